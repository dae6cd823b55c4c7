package com.aerodecode.decoder.api;

public interface ReportScanner<T> {
    String name();

    T scan(String raw);
}
