package com.aerodecode.decoder.api;

public interface ReportPrinter<T> {
    String print(T report);
}
