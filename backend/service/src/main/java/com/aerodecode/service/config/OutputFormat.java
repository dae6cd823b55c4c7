package com.aerodecode.service.config;

public enum OutputFormat {
    TEXT,
    JSON
}
