package com.aerodecode.core.model;

public record TrendGroup(String marker) {
}
