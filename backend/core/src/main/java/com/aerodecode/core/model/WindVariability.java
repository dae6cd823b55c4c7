package com.aerodecode.core.model;

public record WindVariability(int from, int to) {
}
