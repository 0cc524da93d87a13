package com.kotsin.margin.model;

public enum TrendDirection {
    IMPROVING,
    DETERIORATING,
    STABLE
}
