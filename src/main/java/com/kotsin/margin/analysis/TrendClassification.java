package com.kotsin.margin.analysis;

public enum TrendClassification {
    IMPROVING,
    STABLE,
    DECLINING
}
