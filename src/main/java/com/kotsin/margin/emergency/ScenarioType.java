package com.kotsin.margin.emergency;

import java.util.Locale;

public enum ScenarioType {
    SINGLE_ACCOUNT,
    MULTI_ACCOUNT,
    CORRELATED_POSITIONS;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
