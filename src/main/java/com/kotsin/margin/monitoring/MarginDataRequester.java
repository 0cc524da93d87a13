package com.kotsin.margin.monitoring;

/**
 * Invoked by a polling timer when an account is due for a fresh margin reading.
 */
@FunctionalInterface
public interface MarginDataRequester {

    void requestMarginData(String accountId, String broker);
}
