package com.kotsin.margin.monitoring;

import com.kotsin.margin.model.AccountMarginInfo;

import java.util.Optional;

/**
 * Where the polling monitor pulls margin data from.
 */
public interface MarginTelemetrySource {

    Optional<AccountMarginInfo> latest(String accountId);
}
