package com.kotsin.margin.optimizer;

public enum MinimizationPolicy {
    /** Required reduction above 30% of used margin: close the worst losers outright. */
    CLOSE_WORST,
    /** Shrink margin-inefficient positions, optionally hedge net exposure. */
    PARTIAL_REDUCTION,
    /** Bank the best winners and drop the heaviest losers. */
    PROFIT_AND_LOSS_CLEANUP
}
