package com.kotsin.margin.emergency.mode;

import java.util.Optional;

/**
 * One verification step behind a {@link RecoveryActionType}. A thrown exception counts as a failed check.
 */
public interface RecoveryCheck {

    RecoveryActionType type();

    /**
     * @return empty when the check passes, otherwise the reason it failed
     */
    Optional<String> verify(EmergencyModeState state) throws Exception;
}
