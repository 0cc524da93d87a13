package com.kotsin.margin.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The one channel every engine event goes through.
 * Listeners run synchronously in registration order; one failing listener does not stop the rest.
 */
@Component
@Slf4j
public class RiskEventDispatcher {

    private final List<RiskEventListener> listeners = new CopyOnWriteArrayList<>();

    public void register(RiskEventListener listener) {
        listeners.add(listener);
    }

    public void unregister(RiskEventListener listener) {
        listeners.remove(listener);
    }

    public void dispatch(RiskEngineEvent event) {
        for (RiskEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.error("[EVENTS] Listener failed for type={} account={}: {}",
                        event.getType(), event.getAccountId(), e.getMessage(), e);
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }
}
