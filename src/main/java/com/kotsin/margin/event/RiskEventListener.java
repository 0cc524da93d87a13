package com.kotsin.margin.event;

@FunctionalInterface
public interface RiskEventListener {

    void onEvent(RiskEngineEvent event);
}
