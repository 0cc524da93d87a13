package com.kotsin.margin.emergency;

import lombok.Value;

@Value
public class StrategyTemplate {
    String id;
    String description;
    EmergencyStrategy strategy;
}
