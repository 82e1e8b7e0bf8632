package com.ewas.alerting.trigger;

public record VariableDataUpdatedEvent(String variableCode, String sourceName) {
}
