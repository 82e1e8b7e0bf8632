package com.ewas.alerting.trigger;

/**
 * Published by ingestion once every variable of a source has been processed.
 */
public record SourceProcessedEvent(String sourceName, int variablesProcessed) {
}
