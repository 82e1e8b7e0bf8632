package com.ewas.alerting.detector;

import com.ewas.alerting.detector.schema.ConfigurationSchema;

/**
 * Registry entry: stable key, published schema, typed settings class and factory.
 */
public record DetectorDefinition<C>(String key,
                                    String displayName,
                                    ConfigurationSchema schema,
                                    Class<C> settingsType,
                                    DetectorFactory<C> factory) {
}
