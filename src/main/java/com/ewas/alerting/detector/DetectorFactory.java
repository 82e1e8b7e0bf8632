package com.ewas.alerting.detector;

import com.ewas.alerting.model.DetectorConfig;

@FunctionalInterface
public interface DetectorFactory<C> {

    Detector create(DetectorConfig config, C settings, DetectorContext context);
}
