package com.calibration.splineengine.domain.service.calibration;

import com.calibration.splineengine.domain.service.optimizer.OptimizerSettings;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "calibration.two-factor")
public class TwoFactorProperties {

    private double probabilityFloor = 0.01;
    private double probabilityCeiling = 0.99;
    private double monotonicityPenalty = 100.0;
    private double smoothnessPenalty = 0.01;
    private int maxIterations = 2000;
    private double functionTolerance = 1e-12;
    private double gradientTolerance = 1e-8;
    private double initialEffectSpan = 2.0;

    public OptimizerSettings optimizerSettings() {
        return OptimizerSettings.builder()
                .maxIterations(maxIterations)
                .functionTolerance(functionTolerance)
                .gradientTolerance(gradientTolerance)
                .build();
    }
}
