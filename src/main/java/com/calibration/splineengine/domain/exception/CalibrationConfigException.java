package com.calibration.splineengine.domain.exception;

public class CalibrationConfigException extends RuntimeException {

    public CalibrationConfigException(String message) {
        super(message);
    }
}
