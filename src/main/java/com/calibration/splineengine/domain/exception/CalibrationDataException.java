package com.calibration.splineengine.domain.exception;

import lombok.Getter;

/**
 * 관측 데이터 검증 실패. 누락되었거나 잘못된 필드를 식별한다.
 */
@Getter
public class CalibrationDataException extends RuntimeException {

    private final String field;

    public CalibrationDataException(String field, String message) {
        super(message);
        this.field = field;
    }
}
