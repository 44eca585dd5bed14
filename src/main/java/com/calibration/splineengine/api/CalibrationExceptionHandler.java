package com.calibration.splineengine.api;

import com.calibration.splineengine.domain.exception.CalibrationConfigException;
import com.calibration.splineengine.domain.exception.CalibrationDataException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class CalibrationExceptionHandler {

    @ExceptionHandler(CalibrationDataException.class)
    public ResponseEntity<Map<String, Object>> handleData(CalibrationDataException ex,
                                                          HttpServletRequest request) {
        Map<String, Object> body = body("invalid-data", ex.getMessage(), request);
        body.put("field", ex.getField());
        log.warn("[API] 데이터 검증 실패: path={}, field={}, message={}",
                request.getRequestURI(), ex.getField(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler({CalibrationConfigException.class, IllegalArgumentException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleConfig(Exception ex, HttpServletRequest request) {
        log.warn("[API] 잘못된 요청: path={}, message={}", request.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body("invalid-config", ex.getMessage(), request));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleServerError(Exception ex, HttpServletRequest request) {
        log.error("[API] 처리 실패: path={}", request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("internal-error", ex.getMessage(), request));
    }

    private Map<String, Object> body(String error, String message, HttpServletRequest request) {
        Map<String, Object> body = new HashMap<>();
        body.put("success", false);
        body.put("error", error);
        body.put("message", message != null ? message : "");
        body.put("path", request.getRequestURI());
        return body;
    }
}
