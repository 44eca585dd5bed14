package com.calibration.splineengine.api;

import com.calibration.splineengine.api.dto.SplineEvaluateRequest;
import com.calibration.splineengine.api.dto.SplineFitRequest;
import com.calibration.splineengine.domain.model.MonotoneFit;
import com.calibration.splineengine.domain.service.spline.MonotoneSplineFitter;
import com.calibration.splineengine.domain.service.spline.SplineEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/splines")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class SplineController {

    private final MonotoneSplineFitter fitter;
    private final SplineEvaluator evaluator;

    @PostMapping("/fit")
    public ResponseEntity<MonotoneFit> fit(@RequestBody SplineFitRequest request) {
        log.info("[Spline API] 피팅 요청: samples={}, nBasis={}, anchored={}",
                request.getX() != null ? request.getX().length : 0,
                request.getNumBasis(), request.getAnchor() != null);
        return ResponseEntity.ok(fitter.fit(request.toFitRequest()));
    }

    @PostMapping("/evaluate")
    public ResponseEntity<Map<String, Object>> evaluate(@RequestBody SplineEvaluateRequest request) {
        if (request.getParameters() == null) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "message", "params는 필수입니다"));
        }
        if (request.getPoints() == null) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "message", "points는 필수입니다"));
        }

        double[] values = evaluator.evaluate(request.getPoints(), request.getParameters());
        return ResponseEntity.ok(Map.of(
                "points", request.getPoints(),
                "values", values));
    }
}
