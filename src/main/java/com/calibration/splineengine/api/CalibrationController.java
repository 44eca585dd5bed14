package com.calibration.splineengine.api;

import com.calibration.splineengine.api.dto.ArtifactScoreRequest;
import com.calibration.splineengine.api.dto.ScoredLevel;
import com.calibration.splineengine.api.dto.TwoFactorCalibrationRequest;
import com.calibration.splineengine.api.dto.TwoFactorCalibrationResponse;
import com.calibration.splineengine.domain.exception.CalibrationDataException;
import com.calibration.splineengine.domain.model.CalibrationArtifact;
import com.calibration.splineengine.domain.model.TwoFactorCalibration;
import com.calibration.splineengine.domain.service.calibration.CalibrationArtifactMapper;
import com.calibration.splineengine.domain.service.calibration.LatentScoreModel;
import com.calibration.splineengine.domain.service.calibration.TwoFactorCalibrator;
import com.calibration.splineengine.domain.service.spline.SplineEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/calibration")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class CalibrationController {

    private static final String DEFAULT_DESCRIPTION = "Two-factor monotone spline calibration";

    private final TwoFactorCalibrator calibrator;
    private final CalibrationArtifactMapper artifactMapper;
    private final SplineEvaluator evaluator;

    @PostMapping("/two-factor")
    public ResponseEntity<TwoFactorCalibrationResponse> calibrate(@RequestBody TwoFactorCalibrationRequest request) {
        log.info("[Calibration API] 2요인 보정 요청: cells={}",
                request.getCells() != null ? request.getCells().size() : 0);

        TwoFactorCalibration calibration = calibrator.calibrate(
                request.getCells(), request.getFactorA(), request.getFactorB());

        String description = request.getDescription() != null ? request.getDescription() : DEFAULT_DESCRIPTION;
        CalibrationArtifact artifact = artifactMapper.toArtifact(calibration, description);

        return ResponseEntity.ok(new TwoFactorCalibrationResponse(
                artifact,
                calibration.getCurveAFit(),
                calibration.getCurveBFit(),
                calibration.getSurface()));
    }

    @PostMapping("/score")
    public ResponseEntity<Map<String, Object>> score(@RequestBody ArtifactScoreRequest request) {
        if (request.getPoints() == null) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "message", "points는 필수입니다"));
        }

        LatentScoreModel model = LatentScoreModel.from(request.getArtifact(), evaluator);
        List<ScoredLevel> results = new ArrayList<>(request.getPoints().size());
        for (int i = 0; i < request.getPoints().size(); i++) {
            ArtifactScoreRequest.LevelPair pair = request.getPoints().get(i);
            if (pair == null || pair.levelA() == null || pair.levelB() == null) {
                throw new CalibrationDataException("points[" + i + "]",
                        "points[" + i + "]에 level_a, level_b가 모두 필요합니다");
            }
            double score = model.score(pair.levelA(), pair.levelB());
            double logit = request.getArtifact().getGlobalIntercept() + score;
            results.add(new ScoredLevel(pair.levelA(), pair.levelB(), score, logit,
                    LatentScoreModel.sigmoid(logit)));
        }

        log.info("[Calibration API] 보정 레코드 점수 계산: version={}, points={}",
                request.getArtifact().getVersion(), results.size());
        return ResponseEntity.ok(Map.of(
                "global_intercept", request.getArtifact().getGlobalIntercept(),
                "results", results));
    }
}
