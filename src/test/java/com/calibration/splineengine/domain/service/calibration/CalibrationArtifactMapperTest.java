package com.calibration.splineengine.domain.service.calibration;

import com.calibration.splineengine.domain.exception.CalibrationDataException;
import com.calibration.splineengine.domain.model.CalibrationArtifact;
import com.calibration.splineengine.domain.model.ObservationCell;
import com.calibration.splineengine.domain.model.TwoFactorCalibration;
import com.calibration.splineengine.domain.service.optimizer.LbfgsMinimizer;
import com.calibration.splineengine.domain.service.spline.ISplineBasis;
import com.calibration.splineengine.domain.service.spline.MonotoneSplineFitter;
import com.calibration.splineengine.domain.service.spline.SplineEvaluator;
import com.calibration.splineengine.domain.service.spline.SplineFitProperties;
import com.calibration.splineengine.infra.monitor.FitMetricsRecorder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class CalibrationArtifactMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SplineEvaluator evaluator;
    private CalibrationArtifactMapper mapper;
    private TwoFactorCalibration calibration;

    @BeforeEach
    void setUp() {
        SplineFitProperties splineProperties = new SplineFitProperties();
        ISplineBasis basis = new ISplineBasis();
        LbfgsMinimizer minimizer = new LbfgsMinimizer();
        FitMetricsRecorder metrics = new FitMetricsRecorder(new SimpleMeterRegistry());
        evaluator = new SplineEvaluator(basis, splineProperties);
        TwoFactorCalibrator calibrator = new TwoFactorCalibrator(
                new MonotoneSplineFitter(basis, evaluator, minimizer, splineProperties, metrics),
                evaluator, minimizer, new TwoFactorProperties(), metrics);

        calibration = calibrator.calibrate(List.of(
                ObservationCell.of(3.5, 508, 0.20, 2),
                ObservationCell.of(3.5, 516, 0.35, 1),
                ObservationCell.of(3.9, 508, 0.30, 1),
                ObservationCell.of(3.9, 516, 0.55, 3)), 3.75, 512, 4, 0.001);

        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);
        mapper = new CalibrationArtifactMapper(clock);
    }

    @Test
    void writesFieldNamesConsumersBindTo() throws Exception {
        String json = objectMapper.writeValueAsString(mapper.toArtifact(calibration, "test run"));
        JsonNode root = objectMapper.readTree(json);

        assertThat(root.get("version").asText()).isEqualTo("1.0.0");
        assertThat(root.get("calibrated_at").asText()).isEqualTo("2026-03-01");
        assertThat(root.get("description").asText()).isEqualTo("test run");
        assertThat(root.get("global_intercept").asDouble()).isEqualTo(calibration.getGlobalIntercept());

        JsonNode curveA = root.get("curve_a");
        assertThat(curveA.get("coefficients").size()).isEqualTo(4);
        assertThat(curveA.has("intercept")).isTrue();
        assertThat(curveA.get("n_basis").asInt()).isEqualTo(4);
        assertThat(curveA.get("degree").asInt()).isEqualTo(3);
        assertThat(curveA.get("x_min").asDouble()).isEqualTo(3.5);
        assertThat(curveA.get("x_max").asDouble()).isEqualTo(3.9);
        assertThat(curveA.has("knots")).isTrue();
        assertThat(curveA.has("numBasis")).isFalse();
        assertThat(curveA.has("domainMin")).isFalse();

        JsonNode diagnostics = root.get("calibration");
        assertThat(diagnostics.get("anchor_a").asDouble()).isEqualTo(3.75);
        assertThat(diagnostics.get("anchor_b").asDouble()).isEqualTo(512.0);
        assertThat(diagnostics.get("curve_a_monotone").asBoolean()).isTrue();
        assertThat(diagnostics.get("curve_b_monotone").asBoolean()).isTrue();
        assertThat(diagnostics.has("n_iterations")).isTrue();
        assertThat(diagnostics.has("curveAMonotone")).isFalse();
    }

    @Test
    void restoredRecordEvaluatesIdentically() throws Exception {
        CalibrationArtifact written = mapper.toArtifact(calibration, null);

        CalibrationArtifact restored = objectMapper.readValue(
                objectMapper.writeValueAsString(written), CalibrationArtifact.class);

        assertThat(restored.getGlobalIntercept()).isEqualTo(written.getGlobalIntercept());
        for (double a : new double[]{3.3, 3.5, 3.75, 3.9, 4.0}) {
            assertThat(evaluator.evaluate(a, restored.getCurveA()))
                    .isEqualTo(evaluator.evaluate(a, written.getCurveA()));
        }
        assertThat(restored.getCalibration().isCurveBMonotone())
                .isEqualTo(written.getCalibration().isCurveBMonotone());
    }

    @Test
    void restoredModelYieldsInterceptProbabilityAtAnchor() throws Exception {
        CalibrationArtifact restored = objectMapper.readValue(
                objectMapper.writeValueAsString(mapper.toArtifact(calibration, "x")), CalibrationArtifact.class);

        LatentScoreModel model = LatentScoreModel.from(restored, evaluator);

        assertThat(model.score(3.75, 512)).isCloseTo(0.0, within(1e-9));
        assertThat(model.probability(3.75, 512))
                .isCloseTo(LatentScoreModel.sigmoid(restored.getGlobalIntercept()), within(1e-9));
        assertThat(model.probability(3.9, 516)).isGreaterThan(model.probability(3.5, 508));
    }

    @Test
    void recordWithoutCurvesCannotBeScored() throws Exception {
        CalibrationArtifact partial = objectMapper.readValue(
                "{\"version\": \"1.0.0\", \"global_intercept\": -1.2}", CalibrationArtifact.class);

        assertThatThrownBy(() -> LatentScoreModel.from(partial, evaluator))
                .isInstanceOf(CalibrationDataException.class)
                .extracting("field").isEqualTo("artifact.curve_a/curve_b");
    }
}
