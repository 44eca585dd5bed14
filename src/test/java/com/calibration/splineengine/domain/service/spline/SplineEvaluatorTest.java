package com.calibration.splineengine.domain.service.spline;

import com.calibration.splineengine.domain.model.SplineParameters;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SplineEvaluatorTest {

    private final SplineEvaluator evaluator = new SplineEvaluator(new ISplineBasis(), new SplineFitProperties());

    private static SplineParameters params(List<Double> coefficients, int numBasis) {
        return SplineParameters.builder()
                .coefficients(coefficients)
                .intercept(0.5)
                .numBasis(numBasis)
                .degree(2)
                .domainMin(0.0)
                .domainMax(1.0)
                .build();
    }

    @Test
    void reproducesBoundaryValuesOfHandBuiltCurve() {
        SplineParameters params = params(List.of(1.0, 1.0, 1.0), 3);

        assertThat(evaluator.evaluate(0.0, params)).isCloseTo(0.5, within(1e-12));
        assertThat(evaluator.evaluate(1.0, params)).isCloseTo(3.5, within(1e-12));
        assertThat(evaluator.evaluate(0.5, params)).isBetween(0.5, 3.5);
        assertThat(evaluator.isMonotone(params)).isTrue();
    }

    @Test
    void repeatedEvaluationIsIdenticalAndLeavesInputUntouched() {
        SplineParameters params = params(List.of(0.2, 1.5, 0.7), 3);
        double[] points = {0.9, 0.1, 0.5, 1.2, -0.1};
        double[] copy = points.clone();

        double[] first = evaluator.evaluate(points, params);
        double[] second = evaluator.evaluate(points, params);

        assertThat(second).containsExactly(first);
        assertThat(points).containsExactly(copy);
        assertThat(first).hasSize(points.length);
    }

    @Test
    void negativeCoefficientIsDetectedAsNonMonotone() {
        SplineParameters params = params(List.of(1.0, -2.0, 1.0), 3);

        assertThat(evaluator.isMonotone(params)).isFalse();
    }

    @Test
    void coefficientCountMustMatchBasisSize() {
        SplineParameters params = params(List.of(1.0, 1.0), 3);

        assertThatThrownBy(() -> evaluator.evaluate(0.5, params))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("n_basis");
    }

    @Test
    void missingCoefficientsAreRejected() {
        SplineParameters params = params(null, 3);

        assertThatThrownBy(() -> evaluator.evaluate(0.5, params))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
