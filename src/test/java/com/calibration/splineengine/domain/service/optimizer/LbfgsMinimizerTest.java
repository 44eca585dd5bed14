package com.calibration.splineengine.domain.service.optimizer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LbfgsMinimizerTest {

    private final LbfgsMinimizer minimizer = new LbfgsMinimizer();

    private static final DifferentiableObjective ROSENBROCK = (p, g) -> {
        double a = 1.0 - p[0];
        double b = p[1] - p[0] * p[0];
        g[0] = -2.0 * a - 400.0 * p[0] * b;
        g[1] = 200.0 * b;
        return a * a + 100.0 * b * b;
    };

    @Test
    void minimizesSeparableQuadratic() {
        DifferentiableObjective quadratic = (p, g) -> {
            double f = 0.0;
            for (int i = 0; i < p.length; i++) {
                double d = p[i] - i;
                f += (i + 1) * d * d;
                g[i] = 2.0 * (i + 1) * d;
            }
            return f;
        };

        OptimizationResult result = minimizer.minimize(quadratic, new double[5],
                OptimizerSettings.builder().build());

        assertThat(result.isConverged()).isTrue();
        double[] point = result.getPoint();
        for (int i = 0; i < point.length; i++) {
            assertThat(point[i]).isCloseTo(i, within(1e-5));
        }
    }

    @Test
    void minimizesRosenbrockValley() {
        OptimizationResult result = minimizer.minimize(ROSENBROCK, new double[]{-1.2, 1.0},
                OptimizerSettings.builder().build());

        assertThat(result.isConverged()).isTrue();
        assertThat(result.getPoint()[0]).isCloseTo(1.0, within(1e-3));
        assertThat(result.getPoint()[1]).isCloseTo(1.0, within(1e-3));
        assertThat(result.getValue()).isLessThan(1e-6);
    }

    @Test
    void reportsNonConvergenceWithBestPointWhenIterationCapHit() {
        double[] start = {-1.2, 1.0};
        double startValue = ROSENBROCK.evaluate(start, new double[2]);

        OptimizationResult result = minimizer.minimize(ROSENBROCK, start,
                OptimizerSettings.builder().maxIterations(1).build());

        assertThat(result.isConverged()).isFalse();
        assertThat(result.getMessage()).contains("iteration limit");
        assertThat(result.getIterations()).isEqualTo(1);
        assertThat(result.getValue()).isLessThanOrEqualTo(startValue);
    }

    @Test
    void doesNotMutateStartPoint() {
        double[] start = {-1.2, 1.0};

        minimizer.minimize(ROSENBROCK, start, OptimizerSettings.builder().build());

        assertThat(start).containsExactly(-1.2, 1.0);
    }

    @Test
    void nonFiniteStartIsReportedNotThrown() {
        OptimizationResult result = minimizer.minimize((p, g) -> Double.NaN, new double[]{0.0},
                OptimizerSettings.builder().build());

        assertThat(result.isConverged()).isFalse();
        assertThat(result.getIterations()).isZero();
    }

    @Test
    void rejectsEmptyStartPoint() {
        assertThatThrownBy(() -> minimizer.minimize(ROSENBROCK, new double[0],
                OptimizerSettings.builder().build()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
