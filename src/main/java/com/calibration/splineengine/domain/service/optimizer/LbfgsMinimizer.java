package com.calibration.splineengine.domain.service.optimizer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Limited-memory BFGS. 탐색 방향은 two-loop recursion, 스텝은 Armijo backtracking 으로 정한다.
 * 수렴 실패는 예외가 아니라 결과의 converged=false 로 전달된다.
 */
@Slf4j
@Component
public class LbfgsMinimizer {

    static final double ARMIJO_C1 = 1e-4;
    static final double CURVATURE_EPS = 1e-12;

    public OptimizationResult minimize(DifferentiableObjective objective, double[] start,
                                       OptimizerSettings settings) {
        if (start.length == 0) {
            throw new IllegalArgumentException("start point must not be empty");
        }

        int n = start.length;
        double[] x = start.clone();
        double[] g = new double[n];
        double fx = objective.evaluate(x, g);
        int evaluations = 1;

        if (!Double.isFinite(fx)) {
            return new OptimizationResult(x, fx, 0, evaluations, false,
                    "objective not finite at start point");
        }

        Deque<double[]> sHistory = new ArrayDeque<>();
        Deque<double[]> yHistory = new ArrayDeque<>();
        Deque<Double> rhoHistory = new ArrayDeque<>();

        double[] xNew = new double[n];
        double[] gNew = new double[n];

        for (int iter = 0; iter < settings.getMaxIterations(); iter++) {
            if (maxAbs(g) <= settings.getGradientTolerance()) {
                return new OptimizationResult(x, fx, iter, evaluations, true,
                        "projected gradient below tolerance");
            }

            double[] direction = searchDirection(g, sHistory, yHistory, rhoHistory);
            double slope = dot(g, direction);
            if (!(slope < 0)) {
                sHistory.clear();
                yHistory.clear();
                rhoHistory.clear();
                for (int i = 0; i < n; i++) direction[i] = -g[i];
                slope = -dot(g, g);
            }

            double step = sHistory.isEmpty() ? Math.min(1.0, 1.0 / Math.sqrt(dot(g, g))) : 1.0;
            double fNew = Double.NaN;
            boolean accepted = false;

            for (int ls = 0; ls < settings.getMaxLineSearchSteps(); ls++) {
                for (int i = 0; i < n; i++) xNew[i] = x[i] + step * direction[i];
                fNew = objective.evaluate(xNew, gNew);
                evaluations++;
                if (Double.isFinite(fNew) && fNew <= fx + ARMIJO_C1 * step * slope) {
                    accepted = true;
                    break;
                }
                step *= 0.5;
            }

            if (!accepted) {
                log.debug("[LBFGS] line search 실패: iter={}, f={}", iter, fx);
                return new OptimizationResult(x, fx, iter, evaluations, false,
                        "line search failed to decrease objective");
            }

            double[] s = new double[n];
            double[] y = new double[n];
            for (int i = 0; i < n; i++) {
                s[i] = xNew[i] - x[i];
                y[i] = gNew[i] - g[i];
            }
            double sy = dot(s, y);
            if (sy > CURVATURE_EPS) {
                if (sHistory.size() == settings.getHistorySize()) {
                    sHistory.removeFirst();
                    yHistory.removeFirst();
                    rhoHistory.removeFirst();
                }
                sHistory.addLast(s);
                yHistory.addLast(y);
                rhoHistory.addLast(1.0 / sy);
            }

            double reduction = (fx - fNew) / Math.max(Math.max(Math.abs(fx), Math.abs(fNew)), 1.0);

            System.arraycopy(xNew, 0, x, 0, n);
            System.arraycopy(gNew, 0, g, 0, n);
            fx = fNew;

            if (reduction <= settings.getFunctionTolerance()) {
                return new OptimizationResult(x, fx, iter + 1, evaluations, true,
                        "relative reduction of objective below tolerance");
            }
        }

        return new OptimizationResult(x, fx, settings.getMaxIterations(), evaluations, false,
                "iteration limit reached");
    }

    private double[] searchDirection(double[] g, Deque<double[]> sHistory,
                                     Deque<double[]> yHistory, Deque<Double> rhoHistory) {
        int m = sHistory.size();
        double[] q = g.clone();
        double[] alpha = new double[m];

        Iterator<double[]> sIt = sHistory.descendingIterator();
        Iterator<double[]> yIt = yHistory.descendingIterator();
        Iterator<Double> rIt = rhoHistory.descendingIterator();
        for (int k = m - 1; k >= 0; k--) {
            double[] s = sIt.next();
            double[] y = yIt.next();
            double rho = rIt.next();
            alpha[k] = rho * dot(s, q);
            axpy(-alpha[k], y, q);
        }

        if (m > 0) {
            double[] sLast = sHistory.peekLast();
            double[] yLast = yHistory.peekLast();
            double gamma = dot(sLast, yLast) / dot(yLast, yLast);
            for (int i = 0; i < q.length; i++) q[i] *= gamma;
        }

        sIt = sHistory.iterator();
        yIt = yHistory.iterator();
        rIt = rhoHistory.iterator();
        for (int k = 0; k < m; k++) {
            double[] s = sIt.next();
            double[] y = yIt.next();
            double rho = rIt.next();
            double beta = rho * dot(y, q);
            axpy(alpha[k] - beta, s, q);
        }

        for (int i = 0; i < q.length; i++) q[i] = -q[i];
        return q;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) sum += a[i] * b[i];
        return sum;
    }

    private static void axpy(double a, double[] x, double[] y) {
        for (int i = 0; i < y.length; i++) y[i] += a * x[i];
    }

    private static double maxAbs(double[] v) {
        double max = 0.0;
        for (double d : v) max = Math.max(max, Math.abs(d));
        return max;
    }
}
