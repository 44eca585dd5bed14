package com.calibration.splineengine.domain.service.optimizer;

@FunctionalInterface
public interface DifferentiableObjective {

    /**
     * point 에서 목적함수 값을 반환하고 gradient 배열에 기울기를 채운다.
     */
    double evaluate(double[] point, double[] gradient);
}
