package com.calibration.splineengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SplineEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SplineEngineApplication.class, args);
    }
}
