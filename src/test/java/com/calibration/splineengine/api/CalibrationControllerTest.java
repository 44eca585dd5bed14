package com.calibration.splineengine.api;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class CalibrationControllerTest {

    @Autowired
    private TestRestTemplate restTemplate;

    private ResponseEntity<JsonNode> post(String path, Object body) {
        return restTemplate.postForEntity(path, body, JsonNode.class);
    }

    private static Map<String, Object> cell(double a, double b, double p) {
        return Map.of("level_a", a, "level_b", b, "probability", p, "weight", 1.0);
    }

    private static Map<String, Object> request(List<Map<String, Object>> cells) {
        return Map.of(
                "cells", cells,
                "factor_a", Map.of("anchor", 1.0, "n_basis", 4),
                "factor_b", Map.of("anchor", 1.0, "n_basis", 4));
    }

    private static List<Map<String, Object>> fourCells() {
        return List.of(cell(1, 1, 0.10), cell(1, 2, 0.20), cell(2, 1, 0.25), cell(2, 2, 0.45));
    }

    @Test
    void calibrationReturnsArtifactWithDiagnostics() {
        ResponseEntity<JsonNode> response = post("/api/calibration/two-factor", request(fourCells()));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        JsonNode artifact = response.getBody().get("artifact");
        for (String field : List.of("version", "calibrated_at", "description",
                "curve_a", "curve_b", "global_intercept", "calibration")) {
            assertThat(artifact.has(field)).as(field).isTrue();
        }
        assertThat(artifact.get("description").asText()).isEqualTo("Two-factor monotone spline calibration");

        JsonNode diagnostics = artifact.get("calibration");
        assertThat(diagnostics.get("curve_a_monotone").asBoolean()).isTrue();
        assertThat(diagnostics.get("curve_b_monotone").asBoolean()).isTrue();
        for (String field : List.of("rmse", "r2", "converged", "n_iterations", "anchor_a", "anchor_b")) {
            assertThat(diagnostics.has(field)).as(field).isTrue();
        }
        assertThat(response.getBody().get("surface").size()).isEqualTo(4);
        assertThat(response.getBody().has("curve_a_fit")).isTrue();
        assertThat(response.getBody().has("curve_b_fit")).isTrue();
    }

    @Test
    void returnedArtifactScoresAnchorAtGlobalIntercept() {
        JsonNode artifact = post("/api/calibration/two-factor", request(fourCells())).getBody().get("artifact");

        ResponseEntity<JsonNode> response = post("/api/calibration/score", Map.of(
                "artifact", artifact,
                "points", List.of(Map.of("level_a", 1.0, "level_b", 1.0), Map.of("level_a", 2.0, "level_b", 2.0))));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        double intercept = artifact.get("global_intercept").asDouble();
        JsonNode results = response.getBody().get("results");
        assertThat(results.size()).isEqualTo(2);
        assertThat(results.get(0).get("score").asDouble()).isCloseTo(0.0, within(1e-9));
        assertThat(results.get(0).get("probability").asDouble())
                .isCloseTo(1.0 / (1.0 + Math.exp(-intercept)), within(1e-9));
        assertThat(results.get(1).get("probability").asDouble())
                .isGreaterThan(results.get(0).get("probability").asDouble());
    }

    @Test
    void scoringWithoutCurvesReportsField() {
        ResponseEntity<JsonNode> response = post("/api/calibration/score", Map.of(
                "artifact", Map.of("version", "1.0.0", "global_intercept", -1.2),
                "points", List.of(Map.of("level_a", 1.0, "level_b", 1.0))));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().get("field").asText()).isEqualTo("artifact.curve_a/curve_b");
    }

    @Test
    void missingProbabilityIsReportedWithField() {
        Map<String, Object> broken = new HashMap<>();
        broken.put("level_a", 1.0);
        broken.put("level_b", 2.0);
        broken.put("weight", 1.0);

        ResponseEntity<JsonNode> response = post("/api/calibration/two-factor",
                request(List.of(cell(1, 1, 0.1), broken)));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        JsonNode body = response.getBody();
        assertThat(body.get("success").asBoolean()).isFalse();
        assertThat(body.get("error").asText()).isEqualTo("invalid-data");
        assertThat(body.get("field").asText()).isEqualTo("cells[1].probability");
        assertThat(body.get("path").asText()).isEqualTo("/api/calibration/two-factor");
    }

    @Test
    void missingFactorSettingsIsConfigError() {
        ResponseEntity<JsonNode> response = post("/api/calibration/two-factor",
                Map.of("cells", List.of(cell(1, 1, 0.1))));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().get("error").asText()).isEqualTo("invalid-config");
    }

    @Test
    void malformedBodyIsBadRequest() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<JsonNode> response = post("/api/calibration/two-factor",
                new HttpEntity<>("{\"cells\": [ {\"level_a\": ", headers));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }
}
