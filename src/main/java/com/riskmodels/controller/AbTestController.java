package com.riskmodels.controller;

import com.riskmodels.dto.AbTestResponse;
import com.riskmodels.dto.CreateAbTestRequest;
import com.riskmodels.dto.OutcomeRequest;
import com.riskmodels.dto.RouteDecision;
import com.riskmodels.service.TrafficRouter;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AbTestController {

    private final TrafficRouter trafficRouter;

    @PostMapping("/ab-tests")
    public ResponseEntity<AbTestResponse> create(@Valid @RequestBody CreateAbTestRequest request) {
        log.info("POST /ab-tests | model={} | strategy={} | variants={}",
                 request.getModelName(), request.getStrategy(), request.getVariants().size());
        return ResponseEntity.status(HttpStatus.CREATED).body(trafficRouter.createTest(request));
    }

    @GetMapping("/ab-tests")
    public ResponseEntity<List<AbTestResponse>> list(@RequestParam(required = false) String modelName) {
        return ResponseEntity.ok(trafficRouter.listTests(modelName));
    }

    @GetMapping("/ab-tests/{testId}")
    public ResponseEntity<AbTestResponse> get(@PathVariable String testId) {
        return ResponseEntity.ok(trafficRouter.getTest(testId));
    }

    @PostMapping("/ab-tests/{testId}/outcomes")
    public ResponseEntity<Void> outcome(@PathVariable String testId, @Valid @RequestBody OutcomeRequest request) {
        trafficRouter.recordOutcome(testId, request.getVersionId(), request.getSuccess(), request.getMetricValue());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/ab-tests/{testId}/winner")
    public ResponseEntity<AbTestResponse> selectWinner(
            @PathVariable String testId, @RequestParam @NotBlank String actor) {
        log.info("POST /ab-tests/{}/winner | actor={}", testId, actor);
        trafficRouter.selectWinner(testId, actor);
        return ResponseEntity.ok(trafficRouter.getTest(testId));
    }

    @GetMapping("/models/{modelName}/ab-test")
    public ResponseEntity<AbTestResponse> active(@PathVariable String modelName) {
        return ResponseEntity.ok(trafficRouter.activeTest(modelName));
    }

    @GetMapping("/models/{modelName}/route")
    public ResponseEntity<RouteDecision> route(@PathVariable String modelName, @RequestParam @NotBlank String key) {
        return ResponseEntity.ok(trafficRouter.routeRequest(modelName, key));
    }
}
