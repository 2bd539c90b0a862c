package com.climateforecast.controller;

import com.climateforecast.config.RequestGuardFilter;
import com.climateforecast.dto.AsyncJobResponse;
import com.climateforecast.dto.ClimatologyRequest;
import com.climateforecast.dto.ClimatologyResponse;
import com.climateforecast.dto.EvaluationRequest;
import com.climateforecast.dto.ForecastBandRequest;
import com.climateforecast.dto.ForecastBandResponse;
import com.climateforecast.dto.ModelInfoResponse;
import com.climateforecast.model.HoldoutReport;
import com.climateforecast.model.RollingOriginReport;
import com.climateforecast.service.AsyncJobService;
import com.climateforecast.service.EvaluationService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class EvaluationController {

    private final EvaluationService evaluationService;
    private final AsyncJobService asyncJobService;

    @PostMapping("/evaluations/holdout")
    public ResponseEntity<HoldoutReport> holdout(
            @Valid @RequestBody EvaluationRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /evaluations/holdout | rows={} | variables={} | models={} | requestId={}",
                 request.getObservations().size(), request.getVariables(), request.getModels(), requestId);
        return ResponseEntity.ok()
            .header(RequestGuardFilter.REQUEST_ID_HEADER, requestId)
            .body(evaluationService.holdout(request));
    }

    @PostMapping("/evaluations/rolling-origin")
    public ResponseEntity<RollingOriginReport> rollingOrigin(
            @Valid @RequestBody EvaluationRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /evaluations/rolling-origin | rows={} | variables={} | models={} | requestId={}",
                 request.getObservations().size(), request.getVariables(), request.getModels(), requestId);
        return ResponseEntity.ok()
            .header(RequestGuardFilter.REQUEST_ID_HEADER, requestId)
            .body(evaluationService.rollingOrigin(request));
    }

    @PostMapping("/evaluations/rolling-origin/async")
    public ResponseEntity<AsyncJobResponse> rollingOriginAsync(
            @Valid @RequestBody EvaluationRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        UUID jobId = asyncJobService.submit(
            "ROLLING_ORIGIN",
            requestId,
            progress -> evaluationService.rollingOrigin(request, progress)
        );
        return ResponseEntity.accepted()
            .header(RequestGuardFilter.REQUEST_ID_HEADER, requestId)
            .header("Location", "/api/v1/jobs/" + jobId)
            .body(asyncJobService.getJob(jobId));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(asyncJobService.getJob(jobId));
    }

    @PostMapping("/evaluations/forecast-band")
    public ResponseEntity<ForecastBandResponse> forecastBand(
            @Valid @RequestBody ForecastBandRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /evaluations/forecast-band | variable={} | model={} | requestId={}",
                 request.getVariable(), request.getModel(), requestId);
        return ResponseEntity.ok()
            .header(RequestGuardFilter.REQUEST_ID_HEADER, requestId)
            .body(evaluationService.forecastBand(request));
    }

    @PostMapping("/climatology")
    public ResponseEntity<ClimatologyResponse> climatology(@Valid @RequestBody ClimatologyRequest request) {
        return ResponseEntity.ok(evaluationService.climatology(request));
    }

    @GetMapping("/models")
    public ResponseEntity<List<ModelInfoResponse>> models() {
        return ResponseEntity.ok(evaluationService.models());
    }

    private String resolveRequestId(HttpServletRequest request) {
        Object assigned = request.getAttribute(RequestGuardFilter.REQUEST_ID_ATTRIBUTE);
        if (assigned instanceof String id) {
            return id;
        }
        String id = request.getHeader(RequestGuardFilter.REQUEST_ID_HEADER);
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
