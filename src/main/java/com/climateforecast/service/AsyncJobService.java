package com.climateforecast.service;

import com.climateforecast.dto.AsyncJobResponse;
import com.climateforecast.dto.AsyncJobStatus;
import com.climateforecast.exception.ClimateForecastException;
import com.climateforecast.exception.JobNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Background runner for long evaluation sweeps. Jobs report a completion percentage while they run;
 * finished jobs beyond {@code jobs.max-retained} are evicted oldest first.
 */
@Slf4j
@Service
public class AsyncJobService {

    @Value("${jobs.pool-size:2}")
    private int poolSize = 2;

    @Value("${jobs.max-retained:200}")
    private int maxRetained = 200;

    private ExecutorService executor;
    private final ConcurrentHashMap<UUID, JobState> jobs = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(1, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public UUID submit(String jobType, String requestId, Function<IntConsumer, Object> task) {
        UUID jobId = UUID.randomUUID();
        JobState state = new JobState(jobId, jobType, requestId, Instant.now());
        jobs.put(jobId, state);
        evictFinished();

        CompletableFuture.runAsync(() -> execute(state, task), executor);
        log.info("Job queued | jobId={} | type={} | requestId={}", jobId, jobType, requestId);
        return jobId;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        JobState state = jobs.get(jobId);
        if (state == null) {
            throw new JobNotFoundException(jobId);
        }
        return state.toResponse();
    }

    private void execute(JobState state, Function<IntConsumer, Object> task) {
        state.markRunning();
        try {
            Object result = task.apply(state::reportProgress);
            state.markCompleted(result);
            log.info("Job completed | jobId={} | type={}", state.jobId, state.jobType);
        } catch (ClimateForecastException ex) {
            state.markFailed(ex.getErrorCode(), ex.getMessage());
            log.warn("Job failed | jobId={} | code={} | reason={}", state.jobId, ex.getErrorCode(), ex.getMessage());
        } catch (RuntimeException ex) {
            String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            state.markFailed("INTERNAL_ERROR", message);
            log.error("Job crashed | jobId={} | type={}", state.jobId, state.jobType, ex);
        }
    }

    private void evictFinished() {
        if (jobs.size() <= maxRetained) {
            return;
        }
        jobs.entrySet().stream()
            .filter(e -> e.getValue().isFinished())
            .sorted(Comparator.comparing(e -> e.getValue().submittedAt))
            .limit(Math.max(1, jobs.size() - maxRetained))
            .map(Map.Entry::getKey)
            .toList()
            .forEach(jobs::remove);
    }

    private static final class JobState {
        private final UUID jobId;
        private final String jobType;
        private final String requestId;
        private final Instant submittedAt;
        private volatile Instant startedAt;
        private volatile Instant finishedAt;
        private volatile AsyncJobStatus status = AsyncJobStatus.QUEUED;
        private volatile int progressPercent;
        private volatile String message = "Queued";
        private volatile String errorCode;
        private volatile Object result;

        private JobState(UUID jobId, String jobType, String requestId, Instant submittedAt) {
            this.jobId = jobId;
            this.jobType = jobType;
            this.requestId = requestId;
            this.submittedAt = submittedAt;
        }

        private boolean isFinished() {
            return status == AsyncJobStatus.COMPLETED || status == AsyncJobStatus.FAILED;
        }

        private synchronized void markRunning() {
            startedAt = Instant.now();
            status = AsyncJobStatus.RUNNING;
            message = "Running";
        }

        // progress never goes backwards and stays below 100 until the result is stored
        private synchronized void reportProgress(int percent) {
            if (status == AsyncJobStatus.RUNNING) {
                progressPercent = Math.max(progressPercent, Math.min(99, percent));
            }
        }

        private synchronized void markCompleted(Object value) {
            finishedAt = Instant.now();
            status = AsyncJobStatus.COMPLETED;
            result = value;
            message = "Completed";
            progressPercent = 100;
        }

        private synchronized void markFailed(String code, String reason) {
            finishedAt = Instant.now();
            status = AsyncJobStatus.FAILED;
            errorCode = code;
            message = reason;
            progressPercent = 100;
        }

        private synchronized AsyncJobResponse toResponse() {
            return AsyncJobResponse.builder()
                .jobId(jobId)
                .jobType(jobType)
                .status(status)
                .submittedAt(submittedAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .progressPercent(progressPercent)
                .message(message)
                .errorCode(errorCode)
                .result(result)
                .requestId(requestId)
                .build();
        }
    }
}
