package com.climateforecast.service;

import com.climateforecast.exception.FitFailureException;
import com.climateforecast.forecasting.FittedModel;
import com.climateforecast.forecasting.ForecastModel;
import com.climateforecast.model.ForecastResult;
import com.climateforecast.model.PredictionInterval;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one fit followed by one forecast, optionally under a wall-clock budget, and rejects
 * degenerate forecasts. Every failure on this path surfaces as {@link FitFailureException}.
 * <p>
 * Timed fits run on daemon threads of an unbounded pool and the budget starts when the fit
 * starts. The fitting libraries ignore interruption, so a fit past its budget keeps its own
 * thread until it returns and never holds up another fold.
 */
@Slf4j
@Component
public class ModelFitExecutor {

    private final AtomicInteger threadCounter = new AtomicInteger();

    private ExecutorService executor;

    @PostConstruct
    void init() {
        executor = Executors.newCachedThreadPool(task -> {
            Thread thread = new Thread(task, "model-fit-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public Outcome fitAndForecast(ForecastModel model, double[] train, int frequency, int horizon,
                                  List<Integer> confidenceLevels, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return run(model, train, frequency, horizon, confidenceLevels);
        }
        if (executor == null) {
            throw new IllegalStateException("ModelFitExecutor has not been initialised");
        }
        CountDownLatch started = new CountDownLatch(1);
        Future<Outcome> future = executor.submit(() -> {
            started.countDown();
            return run(model, train, frequency, horizon, confidenceLevels);
        });
        try {
            started.await();
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Fit abandoned after time budget | model={} | trainSize={} | budgetMs={}",
                model.id(), train.length, timeout.toMillis());
            throw new FitFailureException(model.id() + ": fit exceeded time budget of " + timeout.toMillis()
                + " ms on " + train.length + " points");
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new FitFailureException(model.id() + ": interrupted while fitting", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof FitFailureException failure) {
                throw failure;
            }
            throw new FitFailureException(model.id() + ": fitting raised " + cause, cause);
        }
    }

    private Outcome run(ForecastModel model, double[] train, int frequency, int horizon,
                        List<Integer> confidenceLevels) {
        FittedModel fitted;
        ForecastResult forecast;
        try {
            fitted = model.fit(train, frequency);
            forecast = model.forecast(fitted, horizon, confidenceLevels);
        } catch (FitFailureException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new FitFailureException(model.id() + ": fitting raised " + ex, ex);
        }
        requireUsable(model, fitted, forecast, horizon);
        return new Outcome(fitted, forecast);
    }

    static void requireUsable(ForecastModel model, FittedModel fitted, ForecastResult forecast, int horizon) {
        if (forecast.horizon() != horizon) {
            throw new FitFailureException(model.id() + ": " + fitted.spec() + " returned " + forecast.horizon()
                + " forecast points, expected " + horizon);
        }
        for (Double point : forecast.getMean()) {
            if (point == null || !Double.isFinite(point)) {
                throw new FitFailureException(model.id() + ": " + fitted.spec() + " produced a non-finite forecast");
            }
        }
        for (PredictionInterval interval : forecast.getIntervals()) {
            if (interval.isCollapsed()) {
                throw new FitFailureException(model.id() + ": " + fitted.spec() + " produced a collapsed "
                    + interval.level() + "% prediction interval");
            }
        }
    }

    public record Outcome(FittedModel fitted, ForecastResult forecast) {}
}
