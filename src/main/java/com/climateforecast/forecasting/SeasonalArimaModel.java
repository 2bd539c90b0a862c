package com.climateforecast.forecasting;

import com.climateforecast.exception.FitFailureException;
import com.climateforecast.model.ForecastResult;
import com.climateforecast.model.PredictionInterval;
import com.github.signaflo.timeseries.TimePeriod;
import com.github.signaflo.timeseries.TimeSeries;
import com.github.signaflo.timeseries.TimeUnit;
import com.github.signaflo.timeseries.forecast.Forecast;
import com.github.signaflo.timeseries.model.arima.Arima;
import com.github.signaflo.timeseries.model.arima.ArimaOrder;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Automatic (seasonal) ARIMA. Differencing orders are chosen by the smallest standard deviation
 * of the differenced series; AR/MA orders by the lowest AIC among the candidates the search budget allows.
 */
@Slf4j
@Order(1)
@Component
public class SeasonalArimaModel implements ForecastModel {

    public static final String ID = "sarima";

    private static final int MIN_TRAIN = 4;
    private static final int MIN_DIFFERENCED = 4;

    @Value("${arima.max-p:2}")
    private int maxP = 2;

    @Value("${arima.max-q:2}")
    private int maxQ = 2;

    @Value("${arima.max-d:1}")
    private int maxD = 1;

    @Value("${arima.max-seasonal-p:1}")
    private int maxSeasonalP = 1;

    @Value("${arima.max-seasonal-q:1}")
    private int maxSeasonalQ = 1;

    @Value("${arima.max-candidates:64}")
    private int maxCandidates = 64;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String displayName() {
        return "(S)ARIMA";
    }

    @Override
    public FittedModel fit(double[] train, int frequency) {
        TrainingSegments.requireFittable(train, ID, MIN_TRAIN);
        boolean seasonal = frequency > 1 && train.length >= 2 * frequency;

        int[] differencing = selectDifferencing(train, frequency, seasonal);
        int d = differencing[0];
        int seasonalD = differencing[1];

        TimeSeries observations = TimeSeries.from(TimePeriod.oneMonth(), train);
        TimePeriod seasonalCycle = new TimePeriod(TimeUnit.MONTH, frequency);

        Arima best = null;
        CandidateOrder bestOrder = null;
        double bestAic = Double.POSITIVE_INFINITY;
        int attempted = 0;
        for (int[] pq : candidateOrders(seasonal)) {
            if (attempted >= maxCandidates) {
                break;
            }
            attempted++;
            CandidateOrder order = seasonal
                ? new CandidateOrder(pq[0], d, pq[1], pq[2], seasonalD, pq[3])
                : new CandidateOrder(pq[0], d, pq[1], 0, 0, 0);
            try {
                Arima candidate = seasonal
                    ? Arima.model(observations, order.toArimaOrder(), seasonalCycle)
                    : Arima.model(observations, order.toArimaOrder());
                double aic = candidate.aic();
                if (Double.isFinite(aic) && aic < bestAic) {
                    best = candidate;
                    bestOrder = order;
                    bestAic = aic;
                }
            } catch (RuntimeException ex) {
                log.debug("ARIMA candidate rejected | order={} | reason={}", order, ex.getMessage());
            }
        }

        if (best == null) {
            throw new FitFailureException(ID + ": none of " + attempted + " ARIMA candidates converged (d="
                + d + ", D=" + seasonalD + ", n=" + train.length + ")");
        }
        String spec = bestOrder.describe(seasonal, frequency);
        log.debug("ARIMA selected | spec={} | aic={} | candidates={}", spec, bestAic, attempted);
        return new ArimaFit(best, spec, bestAic, train.length);
    }

    int[] selectDifferencing(double[] train, int frequency, boolean seasonal) {
        int bestD = 0;
        int bestSeasonalD = 0;
        double bestSd = Double.POSITIVE_INFINITY;
        int seasonalLimit = seasonal ? 1 : 0;
        for (int seasonalD = 0; seasonalD <= seasonalLimit; seasonalD++) {
            for (int d = 0; d <= maxD; d++) {
                double[] diffed = train;
                for (int i = 0; i < seasonalD; i++) {
                    diffed = TrainingSegments.difference(diffed, frequency);
                }
                for (int i = 0; i < d; i++) {
                    diffed = TrainingSegments.difference(diffed, 1);
                }
                if (diffed.length < MIN_DIFFERENCED) {
                    continue;
                }
                double sd = new StandardDeviation().evaluate(diffed);
                // strict comparison keeps the lower order on ties
                if (sd < bestSd) {
                    bestSd = sd;
                    bestD = d;
                    bestSeasonalD = seasonalD;
                }
            }
        }
        return new int[] {bestD, bestSeasonalD};
    }

    /** {p, q, P, Q} tuples, simplest first so the candidate budget drops the most complex ones. */
    List<int[]> candidateOrders(boolean seasonal) {
        List<int[]> orders = new ArrayList<>();
        int sp = seasonal ? maxSeasonalP : 0;
        int sq = seasonal ? maxSeasonalQ : 0;
        for (int p = 0; p <= maxP; p++) {
            for (int q = 0; q <= maxQ; q++) {
                for (int bigP = 0; bigP <= sp; bigP++) {
                    for (int bigQ = 0; bigQ <= sq; bigQ++) {
                        orders.add(new int[] {p, q, bigP, bigQ});
                    }
                }
            }
        }
        orders.sort(Comparator.comparingInt(o -> o[0] + o[1] + o[2] + o[3]));
        return orders;
    }

    record CandidateOrder(int p, int d, int q, int seasonalP, int seasonalD, int seasonalQ) {

        ArimaOrder toArimaOrder() {
            return ArimaOrder.order(p, d, q, seasonalP, seasonalD, seasonalQ);
        }

        String describe(boolean seasonal, int frequency) {
            String base = String.format("ARIMA(%d,%d,%d)", p, d, q);
            if (!seasonal) {
                return base;
            }
            return base + String.format("(%d,%d,%d)[%d]", seasonalP, seasonalD, seasonalQ, frequency);
        }
    }

    static final class ArimaFit implements FittedModel {

        private final Arima arima;
        private final String spec;
        private final double aic;
        private final int trainSize;

        ArimaFit(Arima arima, String spec, double aic, int trainSize) {
            this.arima = arima;
            this.spec = spec;
            this.aic = aic;
            this.trainSize = trainSize;
        }

        @Override
        public String spec() {
            return spec;
        }

        @Override
        public double informationCriterion() {
            return aic;
        }

        @Override
        public int trainSize() {
            return trainSize;
        }

        @Override
        public ForecastResult forecast(int horizon, List<Integer> confidenceLevels) {
            try {
                Forecast point = arima.forecast(horizon);
                ForecastResult.ForecastResultBuilder result = ForecastResult.builder()
                    .mean(boxed(point.pointEstimates().asArray()));
                for (Integer level : confidenceLevels) {
                    Forecast bounded = arima.forecast(horizon, 1.0 - level / 100.0);
                    result.interval(new PredictionInterval(level,
                        boxed(bounded.lowerPredictionInterval().asArray()),
                        boxed(bounded.upperPredictionInterval().asArray())));
                }
                return result.build();
            } catch (RuntimeException ex) {
                throw new FitFailureException(ID + ": forecasting from " + spec + " failed: " + ex.getMessage(), ex);
            }
        }

        private static List<Double> boxed(double[] values) {
            List<Double> out = new ArrayList<>(values.length);
            for (double v : values) {
                out.add(v);
            }
            return out;
        }
    }
}
