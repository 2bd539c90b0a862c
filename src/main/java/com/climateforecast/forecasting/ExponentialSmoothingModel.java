package com.climateforecast.forecasting;

import com.climateforecast.exception.FitFailureException;
import com.climateforecast.forecasting.EtsSpec.ErrorType;
import com.climateforecast.forecasting.EtsSpec.SeasonType;
import com.climateforecast.forecasting.EtsSpec.TrendType;
import com.climateforecast.model.ForecastResult;
import com.climateforecast.model.PredictionInterval;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Exponential smoothing in state-space form (the ETS formulation of Holt–Winters).
 *
 * <p>Every admissible ETS(error, trend, season) combination is fitted by Nelder–Mead on the
 * likelihood and the one with the lowest AICc wins. Multiplicative components need strictly
 * positive data; additive error with multiplicative season is not considered. Seasonal variants
 * need two full periods of history to initialise.
 */
@Slf4j
@Order(2)
@Component
public class ExponentialSmoothingModel implements ForecastModel {

    public static final String ID = "hw";

    private static final int MIN_TRAIN = 4;
    private static final double PENALTY = 1e12;
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

    @Value("${ets.max-evaluations:2000}")
    private int maxEvaluations = 2000;

    @Value("${ets.allow-damped:true}")
    private boolean allowDamped = true;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String displayName() {
        return "Holt–Winters";
    }

    @Override
    public FittedModel fit(double[] train, int frequency) {
        TrainingSegments.requireFittable(train, ID, MIN_TRAIN);
        int n = train.length;

        EtsFit best = null;
        int tried = 0;
        for (EtsSpec spec : candidates(train, frequency)) {
            int k = spec.parameterCount(frequency);
            if (n <= k + 1) {
                continue;
            }
            tried++;
            EtsFit fitted = fitSpec(spec, train, frequency, k);
            if (fitted != null && (best == null || fitted.aicc < best.aicc)) {
                best = fitted;
            }
        }
        if (best == null) {
            throw new FitFailureException(ID + ": no ETS candidate could be estimated from " + n
                + " points (" + tried + " tried)");
        }
        log.debug("ETS selected | spec={} | aicc={} | alpha={} | beta={} | gamma={} | phi={}",
            best.spec, best.aicc, best.params.alpha(), best.params.beta(), best.params.gamma(), best.params.phi());
        return best;
    }

    List<EtsSpec> candidates(double[] train, int frequency) {
        boolean positive = TrainingSegments.strictlyPositive(train);
        boolean seasonalPossible = frequency > 1 && train.length >= 2 * frequency;
        List<EtsSpec> specs = new ArrayList<>();
        for (ErrorType error : ErrorType.values()) {
            for (TrendType trend : TrendType.values()) {
                for (SeasonType season : SeasonType.values()) {
                    EtsSpec spec = new EtsSpec(error, trend, season);
                    if (spec.isDamped() && !allowDamped) {
                        continue;
                    }
                    if (spec.hasSeason() && !seasonalPossible) {
                        continue;
                    }
                    if (spec.isMultiplicative() && !positive) {
                        continue;
                    }
                    if (error == ErrorType.A && season == SeasonType.M) {
                        continue;
                    }
                    specs.add(spec);
                }
            }
        }
        return specs;
    }

    private EtsFit fitSpec(EtsSpec spec, double[] y, int frequency, int k) {
        EtsRecursion.State start = EtsRecursion.initialState(spec, y, frequency);
        double[] guess = EtsParameters.initialGuess(spec);
        PointValuePair optimum;
        try {
            SimplexOptimizer optimizer = new SimplexOptimizer(1e-8, 1e-10);
            optimum = optimizer.optimize(
                new MaxEval(maxEvaluations),
                new ObjectiveFunction(x -> {
                    EtsRecursion.Pass pass = EtsRecursion.run(spec, EtsParameters.fromUnbounded(spec, x), start, y);
                    return pass == null ? PENALTY : pass.minusTwoLogLik();
                }),
                GoalType.MINIMIZE,
                new InitialGuess(guess),
                new NelderMeadSimplex(guess.length));
        } catch (TooManyEvaluationsException ex) {
            log.debug("ETS candidate did not converge | spec={} | maxEvaluations={}", spec, maxEvaluations);
            return null;
        }

        EtsParameters params = EtsParameters.fromUnbounded(spec, optimum.getPoint());
        EtsRecursion.Pass pass = EtsRecursion.run(spec, params, start, y);
        if (pass == null) {
            return null;
        }
        int n = y.length;
        double aic = pass.minusTwoLogLik() + 2.0 * k;
        double aicc = aic + (2.0 * k * (k + 1)) / (n - k - 1);
        return new EtsFit(spec, params, pass.state(), pass.sigma2(), aicc, n, frequency);
    }

    static final class EtsFit implements FittedModel {

        private final EtsSpec spec;
        private final EtsParameters params;
        private final EtsRecursion.State state;
        private final double sigma2;
        private final double aicc;
        private final int trainSize;
        private final int frequency;

        EtsFit(EtsSpec spec, EtsParameters params, EtsRecursion.State state, double sigma2,
               double aicc, int trainSize, int frequency) {
            this.spec = spec;
            this.params = params;
            this.state = state;
            this.sigma2 = sigma2;
            this.aicc = aicc;
            this.trainSize = trainSize;
            this.frequency = frequency;
        }

        @Override
        public String spec() {
            return spec.toString();
        }

        @Override
        public double informationCriterion() {
            return aicc;
        }

        @Override
        public int trainSize() {
            return trainSize;
        }

        @Override
        public ForecastResult forecast(int horizon, List<Integer> confidenceLevels) {
            double[] mean = new double[horizon];
            double[] variance = new double[horizon];
            double[] seasonals = state.seasonals();
            int m = seasonals.length;
            double phi = spec.isDamped() ? params.phi() : 1.0;

            double dampedSum = 0.0;
            double phiPower = 1.0;
            double sumC2 = 0.0;
            for (int h = 1; h <= horizon; h++) {
                phiPower *= phi;
                dampedSum += phiPower;
                double trendPart = spec.hasTrend() ? state.trend() * dampedSum : 0.0;
                double lb = state.level() + trendPart;
                double s = seasonals[(trainSize + h - 1) % m];
                mean[h - 1] = switch (spec.season()) {
                    case A -> lb + s;
                    case M -> lb * s;
                    case N -> lb;
                };
                double base = spec.error() == ErrorType.A ? sigma2 : sigma2 * mean[h - 1] * mean[h - 1];
                variance[h - 1] = base * (1.0 + sumC2);
                double c = params.alpha() + params.beta() * trendMultiplier(h, phi)
                    + (spec.hasSeason() && h % frequency == 0 ? params.gamma() : 0.0);
                sumC2 += c * c;
            }

            ForecastResult.ForecastResultBuilder result = ForecastResult.builder().mean(boxed(mean));
            for (Integer level : confidenceLevels) {
                double z = STANDARD_NORMAL.inverseCumulativeProbability(0.5 + level / 200.0);
                List<Double> lower = new ArrayList<>(horizon);
                List<Double> upper = new ArrayList<>(horizon);
                for (int i = 0; i < horizon; i++) {
                    double half = z * Math.sqrt(variance[i]);
                    lower.add(mean[i] - half);
                    upper.add(mean[i] + half);
                }
                result.interval(new PredictionInterval(level, lower, upper));
            }
            return result.build();
        }

        private double trendMultiplier(int j, double phi) {
            if (!spec.hasTrend()) {
                return 0.0;
            }
            if (!spec.isDamped()) {
                return j;
            }
            return phi * (1.0 - Math.pow(phi, j)) / (1.0 - phi);
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
