package com.esgcredit.forecast;

import com.esgcredit.model.Pillar;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import smile.data.DataFrame;
import smile.data.Tuple;
import smile.data.formula.Formula;
import smile.regression.RandomForest;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.LongStream;

/**
 * Ensemble regressor for one metric: several random forests fitted on the same one-step-ahead pairs with
 * disjoint tree seeds. The spread of the member predictions is the model variance of a step.
 * Training sets too small for a forest fall back to a drift estimate with no member spread.
 * Read-only once fitted.
 */
final class MetricRegressor {
    static final String TARGET = "target";

    private final Pillar pillar;
    private final String[] columns;
    private final List<RandomForest> members;
    private final double drift;
    private final double residualVariance;
    private final int trainingSize;

    private MetricRegressor(
            Pillar pillar,
            String[] columns,
            List<RandomForest> members,
            double drift,
            double residualVariance,
            int trainingSize
    ) {
        this.pillar = pillar;
        this.columns = columns;
        this.members = List.copyOf(members);
        this.drift = drift;
        this.residualVariance = residualVariance;
        this.trainingSize = trainingSize;
    }

    static MetricRegressor fit(
            Pillar pillar,
            List<String> featureNames,
            double[][] x,
            double[] y,
            ForecastSettings settings,
            long seed
    ) {
        int n = y.length;
        int p = featureNames.size();
        String[] columns = new String[p + 1];
        for (int j = 0; j < p; j++) {
            columns[j] = featureNames.get(j);
        }
        columns[p] = TARGET;

        double driftSum = 0.0;
        for (int i = 0; i < n; i++) {
            driftSum += y[i] - x[i][0];
        }
        double drift = n == 0 ? 0.0 : driftSum / n;

        List<RandomForest> members = new ArrayList<>();
        if (n >= settings.minForestSamples()) {
            double[][] data = new double[n][];
            for (int i = 0; i < n; i++) {
                data[i] = withTarget(x[i], y[i]);
            }
            DataFrame frame = DataFrame.of(data, columns);
            int mtry = Math.max(1, p / 3);
            int maxNodes = Math.max(2, n);
            for (int m = 0; m < settings.members; m++) {
                // offset by one: a zero tree seed leaves that tree unseeded
                long base = seed + 1L + (long) m * settings.trees;
                members.add(RandomForest.fit(
                        Formula.lhs(TARGET),
                        frame,
                        settings.trees,
                        mtry,
                        settings.maxDepth,
                        maxNodes,
                        settings.nodeSize,
                        1.0,
                        LongStream.range(base, base + settings.trees)
                ));
            }
        }

        MetricRegressor partial = new MetricRegressor(pillar, columns, members, drift, 0.0, n);
        DescriptiveStatistics residuals = new DescriptiveStatistics();
        for (int i = 0; i < n; i++) {
            residuals.addValue(y[i] - partial.predict(x[i]));
        }
        double residualVariance = n < 2 ? 0.0 : residuals.getVariance();
        return new MetricRegressor(pillar, columns, members, drift, residualVariance, n);
    }

    /**
     * One prediction per ensemble member; a single drift estimate when no forest was fitted.
     */
    double[] memberPredictions(double[] features) {
        if (members.isEmpty()) {
            return new double[]{features[0] + drift};
        }
        Tuple row = DataFrame.of(new double[][]{withTarget(features, 0.0)}, columns).get(0);
        double[] out = new double[members.size()];
        for (int m = 0; m < out.length; m++) {
            out[m] = members.get(m).predict(row);
        }
        return out;
    }

    double predict(double[] features) {
        double[] preds = memberPredictions(features);
        double sum = 0.0;
        for (double v : preds) {
            sum += v;
        }
        return sum / preds.length;
    }

    static double memberVariance(double[] predictions) {
        if (predictions.length < 2) {
            return 0.0;
        }
        return new DescriptiveStatistics(predictions).getVariance();
    }

    Pillar pillar() {
        return pillar;
    }

    double residualVariance() {
        return residualVariance;
    }

    int trainingSize() {
        return trainingSize;
    }

    boolean usesForest() {
        return !members.isEmpty();
    }

    private static double[] withTarget(double[] features, double target) {
        double[] row = new double[features.length + 1];
        System.arraycopy(features, 0, row, 0, features.length);
        row[features.length] = target;
        return row;
    }
}
