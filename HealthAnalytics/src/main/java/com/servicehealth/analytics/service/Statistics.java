package com.servicehealth.analytics.service;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.util.List;

/**
 * Descriptive statistics and least-squares fitting used by the analytics engine.
 * commons-math yields NaN on too few values; these helpers return 0 instead.
 */
public final class Statistics {

    private Statistics() {
    }

    public record LinearFit(double slope, double intercept) {

        public double valueAt(double x) {
            return slope * x + intercept;
        }
    }

    /**
     * Arithmetic mean, 0 for an empty list.
     */
    public static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        return new Mean().evaluate(toArray(values));
    }

    /**
     * Sample standard deviation (n-1 denominator), 0 for fewer than two values.
     */
    public static double standardDeviation(List<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        return new StandardDeviation(true).evaluate(toArray(values));
    }

    /**
     * Ordinary least squares fit of {@code y = slope * x + intercept}.
     * When all x are equal the slope is undefined and reported as 0 with the mean of y as intercept.
     */
    public static LinearFit leastSquares(double[] xs, double[] ys) {
        if (xs.length != ys.length) {
            throw new IllegalArgumentException("x and y must have the same length: " + xs.length + " != " + ys.length);
        }
        if (xs.length == 0) {
            return new LinearFit(0.0, 0.0);
        }

        SimpleRegression regression = new SimpleRegression(true);
        for (int i = 0; i < xs.length; i++) {
            regression.addData(xs[i], ys[i]);
        }

        double slope = regression.getSlope();
        if (Double.isNaN(slope)) {
            return new LinearFit(0.0, new Mean().evaluate(ys));
        }
        return new LinearFit(slope, regression.getIntercept());
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
