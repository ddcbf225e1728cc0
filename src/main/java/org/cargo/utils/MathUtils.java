package org.cargo.utils;

import org.apache.commons.math3.special.Gamma;

/**
 * MathUtils is a static class (no instantiation allowed!) with some useful math methods.
 */
public final class MathUtils {
    private MathUtils() {}

    public static double sum(final double[] values) {
        Utils.nonNull(values);
        double s = 0.0;
        for (final double v : values) {
            s += v;
        }
        return s;
    }

    /**
     * Computes log(sum_i exp(values[i])) without overflow by factoring out the maximum.
     * Returns negative infinity when every value is negative infinity, or when {@code values} is empty.
     */
    public static double logSumExp(final double[] values) {
        Utils.nonNull(values);
        double max = Double.NEGATIVE_INFINITY;
        for (final double v : values) {
            max = Math.max(max, v);
        }
        if (Double.isInfinite(max)) {
            return max;
        }
        double sum = 0.0;
        for (final double v : values) {
            sum += Math.exp(v - max);
        }
        return max + Math.log(sum);
    }

    /**
     * log(x!) = lgamma(x + 1), evaluated with the Lanczos approximation so large counts do not overflow.
     */
    public static double logFactorial(final double x) {
        Utils.validateArg(x >= 0, "Factorial is only defined for non-negative values.");
        return Gamma.logGamma(x + 1);
    }
}
