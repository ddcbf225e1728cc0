package org.cargo.statistics;

import com.google.common.primitives.Doubles;
import org.apache.commons.math3.distribution.BinomialDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cargo.exceptions.CargoException;
import org.cargo.exceptions.UserException;
import org.cargo.utils.MathUtils;
import org.cargo.utils.Utils;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * The multinomial distribution over count vectors: each of N independent trials lands in one of D categories,
 * category d being chosen with probability beta[d].  The pmf of a count vector x with sum_d x[d] = n is
 * P(x) = n! / prod_d x[d]! * prod_d beta[d]^x[d].
 *
 * Instances are immutable.  The log parameters are cached at construction with the convention log(0) := 0, so that a
 * zero-probability category with a zero count contributes 0 * log(0) = 0 to the likelihood; a positive count in such
 * a category is detected separately and yields a log likelihood of negative infinity.
 *
 * No random generator is held by the distribution.  Sampling methods take a {@link RandomGenerator}, so instances can
 * be shared across threads as long as each thread brings its own generator.
 */
public final class Multinomial {
    private static final Logger logger = LogManager.getLogger(Multinomial.class);

    /**
     * Tolerance on the sum of a parameter vector that is supplied without normalization.
     */
    public static final double SUM_TO_UNITY_EPSILON = 1E-6;

    private final double[] beta;
    private final double[] logBeta;
    private final double totalMass;

    //index of the last category with nonzero probability; receives the remaining trials when sampling
    private final int lastSupportedCategory;

    private final List<Double> betaView;
    private final List<Double> logBetaView;

    /**
     * Create a multinomial distribution whose parameters are {@code beta} divided by its sum.
     */
    public Multinomial(final double[] beta) {
        this(beta, true);
    }

    /**
     * Create a multinomial distribution from a parameter vector.
     *
     * @param beta      non-negative category weights, at least one of them positive
     * @param normalize if true, {@code beta} is divided by its sum; if false, {@code beta} must already sum to one
     *                  within {@link #SUM_TO_UNITY_EPSILON} and is kept as given
     * @throws UserException.InvalidParameter if {@code beta} is empty, has a negative or non-finite entry,
     *                                        sums to zero, or is not normalized when {@code normalize} is false
     */
    public Multinomial(final double[] beta, final boolean normalize) {
        Utils.nonNull(beta, "Parameter vector cannot be null.");
        if (beta.length == 0) {
            throw new UserException.InvalidParameter("the parameter vector must have at least one element.");
        }
        for (int d = 0; d < beta.length; d++) {
            if (Double.isNaN(beta[d]) || Double.isInfinite(beta[d])) {
                throw new UserException.InvalidParameter(String.format("entry %d is not finite (%f).", d, beta[d]));
            }
            if (beta[d] < 0) {
                throw new UserException.InvalidParameter(String.format("entry %d is negative (%f).", d, beta[d]));
            }
        }
        final double sum = MathUtils.sum(beta);
        if (sum <= 0) {
            throw new UserException.InvalidParameter("the parameter vector sums to zero and cannot be normalized.");
        }
        if (Double.isInfinite(sum)) {
            throw new UserException.InvalidParameter("the sum of the parameter vector overflows.");
        }

        if (normalize) {
            this.beta = Arrays.stream(beta).map(b -> b / sum).toArray();
        } else {
            if (Math.abs(1. - sum) > SUM_TO_UNITY_EPSILON) {
                throw new UserException.InvalidParameter(
                        String.format("the parameter vector must sum to one when not normalized, but sums to %f.", sum));
            }
            this.beta = Arrays.copyOf(beta, beta.length);
        }
        logBeta = Arrays.stream(this.beta).map(b -> b == 0. ? 0. : Math.log(b)).toArray();
        totalMass = MathUtils.sum(this.beta);

        int last = this.beta.length - 1;
        while (this.beta[last] == 0.) {
            last--;
        }
        lastSupportedCategory = last;

        betaView = Collections.unmodifiableList(Doubles.asList(this.beta));
        logBetaView = Collections.unmodifiableList(Doubles.asList(logBeta));
        logger.debug("Created multinomial distribution over " + this.beta.length + " categories with parameters "
                + Arrays.toString(this.beta));
    }

    /**
     * Create the uniform multinomial distribution (1/K, 1/K, . . . 1/K) over K categories.
     */
    public static Multinomial uniform(final int numCategories) {
        if (numCategories < 1) {
            throw new UserException.InvalidParameter(
                    String.format("the number of categories must be positive, but was %d.", numCategories));
        }
        return new Multinomial(Collections.nCopies(numCategories, 1. / numCategories).stream().mapToDouble(x -> x).toArray());
    }

    /**
     * Create a multinomial distribution from unnormalized natural-log weights.  The weights are exponentiated relative
     * to their log-sum-exp, so large magnitudes do not overflow.  An entry of negative infinity gives a
     * zero-probability category.
     */
    public static Multinomial fromLogProbabilities(final double[] unnormalizedLogBeta) {
        Utils.nonNull(unnormalizedLogBeta, "Log parameter vector cannot be null.");
        if (unnormalizedLogBeta.length == 0) {
            throw new UserException.InvalidParameter("the log parameter vector must have at least one element.");
        }
        for (int d = 0; d < unnormalizedLogBeta.length; d++) {
            if (Double.isNaN(unnormalizedLogBeta[d]) || unnormalizedLogBeta[d] == Double.POSITIVE_INFINITY) {
                throw new UserException.InvalidParameter(
                        String.format("log entry %d must be finite or negative infinity (%f).", d, unnormalizedLogBeta[d]));
            }
        }
        final double logNormalization = MathUtils.logSumExp(unnormalizedLogBeta);
        if (Double.isInfinite(logNormalization)) {
            throw new UserException.InvalidParameter("every log entry is negative infinity.");
        }
        return new Multinomial(Arrays.stream(unnormalizedLogBeta).map(x -> Math.exp(x - logNormalization)).toArray());
    }

    /**
     * Draw a count vector from N trials.  Categories are filled in order with conditional binomial draws:
     * category d receives Binomial(remaining trials, beta[d] / remaining probability mass) trials, and the last
     * category with nonzero probability receives whatever is left.  Zero-probability categories never receive trials.
     *
     * @param rng       source of randomness
     * @param numTrials N, the sum of the returned counts
     * @return counts of length {@link #numCategories()} summing to {@code numTrials}
     * @throws UserException.InvalidArgument if {@code numTrials} is negative
     */
    public int[] variate(final RandomGenerator rng, final int numTrials) {
        Utils.nonNull(rng, "Random generator cannot be null.");
        if (numTrials < 0) {
            throw new UserException.InvalidArgument("numTrials", Integer.toString(numTrials), "the number of trials cannot be negative.");
        }
        final int[] counts = new int[beta.length];
        int remainingTrials = numTrials;
        double remainingMass = totalMass;
        for (int d = 0; d < lastSupportedCategory && remainingTrials > 0; d++) {
            if (beta[d] == 0.) {
                continue;
            }
            final double conditionalProbability = remainingMass > beta[d] ? beta[d] / remainingMass : 1.;
            final int count = conditionalProbability == 1.
                    ? remainingTrials
                    : new BinomialDistribution(rng, remainingTrials, conditionalProbability).sample();
            counts[d] = count;
            remainingTrials -= count;
            remainingMass -= beta[d];
        }
        counts[lastSupportedCategory] += remainingTrials;
        return counts;
    }

    /**
     * Draw a single-trial count vector: one entry is 1, all others are 0.
     */
    public int[] variate(final RandomGenerator rng) {
        return variate(rng, 1);
    }

    /**
     * Draw a single-trial count vector and return the index of the category it landed in.
     *
     * @throws CargoException.InternalConsistency if the draw is not a one-hot vector
     */
    public int indicator(final RandomGenerator rng) {
        final int[] draw = variate(rng);
        int index = -1;
        for (int d = 0; d < draw.length; d++) {
            if (draw[d] == 0) {
                continue;
            }
            if (draw[d] != 1 || index != -1) {
                throw new CargoException.InternalConsistency(
                        "Single-trial draw is not a one-hot vector: " + Arrays.toString(draw));
            }
            index = d;
        }
        if (index == -1) {
            throw new CargoException.InternalConsistency(
                    "Single-trial draw has no nonzero entry: " + Arrays.toString(draw));
        }
        return index;
    }

    /**
     * Log probability of a count vector; see {@link #logLikelihood(double[])}.
     */
    public double logLikelihood(final int[] sample) {
        Utils.nonNull(sample, "Sample cannot be null.");
        return logLikelihood(Arrays.stream(sample).asDoubleStream().toArray());
    }

    /**
     * Return the log probability of a count vector,
     * lgamma(n + 1) - sum_d lgamma(sample[d] + 1) + sum_d sample[d] * log(beta[d]), with n = sum_d sample[d].
     * The total n is taken from the sample itself.
     *
     * @param sample non-negative, integral-valued counts, one per category
     * @return the log likelihood, or negative infinity if a zero-probability category has a positive count
     * @throws UserException.DimensionMismatch if the length of {@code sample} differs from {@link #numCategories()}
     * @throws UserException.InvalidArgument   if a count is negative or not finite
     */
    public double logLikelihood(final double[] sample) {
        Utils.nonNull(sample, "Sample cannot be null.");
        if (sample.length != beta.length) {
            throw new UserException.DimensionMismatch(beta.length, sample.length);
        }
        boolean impossible = false;
        double n = 0.;
        double logLikelihood = 0.;
        for (int d = 0; d < sample.length; d++) {
            final double count = sample[d];
            if (Double.isNaN(count) || Double.isInfinite(count) || count < 0) {
                throw new UserException.InvalidArgument("sample", Arrays.toString(sample),
                        "counts must be finite and non-negative.");
            }
            if (count > 0 && beta[d] == 0.) {
                impossible = true;
            }
            n += count;
            logLikelihood += count * logBeta[d] - MathUtils.logFactorial(count);
        }
        return impossible ? Double.NEGATIVE_INFINITY : logLikelihood + MathUtils.logFactorial(n);
    }

    /**
     * Log probability of a collection of independent count vectors, i.e. the sum of their log likelihoods.
     */
    public double logLikelihood(final Collection<int[]> samples) {
        Utils.nonNull(samples, "Samples cannot be null.");
        double total = 0.;
        for (final int[] sample : samples) {
            total += logLikelihood(sample);
        }
        return total;
    }

    public int numCategories() {
        return beta.length;
    }

    public double probability(final int category) {
        validateCategory(category);
        return beta[category];
    }

    /**
     * Cached log of the probability of {@code category}; 0 for a zero-probability category.
     */
    public double logProbability(final int category) {
        validateCategory(category);
        return logBeta[category];
    }

    /**
     * @return read-only view of the parameter vector
     */
    public List<Double> getBeta() {
        return betaView;
    }

    /**
     * @return read-only view of the log parameter vector, with 0 in place of log(0)
     */
    public List<Double> getLogBeta() {
        return logBetaView;
    }

    private void validateCategory(final int category) {
        if (category < 0 || category >= beta.length) {
            throw new UserException.InvalidArgument("category", Integer.toString(category),
                    String.format("must be in [0, %d).", beta.length));
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(beta, ((Multinomial) o).beta);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(beta);
    }

    @Override
    public String toString() {
        return "Multinomial{beta=" + Arrays.toString(beta) + "}";
    }
}
