package org.cargo.utils;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class MathUtilsUnitTest {
    private static final double EPSILON = 1E-10;

    @Test
    public void testSum() {
        Assert.assertEquals(MathUtils.sum(new double[]{1., 2.5, -0.5}), 3., EPSILON);
        Assert.assertEquals(MathUtils.sum(new double[]{}), 0.);
    }

    @DataProvider(name = "logSumExp")
    public Object[][] logSumExp() {
        return new Object[][]{
                {new double[]{0.}, 0.},
                {new double[]{Math.log(1.), Math.log(2.), Math.log(3.)}, Math.log(6.)},
                {new double[]{1000., 1000.}, 1000. + Math.log(2.)},
                {new double[]{-1000., Double.NEGATIVE_INFINITY}, -1000.}
        };
    }

    @Test(dataProvider = "logSumExp")
    public void testLogSumExp(final double[] values, final double expected) {
        Assert.assertEquals(MathUtils.logSumExp(values), expected, EPSILON);
    }

    @Test
    public void testLogSumExpOfNegativeInfinities() {
        Assert.assertEquals(MathUtils.logSumExp(new double[]{Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY}),
                Double.NEGATIVE_INFINITY);
        Assert.assertEquals(MathUtils.logSumExp(new double[]{}), Double.NEGATIVE_INFINITY);
    }

    @Test
    public void testLogFactorial() {
        Assert.assertEquals(MathUtils.logFactorial(0), 0., EPSILON);
        Assert.assertEquals(MathUtils.logFactorial(1), 0., EPSILON);
        Assert.assertEquals(MathUtils.logFactorial(5), Math.log(120.), EPSILON);
        Assert.assertFalse(Double.isInfinite(MathUtils.logFactorial(1E7)));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testLogFactorialOfNegative() {
        MathUtils.logFactorial(-1);
    }
}
