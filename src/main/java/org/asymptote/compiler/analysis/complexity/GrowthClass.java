package org.asymptote.compiler.analysis.complexity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * A closed-form growth class {@code base^n · n^degree · log^logPower n}.
 * <p>
 * Classes are totally ordered by asymptotic dominance: exponential base first, then
 * polynomial degree, then the power of the logarithmic factor. Base and degree are
 * normalized to nine decimals so that computed exponents such as {@code log_2 4}
 * compare equal to their exact value.
 *
 * @param base     The exponential base, at least 1 (1 means no exponential factor).
 * @param degree   The polynomial degree, at least 0.
 * @param logPower The power of the logarithmic factor, at least 0.
 */
public record GrowthClass(double base, double degree, int logPower) implements Comparable<GrowthClass> {

    public static final double EPSILON = 1e-9;

    public static final GrowthClass CONSTANT = new GrowthClass(1, 0, 0);
    public static final GrowthClass LOGARITHMIC = new GrowthClass(1, 0, 1);
    public static final GrowthClass LINEAR = new GrowthClass(1, 1, 0);
    public static final GrowthClass LINEARITHMIC = new GrowthClass(1, 1, 1);
    public static final GrowthClass QUADRATIC = new GrowthClass(1, 2, 0);

    public GrowthClass {
        base = normalize(base);
        degree = normalize(degree);
        if (base < 1 || Double.isNaN(base) || Double.isInfinite(base)) {
            throw new IllegalArgumentException("Exponential base must be finite and at least 1: " + base);
        }
        if (degree < 0 || Double.isNaN(degree) || Double.isInfinite(degree)) {
            throw new IllegalArgumentException("Degree must be finite and non-negative: " + degree);
        }
        if (logPower < 0) {
            throw new IllegalArgumentException("Log power must be non-negative: " + logPower);
        }
    }

    public static GrowthClass polynomial(double degree) {
        return new GrowthClass(1, degree, 0);
    }

    public static GrowthClass polyLog(double degree, int logPower) {
        return new GrowthClass(1, degree, logPower);
    }

    public static GrowthClass exponential(double base) {
        return new GrowthClass(base, 0, 0);
    }

    private static double normalize(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(9, RoundingMode.HALF_UP).doubleValue() + 0.0;
    }

    public boolean isConstant() {
        return equals(CONSTANT);
    }

    public boolean isExponential() {
        return base > 1;
    }

    /**
     * @return true for a pure polynomial {@code n^d} without log or exponential factor.
     */
    public boolean isPurePolynomial() {
        return base == 1 && logPower == 0;
    }

    /**
     * @return the product class, e.g. {@code n · log n = n log n}, or null if base or degree overflow.
     */
    public GrowthClass times(GrowthClass other) {
        double productBase = base * other.base;
        double productDegree = degree + other.degree;
        if (!Double.isFinite(productBase) || !Double.isFinite(productDegree)) {
            return null;
        }
        return new GrowthClass(productBase, productDegree, logPower + other.logPower);
    }

    /**
     * Raises the class to a non-negative power, e.g. {@code sqrt(n) = n^0.5}.
     *
     * @return the powered class, or null if the log factor would get a fractional power
     *         or the result is not finite.
     */
    public GrowthClass pow(double exponent) {
        if (!Double.isFinite(exponent) || exponent < 0) {
            return null;
        }
        double powered = logPower * exponent;
        if (Math.abs(powered - Math.rint(powered)) > EPSILON || powered > Integer.MAX_VALUE) {
            return null;
        }
        double poweredBase = Math.pow(base, exponent);
        double poweredDegree = degree * exponent;
        if (!Double.isFinite(poweredBase) || !Double.isFinite(poweredDegree)) {
            return null;
        }
        return new GrowthClass(poweredBase, poweredDegree, (int) Math.rint(powered));
    }

    /**
     * Divides pure polynomials, e.g. {@code n^2 / n = n}.
     *
     * @return the quotient, or null if either side is not a pure polynomial or the quotient shrinks below a constant.
     */
    public GrowthClass dividedBy(GrowthClass divisor) {
        if (!isPurePolynomial() || !divisor.isPurePolynomial() || divisor.degree > degree + EPSILON) {
            return null;
        }
        return polynomial(Math.max(0, degree - divisor.degree));
    }

    /**
     * The growth of the logarithm of a quantity of this class: {@code log(c) = 1},
     * {@code log(n^d log^k n) = log n}, {@code log(b^n ...) = n}.
     *
     * @return the class of the logarithm, or null for {@code log log n}, which is not representable.
     */
    public GrowthClass logarithm() {
        if (isExponential()) {
            return LINEAR;
        }
        if (degree > 0) {
            return LOGARITHMIC;
        }
        return logPower == 0 ? CONSTANT : null;
    }

    @Override
    public int compareTo(GrowthClass other) {
        int byBase = Double.compare(base, other.base);
        if (byBase != 0) {
            return byBase;
        }
        int byDegree = Double.compare(degree, other.degree);
        if (byDegree != 0) {
            return byDegree;
        }
        return Integer.compare(logPower, other.logPower);
    }

    /**
     * @return the label without a bound symbol, e.g. {@code n log n}, {@code n^1.585} or {@code 2^n}.
     */
    public String label() {
        List<String> factors = new ArrayList<>();
        if (degree == 1) {
            factors.add("n");
        } else if (degree > 0) {
            factors.add("n^" + format(degree));
        }
        if (logPower == 1) {
            factors.add("log n");
        } else if (logPower > 1) {
            factors.add("log^" + logPower + " n");
        }
        String polyLog = String.join(" ", factors);
        if (!isExponential()) {
            return polyLog.isEmpty() ? "1" : polyLog;
        }
        String exponential = format(base) + "^n";
        return polyLog.isEmpty() ? exponential : polyLog + " · " + exponential;
    }

    /**
     * Formats a coefficient: integral values without decimals, others to three decimals.
     */
    public static String format(double value) {
        if (Math.abs(value - Math.rint(value)) < EPSILON) {
            return Long.toString((long) Math.rint(value));
        }
        return BigDecimal.valueOf(value).setScale(3, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
    }

    @Override
    public String toString() {
        return label();
    }
}
