package com.github.micycle1.polyplot.bound;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.polyplot.polynomial.Polynomial;
import com.github.micycle1.polyplot.util.NthRoot;

/**
 * Classical coefficient bounds on the real roots of a polynomial.
 */
public class BoundEstimator {

	private static final Logger LOGGER = LoggerFactory.getLogger(BoundEstimator.class);

	/**
	 * Cauchy's bound: every root, real or complex, lies in the disk of radius
	 * <code>1 + max_{i&lt;n} |c_i| / |a_n|</code>. The leading coefficient
	 * <code>a_n</code> is the highest non-zero one, so zero top coefficients do not
	 * blow the radius up.
	 *
	 * @return the interval [-r, r], or {@link Bound#DEFAULT} for a constant
	 */
	public static Bound cauchy(Polynomial p) {
		double[] c = p.coefficients();
		int n = leadingIndex(c);
		if (n < 1) {
			return Bound.DEFAULT;
		}
		double an = Math.abs(c[n]);
		double maxAk = 0;
		for (int i = 0; i < n; i++) {
			maxAk = Math.max(maxAk, Math.abs(c[i]));
		}
		return Bound.symmetric(1 + maxAk / an);
	}

	/**
	 * Lagrange's upper bound on the positive real roots.
	 * <p>
	 * The coefficients are normalised so the leading one is positive. With
	 * <code>b</code> the most negative remaining coefficient and <code>k</code> the
	 * gap between the leading exponent and the highest exponent carrying a negative
	 * coefficient, every positive root is below <code>1 + (|b| / a_n)^(1/k)</code>.
	 *
	 * @return the bound, or empty when no coefficient is negative after
	 *         normalisation or when <code>|b| / a_n</code> underflows to zero or
	 *         overflows
	 */
	public static OptionalDouble lagrangeUpper(Polynomial p) {
		double[] c = p.coefficients();
		int n = leadingIndex(c);
		if (n < 1) {
			return OptionalDouble.empty();
		}
		if (c[n] < 0) {
			for (int i = 0; i < c.length; i++) {
				c[i] = -c[i];
			}
		}
		double an = c[n];
		double b = 0;
		int k = 0;
		for (int i = 0; i < n; i++) {
			if (c[i] < b) {
				b = c[i];
			}
			if (c[i] < 0) {
				k = n - i; // keeps the value for the highest negative exponent
			}
		}
		if (k == 0) {
			return OptionalDouble.empty();
		}
		double radicand = Math.abs(b) / an;
		if (!(radicand > 0) || Double.isInfinite(radicand)) {
			LOGGER.debug("Lagrange radicand {} out of range for {}", radicand, p);
			return OptionalDouble.empty();
		}
		return OptionalDouble.of(1 + NthRoot.newton(radicand, k));
	}

	/**
	 * Bounds the real roots by applying {@link #lagrangeUpper(Polynomial)} in four
	 * orientations:
	 * <ul>
	 * <li>largest positive root: p itself;</li>
	 * <li>smallest positive root: reciprocal of the bound of the reversed p;</li>
	 * <li>smallest negative root: negated bound of p(-x);</li>
	 * <li>largest negative root: negated reciprocal of the bound of reversed
	 * p(-x).</li>
	 * </ul>
	 * The positive pair is only tried when p has a negative coefficient, the
	 * negative pair only when p(-x) has one. The result spans the smallest and
	 * largest of the values obtained.
	 *
	 * @return the combined interval, or {@link Bound#DEFAULT} for a constant or
	 *         when no orientation yields a value
	 */
	public static Bound lagrange(Polynomial p) {
		if (p.degree() < 1) {
			return Bound.DEFAULT;
		}

		List<Double> limits = new ArrayList<>(4);

		if (p.hasNegativeCoefficient()) {
			lagrangeUpper(p).ifPresent(limits::add);
			lagrangeUpper(p.reverse()).ifPresent(r -> limits.add(1 / r));
		}

		Polynomial reflected = p.reflectAboutY();
		if (reflected.hasNegativeCoefficient()) {
			lagrangeUpper(reflected).ifPresent(r -> limits.add(-r));
			lagrangeUpper(reflected.reverse()).ifPresent(r -> limits.add(-1 / r));
		}

		if (limits.isEmpty()) {
			LOGGER.debug("No Lagrange bound applies to {}; using default range", p);
			return Bound.DEFAULT;
		}
		Collections.sort(limits);
		return new Bound(limits.get(0), limits.get(limits.size() - 1));
	}

	/**
	 * Index of the highest non-zero coefficient, or 0 if all above the constant
	 * are zero.
	 */
	static int leadingIndex(double[] c) {
		for (int i = c.length - 1; i > 0; i--) {
			if (c[i] != 0) {
				return i;
			}
		}
		return 0;
	}

	private BoundEstimator() {
	}
}
