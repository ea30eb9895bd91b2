package com.github.micycle1.polyplot.util;

import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.polyplot.PolyConstants;

public class NthRoot {

	private static final Logger LOGGER = LoggerFactory.getLogger(NthRoot.class);

	/**
	 * Computes the n-th root of a with Newton's method, seeded with a itself:
	 * <code>x_{k+1} = ((n-1) x_k + a / x_k^(n-1)) / n</code>, stopping once
	 * <code>|a - x_k^n| &lt; 1e-7</code>.
	 *
	 * @param a a positive radicand
	 * @param n the root degree, at least 1
	 * @return the approximate n-th root of a
	 */
	public static double newton(double a, int n) {
		Validate.isTrue(n >= 1, "Root degree must be positive: %d", n);
		Validate.isTrue(a > 0, "Radicand must be positive: %s", a);

		double xk = a;
		double x1 = xk;
		for (int i = 0; i < PolyConstants.NTH_ROOT_MAX_ITERATIONS; i++) {
			x1 = ((n - 1) * xk + a / Math.pow(xk, n - 1)) / n;
			if (Math.abs(a - Math.pow(xk, n)) < PolyConstants.NTH_ROOT_TOL) {
				return x1;
			}
			if (x1 == xk) {
				// fixed point in floating point; the absolute tolerance is out of reach
				return x1;
			}
			xk = x1;
		}
		LOGGER.warn("nth root of {} (n={}) did not reach tolerance after {} iterations", a, n, PolyConstants.NTH_ROOT_MAX_ITERATIONS);
		return x1;
	}

	private NthRoot() {
	}
}
