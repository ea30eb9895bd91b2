package com.github.micycle1.polyplot.util;

public class Binomial {

	/**
	 * Newton's binomial coefficient C(n, k), computed as a running product so that
	 * no factorial is formed.
	 *
	 * @return C(n, k), or 0 if k is outside [0, n]
	 */
	public static double coefficient(int n, int k) {
		if (k < 0 || k > n) {
			return 0;
		}
		double result = 1;
		for (int i = 1; i <= k; i++) {
			result = result * (n - i + 1) / i;
		}
		return result;
	}

	private Binomial() {
	}
}
