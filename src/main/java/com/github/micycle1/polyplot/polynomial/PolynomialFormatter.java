package com.github.micycle1.polyplot.polynomial;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Human-readable renderings of a {@link Polynomial}. Numbers are written in the
 * style of C's <code>%g</code>: six significant digits, trailing zeros removed,
 * scientific notation for very small or large magnitudes.
 */
public class PolynomialFormatter {

	private static final MathContext SIX_DIGITS = new MathContext(6, RoundingMode.HALF_EVEN);

	/**
	 * Sign-aware listing from the highest power down, e.g.
	 * <code>-x^5 - 6*x^4 + x</code>. Zero terms are skipped and unit coefficients
	 * are elided; a polynomial with no non-zero term renders as <code>0</code>.
	 */
	public static String format(Polynomial p) {
		double[] c = p.coefficients();
		StringBuilder sb = new StringBuilder();
		for (int i = c.length - 1; i >= 0; i--) {
			if (c[i] == 0) {
				continue;
			}
			boolean negative = c[i] < 0;
			if (sb.length() == 0) {
				if (negative) {
					sb.append('-');
				}
			} else {
				sb.append(negative ? " - " : " + ");
			}
			sb.append(term(Math.abs(c[i]), i));
		}
		return sb.length() == 0 ? "0" : sb.toString();
	}

	/**
	 * Every term including zeros, highest power first, written as
	 * <code>c*x^i</code> and joined by <code> + </code>.
	 */
	public static String formatAll(Polynomial p) {
		double[] c = p.coefficients();
		StringBuilder sb = new StringBuilder();
		for (int i = c.length - 1; i >= 0; i--) {
			if (sb.length() > 0) {
				sb.append(" + ");
			}
			sb.append(formatNumber(c[i])).append("*x^").append(i);
		}
		return sb.toString();
	}

	private static String term(double magnitude, int exponent) {
		String number = formatNumber(magnitude);
		if (exponent == 0) {
			return number;
		}
		String variable = exponent == 1 ? "x" : "x^" + exponent;
		return number.equals("1") ? variable : number + "*" + variable;
	}

	/**
	 * Formats a value like <code>%g</code> does.
	 */
	public static String formatNumber(double value) {
		if (value == 0) {
			return "0";
		}
		BigDecimal rounded = new BigDecimal(value).round(SIX_DIGITS);
		int exponent = rounded.precision() - rounded.scale() - 1;
		if (exponent >= -4 && exponent < 6) {
			return rounded.stripTrailingZeros().toPlainString();
		}
		String mantissa = rounded.movePointLeft(exponent).stripTrailingZeros().toPlainString();
		return String.format("%se%s%02d", mantissa, exponent < 0 ? "-" : "+", Math.abs(exponent));
	}

	private PolynomialFormatter() {
	}
}
