package com.github.micycle1.polyplot.parse;

import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;

import com.github.micycle1.polyplot.polynomial.Polynomial;

/**
 * Reads polynomials written the way a user types them, e.g.
 * <code>3x^2 - 2,5*x + 1/2</code> or <code>-x^3 + 1.5e-2x</code>.
 * <p>
 * A term is an optional sign, an optional coefficient, and an optional
 * <code>x</code> or <code>x^k</code>; a <code>*</code> may sit between a
 * coefficient and <code>x</code>. Coefficients are decimal numbers (<code>.</code>
 * or <code>,</code> as separator), fractions <code>a/b</code>, either with an
 * optional <code>e+k</code> or <code>e-k</code> exponent. Spaces are allowed
 * around the signs joining terms. Terms with the same exponent are summed.
 */
public class PolynomialParser {

	/** Largest exponent accepted; bounds the size of the coefficient array. */
	public static final int MAX_EXPONENT = 10_000;

	private static final String NUMBER = "(?:\\d*[.,/]?\\d+(?:e[+-]\\d+)?)";
	private static final String POWER = "(?:x(?:\\^\\d+)?)";
	private static final String TERM = "(?:" + NUMBER + "(?:\\*?" + POWER + ")?|" + POWER + ")";

	private static final Pattern VALID = Pattern.compile("^ *[+-]? *" + TERM + "(?: *[+-] *" + TERM + ")* *$");
	private static final Pattern TERM_PARTS = Pattern.compile("^([+-]?)(" + NUMBER + ")?(?:\\*?(x)(?:\\^(\\d+))?)?$");
	// split before every sign that is not part of an e+k / e-k exponent
	private static final Pattern TERM_SPLIT = Pattern.compile("(?<!e)(?=[+-])");

	/**
	 * Checks the text against the term grammar without evaluating it.
	 */
	public static boolean isValid(String text) {
		return text != null && VALID.matcher(text).matches();
	}

	/**
	 * @throws PolynomialParseException if the text is empty, does not match the
	 *                                  grammar, or a coefficient is not finite
	 */
	public static Polynomial parse(String text) throws PolynomialParseException {
		if (StringUtils.isBlank(text)) {
			throw new PolynomialParseException("Empty polynomial", String.valueOf(text));
		}
		if (!isValid(text)) {
			throw new PolynomialParseException("Malformed polynomial", text);
		}

		String cleaned = StringUtils.deleteWhitespace(text);
		TreeMap<Integer, Double> coefficients = new TreeMap<>();
		for (String term : TERM_SPLIT.split(cleaned)) {
			if (term.isEmpty()) {
				continue;
			}
			Pair<Integer, Double> parsed = parseTerm(term);
			coefficients.merge(parsed.getLeft(), parsed.getRight(), Double::sum);
		}
		return new Polynomial(toDense(coefficients, text));
	}

	/**
	 * Parses one signed term such as <code>-2.5*x^3</code>.
	 *
	 * @return (exponent, coefficient)
	 */
	static Pair<Integer, Double> parseTerm(String term) throws PolynomialParseException {
		Matcher m = TERM_PARTS.matcher(term);
		if (!m.matches() || (m.group(2) == null && m.group(3) == null)) {
			throw new PolynomialParseException("Malformed term", term);
		}
		double sign = "-".equals(m.group(1)) ? -1 : 1;
		double magnitude = m.group(2) == null ? 1 : parseNumber(m.group(2));

		int exponent = 0;
		if (m.group(3) != null) {
			exponent = 1;
			if (m.group(4) != null) {
				try {
					exponent = Integer.parseInt(m.group(4));
				} catch (NumberFormatException e) {
					throw new PolynomialParseException("Exponent out of range", term, e);
				}
				if (exponent > MAX_EXPONENT) {
					throw new PolynomialParseException("Exponent above " + MAX_EXPONENT, term);
				}
			}
		}
		return new ImmutablePair<>(exponent, sign * magnitude);
	}

	/**
	 * Evaluates an unsigned numeric literal: a decimal or a fraction, optionally
	 * followed by a power-of-ten exponent. Nothing else is evaluated.
	 */
	static double parseNumber(String literal) throws PolynomialParseException {
		String mantissa = literal.replace(',', '.');
		int scale = 0;
		int e = mantissa.indexOf('e');
		if (e >= 0) {
			try {
				scale = Integer.parseInt(mantissa.substring(e + 1));
			} catch (NumberFormatException ex) {
				throw new PolynomialParseException("Exponent out of range", literal, ex);
			}
			mantissa = mantissa.substring(0, e);
		}

		double value;
		int slash = mantissa.indexOf('/');
		if (slash >= 0) {
			if (slash == 0) {
				throw new PolynomialParseException("Fraction without numerator", literal);
			}
			double numerator = Double.parseDouble(mantissa.substring(0, slash));
			double denominator = Double.parseDouble(mantissa.substring(slash + 1));
			if (denominator == 0) {
				throw new PolynomialParseException("Division by zero", literal);
			}
			value = numerator / denominator * Math.pow(10, scale);
		} else {
			value = Double.parseDouble(mantissa + "e" + scale);
		}

		if (!Double.isFinite(value)) {
			throw new PolynomialParseException("Coefficient is not finite", literal);
		}
		return value;
	}

	private static double[] toDense(TreeMap<Integer, Double> coefficients, String text) throws PolynomialParseException {
		if (coefficients.isEmpty()) {
			throw new PolynomialParseException("No terms", text);
		}
		int maxExponent = coefficients.lastKey();
		double[] dense = new double[maxExponent + 1];
		for (Map.Entry<Integer, Double> entry : coefficients.entrySet()) {
			dense[entry.getKey()] = entry.getValue();
		}
		for (double c : dense) {
			if (!Double.isFinite(c)) {
				throw new PolynomialParseException("Coefficient sum is not finite", text);
			}
		}
		return dense;
	}

	private PolynomialParser() {
	}
}
