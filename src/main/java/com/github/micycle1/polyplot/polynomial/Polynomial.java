package com.github.micycle1.polyplot.polynomial;

import java.util.Arrays;

import org.apache.commons.lang3.Validate;

import com.github.micycle1.polyplot.util.Binomial;

/**
 * A real polynomial in one variable, stored as a dense coefficient vector where
 * index <code>i</code> holds the coefficient of <code>x^i</code>.
 * <p>
 * High-order zero coefficients are kept as given, so {@link #degree()} is the
 * nominal degree (length - 1) and may overstate the true degree. Every
 * operation except {@link #differentiate()} leaves the receiver untouched and
 * returns a new instance built from a copy of the coefficients.
 */
public class Polynomial {

	private double[] coeff;

	/**
	 * @param coefficients coefficients in ascending order of exponent; copied.
	 *                     Must be non-empty and finite. Negative zeros are
	 *                     stored as positive zeros.
	 */
	public Polynomial(double... coefficients) {
		Validate.isTrue(coefficients != null && coefficients.length > 0, "A polynomial needs at least one coefficient");
		this.coeff = new double[coefficients.length];
		for (int i = 0; i < coefficients.length; i++) {
			double c = coefficients[i];
			Validate.isTrue(Double.isFinite(c), "Coefficient is not finite: %s", c);
			coeff[i] = c == 0 ? 0 : c; // -0.0 is stored as 0.0
		}
	}

	/**
	 * The zero polynomial <code>[0]</code>.
	 */
	public static Polynomial zero() {
		return new Polynomial(0);
	}

	public double[] coefficients() {
		return coeff.clone();
	}

	public double coefficient(int exponent) {
		return exponent < coeff.length ? coeff[exponent] : 0;
	}

	public int length() {
		return coeff.length;
	}

	/**
	 * Nominal degree: the number of coefficients minus one, whether or not the
	 * top coefficient is zero.
	 */
	public int degree() {
		return coeff.length - 1;
	}

	/**
	 * Whether this is the collapsed zero polynomial <code>[0]</code>, the state
	 * repeated differentiation always ends in.
	 */
	public boolean isZero() {
		return coeff.length == 1 && coeff[0] == 0;
	}

	/**
	 * Evaluates the polynomial at x using Horner's scheme.
	 */
	public double evaluate(double x) {
		double[] b = horner(x);
		return b[b.length - 1];
	}

	/**
	 * Computes the Horner table of this polynomial at <code>a</code>. For
	 * coefficients c<sub>0</sub>..c<sub>n</sub> the table b has n+1 entries:
	 * b<sub>n-1</sub> = c<sub>n</sub> and b<sub>k-1</sub> = c<sub>k</sub> +
	 * a&middot;b<sub>k</sub> for k = n-1..0, where index -1 denotes the last slot.
	 * The last entry is p(a); the first n entries are the coefficients of the
	 * quotient p(x) / (x - a).
	 *
	 * @param a the evaluation point
	 * @return a fresh table of length {@link #length()}
	 */
	public double[] horner(double a) {
		final int n = coeff.length - 1;
		double[] b = new double[n + 1];
		if (n == 0) {
			b[0] = coeff[0];
			return b;
		}
		b[n - 1] = coeff[n];
		for (int k = n - 1; k >= 0; k--) {
			int target = k == 0 ? n : k - 1; // b[-1] wraps to the remainder slot
			b[target] = coeff[k] + a * b[k];
		}
		return b;
	}

	/**
	 * Synthetic division by <code>(x - a)</code>: the quotient taken from the
	 * Horner table with the remainder dropped.
	 *
	 * @throws IllegalStateException if this polynomial is a constant, which has no
	 *                               quotient to keep
	 */
	public Polynomial deflate(double a) {
		if (coeff.length < 2) {
			throw new IllegalStateException("Cannot deflate a constant polynomial " + this);
		}
		double[] table = horner(a);
		return new Polynomial(Arrays.copyOf(table, table.length - 1));
	}

	/**
	 * Remainder of the division by <code>(x - a)</code>, equal to p(a).
	 */
	public double remainder(double a) {
		return evaluate(a);
	}

	public Polynomial add(Polynomial other) {
		double[] longer = coeff.length > other.coeff.length ? coeff : other.coeff;
		double[] shorter = longer == coeff ? other.coeff : coeff;
		double[] result = longer.clone();
		for (int i = 0; i < shorter.length; i++) {
			result[i] += shorter[i];
		}
		return new Polynomial(result);
	}

	public Polynomial multiply(Polynomial other) {
		double[] c = coeff;
		double[] d = other.coeff;
		double[] result = new double[c.length + d.length - 1];
		for (int i = 0; i < c.length; i++) {
			for (int j = 0; j < d.length; j++) {
				result[i + j] += c[i] * d[j];
			}
		}
		return new Polynomial(result);
	}

	/**
	 * Differentiates this polynomial in place. A constant collapses to the zero
	 * polynomial <code>[0]</code>.
	 *
	 * @see #derivative()
	 */
	public void differentiate() {
		if (coeff.length == 1) {
			coeff = new double[] { 0 };
			return;
		}
		double[] d = new double[coeff.length - 1];
		for (int i = 1; i < coeff.length; i++) {
			d[i - 1] = i * coeff[i];
		}
		coeff = d;
	}

	/**
	 * Returns the derivative as a new polynomial; this instance is unchanged.
	 *
	 * @see #differentiate()
	 */
	public Polynomial derivative() {
		Polynomial dpdx = copy();
		dpdx.differentiate();
		return dpdx;
	}

	public Polynomial copy() {
		return new Polynomial(coeff);
	}

	/**
	 * The polynomial with its coefficient order reversed,
	 * <code>x^n p(1/x)</code>. Its positive roots are the reciprocals of the
	 * positive roots of this polynomial.
	 */
	public Polynomial reverse() {
		double[] r = new double[coeff.length];
		for (int i = 0; i < coeff.length; i++) {
			r[i] = coeff[coeff.length - 1 - i];
		}
		return new Polynomial(r);
	}

	/**
	 * Reflection about the x axis: <code>-f(x)</code>.
	 */
	public Polynomial reflectAboutX() {
		return scale(-1);
	}

	/**
	 * Reflection about the y axis: <code>f(-x)</code>.
	 */
	public Polynomial reflectAboutY() {
		double[] r = coeff.clone();
		for (int i = 1; i < r.length; i += 2) {
			r[i] = -r[i];
		}
		return new Polynomial(r);
	}

	/**
	 * Translation by the vector (p, q): <code>f(x - p) + q</code>, expanded with
	 * the binomial theorem.
	 */
	public Polynomial translate(double p, double q) {
		double[] result = new double[coeff.length];
		result[0] = coeff[0] + q;
		for (int i = 1; i < coeff.length; i++) {
			if (coeff[i] == 0) {
				continue;
			}
			// c_i (x - p)^i = c_i sum_k C(i, k) (-p)^k x^(i-k)
			for (int k = 0; k <= i; k++) {
				result[i - k] += coeff[i] * Binomial.coefficient(i, k) * Math.pow(-p, k);
			}
		}
		return new Polynomial(result);
	}

	/**
	 * Vertical scaling: <code>k f(x)</code>.
	 */
	public Polynomial scale(double k) {
		double[] r = coeff.clone();
		for (int i = 0; i < r.length; i++) {
			r[i] = k * r[i];
		}
		return new Polynomial(r);
	}

	/**
	 * Horizontal scaling: <code>f(k x)</code>.
	 */
	public Polynomial scaleArgument(double k) {
		double[] r = coeff.clone();
		for (int i = 1; i < r.length; i++) {
			r[i] = Math.pow(k, i) * r[i];
		}
		return new Polynomial(r);
	}

	/**
	 * Whether any coefficient is strictly negative.
	 */
	public boolean hasNegativeCoefficient() {
		for (double c : coeff) {
			if (c < 0) {
				return true;
			}
		}
		return false;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Polynomial)) {
			return false;
		}
		return Arrays.equals(coeff, ((Polynomial) o).coeff);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(coeff);
	}

	@Override
	public String toString() {
		return PolynomialFormatter.format(this);
	}
}
