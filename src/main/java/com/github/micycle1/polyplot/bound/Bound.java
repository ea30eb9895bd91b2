package com.github.micycle1.polyplot.bound;

import java.util.Objects;

import com.github.micycle1.polyplot.PolyConstants;

/**
 * A closed real interval [low, high], used both for root-containing bounds and
 * for viewing windows.
 */
public final class Bound {

	/** Fallback interval for constant polynomials and empty feature sets. */
	public static final Bound DEFAULT = new Bound(PolyConstants.DEFAULT_LOW, PolyConstants.DEFAULT_HIGH);

	private final double low;
	private final double high;

	public Bound(double low, double high) {
		if (Double.isNaN(low) || Double.isNaN(high)) {
			throw new IllegalArgumentException("Bound limits must not be NaN");
		}
		if (low > high) {
			throw new IllegalArgumentException("Lower limit " + low + " exceeds upper limit " + high);
		}
		this.low = low;
		this.high = high;
	}

	/**
	 * Symmetric interval [-radius, radius].
	 */
	public static Bound symmetric(double radius) {
		return new Bound(-radius, radius);
	}

	public double getLow() {
		return low;
	}

	public double getHigh() {
		return high;
	}

	public double width() {
		return high - low;
	}

	public boolean contains(double x) {
		return contains(x, 0);
	}

	/**
	 * @param tolerance slack allowed on both ends
	 */
	public boolean contains(double x, double tolerance) {
		return x >= low - tolerance && x <= high + tolerance;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Bound)) {
			return false;
		}
		Bound other = (Bound) o;
		return Double.compare(low, other.low) == 0 && Double.compare(high, other.high) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(low, high);
	}

	@Override
	public String toString() {
		return String.format("[%.6f, %.6f]", low, high);
	}
}
