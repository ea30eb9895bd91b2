package com.github.micycle1.polyplot.critical;

import java.util.Comparator;
import java.util.Objects;

/**
 * An x-value flagged by the {@link CriticalPointLocator}, tagged with the
 * derivative order at which it passed the acceptance gate.
 */
public final class CriticalPoint {

	public static final Comparator<CriticalPoint> BY_X = Comparator.comparingDouble(CriticalPoint::getX);

	private final double x;
	private final int derivativeOrder;
	private final CriticalPointType type;

	public CriticalPoint(double x, int derivativeOrder, CriticalPointType type) {
		this.x = x;
		this.derivativeOrder = derivativeOrder;
		this.type = Objects.requireNonNull(type);
	}

	public double getX() {
		return x;
	}

	public int getDerivativeOrder() {
		return derivativeOrder;
	}

	public CriticalPointType getType() {
		return type;
	}

	@Override
	public String toString() {
		return type + "[x=" + x + ", order=" + derivativeOrder + "]";
	}
}
