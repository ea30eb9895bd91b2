package com.github.micycle1.polyplot.roots;

import java.util.Comparator;

/**
 * An approximate real root accepted by the {@link NewtonRootFinder}.
 */
public final class Root {

	public static final Comparator<Root> BY_VALUE = Comparator.comparingDouble(Root::getValue);

	private final double value;
	private final int deflationStep; // number of deflations performed before this root was accepted
	private final int multiplicityIndex; // 1 on first acceptance, 2.. on re-acceptance at the same value
	private final boolean converged;

	public Root(double value, int deflationStep, int multiplicityIndex, boolean converged) {
		this.value = value;
		this.deflationStep = deflationStep;
		this.multiplicityIndex = multiplicityIndex;
		this.converged = converged;
	}

	public double getValue() {
		return value;
	}

	public int getDeflationStep() {
		return deflationStep;
	}

	/**
	 * Position of this root within a run of repeated acceptances of the same
	 * value. A root of multiplicity m that deflates cleanly yields indices 1..m.
	 */
	public int getMultiplicityIndex() {
		return multiplicityIndex;
	}

	/**
	 * Whether the Newton refinement that produced this root met its step
	 * tolerance (or hit an exact zero) before the iteration ceiling. Unconverged
	 * roots still passed the residual test but are low-confidence.
	 */
	public boolean isConverged() {
		return converged;
	}

	@Override
	public String toString() {
		return "Root[" + value + ", step=" + deflationStep + ", m=" + multiplicityIndex + (converged ? "" : ", unconverged") + "]";
	}
}
