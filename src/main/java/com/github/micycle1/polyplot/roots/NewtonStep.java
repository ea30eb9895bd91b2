package com.github.micycle1.polyplot.roots;

/**
 * Outcome of a single Newton-Raphson refinement.
 */
public final class NewtonStep {

	private final double value;
	private final int iterations;
	private final boolean converged;

	NewtonStep(double value, int iterations, boolean converged) {
		this.value = value;
		this.iterations = iterations;
		this.converged = converged;
	}

	/** The last iterate, whether or not it converged. */
	public double getValue() {
		return value;
	}

	public int getIterations() {
		return iterations;
	}

	public boolean isConverged() {
		return converged;
	}

	@Override
	public String toString() {
		return String.format("NewtonStep[x=%.12f, iterations=%d, converged=%s]", value, iterations, converged);
	}
}
