package com.github.micycle1.polyplot.roots;

import org.apache.commons.lang3.Validate;

import com.github.micycle1.polyplot.PolyConstants;

/**
 * Tolerances and ceilings for the {@link NewtonRootFinder}.
 * <p>
 * The iteration ceiling and the repeat cap are the only guards against runaway
 * computation; by default both scale with the polynomial (length squared Newton
 * steps per refinement, length acceptances per root). Setting a fixed ceiling
 * bounds worst-case latency regardless of the input.
 */
public final class RootFinderSettings {

	/** Marker for "derive from the polynomial length". */
	public static final int AUTO = 0;

	private final double residualTolerance;
	private final double stepTolerance;
	private final double perturbation;
	private final int maxIterations;
	private final int maxRepeats;

	private RootFinderSettings(Builder builder) {
		this.residualTolerance = builder.residualTolerance;
		this.stepTolerance = builder.stepTolerance;
		this.perturbation = builder.perturbation;
		this.maxIterations = builder.maxIterations;
		this.maxRepeats = builder.maxRepeats;
	}

	public static Builder builder() {
		return new Builder();
	}

	public static RootFinderSettings defaults() {
		return builder().build();
	}

	/**
	 * |p(x)| below which an iterate is accepted as a root.
	 */
	public double getResidualTolerance() {
		return residualTolerance;
	}

	/**
	 * |x0 - x1| below which Newton iteration stops.
	 */
	public double getStepTolerance() {
		return stepTolerance;
	}

	public double getPerturbation() {
		return perturbation;
	}

	/**
	 * Newton step ceiling for a polynomial with the given number of coefficients.
	 */
	public int maxIterationsFor(int length) {
		return maxIterations == AUTO ? length * length : maxIterations;
	}

	/**
	 * Ceiling on repeated acceptances of the same root, for a polynomial with the
	 * given number of coefficients.
	 */
	public int maxRepeatsFor(int length) {
		return maxRepeats == AUTO ? length : maxRepeats;
	}

	@Override
	public String toString() {
		return "RootFinderSettings[residual=" + residualTolerance + ", step=" + stepTolerance + ", perturbation=" + perturbation
				+ ", maxIterations=" + (maxIterations == AUTO ? "auto" : maxIterations) + ", maxRepeats="
				+ (maxRepeats == AUTO ? "auto" : maxRepeats) + "]";
	}

	public static final class Builder {

		private double residualTolerance = PolyConstants.ZERO_VALUE;
		private double stepTolerance = PolyConstants.NEWTON_STEP_TOL;
		private double perturbation = PolyConstants.NEWTON_PERTURBATION;
		private int maxIterations = AUTO;
		private int maxRepeats = AUTO;

		private Builder() {
		}

		public Builder residualTolerance(double residualTolerance) {
			Validate.isTrue(residualTolerance > 0, "Residual tolerance must be positive");
			this.residualTolerance = residualTolerance;
			return this;
		}

		public Builder stepTolerance(double stepTolerance) {
			Validate.isTrue(stepTolerance >= 0, "Step tolerance must not be negative");
			this.stepTolerance = stepTolerance;
			return this;
		}

		public Builder perturbation(double perturbation) {
			Validate.isTrue(perturbation != 0, "Perturbation must be non-zero");
			this.perturbation = perturbation;
			return this;
		}

		/**
		 * @param maxIterations fixed Newton step ceiling, or {@link #AUTO}
		 */
		public Builder maxIterations(int maxIterations) {
			Validate.isTrue(maxIterations >= 0, "Iteration ceiling must not be negative");
			this.maxIterations = maxIterations;
			return this;
		}

		/**
		 * @param maxRepeats fixed per-root acceptance cap, or {@link #AUTO}
		 */
		public Builder maxRepeats(int maxRepeats) {
			Validate.isTrue(maxRepeats >= 0, "Repeat cap must not be negative");
			this.maxRepeats = maxRepeats;
			return this;
		}

		public RootFinderSettings build() {
			return new RootFinderSettings(this);
		}
	}
}
