package com.github.micycle1.polyplot.roots;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.polyplot.PolyConstants;
import com.github.micycle1.polyplot.bound.Bound;
import com.github.micycle1.polyplot.bound.BoundEstimator;
import com.github.micycle1.polyplot.polynomial.Polynomial;

/**
 * Finds real roots with Newton-Raphson iteration and synthetic deflation.
 * <p>
 * The first search starts at the Lagrange bound on the positive roots (or 0);
 * each later search starts at the last accepted root. Every accepted root is
 * divided out of a working polynomial and then tested again against the
 * quotient, so a root of multiplicity m is reported up to m times. A candidate
 * outside the Cauchy bound of the input is never accepted; the next attempt
 * starts from it instead. This is a
 * bounded heuristic: widely separated roots or a vanishing derivative can leave
 * roots unreported, but the search always terminates.
 */
public class NewtonRootFinder {

	private static final Logger LOGGER = LoggerFactory.getLogger(NewtonRootFinder.class);

	private final RootFinderSettings settings;

	public NewtonRootFinder() {
		this(RootFinderSettings.defaults());
	}

	public NewtonRootFinder(RootFinderSettings settings) {
		this.settings = settings;
	}

	public RootFinderSettings getSettings() {
		return settings;
	}

	/**
	 * @return approximate real roots in ascending order, repeated per accepted
	 *         multiplicity
	 */
	public double[] findRoots(Polynomial p) {
		List<Root> roots = findRootDetails(p);
		double[] values = new double[roots.size()];
		for (int i = 0; i < values.length; i++) {
			values[i] = roots.get(i).getValue();
		}
		return values;
	}

	/**
	 * As {@link #findRoots(Polynomial)}, with the provenance of every root.
	 *
	 * @return roots sorted by value
	 */
	public List<Root> findRootDetails(Polynomial p) {
		final List<Root> roots = new ArrayList<>();
		final int maxAttempts = p.length();
		final Bound cauchy = BoundEstimator.cauchy(p);

		Polynomial working = p.copy();
		double root = BoundEstimator.lagrangeUpper(p).orElse(0);
		int attempts = 0;

		while (working.degree() > 0 && attempts <= maxAttempts) {
			attempts++;
			NewtonStep step = refine(working, root, settings.maxIterationsFor(working.length()));
			root = step.getValue();
			if (!cauchy.contains(root)) {
				LOGGER.debug("Rejected candidate {} outside {} for {}", root, cauchy, p);
				continue;
			}

			final int maxRepeats = settings.maxRepeatsFor(p.length());
			int repeats = 0;
			while (working.degree() > 0 && repeats < maxRepeats && Math.abs(working.evaluate(root)) < settings.getResidualTolerance()) {
				root = round(root);
				repeats++;
				roots.add(new Root(root, roots.size(), repeats, step.isConverged()));
				working = working.deflate(root);
				LOGGER.debug("Accepted root {} (x{}), remaining polynomial {}", root, repeats, working);
			}
			if (repeats == maxRepeats && maxRepeats > 0) {
				LOGGER.warn("Root {} accepted {} times; repeat cap reached for {}", root, repeats, p);
			}
		}

		if (working.degree() > 0) {
			LOGGER.debug("Stopped after {} attempts with unresolved factor {} of {}", attempts, working, p);
		}

		roots.sort(Root.BY_VALUE);
		return roots;
	}

	/**
	 * Refines a single root by Newton-Raphson iteration from <code>start</code>.
	 * <p>
	 * Stops when p(x) is exactly zero, when two successive iterates differ by less
	 * than the step tolerance, or after <code>maxSteps</code> steps. If the
	 * derivative vanishes at an iterate the iterate is shifted by the perturbation
	 * and the step is retried once; if it still vanishes the current iterate is
	 * returned as unconverged.
	 *
	 * @return the last iterate; an exhausted ceiling is reported through
	 *         {@link NewtonStep#isConverged()} rather than an exception
	 */
	public NewtonStep refine(Polynomial poly, double start, int maxSteps) {
		final Polynomial der = poly.derivative();
		double x1 = start;
		for (int k = 0; k < maxSteps; k++) {
			if (poly.evaluate(x1) == 0) {
				return new NewtonStep(x1, k, true);
			}
			double x0 = x1;
			double slope = der.evaluate(x0);
			if (slope == 0) {
				x0 = x1 - settings.getPerturbation();
				slope = der.evaluate(x0);
				if (slope == 0) {
					LOGGER.debug("Derivative of {} vanishes at {} and {}", poly, x1, x0);
					return new NewtonStep(x1, k + 1, false);
				}
			}
			x1 = x0 - poly.evaluate(x0) / slope;
			if (Math.abs(x0 - x1) < settings.getStepTolerance()) {
				return new NewtonStep(x1, k + 1, true);
			}
		}
		LOGGER.debug("Newton iteration on {} from {} hit the ceiling of {} steps at {}", poly, start, maxSteps, x1);
		return new NewtonStep(x1, maxSteps, false);
	}

	/**
	 * Rounds the exact binary value half-even to {@link PolyConstants#ROOT_SCALE}
	 * decimal places.
	 */
	static double round(double x) {
		return new BigDecimal(x).setScale(PolyConstants.ROOT_SCALE, RoundingMode.HALF_EVEN).doubleValue();
	}
}
