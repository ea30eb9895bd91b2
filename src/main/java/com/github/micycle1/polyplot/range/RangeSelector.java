package com.github.micycle1.polyplot.range;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.polyplot.PolyConstants;
import com.github.micycle1.polyplot.bound.Bound;
import com.github.micycle1.polyplot.bound.BoundEstimator;
import com.github.micycle1.polyplot.critical.CriticalPointLocator;
import com.github.micycle1.polyplot.polynomial.Polynomial;
import com.github.micycle1.polyplot.roots.NewtonRootFinder;

/**
 * Chooses the x interval in which to display a polynomial.
 */
public class RangeSelector {

	private static final Logger LOGGER = LoggerFactory.getLogger(RangeSelector.class);

	private final NewtonRootFinder rootFinder;
	private final CriticalPointLocator criticalPointLocator;

	public RangeSelector() {
		this(new NewtonRootFinder());
	}

	public RangeSelector(NewtonRootFinder rootFinder) {
		this(rootFinder, new CriticalPointLocator(rootFinder));
	}

	public RangeSelector(NewtonRootFinder rootFinder, CriticalPointLocator criticalPointLocator) {
		this.rootFinder = rootFinder;
		this.criticalPointLocator = criticalPointLocator;
	}

	public Bound select(Polynomial p, RangeStrategy strategy) {
		switch (strategy) {
			case CAUCHY:
				return BoundEstimator.cauchy(p);
			case LAGRANGE:
				return BoundEstimator.lagrange(p);
			case FEATURES:
				return featureWindow(p);
			default:
				throw new IllegalArgumentException("Unknown range strategy: " + strategy);
		}
	}

	/**
	 * The span of all roots and critical points, widened by 10% of its width on
	 * each side. A margin under 1 is replaced by 2. A constant polynomial gets
	 * {@link Bound#DEFAULT}; a polynomial with no features gets the default span
	 * plus its margin.
	 */
	public Bound featureWindow(Polynomial p) {
		if (p.degree() < 1) {
			return Bound.DEFAULT;
		}
		double[] roots = rootFinder.findRoots(p);
		double[] points = criticalPointLocator.locate(p);

		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (double x : roots) {
			min = Math.min(min, x);
			max = Math.max(max, x);
		}
		for (double x : points) {
			min = Math.min(min, x);
			max = Math.max(max, x);
		}
		if (roots.length + points.length == 0) {
			min = PolyConstants.DEFAULT_LOW;
			max = PolyConstants.DEFAULT_HIGH;
		}

		double margin = PolyConstants.WINDOW_MARGIN_RATIO * (max - min);
		if (margin < PolyConstants.MIN_WINDOW_MARGIN) {
			margin = PolyConstants.FALLBACK_WINDOW_MARGIN;
		}
		LOGGER.debug("Window for {} from {} roots and {} critical points: [{}, {}] +/- {}", p, roots.length, points.length, min, max,
				margin);
		return new Bound(min - margin, max + margin);
	}
}
