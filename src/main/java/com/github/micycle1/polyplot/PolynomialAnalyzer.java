package com.github.micycle1.polyplot;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.polyplot.bound.Bound;
import com.github.micycle1.polyplot.bound.BoundEstimator;
import com.github.micycle1.polyplot.critical.CriticalPoint;
import com.github.micycle1.polyplot.critical.CriticalPointLocator;
import com.github.micycle1.polyplot.parse.PolynomialParseException;
import com.github.micycle1.polyplot.parse.PolynomialParser;
import com.github.micycle1.polyplot.polynomial.Polynomial;
import com.github.micycle1.polyplot.range.RangeSelector;
import com.github.micycle1.polyplot.roots.NewtonRootFinder;
import com.github.micycle1.polyplot.roots.Root;
import com.github.micycle1.polyplot.roots.RootFinderSettings;

/**
 * Runs the whole pipeline for one polynomial: roots, critical points, the
 * Cauchy root bound and the feature window.
 */
public class PolynomialAnalyzer {

	private static final Logger LOGGER = LoggerFactory.getLogger(PolynomialAnalyzer.class);

	private final NewtonRootFinder rootFinder;
	private final CriticalPointLocator criticalPointLocator;
	private final RangeSelector rangeSelector;

	public PolynomialAnalyzer() {
		this(RootFinderSettings.defaults());
	}

	public PolynomialAnalyzer(RootFinderSettings settings) {
		this.rootFinder = new NewtonRootFinder(settings);
		this.criticalPointLocator = new CriticalPointLocator(rootFinder);
		this.rangeSelector = new RangeSelector(rootFinder, criticalPointLocator);
	}

	public PolynomialAnalysis analyze(String text) throws PolynomialParseException {
		return analyze(PolynomialParser.parse(text));
	}

	public PolynomialAnalysis analyze(Polynomial p) {
		List<Root> roots = rootFinder.findRootDetails(p);
		List<CriticalPoint> points = criticalPointLocator.locateDetailed(p);
		Bound rootBound = BoundEstimator.cauchy(p);
		Bound window = rangeSelector.featureWindow(p);

		PolynomialAnalysis analysis = new PolynomialAnalysis(p, roots, points, rootBound, window);
		if (!analysis.isConverged()) {
			LOGGER.warn("Some roots of {} come from unconverged Newton iterations", p);
		}
		LOGGER.info("Analysed {}: {} roots, {} critical points, window {}", p, roots.size(), points.size(), window);
		return analysis;
	}
}
