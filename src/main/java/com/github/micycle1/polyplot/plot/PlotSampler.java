package com.github.micycle1.polyplot.plot;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.Validate;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;

import com.github.micycle1.polyplot.PolyConstants;
import com.github.micycle1.polyplot.bound.Bound;
import com.github.micycle1.polyplot.critical.CriticalPointLocator;
import com.github.micycle1.polyplot.polynomial.Polynomial;
import com.github.micycle1.polyplot.range.RangeSelector;
import com.github.micycle1.polyplot.roots.NewtonRootFinder;

/**
 * Samples a polynomial over its feature window for plotting. No drawing is done
 * here.
 */
public class PlotSampler {

	private final GeometryFactory geometryFactory;
	private final NewtonRootFinder rootFinder;
	private final CriticalPointLocator criticalPointLocator;
	private final RangeSelector rangeSelector;

	public PlotSampler() {
		this(new NewtonRootFinder());
	}

	public PlotSampler(NewtonRootFinder rootFinder) {
		this.geometryFactory = new GeometryFactory();
		this.rootFinder = rootFinder;
		this.criticalPointLocator = new CriticalPointLocator(rootFinder);
		this.rangeSelector = new RangeSelector(rootFinder, criticalPointLocator);
	}

	public PlotData sample(Polynomial p) {
		return sample(p, PolyConstants.DEFAULT_SAMPLES);
	}

	/**
	 * @param samples number of evenly spaced x-values, both window ends included
	 */
	public PlotData sample(Polynomial p, int samples) {
		return sample(p, rangeSelector.featureWindow(p), samples);
	}

	public PlotData sample(Polynomial p, Bound window, int samples) {
		Validate.isTrue(samples >= 2, "Need at least two samples, got %d", samples);

		Coordinate[] coords = new Coordinate[samples];
		double step = window.width() / (samples - 1);
		double minY = Double.POSITIVE_INFINITY;
		double maxY = Double.NEGATIVE_INFINITY;
		for (int i = 0; i < samples; i++) {
			double x = i == samples - 1 ? window.getHigh() : window.getLow() + i * step;
			double y = p.evaluate(x);
			coords[i] = new Coordinate(x, y);
			minY = Math.min(minY, y);
			maxY = Math.max(maxY, y);
		}
		if (minY == maxY) { // flat curve
			minY -= PolyConstants.FLAT_CURVE_PADDING;
			maxY += PolyConstants.FLAT_CURVE_PADDING;
		}
		LineString curve = geometryFactory.createLineString(coords);

		List<Coordinate> markers = new ArrayList<>();
		for (double x : criticalPointLocator.locate(p)) {
			markers.add(new Coordinate(x, p.evaluate(x)));
		}
		for (double x : rootFinder.findRoots(p)) {
			markers.add(new Coordinate(x, p.evaluate(x)));
		}

		return new PlotData(curve, markers, new Envelope(window.getLow(), window.getHigh(), minY, maxY));
	}
}
