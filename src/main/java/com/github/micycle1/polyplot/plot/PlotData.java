package com.github.micycle1.polyplot.plot;

import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.LineString;

/**
 * Everything a renderer needs to draw a polynomial: the sampled curve, the
 * marker points (roots and critical points) and the frame to show.
 */
public class PlotData {

	private final LineString curve;
	private final List<Coordinate> markers;
	private final Envelope frame;

	public PlotData(LineString curve, List<Coordinate> markers, Envelope frame) {
		this.curve = curve;
		this.markers = List.copyOf(markers);
		this.frame = frame;
	}

	public LineString getCurve() {
		return curve;
	}

	public Coordinate[] getSamples() {
		return curve.getCoordinates();
	}

	public List<Coordinate> getMarkers() {
		return markers;
	}

	public Envelope getFrame() {
		return frame;
	}
}
