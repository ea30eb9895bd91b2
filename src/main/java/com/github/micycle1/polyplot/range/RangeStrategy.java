package com.github.micycle1.polyplot.range;

public enum RangeStrategy {
	/**
	 * Cauchy circle: cheap and loose, contains every root.
	 */
	CAUCHY,

	/**
	 * Lagrange bound in four orientations: tighter than {@link #CAUCHY}.
	 */
	LAGRANGE,

	/**
	 * Span of the roots and critical points plus a margin; the window meant for
	 * a viewer.
	 */
	FEATURES
}
