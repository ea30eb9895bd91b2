package com.github.micycle1.polyplot.critical;

public enum CriticalPointType {
	/**
	 * A root of the first derivative accepted as an extremum candidate.
	 */
	EXTREMUM,

	/**
	 * A root of the second derivative accepted as an inflection candidate.
	 */
	INFLECTION
}
