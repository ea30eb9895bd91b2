package com.github.micycle1.polyplot;

public class PolyConstants {

	/**
	 * Residual below which a refined Newton iterate is accepted as a root (and
	 * below which a derivative is considered to vanish at a critical point).
	 */
	public static final double ZERO_VALUE = 1e-4;
	// step size below which two consecutive Newton iterates are considered equal
	public static final double NEWTON_STEP_TOL = 1e-16;
	// shift applied to an iterate when the derivative vanishes there
	public static final double NEWTON_PERTURBATION = 1e-8;
	public static final double NTH_ROOT_TOL = 1e-7;
	public static final int NTH_ROOT_MAX_ITERATIONS = 10_000;
	// accepted roots are rounded to this many decimal places
	public static final int ROOT_SCALE = 12;

	public static final double DEFAULT_LOW = -5;
	public static final double DEFAULT_HIGH = 5;
	public static final double WINDOW_MARGIN_RATIO = 0.1;
	public static final double MIN_WINDOW_MARGIN = 1;
	public static final double FALLBACK_WINDOW_MARGIN = 2;
	// y padding of the plot frame when the curve is flat
	public static final double FLAT_CURVE_PADDING = 5;
	public static final int DEFAULT_SAMPLES = 10_000;
}
