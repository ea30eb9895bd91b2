package com.github.micycle1.polyplot.critical;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.polyplot.PolyConstants;
import com.github.micycle1.polyplot.polynomial.Polynomial;
import com.github.micycle1.polyplot.roots.NewtonRootFinder;

/**
 * Locates extremum and inflection candidates of a polynomial, used to choose an
 * informative viewing window.
 * <p>
 * Roots of the first derivative (R1) and of the second derivative (R2) are
 * generated once, then filtered while walking down the derivative chain. At
 * derivative order n, with d the current derivative and d' the previous one, a
 * candidate x is accepted when d(x) != 0 and |d'(x)| &lt; 1e-4, and
 * <ul>
 * <li>for R1: n &gt; 1 and n is even;</li>
 * <li>for R2: n &gt; 2 and n is odd.</li>
 * </ul>
 * The walk ends when d collapses to the zero polynomial. This is a heuristic
 * feature detector rather than a calculus-exact classification. A root of p'
 * where p'' does not vanish is accepted at n = 2; at deeper orders the gates
 * only look at higher derivatives, so the same x may be accepted again.
 */
public class CriticalPointLocator {

	private static final Logger LOGGER = LoggerFactory.getLogger(CriticalPointLocator.class);

	private final NewtonRootFinder rootFinder;

	public CriticalPointLocator() {
		this(new NewtonRootFinder());
	}

	public CriticalPointLocator(NewtonRootFinder rootFinder) {
		this.rootFinder = rootFinder;
	}

	/**
	 * @return accepted x-values in ascending order; extrema and inflection
	 *         candidates are mixed
	 */
	public double[] locate(Polynomial p) {
		List<CriticalPoint> points = locateDetailed(p);
		double[] xs = new double[points.size()];
		for (int i = 0; i < xs.length; i++) {
			xs[i] = points.get(i).getX();
		}
		return xs;
	}

	/**
	 * @return accepted points sorted by x
	 */
	public List<CriticalPoint> locateDetailed(Polynomial p) {
		final List<CriticalPoint> points = new ArrayList<>();
		if (p.degree() < 1) {
			return points;
		}

		final double[] r1 = rootFinder.findRoots(p.derivative());
		final double[] r2 = rootFinder.findRoots(p.derivative().derivative());

		Polynomial d = p.derivative();
		Polynomial dPrev = d.copy();
		LOGGER.debug("Candidates for {}: R1={} R2={}", p, r1.length, r2.length);

		int n = 1;
		while (!d.isZero()) {
			for (double x0 : r1) {
				if (passesGate(d, dPrev, x0) && n > 1 && n % 2 == 0) {
					points.add(new CriticalPoint(x0, n, CriticalPointType.EXTREMUM));
				}
			}
			for (double x0 : r2) {
				if (passesGate(d, dPrev, x0) && n > 2 && n % 2 != 0) {
					points.add(new CriticalPoint(x0, n, CriticalPointType.INFLECTION));
				}
			}
			dPrev = d.copy();
			d.differentiate();
			n++;
		}

		points.sort(CriticalPoint.BY_X);
		return points;
	}

	private static boolean passesGate(Polynomial d, Polynomial dPrev, double x0) {
		return d.evaluate(x0) != 0 && Math.abs(dPrev.evaluate(x0)) < PolyConstants.ZERO_VALUE;
	}
}
