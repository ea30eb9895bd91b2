package com.github.micycle1.polyplot;

import java.util.List;

import com.github.micycle1.polyplot.bound.Bound;
import com.github.micycle1.polyplot.critical.CriticalPoint;
import com.github.micycle1.polyplot.polynomial.Polynomial;
import com.github.micycle1.polyplot.roots.Root;

public class PolynomialAnalysis {

	private final Polynomial polynomial;
	private final List<Root> roots;
	private final List<CriticalPoint> criticalPoints;
	private final Bound rootBound;
	private final Bound window;

	public PolynomialAnalysis(Polynomial polynomial, List<Root> roots, List<CriticalPoint> criticalPoints, Bound rootBound, Bound window) {
		this.polynomial = polynomial.copy();
		this.roots = List.copyOf(roots);
		this.criticalPoints = List.copyOf(criticalPoints);
		this.rootBound = rootBound;
		this.window = window;
	}

	public Polynomial getPolynomial() {
		return polynomial.copy();
	}

	public List<Root> getRoots() {
		return roots;
	}

	public List<CriticalPoint> getCriticalPoints() {
		return criticalPoints;
	}

	/**
	 * Cauchy interval containing every root.
	 */
	public Bound getRootBound() {
		return rootBound;
	}

	/**
	 * Feature window for display.
	 */
	public Bound getWindow() {
		return window;
	}

	/**
	 * Whether every accepted root came from a converged Newton refinement.
	 */
	public boolean isConverged() {
		return roots.stream().allMatch(Root::isConverged);
	}

	@Override
	public String toString() {
		return "PolynomialAnalysis[" + polynomial + ", roots=" + roots.size() + ", criticalPoints=" + criticalPoints.size() + ", window="
				+ window + "]";
	}
}
