package com.github.micycle1.polyplot.range;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.github.micycle1.polyplot.bound.Bound;
import com.github.micycle1.polyplot.bound.BoundEstimator;
import com.github.micycle1.polyplot.critical.CriticalPointLocator;
import com.github.micycle1.polyplot.polynomial.Polynomial;
import com.github.micycle1.polyplot.roots.NewtonRootFinder;

class RangeSelectorTest {

	private static final double DELTA = 1e-9;

	@Nested
	class MarginRules {

		private final NewtonRootFinder rootFinder = mock(NewtonRootFinder.class);
		private final CriticalPointLocator locator = mock(CriticalPointLocator.class);

		private final Polynomial anyCubic = new Polynomial(1, 2, 3, 4);

		@Test
		void wideSpanGetsTenPercentMargin() {
			when(rootFinder.findRoots(any())).thenReturn(new double[] { -10, 5 });
			when(locator.locate(any())).thenReturn(new double[] { 10 });
			Bound window = new RangeSelector(rootFinder, locator).featureWindow(anyCubic);
			assertBound(-12, 12, window);
		}

		@Test
		void narrowSpanGetsMarginOfTwo() {
			when(rootFinder.findRoots(any())).thenReturn(new double[] { 1 });
			when(locator.locate(any())).thenReturn(new double[] { 3 });
			// 10% of 2 is under 1
			assertBound(-1, 5, new RangeSelector(rootFinder, locator).featureWindow(anyCubic));
		}

		@Test
		void noFeaturesUsesDefaultSpanPlusMargin() {
			when(rootFinder.findRoots(any())).thenReturn(new double[0]);
			when(locator.locate(any())).thenReturn(new double[0]);
			assertBound(-6, 6, new RangeSelector(rootFinder, locator).featureWindow(anyCubic));
		}

		@Test
		void constantSkipsTheSearch() {
			assertEquals(Bound.DEFAULT, new RangeSelector(rootFinder, locator).featureWindow(new Polynomial(3)));
			verify(rootFinder, never()).findRoots(any());
			verify(locator, never()).locate(any());
		}
	}

	@Test
	void strategiesDispatch() {
		RangeSelector selector = new RangeSelector();
		Polynomial p = new Polynomial(-6, 11, -6, 1);
		assertEquals(BoundEstimator.cauchy(p), selector.select(p, RangeStrategy.CAUCHY));
		assertEquals(BoundEstimator.lagrange(p), selector.select(p, RangeStrategy.LAGRANGE));
		assertEquals(selector.featureWindow(p), selector.select(p, RangeStrategy.FEATURES));
	}

	@Test
	void featureWindowOfConcretePolynomials() {
		RangeSelector selector = new RangeSelector();
		// roots 1, 2, 3 span 2 -> margin 2
		assertBound(-1, 5, selector.featureWindow(new Polynomial(-6, 11, -6, 1)));
		// roots -2, 2 and minimum at 0
		assertBound(-4, 4, selector.featureWindow(new Polynomial(-4, 0, 1)));
		// no roots, minimum at 0
		assertBound(-2, 2, selector.featureWindow(new Polynomial(1, 0, 1)));
		// single root 1.5
		assertBound(-0.5, 3.5, selector.featureWindow(new Polynomial(3, -2)));
		assertEquals(Bound.DEFAULT, selector.featureWindow(new Polynomial(5)));
	}

	@Test
	void featureWindowCoversRootsAndPoints() {
		// x - 6x^4 - x^5: roots span [-6.0046, 0.5349], the critical points lie inside
		// and 10% of the span is under 1
		Bound window = new RangeSelector().featureWindow(new Polynomial(0, 1, 0, 0, -6, -1));
		assertBound(-8.004618954047, 2.534877324554, window);
	}

	private static void assertBound(double low, double high, Bound actual) {
		assertEquals(low, actual.getLow(), DELTA, "low of " + actual);
		assertEquals(high, actual.getHigh(), DELTA, "high of " + actual);
	}
}
