package com.github.micycle1.polyplot.polynomial;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PolynomialTest {

	private static final double DELTA = 1e-12;

	// 1 - x
	private final Polynomial p1 = new Polynomial(1, -1);
	// x - 6x^4 - x^5
	private final Polynomial p2 = new Polynomial(0, 1, 0, 0, -6, -1);

	@Nested
	@DisplayName("Arithmetic")
	class Arithmetic {

		@Test
		void addPadsShorterOperand() {
			assertArrayEquals(new double[] { 1, 0, 0, 0, -6, -1 }, p1.add(p2).coefficients(), DELTA);
			assertArrayEquals(new double[] { 1, 0, 0, 0, -6, -1 }, p2.add(p1).coefficients(), DELTA);
		}

		@Test
		void multiplyConvolves() {
			Polynomial product = p1.multiply(p2);
			assertEquals(p1.length() + p2.length() - 1, product.length());
			assertArrayEquals(new double[] { 0, 1, -1, 0, -6, 5, 1 }, product.coefficients(), DELTA);
		}

		@Test
		void operandsAreNotModified() {
			p1.add(p2);
			p1.multiply(p2);
			assertArrayEquals(new double[] { 1, -1 }, p1.coefficients(), 0);
			assertArrayEquals(new double[] { 0, 1, 0, 0, -6, -1 }, p2.coefficients(), 0);
		}
	}

	@Nested
	@DisplayName("Differentiation")
	class Differentiation {

		@Test
		void derivativeIsPure() {
			Polynomial d = p2.derivative();
			assertArrayEquals(new double[] { 1, 0, 0, -24, -5 }, d.coefficients(), 0);
			assertArrayEquals(new double[] { 0, 1, 0, 0, -6, -1 }, p2.coefficients(), 0);
			assertNotSame(p2, d);
		}

		@Test
		void differentiateMutatesReceiver() {
			Polynomial p = new Polynomial(0, 1, 0, 0, -6, -1);
			Polynomial expected = p.derivative();
			p.differentiate();
			assertEquals(expected, p);
			assertEquals(4, p.degree());
		}

		@Test
		void constantCollapsesToZeroPolynomial() {
			Polynomial p = new Polynomial(7);
			p.differentiate();
			assertTrue(p.isZero());
			p.differentiate();
			assertTrue(p.isZero());
			assertEquals(1, p.length());
		}

		@Test
		void repeatedDifferentiationEndsInZero() {
			Polynomial p = new Polynomial(1, 2, 3, 4);
			int steps = 0;
			while (!p.isZero()) {
				p.differentiate();
				steps++;
			}
			assertEquals(4, steps);
		}
	}

	@Nested
	@DisplayName("Horner table")
	class HornerTable {

		@Test
		void evaluateMatchesDirectSum() {
			// x - 6x^4 - x^5 at 2 = 2 - 96 - 32
			assertEquals(-126, p2.evaluate(2), DELTA);
			assertEquals(1, p1.evaluate(0), DELTA);
			assertEquals(3.5, new Polynomial(3.5).evaluate(100), DELTA);
		}

		@Test
		void tableHoldsQuotientAndRemainder() {
			// x^2 - 4 = (x - 2)(x + 2) + 0
			double[] table = new Polynomial(-4, 0, 1).horner(2);
			assertArrayEquals(new double[] { 2, 1, 0 }, table, DELTA);
			// x^2 + 1 = (x - 1)(x + 1) + 2
			assertArrayEquals(new double[] { 1, 1, 2 }, new Polynomial(1, 0, 1).horner(1), DELTA);
		}

		@Test
		void deflateDividesOutRoot() {
			// (x-1)(x-2)(x-3)
			Polynomial cubic = new Polynomial(-6, 11, -6, 1);
			Polynomial quotient = cubic.deflate(3);
			assertArrayEquals(new double[] { 2, -3, 1 }, quotient.coefficients(), DELTA);
			assertEquals(0, cubic.remainder(3), DELTA);
		}

		@Test
		void deflateRejectsConstant() {
			assertThrows(IllegalStateException.class, () -> new Polynomial(4).deflate(1));
		}
	}

	@Nested
	@DisplayName("Transforms")
	class Transforms {

		@Test
		void signedZerosCompareEqual() {
			Polynomial reflected = new Polynomial(0, 1).reflectAboutX();
			assertEquals(new Polynomial(0, -1), reflected);
			assertEquals(new Polynomial(0, -1).hashCode(), reflected.hashCode());
			assertEquals(new Polynomial(0), new Polynomial(-0.0));
		}

		@Test
		void reflections() {
			Polynomial p = new Polynomial(1, 2, 3, 4);
			assertArrayEquals(new double[] { -1, -2, -3, -4 }, p.reflectAboutX().coefficients(), 0);
			assertArrayEquals(new double[] { 1, -2, 3, -4 }, p.reflectAboutY().coefficients(), 0);
			assertEquals(p.evaluate(-1.5), p.reflectAboutY().evaluate(1.5), DELTA);
		}

		@Test
		void translateShiftsGraph() {
			// x^2 moved by (1, 2): (x-1)^2 + 2 = x^2 - 2x + 3
			Polynomial t = new Polynomial(0, 0, 1).translate(1, 2);
			assertArrayEquals(new double[] { 3, -2, 1 }, t.coefficients(), DELTA);

			Polynomial p = new Polynomial(2, -1, 0, 0.5);
			Polynomial moved = p.translate(-0.75, 4);
			for (double x = -3; x <= 3; x += 0.5) {
				assertEquals(p.evaluate(x + 0.75) + 4, moved.evaluate(x), 1e-9);
			}
		}

		@Test
		void scaling() {
			Polynomial p = new Polynomial(1, 1, 1);
			assertArrayEquals(new double[] { 3, 3, 3 }, p.scale(3).coefficients(), 0);
			assertArrayEquals(new double[] { 1, 2, 4 }, p.scaleArgument(2).coefficients(), 0);
		}

		@Test
		void reverse() {
			assertArrayEquals(new double[] { 3, 2, 1 }, new Polynomial(1, 2, 3).reverse().coefficients(), 0);
		}
	}

	@Test
	void rejectsInvalidStructure() {
		assertThrows(IllegalArgumentException.class, () -> new Polynomial());
		assertThrows(IllegalArgumentException.class, () -> new Polynomial((double[]) null));
		assertThrows(IllegalArgumentException.class, () -> new Polynomial(1, Double.NaN));
		assertThrows(IllegalArgumentException.class, () -> new Polynomial(Double.POSITIVE_INFINITY));
	}

	@Test
	void topZeroIsNotTrimmed() {
		Polynomial p = new Polynomial(1, 2, 0);
		assertEquals(2, p.degree());
		assertFalse(p.isZero());
		assertTrue(new Polynomial(0).isZero());
		assertFalse(new Polynomial(0, 0).isZero());
	}

	@Test
	void coefficientsAreCopied() {
		double[] c = { 1, 2 };
		Polynomial p = new Polynomial(c);
		c[0] = 99;
		p.coefficients()[1] = 99;
		assertArrayEquals(new double[] { 1, 2 }, p.coefficients(), 0);
		assertEquals(0, p.coefficient(5), 0);
	}
}
