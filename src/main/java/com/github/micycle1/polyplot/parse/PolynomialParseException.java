package com.github.micycle1.polyplot.parse;

/**
 * Thrown when text cannot be turned into a polynomial.
 */
public class PolynomialParseException extends Exception {

	private static final long serialVersionUID = 1L;

	private final String input;

	public PolynomialParseException(String message, String input) {
		super(message + ": \"" + input + "\"");
		this.input = input;
	}

	public PolynomialParseException(String message, String input, Throwable cause) {
		super(message + ": \"" + input + "\"", cause);
		this.input = input;
	}

	/**
	 * The offending text (the whole input, or the single term that failed).
	 */
	public String getInput() {
		return input;
	}
}
