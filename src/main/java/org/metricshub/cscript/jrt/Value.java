package org.metricshub.cscript.jrt;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * CScript
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * An immutable scalar handled by a CScript program: an integer, a float or a
 * string. Variables may hold values of any type and change type across
 * redefinitions.
 * <p>
 * Coercion rules:
 * <ul>
 * <li>{@code +} never adds: it concatenates the string forms of its operands
 * (see {@link #toString()}).
 * <li>{@code -}, {@code *}, {@code /} and {@code **} require two numeric
 * operands. Two integers give an integer, except for {@code /} (always a
 * float) and {@code **} with a negative exponent. Any float operand gives a
 * float.
 * <li>Integers and floats compare numerically with each other. Strings only
 * compare with strings.
 * </ul>
 */
public final class Value {

	/** Runtime type tag of a {@link Value}. */
	public enum Type {
		INTEGER("integer"),
		FLOAT("float"),
		STRING("string");

		private final String displayName;

		Type(String displayName) {
			this.displayName = displayName;
		}

		public String getDisplayName() {
			return displayName;
		}
	}

	/** Integer one, the result of a true condition. */
	public static final Value TRUE = new Value(Type.INTEGER, 1L, 0, null);

	/** Integer zero, the result of a false condition. */
	public static final Value FALSE = new Value(Type.INTEGER, 0L, 0, null);

	/** The empty string. */
	public static final Value EMPTY_STRING = new Value(Type.STRING, 0L, 0, "");

	private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?\\d+");
	private static final Pattern DECIMAL_PATTERN = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

	private final Type type;
	private final long longValue;
	private final double doubleValue;
	private final String stringValue;

	private Value(Type type, long longValue, double doubleValue, String stringValue) {
		this.type = type;
		this.longValue = longValue;
		this.doubleValue = doubleValue;
		this.stringValue = stringValue;
	}

	public static Value of(long value) {
		return new Value(Type.INTEGER, value, 0, null);
	}

	public static Value of(double value) {
		return new Value(Type.FLOAT, 0L, value, null);
	}

	public static Value of(String value) {
		if (value == null) {
			throw new IllegalArgumentException("String value must not be null");
		}
		return value.isEmpty() ? EMPTY_STRING : new Value(Type.STRING, 0L, 0, value);
	}

	public static Value of(boolean value) {
		return value ? TRUE : FALSE;
	}

	/**
	 * Converts a Java object (as found in bindings or pre-assigned variables)
	 * into a {@link Value}. Integral numbers become integers, other numbers
	 * floats, anything else its string form.
	 *
	 * @param o the object to convert
	 * @return the corresponding value
	 */
	public static Value fromObject(Object o) {
		if (o == null) {
			return EMPTY_STRING;
		}
		if (o instanceof Value) {
			return (Value) o;
		}
		if (o instanceof Long || o instanceof Integer || o instanceof Short || o instanceof Byte) {
			return of(((Number) o).longValue());
		}
		if (o instanceof Number) {
			return of(((Number) o).doubleValue());
		}
		return of(o.toString());
	}

	/**
	 * Deduces the type of raw text supplied from outside the program (an input
	 * value): integer if it is a run of decimal digits with an optional sign
	 * that fits in a long, else float if it is a plain decimal number with an
	 * optional exponent, else string. Surrounding blanks, type suffixes, hex
	 * literals and {@code NaN} are kept as strings.
	 *
	 * @param raw the raw text
	 * @return the typed value
	 */
	public static Value deduce(String raw) {
		if (raw == null) {
			return EMPTY_STRING;
		}
		if (INTEGER_PATTERN.matcher(raw).matches()) {
			try {
				return of(Long.parseLong(raw));
			} catch (NumberFormatException nfe) {
				// out of long range: read it as a float
			}
		}
		if (DECIMAL_PATTERN.matcher(raw).matches()) {
			return of(Double.parseDouble(raw));
		}
		return of(raw);
	}

	public Type getType() {
		return type;
	}

	public boolean isNumeric() {
		return type != Type.STRING;
	}

	public boolean isInteger() {
		return type == Type.INTEGER;
	}

	/**
	 * @return the numeric value as a double
	 * @throws IllegalStateException if this value is a string
	 */
	public double toDouble() {
		switch (type) {
		case INTEGER:
			return longValue;
		case FLOAT:
			return doubleValue;
		default:
			throw new IllegalStateException("Not a number: " + stringValue);
		}
	}

	/**
	 * @return the integer value
	 * @throws IllegalStateException if this value is not an integer
	 */
	public long toLong() {
		if (type != Type.INTEGER) {
			throw new IllegalStateException("Not an integer: " + this);
		}
		return longValue;
	}

	/**
	 * Zero, zero point zero and the empty string are false, everything else
	 * is true.
	 *
	 * @return the truth value of this value
	 */
	public boolean isTrue() {
		switch (type) {
		case INTEGER:
			return longValue != 0;
		case FLOAT:
			return doubleValue != 0.0;
		default:
			return !stringValue.isEmpty();
		}
	}

	/**
	 * Concatenates the string forms of both values.
	 *
	 * @param other right operand
	 * @return the concatenated string value
	 */
	public Value concat(Value other) {
		return of(toString() + other.toString());
	}

	public Value subtract(Value other) {
		checkNumeric("-", other);
		if (isInteger() && other.isInteger()) {
			try {
				return of(Math.subtractExact(longValue, other.longValue));
			} catch (ArithmeticException e) {
				throw new ScriptRuntimeException("Integer overflow", e);
			}
		}
		return of(toDouble() - other.toDouble());
	}

	public Value multiply(Value other) {
		checkNumeric("*", other);
		if (isInteger() && other.isInteger()) {
			try {
				return of(Math.multiplyExact(longValue, other.longValue));
			} catch (ArithmeticException e) {
				throw new ScriptRuntimeException("Integer overflow", e);
			}
		}
		return of(toDouble() * other.toDouble());
	}

	public Value divide(Value other) {
		checkNumeric("/", other);
		if (other.toDouble() == 0.0) {
			throw new ScriptRuntimeException("Division by zero");
		}
		return of(toDouble() / other.toDouble());
	}

	public Value power(Value other) {
		checkNumeric("**", other);
		if (isInteger() && other.isInteger() && other.longValue >= 0) {
			return of(integerPower(longValue, other.longValue));
		}
		if (toDouble() == 0.0 && other.toDouble() < 0) {
			throw new ScriptRuntimeException("Division by zero");
		}
		return of(Math.pow(toDouble(), other.toDouble()));
	}

	private static long integerPower(long base, long exponent) {
		long result = 1;
		long b = base;
		long e = exponent;
		try {
			while (e > 0) {
				if ((e & 1) == 1) {
					result = Math.multiplyExact(result, b);
				}
				e >>= 1;
				if (e > 0) {
					b = Math.multiplyExact(b, b);
				}
			}
		} catch (ArithmeticException ex) {
			throw new ScriptRuntimeException("Integer overflow", ex);
		}
		return result;
	}

	private void checkNumeric(String operator, Value other) {
		if (!isNumeric() || !other.isNumeric()) {
			throw new ScriptRuntimeException(
					"Unsupported operand types for "
							+ operator
							+ ": "
							+ type.getDisplayName()
							+ " and "
							+ other.type.getDisplayName());
		}
	}

	/**
	 * Orders this value against another one. Numbers are ordered numerically,
	 * strings lexicographically.
	 *
	 * @param other the value to compare with
	 * @param operator the comparison operator, used in the error message
	 * @return a negative integer, zero, or a positive integer
	 * @throws ScriptRuntimeException if a string is ordered against a number
	 */
	public int order(Value other, String operator) {
		if (isNumeric() && other.isNumeric()) {
			if (isInteger() && other.isInteger()) {
				return Long.compare(longValue, other.longValue);
			}
			return Double.compare(toDouble(), other.toDouble());
		}
		if (!isNumeric() && !other.isNumeric()) {
			return stringValue.compareTo(other.stringValue);
		}
		throw new ScriptRuntimeException(
				"'"
						+ operator
						+ "' not supported between "
						+ type.getDisplayName()
						+ " and "
						+ other.type.getDisplayName());
	}

	/**
	 * Equality as seen by the program: numbers compare numerically regardless
	 * of their type, strings by content, and a string never equals a number.
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Value)) {
			return false;
		}
		Value other = (Value) obj;
		if (isNumeric() && other.isNumeric()) {
			if (isInteger() && other.isInteger()) {
				return longValue == other.longValue;
			}
			return toDouble() == other.toDouble();
		}
		if (!isNumeric() && !other.isNumeric()) {
			return stringValue.equals(other.stringValue);
		}
		return false;
	}

	@Override
	public int hashCode() {
		if (isNumeric()) {
			// -0.0 equals 0.0
			return Double.hashCode(toDouble() + 0.0);
		}
		return stringValue.hashCode();
	}

	/**
	 * The printed form of this value: integers in decimal, strings as is, and
	 * floats in their shortest form with at least one decimal ({@code 2.0}),
	 * switching to scientific notation ({@code 1e+16}, {@code 1e-05}) for very
	 * large or very small magnitudes.
	 */
	@Override
	public String toString() {
		switch (type) {
		case INTEGER:
			return Long.toString(longValue);
		case FLOAT:
			return formatFloat(doubleValue);
		default:
			return stringValue;
		}
	}

	static String formatFloat(double d) {
		if (Double.isNaN(d)) {
			return "nan";
		}
		if (Double.isInfinite(d)) {
			return d > 0 ? "inf" : "-inf";
		}
		if (d == 0.0) {
			return 1 / d < 0 ? "-0.0" : "0.0";
		}
		BigDecimal decimal = shortestDecimal(d);
		int exponent = decimal.precision() - decimal.scale() - 1;
		if (exponent >= -4 && exponent < 16) {
			String plain = decimal.toPlainString();
			return plain.indexOf('.') < 0 ? plain + ".0" : plain;
		}
		String digits = decimal.unscaledValue().abs().toString();
		StringBuilder sb = new StringBuilder();
		if (d < 0) {
			sb.append('-');
		}
		sb.append(digits.charAt(0));
		if (digits.length() > 1) {
			sb.append('.').append(digits, 1, digits.length());
		}
		sb.append('e').append(exponent < 0 ? '-' : '+');
		int absExponent = Math.abs(exponent);
		if (absExponent < 10) {
			sb.append('0');
		}
		sb.append(absExponent);
		return sb.toString();
	}

	/**
	 * Fewest significant digits that still read back as {@code d}.
	 */
	private static BigDecimal shortestDecimal(double d) {
		BigDecimal exact = new BigDecimal(d);
		for (int precision = 1; precision < 17; precision++) {
			BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
			if (Double.parseDouble(candidate.toString()) == d) {
				return candidate.stripTrailingZeros();
			}
		}
		return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros();
	}
}
