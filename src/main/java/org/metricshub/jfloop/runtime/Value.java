package org.metricshub.jfloop.runtime;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jfloop
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
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

import java.math.BigInteger;

/**
 * A runtime value of the Floop language.
 * <p>
 * Values are immutable and come in three flavors:
 * <ul>
 * <li>{@link IntegerValue}: a non-negative integer of arbitrary size
 * <li>{@link BooleanValue}: <code>YES</code> or <code>NO</code>
 * <li>{@link CellReference}: the designator of a cell, produced only
 * as the target of an assignment and never stored in a cell
 * </ul>
 * Equality is structural within a flavor. Values of different flavors are
 * never equal; comparing them with the <code>=</code> operator is a type
 * error raised by the interpreter, not by this class.
 */
public abstract class Value {

	/** Runtime tag of a value. */
	public enum Type {
		INTEGER,
		BOOLEAN,
		CELL_REFERENCE
	}

	/** Index of the implicit output cell. */
	public static final int OUTPUT_CELL = -1;

	public static final BooleanValue YES = new BooleanValue(true);
	public static final BooleanValue NO = new BooleanValue(false);
	public static final IntegerValue ZERO = new IntegerValue(BigInteger.ZERO);

	Value() {}

	public static IntegerValue of(BigInteger value) {
		if (BigInteger.ZERO.equals(value)) {
			return ZERO;
		}
		return new IntegerValue(value);
	}

	public static IntegerValue of(long value) {
		return of(BigInteger.valueOf(value));
	}

	public static BooleanValue of(boolean value) {
		return value ? YES : NO;
	}

	public static CellReference cellReference(int index) {
		return new CellReference(index);
	}

	public abstract Type getType();

	public final boolean isInteger() {
		return getType() == Type.INTEGER;
	}

	public final boolean isBoolean() {
		return getType() == Type.BOOLEAN;
	}

	/**
	 * @return the integer carried by this value
	 * @throws IllegalStateException if this is not an integer; callers are
	 *         expected to check {@link #getType()} first
	 */
	public BigInteger integerValue() {
		throw new IllegalStateException(this + " is not an integer");
	}

	/**
	 * @return the boolean carried by this value
	 * @throws IllegalStateException if this is not a boolean
	 */
	public boolean booleanValue() {
		throw new IllegalStateException(this + " is not a boolean");
	}

	/** A non-negative integer. */
	public static final class IntegerValue extends Value {

		private final BigInteger value;

		private IntegerValue(BigInteger value) {
			if (value == null || value.signum() < 0) {
				throw new IllegalArgumentException("Floop integers are non-negative: " + value);
			}
			this.value = value;
		}

		@Override
		public Type getType() {
			return Type.INTEGER;
		}

		@Override
		public BigInteger integerValue() {
			return value;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			}
			return o instanceof IntegerValue && value.equals(((IntegerValue) o).value);
		}

		@Override
		public int hashCode() {
			return value.hashCode();
		}

		@Override
		public String toString() {
			return value.toString();
		}
	}

	/** <code>YES</code> or <code>NO</code>. */
	public static final class BooleanValue extends Value {

		private final boolean value;

		private BooleanValue(boolean value) {
			this.value = value;
		}

		@Override
		public Type getType() {
			return Type.BOOLEAN;
		}

		@Override
		public boolean booleanValue() {
			return value;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof BooleanValue && value == ((BooleanValue) o).value;
		}

		@Override
		public int hashCode() {
			return Boolean.hashCode(value);
		}

		@Override
		public String toString() {
			return value ? "YES" : "NO";
		}
	}

	/** The lvalue of an assignment. */
	public static final class CellReference extends Value {

		private final int index;

		private CellReference(int index) {
			this.index = index;
		}

		@Override
		public Type getType() {
			return Type.CELL_REFERENCE;
		}

		public int getIndex() {
			return index;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof CellReference && index == ((CellReference) o).index;
		}

		@Override
		public int hashCode() {
			return Integer.hashCode(index);
		}

		@Override
		public String toString() {
			return index == OUTPUT_CELL ? "OUTPUT" : "CELL(" + index + ")";
		}
	}
}
