// This file is part of the GR1Synth toolchain (gr1s).
//
// GR1Synth is free software; you can redistribute it and/or
// modify it under the terms of the GNU General Public License
// as published by the Free Software Foundation; either version 3
// of the License, or (at your option) any later version.
//
// GR1Synth is distributed in the hope that it will be useful,
// but WITHOUT ANY WARRANTY; without even the implied warranty of
// MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
// GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with GR1Synth. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2026, The GR1Synth Developers.
package gr1synth.spec;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;

/**
 * The set of values a specification variable ranges over: either the
 * booleans, a bounded integer range, or a finite enumeration of names.
 *
 */
public abstract class Domain {
	public static final Domain BOOLEAN = new Bool();

	public static Domain range(int lo, int hi) {
		return new Range(lo, hi);
	}

	public static Domain enumeration(Iterable<String> values) {
		return new Enumeration(ImmutableSet.copyOf(values));
	}

	public static Domain enumeration(String... values) {
		return new Enumeration(ImmutableSet.copyOf(values));
	}

	public boolean isBoolean() {
		return this instanceof Bool;
	}

	public static final class Bool extends Domain {
		private Bool() {
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Bool;
		}

		@Override
		public int hashCode() {
			return 0;
		}

		@Override
		public String toString() {
			return "boolean";
		}
	}

	/**
	 * The integers from <code>lo</code> to <code>hi</code> inclusive.
	 */
	public static final class Range extends Domain {
		private final int lo;
		private final int hi;

		private Range(int lo, int hi) {
			checkArgument(lo <= hi, "empty range [%s, %s]", lo, hi);
			this.lo = lo;
			this.hi = hi;
		}

		public int lo() {
			return lo;
		}

		public int hi() {
			return hi;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Range) {
				Range r = (Range) o;
				return lo == r.lo && hi == r.hi;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return 31 * lo + hi;
		}

		@Override
		public String toString() {
			return "[" + lo + ", " + hi + "]";
		}
	}

	/**
	 * An explicit list of values. Two enumerations are the same domain when
	 * they have the same values, whatever their order.
	 */
	public static final class Enumeration extends Domain {
		private final ImmutableSet<String> values;

		private Enumeration(ImmutableSet<String> values) {
			checkArgument(!values.isEmpty(), "empty enumeration");
			this.values = checkNotNull(values);
		}

		public ImmutableSet<String> values() {
			return values;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Enumeration && ((Enumeration) o).values.equals(values);
		}

		@Override
		public int hashCode() {
			return values.hashCode();
		}

		@Override
		public String toString() {
			return "{" + Joiner.on(", ").join(values) + "}";
		}
	}
}
