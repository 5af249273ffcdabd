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
package gr1synth.util;

/**
 * Any part of a formula which may carry extra information that is not part of
 * its meaning, such as the span of formula text it was parsed from. Attributes
 * never take part in equality of formulas.
 *
 */
public interface SyntacticElement {

	/**
	 * Get the attributes attached to this element.
	 *
	 * @return
	 */
	public Attribute[] attributes();

	/**
	 * Get the first attribute which is an instance of the given class, or
	 * <code>null</code> if there is none.
	 *
	 * @param kind
	 * @return
	 */
	public <T extends Attribute> T attribute(Class<T> kind);

	public class Impl implements SyntacticElement {
		private static final Attribute[] NONE = new Attribute[0];

		private final Attribute[] attributes;

		public Impl(Attribute... attributes) {
			this.attributes = attributes == null ? NONE : attributes;
		}

		@Override
		public Attribute[] attributes() {
			return attributes;
		}

		@Override
		public <T extends Attribute> T attribute(Class<T> kind) {
			for (Attribute a : attributes) {
				if (kind.isInstance(a)) {
					return kind.cast(a);
				}
			}
			return null;
		}
	}

	/**
	 * Marker for information attached to a syntactic element.
	 */
	public interface Attribute {

		/**
		 * The inclusive character span of the formula text an element was
		 * parsed from.
		 */
		public static class Source implements Attribute {
			public final int start;
			public final int end;

			public Source(int start, int end) {
				this.start = start;
				this.end = end;
			}

			@Override
			public String toString() {
				return "@" + start + ":" + end;
			}
		}
	}
}
