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
package gr1synth.synth;

/**
 * What must hold of the action variables at every step.
 *
 */
public enum ActionConstraint {
	/**
	 * Any combination of actions may hold.
	 */
	NONE("none"),
	/**
	 * At most one action holds.
	 */
	MUTEX("mutex"),
	/**
	 * Exactly one action holds.
	 */
	XOR("xor");

	private final String token;

	private ActionConstraint(String token) {
		this.token = token;
	}

	public boolean isMutex() {
		return this != NONE;
	}

	public boolean isMinOne() {
		return this == XOR;
	}

	/**
	 * Read a constraint from its textual name. A <code>null</code> token means
	 * no constraint.
	 *
	 * @param token
	 * @return
	 */
	public static ActionConstraint parse(String token) {
		if (token == null) {
			return NONE;
		}
		switch (token) {
		case "none":
			return NONE;
		case "mutex":
			return MUTEX;
		case "xor":
		case "exactly-one":
			return XOR;
		default:
			throw new InvalidEncodingOptionException("unknown action constraint \"" + token + "\"");
		}
	}

	@Override
	public String toString() {
		return token;
	}
}
