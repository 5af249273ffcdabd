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
package gr1synth.transys;

/**
 * Thrown when a transition system cannot be encoded: it is of a kind the
 * encoder does not know, or it refers to states, actions or propositions it
 * never declared.
 *
 */
public class MalformedTransitionSystemException extends RuntimeException {

	public MalformedTransitionSystemException(String msg) {
		super(msg);
	}

	public static final long serialVersionUID = 1l;
}
