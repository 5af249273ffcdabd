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
package gr1synth.core;

import gr1synth.core.Syntax.Operator;

/**
 * Thrown when a formula uses an operator which has no rendering in the
 * requested dialect.
 *
 */
public class UnsupportedOperatorException extends RuntimeException {
	private final Operator operator;
	private final Dialect dialect;

	public UnsupportedOperatorException(Operator operator, Dialect dialect) {
		this(operator, dialect, "operator " + operator + " not supported in " + dialect + " syntax");
	}

	public UnsupportedOperatorException(Operator operator, Dialect dialect, String msg) {
		super(msg);
		this.operator = operator;
		this.dialect = dialect;
	}

	public Operator operator() {
		return operator;
	}

	public Dialect dialect() {
		return dialect;
	}

	public static final long serialVersionUID = 1l;
}
