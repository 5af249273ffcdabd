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
package gr1synth.io;

import java.util.Collections;
import java.util.Set;

import gr1synth.core.Dialect;
import gr1synth.core.Syntax.Expr;
import gr1synth.core.Syntax.Operator;
import gr1synth.core.UnsupportedOperatorException;
import gr1synth.util.AbstractTransformer;

/**
 * Writes a formula in a given dialect. The state passed down the tree records
 * whether the current node sits beneath a next operator, which matters only
 * for dialects that express next by priming variables.
 *
 */
public class Emitter extends AbstractTransformer<Boolean, String> {
	private final Dialect dialect;
	private final Set<String> values;

	public Emitter(Dialect dialect) {
		this(dialect, Collections.emptySet());
	}

	/**
	 * Construct an emitter which treats the given names as values of
	 * enumerated variables. These are never primed.
	 *
	 * @param dialect
	 * @param values
	 */
	public Emitter(Dialect dialect, Set<String> values) {
		this.dialect = dialect;
		this.values = values;
	}

	public static String render(Dialect dialect, Expr expr) {
		return new Emitter(dialect).apply(false, expr);
	}

	public static String render(Dialect dialect, Expr expr, Set<String> values) {
		return new Emitter(dialect, values).apply(false, expr);
	}

	@Override
	public String apply(Boolean primed, Expr.Int expr) {
		return Integer.toString(expr.value());
	}

	@Override
	public String apply(Boolean primed, Expr.Variable expr) {
		return dialect.atom(expr.name(), primed && !values.contains(expr.name()));
	}

	@Override
	public String apply(Boolean primed, Expr.Constant expr) {
		// constants do not change over time
		return dialect.atom(expr.toString(), false);
	}

	@Override
	public String apply(Boolean primed, Expr.Bool expr) {
		return dialect.literal(expr.value());
	}

	@Override
	public String apply(Boolean primed, Expr.Unary expr) {
		Operator op = expr.operator();
		String pattern = dialect.pattern(op);
		if (primed && op.isTemporal()) {
			// A primed variable can only refer one step ahead
			throw new UnsupportedOperatorException(op, dialect,
					"operator " + op + " cannot appear beneath next in " + dialect + " syntax");
		}
		boolean p = primed || (op == Operator.NEXT && dialect.primesNext());
		return String.format(pattern, apply(p, expr.operand()));
	}

	@Override
	public String apply(Boolean primed, Expr.Binary expr) {
		Operator op = expr.operator();
		String pattern = dialect.pattern(op);
		if (primed && op.isTemporal()) {
			throw new UnsupportedOperatorException(op, dialect,
					"operator " + op + " cannot appear beneath next in " + dialect + " syntax");
		}
		String l = apply(primed, expr.leftOperand());
		String r = apply(primed, expr.rightOperand());
		return String.format(pattern, l, r);
	}
}
