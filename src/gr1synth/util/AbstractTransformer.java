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

import gr1synth.core.Syntax;
import gr1synth.core.Syntax.Expr;

/**
 * A visitor over formulas which dispatches on the opcode of each node. The
 * state is threaded from a node to its operands, and each node produces a
 * result.
 *
 * @param <T>
 *            The state passed down the tree (e.g. whether the current position
 *            is under a next operator).
 * @param <S>
 *            The result produced for each node.
 */
public abstract class AbstractTransformer<T, S> {

	public S apply(T state, Expr expr) {
		switch (expr.getOpcode()) {
		case Syntax.EXPR_integer:
			return apply(state, (Expr.Int) expr);
		case Syntax.EXPR_variable:
			return apply(state, (Expr.Variable) expr);
		case Syntax.EXPR_constant:
			return apply(state, (Expr.Constant) expr);
		case Syntax.EXPR_boolean:
			return apply(state, (Expr.Bool) expr);
		case Syntax.EXPR_unary:
			return apply(state, (Expr.Unary) expr);
		case Syntax.EXPR_binary:
			return apply(state, (Expr.Binary) expr);
		}
		throw new IllegalArgumentException("Invalid expression encountered: " + expr);
	}

	/**
	 * Apply this transformer to an integer literal.
	 *
	 * @param state The current state
	 * @param expr  The node being transformed.
	 * @return
	 */
	public abstract S apply(T state, Expr.Int expr);

	/**
	 * Apply this transformer to a variable reference.
	 *
	 * @param state The current state
	 * @param expr  The node being transformed.
	 * @return
	 */
	public abstract S apply(T state, Expr.Variable expr);

	/**
	 * Apply this transformer to a quoted constant.
	 *
	 * @param state The current state
	 * @param expr  The node being transformed.
	 * @return
	 */
	public abstract S apply(T state, Expr.Constant expr);

	/**
	 * Apply this transformer to a boolean literal.
	 *
	 * @param state The current state
	 * @param expr  The node being transformed.
	 * @return
	 */
	public abstract S apply(T state, Expr.Bool expr);

	/**
	 * Apply this transformer to a unary node.
	 *
	 * @param state The current state
	 * @param expr  The node being transformed.
	 * @return
	 */
	public abstract S apply(T state, Expr.Unary expr);

	/**
	 * Apply this transformer to a binary node.
	 *
	 * @param state The current state
	 * @param expr  The node being transformed.
	 * @return
	 */
	public abstract S apply(T state, Expr.Binary expr);
}
