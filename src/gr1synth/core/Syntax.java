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

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

import gr1synth.io.Emitter;
import gr1synth.util.SyntacticElement;

/**
 * Abstract syntax for linear temporal logic formulas. Every node is immutable
 * and owns its operands, hence a formula is always a finite tree. Node kinds
 * are identified by an opcode, which is what visitors dispatch on.
 *
 */
public class Syntax {
	public final static int EXPR_integer = 0;
	public final static int EXPR_variable = 1;
	public final static int EXPR_constant = 2;
	public final static int EXPR_boolean = 3;
	public final static int EXPR_unary = 4;
	public final static int EXPR_binary = 5;

	/**
	 * The operators which can appear in unary and binary nodes. The symbol is
	 * the one used by <code>toString()</code>; the concrete token in each
	 * target syntax is determined by {@link Dialect}.
	 */
	public enum Operator {
		// Unary
		NOT("!", Kind.LOGICAL, 1),
		NEXT("X", Kind.TEMPORAL, 1),
		ALWAYS("G", Kind.TEMPORAL, 1),
		EVENTUALLY("F", Kind.TEMPORAL, 1),
		// Binary
		AND("&", Kind.LOGICAL, 2),
		OR("|", Kind.LOGICAL, 2),
		XOR("xor", Kind.LOGICAL, 2),
		IMPLIES("->", Kind.LOGICAL, 2),
		IFF("<->", Kind.LOGICAL, 2),
		UNTIL("U", Kind.TEMPORAL, 2),
		RELEASE("R", Kind.TEMPORAL, 2),
		EQ("=", Kind.COMPARATOR, 2),
		NEQ("!=", Kind.COMPARATOR, 2),
		LT("<", Kind.COMPARATOR, 2),
		LTEQ("<=", Kind.COMPARATOR, 2),
		GT(">", Kind.COMPARATOR, 2),
		GTEQ(">=", Kind.COMPARATOR, 2),
		ADD("+", Kind.ARITHMETIC, 2),
		SUB("-", Kind.ARITHMETIC, 2),
		MUL("*", Kind.ARITHMETIC, 2),
		DIV("/", Kind.ARITHMETIC, 2);

		public enum Kind {
			LOGICAL, TEMPORAL, COMPARATOR, ARITHMETIC
		}

		private final String symbol;
		private final Kind kind;
		private final int arity;

		private Operator(String symbol, Kind kind, int arity) {
			this.symbol = symbol;
			this.kind = kind;
			this.arity = arity;
		}

		public String symbol() {
			return symbol;
		}

		public Kind kind() {
			return kind;
		}

		public int arity() {
			return arity;
		}

		public boolean isTemporal() {
			return kind == Kind.TEMPORAL;
		}
	}

	public interface Expr extends SyntacticElement {

		/**
		 * Get the opcode identifying the kind of this node.
		 *
		 * @return
		 */
		public int getOpcode();

		/**
		 * Get the number of nodes in the tree rooted at this node.
		 *
		 * @return
		 */
		public int size();

		/**
		 * Get the variables referenced anywhere in this tree, in order of first
		 * occurrence.
		 *
		 * @return
		 */
		public Set<Variable> freeVariables();

		/**
		 * Rebuild this tree bottom-up, replacing each node by the result of
		 * applying the given rewrite to it. Operands are rewritten before the
		 * node containing them, so the rewrite always sees rewritten children.
		 *
		 * @param rewrite
		 * @return
		 */
		public Expr transform(Function<Expr, Expr> rewrite);

		/**
		 * Render this formula in the given concrete syntax.
		 *
		 * @param dialect
		 * @return
		 * @throws UnsupportedOperatorException
		 *             if the formula uses an operator the dialect cannot
		 *             express.
		 */
		public String render(Dialect dialect);

		public static abstract class AbstractExpr extends SyntacticElement.Impl implements Expr {
			private final int opcode;

			public AbstractExpr(int opcode, Attribute... attributes) {
				super(attributes);
				this.opcode = opcode;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}

			@Override
			public Set<Variable> freeVariables() {
				LinkedHashSet<Variable> vars = new LinkedHashSet<>();
				collect(vars);
				return vars;
			}

			@Override
			public String render(Dialect dialect) {
				return Emitter.render(dialect, this);
			}

			protected abstract void collect(Set<Variable> vars);
		}

		/**
		 * A node with no operands.
		 */
		public static abstract class Leaf extends AbstractExpr {
			public Leaf(int opcode, Attribute... attributes) {
				super(opcode, attributes);
			}

			@Override
			public int size() {
				return 1;
			}

			@Override
			public Expr transform(Function<Expr, Expr> rewrite) {
				return Objects.requireNonNull(rewrite.apply(this), "rewrite produced null");
			}

			@Override
			protected void collect(Set<Variable> vars) {
			}
		}

		/**
		 * An integer literal, such as <code>3</code>.
		 */
		public class Int extends Leaf {
			private final int value;

			public Int(int value, Attribute... attributes) {
				super(EXPR_integer, attributes);
				this.value = value;
			}

			public int value() {
				return value;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Int && ((Int) o).value == value;
			}

			@Override
			public int hashCode() {
				return value;
			}

			@Override
			public String toString() {
				return Integer.toString(value);
			}
		}

		/**
		 * A reference to a declared variable, such as <code>park</code>.
		 */
		public class Variable extends Leaf {
			private final String name;

			public Variable(String name, Attribute... attributes) {
				super(EXPR_variable, attributes);
				this.name = Objects.requireNonNull(name);
			}

			public String name() {
				return name;
			}

			@Override
			protected void collect(Set<Variable> vars) {
				vars.add(this);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Variable && ((Variable) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return name;
			}
		}

		/**
		 * A string constant, used as a value of an enumerated variable. It is
		 * always written in double quotes.
		 */
		public class Constant extends Leaf {
			private final String value;

			public Constant(String value, Attribute... attributes) {
				super(EXPR_constant, attributes);
				this.value = Objects.requireNonNull(value);
			}

			public String value() {
				return value;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Constant && ((Constant) o).value.equals(value);
			}

			@Override
			public int hashCode() {
				return value.hashCode() + 1;
			}

			@Override
			public String toString() {
				return "\"" + value + "\"";
			}
		}

		/**
		 * Either <code>True</code> or <code>False</code>.
		 */
		public class Bool extends Leaf {
			private final boolean value;

			public Bool(boolean value, Attribute... attributes) {
				super(EXPR_boolean, attributes);
				this.value = value;
			}

			public boolean value() {
				return value;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Bool && ((Bool) o).value == value;
			}

			@Override
			public int hashCode() {
				return value ? 1231 : 1237;
			}

			@Override
			public String toString() {
				return value ? "True" : "False";
			}
		}

		/**
		 * Negation or a unary temporal operator, such as <code>[] p</code>.
		 */
		public class Unary extends AbstractExpr {
			private final Operator operator;
			private final Expr operand;

			public Unary(Operator operator, Expr operand, Attribute... attributes) {
				super(EXPR_unary, attributes);
				if (operator.arity() != 1) {
					throw new IllegalArgumentException("operator " + operator + " is not unary");
				}
				this.operator = operator;
				this.operand = Objects.requireNonNull(operand);
			}

			public Operator operator() {
				return operator;
			}

			public Expr operand() {
				return operand;
			}

			@Override
			public int size() {
				return 1 + operand.size();
			}

			@Override
			public Expr transform(Function<Expr, Expr> rewrite) {
				Expr o = operand.transform(rewrite);
				return Objects.requireNonNull(rewrite.apply(new Unary(operator, o, attributes())),
						"rewrite produced null");
			}

			@Override
			protected void collect(Set<Variable> vars) {
				((AbstractExpr) operand).collect(vars);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Unary) {
					Unary u = (Unary) o;
					return operator == u.operator && operand.equals(u.operand);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return operator.hashCode() ^ operand.hashCode();
			}

			@Override
			public String toString() {
				return "( " + operator.symbol() + " " + operand + " )";
			}
		}

		/**
		 * Any binary operator, logical, temporal, comparison or arithmetic.
		 */
		public class Binary extends AbstractExpr {
			private final Operator operator;
			private final Expr lhs;
			private final Expr rhs;

			public Binary(Operator operator, Expr lhs, Expr rhs, Attribute... attributes) {
				super(EXPR_binary, attributes);
				if (operator.arity() != 2) {
					throw new IllegalArgumentException("operator " + operator + " is not binary");
				}
				this.operator = operator;
				this.lhs = Objects.requireNonNull(lhs);
				this.rhs = Objects.requireNonNull(rhs);
			}

			public Operator operator() {
				return operator;
			}

			public Expr leftOperand() {
				return lhs;
			}

			public Expr rightOperand() {
				return rhs;
			}

			@Override
			public int size() {
				return 1 + lhs.size() + rhs.size();
			}

			@Override
			public Expr transform(Function<Expr, Expr> rewrite) {
				Expr l = lhs.transform(rewrite);
				Expr r = rhs.transform(rewrite);
				return Objects.requireNonNull(rewrite.apply(new Binary(operator, l, r, attributes())),
						"rewrite produced null");
			}

			@Override
			protected void collect(Set<Variable> vars) {
				((AbstractExpr) lhs).collect(vars);
				((AbstractExpr) rhs).collect(vars);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Binary) {
					Binary b = (Binary) o;
					return operator == b.operator && lhs.equals(b.lhs) && rhs.equals(b.rhs);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return operator.hashCode() ^ (31 * lhs.hashCode()) ^ rhs.hashCode();
			}

			@Override
			public String toString() {
				return "( " + lhs + " " + operator.symbol() + " " + rhs + " )";
			}
		}
	}

	// =============================================================
	// Constructors
	// =============================================================

	public static final Expr.Bool TRUE = new Expr.Bool(true);
	public static final Expr.Bool FALSE = new Expr.Bool(false);

	public static Expr.Variable Var(String name) {
		return new Expr.Variable(name);
	}

	public static Expr.Int Int(int value) {
		return new Expr.Int(value);
	}

	public static Expr.Constant Const(String value) {
		return new Expr.Constant(value);
	}

	public static Expr.Unary Not(Expr e) {
		return new Expr.Unary(Operator.NOT, e);
	}

	public static Expr.Unary Next(Expr e) {
		return new Expr.Unary(Operator.NEXT, e);
	}

	public static Expr.Unary Always(Expr e) {
		return new Expr.Unary(Operator.ALWAYS, e);
	}

	public static Expr.Unary Eventually(Expr e) {
		return new Expr.Unary(Operator.EVENTUALLY, e);
	}

	public static Expr.Binary And(Expr l, Expr r) {
		return new Expr.Binary(Operator.AND, l, r);
	}

	public static Expr.Binary Or(Expr l, Expr r) {
		return new Expr.Binary(Operator.OR, l, r);
	}

	public static Expr.Binary Implies(Expr l, Expr r) {
		return new Expr.Binary(Operator.IMPLIES, l, r);
	}

	public static Expr.Binary Iff(Expr l, Expr r) {
		return new Expr.Binary(Operator.IFF, l, r);
	}

	public static Expr.Binary Until(Expr l, Expr r) {
		return new Expr.Binary(Operator.UNTIL, l, r);
	}

	public static Expr.Binary Release(Expr l, Expr r) {
		return new Expr.Binary(Operator.RELEASE, l, r);
	}

	public static Expr.Binary Eq(Expr l, Expr r) {
		return new Expr.Binary(Operator.EQ, l, r);
	}

	/**
	 * Join one or more formulas with a given binary operator, associating to
	 * the left.
	 *
	 * @param operator
	 * @param operands
	 * @return
	 */
	public static Expr fold(Operator operator, Iterable<? extends Expr> operands) {
		Expr result = null;
		for (Expr e : operands) {
			result = result == null ? e : new Expr.Binary(operator, result, e);
		}
		if (result == null) {
			throw new IllegalArgumentException("cannot fold an empty list with " + operator);
		}
		return result;
	}
}
