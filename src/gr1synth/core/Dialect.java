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

import static gr1synth.core.Syntax.Operator.*;

import java.util.EnumMap;

import gr1synth.core.Syntax.Operator;

/**
 * The concrete syntaxes a formula can be written in. Each dialect has a fixed
 * table mapping operators to output patterns, where <code>%1$s</code> and
 * <code>%2$s</code> stand for the rendered operands. An operator which is
 * absent from a table cannot be expressed in that dialect.
 * <p>
 * Every pattern for a binary operator parenthesises the whole application, so
 * the rendered text never depends on operator precedence.
 *
 */
public enum Dialect {
	/**
	 * Input language of the gr1c solver. Next is written by priming the
	 * variables underneath it.
	 */
	GR1C("gr1c", "True", "False", false, true),
	/**
	 * Input language of the JTLV solver.
	 */
	JTLV("JTLV", "TRUE", "FALSE", true, false),
	/**
	 * Input language of the NuSMV model checker.
	 */
	SMV("SMV", "TRUE", "FALSE", false, false),
	/**
	 * LTL syntax of the SPIN verifier.
	 */
	PROMELA("Promela", "true", "false", false, false),
	/**
	 * Propositional expressions which a Python interpreter can evaluate.
	 */
	PYTHON("Python", "True", "False", false, false);

	private final String name;
	private final String trueLiteral;
	private final String falseLiteral;
	private final boolean parenthesiseAtoms;
	private final boolean primesNext;
	private final EnumMap<Operator, String> table = new EnumMap<>(Operator.class);

	private Dialect(String name, String trueLiteral, String falseLiteral, boolean parenthesiseAtoms,
			boolean primesNext) {
		this.name = name;
		this.trueLiteral = trueLiteral;
		this.falseLiteral = falseLiteral;
		this.parenthesiseAtoms = parenthesiseAtoms;
		this.primesNext = primesNext;
	}

	static {
		// gr1c
		prefix(GR1C, NOT, "!");
		GR1C.table.put(NEXT, "( %1$s )");
		prefix(GR1C, ALWAYS, "[]");
		prefix(GR1C, EVENTUALLY, "<>");
		infix(GR1C, AND, "&&");
		infix(GR1C, OR, "||");
		infix(GR1C, IMPLIES, "->");
		infix(GR1C, IFF, "<->");
		comparisons(GR1C, "=");
		arithmetic(GR1C);
		// JTLV
		prefix(JTLV, NOT, "!");
		prefix(JTLV, NEXT, "next");
		prefix(JTLV, ALWAYS, "[]");
		prefix(JTLV, EVENTUALLY, "<>");
		infix(JTLV, AND, "&&");
		infix(JTLV, OR, "||");
		infix(JTLV, XOR, "xor");
		infix(JTLV, IMPLIES, "->");
		infix(JTLV, IFF, "<->");
		infix(JTLV, UNTIL, "U");
		comparisons(JTLV, "=");
		arithmetic(JTLV);
		// SMV
		prefix(SMV, NOT, "!");
		prefix(SMV, NEXT, "X");
		prefix(SMV, ALWAYS, "G");
		prefix(SMV, EVENTUALLY, "F");
		infix(SMV, AND, "&");
		infix(SMV, OR, "|");
		infix(SMV, XOR, "xor");
		infix(SMV, IMPLIES, "->");
		infix(SMV, IFF, "<->");
		infix(SMV, UNTIL, "U");
		infix(SMV, RELEASE, "V");
		comparisons(SMV, "=");
		arithmetic(SMV);
		// Promela
		prefix(PROMELA, NOT, "!");
		prefix(PROMELA, ALWAYS, "[]");
		prefix(PROMELA, EVENTUALLY, "<>");
		infix(PROMELA, AND, "&&");
		infix(PROMELA, OR, "||");
		infix(PROMELA, IMPLIES, "->");
		infix(PROMELA, IFF, "<->");
		infix(PROMELA, UNTIL, "U");
		infix(PROMELA, RELEASE, "V");
		comparisons(PROMELA, "==");
		arithmetic(PROMELA);
		// Python
		prefix(PYTHON, NOT, "not");
		infix(PYTHON, AND, "and");
		infix(PYTHON, OR, "or");
		infix(PYTHON, XOR, "^");
		PYTHON.table.put(IMPLIES, "( ( not %1$s ) or %2$s )");
		PYTHON.table.put(IFF, "( ( %1$s and %2$s ) or not ( %1$s or %2$s ) )");
		comparisons(PYTHON, "==");
		arithmetic(PYTHON);
	}

	private static void prefix(Dialect d, Operator op, String token) {
		d.table.put(op, "( " + token + " %1$s )");
	}

	private static void infix(Dialect d, Operator op, String token) {
		d.table.put(op, "( %1$s " + token + " %2$s )");
	}

	private static void comparisons(Dialect d, String equality) {
		infix(d, EQ, equality);
		infix(d, NEQ, "!=");
		infix(d, LT, "<");
		infix(d, LTEQ, "<=");
		infix(d, GT, ">");
		infix(d, GTEQ, ">=");
	}

	private static void arithmetic(Dialect d) {
		infix(d, ADD, "+");
		infix(d, SUB, "-");
		infix(d, MUL, "*");
		infix(d, DIV, "/");
	}

	/**
	 * Check whether a given operator can be expressed in this dialect.
	 *
	 * @param op
	 * @return
	 */
	public boolean supports(Operator op) {
		return table.containsKey(op);
	}

	/**
	 * Get the output pattern for a given operator.
	 *
	 * @param op
	 * @return
	 * @throws UnsupportedOperatorException
	 *             if the operator has no entry in this dialect's table.
	 */
	public String pattern(Operator op) {
		String p = table.get(op);
		if (p == null) {
			throw new UnsupportedOperatorException(op, this);
		}
		return p;
	}

	public String literal(boolean value) {
		return value ? trueLiteral : falseLiteral;
	}

	/**
	 * Write an atomic name (variable or quoted constant), optionally primed to
	 * refer to its value in the next step.
	 *
	 * @param text
	 * @param primed
	 * @return
	 */
	public String atom(String text, boolean primed) {
		if (primed) {
			text = text + "'";
		}
		return parenthesiseAtoms ? "(" + text + ")" : text;
	}

	/**
	 * Whether next is expressed by priming, rather than by an operator token.
	 *
	 * @return
	 */
	public boolean primesNext() {
		return primesNext;
	}

	@Override
	public String toString() {
		return name;
	}
}
