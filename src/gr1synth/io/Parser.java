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

import java.util.ArrayList;
import java.util.List;

import gr1synth.core.Syntax.Expr;
import gr1synth.core.Syntax.Operator;
import gr1synth.io.Lexer.*;
import gr1synth.util.SyntacticElement.Attribute;
import gr1synth.util.SyntaxError;

/**
 * Recursive descent parser for temporal logic formulas. Operators bind as
 * follows, from loosest to tightest:
 *
 * <pre>
 * <->   ->   || | or   && & and   xor ^   U V R
 * ! not  [] G always  <> F eventually  X next
 * = == != < <= > >=   + -   * /   postfix '
 * </pre>
 *
 * Implication and the binary temporal operators associate to the right, the
 * remaining binary operators to the left.
 *
 */
public class Parser {
	private final String formula;
	private final ArrayList<Token> tokens;
	private int index;

	public Parser(String formula, List<Token> tokens) {
		this.formula = formula;
		this.tokens = new ArrayList<>(tokens);
	}

	/**
	 * Parse a complete formula from the given text.
	 *
	 * @param text
	 * @return
	 */
	public static Expr parse(String text) {
		Lexer lexer = new Lexer(text);
		return new Parser(text, lexer.scan()).parseFormula();
	}

	/**
	 * Parse a formula which must span all remaining tokens.
	 *
	 * @return
	 */
	public Expr parseFormula() {
		checkNotEof();
		Expr e = parseBiImplication();
		if (index < tokens.size()) {
			Token t = tokens.get(index);
			syntaxError("unexpected '" + t.text + "'", t);
		}
		return e;
	}

	public Expr parseBiImplication() {
		int start = index;
		Expr lhs = parseImplication();
		while (lookahead("<->")) {
			match("<->");
			Expr rhs = parseImplication();
			lhs = new Expr.Binary(Operator.IFF, lhs, rhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	public Expr parseImplication() {
		int start = index;
		Expr lhs = parseDisjunction();
		if (lookahead("->")) {
			match("->");
			Expr rhs = parseImplication();
			return new Expr.Binary(Operator.IMPLIES, lhs, rhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	public Expr parseDisjunction() {
		int start = index;
		Expr lhs = parseConjunction();
		while (lookahead("||", "|", "or")) {
			match("||", "|", "or");
			Expr rhs = parseConjunction();
			lhs = new Expr.Binary(Operator.OR, lhs, rhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	public Expr parseConjunction() {
		int start = index;
		Expr lhs = parseExclusiveOr();
		while (lookahead("&&", "&", "and")) {
			match("&&", "&", "and");
			Expr rhs = parseExclusiveOr();
			lhs = new Expr.Binary(Operator.AND, lhs, rhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	public Expr parseExclusiveOr() {
		int start = index;
		Expr lhs = parseTemporalBinary();
		while (lookahead("xor", "^")) {
			match("xor", "^");
			Expr rhs = parseTemporalBinary();
			lhs = new Expr.Binary(Operator.XOR, lhs, rhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	public Expr parseTemporalBinary() {
		int start = index;
		Expr lhs = parseUnary();
		if (lookahead("U", "V", "R") && startsOperand(index + 1)) {
			Token t = match("U", "V", "R");
			Operator op = t.text.equals("U") ? Operator.UNTIL : Operator.RELEASE;
			Expr rhs = parseTemporalBinary();
			return new Expr.Binary(op, lhs, rhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	public Expr parseUnary() {
		checkNotEof();
		int start = index;
		Operator op;
		if (lookahead("!", "not")) {
			op = Operator.NOT;
		} else if (lookahead("[]", "always") || (lookahead("G") && startsOperand(index + 1))) {
			op = Operator.ALWAYS;
		} else if (lookahead("<>", "eventually") || (lookahead("F") && startsOperand(index + 1))) {
			op = Operator.EVENTUALLY;
		} else if (lookahead("next") || (lookahead("X") && startsOperand(index + 1))) {
			op = Operator.NEXT;
		} else {
			return parseComparison();
		}
		index = index + 1;
		Expr operand = parseUnary();
		return new Expr.Unary(op, operand, sourceAttr(start, index - 1));
	}

	public Expr parseComparison() {
		int start = index;
		Expr lhs = parseAdditive();
		if (lookahead("=", "==", "!=", "<", "<=", ">", ">=")) {
			Token t = match("=", "==", "!=", "<", "<=", ">", ">=");
			Expr rhs = parseAdditive();
			return new Expr.Binary(comparator(t.text), lhs, rhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	public Expr parseAdditive() {
		int start = index;
		Expr lhs = parseMultiplicative();
		while (lookahead("+", "-")) {
			Token t = match("+", "-");
			Operator op = t.text.equals("+") ? Operator.ADD : Operator.SUB;
			Expr rhs = parseMultiplicative();
			lhs = new Expr.Binary(op, lhs, rhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	public Expr parseMultiplicative() {
		int start = index;
		Expr lhs = parsePrimed();
		while (lookahead("*", "/")) {
			Token t = match("*", "/");
			Operator op = t.text.equals("*") ? Operator.MUL : Operator.DIV;
			Expr rhs = parsePrimed();
			lhs = new Expr.Binary(op, lhs, rhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	/**
	 * Parse a term followed by zero or more primes, each of which refers one
	 * step further ahead.
	 *
	 * @return
	 */
	public Expr parsePrimed() {
		int start = index;
		Expr e = parseTerm();
		while (index < tokens.size() && tokens.get(index) instanceof Prime) {
			index = index + 1;
			e = new Expr.Unary(Operator.NEXT, e, sourceAttr(start, index - 1));
		}
		return e;
	}

	public Expr parseTerm() {
		checkNotEof();
		int start = index;
		Token lookahead = tokens.get(index);
		if (lookahead instanceof LeftBrace) {
			match("(");
			Expr e = parseBiImplication();
			match(")");
			return e;
		} else if (lookahead instanceof Int) {
			int val = match(Int.class, "an integer").value;
			return new Expr.Int(val, sourceAttr(start, start));
		} else if (lookahead instanceof Quoted) {
			String val = match(Quoted.class, "a string").value;
			return new Expr.Constant(val, sourceAttr(start, start));
		} else if (lookahead instanceof Keyword && isBoolean(lookahead.text)) {
			index = index + 1;
			boolean val = lookahead.text.equalsIgnoreCase("true");
			return new Expr.Bool(val, sourceAttr(start, start));
		} else if (lookahead instanceof Identifier || isLetterOperator(lookahead)) {
			index = index + 1;
			return new Expr.Variable(lookahead.text, sourceAttr(start, start));
		}
		syntaxError("unexpected '" + lookahead.text + "'", lookahead);
		return null; // unreachable
	}

	/**
	 * Check whether the token at a given position can begin an operand. A
	 * single letter operator (<code>X</code>, <code>G</code>, <code>F</code>,
	 * <code>U</code>, <code>V</code> or <code>R</code>) is read as a variable
	 * wherever it cannot act as an operator, so that <code>X &amp;&amp; R</code>
	 * and <code>G'</code> name variables while <code>X R</code> is the next
	 * value of <code>R</code>.
	 *
	 * @param i
	 * @return
	 */
	private boolean startsOperand(int i) {
		if (i >= tokens.size()) {
			return false;
		}
		Token t = tokens.get(i);
		if (t instanceof LeftBrace || t instanceof Int || t instanceof Quoted || t instanceof Identifier) {
			return true;
		} else if (t instanceof Keyword) {
			switch (t.text) {
			case "and":
			case "or":
			case "xor":
				return false;
			case "U":
			case "V":
			case "R":
				// a binary operator needs an operand after it
				return !startsOperand(i + 1);
			default:
				return true;
			}
		}
		switch (t.text) {
		case "!":
		case "[]":
		case "<>":
			return true;
		default:
			return false;
		}
	}

	private static boolean isLetterOperator(Token t) {
		return t instanceof Keyword && t.text.length() == 1 && "XGFUVR".contains(t.text);
	}

	private static boolean isBoolean(String text) {
		return text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false");
	}

	private static Operator comparator(String text) {
		switch (text) {
		case "=":
		case "==":
			return Operator.EQ;
		case "!=":
			return Operator.NEQ;
		case "<":
			return Operator.LT;
		case "<=":
			return Operator.LTEQ;
		case ">":
			return Operator.GT;
		default:
			return Operator.GTEQ;
		}
	}

	private boolean lookahead(String... options) {
		if (index >= tokens.size()) {
			return false;
		}
		Token t = tokens.get(index);
		if (t instanceof Identifier || t instanceof Int || t instanceof Quoted) {
			return false;
		}
		for (String option : options) {
			if (t.text.equals(option)) {
				return true;
			}
		}
		return false;
	}

	private void checkNotEof() {
		if (index >= tokens.size()) {
			int end = Math.max(0, formula.length() - 1);
			throw new SyntaxError("unexpected end of formula", formula, end, end);
		}
	}

	private Token match(String... options) {
		checkNotEof();
		Token t = tokens.get(index);
		for (int i = 0; i != options.length; ++i) {
			if (t.text.equals(options[i])) {
				index = index + 1;
				return t;
			}
		}
		String s = "";
		for (int i = 0; i != options.length; ++i) {
			if (i != 0) {
				s += " or ";
			}
			s += "'" + options[i] + "'";
		}
		syntaxError("expecting " + s + ", found '" + t.text + "'", t);
		return null;
	}

	@SuppressWarnings("unchecked")
	private <T extends Token> T match(Class<T> c, String name) {
		checkNotEof();
		Token t = tokens.get(index);
		if (!c.isInstance(t)) {
			syntaxError("expecting " + name + ", found '" + t.text + "'", t);
		}
		index = index + 1;
		return (T) t;
	}

	private Attribute.Source sourceAttr(int start, int end) {
		Token t1 = tokens.get(start);
		Token t2 = tokens.get(end);
		return new Attribute.Source(t1.start, t2.end());
	}

	private void syntaxError(String msg, Token t) {
		throw new SyntaxError(msg, formula, t.start, t.end());
	}
}
