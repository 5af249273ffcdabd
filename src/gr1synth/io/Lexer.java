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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import gr1synth.util.SyntaxError;

/**
 * Responsible for turning formula text into a sequence of tokens. The token
 * set is the union of what the supported dialects write, so that text
 * produced for any of them can be read back.
 *
 */
public class Lexer {
	private final String input;
	private int pos;

	public Lexer(String input) {
		this.input = input;
	}

	public Lexer(Reader reader) throws IOException {
		BufferedReader in = new BufferedReader(reader);
		StringBuilder text = new StringBuilder();
		String tmp;
		while ((tmp = in.readLine()) != null) {
			text.append(tmp);
			text.append("\n");
		}
		this.input = text.toString();
	}

	/**
	 * The text being scanned.
	 *
	 * @return
	 */
	public String input() {
		return input;
	}

	/**
	 * Scan all characters of the input and generate the corresponding list of
	 * tokens, discarding whitespace.
	 *
	 * @return
	 */
	public List<Token> scan() {
		ArrayList<Token> tokens = new ArrayList<>();
		pos = 0;

		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (Character.isDigit(c)) {
				tokens.add(scanNumericConstant());
			} else if (c == '"') {
				tokens.add(scanStringConstant());
			} else if (isOperatorStart(c)) {
				tokens.add(scanOperator());
			} else if (Character.isJavaIdentifierStart(c)) {
				tokens.add(scanIdentifier());
			} else if (Character.isWhitespace(c)) {
				skipWhitespace();
			} else {
				syntaxError("unknown character encountered: " + c);
			}
		}

		return tokens;
	}

	public Token scanNumericConstant() {
		int start = pos;
		while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
			pos = pos + 1;
		}
		String text = input.substring(start, pos);
		BigInteger value = new BigInteger(text);
		if (value.bitLength() > 31) {
			throw new SyntaxError("integer constant too large: " + text, input, start, pos - 1);
		}
		return new Int(value.intValue(), text, start);
	}

	public Token scanStringConstant() {
		int start = pos;
		pos = pos + 1;
		while (pos < input.length() && input.charAt(pos) != '"') {
			pos = pos + 1;
		}
		if (pos >= input.length()) {
			throw new SyntaxError("unterminated string constant", input, start, input.length() - 1);
		}
		pos = pos + 1;
		String text = input.substring(start, pos);
		return new Quoted(text.substring(1, text.length() - 1), text, start);
	}

	static final char[] opStarts = { '!', '&', '|', '^', '-', '<', '>', '=', '[', '+', '*', '/', '(', ')', '\'' };

	public boolean isOperatorStart(char c) {
		for (char o : opStarts) {
			if (c == o) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Multi-character operators, listed so that no operator appears before a
	 * longer one it is a prefix of.
	 */
	static final String[] operators = { "<->", "&&", "||", "->", "[]", "<>", "<=", ">=", "==", "!=", "!", "&", "|",
			"^", "-", "<", ">", "=", "+", "*", "/" };

	public Token scanOperator() {
		char c = input.charAt(pos);
		if (c == '(') {
			return new LeftBrace(pos++);
		} else if (c == ')') {
			return new RightBrace(pos++);
		} else if (c == '\'') {
			return new Prime(pos++);
		}
		for (String op : operators) {
			if (input.startsWith(op, pos)) {
				Token t = new Operator(op, pos);
				pos += op.length();
				return t;
			}
		}
		syntaxError("unknown operator encountered: " + c);
		return null;
	}

	public static final String[] keywords = { "next", "always", "eventually", "not", "and", "or", "xor", "X", "G",
			"F", "U", "V", "R", "TRUE", "FALSE", "True", "False", "true", "false" };

	public Token scanIdentifier() {
		int start = pos;
		while (pos < input.length() && Character.isJavaIdentifierPart(input.charAt(pos))) {
			pos++;
		}
		String text = input.substring(start, pos);
		// now, check for keywords
		for (String keyword : keywords) {
			if (keyword.equals(text)) {
				return new Keyword(text, start);
			}
		}
		// otherwise, must be identifier
		return new Identifier(text, start);
	}

	public void skipWhitespace() {
		while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
			pos++;
		}
	}

	private void syntaxError(String msg) {
		throw new SyntaxError(msg, input, pos, pos);
	}

	/**
	 * The base class for all tokens.
	 *
	 */
	public static abstract class Token {
		public final String text;
		public final int start;

		public Token(String text, int pos) {
			this.text = text;
			this.start = pos;
		}

		public int end() {
			return start + text.length() - 1;
		}

		@Override
		public String toString() {
			return text;
		}
	}

	/**
	 * A sequence of one or more digits.
	 */
	public static class Int extends Token {
		public final int value;

		public Int(int r, String text, int pos) {
			super(text, pos);
			value = r;
		}
	}

	/**
	 * Text enclosed in double quotes. The value excludes the quotes.
	 */
	public static class Quoted extends Token {
		public final String value;

		public Quoted(String value, String text, int pos) {
			super(text, pos);
			this.value = value;
		}
	}

	/**
	 * A variable name.
	 */
	public static class Identifier extends Token {
		public Identifier(String text, int pos) {
			super(text, pos);
		}
	}

	/**
	 * A reserved word, such as <code>next</code> or <code>TRUE</code>.
	 */
	public static class Keyword extends Token {
		public Keyword(String text, int pos) {
			super(text, pos);
		}
	}

	public static class Operator extends Token {
		public Operator(String text, int pos) {
			super(text, pos);
		}
	}

	public static class LeftBrace extends Token {
		public LeftBrace(int pos) {
			super("(", pos);
		}
	}

	public static class RightBrace extends Token {
		public RightBrace(int pos) {
			super(")", pos);
		}
	}

	public static class Prime extends Token {
		public Prime(int pos) {
			super("'", pos);
		}
	}
}
