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

import java.io.PrintStream;

/**
 * Thrown when formula text cannot be turned into a syntax tree.
 *
 */
public class SyntaxError extends RuntimeException {
	private final String msg;
	private final String formula;
	private final int start;
	private final int end;

	/**
	 * Identify a syntax error within a given piece of formula text.
	 *
	 * @param msg
	 *            Message detailing the problem.
	 * @param formula
	 *            The formula text this error refers to (may be null).
	 * @param start
	 *            Index of the first offending character.
	 * @param end
	 *            Index of the last offending character.
	 */
	public SyntaxError(String msg, String formula, int start, int end) {
		super(msg);
		this.msg = msg;
		this.formula = formula;
		this.start = start;
		this.end = end;
	}

	@Override
	public String getMessage() {
		return msg == null ? "" : msg;
	}

	public String msg() {
		return msg;
	}

	/**
	 * The formula text where the error arose.
	 *
	 * @return
	 */
	public String formula() {
		return formula;
	}

	public int start() {
		return start;
	}

	public int end() {
		return end;
	}

	/**
	 * Write the error to a given output stream, underlining the offending part
	 * of the formula.
	 */
	public void outputSourceError(PrintStream output) {
		if (formula == null || start < 0) {
			output.println("syntax error: " + getMessage());
			return;
		}
		// Locate the line containing the error
		int lineStart = formula.lastIndexOf('\n', Math.max(0, start - 1)) + 1;
		if (start == 0) {
			lineStart = 0;
		}
		int lineEnd = formula.indexOf('\n', start);
		if (lineEnd < 0) {
			lineEnd = formula.length();
		}
		output.println("syntax error: " + getMessage());
		output.println(formula.substring(lineStart, lineEnd));
		StringBuilder marker = new StringBuilder();
		for (int i = lineStart; i < start; ++i) {
			marker.append(formula.charAt(i) == '\t' ? '\t' : ' ');
		}
		int last = Math.min(Math.max(end, start), Math.max(lineEnd - 1, start));
		for (int i = start; i <= last; ++i) {
			marker.append('^');
		}
		output.println(marker);
	}

	public static final long serialVersionUID = 1l;
}
