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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the non-fatal conditions found while encoding, such as a missing
 * initial state or a deadlocked state. Encoding never stops because of a
 * warning; the caller decides what to make of them afterwards.
 * <p>
 * An instance belongs to a single encoding call (or a single merge), and is
 * not safe for use from several threads at once.
 *
 */
public class Diagnostics {
	private final PrintStream output;
	private final boolean verbose;
	private final List<String> warnings = new ArrayList<>();

	private Diagnostics(PrintStream output, boolean verbose) {
		this.output = output;
		this.verbose = verbose;
	}

	/**
	 * Record warnings without echoing anything.
	 *
	 * @return
	 */
	public static Diagnostics silent() {
		return new Diagnostics(null, false);
	}

	/**
	 * Record warnings and echo them to standard error.
	 *
	 * @return
	 */
	public static Diagnostics stderr() {
		return new Diagnostics(System.err, false);
	}

	/**
	 * Record warnings and echo them to a given stream. When verbose, debug
	 * messages are written as well.
	 *
	 * @param output
	 * @param verbose
	 * @return
	 */
	public static Diagnostics to(PrintStream output, boolean verbose) {
		return new Diagnostics(output, verbose);
	}

	public void warning(String msg) {
		warnings.add(msg);
		if (output != null) {
			output.println("warning: " + msg);
		}
	}

	public void debug(String msg) {
		if (output != null && verbose) {
			output.println(msg);
		}
	}

	public boolean isVerbose() {
		return verbose;
	}

	/**
	 * The warnings recorded so far, in the order they were raised.
	 *
	 * @return
	 */
	public List<String> warnings() {
		return Collections.unmodifiableList(warnings);
	}
}
