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
package gr1synth.synth;

import gr1synth.core.Dialect;
import gr1synth.spec.Gr1Spec;
import gr1synth.util.Diagnostics;

/**
 * A GR(1) synthesis tool. Implementations typically write the specification
 * out in the tool's input format, run it, and read back the strategy.
 *
 */
public interface Solver {

	/**
	 * A short name identifying this solver in messages.
	 *
	 * @return
	 */
	public String name();

	/**
	 * The dialect this solver reads. Specifications are translated into it
	 * before being handed over.
	 *
	 * @return
	 */
	public Dialect dialect();

	/**
	 * Whether variables may range over integers or enumerations, rather than
	 * only the booleans.
	 *
	 * @return
	 */
	public boolean supportsIntegerDomains();

	/**
	 * Compute a strategy realizing the given specification.
	 *
	 * @param spec
	 * @param diagnostics
	 * @return The strategy, or null if the specification is unrealizable.
	 */
	public MealyMachine synthesize(Gr1Spec spec, Diagnostics diagnostics);

	public boolean isRealizable(Gr1Spec spec, Diagnostics diagnostics);
}
