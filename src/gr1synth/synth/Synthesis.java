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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Strings;

import gr1synth.spec.Gr1Spec;
import gr1synth.transys.AbstractTransitionSystem;
import gr1synth.util.Diagnostics;

/**
 * Entry points which combine a user specification with encoded transition
 * systems and hand the result to a solver.
 *
 */
public class Synthesis {
	private static final String RULE = "\n" + Strings.repeat("-", 60);

	/**
	 * Conjoin a specification with the encodings of an environment and a
	 * system transition system. Either transition system may be null. The
	 * encodings use the given options, except that initial states are ignored
	 * on each side as requested.
	 *
	 * @param spec
	 * @param env
	 * @param sys
	 * @param ignoreEnvInit
	 * @param ignoreSysInit
	 * @param options
	 * @return
	 */
	public static Gr1Spec specPlusSystems(Gr1Spec spec, AbstractTransitionSystem env, AbstractTransitionSystem sys,
			boolean ignoreEnvInit, boolean ignoreSysInit, EncodingOptions options) {
		checkNotNull(spec);
		Diagnostics diagnostics = options.diagnostics();
		if (sys != null) {
			Gr1Spec s = TransitionSystemEncoder.sysToSpec(sys, options.withIgnoreInitial(ignoreSysInit));
			spec = spec.combine(s);
			diagnostics.debug("sys TS:\n" + s.pretty() + RULE);
		}
		if (env != null) {
			Gr1Spec e = TransitionSystemEncoder.envToSpec(env, options.withIgnoreInitial(ignoreEnvInit));
			spec = spec.combine(e);
			diagnostics.debug("env TS:\n" + e.pretty() + RULE);
		}
		diagnostics.debug("Overall Spec:\n" + spec.pretty() + RULE);
		return spec;
	}

	/**
	 * Adjust the options to what a solver can handle. A solver without integer
	 * domains gets Boolean states and actions.
	 *
	 * @param solver
	 * @param options
	 * @return
	 */
	public static EncodingOptions checkSolverOptions(Solver solver, EncodingOptions options) {
		if (solver.supportsIntegerDomains()) {
			return options;
		}
		if (!options.boolStates()) {
			options.diagnostics().warning("integer states not available for " + solver.name() + ", using bool states");
			options = options.withBoolStates(true);
		}
		if (!options.boolActions()) {
			options.diagnostics()
					.warning("integer actions not available for " + solver.name() + ", using bool actions");
			options = options.withBoolActions(true);
		}
		return options;
	}

	/**
	 * Synthesize a strategy for a specification together with the given
	 * transition systems.
	 *
	 * @param solver
	 * @param spec
	 * @param env
	 * @param sys
	 * @param ignoreEnvInit
	 * @param ignoreSysInit
	 * @param options
	 * @return The strategy, or null if none exists.
	 */
	public static MealyMachine synthesize(Solver solver, Gr1Spec spec, AbstractTransitionSystem env,
			AbstractTransitionSystem sys, boolean ignoreEnvInit, boolean ignoreSysInit, EncodingOptions options) {
		Gr1Spec input = prepare(solver, spec, env, sys, ignoreEnvInit, ignoreSysInit, options);
		Diagnostics diagnostics = options.diagnostics();
		MealyMachine ctrl = solver.synthesize(input, diagnostics);
		if (ctrl == null) {
			diagnostics.debug("No Mealy machine returned.");
		} else {
			diagnostics.debug("Mealy machine has: n = " + ctrl.size() + " states.");
		}
		return ctrl;
	}

	public static boolean isRealizable(Solver solver, Gr1Spec spec, AbstractTransitionSystem env,
			AbstractTransitionSystem sys, boolean ignoreEnvInit, boolean ignoreSysInit, EncodingOptions options) {
		Gr1Spec input = prepare(solver, spec, env, sys, ignoreEnvInit, ignoreSysInit, options);
		return solver.isRealizable(input, options.diagnostics());
	}

	private static Gr1Spec prepare(Solver solver, Gr1Spec spec, AbstractTransitionSystem env,
			AbstractTransitionSystem sys, boolean ignoreEnvInit, boolean ignoreSysInit, EncodingOptions options) {
		options = checkSolverOptions(solver, options);
		Gr1Spec merged = specPlusSystems(spec, env, sys, ignoreEnvInit, ignoreSysInit, options);
		return merged.translate(solver.dialect());
	}
}
