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

import gr1synth.util.Diagnostics;

/**
 * Controls how a transition system is turned into GR(1) formulas. Instances
 * are immutable; each <code>with</code> method returns a modified copy.
 *
 */
public final class EncodingOptions {
	/**
	 * The name of the integer variable holding the current location, when the
	 * location belongs to the system.
	 */
	public static final String SYS_LOCATION_VARIABLE = "loc";
	/**
	 * As above, when the location belongs to the environment.
	 */
	public static final String ENV_LOCATION_VARIABLE = "eloc";

	private final boolean ignoreInitial;
	private final boolean boolStates;
	private final boolean boolActions;
	private final ActionConstraint actionConstraint;
	private final String envActionVariable;
	private final String sysActionVariable;
	private final Diagnostics diagnostics;

	private EncodingOptions(boolean ignoreInitial, boolean boolStates, boolean boolActions,
			ActionConstraint actionConstraint, String envActionVariable, String sysActionVariable,
			Diagnostics diagnostics) {
		this.ignoreInitial = ignoreInitial;
		this.boolStates = boolStates;
		this.boolActions = boolActions;
		this.actionConstraint = checkNotNull(actionConstraint);
		this.envActionVariable = checkVariableName(envActionVariable);
		this.sysActionVariable = checkVariableName(sysActionVariable);
		this.diagnostics = checkNotNull(diagnostics);
	}

	/**
	 * Integer states and actions where possible, no action constraint, initial
	 * states respected, and warnings recorded silently.
	 *
	 * @return
	 */
	public static EncodingOptions defaults() {
		return new EncodingOptions(false, false, false, ActionConstraint.NONE, "eact", "act", Diagnostics.silent());
	}

	public boolean ignoreInitial() {
		return ignoreInitial;
	}

	public boolean boolStates() {
		return boolStates;
	}

	public boolean boolActions() {
		return boolActions;
	}

	public ActionConstraint actionConstraint() {
		return actionConstraint;
	}

	public String envActionVariable() {
		return envActionVariable;
	}

	public String sysActionVariable() {
		return sysActionVariable;
	}

	public Diagnostics diagnostics() {
		return diagnostics;
	}

	public EncodingOptions withIgnoreInitial(boolean flag) {
		return new EncodingOptions(flag, boolStates, boolActions, actionConstraint, envActionVariable,
				sysActionVariable, diagnostics);
	}

	public EncodingOptions withBoolStates(boolean flag) {
		return new EncodingOptions(ignoreInitial, flag, boolActions, actionConstraint, envActionVariable,
				sysActionVariable, diagnostics);
	}

	public EncodingOptions withBoolActions(boolean flag) {
		return new EncodingOptions(ignoreInitial, boolStates, flag, actionConstraint, envActionVariable,
				sysActionVariable, diagnostics);
	}

	public EncodingOptions withActionConstraint(ActionConstraint constraint) {
		return new EncodingOptions(ignoreInitial, boolStates, boolActions, constraint, envActionVariable,
				sysActionVariable, diagnostics);
	}

	/**
	 * Set the names of the integer variables used for environment and system
	 * actions respectively.
	 *
	 * @param env
	 * @param sys
	 * @return
	 */
	public EncodingOptions withActionVariables(String env, String sys) {
		return new EncodingOptions(ignoreInitial, boolStates, boolActions, actionConstraint, env, sys,
				diagnostics);
	}

	public EncodingOptions withDiagnostics(Diagnostics diagnostics) {
		return new EncodingOptions(ignoreInitial, boolStates, boolActions, actionConstraint, envActionVariable,
				sysActionVariable, diagnostics);
	}

	private static String checkVariableName(String name) {
		if (name == null || name.trim().isEmpty()) {
			throw new InvalidEncodingOptionException("action variable name must not be blank");
		}
		return name;
	}

	@Override
	public String toString() {
		return "{ignoreInitial=" + ignoreInitial + ", boolStates=" + boolStates + ", boolActions=" + boolActions
				+ ", actionConstraint=" + actionConstraint + ", actionVariables=(" + envActionVariable + ", "
				+ sysActionVariable + ")}";
	}
}
