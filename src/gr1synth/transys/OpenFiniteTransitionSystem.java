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
package gr1synth.transys;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A transition system open to an environment. A transition may be tagged with
 * an environment action, a system action, both or neither.
 *
 */
public class OpenFiniteTransitionSystem extends AbstractTransitionSystem {
	private final LinkedHashSet<String> envActions = new LinkedHashSet<>();
	private final LinkedHashSet<String> sysActions = new LinkedHashSet<>();

	public void addEnvActions(String... actions) {
		for (String a : actions) {
			envActions.add(a);
		}
	}

	public void addSysActions(String... actions) {
		for (String a : actions) {
			sysActions.add(a);
		}
	}

	public Set<String> envActions() {
		return Collections.unmodifiableSet(envActions);
	}

	public Set<String> sysActions() {
		return Collections.unmodifiableSet(sysActions);
	}

	/**
	 * Add a transition. Either action may be null.
	 *
	 * @param from
	 * @param to
	 * @param envAction
	 * @param sysAction
	 */
	public void addTransition(String from, String to, String envAction, String sysAction) {
		checkAction(envActions, envAction, "environment action");
		checkAction(sysActions, sysAction, "system action");
		add(new Transition(from, to, null, envAction, sysAction));
	}

	@Override
	public String toString() {
		return "environment actions: " + envActions + "\nsystem actions: " + sysActions + "\n" + super.toString();
	}
}
