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
 * A closed transition system, where every transition may be tagged with one
 * action drawn from a single alphabet.
 *
 */
public class FiniteTransitionSystem extends AbstractTransitionSystem {
	private final LinkedHashSet<String> actions = new LinkedHashSet<>();

	public void addActions(String... actions) {
		for (String a : actions) {
			this.actions.add(a);
		}
	}

	public Set<String> actions() {
		return Collections.unmodifiableSet(actions);
	}

	/**
	 * Add an unlabelled transition.
	 *
	 * @param from
	 * @param to
	 */
	public void addTransition(String from, String to) {
		addTransition(from, to, null);
	}

	public void addTransition(String from, String to, String action) {
		checkAction(actions, action, "action");
		add(new Transition(from, to, action, null, null));
	}

	/**
	 * Add one transition for every true entry of an adjacency matrix, whose rows
	 * and columns are indexed by the given states. Every added transition
	 * carries the same action (which may be null).
	 *
	 * @param adjacency
	 * @param states
	 * @param action
	 */
	public void addAdjacency(boolean[][] adjacency, String[] states, String action) {
		for (int i = 0; i != adjacency.length; ++i) {
			for (int j = 0; j != adjacency[i].length; ++j) {
				if (adjacency[i][j]) {
					addTransition(states[i], states[j], action);
				}
			}
		}
	}

	@Override
	public String toString() {
		return "actions: " + actions + "\n" + super.toString();
	}
}
