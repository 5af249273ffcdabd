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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A finite transition system: states labelled with sets of atomic
 * propositions, a set of initial states, and labelled transitions. Every
 * collection keeps insertion order, so that encoding the same system twice
 * yields identical formulas.
 * <p>
 * States without outgoing transitions are allowed.
 *
 */
public abstract class AbstractTransitionSystem {
	private final LinkedHashSet<String> states = new LinkedHashSet<>();
	private final LinkedHashSet<String> initial = new LinkedHashSet<>();
	private final LinkedHashSet<String> atomicPropositions = new LinkedHashSet<>();
	private final Map<String, Set<String>> labels = new LinkedHashMap<>();
	private final Map<String, List<Transition>> transitions = new LinkedHashMap<>();

	public void addState(String state) {
		if (states.add(state)) {
			transitions.put(state, new ArrayList<>());
		}
	}

	public void addStates(Iterable<String> states) {
		for (String s : states) {
			addState(s);
		}
	}

	public void addStates(String... states) {
		for (String s : states) {
			addState(s);
		}
	}

	/**
	 * Mark a declared state as initial.
	 *
	 * @param state
	 */
	public void addInitial(String... states) {
		for (String s : states) {
			checkState(s);
			initial.add(s);
		}
	}

	public void addAtomicPropositions(String... aps) {
		for (String ap : aps) {
			atomicPropositions.add(ap);
		}
	}

	/**
	 * Set the atomic propositions which hold in a given state, replacing any
	 * previous label.
	 *
	 * @param state
	 * @param aps
	 */
	public void label(String state, String... aps) {
		checkState(state);
		LinkedHashSet<String> label = new LinkedHashSet<>();
		for (String ap : aps) {
			if (!atomicPropositions.contains(ap)) {
				throw new MalformedTransitionSystemException("undeclared atomic proposition " + ap);
			}
			label.add(ap);
		}
		labels.put(state, label);
	}

	public Set<String> states() {
		return Collections.unmodifiableSet(states);
	}

	public Set<String> initialStates() {
		return Collections.unmodifiableSet(initial);
	}

	public Set<String> atomicPropositions() {
		return Collections.unmodifiableSet(atomicPropositions);
	}

	/**
	 * The atomic propositions holding in a state (empty if it was never
	 * labelled).
	 *
	 * @param state
	 * @return
	 */
	public Set<String> labelOf(String state) {
		checkState(state);
		Set<String> label = labels.get(state);
		return label == null ? Collections.emptySet() : Collections.unmodifiableSet(label);
	}

	/**
	 * The transitions leaving a state, in the order they were added.
	 *
	 * @param state
	 * @return
	 */
	public List<Transition> transitionsFrom(String state) {
		checkState(state);
		return Collections.unmodifiableList(transitions.get(state));
	}

	public List<Transition> transitions() {
		ArrayList<Transition> all = new ArrayList<>();
		for (List<Transition> ts : transitions.values()) {
			all.addAll(ts);
		}
		return all;
	}

	protected void add(Transition t) {
		checkState(t.from());
		checkState(t.to());
		List<Transition> out = transitions.get(t.from());
		if (!out.contains(t)) {
			out.add(t);
		}
	}

	protected void checkState(String state) {
		if (!states.contains(state)) {
			throw new MalformedTransitionSystemException("undeclared state " + state);
		}
	}

	protected static void checkAction(Set<String> alphabet, String action, String kind) {
		if (action != null && !alphabet.contains(action)) {
			throw new MalformedTransitionSystemException("undeclared " + kind + " " + action);
		}
	}

	@Override
	public String toString() {
		StringBuilder out = new StringBuilder();
		out.append("states: ").append(states).append('\n');
		out.append("initial: ").append(initial).append('\n');
		out.append("atomic propositions: ").append(atomicPropositions).append('\n');
		for (String s : states) {
			out.append("  ").append(s).append(' ').append(labelOf(s)).append('\n');
		}
		for (Transition t : transitions()) {
			out.append("  ").append(t).append('\n');
		}
		return out.toString();
	}
}
