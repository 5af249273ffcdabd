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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;

import gr1synth.spec.Domain;
import gr1synth.util.Diagnostics;

/**
 * Represents a set of named states or actions by specification variables. The
 * encoding is either Boolean (one variable per name, identified by the name
 * itself) or integer (a single variable, with each name identified by an
 * equality such as <code>loc = 2</code>). Besides the identifiers, an
 * encoding carries the variable declarations it needs and the initial and
 * safety formulas constraining them.
 *
 */
public final class VariableEncoding {
	private static final VariableEncoding EMPTY = new VariableEncoding(true, ImmutableMap.of(), ImmutableMap.of(),
			ImmutableList.of(), ImmutableList.of());

	private final boolean bool;
	private final ImmutableMap<String, String> ids;
	private final ImmutableMap<String, Domain> variables;
	private final ImmutableList<String> init;
	private final ImmutableList<String> safety;

	private VariableEncoding(boolean bool, Map<String, String> ids, Map<String, Domain> variables,
			List<String> init, List<String> safety) {
		this.bool = bool;
		this.ids = ImmutableMap.copyOf(ids);
		this.variables = ImmutableMap.copyOf(variables);
		this.init = ImmutableList.copyOf(init);
		this.safety = ImmutableList.copyOf(safety);
	}

	public boolean isBoolean() {
		return bool;
	}

	/**
	 * Maps each encoded name to the formula which holds exactly when that
	 * name is current.
	 *
	 * @return
	 */
	public ImmutableMap<String, String> ids() {
		return ids;
	}

	public String id(String name) {
		return ids.get(name);
	}

	public ImmutableMap<String, Domain> variables() {
		return variables;
	}

	public ImmutableList<String> init() {
		return init;
	}

	public ImmutableList<String> safety() {
		return safety;
	}

	// ======================================================================
	// Cardinality constraints
	// ======================================================================

	/**
	 * Construct the constraint that at most one of the given labels holds.
	 * Empty labels are ignored. The result is empty when fewer than two labels
	 * remain, otherwise it holds a single formula.
	 *
	 * @param labels
	 * @return
	 */
	public static List<String> mutex(Iterable<String> labels) {
		ArrayList<String> items = new ArrayList<>();
		for (String l : labels) {
			if (!l.isEmpty()) {
				items.add(l);
			}
		}
		if (items.size() <= 1) {
			return Collections.emptyList();
		}
		ArrayList<String> clauses = new ArrayList<>();
		for (String x : items) {
			clauses.add("!(" + x + ") || (" + conjNegExcept(items, x) + ")");
		}
		return Collections.singletonList(conj(clauses));
	}

	/**
	 * Construct the constraint that exactly one of the given labels holds. A
	 * single label is simply asserted, and no labels give no constraint.
	 *
	 * @param labels
	 * @return
	 */
	public static List<String> exactlyOne(Iterable<String> labels) {
		List<String> items = ImmutableList.copyOf(labels);
		if (items.isEmpty()) {
			return Collections.emptyList();
		} else if (items.size() == 1) {
			return Collections.singletonList(pstr(items.get(0)));
		}
		ArrayList<String> cases = new ArrayList<>();
		for (String x : items) {
			cases.add("(" + x + ") && " + conjNegExcept(items, x));
		}
		return Collections.singletonList("(" + disj(cases) + ")");
	}

	// ======================================================================
	// States
	// ======================================================================

	/**
	 * Encode a set of states. An integer variable named <code>stateVar</code>
	 * is used unless Boolean states are requested or there are fewer than
	 * three states. When every state is a letter followed by a distinct
	 * non-negative number (e.g. <code>s0</code>, <code>s7</code>), that number
	 * is the state's value, and a safety formula keeps the variable on those
	 * values when the numbering has gaps. Otherwise the variable ranges over the
	 * state names themselves.
	 *
	 * @param states
	 * @param stateVar
	 * @param boolStates
	 * @param diagnostics
	 * @return
	 */
	public static VariableEncoding encodeStates(Collection<String> states, String stateVar, boolean boolStates,
			Diagnostics diagnostics) {
		if (states.size() < 3) {
			boolStates = true;
		}
		if (boolStates) {
			diagnostics.debug("bool states: " + states);
			return booleans(states, Collections.emptyList(), exactlyOne(states));
		}
		Map<String, Integer> numbers = stateNumbers(states);
		LinkedHashMap<String, String> ids = new LinkedHashMap<>();
		Domain domain;
		List<String> safety = Collections.emptyList();
		if (numbers != null) {
			int hi = states.size() - 1;
			for (Map.Entry<String, Integer> e : numbers.entrySet()) {
				ids.put(e.getKey(), stateVar + " = " + e.getValue());
				hi = Math.max(hi, e.getValue());
			}
			domain = Domain.range(0, hi);
			if (hi + 1 > states.size()) {
				// values between the state numbers are not locations
				safety = Collections.singletonList(disj(ids.values()));
			}
		} else {
			for (String s : states) {
				ids.put(s, stateVar + " = " + s);
			}
			domain = Domain.enumeration(states);
		}
		diagnostics.debug("int states: " + stateVar + " in " + domain);
		return new VariableEncoding(false, ids, ImmutableMap.of(stateVar, domain), Collections.emptyList(), safety);
	}

	private static Map<String, Integer> stateNumbers(Collection<String> states) {
		LinkedHashMap<String, Integer> numbers = new LinkedHashMap<>();
		Set<Integer> seen = new HashSet<>();
		for (String s : states) {
			if (s.length() < 2 || !Character.isLetter(s.charAt(0))) {
				return null;
			}
			Integer n = Ints.tryParse(s.substring(1));
			if (n == null || n < 0 || !seen.add(n)) {
				return null;
			}
			numbers.put(s, n);
		}
		return numbers;
	}

	// ======================================================================
	// Actions
	// ======================================================================

	/**
	 * Encode a set of actions under a given constraint. Actions which are not
	 * mutually exclusive can only be encoded as Booleans, whatever
	 * <code>boolActions</code> says.
	 *
	 * @param actions
	 * @param actionVar
	 * @param constraint
	 * @param boolActions
	 * @param diagnostics
	 * @return
	 */
	public static VariableEncoding encodeActions(Collection<String> actions, String actionVar,
			ActionConstraint constraint, boolean boolActions, Diagnostics diagnostics) {
		return encodeActions(actions, actionVar, constraint.isMutex(), constraint.isMinOne(), boolActions,
				diagnostics);
	}

	/**
	 * Encode a set of actions given the two underlying flags of an action
	 * constraint. Requiring at least one action without mutual exclusion is
	 * not supported.
	 *
	 * @param actions
	 * @param actionVar
	 * @param useMutex
	 * @param minOne
	 * @param boolActions
	 * @param diagnostics
	 * @return
	 * @throws InvalidEncodingOptionException
	 *             if <code>minOne</code> is set without <code>useMutex</code>.
	 */
	public static VariableEncoding encodeActions(Collection<String> actions, String actionVar, boolean useMutex,
			boolean minOne, boolean boolActions, Diagnostics diagnostics) {
		if (minOne && !useMutex) {
			throw new InvalidEncodingOptionException("requiring at least one action needs mutual exclusion");
		}
		if (actions.isEmpty()) {
			return EMPTY;
		}
		if (!useMutex) {
			boolActions = true;
		}
		if (boolActions) {
			diagnostics.debug("bool actions: " + actions);
			if (!useMutex || mutex(actions).isEmpty()) {
				// a single action needs no constraint
				return booleans(actions, Collections.emptyList(), Collections.emptyList());
			}
			List<String> constraint = minOne ? exactlyOne(actions) : mutex(actions);
			return booleans(actions, constraint, Collections.singletonList("X (" + constraint.get(0) + ")"));
		}
		LinkedHashMap<String, String> ids = new LinkedHashMap<>();
		for (String a : actions) {
			ids.put(a, actionVar + " = " + a);
		}
		Domain domain;
		List<Integer> values = actionValues(actions);
		if (values != null) {
			int hi = actions.size() - 1;
			for (int v : values) {
				hi = Math.max(hi, v);
			}
			// one more value for no action
			domain = Domain.range(0, minOne ? hi : hi + 1);
		} else {
			ArrayList<String> names = new ArrayList<>(actions);
			if (!minOne) {
				names.add(noneValue(actionVar));
			}
			domain = Domain.enumeration(names);
		}
		diagnostics.debug("int actions: " + actionVar + " in " + domain);
		return new VariableEncoding(false, ids, ImmutableMap.of(actionVar, domain), Collections.emptyList(),
				Collections.emptyList());
	}

	/**
	 * The value of an enumerated action variable when no action is taken.
	 *
	 * @param actionVar
	 * @return
	 */
	public static String noneValue(String actionVar) {
		return actionVar + "none";
	}

	private static List<Integer> actionValues(Collection<String> actions) {
		ArrayList<Integer> values = new ArrayList<>();
		for (String a : actions) {
			Integer v = Ints.tryParse(a);
			if (v == null || v < 0) {
				return null;
			}
			values.add(v);
		}
		return values;
	}

	private static VariableEncoding booleans(Collection<String> names, List<String> init, List<String> safety) {
		LinkedHashMap<String, String> ids = new LinkedHashMap<>();
		LinkedHashMap<String, Domain> variables = new LinkedHashMap<>();
		for (String n : names) {
			ids.put(n, n);
			variables.put(n, Domain.BOOLEAN);
		}
		return new VariableEncoding(true, ids, variables, init, safety);
	}

	// ======================================================================
	// Formula helpers
	// ======================================================================

	static String pstr(String s) {
		return "(" + s + ")";
	}

	/**
	 * Disjunction of the given formulas, each parenthesised. Empty when there
	 * are none.
	 */
	static String disj(Iterable<String> items) {
		return join(" || ", items);
	}

	static String conj(Iterable<String> items) {
		return join(" && ", items);
	}

	/**
	 * Conjunction of the negations of the given formulas.
	 */
	static String conjNeg(Iterable<String> items) {
		ArrayList<String> negated = new ArrayList<>();
		for (String x : items) {
			negated.add("!(" + x + ")");
		}
		return Joiner.on(" && ").join(negated);
	}

	private static String conjNegExcept(Iterable<String> items, String except) {
		ArrayList<String> rest = new ArrayList<>();
		for (String x : items) {
			if (!x.equals(except)) {
				rest.add(x);
			}
		}
		return conjNeg(rest);
	}

	private static String join(String separator, Iterable<String> items) {
		ArrayList<String> parts = new ArrayList<>();
		for (String x : items) {
			parts.add(pstr(x));
		}
		return Joiner.on(separator).join(parts);
	}

	@Override
	public String toString() {
		return "{ids=" + ids + ", variables=" + variables + ", init=" + init + ", safety=" + safety + "}";
	}
}
