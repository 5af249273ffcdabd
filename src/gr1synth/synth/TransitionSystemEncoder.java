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

import static gr1synth.synth.VariableEncoding.conjNeg;
import static gr1synth.synth.VariableEncoding.disj;
import static gr1synth.synth.VariableEncoding.pstr;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Joiner;

import gr1synth.spec.Domain;
import gr1synth.spec.Gr1Spec;
import gr1synth.transys.AbstractTransitionSystem;
import gr1synth.transys.FiniteTransitionSystem;
import gr1synth.transys.MalformedTransitionSystemException;
import gr1synth.transys.OpenFiniteTransitionSystem;
import gr1synth.transys.Transition;
import gr1synth.util.Diagnostics;

/**
 * Translates finite transition systems into the initial and safety parts of a
 * GR(1) specification. A transition system only ever describes one side of
 * the game, so the resulting specification has no progress formulas and is
 * meant to be combined with one written by the user.
 * <p>
 * Formulas are produced in the gr1c dialect. Encoding is deterministic:
 * states, actions and propositions are visited in declaration order.
 *
 */
public class TransitionSystemEncoder {

	/**
	 * Encode a transition system which describes the system player. A closed
	 * system contributes only system variables and guarantees; an open system
	 * also constrains the environment's actions.
	 *
	 * @param ts
	 * @param options
	 * @return
	 */
	public static Gr1Spec sysToSpec(AbstractTransitionSystem ts, EncodingOptions options) {
		if (ts instanceof FiniteTransitionSystem) {
			return closed((FiniteTransitionSystem) ts, EncodingOptions.SYS_LOCATION_VARIABLE,
					options.sysActionVariable(), options);
		} else if (ts instanceof OpenFiniteTransitionSystem) {
			return sysOpen((OpenFiniteTransitionSystem) ts, options);
		}
		throw unknown(ts);
	}

	/**
	 * Encode a transition system which describes the environment player.
	 *
	 * @param ts
	 * @param options
	 * @return
	 */
	public static Gr1Spec envToSpec(AbstractTransitionSystem ts, EncodingOptions options) {
		if (ts instanceof FiniteTransitionSystem) {
			Gr1Spec c = closed((FiniteTransitionSystem) ts, EncodingOptions.ENV_LOCATION_VARIABLE,
					options.envActionVariable(), options);
			return Gr1Spec.builder().envVars(c.sysVars()).envInit(c.sysInit()).envSafety(c.sysSafety()).build();
		} else if (ts instanceof OpenFiniteTransitionSystem) {
			return envOpen((OpenFiniteTransitionSystem) ts, options);
		}
		throw unknown(ts);
	}

	private static MalformedTransitionSystemException unknown(AbstractTransitionSystem ts) {
		String kind = ts == null ? "null" : ts.getClass().getName();
		return new MalformedTransitionSystemException(
				"cannot encode " + kind + ", expected a closed or open finite transition system");
	}

	// ======================================================================
	// Closed systems
	// ======================================================================

	/**
	 * Encode a closed system, placing everything on the system side.
	 *
	 * @param fts
	 * @param stateVar
	 * @param actionVar
	 * @param options
	 * @return
	 */
	public static Gr1Spec closed(FiniteTransitionSystem fts, String stateVar, String actionVar,
			EncodingOptions options) {
		Diagnostics diagnostics = options.diagnostics();
		Gr1Spec.Builder spec = Gr1Spec.builder();
		spec.sysVars(propositions(fts));
		VariableEncoding actions = VariableEncoding.encodeActions(fts.actions(), actionVar,
				options.actionConstraint(), options.boolActions(), diagnostics);
		spec.sysVars(actions.variables()).sysSafety(actions.safety()).sysInit(actions.init());
		VariableEncoding states = VariableEncoding.encodeStates(fts.states(), stateVar, options.boolStates(),
				diagnostics);
		spec.sysVars(states.variables()).sysSafety(states.safety());
		spec.sysInit(initFromTs(fts, states, options.ignoreInitial(), diagnostics));
		spec.sysSafety(transFromTs(fts, states, actions, null, null, diagnostics));
		spec.sysSafety(apTransFromTs(fts, states));
		return spec.build();
	}

	// ======================================================================
	// Open systems
	// ======================================================================

	/**
	 * Encode an open system from the point of view of the system player, which
	 * owns the location and the system actions. The environment's actions are
	 * restricted to those offered by the current location.
	 *
	 * @param ofts
	 * @param options
	 * @return
	 */
	public static Gr1Spec sysOpen(OpenFiniteTransitionSystem ofts, EncodingOptions options) {
		Diagnostics diagnostics = options.diagnostics();
		Gr1Spec.Builder spec = Gr1Spec.builder();
		spec.sysVars(propositions(ofts));
		VariableEncoding sysActions = VariableEncoding.encodeActions(ofts.sysActions(),
				options.sysActionVariable(), options.actionConstraint(), options.boolActions(), diagnostics);
		spec.sysVars(sysActions.variables()).sysSafety(sysActions.safety()).sysInit(sysActions.init());
		VariableEncoding envActions = VariableEncoding.encodeActions(ofts.envActions(),
				options.envActionVariable(), options.actionConstraint(), options.boolActions(), diagnostics);
		spec.envVars(envActions.variables()).envSafety(envActions.safety()).envInit(envActions.init());
		VariableEncoding states = VariableEncoding.encodeStates(ofts.states(), EncodingOptions.SYS_LOCATION_VARIABLE,
				options.boolStates(), diagnostics);
		spec.sysVars(states.variables()).sysSafety(states.safety());
		spec.sysInit(initFromTs(ofts, states, options.ignoreInitial(), diagnostics));
		spec.sysSafety(transFromTs(ofts, states, null, envActions, sysActions, diagnostics));
		spec.sysSafety(apTransFromTs(ofts, states));
		spec.envSafety(envTransFromSysTs(ofts, states, envActions));
		return spec.build();
	}

	/**
	 * Encode an open system from the point of view of the environment player,
	 * which owns the location and the environment actions. The system's
	 * actions are declared here too, since the system may not be described by
	 * a transition system of its own.
	 *
	 * @param ofts
	 * @param options
	 * @return
	 */
	public static Gr1Spec envOpen(OpenFiniteTransitionSystem ofts, EncodingOptions options) {
		Diagnostics diagnostics = options.diagnostics();
		Gr1Spec.Builder spec = Gr1Spec.builder();
		// propositions follow the environment's location
		spec.envVars(propositions(ofts));
		VariableEncoding envActions = VariableEncoding.encodeActions(ofts.envActions(),
				options.envActionVariable(), options.actionConstraint(), options.boolActions(), diagnostics);
		spec.envVars(envActions.variables()).envSafety(envActions.safety()).envInit(envActions.init());
		VariableEncoding sysActions = VariableEncoding.encodeActions(ofts.sysActions(),
				options.sysActionVariable(), options.actionConstraint(), options.boolActions(), diagnostics);
		spec.sysVars(sysActions.variables()).sysSafety(sysActions.safety()).sysInit(sysActions.init());
		VariableEncoding states = VariableEncoding.encodeStates(ofts.states(), EncodingOptions.ENV_LOCATION_VARIABLE,
				options.boolStates(), diagnostics);
		spec.envVars(states.variables()).envSafety(states.safety());
		spec.envInit(initFromTs(ofts, states, options.ignoreInitial(), diagnostics));
		spec.envSafety(envTransFromEnvTs(ofts, states, envActions, sysActions, diagnostics));
		spec.envSafety(apTransFromTs(ofts, states));
		return spec.build();
	}

	// ======================================================================
	// Formula generation
	// ======================================================================

	/**
	 * Initial formulas: each labelled initial state implies its propositions,
	 * and (unless ignored) one of the initial states holds.
	 *
	 * @param ts
	 * @param states
	 * @param ignoreInitial
	 * @param diagnostics
	 * @return
	 */
	public static List<String> initFromTs(AbstractTransitionSystem ts, VariableEncoding states,
			boolean ignoreInitial, Diagnostics diagnostics) {
		ArrayList<String> init = new ArrayList<>();
		for (String s : ts.initialStates()) {
			String aps = printPropositions(ts.labelOf(s), ts.atomicPropositions());
			if (!aps.isEmpty()) {
				init.add("!(" + pstr(states.id(s)) + ") || (" + aps + ")");
			}
		}
		if (ignoreInitial) {
			return init;
		}
		if (ts.initialStates().isEmpty()) {
			diagnostics.warning("transition system has no initial states; the initial formula is False, "
					+ "so a guarantee becomes False and an assumption makes the specification trivially True");
			init.add("False");
			return init;
		}
		ArrayList<String> ids = new ArrayList<>();
		for (String s : ts.initialStates()) {
			ids.add(states.id(s));
		}
		init.add(disj(ids));
		return init;
	}

	/**
	 * One safety formula per state, requiring the next step to follow one of
	 * its outgoing transitions. Each successor is conjoined with the actions
	 * labelling its edge.
	 *
	 * @param ts
	 * @param states
	 * @param actions
	 *            Identifiers of closed system actions, or null for an open
	 *            system.
	 * @param envActions
	 *            Null for a closed system.
	 * @param sysActions
	 *            Null for a closed system.
	 * @param diagnostics
	 * @return
	 */
	public static List<String> transFromTs(AbstractTransitionSystem ts, VariableEncoding states,
			VariableEncoding actions, VariableEncoding envActions, VariableEncoding sysActions,
			Diagnostics diagnostics) {
		ArrayList<String> safety = new ArrayList<>();
		for (String from : ts.states()) {
			String precond = pstr(states.id(from));
			List<Transition> out = ts.transitionsFrom(from);
			if (out.isEmpty()) {
				diagnostics.warning("state " + from + " has no outgoing transitions");
				safety.add(precond + " -> X(False)");
				continue;
			}
			ArrayList<String> posts = new ArrayList<>();
			for (Transition t : out) {
				String post = pstr(states.id(t.to()));
				post += conjAction(t.envAction(), envActions, false);
				post += conjAction(t.sysAction(), sysActions, false);
				post += conjAction(t.action(), actions, false);
				posts.add(post);
			}
			safety.add(precond + " -> X(" + disj(posts) + ")");
		}
		return safety;
	}

	/**
	 * Restrict the environment to the actions offered by the outgoing
	 * transitions of the current state. A state without transitions offers no
	 * action at all.
	 *
	 * @param ts
	 * @param states
	 * @param envActions
	 * @return
	 */
	public static List<String> envTransFromSysTs(AbstractTransitionSystem ts, VariableEncoding states,
			VariableEncoding envActions) {
		ArrayList<String> safety = new ArrayList<>();
		if (envActions.ids().isEmpty()) {
			return safety;
		}
		for (String from : ts.states()) {
			String precond = pstr(states.id(from));
			List<Transition> out = ts.transitionsFrom(from);
			if (out.isEmpty()) {
				safety.add(precond + " -> X(" + conjNeg(envActions.ids().values()) + ")");
				continue;
			}
			Set<String> next = new LinkedHashSet<>();
			for (Transition t : out) {
				if (t.envAction() != null) {
					next.add(envActions.id(t.envAction()));
				}
			}
			// no edge mentions an environment action
			if (!next.isEmpty()) {
				safety.add(precond + " -> X(" + disj(next) + ")");
			}
		}
		return safety;
	}

	/**
	 * The environment's transition relation, read from its own transition
	 * system. A transition may depend on the system action of the previous
	 * step.
	 *
	 * @param ts
	 * @param states
	 * @param envActions
	 * @param sysActions
	 * @param diagnostics
	 * @return
	 */
	public static List<String> envTransFromEnvTs(AbstractTransitionSystem ts, VariableEncoding states,
			VariableEncoding envActions, VariableEncoding sysActions, Diagnostics diagnostics) {
		ArrayList<String> safety = new ArrayList<>();
		for (String from : ts.states()) {
			String precond = pstr(states.id(from));
			List<Transition> out = ts.transitionsFrom(from);
			if (out.isEmpty()) {
				diagnostics.warning("environment dead end at state " + from
						+ "; if the system can force it, the assumption becomes False and the specification "
						+ "trivially True");
				safety.add(precond + " -> X(False)");
				continue;
			}
			ArrayList<String> posts = new ArrayList<>();
			boolean free = false;
			for (Transition t : out) {
				String post = "X" + pstr(states.id(t.to()));
				post += conjAction(t.envAction(), envActions, true);
				String sys = conjAction(t.sysAction(), sysActions, false);
				post += sys;
				if (sys.isEmpty()) {
					free = true;
				}
				posts.add(pstr(post));
			}
			// Otherwise the system could make the assumption False by asserting
			// no action at all.
			// TODO: replace this with an explicit game structure once open
			// systems carry one.
			if (!free && !sysActions.ids().isEmpty()) {
				posts.add(conjNeg(sysActions.ids().values()));
			}
			safety.add(pstr(precond) + " -> (" + disj(posts) + ")");
		}
		return safety;
	}

	/**
	 * Tie the propositions to the labels of the states they hold in.
	 *
	 * @param ts
	 * @param states
	 * @return
	 */
	public static List<String> apTransFromTs(AbstractTransitionSystem ts, VariableEncoding states) {
		ArrayList<String> safety = new ArrayList<>();
		if (ts.atomicPropositions().isEmpty()) {
			return safety;
		}
		for (String s : ts.states()) {
			String aps = printPropositions(ts.labelOf(s), ts.atomicPropositions());
			if (!aps.isEmpty()) {
				safety.add("X((" + states.id(s) + ") -> (" + aps + "))");
			}
		}
		return safety;
	}

	/**
	 * The conjunction of the propositions in a label with the negations of
	 * those outside it, in proposition order.
	 *
	 * @param label
	 * @param aps
	 * @return
	 */
	public static String printPropositions(Set<String> label, Set<String> aps) {
		ArrayList<String> literals = new ArrayList<>();
		for (String ap : aps) {
			if (label.contains(ap)) {
				literals.add(ap);
			}
		}
		for (String ap : aps) {
			if (!label.contains(ap)) {
				literals.add("!" + ap);
			}
		}
		return Joiner.on(" && ").join(literals);
	}

	private static String conjAction(String action, VariableEncoding ids, boolean next) {
		if (action == null) {
			return "";
		}
		String id = ids.id(action);
		if (id == null || id.isEmpty()) {
			return "";
		}
		return next ? " && X" + pstr(id) : " && " + pstr(id);
	}

	private static Map<String, Domain> propositions(AbstractTransitionSystem ts) {
		Map<String, Domain> vars = new LinkedHashMap<>();
		for (String ap : ts.atomicPropositions()) {
			vars.put(ap, Domain.BOOLEAN);
		}
		return vars;
	}
}
