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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * A finite-state strategy returned by a solver. Each transition reads a
 * valuation of the environment variables and writes a valuation of the system
 * variables. Boolean variables take the values 0 and 1.
 *
 */
public final class MealyMachine {
	private final ImmutableSet<String> inputs;
	private final ImmutableSet<String> outputs;
	private final ImmutableSet<String> states;
	private final ImmutableSet<String> initialStates;
	private final ImmutableList<Edge> transitions;

	private MealyMachine(Builder builder) {
		this.inputs = builder.inputs.build();
		this.outputs = builder.outputs.build();
		this.states = builder.states.build();
		this.initialStates = builder.initialStates.build();
		this.transitions = builder.transitions.build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public ImmutableSet<String> inputs() {
		return inputs;
	}

	public ImmutableSet<String> outputs() {
		return outputs;
	}

	public ImmutableSet<String> states() {
		return states;
	}

	public ImmutableSet<String> initialStates() {
		return initialStates;
	}

	public ImmutableList<Edge> transitions() {
		return transitions;
	}

	public List<Edge> transitionsFrom(String state) {
		ArrayList<Edge> out = new ArrayList<>();
		for (Edge e : transitions) {
			if (e.from().equals(state)) {
				out.add(e);
			}
		}
		return out;
	}

	public int size() {
		return states.size();
	}

	@Override
	public String toString() {
		return "{inputs=" + inputs + ", outputs=" + outputs + ", states=" + states + ", initial=" + initialStates
				+ ", transitions=" + transitions + "}";
	}

	/**
	 * A transition of the machine, labelled with the values of inputs and
	 * outputs.
	 */
	public static final class Edge {
		private final String from;
		private final String to;
		private final ImmutableMap<String, Integer> valuation;

		public Edge(String from, String to, Map<String, Integer> valuation) {
			this.from = checkNotNull(from);
			this.to = checkNotNull(to);
			this.valuation = ImmutableMap.copyOf(valuation);
		}

		public String from() {
			return from;
		}

		public String to() {
			return to;
		}

		public ImmutableMap<String, Integer> valuation() {
			return valuation;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Edge) {
				Edge e = (Edge) o;
				return from.equals(e.from) && to.equals(e.to) && valuation.equals(e.valuation);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Objects.hash(from, to, valuation);
		}

		@Override
		public String toString() {
			return from + " -> " + to + " " + valuation;
		}
	}

	public static final class Builder {
		private final ImmutableSet.Builder<String> inputs = ImmutableSet.builder();
		private final ImmutableSet.Builder<String> outputs = ImmutableSet.builder();
		private final ImmutableSet.Builder<String> states = ImmutableSet.builder();
		private final ImmutableSet.Builder<String> initialStates = ImmutableSet.builder();
		private final ImmutableList.Builder<Edge> transitions = ImmutableList.builder();
		private final HashSet<String> declared = new HashSet<>();

		private Builder() {
		}

		public Builder inputs(Iterable<String> names) {
			inputs.addAll(names);
			return this;
		}

		public Builder outputs(Iterable<String> names) {
			outputs.addAll(names);
			return this;
		}

		public Builder state(String state, boolean initial) {
			states.add(state);
			declared.add(state);
			if (initial) {
				initialStates.add(state);
			}
			return this;
		}

		public Builder transition(String from, String to, Map<String, Integer> valuation) {
			checkArgument(declared.contains(from), "undeclared state %s", from);
			checkArgument(declared.contains(to), "undeclared state %s", to);
			transitions.add(new Edge(from, to, valuation));
			return this;
		}

		public MealyMachine build() {
			return new MealyMachine(this);
		}
	}
}
