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

import java.util.Objects;

/**
 * A labelled edge between two states. The label holds at most one action of
 * each kind: the action of a closed system, the environment action and the
 * system action of an open system. Absent actions are <code>null</code>.
 *
 */
public final class Transition {
	private final String from;
	private final String to;
	private final String action;
	private final String envAction;
	private final String sysAction;

	public Transition(String from, String to, String action, String envAction, String sysAction) {
		this.from = Objects.requireNonNull(from);
		this.to = Objects.requireNonNull(to);
		this.action = action;
		this.envAction = envAction;
		this.sysAction = sysAction;
	}

	public String from() {
		return from;
	}

	public String to() {
		return to;
	}

	/**
	 * The action of a closed system which fires this edge, or null.
	 *
	 * @return
	 */
	public String action() {
		return action;
	}

	public String envAction() {
		return envAction;
	}

	public String sysAction() {
		return sysAction;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Transition) {
			Transition t = (Transition) o;
			return from.equals(t.from) && to.equals(t.to) && Objects.equals(action, t.action)
					&& Objects.equals(envAction, t.envAction) && Objects.equals(sysAction, t.sysAction);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(from, to, action, envAction, sysAction);
	}

	@Override
	public String toString() {
		String label = "";
		if (action != null) {
			label += " act=" + action;
		}
		if (envAction != null) {
			label += " env=" + envAction;
		}
		if (sysAction != null) {
			label += " sys=" + sysAction;
		}
		return from + " -> " + to + (label.isEmpty() ? "" : " [" + label.trim() + "]");
	}
}
