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
package gr1synth.spec;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import gr1synth.core.Dialect;
import gr1synth.core.Syntax.Expr;
import gr1synth.io.Emitter;
import gr1synth.io.Parser;

/**
 * A GR(1) specification: typed environment and system variables, plus the
 * initial, safety and progress formulas of the assumption (environment) and of
 * the guarantee (system). The formulas in each group are implicitly conjoined.
 * Instances are immutable; use {@link Builder} to create one and
 * {@link #combine(Gr1Spec)} to merge two.
 *
 */
public final class Gr1Spec {
	private static final Gr1Spec EMPTY = builder().build();

	private final ImmutableMap<String, Domain> envVars;
	private final ImmutableMap<String, Domain> sysVars;
	private final ImmutableList<String> envInit;
	private final ImmutableList<String> sysInit;
	private final ImmutableList<String> envSafety;
	private final ImmutableList<String> sysSafety;
	private final ImmutableList<String> envProg;
	private final ImmutableList<String> sysProg;

	private Gr1Spec(final Builder builder) {
		this.envVars = ImmutableMap.copyOf(builder.envVars);
		this.sysVars = ImmutableMap.copyOf(builder.sysVars);
		this.envInit = builder.envInit.build();
		this.sysInit = builder.sysInit.build();
		this.envSafety = builder.envSafety.build();
		this.sysSafety = builder.sysSafety.build();
		this.envProg = builder.envProg.build();
		this.sysProg = builder.sysProg.build();
	}

	public static Gr1Spec empty() {
		return EMPTY;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * A builder initialised with the contents of this specification.
	 *
	 * @return
	 */
	public Builder toBuilder() {
		return builder().addAll(this);
	}

	public ImmutableMap<String, Domain> envVars() {
		return envVars;
	}

	public ImmutableMap<String, Domain> sysVars() {
		return sysVars;
	}

	public ImmutableList<String> envInit() {
		return envInit;
	}

	public ImmutableList<String> sysInit() {
		return sysInit;
	}

	public ImmutableList<String> envSafety() {
		return envSafety;
	}

	public ImmutableList<String> sysSafety() {
		return sysSafety;
	}

	public ImmutableList<String> envProg() {
		return envProg;
	}

	public ImmutableList<String> sysProg() {
		return sysProg;
	}

	/**
	 * Merge two specifications. Variable declarations are united, and each
	 * formula group of the result lists the formulas of the left operand
	 * followed by those of the right. Duplicate formulas are kept.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 * @throws ConflictingDeclarationException
	 *             if a variable is declared with different domains, or on
	 *             different sides.
	 */
	public static Gr1Spec combine(Gr1Spec lhs, Gr1Spec rhs) {
		return lhs.toBuilder().addAll(rhs).build();
	}

	public Gr1Spec combine(Gr1Spec other) {
		return combine(this, other);
	}

	/**
	 * Rewrite every formula into the given dialect by parsing it and emitting
	 * the resulting tree. Variable declarations are unchanged.
	 *
	 * @param dialect
	 * @return
	 */
	public Gr1Spec translate(Dialect dialect) {
		Set<String> values = enumerationValues();
		Builder b = builder();
		b.envVars.putAll(envVars);
		b.sysVars.putAll(sysVars);
		b.envInit.addAll(translate(envInit, dialect, values));
		b.sysInit.addAll(translate(sysInit, dialect, values));
		b.envSafety.addAll(translate(envSafety, dialect, values));
		b.sysSafety.addAll(translate(sysSafety, dialect, values));
		b.envProg.addAll(translate(envProg, dialect, values));
		b.sysProg.addAll(translate(sysProg, dialect, values));
		return b.build();
	}

	private static List<String> translate(List<String> formulas, Dialect dialect, Set<String> values) {
		ImmutableList.Builder<String> r = ImmutableList.builder();
		for (String f : formulas) {
			r.add(f.trim().isEmpty() ? f : Emitter.render(dialect, Parser.parse(f), values));
		}
		return r.build();
	}

	/**
	 * The values of enumerated variables. None of them is also a variable.
	 *
	 * @return
	 */
	private Set<String> enumerationValues() {
		Set<String> values = new LinkedHashSet<>();
		for (Map<String, Domain> vars : ImmutableList.of(envVars, sysVars)) {
			for (Domain d : vars.values()) {
				if (d instanceof Domain.Enumeration) {
					values.addAll(((Domain.Enumeration) d).values());
				}
			}
		}
		return values;
	}

	/**
	 * The names of all declared variables.
	 *
	 * @return
	 */
	public ImmutableSet<String> variables() {
		return ImmutableSet.<String>builder().addAll(envVars.keySet()).addAll(sysVars.keySet()).build();
	}

	/**
	 * Find the names used in formulas which are neither declared as a
	 * variable nor listed as a value of an enumerated variable.
	 *
	 * @return
	 */
	public Set<String> undeclaredVariables() {
		Set<String> known = new LinkedHashSet<>(variables());
		known.addAll(enumerationValues());
		Set<String> unknown = new LinkedHashSet<>();
		for (List<String> group : ImmutableList.of(envInit, sysInit, envSafety, sysSafety, envProg, sysProg)) {
			for (String f : group) {
				if (f.trim().isEmpty()) {
					continue;
				}
				for (Expr.Variable v : Parser.parse(f).freeVariables()) {
					if (!known.contains(v.name())) {
						unknown.add(v.name());
					}
				}
			}
		}
		return unknown;
	}

	/**
	 * Human readable listing of the whole specification, for diagnostics.
	 *
	 * @return
	 */
	public String pretty() {
		StringBuilder out = new StringBuilder();
		out.append("ENVIRONMENT VARIABLES:\n");
		prettyVars(out, envVars);
		out.append("\nSYSTEM VARIABLES:\n");
		prettyVars(out, sysVars);
		out.append("\nFORMULA:\n");
		out.append("ASSUMPTION:\n");
		prettyGroup(out, "INITIAL", envInit);
		prettyGroup(out, "SAFETY", envSafety);
		prettyGroup(out, "LIVENESS", envProg);
		out.append("GUARANTEE:\n");
		prettyGroup(out, "INITIAL", sysInit);
		prettyGroup(out, "SAFETY", sysSafety);
		prettyGroup(out, "LIVENESS", sysProg);
		return out.toString();
	}

	private static void prettyVars(StringBuilder out, Map<String, Domain> vars) {
		if (vars.isEmpty()) {
			out.append("\t(none)\n");
		}
		for (Map.Entry<String, Domain> e : vars.entrySet()) {
			out.append('\t').append(e.getKey()).append('\t').append(e.getValue()).append('\n');
		}
	}

	private static void prettyGroup(StringBuilder out, String title, List<String> formulas) {
		out.append("    ").append(title).append('\n');
		for (int i = 0; i != formulas.size(); ++i) {
			out.append("\t").append(i == 0 ? "  " : "& ").append(formulas.get(i)).append('\n');
		}
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Gr1Spec) {
			Gr1Spec s = (Gr1Spec) o;
			return envVars.equals(s.envVars) && sysVars.equals(s.sysVars) && envInit.equals(s.envInit)
					&& sysInit.equals(s.sysInit) && envSafety.equals(s.envSafety) && sysSafety.equals(s.sysSafety)
					&& envProg.equals(s.envProg) && sysProg.equals(s.sysProg);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(envVars, sysVars, envInit, sysInit, envSafety, sysSafety, envProg, sysProg);
	}

	@Override
	public String toString() {
		return "{env_vars=" + envVars + ", sys_vars=" + sysVars + ", env_init=" + envInit + ", sys_init=" + sysInit
				+ ", env_safety=" + envSafety + ", sys_safety=" + sysSafety + ", env_prog=" + envProg + ", sys_prog="
				+ sysProg + "}";
	}

	/**
	 * Accumulates declarations and formulas. Declarations are checked as they
	 * are added.
	 */
	public static final class Builder {
		private final Map<String, Domain> envVars = new LinkedHashMap<>();
		private final Map<String, Domain> sysVars = new LinkedHashMap<>();
		private final ImmutableList.Builder<String> envInit = ImmutableList.builder();
		private final ImmutableList.Builder<String> sysInit = ImmutableList.builder();
		private final ImmutableList.Builder<String> envSafety = ImmutableList.builder();
		private final ImmutableList.Builder<String> sysSafety = ImmutableList.builder();
		private final ImmutableList.Builder<String> envProg = ImmutableList.builder();
		private final ImmutableList.Builder<String> sysProg = ImmutableList.builder();

		private Builder() {
		}

		public Builder envVar(String name, Domain domain) {
			declare(envVars, sysVars, "environment", name, domain);
			return this;
		}

		public Builder sysVar(String name, Domain domain) {
			declare(sysVars, envVars, "system", name, domain);
			return this;
		}

		public Builder envVars(Map<String, Domain> vars) {
			for (Map.Entry<String, Domain> e : vars.entrySet()) {
				envVar(e.getKey(), e.getValue());
			}
			return this;
		}

		public Builder sysVars(Map<String, Domain> vars) {
			for (Map.Entry<String, Domain> e : vars.entrySet()) {
				sysVar(e.getKey(), e.getValue());
			}
			return this;
		}

		public Builder envInit(Iterable<String> formulas) {
			envInit.addAll(formulas);
			return this;
		}

		public Builder envInit(String... formulas) {
			envInit.add(formulas);
			return this;
		}

		public Builder sysInit(Iterable<String> formulas) {
			sysInit.addAll(formulas);
			return this;
		}

		public Builder sysInit(String... formulas) {
			sysInit.add(formulas);
			return this;
		}

		public Builder envSafety(Iterable<String> formulas) {
			envSafety.addAll(formulas);
			return this;
		}

		public Builder envSafety(String... formulas) {
			envSafety.add(formulas);
			return this;
		}

		public Builder sysSafety(Iterable<String> formulas) {
			sysSafety.addAll(formulas);
			return this;
		}

		public Builder sysSafety(String... formulas) {
			sysSafety.add(formulas);
			return this;
		}

		public Builder envProg(Iterable<String> formulas) {
			envProg.addAll(formulas);
			return this;
		}

		public Builder envProg(String... formulas) {
			envProg.add(formulas);
			return this;
		}

		public Builder sysProg(Iterable<String> formulas) {
			sysProg.addAll(formulas);
			return this;
		}

		public Builder sysProg(String... formulas) {
			sysProg.add(formulas);
			return this;
		}

		/**
		 * Add every declaration and formula of a given specification.
		 *
		 * @param spec
		 * @return
		 */
		public Builder addAll(Gr1Spec spec) {
			envVars(spec.envVars);
			sysVars(spec.sysVars);
			envInit.addAll(spec.envInit);
			sysInit.addAll(spec.sysInit);
			envSafety.addAll(spec.envSafety);
			sysSafety.addAll(spec.sysSafety);
			envProg.addAll(spec.envProg);
			sysProg.addAll(spec.sysProg);
			return this;
		}

		/**
		 * Construct the specification.
		 *
		 * @return
		 * @throws ConflictingDeclarationException
		 *             if a value of an enumerated variable is also the name of
		 *             a variable, since the two could not be told apart in a
		 *             formula.
		 */
		public Gr1Spec build() {
			for (Map<String, Domain> vars : ImmutableList.of(envVars, sysVars)) {
				for (Map.Entry<String, Domain> e : vars.entrySet()) {
					if (e.getValue() instanceof Domain.Enumeration) {
						checkValues(e.getKey(), (Domain.Enumeration) e.getValue());
					}
				}
			}
			return new Gr1Spec(this);
		}

		private void checkValues(String name, Domain.Enumeration domain) {
			for (String v : domain.values()) {
				Domain d = envVars.containsKey(v) ? envVars.get(v) : sysVars.get(v);
				if (d != null) {
					throw new ConflictingDeclarationException(v, d.toString(), "value of " + name);
				}
			}
		}

		private static void declare(Map<String, Domain> vars, Map<String, Domain> others, String side, String name,
				Domain domain) {
			checkNotNull(name);
			checkNotNull(domain);
			Domain other = others.get(name);
			if (other != null) {
				String otherSide = side.equals("system") ? "environment" : "system";
				throw new ConflictingDeclarationException(name, otherSide + " " + other, side + " " + domain);
			}
			Domain existing = vars.get(name);
			if (existing != null && !existing.equals(domain)) {
				throw new ConflictingDeclarationException(name, existing.toString(), domain.toString());
			}
			vars.put(name, domain);
		}
	}
}
