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
package gr1synth.extensions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;

import gr1synth.core.Dialect;
import gr1synth.core.Syntax;
import gr1synth.core.Syntax.Expr;
import gr1synth.core.Syntax.Operator;
import gr1synth.io.Parser;
import gr1synth.spec.Domain;
import gr1synth.spec.Gr1Spec;
import gr1synth.synth.VariableEncoding;

/**
 * Augments a specification with the discrete abstraction of a continuous
 * system. Each region becomes a Boolean system variable, and each preserved
 * proposition is replaced by the disjunction of the regions it holds in.
 *
 */
public class Partitions {
	public static final String DEFAULT_PREFIX = "cellID";

	public static Gr1Spec augment(Gr1Spec spec, PropPreservingPartition partition) {
		return augment(spec, partition, DEFAULT_PREFIX);
	}

	/**
	 * Construct a new specification from a given one and a partition. Region
	 * <code>i</code> is named <code>prefix_i</code>. The system must move
	 * between adjacent regions, and exactly one region holds at any time. The
	 * given specification is left unchanged.
	 *
	 * @param spec
	 * @param partition
	 * @param prefix
	 * @return
	 */
	public static Gr1Spec augment(Gr1Spec spec, PropPreservingPartition partition, String prefix) {
		int n = partition.size();
		if (n == 0) {
			return spec;
		}
		List<String> regions = new ArrayList<>();
		for (int i = 0; i != n; ++i) {
			regions.add(prefix + "_" + i);
		}
		Map<String, Expr> substitution = new LinkedHashMap<>();
		for (String p : partition.propositions()) {
			List<Expr> cells = new ArrayList<>();
			for (int i = 0; i != n; ++i) {
				if (partition.propositionsOf(i).contains(p)) {
					cells.add(Syntax.Var(regions.get(i)));
				}
			}
			substitution.put(p, cells.isEmpty() ? Syntax.FALSE : Syntax.fold(Operator.OR, cells));
		}
		Gr1Spec.Builder b = Gr1Spec.builder();
		b.envVars(spec.envVars());
		for (Map.Entry<String, Domain> e : spec.sysVars().entrySet()) {
			if (!substitution.containsKey(e.getKey())) {
				b.sysVar(e.getKey(), e.getValue());
			}
		}
		for (String r : regions) {
			b.sysVar(r, Domain.BOOLEAN);
		}
		b.envInit(substitute(spec.envInit(), substitution));
		b.sysInit(substitute(spec.sysInit(), substitution));
		b.envSafety(substitute(spec.envSafety(), substitution));
		b.sysSafety(substitute(spec.sysSafety(), substitution));
		b.envProg(substitute(spec.envProg(), substitution));
		b.sysProg(substitute(spec.sysProg(), substitution));
		// transitions
		for (int i = 0; i != n; ++i) {
			List<String> successors = new ArrayList<>();
			for (int j = 0; j != n; ++j) {
				if (partition.isAdjacent(i, j)) {
					successors.add(regions.get(j) + "'");
				}
			}
			String next = successors.isEmpty() ? "False" : Joiner.on(" || ").join(successors);
			b.sysSafety(regions.get(i) + " -> (" + next + ")");
		}
		// exactly one region at a time
		List<String> one = VariableEncoding.exactlyOne(regions);
		b.sysInit(one);
		for (String f : one) {
			b.sysSafety("X (" + f + ")");
		}
		return b.build();
	}

	/**
	 * Replace propositions by their regions. Formulas not mentioning any
	 * proposition are kept as written, the others are rewritten in the gr1c
	 * dialect.
	 */
	private static List<String> substitute(List<String> formulas, Map<String, Expr> substitution) {
		List<String> r = new ArrayList<>();
		for (String f : formulas) {
			Expr parsed = f.trim().isEmpty() ? null : Parser.parse(f);
			if (parsed == null || !mentions(parsed, substitution)) {
				r.add(f);
			} else {
				Expr e = parsed.transform(x -> {
					if (x instanceof Expr.Variable) {
						Expr y = substitution.get(((Expr.Variable) x).name());
						return y == null ? x : y;
					}
					return x;
				});
				r.add(e.render(Dialect.GR1C));
			}
		}
		return r;
	}

	private static boolean mentions(Expr e, Map<String, Expr> substitution) {
		for (Expr.Variable v : e.freeVariables()) {
			if (substitution.containsKey(v.name())) {
				return true;
			}
		}
		return false;
	}
}
