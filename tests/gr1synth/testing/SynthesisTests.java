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
package gr1synth.testing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;

import gr1synth.core.Dialect;
import gr1synth.spec.ConflictingDeclarationException;
import gr1synth.spec.Domain;
import gr1synth.spec.Gr1Spec;
import gr1synth.synth.ActionConstraint;
import gr1synth.synth.EncodingOptions;
import gr1synth.synth.MealyMachine;
import gr1synth.synth.Solver;
import gr1synth.synth.Synthesis;
import gr1synth.synth.TransitionSystemEncoder;
import gr1synth.transys.FiniteTransitionSystem;
import gr1synth.util.Diagnostics;

/**
 * Tests for combining user specifications with transition systems and
 * handing them to a solver.
 *
 */
public class SynthesisTests {

	// ==============================================================
	// Combining
	// ==============================================================

	@Test
	public void test_01() {
		Gr1Spec user = Gr1Spec.builder().sysProg("home").build();
		EncodingOptions options = EncodingOptions.defaults();
		Gr1Spec r = Synthesis.specPlusSystems(user, null, robot(), false, false, options);
		Gr1Spec sys = TransitionSystemEncoder.sysToSpec(robot(), options);
		assertEquals(Arrays.asList("home"), r.sysProg());
		assertEquals(sys.sysVars(), r.sysVars());
		assertEquals(sys.sysInit(), r.sysInit());
		assertEquals(sys.sysSafety(), r.sysSafety());
		assertTrue(r.envVars().isEmpty());
	}

	@Test
	public void test_02() {
		Gr1Spec user = Gr1Spec.builder().envProg("e1").sysProg("home").build();
		Gr1Spec r = Synthesis.specPlusSystems(user, door(), robot(), true, false, EncodingOptions.defaults());
		assertEquals(Domain.BOOLEAN, r.envVars().get("e0"));
		assertEquals(Domain.BOOLEAN, r.envVars().get("e1"));
		assertEquals(Domain.range(0, 2), r.sysVars().get("loc"));
		// initial state of the environment is ignored
		assertTrue(r.envInit().isEmpty());
		assertFalse(r.sysInit().isEmpty());
		assertEquals(Arrays.asList("e1"), r.envProg());
	}

	@Test
	public void test_03() {
		Gr1Spec user = Gr1Spec.builder().sysVar("x", Domain.BOOLEAN).sysProg("x").build();
		assertEquals(user, Synthesis.specPlusSystems(user, null, null, false, false, EncodingOptions.defaults()));
	}

	@Test
	public void test_04() {
		// the user has claimed the system's location for the environment
		Gr1Spec user = Gr1Spec.builder().envVar("loc", Domain.BOOLEAN).build();
		assertThrows(ConflictingDeclarationException.class,
				() -> Synthesis.specPlusSystems(user, null, robot(), false, false, EncodingOptions.defaults()));
	}

	// ==============================================================
	// Solver options
	// ==============================================================

	@Test
	public void test_05() {
		Diagnostics d = Diagnostics.silent();
		EncodingOptions options = EncodingOptions.defaults().withDiagnostics(d);
		EncodingOptions r = Synthesis.checkSolverOptions(new StubSolver(Dialect.JTLV, false, null), options);
		assertTrue(r.boolStates());
		assertTrue(r.boolActions());
		assertEquals(Arrays.asList("integer states not available for stub, using bool states",
				"integer actions not available for stub, using bool actions"), d.warnings());
	}

	@Test
	public void test_06() {
		Diagnostics d = Diagnostics.silent();
		EncodingOptions options = EncodingOptions.defaults().withDiagnostics(d);
		assertSame(options, Synthesis.checkSolverOptions(new StubSolver(Dialect.GR1C, true, null), options));
		EncodingOptions bools = options.withBoolStates(true).withBoolActions(true);
		assertSame(bools, Synthesis.checkSolverOptions(new StubSolver(Dialect.JTLV, false, null), bools));
		assertTrue(d.warnings().isEmpty());
	}

	// ==============================================================
	// Synthesis
	// ==============================================================

	@Test
	public void test_07() {
		MealyMachine m = twoStates();
		StubSolver solver = new StubSolver(Dialect.GR1C, true, m);
		Gr1Spec user = Gr1Spec.builder().sysProg("home").build();
		EncodingOptions options = EncodingOptions.defaults().withActionConstraint(ActionConstraint.MUTEX);
		assertSame(m, Synthesis.synthesize(solver, user, door(), robot(), false, false, options));
		Gr1Spec expected = Synthesis.specPlusSystems(user, door(), robot(), false, false, options)
				.translate(Dialect.GR1C);
		assertEquals(expected, solver.received);
		assertEquals(Domain.enumeration("go", "stay", "actnone"), solver.received.sysVars().get("act"));
	}

	@Test
	public void test_08() {
		// a solver without integers sees Boolean states and actions
		StubSolver solver = new StubSolver(Dialect.JTLV, false, null);
		Diagnostics d = Diagnostics.silent();
		EncodingOptions options = EncodingOptions.defaults().withActionConstraint(ActionConstraint.MUTEX)
				.withDiagnostics(d);
		assertNull(Synthesis.synthesize(solver, Gr1Spec.empty(), null, robot(), false, false, options));
		Gr1Spec spec = solver.received;
		assertFalse(spec.sysVars().containsKey("loc"));
		assertFalse(spec.sysVars().containsKey("act"));
		for (String v : Arrays.asList("s0", "s1", "s2", "go", "stay")) {
			assertEquals(Domain.BOOLEAN, spec.sysVars().get(v));
		}
		assertEquals(2, d.warnings().size());
	}

	@Test
	public void test_09() {
		StubSolver yes = new StubSolver(Dialect.GR1C, true, twoStates());
		StubSolver no = new StubSolver(Dialect.GR1C, true, null);
		EncodingOptions options = EncodingOptions.defaults();
		assertTrue(Synthesis.isRealizable(yes, Gr1Spec.empty(), null, robot(), false, false, options));
		assertFalse(Synthesis.isRealizable(no, Gr1Spec.empty(), null, robot(), false, false, options));
		assertEquals(TransitionSystemEncoder.sysToSpec(robot(), options).translate(Dialect.GR1C), no.received);
	}

	@Test
	public void test_10() {
		// verbose diagnostics echo the intermediate specifications
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
		Diagnostics d = Diagnostics.to(out, true);
		Synthesis.specPlusSystems(Gr1Spec.empty(), door(), robot(), false, false,
				EncodingOptions.defaults().withDiagnostics(d));
		String text = bytes.toString(StandardCharsets.UTF_8);
		assertTrue(text.contains("sys TS:"));
		assertTrue(text.contains("env TS:"));
		assertTrue(text.contains("Overall Spec:"));
		assertTrue(d.isVerbose());
	}

	@Test
	public void test_11() {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		Diagnostics d = Diagnostics.to(new PrintStream(bytes, true, StandardCharsets.UTF_8), false);
		FiniteTransitionSystem fts = robot();
		fts.addState("s3");
		Synthesis.specPlusSystems(Gr1Spec.empty(), null, fts, false, false,
				EncodingOptions.defaults().withDiagnostics(d));
		String text = bytes.toString(StandardCharsets.UTF_8);
		assertTrue(text.startsWith("warning: "));
		assertFalse(text.contains("Overall Spec:"));
		assertEquals(1, d.warnings().size());
	}

	// ==============================================================
	// Mealy machines
	// ==============================================================

	@Test
	public void test_12() {
		MealyMachine m = twoStates();
		assertEquals(2, m.size());
		assertEquals(Arrays.asList("0"), m.initialStates().asList());
		assertEquals(1, m.transitionsFrom("0").size());
		assertEquals(ImmutableMap.of("door", 1, "loc", 2), m.transitionsFrom("0").get(0).valuation());
		assertEquals(3, m.transitions().size());
		assertTrue(m.inputs().contains("door"));
		assertTrue(m.outputs().contains("loc"));
	}

	@Test
	public void test_13() {
		MealyMachine.Builder b = MealyMachine.builder().state("0", true);
		assertThrows(IllegalArgumentException.class, () -> b.transition("0", "1", ImmutableMap.of()));
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	/**
	 * A robot moving around three locations, with home at s0.
	 */
	private static FiniteTransitionSystem robot() {
		FiniteTransitionSystem fts = new FiniteTransitionSystem();
		fts.addStates("s0", "s1", "s2");
		fts.addActions("go", "stay");
		fts.addAtomicPropositions("home");
		fts.label("s0", "home");
		fts.addInitial("s0");
		fts.addTransition("s0", "s1", "go");
		fts.addTransition("s1", "s2", "go");
		fts.addTransition("s2", "s0", "go");
		fts.addTransition("s0", "s0", "stay");
		fts.addTransition("s1", "s1", "stay");
		fts.addTransition("s2", "s2", "stay");
		return fts;
	}

	/**
	 * A door which alternates between two states.
	 */
	private static FiniteTransitionSystem door() {
		FiniteTransitionSystem fts = new FiniteTransitionSystem();
		fts.addStates("e0", "e1");
		fts.addInitial("e0");
		fts.addTransition("e0", "e1");
		fts.addTransition("e1", "e0");
		return fts;
	}

	private static MealyMachine twoStates() {
		return MealyMachine.builder().inputs(Arrays.asList("door")).outputs(Arrays.asList("loc"))
				.state("0", true).state("1", false)
				.transition("0", "1", ImmutableMap.of("door", 1, "loc", 2))
				.transition("1", "0", ImmutableMap.of("door", 0, "loc", 0))
				.transition("1", "1", ImmutableMap.of("door", 1, "loc", 1)).build();
	}

	/**
	 * Records the specification it is given and answers with a fixed
	 * strategy.
	 */
	private static class StubSolver implements Solver {
		private final Dialect dialect;
		private final boolean integers;
		private final MealyMachine strategy;
		private Gr1Spec received;

		public StubSolver(Dialect dialect, boolean integers, MealyMachine strategy) {
			this.dialect = dialect;
			this.integers = integers;
			this.strategy = strategy;
		}

		@Override
		public String name() {
			return "stub";
		}

		@Override
		public Dialect dialect() {
			return dialect;
		}

		@Override
		public boolean supportsIntegerDomains() {
			return integers;
		}

		@Override
		public MealyMachine synthesize(Gr1Spec spec, Diagnostics diagnostics) {
			received = spec;
			return strategy;
		}

		@Override
		public boolean isRealizable(Gr1Spec spec, Diagnostics diagnostics) {
			received = spec;
			return strategy != null;
		}
	}
}
