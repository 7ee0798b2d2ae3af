// This file is part of the ASP Verifier (aspverify).
//
// The ASP Verifier is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The ASP Verifier is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the ASP Verifier. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.
package aspverify.testing;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import aspverify.analysis.DependencyGraph;
import aspverify.analysis.DependencyGraph.Polarity;
import aspverify.core.Program;
import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Predicate;
import aspverify.io.Parser;

/**
 * Tests for the predicate dependency graph, covering tightness and private
 * recursion.
 *
 * @author David J. Pearce
 *
 */
public class AnalysisTests {
	private static final Predicate P = new Predicate("p", 0);
	private static final Predicate Q = new Predicate("q", 0);
	private static final Predicate R = new Predicate("r", 0);

	// ==============================================================
	// Polarity
	// ==============================================================

	@Test
	public void test_01() {
		DependencyGraph g = graph("p :- q, not r.");
		assertEquals(Polarity.POSITIVE, g.polarity(P, Q));
		assertEquals(Polarity.NEGATIVE, g.polarity(P, R));
		assertNull(g.polarity(Q, P));
	}

	@Test
	public void test_02() {
		// a positive occurrence dominates a negative one
		DependencyGraph g = graph("p :- not q. p :- q.");
		assertEquals(Polarity.POSITIVE, g.polarity(P, Q));
	}

	@Test
	public void test_03() {
		DependencyGraph g = graph("p :- not not q.");
		assertEquals(Polarity.NEGATIVE, g.polarity(P, Q));
	}

	@Test
	public void test_04() {
		// comparisons and constraints contribute no edges
		DependencyGraph g = graph("p(X) :- X = 1..3. :- p(1), q.");
		assertEquals(ImmutableSet.of(new Predicate("p", 1)), g.predicates());
	}

	// ==============================================================
	// Tightness
	// ==============================================================

	@Test
	public void test_05() {
		DependencyGraph g = graph("p :- q. q :- p.");
		assertFalse(g.isTight());
		assertEquals(ImmutableSet.of(P, Q), ImmutableSet.copyOf(g.positiveCycle()));
	}

	@Test
	public void test_06() {
		assertTrue(graph("p :- not q. q :- not p.").isTight());
	}

	@Test
	public void test_07() {
		assertFalse(graph("p(X) :- q(X), p(X).").isTight());
	}

	@Test
	public void test_08() {
		assertTrue(graph("p :- q. q :- r. r :- not p.").isTight());
	}

	@Test
	public void test_09() {
		assertTrue(DependencyGraph.of(Fixtures.program("coloring.lp")).isTight());
		assertTrue(DependencyGraph.of(Fixtures.program("primes.lp")).isTight());
	}

	@Test
	public void test_10() {
		// theories are analysed in the same way
		List<Formula> theory = new Parser(null, "q -> p. not not p -> q.").parseTheory();
		assertTrue(DependencyGraph.of(theory).isTight());
		theory = new Parser(null, "q -> p. (r -> p) and p -> q.").parseTheory();
		assertFalse(DependencyGraph.of(theory).isTight());
	}

	// ==============================================================
	// Private Recursion
	// ==============================================================

	@Test
	public void test_11() {
		DependencyGraph g = graph("{p}.");
		assertEquals(ImmutableList.of(P), g.privateRecursion(ImmutableSet.of(P)));
		assertFalse(g.hasPrivateRecursion(ImmutableSet.of()));
	}

	@Test
	public void test_12() {
		// recursion through negation counts
		DependencyGraph g = graph("p :- not q. q :- not p.");
		assertTrue(g.hasPrivateRecursion(ImmutableSet.of(P, Q)));
	}

	@Test
	public void test_13() {
		// cycles through public predicates do not count
		DependencyGraph g = graph("p :- not q. q :- not p.");
		assertFalse(g.hasPrivateRecursion(ImmutableSet.of(P)));
	}

	@Test
	public void test_14() {
		Program program = Fixtures.program("coloring.lp");
		Set<Predicate> privates = Fixtures.guide("coloring.ug").privatePredicates(program.predicates());
		assertEquals(ImmutableSet.of(new Predicate("assigned", 1)), privates);
		assertFalse(DependencyGraph.of(program).hasPrivateRecursion(privates));
	}

	@Test
	public void test_15() {
		// choice rules for public predicates are fine
		DependencyGraph g = graph("{p}. q :- p.");
		assertFalse(g.hasPrivateRecursion(ImmutableSet.of(Q)));
	}

	private static DependencyGraph graph(String program) {
		return DependencyGraph.of(new Parser(null, program).parseProgram());
	}
}
