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
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableSet;

import aspverify.core.Syntax;
import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Predicate;
import aspverify.io.Parser;
import aspverify.translate.Completion;
import aspverify.translate.Gamma;
import aspverify.translate.PredicateRenaming;
import aspverify.translate.Simplifier;
import aspverify.translate.TauStar;
import aspverify.translate.Tightening;
import aspverify.util.ValidationError;

/**
 * Tests for the tau-star, completion, gamma and tightening translations.
 *
 * @author David J. Pearce
 *
 */
public class TranslationTests {

	// ==============================================================
	// Tau-Star
	// ==============================================================

	@Test
	public void test_01() {
		checkTauStar("p :- q.", "q -> p");
	}

	@Test
	public void test_02() {
		checkTauStar("p(X) :- q(X).", "forall V1 X (V1 = X and exists Z (Z = X and q(Z)) -> p(V1))");
	}

	@Test
	public void test_03() {
		checkTauStar(":- p.", "not p");
	}

	@Test
	public void test_04() {
		checkTauStar("{p}.", "#true and not not p -> p");
	}

	@Test
	public void test_05() {
		checkTauStar("p :- not q.", "not q -> p");
	}

	@Test
	public void test_06() {
		checkTauStar("p.", "#true -> p");
	}

	@Test
	public void test_07() {
		// intervals denote every value in range
		checkTauStar("p(1..3).",
				"forall V1 (exists I$i J$i K$i (I$i = 1 and J$i = 3 and V1 = K$i and I$i <= K$i <= J$i) and #true -> p(V1))");
	}

	@Test
	public void test_08() {
		// comparisons use one fresh variable per operand
		checkTauStar("p :- X < 1, q(X).", "forall X (exists Z Z1 (Z = X and Z1 = 1 and Z < Z1) and exists Z (Z = X and q(Z)) -> p)");
	}

	@Test
	public void test_09() {
		// head variables avoid those already used
		TauStar t = new TauStar(new Parser(null, "p(V1) :- q(V1).").parseProgram());
		assertEquals("V2", t.globals().get(0).name());
	}

	@Test
	public void test_10() {
		// every rule for the same predicate shares the same head
		List<Formula> theory = TauStar.apply(new Parser(null, "p(X) :- q(X). p(a).").parseProgram());
		assertEquals(2, theory.size());
		assertTrue(theory.get(0).toString().endsWith("-> p(V1))"));
		assertTrue(theory.get(1).toString().endsWith("-> p(V1))"));
	}

	@Test
	public void test_11() {
		// division introduces quotient and remainder
		List<Formula> theory = TauStar.apply(new Parser(null, "p(X / 2) :- q(X).").parseProgram());
		String s = theory.get(0).toString();
		assertTrue(s.contains("J$i != 0"));
		assertTrue(s.contains("I$i = J$i * Q$i + R$i"));
	}

	@Test
	public void test_30() {
		// program variables with more digits than an int holds
		List<Formula> theory = TauStar.apply(new Parser(null, "p(V99999999999) :- q(V99999999999).").parseProgram());
		assertEquals(1, theory.size());
		assertTrue(theory.get(0).toString().startsWith("forall V100000000000 V99999999999"));
	}

	// ==============================================================
	// Completion
	// ==============================================================

	@Test
	public void test_12() {
		checkCompletion("q -> p. r -> p.", "p <-> q or r");
	}

	@Test
	public void test_13() {
		checkCompletion("forall X (q(X) -> p(X)).", "forall X (p(X) <-> q(X))");
	}

	@Test
	public void test_14() {
		// constraints are retained as is
		checkCompletion("q -> p. not (p and r).", "p <-> q", "not (p and r)");
	}

	@Test
	public void test_15() {
		// heads with non-variable terms use fresh variables
		checkCompletion("forall X (q(X) -> p(X, a)).", "forall V1 V2 (p(V1, V2) <-> exists X (V1 = X and V2 = a and q(X)))");
	}

	@Test
	public void test_16() {
		// intensional predicates without rules are false
		List<Formula> theory = new Parser(null, "forall X (q(X) -> p(X)).").parseTheory();
		List<Formula> completed = new Completion(theory, ImmutableSet.of(new Predicate("p", 1), new Predicate("r", 1)))
				.complete();
		assertEquals(2, completed.size());
		assertEquals("forall V1 not r(V1)", completed.get(1).toString());
	}

	@Test
	public void test_17() {
		// extensional predicates keep their rules
		List<Formula> theory = new Parser(null, "forall X (q(X) -> p(X)). forall X (r(X) -> s(X)).").parseTheory();
		List<Formula> completed = new Completion(theory, ImmutableSet.of(new Predicate("p", 1))).complete();
		assertEquals("forall X (p(X) <-> q(X))", completed.get(0).toString());
		assertEquals("forall X (r(X) -> s(X))", completed.get(1).toString());
	}

	@Test
	public void test_18() {
		invalidCompletion("p -> p.", ValidationError.Kind.NOT_TIGHT);
	}

	@Test
	public void test_19() {
		invalidCompletion("p or q.", ValidationError.Kind.NOT_COMPLETABLE);
	}

	@Test
	public void test_20() {
		// negative cycles are fine
		checkCompletion("not q -> p. not p -> q.", "p <-> not q", "q <-> not p");
	}

	@Test
	public void test_31() {
		List<Formula> theory = TauStar.apply(new Parser(null, "p(X) :- X = 1. q(X, Y). p(X) :- q(X, Y).").parseProgram());
		List<Formula> completed = Simplifier.simplify(Completion.apply(theory));
		assertEquals("forall V1 (p(V1) <-> V1 = 1 or exists Y q(V1, Y))", completed.get(0).toString());
	}

	// ==============================================================
	// Gamma
	// ==============================================================

	@Test
	public void test_21() {
		assertEquals("(hp -> hq) and (tp -> tq)", Gamma.here(formula("p -> q")).toString());
	}

	@Test
	public void test_22() {
		assertEquals("not tp", Gamma.here(formula("not p")).toString());
	}

	@Test
	public void test_23() {
		// a negated antecedent is the same here and there
		assertEquals("not tq -> hp", Gamma.here(formula("not q -> p")).toString());
	}

	@Test
	public void test_24() {
		assertEquals("forall X (hp(X) and X > 1 or exists Y hq(X, Y))",
				Gamma.here(formula("forall X (p(X) and X > 1 or exists Y q(X, Y))")).toString());
	}

	@Test
	public void test_25() {
		assertEquals("tp -> tq", Gamma.there(formula("p -> q")).toString());
	}

	@Test
	public void test_26() {
		List<Formula> theory = Gamma.theory(new Parser(null, "forall X (q(X) -> p(X)).").parseTheory());
		assertEquals(4, theory.size());
		assertEquals("forall X ((hq(X) -> hp(X)) and (tq(X) -> tp(X)))", theory.get(0).toString());
		assertEquals("forall X (tq(X) -> tp(X))", theory.get(1).toString());
		assertTrue(theory.contains(formula("forall X1 (hq(X1) -> tq(X1))")));
		assertTrue(theory.contains(formula("forall X1 (hp(X1) -> tp(X1))")));
	}

	@Test
	public void test_27() {
		assertEquals(ImmutableSet.of(new Predicate("hp", 1), new Predicate("tp", 1)),
				Gamma.split(ImmutableSet.of(new Predicate("p", 1))));
	}

	@Test
	public void test_32() {
		// an antecedent without atoms is the same here and there
		assertEquals(
				"forall X ((exists I$i (X = I$i and 3 < I$i < 5) -> hp(X)) and (exists I$i (X = I$i and 3 < I$i < 5) -> tp(X)))",
				Gamma.here(formula("forall X (exists I$i (X = I$i and 3 < I$i < 5) -> p(X))")).toString());
	}

	// ==============================================================
	// Predicate Renaming
	// ==============================================================

	@Test
	public void test_28() {
		PredicateRenaming r = PredicateRenaming.separate(ImmutableSet.of(new Predicate("p", 1)),
				ImmutableSet.of(new Predicate("p", 1), new Predicate("p_p", 1)));
		assertEquals("p_p_p", r.mapping().get(new Predicate("p", 1)));
		assertEquals("forall X (p_p_p(X) -> q(X))", r.apply(formula("forall X (p(X) -> q(X))")).toString());
	}

	@Test
	public void test_29() {
		// predicates which do not clash are left alone
		PredicateRenaming r = PredicateRenaming.separate(ImmutableSet.of(new Predicate("p", 1)),
				ImmutableSet.of(new Predicate("p", 2)));
		assertTrue(r.mapping().isEmpty());
		assertEquals(Syntax.predicates(formula("p(X)")), ImmutableSet.of(new Predicate("p", 1)));
	}

	// ==============================================================
	// Ordered Completion
	// ==============================================================

	@Test
	public void test_33() {
		checkOrderedCompletion("p :- q.", "q -> p", "p -> q and less_q_p");
	}

	@Test
	public void test_34() {
		// atoms under negation are not ordered
		checkOrderedCompletion("p :- q, not r.", "q and not r -> p", "p -> (q and less_q_p) and not r");
	}

	@Test
	public void test_35() {
		// positive cycles are fine, and constraints come first
		checkOrderedCompletion("p :- p. :- q.", "not q", "p -> p", "p -> p and less_p_p");
	}

	@Test
	public void test_36() {
		List<Formula> completed = new Completion(TauStar.apply(new Parser(null, "p(X) :- q(X).").parseProgram()))
				.completeOrdered();
		assertEquals(2, completed.size());
		assertTrue(completed.get(1).toString().contains("q(Z) and less_q_p(Z, V1)"));
	}

	@Test
	public void test_37() {
		try {
			new Completion(new Parser(null, "forall X (q(X) -> p(X)). p(a).").parseTheory()).completeOrdered();
			fail("ordered completion should have failed");
		} catch (ValidationError e) {
			assertEquals(ValidationError.Kind.NOT_COMPLETABLE, e.kind());
		}
	}

	@Test
	public void test_38() {
		// a cycle is only tolerated when asked for
		List<Formula> theory = new Parser(null, "p -> p.").parseTheory();
		assertEquals("p <-> p", new Completion(theory).setCheckTightness(false).complete().get(0).toString());
	}

	// ==============================================================
	// Tightening
	// ==============================================================

	@Test
	public void test_39() {
		assertEquals("p(N + 1) :- q(N), not r.\nr(N + 1).\np :- p(N).\nq :- q(N).\nr :- r(N).\n",
				tighten("p :- q, not r. r."));
	}

	@Test
	public void test_40() {
		// the step variable avoids those of the program
		assertEquals("p(N, N1 + 1) :- q(N, N1).\np(X1) :- p(X1, N1).\nq(X1) :- q(X1, N1).\n",
				tighten("p(N) :- q(N)."));
	}

	@Test
	public void test_41() {
		// choice rules stay choice rules and constraints are unchanged
		assertEquals("{p(N + 1)} :- q(N).\n:- p.\np :- p(N).\nq :- q(N).\n", tighten("{p} :- q. :- p."));
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private static Formula formula(String input) {
		return new Parser(null, input).parseFormula();
	}

	private static void checkTauStar(String program, String expected) {
		List<Formula> theory = TauStar.apply(new Parser(null, program).parseProgram());
		assertEquals(1, theory.size());
		assertEquals(expected, theory.get(0).toString());
	}

	private static void checkCompletion(String theory, String... expected) {
		List<Formula> completed = Completion.apply(new Parser(null, theory).parseTheory());
		assertEquals(expected.length, completed.size());
		for (int i = 0; i != expected.length; ++i) {
			assertEquals(expected[i], completed.get(i).toString());
		}
	}

	private static String tighten(String program) {
		return Tightening.apply(new Parser(null, program).parseProgram()).toString();
	}

	private static void checkOrderedCompletion(String program, String... expected) {
		List<Formula> theory = TauStar.apply(new Parser(null, program).parseProgram());
		List<Formula> completed = new Completion(theory).completeOrdered();
		assertEquals(expected.length, completed.size());
		for (int i = 0; i != expected.length; ++i) {
			assertEquals(expected[i], completed.get(i).toString());
		}
	}

	private static void invalidCompletion(String theory, ValidationError.Kind kind) {
		try {
			Completion.apply(new Parser(null, theory).parseTheory());
			fail("completion should have failed");
		} catch (ValidationError e) {
			assertEquals(kind, e.kind());
		}
	}
}
