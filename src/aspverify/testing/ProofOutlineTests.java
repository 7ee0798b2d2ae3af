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
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableSet;

import aspverify.core.Specification;
import aspverify.core.Specification.AnnotatedFormula;
import aspverify.core.Specification.Direction;
import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Predicate;
import aspverify.io.Parser;
import aspverify.util.ValidationError;
import aspverify.verify.EquivalenceBreaker;
import aspverify.verify.PlaceholderSubstitution;
import aspverify.verify.ProofOutline;

/**
 * Tests for proof outlines, equivalence breaking and placeholder
 * substitution.
 *
 * @author David J. Pearce
 *
 */
public class ProofOutlineTests {
	private static final ImmutableSet<Predicate> BASE = ImmutableSet.of(new Predicate("p", 1),
			new Predicate("q", 2));

	// ==============================================================
	// Outlines
	// ==============================================================

	@Test
	public void test_01() {
		ProofOutline o = outline("lemma: forall X (p(X) -> q(X, X)).");
		assertEquals(1, o.steps().size());
		assertEquals("lemma_1", o.steps().get(0).name());
		assertEquals(1, o.steps().get(0).obligations().size());
	}

	@Test
	public void test_02() {
		ProofOutline o = outline("definition: forall X (d(X) <-> p(X)).\nlemma[l]: forall X (d(X) -> p(X)).");
		assertEquals("definition_1", o.steps().get(0).name());
		assertEquals(0, o.steps().get(0).obligations().size());
		assertEquals("l", o.steps().get(1).name());
	}

	@Test
	public void test_03() {
		ProofOutline o = outline("lemma(forward): p(1).\nlemma(backward): p(2).\nlemma: p(3).");
		assertEquals(2, o.steps(Direction.FORWARD).size());
		assertEquals(2, o.steps(Direction.BACKWARD).size());
		assertEquals("p(1)", o.steps(Direction.FORWARD).get(0).formula().toString());
		assertEquals("p(2)", o.steps(Direction.BACKWARD).get(0).formula().toString());
	}

	@Test
	public void test_04() {
		List<AnnotatedFormula> obligations = outline("inductive-lemma[ind]: forall N$i (N$i >= 0 -> p(N$i)).")
				.steps().get(0).obligations();
		assertEquals(2, obligations.size());
		assertEquals("ind_base_case", obligations.get(0).name());
		assertEquals("p(0)", obligations.get(0).formula().toString());
		assertEquals("ind_inductive_step", obligations.get(1).name());
		assertEquals("forall N$i (N$i >= 0 and p(N$i) -> p(N$i + 1))", obligations.get(1).formula().toString());
	}

	@Test
	public void test_05() {
		List<AnnotatedFormula> obligations = outline(
				"inductive-lemma: forall X N$i (N$i >= 1 -> q(X, N$i)).").steps().get(0).obligations();
		assertEquals("forall X q(X, 1)", obligations.get(0).formula().toString());
		assertEquals("forall X N$i (N$i >= 1 and q(X, N$i) -> q(X, N$i + 1))",
				obligations.get(1).formula().toString());
	}

	@Test
	public void test_06() {
		// a definition may use those before it
		ProofOutline o = outline(
				"definition: forall X (d(X) <-> p(X)).\ndefinition: forall X (e(X) <-> d(X) and p(X)).");
		assertEquals(2, o.steps().size());
	}

	@Test
	public void test_07() {
		checkMalformed("spec: p(1).");
	}

	@Test
	public void test_08() {
		checkMalformed("definition: forall X (p(X) <-> q(X, X)).");
	}

	@Test
	public void test_09() {
		checkMalformed("definition: forall X (d(X) <-> q(X, Y)).");
	}

	@Test
	public void test_10() {
		checkMalformed("definition: forall X (d(X) <-> e(X)).");
	}

	@Test
	public void test_11() {
		checkMalformed("definition: forall X Y (d(X) <-> q(X, Y)).");
	}

	@Test
	public void test_12() {
		checkMalformed("inductive-lemma: forall X (p(X) -> q(X, X)).");
	}

	@Test
	public void test_13() {
		checkMalformed("inductive-lemma: forall N$i M$i (N$i >= M$i -> p(N$i)).");
	}

	// ==============================================================
	// Equivalence Breaking
	// ==============================================================

	@Test
	public void test_14() {
		List<Formula> parts = EquivalenceBreaker.apply(formula("forall X (p(X) <-> q(X, X))"));
		assertEquals(2, parts.size());
		assertEquals("forall X (p(X) -> q(X, X))", parts.get(0).toString());
		assertEquals("forall X (q(X, X) -> p(X))", parts.get(1).toString());
	}

	@Test
	public void test_15() {
		assertEquals(1, EquivalenceBreaker.apply(formula("forall X (p(X) -> q(X, X))")).size());
		assertEquals(1, EquivalenceBreaker.apply(formula("(p <-> q) and r")).size());
	}

	@Test
	public void test_16() {
		Specification s = spec("spec[d]: p <-> q.\nspec: q <-> p.");
		List<AnnotatedFormula> parts = EquivalenceBreaker.applyAll(s.formulas());
		assertEquals(4, parts.size());
		assertEquals("d_forward", parts.get(0).name());
		assertEquals("d_backward", parts.get(1).name());
		assertEquals(Specification.UNNAMED, parts.get(2).name());
	}

	// ==============================================================
	// Placeholders
	// ==============================================================

	@Test
	public void test_17() {
		PlaceholderSubstitution s = placeholders("input: n -> integer. input: c -> symbol.");
		assertEquals("p(n$i, c$s, d)", s.apply(formula("p(n, c, d)")).toString());
	}

	@Test
	public void test_18() {
		PlaceholderSubstitution s = placeholders("input: n -> integer.");
		assertEquals("forall X (X < n$i -> p(X))", s.apply(formula("forall X (X < n -> p(X))")).toString());
	}

	@Test
	public void test_19() {
		PlaceholderSubstitution s = placeholders("input: n -> integer.");
		ValidationError e = assertThrows(ValidationError.class, () -> s.apply(formula("p(n$s)")));
		assertEquals(ValidationError.Kind.PLACEHOLDER_SORT_CONFLICT, e.kind());
	}

	@Test
	public void test_20() {
		ValidationError e = assertThrows(ValidationError.class,
				() -> placeholders("input: n -> integer. input: n -> general."));
		assertEquals(ValidationError.Kind.PLACEHOLDER_SORT_CONFLICT, e.kind());
	}

	@Test
	public void test_21() {
		// repeated declarations at the same sort are fine
		PlaceholderSubstitution s = placeholders("input: n -> integer. input: n -> integer.");
		assertEquals(1, s.placeholders().size());
	}

	@Test
	public void test_22() {
		PlaceholderSubstitution s = placeholders("input: n -> integer.");
		assertEquals("p(n$i) :- q(n$i).", s.apply(new Parser(null, "p(n) :- q(n).").parseProgram()).toString().trim());
	}

	// ==============================================================
	// Definitions
	// ==============================================================

	@Test
	public void test_23() {
		// Y is an argument of d but never occurs on the right
		checkMalformed("definition: forall X Y (d(X, Y) <-> q(X, X)).");
	}

	@Test
	public void test_24() {
		ProofOutline o = outline("definition: forall X Y (d(X, Y) <-> q(Y, X)).");
		assertEquals(1, o.steps(Direction.FORWARD).size());
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private static ProofOutline outline(String input) {
		return new ProofOutline(spec(input), BASE);
	}

	private static void checkMalformed(String input) {
		ValidationError e = assertThrows(ValidationError.class, () -> outline(input));
		assertEquals(ValidationError.Kind.MALFORMED_PROOF_OUTLINE, e.kind());
	}

	private static PlaceholderSubstitution placeholders(String input) {
		return new PlaceholderSubstitution(new Parser(null, input).parseUserGuide());
	}

	private static Specification spec(String input) {
		return new Parser(null, input).parseSpecification();
	}

	private static Formula formula(String input) {
		return new Parser(null, input).parseFormula();
	}
}
