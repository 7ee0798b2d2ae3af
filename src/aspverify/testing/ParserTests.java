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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.jupiter.api.Test;

import aspverify.core.Program;
import aspverify.core.Program.Rule;
import aspverify.core.Specification;
import aspverify.core.Specification.AnnotatedFormula;
import aspverify.core.Specification.Direction;
import aspverify.core.Specification.Role;
import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Predicate;
import aspverify.core.Syntax.Sort;
import aspverify.core.Syntax.Term;
import aspverify.core.UserGuide;
import aspverify.io.Parser;
import aspverify.util.SyntacticElement.Attribute;
import aspverify.util.SyntaxError;

/**
 * Tests for parsing programs, formulas, specifications and user guides.
 *
 * @author David J. Pearce
 *
 */
public class ParserTests {

	// ==============================================================
	// Programs
	// ==============================================================

	@Test
	public void test_01() {
		Program p = program("p(X) :- q(X), not r(X).");
		assertEquals(1, p.rules().size());
		assertEquals(Program.Kind.BASIC, p.rules().get(0).kind());
		assertEquals("p(X) :- q(X), not r(X).", p.rules().get(0).toString());
	}

	@Test
	public void test_02() {
		Program p = program("{p(X)} :- q(X).");
		assertEquals(Program.Kind.CHOICE, p.rules().get(0).kind());
		assertEquals("{p(X)} :- q(X).", p.rules().get(0).toString());
	}

	@Test
	public void test_03() {
		Program p = program(":- p(X), X > 3.");
		Rule r = p.rules().get(0);
		assertEquals(Program.Kind.CONSTRAINT, r.kind());
		assertNull(r.head());
		assertEquals(2, r.body().size());
	}

	@Test
	public void test_04() {
		Program p = program("p :- not not q.");
		assertEquals(Program.Sign.DOUBLE_NEGATION, p.rules().get(0).body().get(0).sign());
	}

	@Test
	public void test_05() {
		// directives and comments are skipped
		Program p = program("% a comment\np(1..3).\n#show p/1.\n%* block\n comment *%\nq(a).");
		assertEquals(2, p.rules().size());
		assertEquals("p(1..3).", p.rules().get(0).toString());
	}

	@Test
	public void test_06() {
		Program p = program("p(X + 2 * Y - -1) :- q(X, Y).");
		Term t = ((Formula.Atom) p.rules().get(0).head()).terms().get(0);
		assertEquals("X + 2 * Y - -1", t.toString());
	}

	@Test
	public void test_07() {
		Program p = program("p(X / 2, X \\ 2) :- q(X), #inf < X < #sup.");
		assertEquals("p(X / 2, X \\ 2) :- q(X), #inf < X < #sup.", p.rules().get(0).toString());
	}

	@Test
	public void test_08() {
		// anonymous variables are distinct
		Program p = program("p :- q(_, _).");
		Formula.Atom q = (Formula.Atom) p.rules().get(0).body().get(0).atom();
		assertTrue(!q.terms().get(0).equals(q.terms().get(1)));
	}

	@Test
	public void test_09() {
		Program p = program("#false :- p.");
		assertEquals(Program.Kind.CONSTRAINT, p.rules().get(0).kind());
	}

	@Test
	public void test_10() {
		// rules carry their position in the source text
		Program p = program("p.\nq :- p.");
		Attribute.Source s = p.rules().get(1).attribute(Attribute.Source.class);
		assertEquals(3, s.start);
		assertEquals(9, s.end);
	}

	// ==============================================================
	// Formulas
	// ==============================================================

	@Test
	public void test_11() {
		roundTrip("forall X (p(X) -> q(X))");
	}

	@Test
	public void test_12() {
		roundTrip("exists N$i (N$i > 0 and p(N$i))");
	}

	@Test
	public void test_13() {
		roundTrip("not p and q or r");
	}

	@Test
	public void test_14() {
		roundTrip("(p -> q) -> r");
	}

	@Test
	public void test_15() {
		roundTrip("p <-> q or not r");
	}

	@Test
	public void test_16() {
		roundTrip("1 <= X < 3 and X != a");
	}

	@Test
	public void test_17() {
		roundTrip("forall X S$s exists Y p(X, S$s, Y)");
	}

	@Test
	public void test_18() {
		roundTrip("#true and not #false");
	}

	@Test
	public void test_19() {
		// reverse implication
		assertEquals("q -> p", formula("p <- q").toString());
	}

	@Test
	public void test_20() {
		// implication is right associative
		assertEquals("p -> (q -> r)", formula("p -> q -> r").toString());
	}

	@Test
	public void test_21() {
		// parentheses around terms as well as formulas
		assertEquals("(X + 1) * 2 = 4", formula("((X + 1) * 2 = 4)").toString());
	}

	@Test
	public void test_22() {
		Formula.Comparison c = (Formula.Comparison) formula("n$i < X$");
		assertEquals(Sort.INTEGER, c.term().sort());
		assertTrue(c.term() instanceof Term.Placeholder);
		assertEquals(Sort.INTEGER, c.guards().get(0).term().sort());
	}

	@Test
	public void test_23() {
		List<Formula> theory = new Parser(null, "p. q -> p. forall X (r(X) -> p).").parseTheory();
		assertEquals(3, theory.size());
	}

	// ==============================================================
	// Specifications and User Guides
	// ==============================================================

	@Test
	public void test_24() {
		Specification s = new Parser(null, "assume: p.\nspec(forward)[first]: q -> p.\ndefinition: forall X (d(X) <-> p).")
				.parseSpecification();
		assertEquals(3, s.formulas().size());
		AnnotatedFormula f = s.formulas().get(1);
		assertEquals(Role.SPEC, f.role());
		assertEquals(Direction.FORWARD, f.direction());
		assertEquals("first", f.name());
		assertEquals(Role.ASSUMPTION, s.formulas().get(0).role());
		assertEquals(Direction.UNIVERSAL, s.formulas().get(0).direction());
		assertEquals(Specification.UNNAMED, s.formulas().get(0).name());
	}

	@Test
	public void test_25() {
		Specification s = new Parser(null, "inductive-lemma[ind]: forall N$i (N$i >= 0 -> p(N$i)).")
				.parseSpecification();
		assertEquals(Role.INDUCTIVE_LEMMA, s.formulas().get(0).role());
		assertEquals("ind", s.formulas().get(0).name());
	}

	@Test
	public void test_26() {
		UserGuide g = new Parser(null, "input: p/1, q/0.\noutput: r/2.\ninput: n -> integer.\nassumption: p(1).")
				.parseUserGuide();
		assertTrue(g.inputs().contains(new Predicate("p", 1)));
		assertTrue(g.inputs().contains(new Predicate("q", 0)));
		assertTrue(g.outputs().contains(new Predicate("r", 2)));
		assertEquals(1, g.placeholders().size());
		assertEquals(Sort.INTEGER, g.placeholders().get(0).sort());
		assertEquals(1, g.assumptions().size());
	}

	// ==============================================================
	// Syntax Errors
	// ==============================================================

	@Test
	public void test_27() {
		invalidProgram("p(X :- q.");
	}

	@Test
	public void test_28() {
		invalidProgram("p :- not not not q.");
	}

	@Test
	public void test_29() {
		// sorts are not permitted in programs
		invalidProgram("p(X$i) :- q(X$i).");
	}

	@Test
	public void test_30() {
		invalidProgram("p :- q");
	}

	@Test
	public void test_31() {
		invalidProgram("p(2147483648).");
	}

	@Test
	public void test_32() {
		try {
			new Parser(null, "conjecture: p.").parseSpecification();
			fail("unknown role accepted");
		} catch (SyntaxError e) {
			// expected
		}
	}

	@Test
	public void test_33() {
		try {
			new Parser(null, "forall X (p(X) and").parseFormula();
			fail("incomplete formula accepted");
		} catch (SyntaxError e) {
			// expected
		}
	}

	@Test
	public void test_34() {
		try {
			formula("X$q = 1");
			fail("unknown sort accepted");
		} catch (SyntaxError e) {
			// expected
		}
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private static Program program(String input) {
		return new Parser(null, input).parseProgram();
	}

	private static Formula formula(String input) {
		return new Parser(null, input).parseFormula();
	}

	private static void roundTrip(String input) {
		Formula f = formula(input);
		assertEquals(input, f.toString());
		assertEquals(f, formula(f.toString()));
	}

	private static void invalidProgram(String input) {
		try {
			program(input);
			fail("invalid program accepted: " + input);
		} catch (SyntaxError e) {
			// expected
		}
	}
}
