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

import java.util.List;

import org.junit.jupiter.api.Test;

import aspverify.core.Syntax.Formula;
import aspverify.io.Parser;
import aspverify.translate.Gamma;
import aspverify.translate.Simplifier;
import aspverify.translate.Simplifier.Portfolio;
import aspverify.translate.Simplifier.Strategy;
import aspverify.translate.TauStar;

/**
 * Tests for the simplifier.
 *
 * @author David J. Pearce
 *
 */
public class SimplifierTests {

	// ==============================================================
	// Truth Constants
	// ==============================================================

	@Test
	public void test_01() {
		check("p and #true", "p");
	}

	@Test
	public void test_02() {
		check("p or #true", "#true");
	}

	@Test
	public void test_03() {
		check("not #false", "#true");
	}

	@Test
	public void test_04() {
		check("p -> p", "#true");
	}

	@Test
	public void test_05() {
		check("#true -> p", "p");
	}

	@Test
	public void test_06() {
		check("p <-> #true", "p");
	}

	@Test
	public void test_07() {
		check("#false -> p and q", "#true");
	}

	@Test
	public void test_08() {
		check("p and #false or q", "q");
	}

	// ==============================================================
	// Comparisons
	// ==============================================================

	@Test
	public void test_09() {
		check("3 = 4 and p", "#false");
	}

	@Test
	public void test_10() {
		check("1 < 2 < X", "2 < X");
	}

	@Test
	public void test_11() {
		check("X = X", "#true");
	}

	@Test
	public void test_12() {
		check("X < X", "#false");
	}

	@Test
	public void test_13() {
		// partial terms may have no value
		check("1 / 0 = 1 / 0", "1 / 0 = 1 / 0");
	}

	// ==============================================================
	// Connectives
	// ==============================================================

	@Test
	public void test_14() {
		check("(p and q) and (q and r)", "p and q and r");
	}

	@Test
	public void test_15() {
		check("p or (q or p)", "p or q");
	}

	@Test
	public void test_16() {
		check("exists X p(X) and exists Y q(Y)", "exists X Y (p(X) and q(Y))");
	}

	@Test
	public void test_17() {
		// merging would capture X
		check("exists X p(X) and exists Y q(X, Y)", "exists X p(X) and exists Y q(X, Y)");
	}

	// ==============================================================
	// Quantifiers
	// ==============================================================

	@Test
	public void test_18() {
		check("forall X Y p(X)", "forall X p(X)");
	}

	@Test
	public void test_19() {
		check("forall X forall Y p(X, Y)", "forall X Y p(X, Y)");
	}

	@Test
	public void test_20() {
		check("exists X (X = a and p(X))", "p(a)");
	}

	@Test
	public void test_21() {
		check("exists N$i (N$i = M$i + 1 and p(N$i))", "p(M$i + 1)");
	}

	@Test
	public void test_22() {
		// compound terms are not duplicated
		check("exists N$i (N$i = M$i + 1 and p(N$i) and q(N$i))", "exists N$i (N$i = M$i + 1 and p(N$i) and q(N$i))");
	}

	@Test
	public void test_23() {
		// a symbol is not an integer
		check("exists N$i (N$i = a and p(N$i))", "exists N$i (N$i = a and p(N$i))");
	}

	@Test
	public void test_24() {
		check("exists X (X = 1 / 0 and p(X))", "exists X (X = 1 / 0 and p(X))");
	}

	@Test
	public void test_25() {
		check("forall X (exists Z (Z = X and q(Z)) -> p(X))", "forall X (q(X) -> p(X))");
	}

	// ==============================================================
	// Idempotence
	// ==============================================================

	@Test
	public void test_26() {
		checkIdempotent(TauStar.apply(Fixtures.program("coloring.lp")));
	}

	@Test
	public void test_27() {
		checkIdempotent(TauStar.apply(Fixtures.program("primes.lp")));
	}

	@Test
	public void test_28() {
		checkIdempotent(Gamma.theory(TauStar.apply(Fixtures.program("coloring.lp"))));
	}

	// ==============================================================
	// Portfolios and Strategies
	// ==============================================================

	@Test
	public void test_29() {
		check(Portfolio.CLASSIC, Strategy.FIXPOINT, "not not p", "p");
		check(Portfolio.HT, Strategy.FIXPOINT, "not not p", "not not p");
	}

	@Test
	public void test_30() {
		// weak excluded middle holds in here-and-there
		check(Portfolio.HT, Strategy.FIXPOINT, "not p or not not p", "#true");
		check(Portfolio.INTUITIONISTIC, Strategy.FIXPOINT, "not p or not not p", "not p or not not p");
	}

	@Test
	public void test_31() {
		check(Portfolio.HT, Strategy.FIXPOINT, "q or p or not p", "q or p or not p");
		check(Portfolio.CLASSIC, Strategy.FIXPOINT, "q or p or not p", "#true");
	}

	@Test
	public void test_32() {
		// only the root is rewritten
		check(Portfolio.INTUITIONISTIC, Strategy.SHALLOW, "not (p and #true)", "not (p and #true)");
		check(Portfolio.INTUITIONISTIC, Strategy.RECURSIVE, "not (p and #true)", "not p");
	}

	@Test
	public void test_33() {
		// one variable is eliminated per pass
		check(Portfolio.INTUITIONISTIC, Strategy.RECURSIVE, "exists X Y (X = 1 and Y = 2 and p(X, Y))",
				"exists Y (Y = 2 and p(1, Y))");
		check(Portfolio.INTUITIONISTIC, Strategy.FIXPOINT, "exists X Y (X = 1 and Y = 2 and p(X, Y))", "p(1, 2)");
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private static void check(String input, String expected) {
		Formula f = new Parser(null, input).parseFormula();
		assertEquals(expected, Simplifier.simplify(f).toString());
	}

	private static void check(Portfolio portfolio, Strategy strategy, String input, String expected) {
		Formula f = new Parser(null, input).parseFormula();
		assertEquals(expected, new Simplifier(portfolio, strategy).run(f).toString());
	}

	private static void checkIdempotent(List<Formula> theory) {
		List<Formula> once = Simplifier.simplify(theory);
		assertEquals(once, Simplifier.simplify(once));
	}
}
