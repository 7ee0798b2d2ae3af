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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

import aspverify.core.Specification.Direction;
import aspverify.core.Syntax.Formula;
import aspverify.io.Parser;
import aspverify.io.TptpPrinter;
import aspverify.verify.ProofProblem;

/**
 * Tests for rendering formulas and problems in TPTP.
 *
 * @author David J. Pearce
 *
 */
public class TptpPrinterTests {

	// ==============================================================
	// Formulas
	// ==============================================================

	@Test
	public void test_01() {
		check("forall X (p(X) -> q(X))", "(![X: general]: (p(X) => q(X)))");
	}

	@Test
	public void test_02() {
		check("exists N$i S$s p(N$i, S$s)", "(?[N__i: $int, S__s: symbol]: p(f__integer__(N__i), f__symbolic__(S__s)))");
	}

	@Test
	public void test_03() {
		check("not p", "~(p)");
	}

	@Test
	public void test_04() {
		check("p or q and #true", "(p | (q & $true))");
	}

	@Test
	public void test_05() {
		check("p <-> #false", "(p <=> $false)");
	}

	// ==============================================================
	// Terms and Comparisons
	// ==============================================================

	@Test
	public void test_06() {
		check("N$i + 1 > 2", "$greater($sum(N__i, 1), 2)");
	}

	@Test
	public void test_07() {
		check("-3 = N$i", "$uminus(3) = N__i");
	}

	@Test
	public void test_08() {
		check("N$i / 2 = M$i \\ 3", "$quotient_t(N__i, 2) = $remainder_t(M__i, 3)");
	}

	@Test
	public void test_09() {
		check("N$i * M$i - 1 <= 0", "$lesseq($difference($product(N__i, M__i), 1), 0)");
	}

	@Test
	public void test_10() {
		check("X < a", "p__less__(X, f__symbolic__(a))");
	}

	@Test
	public void test_11() {
		check("1 <= X < 3", "(p__less_equal__(f__integer__(1), X) & p__less__(X, f__integer__(3)))");
	}

	@Test
	public void test_12() {
		check("#inf < X and X != #sup", "(p__less__(c__infimum__, X) & X != c__supremum__)");
	}

	@Test
	public void test_13() {
		check("p(1, S$s, n$i, m$g)", "p(f__integer__(1), f__symbolic__(S__s), f__integer__(n), m)");
	}

	@Test
	public void test_14() {
		check("X >= N$i", "p__greater_equal__(X, f__integer__(N__i))");
	}

	// ==============================================================
	// Problems
	// ==============================================================

	@Test
	public void test_15() {
		ProofProblem problem = new ProofProblem("goal", Direction.FORWARD,
				ImmutableList.of(formula("p(b)"), formula("q(a)")), formula("p(b) -> q(n$i)"));
		String output = print(problem);
		assertTrue(output.startsWith(TptpPrinter.prelude()));
		assertTrue(output.contains("tff(predicate_0, type, p: (general) > $o).\n"));
		assertTrue(output.contains("tff(predicate_1, type, q: (general) > $o).\n"));
		assertTrue(output.contains("tff(type_symbol_0, type, a: symbol).\n"));
		assertTrue(output.contains("tff(type_symbol_1, type, b: symbol).\n"));
		assertTrue(output.contains("tff(type_function_constant_0, type, n: $int).\n"));
		assertTrue(output.contains("tff(symbol_order_0, axiom, p__less__(f__symbolic__(a), f__symbolic__(b))).\n"));
		assertTrue(output.contains("tff(axiom_0, axiom, p(f__symbolic__(b))).\n"));
		assertTrue(output.contains("tff(axiom_1, axiom, q(f__symbolic__(a))).\n"));
		assertTrue(output.endsWith("tff(goal, conjecture, (p(f__symbolic__(b)) => q(f__integer__(n)))).\n"));
	}

	@Test
	public void test_16() {
		// propositional predicates and quoted names
		ProofProblem problem = new ProofProblem("Goal 1", Direction.BACKWARD, ImmutableList.of(), formula("p"));
		String output = print(problem);
		assertTrue(output.contains("tff(predicate_0, type, p: $o).\n"));
		assertTrue(output.contains("tff('Goal 1', conjecture, p).\n"));
	}

	@Test
	public void test_17() {
		String prelude = TptpPrinter.prelude();
		assertTrue(prelude.contains("p__less_equal__"));
		assertTrue(prelude.contains("c__infimum__"));
		assertTrue(prelude.contains("f__integer__"));
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private static Formula formula(String input) {
		return new Parser(null, input).parseFormula();
	}

	private static void check(String input, String expected) {
		assertEquals(expected, TptpPrinter.toString(formula(input)));
	}

	private static String print(ProofProblem problem) {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(bytes, true);
		new TptpPrinter(out).print(problem);
		out.flush();
		return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
	}
}
