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
import static org.junit.Assert.assertTrue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.collect.ImmutableList;

import aspverify.Main;
import aspverify.util.OptArg;

/**
 * Tests for the command line.
 *
 * @author David J. Pearce
 *
 */
public class MainTests {
	private static final OptArg[] OPTIONS = {
			new OptArg("verbose", "v", "verbose"),
			new OptArg("time-limit", "t", OptArg.INT, "time limit", 60),
			new OptArg("direction", OptArg.CHOICE("forward", "backward"), "direction"),
			new OptArg("with", OptArg.STRINGLIST, "translations"),
	};

	@TempDir
	Path tmp;

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	// ==============================================================
	// Options
	// ==============================================================

	@Test
	public void test_01() {
		List<String> args = list("-v", "a", "--time-limit", "10", "--direction=backward", "b");
		Map<String, Object> options = OptArg.parseOptions(args, OPTIONS);
		assertEquals(true, options.get("verbose"));
		assertEquals(10, options.get("time-limit"));
		assertEquals("backward", options.get("direction"));
		assertEquals(ImmutableList.of("a", "b"), args);
	}

	@Test
	public void test_02() {
		Map<String, Object> options = OptArg.parseOptions(list("a"), OPTIONS);
		assertEquals(60, options.get("time-limit"));
		assertFalse(options.containsKey("verbose"));
		assertFalse(options.containsKey("direction"));
	}

	@Test
	public void test_03() {
		Map<String, Object> options = OptArg.parseOptions(list("--with", "tau-star, completion,,gamma"), OPTIONS);
		assertEquals(ImmutableList.of("tau-star", "completion", "gamma"), options.get("with"));
	}

	@Test
	public void test_04() {
		List<String> args = list("--", "-v");
		Map<String, Object> options = OptArg.parseOptions(args, OPTIONS);
		assertFalse(options.containsKey("verbose"));
		assertEquals(ImmutableList.of("-v"), args);
	}

	@Test
	public void test_05() {
		assertThrows(IllegalArgumentException.class, () -> OptArg.parseOptions(list("--wibble"), OPTIONS));
	}

	@Test
	public void test_06() {
		assertThrows(IllegalArgumentException.class,
				() -> OptArg.parseOptions(list("--direction", "sideways"), OPTIONS));
	}

	@Test
	public void test_07() {
		assertThrows(IllegalArgumentException.class, () -> OptArg.parseOptions(list("-t", "ten"), OPTIONS));
		assertThrows(IllegalArgumentException.class, () -> OptArg.parseOptions(list("-t"), OPTIONS));
		assertThrows(IllegalArgumentException.class, () -> OptArg.parseOptions(list("--verbose=yes"), OPTIONS));
	}

	// ==============================================================
	// Analyze
	// ==============================================================

	@Test
	public void test_08() {
		assertEquals(Main.SUCCESS, run("analyze", Fixtures.path("coloring.lp")));
		assertTrue(output().contains("The program is tight."));
	}

	@Test
	public void test_09() {
		assertEquals(Main.SUCCESS, run("analyze", "--property", "private-recursion", Fixtures.path("coloring.lp"),
				Fixtures.path("coloring.ug")));
		assertTrue(output().contains("The program has no private recursion."));
	}

	@Test
	public void test_10() throws IOException {
		String file = write("loop.lp", "p :- q.\nq :- p.\n");
		assertEquals(Main.FAILURE, run("analyze", file));
		assertTrue(output().contains("The program is not tight: "));
	}

	@Test
	public void test_11() throws IOException {
		// without a user guide every predicate is private
		String file = write("choice.lp", "{p}.\nq :- p.\n");
		assertEquals(Main.FAILURE, run("analyze", "-p", "private-recursion", file));
		assertTrue(output().contains("The program has private recursion: "));
	}

	// ==============================================================
	// Translate
	// ==============================================================

	@Test
	public void test_12() {
		assertEquals(Main.SUCCESS, run("translate", "--with", "tau-star,simplify", Fixtures.path("primes.lp")));
		String[] lines = output().trim().split("\n");
		assertEquals(2, lines.length);
		for (String line : lines) {
			assertTrue(line.endsWith("."));
		}
	}

	@Test
	public void test_13() throws IOException {
		String file = write("rules.lp", "p :- q.\n");
		assertEquals(Main.SUCCESS, run("translate", "--with", "tau-star,gamma", file));
		List<String> lines = Arrays.asList(output().split("\n"));
		assertEquals(4, lines.size());
		assertEquals("(hq -> hp) and (tq -> tp).", lines.get(0));
		assertEquals("tq -> tp.", lines.get(1));
		assertTrue(lines.contains("hp -> tp."));
		assertTrue(lines.contains("hq -> tq."));
	}

	@Test
	public void test_14() throws IOException {
		String file = write("theory.txt", "forall X (q(X) -> p(X)).\n");
		assertEquals(Main.SUCCESS, run("translate", "--with", "completion", file));
		assertTrue(output().contains("forall X (p(X) <-> q(X))."));
	}

	@Test
	public void test_15() {
		assertEquals(Main.INVALID, run("translate", "--with", "completion", Fixtures.path("primes.lp")));
		assertEquals(Main.INVALID, run("translate", Fixtures.path("primes.lp")));
		assertEquals(Main.INVALID, run("translate", "--with", "tau-star,wibble", Fixtures.path("primes.lp")));
	}

	@Test
	public void test_25() throws IOException {
		String file = write("rules.lp", "p :- q.\n");
		assertEquals(Main.SUCCESS, run("translate", "--with", "tau-star,ordered-completion", file));
		assertEquals("q -> p.\np -> q and less_q_p.\n", output());
	}

	@Test
	public void test_26() throws IOException {
		String file = write("theory.txt", "not not p.\nnot p or not not p.\n");
		assertEquals(Main.SUCCESS, run("simplify", file));
		assertEquals("not not p.\nnot p or not not p.\n", output());
	}

	@Test
	public void test_27() throws IOException {
		String file = write("theory.txt", "not not p.\nnot p or not not p.\n");
		assertEquals(Main.SUCCESS, run("simplify", "--portfolio", "ht", file));
		assertEquals("not not p.\n#true.\n", output());
	}

	@Test
	public void test_28() throws IOException {
		String file = write("theory.txt", "not (p and #true).\n");
		assertEquals(Main.SUCCESS, run("simplify", "--portfolio", "classic", "--strategy", "shallow", file));
		assertEquals("not (p and #true).\n", output());
		assertEquals(Main.INVALID, run("simplify", "--strategy", "sometimes", file));
	}

	@Test
	public void test_29() throws IOException {
		String file = write("loop.lp", "p :- p.\n");
		assertEquals(Main.SUCCESS, run("tighten", file));
		assertEquals("p(N + 1) :- p(N).\np :- p(N).\n", output());
	}

	// ==============================================================
	// Verify
	// ==============================================================

	@Test
	public void test_16() {
		assertEquals(Main.SUCCESS, run("verify", "--no-proof-search", Fixtures.path("coloring.spec"),
				Fixtures.path("coloring.lp"), Fixtures.path("coloring.ug")));
		assertTrue(output().contains("stage 1 (forward): completed_definition_of_assign_2_forward"));
		assertTrue(output().contains("stage 1 (backward): conjecture_1 conjecture_2 conjecture_3 conjecture_4"));
	}

	@Test
	public void test_17() {
		File dir = tmp.resolve("problems").toFile();
		assertEquals(Main.SUCCESS, run("verify", "--no-proof-search", "--save-problems", dir.getPath(),
				Fixtures.path("primes.spec"), Fixtures.path("primes.lp"), Fixtures.path("primes.ug"),
				Fixtures.path("primes.po")));
		assertTrue(new File(dir, "forward_squares_base_case.p").exists());
		assertTrue(new File(dir, "backward_composite_products_forward.p").exists());
		assertTrue(new File(dir, "backward_conjecture_2.p").exists());
	}

	@Test
	public void test_18() throws IOException {
		String left = write("left.lp", "p :- q.\n");
		String right = write("right.lp", "p :- q.\n");
		assertEquals(Main.SUCCESS, run("verify", "--equivalence", "strong", "--direction", "forward",
				"--no-proof-search", left, right));
		assertEquals("stage 1 (forward): rule_1\n\n", output());
	}

	@Test
	public void test_19() {
		// a prover which cannot be run fails every problem
		assertEquals(Main.FAILURE, run("verify", "--vampire", tmp.resolve("no-such-prover").toString(),
				Fixtures.path("coloring.spec"), Fixtures.path("coloring.lp"), Fixtures.path("coloring.ug")));
		assertTrue(output().contains("Failure! Equivalence not verified."));
	}

	@Test
	public void test_20() {
		assertEquals(Main.INVALID,
				run("verify", Fixtures.path("coloring.spec"), Fixtures.path("coloring.lp")));
		assertEquals(Main.INVALID, run("verify", "--equivalence", "weak", Fixtures.path("coloring.lp"),
				Fixtures.path("coloring.lp")));
	}

	@Test
	public void test_30() throws IOException {
		String left = write("left.lp", "p :- p.\n");
		String right = write("right.lp", "p :- p.\n");
		String guide = write("guide.ug", "output: p/0.\n");
		assertEquals(Main.INVALID, run("verify", "--no-proof-search", left, right, guide));
		assertEquals(Main.SUCCESS, run("verify", "--no-proof-search", "--bypass-tightness", left, right, guide));
	}

	// ==============================================================
	// Invalid Input
	// ==============================================================

	@Test
	public void test_21() {
		assertEquals(Main.INVALID, run());
		assertEquals(Main.INVALID, run("prove"));
	}

	@Test
	public void test_22() {
		assertEquals(Main.INVALID, run("analyze", tmp.resolve("missing.lp").toString()));
	}

	@Test
	public void test_23() throws IOException {
		String file = write("broken.lp", "p :- .\n");
		assertEquals(Main.INVALID, run("analyze", file));
		assertTrue(errors().contains("broken.lp"));
	}

	@Test
	public void test_24() throws IOException {
		String left = write("loop.lp", "p :- q.\nq :- p.\n");
		assertEquals(Main.INVALID, run("verify", left, left, Fixtures.path("coloring.ug")));
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private int run(String... args) {
		return Main.run(list(args), new PrintStream(out), new PrintStream(err));
	}

	private String output() {
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}

	private String errors() {
		return new String(err.toByteArray(), StandardCharsets.UTF_8);
	}

	private String write(String name, String contents) throws IOException {
		Path file = tmp.resolve(name);
		Files.write(file, contents.getBytes(StandardCharsets.UTF_8));
		return file.toString();
	}

	private static List<String> list(String... args) {
		return new ArrayList<>(Arrays.asList(args));
	}
}
