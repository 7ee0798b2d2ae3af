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
package aspverify;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import aspverify.analysis.DependencyGraph;
import aspverify.core.Program;
import aspverify.core.Specification;
import aspverify.core.Specification.Direction;
import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Predicate;
import aspverify.core.UserGuide;
import aspverify.io.Lexer;
import aspverify.io.Parser;
import aspverify.io.TptpPrinter;
import aspverify.translate.Completion;
import aspverify.translate.Gamma;
import aspverify.translate.Simplifier;
import aspverify.translate.TauStar;
import aspverify.translate.Tightening;
import aspverify.util.OptArg;
import aspverify.util.SyntaxError;
import aspverify.util.ValidationError;
import aspverify.verify.ProblemBuilder;
import aspverify.verify.ProblemBuilder.Decomposition;
import aspverify.verify.ProofProblem;
import aspverify.verify.ProofSchedule;
import aspverify.verify.Vampire;
import aspverify.verify.Verifier;

/**
 * Command-line entry point, supporting the following commands:
 *
 * <pre>
 * translate --with tau-star,completion,ordered-completion,gamma,simplify &lt;file&gt;
 * simplify --portfolio classic|ht|intuitionistic --strategy shallow|recursive|fixpoint &lt;file&gt;
 * tighten &lt;program.lp&gt;
 * verify --equivalence strong &lt;left.lp&gt; &lt;right.lp&gt;
 * verify --equivalence external &lt;left.lp|left.spec&gt; &lt;right.lp&gt; &lt;guide.ug&gt; [outline.po]
 * analyze --property tightness|private-recursion &lt;program.lp&gt; [guide.ug]
 * </pre>
 *
 * The exit status is 0 on success, 1 on failure and 2 for malformed input.
 *
 * @author David J. Pearce
 *
 */
public class Main {
	public static final int SUCCESS = 0;
	public static final int FAILURE = 1;
	public static final int INVALID = 2;

	private static final OptArg[] TRANSLATE_OPTIONS = {
			new OptArg("with", "w", OptArg.STRINGLIST, "translations to apply, in order", null),
	};

	private static final OptArg[] VERIFY_OPTIONS = {
			new OptArg("verbose", "v", "report progress of each problem"),
			new OptArg("equivalence", "e", OptArg.CHOICE("strong", "external"), "kind of equivalence to verify",
					"external"),
			new OptArg("direction", "d", OptArg.CHOICE("universal", "forward", "backward"),
					"direction(s) to verify", "universal"),
			new OptArg("decomposition", OptArg.CHOICE("independent", "sequential"),
					"how conjectures are split into stages"),
			new OptArg("no-simplify", "do not simplify translated formulas"),
			new OptArg("no-eq-break", "do not break equivalences into implications"),
			new OptArg("bypass-tightness", "complete programs even when they are not tight"),
			new OptArg("prover-instances", "n", OptArg.INT, "number of prover instances to run at once", 1),
			new OptArg("prover-cores", "c", OptArg.INT, "number of cores given to each prover instance", 1),
			new OptArg("time-limit", "t", OptArg.INT, "time limit (in seconds) for each problem", 60),
			new OptArg("no-proof-search", "construct the problems but do not attempt them"),
			new OptArg("save-problems", "s", OptArg.STRING, "directory to save problems into (in TPTP)", null),
			new OptArg("vampire", OptArg.STRING, "command used to run vampire", "vampire"),
	};

	private static final OptArg[] SIMPLIFY_OPTIONS = {
			new OptArg("portfolio", OptArg.CHOICE("intuitionistic", "ht", "classic"),
					"logic in which simplifications preserve equivalence", "intuitionistic"),
			new OptArg("strategy", OptArg.CHOICE("shallow", "recursive", "fixpoint"),
					"where and how often simplifications are applied", "fixpoint"),
	};

	private static final OptArg[] TIGHTEN_OPTIONS = {};

	private static final OptArg[] ANALYZE_OPTIONS = {
			new OptArg("property", "p", OptArg.CHOICE("tightness", "private-recursion"), "property to check",
					"tightness"),
	};

	public static void main(String[] _args) {
		List<String> args = new ArrayList<>(Arrays.asList(_args));
		System.exit(run(args, System.out, System.err));
	}

	/**
	 * Run a single command, returning the exit status.
	 *
	 * @param args
	 *            The command followed by its options and arguments.
	 * @param out
	 *            Stream for results.
	 * @param err
	 *            Stream for progress and errors.
	 * @return
	 */
	public static int run(List<String> args, PrintStream out, PrintStream err) {
		if (args.isEmpty()) {
			usage(err);
			return INVALID;
		}
		String command = args.remove(0);
		try {
			switch (command) {
			case "translate":
				return translate(args, OptArg.parseOptions(args, TRANSLATE_OPTIONS), out);
			case "simplify":
				return simplify(args, OptArg.parseOptions(args, SIMPLIFY_OPTIONS), out);
			case "tighten":
				return tighten(args, OptArg.parseOptions(args, TIGHTEN_OPTIONS), out);
			case "verify":
				return verify(args, OptArg.parseOptions(args, VERIFY_OPTIONS), out, err);
			case "analyze":
				return analyze(args, OptArg.parseOptions(args, ANALYZE_OPTIONS), out);
			default:
				err.println("unknown command: " + command);
				usage(err);
				return INVALID;
			}
		} catch (SyntaxError e) {
			e.outputSourceError(err);
			return INVALID;
		} catch (ValidationError e) {
			e.outputSourceError(err);
			return INVALID;
		} catch (IllegalArgumentException e) {
			err.println(e.getMessage());
			return INVALID;
		} catch (IOException e) {
			err.println("I/O error: " + e.getMessage());
			return INVALID;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			err.println("interrupted");
			return FAILURE;
		}
	}

	private static void usage(PrintStream err) {
		err.println("usage: aspverify translate --with <translations> <file>");
		OptArg.usage(err, TRANSLATE_OPTIONS);
		err.println("       aspverify simplify <file>");
		OptArg.usage(err, SIMPLIFY_OPTIONS);
		err.println("       aspverify tighten <program>");
		err.println("       aspverify verify <left> <right> [<guide> [<outline>]]");
		OptArg.usage(err, VERIFY_OPTIONS);
		err.println("       aspverify analyze <program> [<guide>]");
		OptArg.usage(err, ANALYZE_OPTIONS);
	}

	// =============================================================================
	// Translate
	// =============================================================================

	@SuppressWarnings("unchecked")
	private static int translate(List<String> args, Map<String, Object> options, PrintStream out)
			throws IOException {
		List<String> steps = (List<String>) options.get("with");
		if (args.size() != 1 || steps == null || steps.isEmpty()) {
			throw new IllegalArgumentException("usage: translate --with <translations> <file>");
		}
		String filename = args.get(0);
		Parser parser = new Parser(new Lexer(filename));
		List<Formula> theory;
		int i = 0;
		if (filename.endsWith(".lp")) {
			if (!steps.get(0).equals("tau-star")) {
				throw new IllegalArgumentException("a program must first be translated with tau-star");
			}
			theory = TauStar.apply(parser.parseProgram());
			i = 1;
		} else {
			theory = parser.parseTheory();
		}
		for (; i < steps.size(); ++i) {
			switch (steps.get(i)) {
			case "tau-star":
				throw new IllegalArgumentException("tau-star applies only to programs");
			case "completion":
				theory = Completion.apply(theory);
				break;
			case "ordered-completion":
				theory = new Completion(theory).completeOrdered();
				break;
			case "gamma":
				theory = Gamma.theory(theory);
				break;
			case "simplify":
				theory = Simplifier.simplify(theory);
				break;
			default:
				throw new IllegalArgumentException("unknown translation: " + steps.get(i));
			}
		}
		for (Formula f : theory) {
			out.println(f + ".");
		}
		return SUCCESS;
	}

	private static int simplify(List<String> args, Map<String, Object> options, PrintStream out)
			throws IOException {
		if (args.size() != 1) {
			throw new IllegalArgumentException("usage: simplify [--portfolio <logic>] [--strategy <strategy>] <file>");
		}
		Simplifier.Portfolio portfolio = Simplifier.Portfolio
				.valueOf(((String) options.get("portfolio")).toUpperCase());
		Simplifier.Strategy strategy = Simplifier.Strategy.valueOf(((String) options.get("strategy")).toUpperCase());
		List<Formula> theory = new Simplifier(portfolio, strategy).run(parse(args.get(0)).parseTheory());
		for (Formula f : theory) {
			out.println(f + ".");
		}
		return SUCCESS;
	}

	private static int tighten(List<String> args, Map<String, Object> options, PrintStream out)
			throws IOException {
		if (args.size() != 1) {
			throw new IllegalArgumentException("usage: tighten <program.lp>");
		}
		out.print(Tightening.apply(parse(args.get(0)).parseProgram()));
		return SUCCESS;
	}

	// =============================================================================
	// Verify
	// =============================================================================

	private static int verify(List<String> args, Map<String, Object> options, PrintStream out, PrintStream err)
			throws IOException, InterruptedException {
		String equivalence = (String) options.get("equivalence");
		ProblemBuilder builder = new ProblemBuilder();
		builder.setSimplify(!options.containsKey("no-simplify"));
		builder.setBreakEquivalences(!options.containsKey("no-eq-break"));
		builder.setBypassTightness(options.containsKey("bypass-tightness"));
		builder.setDirection(Direction.valueOf(((String) options.get("direction")).toUpperCase()));
		if (options.containsKey("decomposition")) {
			builder.setDecomposition(Decomposition.valueOf(((String) options.get("decomposition")).toUpperCase()));
		}
		List<ProofSchedule> schedules;
		if (equivalence.equals("strong")) {
			if (args.size() != 2) {
				throw new IllegalArgumentException("usage: verify --equivalence strong <left.lp> <right.lp>");
			}
			Program left = parse(args.get(0)).parseProgram();
			Program right = parse(args.get(1)).parseProgram();
			schedules = builder.strongEquivalence(left, right);
		} else {
			if (args.size() < 3 || args.size() > 4) {
				throw new IllegalArgumentException(
						"usage: verify --equivalence external <left> <right.lp> <guide.ug> [<outline.po>]");
			}
			Program right = parse(args.get(1)).parseProgram();
			UserGuide guide = parse(args.get(2)).parseUserGuide();
			Specification outline = args.size() == 4 ? parse(args.get(3)).parseSpecification() : null;
			if (args.get(0).endsWith(".lp")) {
				Program left = parse(args.get(0)).parseProgram();
				schedules = builder.externalEquivalence(left, right, guide, outline);
			} else {
				Specification left = parse(args.get(0)).parseSpecification();
				schedules = builder.externalEquivalence(left, right, guide, outline);
			}
		}
		if (options.containsKey("save-problems")) {
			save(new File((String) options.get("save-problems")), schedules);
		}
		if (options.containsKey("no-proof-search")) {
			for (ProofSchedule s : schedules) {
				out.println(s);
			}
			return SUCCESS;
		}
		int cores = (Integer) options.get("prover-cores");
		Vampire vampire = new Vampire((String) options.get("vampire"), cores);
		Verifier verifier = new Verifier(vampire);
		verifier.setInstances((Integer) options.get("prover-instances"));
		verifier.setTimeLimit((Integer) options.get("time-limit"));
		verifier.setVerbose(options.containsKey("verbose"));
		verifier.setOutput(err);
		Verifier.Report report = verifier.verify(schedules);
		report.print(out);
		return report.isSuccess() ? SUCCESS : FAILURE;
	}

	/**
	 * Write every problem of the given schedules into a directory, one TPTP
	 * file per problem.
	 */
	private static void save(File dir, List<ProofSchedule> schedules) throws IOException {
		if (!dir.isDirectory() && !dir.mkdirs()) {
			throw new IOException("cannot create directory " + dir);
		}
		for (ProofSchedule s : schedules) {
			for (ProofProblem p : s.problems()) {
				File file = new File(dir, p.direction() + "_" + p.name() + ".p");
				try (PrintStream ps = new PrintStream(new FileOutputStream(file), false,
						StandardCharsets.UTF_8.name())) {
					new TptpPrinter(ps).print(p);
				}
			}
		}
	}

	private static Parser parse(String filename) throws IOException {
		return new Parser(new Lexer(filename));
	}

	// =============================================================================
	// Analyze
	// =============================================================================

	private static int analyze(List<String> args, Map<String, Object> options, PrintStream out)
			throws IOException {
		if (args.size() < 1 || args.size() > 2) {
			throw new IllegalArgumentException("usage: analyze --property <property> <program.lp> [<guide.ug>]");
		}
		Program program = parse(args.get(0)).parseProgram();
		UserGuide guide = args.size() == 2 ? parse(args.get(1)).parseUserGuide() : UserGuide.empty();
		DependencyGraph graph = DependencyGraph.of(program);
		if (options.get("property").equals("tightness")) {
			if (graph.isTight()) {
				out.println("The program is tight.");
				return SUCCESS;
			}
			out.println("The program is not tight: " + cycle(graph.positiveCycle()));
			return FAILURE;
		} else {
			Set<Predicate> privates = guide.privatePredicates(program.predicates());
			if (!graph.hasPrivateRecursion(privates)) {
				out.println("The program has no private recursion.");
				return SUCCESS;
			}
			out.println("The program has private recursion: " + cycle(graph.privateRecursion(privates)));
			return FAILURE;
		}
	}

	private static String cycle(List<Predicate> predicates) {
		StringBuilder r = new StringBuilder();
		for (Predicate p : predicates) {
			r.append(p).append(" -> ");
		}
		if (!predicates.isEmpty()) {
			r.append(predicates.get(0));
		}
		return r.toString();
	}
}
