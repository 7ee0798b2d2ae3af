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
package aspverify.io;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.TreeSet;

import com.google.common.io.Resources;

import aspverify.core.Syntax;
import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Predicate;
import aspverify.core.Syntax.Relation;
import aspverify.core.Syntax.Sort;
import aspverify.core.Syntax.Term;
import aspverify.util.AbstractTransformer;
import aspverify.verify.ProofProblem;

/**
 * Writes proof problems in the typed first-order form (TFF) of the TPTP
 * language. Every problem begins with a fixed prelude describing the general
 * sort. Values of the general sort are either integers (embedded with
 * <code>f__integer__</code>), symbols (embedded with
 * <code>f__symbolic__</code>), or one of the two constants
 * <code>c__infimum__</code> and <code>c__supremum__</code>. Variables are
 * named according to their sort, such that integer variables carry the suffix
 * <code>__i</code> and symbol variables the suffix <code>__s</code>.
 *
 * @author David J. Pearce
 *
 */
public class TptpPrinter {
	private static final String PRELUDE = "standard_interpretation.p";

	private final PrintStream out;

	public TptpPrinter(PrintStream out) {
		this.out = out;
	}

	/**
	 * Write a complete problem, including the prelude, the type declarations of
	 * every predicate and constant used, the ordering of the symbols used, the
	 * axioms and, finally, the conjecture.
	 *
	 * @param problem
	 */
	public void print(ProofProblem problem) {
		ArrayList<Formula> formulas = new ArrayList<>(problem.axioms());
		formulas.add(problem.conjecture());
		LinkedHashSet<Predicate> predicates = new LinkedHashSet<>();
		TreeSet<String> symbols = new TreeSet<>();
		LinkedHashSet<Term.Placeholder> placeholders = new LinkedHashSet<>();
		for (Formula f : formulas) {
			predicates.addAll(Syntax.predicates(f));
			LinkedHashSet<Term> constants = new LinkedHashSet<>();
			for (Term t : Syntax.terms(f)) {
				Syntax.constants(t, constants);
			}
			for (Term c : constants) {
				if (c instanceof Term.SymbolicConstant) {
					symbols.add(((Term.SymbolicConstant) c).name());
				} else {
					placeholders.add((Term.Placeholder) c);
				}
			}
		}
		out.print(prelude());
		int i = 0;
		for (Predicate p : predicates) {
			out.println("tff(predicate_" + (i++) + ", type, " + p.symbol() + ": " + signature(p) + ").");
		}
		i = 0;
		for (String s : symbols) {
			out.println("tff(type_symbol_" + (i++) + ", type, " + s + ": symbol).");
		}
		i = 0;
		for (Term.Placeholder p : placeholders) {
			out.println("tff(type_function_constant_" + (i++) + ", type, " + p.name() + ": " + type(p.sort()) + ").");
		}
		String previous = null;
		i = 0;
		for (String s : symbols) {
			if (previous != null) {
				out.println("tff(symbol_order_" + (i++) + ", axiom, p__less__(f__symbolic__(" + previous
						+ "), f__symbolic__(" + s + "))).");
			}
			previous = s;
		}
		i = 0;
		for (Formula f : problem.axioms()) {
			out.println("tff(axiom_" + (i++) + ", axiom, " + toString(f) + ").");
		}
		out.println("tff(" + name(problem.name()) + ", conjecture, " + toString(problem.conjecture()) + ").");
	}

	/**
	 * Render a single formula in TPTP syntax.
	 *
	 * @param formula
	 * @return
	 */
	public static String toString(Formula formula) {
		return new Renderer().apply(formula);
	}

	/**
	 * Load the fixed prelude.
	 *
	 * @return
	 */
	public static String prelude() {
		try {
			return Resources.toString(Resources.getResource(TptpPrinter.class, PRELUDE), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	private static String signature(Predicate p) {
		if (p.arity() == 0) {
			return "$o";
		}
		ArrayList<String> arguments = new ArrayList<>();
		for (int i = 0; i != p.arity(); ++i) {
			arguments.add("general");
		}
		return "(" + String.join(" * ", arguments) + ") > $o";
	}

	private static String type(Sort sort) {
		switch (sort) {
		case INTEGER:
			return "$int";
		case SYMBOL:
			return "symbol";
		default:
			return "general";
		}
	}

	/**
	 * Formula names must be TPTP lower words, and are quoted otherwise.
	 */
	private static String name(String name) {
		if (name.matches("[a-z][a-zA-Z0-9_]*")) {
			return name;
		}
		return "'" + name.replace("\\", "\\\\").replace("'", "\\'") + "'";
	}

	private static String variable(Term.Variable v) {
		switch (v.sort()) {
		case INTEGER:
			return v.name() + "__i";
		case SYMBOL:
			return v.name() + "__s";
		default:
			return v.name();
		}
	}

	/**
	 * Render a term of the integer sort, as used in arithmetic.
	 *
	 * @param term
	 * @return
	 */
	private static String integer(Term term) {
		switch (term.getOpcode()) {
		case Syntax.TERM_integer: {
			int n = ((Term.IntegerConstant) term).value();
			return n < 0 ? "$uminus(" + Math.abs((long) n) + ")" : Integer.toString(n);
		}
		case Syntax.TERM_variable:
			return variable((Term.Variable) term);
		case Syntax.TERM_placeholder:
			return ((Term.Placeholder) term).name();
		case Syntax.TERM_binary: {
			Term.BinaryOperation b = (Term.BinaryOperation) term;
			return operator(b.operator()) + "(" + integer(b.lhs()) + ", " + integer(b.rhs()) + ")";
		}
		default:
			throw new IllegalArgumentException("Invalid integer term encountered: " + term);
		}
	}

	private static String operator(Term.Operator op) {
		switch (op) {
		case ADD:
			return "$sum";
		case SUBTRACT:
			return "$difference";
		case MULTIPLY:
			return "$product";
		case DIVIDE:
			return "$quotient_t";
		default:
			return "$remainder_t";
		}
	}

	/**
	 * Render a term of the general sort, embedding integers and symbols as
	 * necessary.
	 *
	 * @param term
	 * @return
	 */
	private static String general(Term term) {
		if (term.sort() == Sort.INTEGER) {
			return "f__integer__(" + integer(term) + ")";
		}
		switch (term.getOpcode()) {
		case Syntax.TERM_symbol:
			return "f__symbolic__(" + ((Term.SymbolicConstant) term).name() + ")";
		case Syntax.TERM_variable: {
			Term.Variable v = (Term.Variable) term;
			return v.sort() == Sort.SYMBOL ? "f__symbolic__(" + variable(v) + ")" : variable(v);
		}
		case Syntax.TERM_placeholder: {
			Term.Placeholder p = (Term.Placeholder) term;
			return p.sort() == Sort.SYMBOL ? "f__symbolic__(" + p.name() + ")" : p.name();
		}
		case Syntax.TERM_infimum:
			return "c__infimum__";
		case Syntax.TERM_supremum:
			return "c__supremum__";
		default:
			throw new IllegalArgumentException("Invalid general term encountered: " + term);
		}
	}

	private static String comparison(Term lhs, Relation relation, Term rhs) {
		if (Syntax.isArithmetic(lhs) && Syntax.isArithmetic(rhs)) {
			String l = integer(lhs);
			String r = integer(rhs);
			switch (relation) {
			case EQUAL:
				return l + " = " + r;
			case NOT_EQUAL:
				return l + " != " + r;
			case LESS:
				return "$less(" + l + ", " + r + ")";
			case LESS_EQUAL:
				return "$lesseq(" + l + ", " + r + ")";
			case GREATER:
				return "$greater(" + l + ", " + r + ")";
			default:
				return "$greatereq(" + l + ", " + r + ")";
			}
		}
		String l = general(lhs);
		String r = general(rhs);
		switch (relation) {
		case EQUAL:
			return l + " = " + r;
		case NOT_EQUAL:
			return l + " != " + r;
		case LESS:
			return "p__less__(" + l + ", " + r + ")";
		case LESS_EQUAL:
			return "p__less_equal__(" + l + ", " + r + ")";
		case GREATER:
			return "p__greater__(" + l + ", " + r + ")";
		default:
			return "p__greater_equal__(" + l + ", " + r + ")";
		}
	}

	/**
	 * Renders formulas. Every compound formula is parenthesised, which avoids
	 * any reliance on the precedence of TPTP connectives.
	 *
	 * @author David J. Pearce
	 *
	 */
	private static final class Renderer extends AbstractTransformer<String> {

		@Override
		protected String apply(Formula.Truth formula) {
			return "$true";
		}

		@Override
		protected String apply(Formula.Falsity formula) {
			return "$false";
		}

		@Override
		protected String apply(Formula.Atom formula) {
			if (formula.terms().isEmpty()) {
				return formula.symbol();
			}
			ArrayList<String> terms = new ArrayList<>();
			for (Term t : formula.terms()) {
				terms.add(general(t));
			}
			return formula.symbol() + "(" + String.join(", ", terms) + ")";
		}

		@Override
		protected String apply(Formula.Comparison formula) {
			ArrayList<String> parts = new ArrayList<>();
			Term lhs = formula.term();
			for (Formula.Guard g : formula.guards()) {
				parts.add(comparison(lhs, g.relation(), g.term()));
				lhs = g.term();
			}
			return parts.size() == 1 ? parts.get(0) : "(" + String.join(" & ", parts) + ")";
		}

		@Override
		protected String apply(Formula.Negation formula) {
			return "~(" + apply(formula.operand()) + ")";
		}

		@Override
		protected String apply(Formula.Conjunction formula) {
			return "(" + join(formula.operands(), " & ") + ")";
		}

		@Override
		protected String apply(Formula.Disjunction formula) {
			return "(" + join(formula.operands(), " | ") + ")";
		}

		@Override
		protected String apply(Formula.Implication formula) {
			return "(" + apply(formula.lhs()) + " => " + apply(formula.rhs()) + ")";
		}

		@Override
		protected String apply(Formula.Equivalence formula) {
			return "(" + apply(formula.lhs()) + " <=> " + apply(formula.rhs()) + ")";
		}

		@Override
		protected String apply(Formula.Universal formula) {
			return "(![" + declarations(formula.variables()) + "]: " + apply(formula.body()) + ")";
		}

		@Override
		protected String apply(Formula.Existential formula) {
			return "(?[" + declarations(formula.variables()) + "]: " + apply(formula.body()) + ")";
		}

		private String join(List<Formula> operands, String separator) {
			ArrayList<String> parts = new ArrayList<>();
			for (Formula f : operands) {
				parts.add(apply(f));
			}
			return String.join(separator, parts);
		}

		private static String declarations(List<Term.Variable> variables) {
			ArrayList<String> parts = new ArrayList<>();
			for (Term.Variable v : variables) {
				parts.add(variable(v) + ": " + type(v.sort()));
			}
			return String.join(", ", parts);
		}
	}
}
