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
package aspverify.translate;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableList;

import aspverify.core.Program;
import aspverify.core.Program.Literal;
import aspverify.core.Program.Rule;
import aspverify.core.Syntax;
import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Relation;
import aspverify.core.Syntax.Sort;
import aspverify.core.Syntax.Term;
import aspverify.core.Syntax.Term.Operator;

/**
 * Translates a program into a first-order theory (the tau-star translation).
 * Since ASP terms may denote zero, one or many values (e.g.
 * <code>1..3</code> or <code>X/0</code>), every term is translated relative to
 * a variable <code>Z</code> into a formula <code>val_t(Z)</code> which holds
 * exactly when <code>Z</code> is one of the values of <code>t</code>. For
 * example, the rule <code>p(X+1) :- q(X).</code> becomes:
 *
 * <pre>
 * forall V1 X (exists I$i J$i (I$i = X and J$i = 1 and V1 = I$i + J$i) and exists Z (Z = X and q(Z)) -&gt; p(V1))
 * </pre>
 *
 * The head variables <code>V1</code>, <code>V2</code>, ... are shared by all
 * rules, such that every rule defining the same predicate has the same head.
 *
 * @author David J. Pearce
 *
 */
public class TauStar {
	private static final Pattern GLOBAL = Pattern.compile("^V([0-9]+)$");

	private final Program program;
	private final ImmutableList<Term.Variable> globals;

	public TauStar(Program program) {
		this.program = program;
		this.globals = chooseGlobals(program);
	}

	/**
	 * Translate a program into a theory, one formula per rule and in the same
	 * order.
	 *
	 * @param program
	 * @return
	 */
	public static List<Formula> apply(Program program) {
		return new TauStar(program).translate();
	}

	public List<Formula> translate() {
		ArrayList<Formula> result = new ArrayList<>();
		for (Rule r : program.rules()) {
			result.add(translate(r));
		}
		return result;
	}

	/**
	 * Get the head variables used for this program.
	 *
	 * @return
	 */
	public ImmutableList<Term.Variable> globals() {
		return globals;
	}

	/**
	 * Translate a single rule.
	 *
	 * @param rule
	 * @return
	 */
	public Formula translate(Rule rule) {
		LinkedHashSet<Term.Variable> variables = new LinkedHashSet<>();
		Set<Term.Variable> local = rule.variables();
		HashSet<String> taken = new HashSet<>();
		for (Term.Variable v : local) {
			taken.add(v.name());
		}
		for (Term.Variable v : globals) {
			taken.add(v.name());
		}
		ArrayList<Formula> antecedent = new ArrayList<>();
		Formula.Atom head = null;
		if (rule.head() != null) {
			List<Term> terms = rule.head().terms();
			ArrayList<Term> arguments = new ArrayList<>();
			for (int i = 0; i != terms.size(); ++i) {
				Term.Variable v = globals.get(i);
				variables.add(v);
				arguments.add(v);
				antecedent.add(valuation(terms.get(i), v, taken));
			}
			head = new Formula.Atom(rule.head().symbol(), arguments);
		}
		variables.addAll(local);
		ArrayList<Formula> body = new ArrayList<>();
		for (Literal l : rule.body()) {
			body.add(translate(l, taken));
		}
		switch (rule.kind()) {
		case CONSTRAINT:
			return Syntax.forall(variables, new Formula.Negation(Syntax.conjunction(body), rule.attributes()));
		case CHOICE:
			antecedent.addAll(body.isEmpty() ? ImmutableList.<Formula>of(Syntax.TRUE) : body);
			antecedent.add(Syntax.negate(2, head));
			break;
		default:
			antecedent.addAll(body.isEmpty() ? ImmutableList.<Formula>of(Syntax.TRUE) : body);
		}
		return Syntax.forall(variables,
				new Formula.Implication(Syntax.conjunction(antecedent), head, rule.attributes()));
	}

	/**
	 * Translate a body literal. An atom <code>p(t1,...,tn)</code> becomes
	 * <code>exists Z1...Zn (val_t1(Z1) and ... and p(Z1,...,Zn))</code>, where
	 * any negation is applied to the inner atom. Comparisons are translated
	 * similarly, with one fresh variable per operand.
	 *
	 * @param literal
	 * @param taken
	 *            Variable names which cannot be used for fresh variables.
	 * @return
	 */
	public Formula translate(Literal literal, Set<String> taken) {
		HashSet<String> inner = new HashSet<>(taken);
		ArrayList<Term.Variable> variables = new ArrayList<>();
		ArrayList<Formula> conjuncts = new ArrayList<>();
		Formula core;
		if (literal.atom() instanceof Formula.Atom) {
			Formula.Atom atom = (Formula.Atom) literal.atom();
			ArrayList<Term> arguments = new ArrayList<>();
			for (Term t : atom.terms()) {
				Term.Variable z = fresh("Z", Sort.GENERAL, inner);
				variables.add(z);
				arguments.add(z);
			}
			for (int i = 0; i != arguments.size(); ++i) {
				conjuncts.add(valuation(atom.terms().get(i), (Term.Variable) arguments.get(i), inner));
			}
			core = new Formula.Atom(atom.symbol(), arguments);
		} else {
			Formula.Comparison comparison = (Formula.Comparison) literal.atom();
			ArrayList<Term> operands = new ArrayList<>();
			operands.add(comparison.term());
			for (Formula.Guard g : comparison.guards()) {
				operands.add(g.term());
			}
			for (int i = 0; i != operands.size(); ++i) {
				variables.add(fresh("Z", Sort.GENERAL, inner));
			}
			ArrayList<Formula.Guard> guards = new ArrayList<>();
			for (int i = 0; i != operands.size(); ++i) {
				conjuncts.add(valuation(operands.get(i), variables.get(i), inner));
				if (i > 0) {
					guards.add(new Formula.Guard(comparison.guards().get(i - 1).relation(), variables.get(i)));
				}
			}
			core = new Formula.Comparison(variables.get(0), guards);
		}
		conjuncts.add(Syntax.negate(literal.sign().depth(), core));
		return Syntax.exists(variables, Syntax.conjunction(conjuncts));
	}

	/**
	 * Construct the formula <code>val_t(Z)</code> which holds exactly when
	 * <code>Z</code> is a value of term <code>t</code>.
	 *
	 * @param term
	 * @param z
	 * @param taken
	 *            Variable names which cannot be used for auxiliary variables.
	 *            This is extended with the names chosen.
	 * @return
	 */
	public Formula valuation(Term term, Term.Variable z, Set<String> taken) {
		switch (term.getOpcode()) {
		case Syntax.TERM_integer:
		case Syntax.TERM_symbol:
		case Syntax.TERM_variable:
		case Syntax.TERM_placeholder:
		case Syntax.TERM_infimum:
		case Syntax.TERM_supremum:
			return new Formula.Comparison(z, Relation.EQUAL, term);
		case Syntax.TERM_binary:
			return valuation((Term.BinaryOperation) term, z, taken);
		case Syntax.TERM_interval:
			return valuation((Term.Interval) term, z, taken);
		default:
			throw new IllegalArgumentException("Invalid term encountered: " + term);
		}
	}

	private Formula valuation(Term.BinaryOperation term, Term.Variable z, Set<String> taken) {
		Term.Variable i = fresh("I", Sort.INTEGER, taken);
		Term.Variable j = fresh("J", Sort.INTEGER, taken);
		Formula lhs = valuation(term.lhs(), i, taken);
		Formula rhs = valuation(term.rhs(), j, taken);
		switch (term.operator()) {
		case ADD:
		case SUBTRACT:
		case MULTIPLY: {
			Formula result = new Formula.Comparison(z, Relation.EQUAL, new Term.BinaryOperation(term.operator(), i, j));
			return Syntax.exists(ImmutableList.of(i, j), Syntax.conjunction(lhs, rhs, result));
		}
		default: {
			// Integer division truncates towards zero, so the remainder takes
			// the sign of the dividend. A zero divisor leaves no values.
			Term.Variable q = fresh("Q", Sort.INTEGER, taken);
			Term.Variable r = fresh("R", Sort.INTEGER, taken);
			Term zero = new Term.IntegerConstant(0);
			Formula nonZero = new Formula.Comparison(j, Relation.NOT_EQUAL, zero);
			Formula decomposition = new Formula.Comparison(i, Relation.EQUAL, new Term.BinaryOperation(Operator.ADD,
					new Term.BinaryOperation(Operator.MULTIPLY, j, q), r));
			Formula sign = new Formula.Disjunction(
					Syntax.conjunction(new Formula.Comparison(i, Relation.GREATER_EQUAL, zero),
							new Formula.Comparison(r, Relation.GREATER_EQUAL, zero)),
					Syntax.conjunction(new Formula.Comparison(i, Relation.LESS, zero),
							new Formula.Comparison(r, Relation.LESS_EQUAL, zero)));
			Term negJ = new Term.BinaryOperation(Operator.SUBTRACT, zero, j);
			Formula bound = new Formula.Disjunction(
					Syntax.conjunction(new Formula.Comparison(j, Relation.GREATER, zero),
							new Formula.Comparison(negJ,
									ImmutableList.of(new Formula.Guard(Relation.LESS, r),
											new Formula.Guard(Relation.LESS, j)))),
					Syntax.conjunction(new Formula.Comparison(j, Relation.LESS, zero), new Formula.Comparison(j,
							ImmutableList.of(new Formula.Guard(Relation.LESS, r), new Formula.Guard(Relation.LESS, negJ)))));
			Term.Variable result = term.operator() == Operator.DIVIDE ? q : r;
			Formula value = new Formula.Comparison(z, Relation.EQUAL, result);
			return Syntax.exists(ImmutableList.of(i, j, q, r),
					Syntax.conjunction(lhs, rhs, nonZero, decomposition, sign, bound, value));
		}
		}
	}

	private Formula valuation(Term.Interval term, Term.Variable z, Set<String> taken) {
		Term.Variable i = fresh("I", Sort.INTEGER, taken);
		Term.Variable j = fresh("J", Sort.INTEGER, taken);
		Term.Variable k = fresh("K", Sort.INTEGER, taken);
		Formula lower = valuation(term.lower(), i, taken);
		Formula upper = valuation(term.upper(), j, taken);
		Formula value = new Formula.Comparison(z, Relation.EQUAL, k);
		Formula range = new Formula.Comparison(i,
				ImmutableList.of(new Formula.Guard(Relation.LESS_EQUAL, k), new Formula.Guard(Relation.LESS_EQUAL, j)));
		return Syntax.exists(ImmutableList.of(i, j, k), Syntax.conjunction(lower, upper, value, range));
	}

	/**
	 * Choose a fresh variable of a given sort, recording its name as taken.
	 */
	private static Term.Variable fresh(String stem, Sort sort, Set<String> taken) {
		String name = Syntax.fresh(stem, taken);
		taken.add(name);
		return new Term.Variable(name, sort);
	}

	/**
	 * Choose the head variables <code>V1</code>, ..., <code>Vn</code> for a
	 * program, where n is the largest head arity, numbering them above any
	 * variable of the same form already used in the program.
	 *
	 * @param program
	 * @return
	 */
	private static ImmutableList<Term.Variable> chooseGlobals(Program program) {
		int arity = 0;
		for (Rule r : program.rules()) {
			if (r.head() != null) {
				arity = Math.max(arity, r.head().terms().size());
			}
		}
		// program variables may carry arbitrarily many digits
		BigInteger max = BigInteger.ZERO;
		for (String name : program.variableNames()) {
			Matcher m = GLOBAL.matcher(name);
			if (m.matches()) {
				max = max.max(new BigInteger(m.group(1)));
			}
		}
		ImmutableList.Builder<Term.Variable> result = ImmutableList.builder();
		for (int i = 1; i <= arity; ++i) {
			result.add(new Term.Variable("V" + max.add(BigInteger.valueOf(i))));
		}
		return result.build();
	}
}
