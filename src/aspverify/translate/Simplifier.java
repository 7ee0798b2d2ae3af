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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import aspverify.core.Syntax;
import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Relation;
import aspverify.core.Syntax.Term;
import aspverify.util.AbstractRewriter;

/**
 * Simplifies formulas whilst preserving equivalence in the logic of
 * here-and-there. Hence, only intuitionistically valid rewrites are applied
 * (in particular, double negations are never removed). The rewrites are:
 *
 * <ul>
 * <li>Comparisons between identical terms or integer numerals are evaluated.</li>
 * <li>Truth constants are eliminated, e.g. <code>F and #true</code> becomes
 * <code>F</code> and <code>F -&gt; F</code> becomes <code>#true</code>.</li>
 * <li>Nested conjunctions and disjunctions are flattened and duplicate
 * operands removed.</li>
 * <li>Nested quantifiers of the same kind are joined, and variables which are
 * not used are dropped.</li>
 * <li>Existentials conjoined together are merged when this causes no
 * capture.</li>
 * <li><code>exists X (X = t and F)</code> becomes <code>F[t/X]</code>.</li>
 * </ul>
 *
 * Rewrites are applied bottom up, and repeated until nothing changes. Stronger
 * portfolios add rewrites which are only valid in the logic of here-and-there
 * (<code>not F or not not F</code> becomes <code>#true</code>) or in classical
 * logic (<code>not not F</code> becomes <code>F</code> and <code>F or not
 * F</code> becomes <code>#true</code>). A weaker strategy applies the rewrites
 * at the root only, or in a single pass.
 *
 * @author David J. Pearce
 *
 */
public class Simplifier extends AbstractRewriter {
	/**
	 * The logic in which rewrites must preserve equivalence. Each portfolio
	 * includes the rewrites of those before it.
	 */
	public enum Portfolio {
		INTUITIONISTIC, HT, CLASSIC;

		@Override
		public String toString() {
			return name().toLowerCase();
		}
	}

	/**
	 * Where and how often rewrites are applied.
	 */
	public enum Strategy {
		/**
		 * Rewrite the outermost connective once.
		 */
		SHALLOW,
		/**
		 * Rewrite every subformula once, bottom up.
		 */
		RECURSIVE,
		/**
		 * Rewrite every subformula repeatedly, until nothing changes.
		 */
		FIXPOINT;

		@Override
		public String toString() {
			return name().toLowerCase();
		}
	}

	private final Portfolio portfolio;
	private final Strategy strategy;

	public Simplifier() {
		this(Portfolio.INTUITIONISTIC, Strategy.FIXPOINT);
	}

	public Simplifier(Portfolio portfolio, Strategy strategy) {
		this.portfolio = portfolio;
		this.strategy = strategy;
	}

	/**
	 * Simplify a formula as far as possible, preserving equivalence in the
	 * logic of here-and-there.
	 *
	 * @param formula
	 * @return
	 */
	public static Formula simplify(Formula formula) {
		return new Simplifier().run(formula);
	}

	public static List<Formula> simplify(List<Formula> formulas) {
		return new Simplifier().run(formulas);
	}

	/**
	 * Simplify a formula according to the chosen strategy.
	 *
	 * @param formula
	 * @return
	 */
	public Formula run(Formula formula) {
		if (strategy != Strategy.FIXPOINT) {
			return apply(formula);
		}
		Formula previous;
		do {
			previous = formula;
			formula = apply(formula);
		} while (!formula.equals(previous));
		return formula;
	}

	public List<Formula> run(List<Formula> formulas) {
		ArrayList<Formula> result = new ArrayList<>();
		for (Formula f : formulas) {
			result.add(run(f));
		}
		return result;
	}

	/**
	 * Simplify an immediate subformula, unless only the root is rewritten.
	 */
	private Formula child(Formula formula) {
		return strategy == Strategy.SHALLOW ? formula : apply(formula);
	}

	@Override
	protected Formula apply(Formula.Comparison formula) {
		ArrayList<Term> terms = new ArrayList<>();
		terms.add(formula.term());
		for (Formula.Guard g : formula.guards()) {
			terms.add(g.term());
		}
		ArrayList<Formula> segments = new ArrayList<>();
		ArrayList<Formula.Guard> segment = new ArrayList<>();
		Term start = terms.get(0);
		boolean decided = false;
		for (int i = 0; i != formula.guards().size(); ++i) {
			Relation relation = formula.guards().get(i).relation();
			Boolean value = evaluate(terms.get(i), relation, terms.get(i + 1));
			if (value == null) {
				segment.add(formula.guards().get(i));
				continue;
			}
			decided = true;
			if (!value) {
				return Syntax.FALSE;
			}
			if (!segment.isEmpty()) {
				segments.add(new Formula.Comparison(start, segment));
				segment = new ArrayList<>();
			}
			start = terms.get(i + 1);
		}
		if (!decided) {
			return formula;
		}
		if (!segment.isEmpty()) {
			segments.add(new Formula.Comparison(start, segment));
		}
		return Syntax.conjunction(segments);
	}

	/**
	 * Attempt to decide whether two terms are related, returning null if this
	 * cannot be determined syntactically.
	 */
	private static Boolean evaluate(Term lhs, Relation relation, Term rhs) {
		if (lhs.equals(rhs) && Syntax.isTotal(lhs)) {
			return relation.isReflexive();
		} else if (lhs instanceof Term.IntegerConstant && rhs instanceof Term.IntegerConstant) {
			int l = ((Term.IntegerConstant) lhs).value();
			int r = ((Term.IntegerConstant) rhs).value();
			switch (relation) {
			case EQUAL:
				return l == r;
			case NOT_EQUAL:
				return l != r;
			case LESS:
				return l < r;
			case LESS_EQUAL:
				return l <= r;
			case GREATER:
				return l > r;
			default:
				return l >= r;
			}
		}
		return null;
	}

	@Override
	protected Formula apply(Formula.Negation formula) {
		Formula operand = child(formula.operand());
		if (portfolio == Portfolio.CLASSIC && operand instanceof Formula.Negation) {
			return ((Formula.Negation) operand).operand();
		} else if (operand instanceof Formula.Truth) {
			return Syntax.FALSE;
		} else if (operand instanceof Formula.Falsity) {
			return Syntax.TRUE;
		} else if (operand == formula.operand()) {
			return formula;
		}
		return new Formula.Negation(operand, formula.attributes());
	}

	@Override
	protected Formula apply(Formula.Conjunction formula) {
		LinkedHashSet<Formula> operands = new LinkedHashSet<>();
		for (Formula f : formula.operands()) {
			f = child(f);
			if (f instanceof Formula.Falsity) {
				return Syntax.FALSE;
			} else if (f instanceof Formula.Conjunction) {
				operands.addAll(((Formula.Conjunction) f).operands());
			} else if (!(f instanceof Formula.Truth)) {
				operands.add(f);
			}
		}
		ArrayList<Formula> list = new ArrayList<>(operands);
		Formula merged = mergeExistentials(list);
		if (merged != null) {
			return merged;
		} else if (list.equals(formula.operands())) {
			return formula;
		}
		return Syntax.conjunction(list);
	}

	/**
	 * Merge two or more existentials within a conjunction into one, such that
	 * <code>exists X F and exists Y G and H</code> becomes
	 * <code>exists X Y (F and G and H)</code>. This is only possible when no
	 * variable would be captured.
	 *
	 * @param operands
	 * @return The merged formula, or null if no merge is possible.
	 */
	private static Formula mergeExistentials(List<Formula> operands) {
		ArrayList<Term.Variable> variables = new ArrayList<>();
		HashSet<String> names = new HashSet<>();
		int count = 0;
		for (Formula f : operands) {
			if (f instanceof Formula.Existential) {
				for (Term.Variable v : ((Formula.Existential) f).variables()) {
					if (!names.add(v.name())) {
						return null;
					}
					variables.add(v);
				}
				count++;
			}
		}
		if (count < 2) {
			return null;
		}
		ArrayList<Formula> body = new ArrayList<>();
		for (Formula f : operands) {
			Formula inner = f instanceof Formula.Existential ? ((Formula.Existential) f).body() : f;
			Set<Term.Variable> own = f instanceof Formula.Existential
					? new HashSet<>(((Formula.Existential) f).variables())
					: new HashSet<>();
			for (Term.Variable v : Syntax.freeVariables(inner)) {
				if (names.contains(v.name()) && !own.contains(v)) {
					return null;
				}
			}
			if (inner instanceof Formula.Conjunction) {
				body.addAll(((Formula.Conjunction) inner).operands());
			} else {
				body.add(inner);
			}
		}
		return new Formula.Existential(variables, Syntax.conjunction(body));
	}

	@Override
	protected Formula apply(Formula.Disjunction formula) {
		LinkedHashSet<Formula> operands = new LinkedHashSet<>();
		for (Formula f : formula.operands()) {
			f = child(f);
			if (f instanceof Formula.Truth) {
				return Syntax.TRUE;
			} else if (f instanceof Formula.Disjunction) {
				operands.addAll(((Formula.Disjunction) f).operands());
			} else if (!(f instanceof Formula.Falsity)) {
				operands.add(f);
			}
		}
		if (excludesMiddle(operands)) {
			return Syntax.TRUE;
		}
		ArrayList<Formula> list = new ArrayList<>(operands);
		if (list.equals(formula.operands())) {
			return formula;
		}
		return Syntax.disjunction(list);
	}

	/**
	 * Check whether a disjunction contains both <code>not F</code> and
	 * <code>not not F</code> (here-and-there), or both <code>F</code> and
	 * <code>not F</code> (classical).
	 */
	private boolean excludesMiddle(Set<Formula> operands) {
		if (portfolio == Portfolio.INTUITIONISTIC) {
			return false;
		}
		for (Formula f : operands) {
			if (f instanceof Formula.Negation) {
				if (operands.contains(new Formula.Negation(f))) {
					return true;
				} else if (portfolio == Portfolio.CLASSIC && operands.contains(((Formula.Negation) f).operand())) {
					return true;
				}
			}
		}
		return false;
	}

	@Override
	protected Formula apply(Formula.Implication formula) {
		Formula lhs = child(formula.lhs());
		Formula rhs = child(formula.rhs());
		if (lhs instanceof Formula.Truth) {
			return rhs;
		} else if (lhs instanceof Formula.Falsity || rhs instanceof Formula.Truth || lhs.equals(rhs)) {
			return Syntax.TRUE;
		} else if (lhs == formula.lhs() && rhs == formula.rhs()) {
			return formula;
		}
		return new Formula.Implication(lhs, rhs, formula.attributes());
	}

	@Override
	protected Formula apply(Formula.Equivalence formula) {
		Formula lhs = child(formula.lhs());
		Formula rhs = child(formula.rhs());
		if (lhs.equals(rhs)) {
			return Syntax.TRUE;
		} else if (lhs instanceof Formula.Truth) {
			return rhs;
		} else if (rhs instanceof Formula.Truth) {
			return lhs;
		} else if (lhs == formula.lhs() && rhs == formula.rhs()) {
			return formula;
		}
		return new Formula.Equivalence(lhs, rhs, formula.attributes());
	}

	@Override
	protected Formula apply(Formula.Universal formula) {
		Formula body = child(formula.body());
		List<Term.Variable> variables = formula.variables();
		if (body instanceof Formula.Universal) {
			Formula.Universal inner = (Formula.Universal) body;
			variables = join(variables, inner.variables());
			body = inner.body();
		}
		variables = used(variables, body);
		if (variables.equals(formula.variables()) && body == formula.body()) {
			return formula;
		}
		return Syntax.forall(variables, body);
	}

	@Override
	protected Formula apply(Formula.Existential formula) {
		Formula body = child(formula.body());
		List<Term.Variable> variables = formula.variables();
		if (body instanceof Formula.Existential) {
			Formula.Existential inner = (Formula.Existential) body;
			variables = join(variables, inner.variables());
			body = inner.body();
		}
		variables = used(variables, body);
		// eliminate at most one variable per pass
		for (Term.Variable v : variables) {
			Formula reduced = eliminate(v, body);
			if (reduced != null) {
				ArrayList<Term.Variable> remaining = new ArrayList<>(variables);
				remaining.remove(v);
				return Syntax.exists(remaining, reduced);
			}
		}
		if (variables.equals(formula.variables()) && body == formula.body()) {
			return formula;
		}
		return Syntax.exists(variables, body);
	}

	/**
	 * Attempt to eliminate an existentially quantified variable
	 * <code>X</code> from a body of the form <code>... and X = t and ...</code>,
	 * by substituting <code>t</code> for <code>X</code> in the remaining
	 * conjuncts.
	 *
	 * @param variable
	 * @param body
	 * @return The remaining body, or null if no such equality exists.
	 */
	private static Formula eliminate(Term.Variable variable, Formula body) {
		List<Formula> conjuncts = body instanceof Formula.Conjunction ? ((Formula.Conjunction) body).operands()
				: ImmutableList.of(body);
		for (int i = 0; i != conjuncts.size(); ++i) {
			Term t = definition(variable, conjuncts.get(i));
			if (t == null) {
				continue;
			}
			ArrayList<Formula> rest = new ArrayList<>(conjuncts);
			rest.remove(i);
			Formula remainder = Syntax.conjunction(rest);
			if (Syntax.size(t) > 1 && occurrences(variable, remainder) > 1) {
				continue;
			}
			return Substitution.apply(remainder, variable, t);
		}
		return null;
	}

	/**
	 * Check whether a formula is an equality <code>X = t</code> (or
	 * <code>t = X</code>) which can be used to eliminate <code>X</code>.
	 */
	private static Term definition(Term.Variable variable, Formula f) {
		if (!(f instanceof Formula.Comparison)) {
			return null;
		}
		Formula.Comparison c = (Formula.Comparison) f;
		if (c.guards().size() != 1 || c.guards().get(0).relation() != Relation.EQUAL) {
			return null;
		}
		Term lhs = c.term();
		Term rhs = c.guards().get(0).term();
		Term t = lhs.equals(variable) ? rhs : rhs.equals(variable) ? lhs : null;
		if (t == null || Syntax.variables(t).contains(variable) || !Syntax.isTotal(t)
				|| !variable.sort().contains(t.sort())) {
			return null;
		}
		return t;
	}

	private static int occurrences(Term.Variable variable, Formula f) {
		int count = 0;
		for (Term t : Syntax.terms(f)) {
			count += occurrences(variable, t);
		}
		return count;
	}

	private static int occurrences(Term.Variable variable, Term t) {
		if (t.equals(variable)) {
			return 1;
		} else if (t instanceof Term.BinaryOperation) {
			Term.BinaryOperation b = (Term.BinaryOperation) t;
			return occurrences(variable, b.lhs()) + occurrences(variable, b.rhs());
		} else if (t instanceof Term.Interval) {
			Term.Interval i = (Term.Interval) t;
			return occurrences(variable, i.lower()) + occurrences(variable, i.upper());
		}
		return 0;
	}

	/**
	 * Join the variables of two nested quantifiers, where an inner variable
	 * shadows any outer one of the same name.
	 */
	private static List<Term.Variable> join(List<Term.Variable> outer, List<Term.Variable> inner) {
		HashSet<String> names = new HashSet<>();
		for (Term.Variable v : inner) {
			names.add(v.name());
		}
		ArrayList<Term.Variable> result = new ArrayList<>();
		for (Term.Variable v : outer) {
			if (!names.contains(v.name())) {
				result.add(v);
			}
		}
		result.addAll(inner);
		return result;
	}

	/**
	 * Retain only those variables which actually occur free in the body.
	 */
	private static List<Term.Variable> used(List<Term.Variable> variables, Formula body) {
		Set<Term.Variable> free = Syntax.freeVariables(body);
		ArrayList<Term.Variable> result = new ArrayList<>();
		for (Term.Variable v : variables) {
			if (free.contains(v)) {
				result.add(v);
			}
		}
		return result.size() == variables.size() ? variables : result;
	}
}
