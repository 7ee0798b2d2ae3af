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
package aspverify.util;

import java.util.ArrayList;
import java.util.List;

import aspverify.core.Syntax;
import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Term;

/**
 * A formula transformer which, by default, rebuilds every formula and term
 * structurally. Subclasses override only those cases they actually change.
 * Unchanged subtrees are returned as is.
 *
 * @author David J. Pearce
 *
 */
public abstract class AbstractRewriter extends AbstractTransformer<Formula> {

	/**
	 * Rewrite a single term. By default, constants and variables are returned
	 * as is and compound terms are rebuilt from their rewritten children.
	 *
	 * @param term
	 * @return
	 */
	public Term apply(Term term) {
		switch (term.getOpcode()) {
		case Syntax.TERM_binary: {
			Term.BinaryOperation b = (Term.BinaryOperation) term;
			Term lhs = apply(b.lhs());
			Term rhs = apply(b.rhs());
			if (lhs == b.lhs() && rhs == b.rhs()) {
				return b;
			}
			return new Term.BinaryOperation(b.operator(), lhs, rhs, b.attributes());
		}
		case Syntax.TERM_interval: {
			Term.Interval i = (Term.Interval) term;
			Term lower = apply(i.lower());
			Term upper = apply(i.upper());
			if (lower == i.lower() && upper == i.upper()) {
				return i;
			}
			return new Term.Interval(lower, upper, i.attributes());
		}
		case Syntax.TERM_integer:
		case Syntax.TERM_symbol:
		case Syntax.TERM_variable:
		case Syntax.TERM_placeholder:
		case Syntax.TERM_infimum:
		case Syntax.TERM_supremum:
			return term;
		default:
			throw new IllegalArgumentException("Invalid term encountered: " + term);
		}
	}

	@Override
	protected Formula apply(Formula.Truth formula) {
		return formula;
	}

	@Override
	protected Formula apply(Formula.Falsity formula) {
		return formula;
	}

	@Override
	protected Formula apply(Formula.Atom formula) {
		List<Term> terms = applyAll(formula.terms());
		if (terms == formula.terms()) {
			return formula;
		}
		return new Formula.Atom(formula.symbol(), terms, formula.attributes());
	}

	@Override
	protected Formula apply(Formula.Comparison formula) {
		Term term = apply(formula.term());
		boolean changed = term != formula.term();
		ArrayList<Formula.Guard> guards = new ArrayList<>();
		for (Formula.Guard g : formula.guards()) {
			Term t = apply(g.term());
			changed |= t != g.term();
			guards.add(new Formula.Guard(g.relation(), t));
		}
		if (!changed) {
			return formula;
		}
		return new Formula.Comparison(term, guards, formula.attributes());
	}

	@Override
	protected Formula apply(Formula.Negation formula) {
		Formula operand = apply(formula.operand());
		if (operand == formula.operand()) {
			return formula;
		}
		return new Formula.Negation(operand, formula.attributes());
	}

	@Override
	protected Formula apply(Formula.Conjunction formula) {
		List<Formula> operands = applyAllFormulas(formula.operands());
		if (operands == formula.operands()) {
			return formula;
		}
		return new Formula.Conjunction(operands, formula.attributes());
	}

	@Override
	protected Formula apply(Formula.Disjunction formula) {
		List<Formula> operands = applyAllFormulas(formula.operands());
		if (operands == formula.operands()) {
			return formula;
		}
		return new Formula.Disjunction(operands, formula.attributes());
	}

	@Override
	protected Formula apply(Formula.Implication formula) {
		Formula lhs = apply(formula.lhs());
		Formula rhs = apply(formula.rhs());
		if (lhs == formula.lhs() && rhs == formula.rhs()) {
			return formula;
		}
		return new Formula.Implication(lhs, rhs, formula.attributes());
	}

	@Override
	protected Formula apply(Formula.Equivalence formula) {
		Formula lhs = apply(formula.lhs());
		Formula rhs = apply(formula.rhs());
		if (lhs == formula.lhs() && rhs == formula.rhs()) {
			return formula;
		}
		return new Formula.Equivalence(lhs, rhs, formula.attributes());
	}

	@Override
	protected Formula apply(Formula.Universal formula) {
		Formula body = apply(formula.body());
		if (body == formula.body()) {
			return formula;
		}
		return new Formula.Universal(formula.variables(), body, formula.attributes());
	}

	@Override
	protected Formula apply(Formula.Existential formula) {
		Formula body = apply(formula.body());
		if (body == formula.body()) {
			return formula;
		}
		return new Formula.Existential(formula.variables(), body, formula.attributes());
	}

	/**
	 * Rewrite a list of terms, returning the original list if nothing changed.
	 *
	 * @param terms
	 * @return
	 */
	protected List<Term> applyAll(List<Term> terms) {
		ArrayList<Term> result = new ArrayList<>();
		boolean changed = false;
		for (Term t : terms) {
			Term r = apply(t);
			changed |= r != t;
			result.add(r);
		}
		return changed ? result : terms;
	}

	protected List<Formula> applyAllFormulas(List<Formula> formulas) {
		ArrayList<Formula> result = new ArrayList<>();
		boolean changed = false;
		for (Formula f : formulas) {
			Formula r = apply(f);
			changed |= r != f;
			result.add(r);
		}
		return changed ? result : formulas;
	}
}
