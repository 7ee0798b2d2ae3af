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
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import aspverify.core.Syntax;
import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Predicate;
import aspverify.core.Syntax.Term;
import aspverify.util.AbstractTransformer;

/**
 * Reduces here-and-there (HT) semantics to classical logic. Every predicate
 * <code>p</code> is split into <code>hp</code> (its extent in the "here" world)
 * and <code>tp</code> (its extent in the "there" world). Then,
 * <code>here(F)</code> holds classically exactly when <code>F</code> holds in
 * the here world of an HT interpretation, provided the ordering axioms
 * <code>forall X (hp(X) -&gt; tp(X))</code> hold. The cases are:
 *
 * <pre>
 * here(p(t))  = hp(t)
 * here(not F) = not there(F)
 * here(F -&gt; G) = (here(F) -&gt; here(G)) and (there(F) -&gt; there(G))
 * here(F &lt;-&gt; G) = (here(F) &lt;-&gt; here(G)) and (there(F) &lt;-&gt; there(G))
 * </pre>
 *
 * Conjunction, disjunction and the quantifiers are translated componentwise,
 * whilst comparisons are unchanged. When the antecedent of an implication is
 * a negation, its here and there translations coincide and, under the
 * ordering axioms, the second conjunct follows from the first and is omitted.
 *
 * @author David J. Pearce
 *
 */
public class Gamma extends AbstractTransformer<Formula> {
	public static final String HERE = "h";
	public static final String THERE = "t";

	private final Rename there = new Rename(THERE);

	/**
	 * Compute <code>here(F)</code>.
	 *
	 * @param formula
	 * @return
	 */
	public static Formula here(Formula formula) {
		return new Gamma().apply(formula);
	}

	/**
	 * Compute <code>there(F)</code>, which simply renames every predicate.
	 *
	 * @param formula
	 * @return
	 */
	public static Formula there(Formula formula) {
		return new Rename(THERE).apply(formula);
	}

	/**
	 * Translate a whole theory, producing <code>here(F)</code> and
	 * <code>there(F)</code> for every formula followed by the ordering axioms.
	 *
	 * @param theory
	 * @return
	 */
	public static List<Formula> theory(List<Formula> theory) {
		ArrayList<Formula> result = new ArrayList<>();
		LinkedHashSet<Predicate> predicates = new LinkedHashSet<>();
		for (Formula f : theory) {
			result.add(here(f));
			predicates.addAll(Syntax.predicates(f));
		}
		for (Formula f : theory) {
			result.add(there(f));
		}
		result.addAll(orderingAxioms(predicates));
		return result;
	}

	/**
	 * Construct the axioms <code>forall X (hp(X) -&gt; tp(X))</code> for the
	 * given predicates.
	 *
	 * @param predicates
	 * @return
	 */
	public static List<Formula> orderingAxioms(Collection<Predicate> predicates) {
		ArrayList<Formula> result = new ArrayList<>();
		for (Predicate p : predicates) {
			ArrayList<Term.Variable> variables = new ArrayList<>();
			for (int i = 1; i <= p.arity(); ++i) {
				variables.add(new Term.Variable("X" + i));
			}
			Formula h = new Formula.Atom(HERE + p.symbol(), variables);
			Formula t = new Formula.Atom(THERE + p.symbol(), variables);
			result.add(Syntax.forall(variables, new Formula.Implication(h, t)));
		}
		return result;
	}

	/**
	 * Determine the predicates introduced by gamma for a given predicate set.
	 *
	 * @param predicates
	 * @return
	 */
	public static Set<Predicate> split(Collection<Predicate> predicates) {
		LinkedHashSet<Predicate> result = new LinkedHashSet<>();
		for (Predicate p : predicates) {
			result.add(new Predicate(HERE + p.symbol(), p.arity()));
			result.add(new Predicate(THERE + p.symbol(), p.arity()));
		}
		return result;
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
		return new Formula.Atom(HERE + formula.symbol(), formula.terms(), formula.attributes());
	}

	@Override
	protected Formula apply(Formula.Comparison formula) {
		return formula;
	}

	@Override
	protected Formula apply(Formula.Negation formula) {
		return new Formula.Negation(there.apply(formula.operand()), formula.attributes());
	}

	@Override
	protected Formula apply(Formula.Conjunction formula) {
		ArrayList<Formula> operands = new ArrayList<>();
		for (Formula f : formula.operands()) {
			operands.add(apply(f));
		}
		return new Formula.Conjunction(operands, formula.attributes());
	}

	@Override
	protected Formula apply(Formula.Disjunction formula) {
		ArrayList<Formula> operands = new ArrayList<>();
		for (Formula f : formula.operands()) {
			operands.add(apply(f));
		}
		return new Formula.Disjunction(operands, formula.attributes());
	}

	/**
	 * Translate <code>F -&gt; G</code> in the here world. When the antecedent is
	 * a negation, only <code>here(F) -&gt; here(G)</code> is produced and the
	 * there-implication is omitted. This is equivalent to the full translation
	 * only in the presence of the ordering axioms <code>forall X (hp(X) -&gt;
	 * tp(X))</code>, so callers using {@link #here(Formula)} on its own must
	 * supply those axioms as well.
	 *
	 * @param formula
	 * @return
	 */
	@Override
	protected Formula apply(Formula.Implication formula) {
		Formula here = new Formula.Implication(apply(formula.lhs()), apply(formula.rhs()));
		if (formula.lhs() instanceof Formula.Negation) {
			return here;
		}
		Formula there = new Formula.Implication(this.there.apply(formula.lhs()), this.there.apply(formula.rhs()));
		return new Formula.Conjunction(here, there);
	}

	@Override
	protected Formula apply(Formula.Equivalence formula) {
		Formula here = new Formula.Equivalence(apply(formula.lhs()), apply(formula.rhs()));
		if (formula.lhs() instanceof Formula.Negation && formula.rhs() instanceof Formula.Negation) {
			return here;
		}
		Formula there = new Formula.Equivalence(this.there.apply(formula.lhs()), this.there.apply(formula.rhs()));
		return new Formula.Conjunction(here, there);
	}

	@Override
	protected Formula apply(Formula.Universal formula) {
		return new Formula.Universal(formula.variables(), apply(formula.body()), formula.attributes());
	}

	@Override
	protected Formula apply(Formula.Existential formula) {
		return new Formula.Existential(formula.variables(), apply(formula.body()), formula.attributes());
	}

	/**
	 * Prefixes every predicate symbol with a fixed string.
	 *
	 * @author David J. Pearce
	 *
	 */
	private static final class Rename extends PredicateRenaming {
		private final String prefix;

		public Rename(String prefix) {
			this.prefix = prefix;
		}

		@Override
		protected String rename(Predicate predicate) {
			return prefix + predicate.symbol();
		}
	}
}
