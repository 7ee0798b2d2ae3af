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
package aspverify.verify;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

import aspverify.core.Specification;
import aspverify.core.Specification.AnnotatedFormula;
import aspverify.core.Syntax;
import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Term;

/**
 * Splits conjectures of the form <code>forall X (F &lt;-&gt; G)</code> into the
 * two implications <code>forall X (F -&gt; G)</code> and
 * <code>forall X (G -&gt; F)</code>. Provers generally find the halves much
 * easier than the whole.
 *
 * @author David J. Pearce
 *
 */
public class EquivalenceBreaker {
	public static final String FORWARD = "_forward";
	public static final String BACKWARD = "_backward";

	/**
	 * Break a formula, returning either the two halves or the formula itself.
	 *
	 * @param formula
	 * @return
	 */
	public static List<Formula> apply(Formula formula) {
		ArrayList<Term.Variable> variables = new ArrayList<>();
		Formula body = formula;
		while (body instanceof Formula.Universal) {
			Formula.Universal u = (Formula.Universal) body;
			variables.addAll(u.variables());
			body = u.body();
		}
		if (!(body instanceof Formula.Equivalence)) {
			return ImmutableList.of(formula);
		}
		Formula.Equivalence e = (Formula.Equivalence) body;
		Formula forward = Syntax.forall(variables, new Formula.Implication(e.lhs(), e.rhs()));
		Formula backward = Syntax.forall(variables, new Formula.Implication(e.rhs(), e.lhs()));
		return ImmutableList.of(forward, backward);
	}

	/**
	 * Break an annotated formula. The halves are named after the original,
	 * with suffixes {@link #FORWARD} and {@link #BACKWARD}.
	 *
	 * @param formula
	 * @return
	 */
	public static List<AnnotatedFormula> apply(AnnotatedFormula formula) {
		List<Formula> parts = apply(formula.formula());
		if (parts.size() == 1) {
			return ImmutableList.of(formula);
		}
		String name = formula.name();
		String forward = name.equals(Specification.UNNAMED) ? name : name + FORWARD;
		String backward = name.equals(Specification.UNNAMED) ? name : name + BACKWARD;
		return ImmutableList.of(formula.withFormula(parts.get(0)).withName(forward),
				formula.withFormula(parts.get(1)).withName(backward));
	}

	public static List<AnnotatedFormula> applyAll(List<AnnotatedFormula> formulas) {
		ArrayList<AnnotatedFormula> result = new ArrayList<>();
		for (AnnotatedFormula f : formulas) {
			result.addAll(apply(f));
		}
		return result;
	}
}
