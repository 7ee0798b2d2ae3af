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

import aspverify.core.Syntax;
import aspverify.core.Syntax.Formula;

/**
 * Dispatches over every syntactic form of formula. Each form has its own
 * abstract case, hence a transformation extending this class must handle every
 * form explicitly and a new form cannot be silently ignored.
 *
 * @author David J. Pearce
 *
 * @param <T>
 *            The result of the transformation.
 */
public abstract class AbstractTransformer<T> {

	public T apply(Formula formula) {
		switch (formula.getOpcode()) {
		case Syntax.FORMULA_truth:
			return apply((Formula.Truth) formula);
		case Syntax.FORMULA_falsity:
			return apply((Formula.Falsity) formula);
		case Syntax.FORMULA_atom:
			return apply((Formula.Atom) formula);
		case Syntax.FORMULA_comparison:
			return apply((Formula.Comparison) formula);
		case Syntax.FORMULA_negation:
			return apply((Formula.Negation) formula);
		case Syntax.FORMULA_conjunction:
			return apply((Formula.Conjunction) formula);
		case Syntax.FORMULA_disjunction:
			return apply((Formula.Disjunction) formula);
		case Syntax.FORMULA_implication:
			return apply((Formula.Implication) formula);
		case Syntax.FORMULA_equivalence:
			return apply((Formula.Equivalence) formula);
		case Syntax.FORMULA_universal:
			return apply((Formula.Universal) formula);
		case Syntax.FORMULA_existential:
			return apply((Formula.Existential) formula);
		default:
			throw new IllegalArgumentException("Invalid formula encountered: " + formula);
		}
	}

	protected abstract T apply(Formula.Truth formula);

	protected abstract T apply(Formula.Falsity formula);

	protected abstract T apply(Formula.Atom formula);

	protected abstract T apply(Formula.Comparison formula);

	protected abstract T apply(Formula.Negation formula);

	protected abstract T apply(Formula.Conjunction formula);

	protected abstract T apply(Formula.Disjunction formula);

	protected abstract T apply(Formula.Implication formula);

	protected abstract T apply(Formula.Equivalence formula);

	protected abstract T apply(Formula.Universal formula);

	protected abstract T apply(Formula.Existential formula);
}
