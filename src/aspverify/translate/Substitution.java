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
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;

import aspverify.core.Syntax;
import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Term;
import aspverify.util.AbstractRewriter;

/**
 * Replaces free occurrences of variables by terms. Bound variables which would
 * capture a variable of a substituted term are renamed apart first.
 *
 * @author David J. Pearce
 *
 */
public class Substitution extends AbstractRewriter {
	private final Map<Term.Variable, Term> mapping;

	public Substitution(Map<Term.Variable, ? extends Term> mapping) {
		this.mapping = ImmutableMap.copyOf(mapping);
	}

	/**
	 * Substitute a single variable within a formula.
	 *
	 * @param formula
	 * @param variable
	 * @param term
	 * @return
	 */
	public static Formula apply(Formula formula, Term.Variable variable, Term term) {
		return new Substitution(ImmutableMap.of(variable, term)).apply(formula);
	}

	@Override
	public Term apply(Term term) {
		if (term instanceof Term.Variable) {
			Term r = mapping.get(term);
			return r == null ? term : r;
		}
		return super.apply(term);
	}

	@Override
	protected Formula apply(Formula.Universal formula) {
		Formula.Quantifier q = rename(formula);
		return q == null ? formula : Syntax.forall(q.variables(), q.body());
	}

	@Override
	protected Formula apply(Formula.Existential formula) {
		Formula.Quantifier q = rename(formula);
		return q == null ? formula : Syntax.exists(q.variables(), q.body());
	}

	/**
	 * Apply this substitution beneath a quantifier. Returns null when the
	 * quantifier is unaffected; otherwise, a quantifier whose (possibly
	 * renamed) variables and rewritten body are to be used.
	 */
	private Formula.Quantifier rename(Formula.Quantifier formula) {
		HashMap<Term.Variable, Term> inner = new HashMap<>(mapping);
		inner.keySet().removeAll(formula.variables());
		// only substitutions for variables actually free in the body matter
		Set<Term.Variable> free = Syntax.freeVariables(formula.body());
		inner.keySet().retainAll(free);
		if (inner.isEmpty()) {
			return null;
		}
		HashSet<String> incoming = new HashSet<>();
		for (Term t : inner.values()) {
			for (Term.Variable v : Syntax.variables(t)) {
				incoming.add(v.name());
			}
		}
		HashSet<String> taken = new HashSet<>(incoming);
		taken.addAll(Syntax.variableNames(formula.body()));
		for (Term.Variable v : inner.keySet()) {
			taken.add(v.name());
		}
		ArrayList<Term.Variable> variables = new ArrayList<>();
		for (Term.Variable v : formula.variables()) {
			if (incoming.contains(v.name())) {
				Term.Variable renamed = new Term.Variable(Syntax.fresh(v.name(), taken), v.sort());
				taken.add(renamed.name());
				inner.put(v, renamed);
				variables.add(renamed);
			} else {
				variables.add(v);
			}
		}
		Formula body = new Substitution(inner).apply(formula.body());
		return new Formula.Universal(variables, body);
	}
}
