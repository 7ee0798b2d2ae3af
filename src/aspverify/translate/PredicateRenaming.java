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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableMap;

import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Predicate;
import aspverify.util.AbstractRewriter;

/**
 * Renames predicate symbols throughout a formula (arities are unchanged).
 *
 * @author David J. Pearce
 *
 */
public class PredicateRenaming extends AbstractRewriter {
	/**
	 * Appended to a private predicate to separate it from a predicate of the
	 * same name on the other side of an equivalence.
	 */
	public static final String SUFFIX = "_p";

	private final Map<Predicate, String> mapping;

	protected PredicateRenaming() {
		this(ImmutableMap.of());
	}

	public PredicateRenaming(Map<Predicate, String> mapping) {
		this.mapping = ImmutableMap.copyOf(mapping);
	}

	/**
	 * Construct the renaming which separates the given predicates from every
	 * predicate in <code>taken</code>, by appending {@link #SUFFIX} (as often
	 * as necessary) to each predicate which collides.
	 *
	 * @param predicates
	 *            Predicates which may be renamed.
	 * @param taken
	 *            Predicates which must not be collided with.
	 * @return
	 */
	public static PredicateRenaming separate(Set<Predicate> predicates, Set<Predicate> taken) {
		LinkedHashMap<Predicate, String> mapping = new LinkedHashMap<>();
		for (Predicate p : predicates) {
			if (taken.contains(p)) {
				String name = p.symbol() + SUFFIX;
				while (taken.contains(new Predicate(name, p.arity())) || predicates.contains(new Predicate(name, p.arity()))
						|| mapping.containsValue(name)) {
					name = name + SUFFIX;
				}
				mapping.put(p, name);
			}
		}
		return new PredicateRenaming(mapping);
	}

	public Map<Predicate, String> mapping() {
		return mapping;
	}

	/**
	 * Determine the new symbol of a given predicate.
	 *
	 * @param predicate
	 * @return
	 */
	protected String rename(Predicate predicate) {
		String r = mapping.get(predicate);
		return r == null ? predicate.symbol() : r;
	}

	/**
	 * Determine the new predicate for a given predicate.
	 *
	 * @param predicate
	 * @return
	 */
	public Predicate apply(Predicate predicate) {
		return new Predicate(rename(predicate), predicate.arity());
	}

	@Override
	protected Formula apply(Formula.Atom formula) {
		String symbol = rename(formula.predicate());
		if (symbol.equals(formula.symbol())) {
			return formula;
		}
		return new Formula.Atom(symbol, formula.terms(), formula.attributes());
	}
}
