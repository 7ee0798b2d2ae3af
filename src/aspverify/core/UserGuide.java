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
package aspverify.core;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import aspverify.core.Specification.AnnotatedFormula;
import aspverify.core.Syntax.Predicate;
import aspverify.core.Syntax.Sort;
import aspverify.util.SyntacticElement;

/**
 * A user guide fixes the interface of the programs being compared: which
 * predicates are inputs and outputs, which symbolic constants are placeholders
 * (and of which sort), and which assumptions may be made about the inputs.
 * Every predicate which is neither an input nor an output is private.
 *
 * @author David J. Pearce
 *
 */
public class UserGuide extends SyntacticElement.Impl {
	private final ImmutableSet<Predicate> inputs;
	private final ImmutableSet<Predicate> outputs;
	private final ImmutableList<PlaceholderDeclaration> placeholders;
	private final ImmutableList<AnnotatedFormula> assumptions;

	public UserGuide(Set<Predicate> inputs, Set<Predicate> outputs, List<PlaceholderDeclaration> placeholders,
			List<AnnotatedFormula> assumptions, Attribute... attributes) {
		super(attributes);
		this.inputs = ImmutableSet.copyOf(inputs);
		this.outputs = ImmutableSet.copyOf(outputs);
		this.placeholders = ImmutableList.copyOf(placeholders);
		this.assumptions = ImmutableList.copyOf(assumptions);
	}

	public static UserGuide empty() {
		return new UserGuide(ImmutableSet.of(), ImmutableSet.of(), ImmutableList.of(), ImmutableList.of());
	}

	public ImmutableSet<Predicate> inputs() {
		return inputs;
	}

	public ImmutableSet<Predicate> outputs() {
		return outputs;
	}

	/**
	 * Get the placeholder declarations in the order given. The same name may be
	 * declared more than once; conflicting declarations are rejected during
	 * placeholder substitution.
	 *
	 * @return
	 */
	public ImmutableList<PlaceholderDeclaration> placeholders() {
		return placeholders;
	}

	public ImmutableList<AnnotatedFormula> assumptions() {
		return assumptions;
	}

	/**
	 * Determine the private predicates among a given set of predicates.
	 *
	 * @param predicates
	 * @return
	 */
	public Set<Predicate> privatePredicates(Set<Predicate> predicates) {
		LinkedHashSet<Predicate> result = new LinkedHashSet<>();
		for (Predicate p : predicates) {
			if (!inputs.contains(p) && !outputs.contains(p)) {
				result.add(p);
			}
		}
		return result;
	}

	@Override
	public String toString() {
		StringBuilder r = new StringBuilder();
		for (Predicate p : inputs) {
			r.append("input: ").append(p).append(".\n");
		}
		for (PlaceholderDeclaration d : placeholders) {
			r.append("input: ").append(d).append(".\n");
		}
		for (Predicate p : outputs) {
			r.append("output: ").append(p).append(".\n");
		}
		for (AnnotatedFormula a : assumptions) {
			r.append(a).append("\n");
		}
		return r.toString();
	}

	/**
	 * Declares a symbolic constant to be a placeholder of a given sort, written
	 * <code>input: n -&gt; integer.</code>
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class PlaceholderDeclaration extends SyntacticElement.Impl {
		private final String name;
		private final Sort sort;

		public PlaceholderDeclaration(String name, Sort sort, Attribute... attributes) {
			super(attributes);
			this.name = name;
			this.sort = sort;
		}

		public String name() {
			return name;
		}

		public Sort sort() {
			return sort;
		}

		@Override
		public String toString() {
			return name + " -> " + sort;
		}
	}
}
