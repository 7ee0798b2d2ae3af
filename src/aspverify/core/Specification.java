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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Predicate;
import aspverify.util.SyntacticElement;

/**
 * A sequence of annotated formulas, as found in specification files and proof
 * outlines.
 *
 * @author David J. Pearce
 *
 */
public class Specification extends SyntacticElement.Impl {
	public static final String UNNAMED = "unnamed";

	public enum Role {
		ASSUMPTION("assumption"), SPEC("spec"), DEFINITION("definition"), LEMMA("lemma"),
		INDUCTIVE_LEMMA("inductive-lemma");

		private final String keyword;

		private Role(String keyword) {
			this.keyword = keyword;
		}

		@Override
		public String toString() {
			return keyword;
		}
	}

	public enum Direction {
		FORWARD, BACKWARD, UNIVERSAL;

		/**
		 * Check whether something annotated with this direction applies when
		 * building the task for a given (concrete) direction.
		 *
		 * @param d
		 * @return
		 */
		public boolean includes(Direction d) {
			return this == UNIVERSAL || d == UNIVERSAL || this == d;
		}

		/**
		 * Get the concrete directions denoted by this direction.
		 *
		 * @return
		 */
		public List<Direction> expand() {
			return this == UNIVERSAL ? ImmutableList.of(FORWARD, BACKWARD) : ImmutableList.of(this);
		}

		@Override
		public String toString() {
			return name().toLowerCase();
		}
	}

	/**
	 * A formula with a role, a direction and a name.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class AnnotatedFormula extends SyntacticElement.Impl {
		private final Role role;
		private final Direction direction;
		private final String name;
		private final Formula formula;

		public AnnotatedFormula(Role role, Direction direction, String name, Formula formula,
				Attribute... attributes) {
			super(attributes);
			this.role = role;
			this.direction = direction == null ? Direction.UNIVERSAL : direction;
			this.name = name == null ? UNNAMED : name;
			this.formula = formula;
		}

		public AnnotatedFormula(Role role, Formula formula) {
			this(role, Direction.UNIVERSAL, UNNAMED, formula);
		}

		public Role role() {
			return role;
		}

		public Direction direction() {
			return direction;
		}

		public String name() {
			return name;
		}

		public Formula formula() {
			return formula;
		}

		/**
		 * Construct a copy of this annotated formula with a different formula,
		 * retaining everything else (including source attributes).
		 *
		 * @param formula
		 * @return
		 */
		public AnnotatedFormula withFormula(Formula formula) {
			return new AnnotatedFormula(role, direction, name, formula, attributes());
		}

		public AnnotatedFormula withName(String name) {
			return new AnnotatedFormula(role, direction, name, formula, attributes());
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof AnnotatedFormula) {
				AnnotatedFormula a = (AnnotatedFormula) o;
				return role == a.role && direction == a.direction && name.equals(a.name) && formula.equals(a.formula);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return role.hashCode() ^ name.hashCode() ^ formula.hashCode();
		}

		@Override
		public String toString() {
			String r = role.toString();
			if (direction != Direction.UNIVERSAL) {
				r += "(" + direction + ")";
			}
			if (!name.equals(UNNAMED)) {
				r += "[" + name + "]";
			}
			return r + ": " + formula + ".";
		}
	}

	private final ImmutableList<AnnotatedFormula> formulas;

	public Specification(List<AnnotatedFormula> formulas, Attribute... attributes) {
		super(attributes);
		this.formulas = ImmutableList.copyOf(formulas);
	}

	public ImmutableList<AnnotatedFormula> formulas() {
		return formulas;
	}

	/**
	 * Get those formulas with a given role, in order.
	 *
	 * @param role
	 * @return
	 */
	public List<AnnotatedFormula> formulas(Role role) {
		ArrayList<AnnotatedFormula> result = new ArrayList<>();
		for (AnnotatedFormula f : formulas) {
			if (f.role() == role) {
				result.add(f);
			}
		}
		return result;
	}

	public Set<Predicate> predicates() {
		LinkedHashSet<Predicate> result = new LinkedHashSet<>();
		for (AnnotatedFormula f : formulas) {
			result.addAll(Syntax.predicates(f.formula()));
		}
		return result;
	}

	@Override
	public String toString() {
		StringBuilder r = new StringBuilder();
		for (AnnotatedFormula f : formulas) {
			r.append(f).append("\n");
		}
		return r.toString();
	}
}
