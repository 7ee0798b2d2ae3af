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
import java.util.Objects;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Predicate;
import aspverify.core.Syntax.Term;
import aspverify.util.SyntacticElement;

/**
 * An answer set program in the supported dialect, consisting of an ordered
 * sequence of basic rules, choice rules and constraints.
 *
 * @author David J. Pearce
 *
 */
public class Program extends SyntacticElement.Impl {
	private final ImmutableList<Rule> rules;

	public Program(List<Rule> rules, Attribute... attributes) {
		super(attributes);
		this.rules = ImmutableList.copyOf(rules);
	}

	public ImmutableList<Rule> rules() {
		return rules;
	}

	/**
	 * Determine every predicate occurring in this program (in heads or bodies),
	 * in order of first occurrence.
	 *
	 * @return
	 */
	public Set<Predicate> predicates() {
		LinkedHashSet<Predicate> result = new LinkedHashSet<>();
		for (Rule r : rules) {
			if (r.head() != null) {
				result.add(r.head().predicate());
			}
			for (Literal l : r.body()) {
				if (l.atom() instanceof Formula.Atom) {
					result.add(((Formula.Atom) l.atom()).predicate());
				}
			}
		}
		return result;
	}

	/**
	 * Determine every predicate occurring in the head of some rule, in order of
	 * first occurrence.
	 *
	 * @return
	 */
	public Set<Predicate> headPredicates() {
		LinkedHashSet<Predicate> result = new LinkedHashSet<>();
		for (Rule r : rules) {
			if (r.head() != null) {
				result.add(r.head().predicate());
			}
		}
		return result;
	}

	/**
	 * Determine every variable name used anywhere in this program.
	 *
	 * @return
	 */
	public Set<String> variableNames() {
		LinkedHashSet<String> result = new LinkedHashSet<>();
		for (Rule r : rules) {
			for (Term.Variable v : r.variables()) {
				result.add(v.name());
			}
		}
		return result;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Program && ((Program) o).rules.equals(rules);
	}

	@Override
	public int hashCode() {
		return rules.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder r = new StringBuilder();
		for (Rule rule : rules) {
			r.append(rule).append("\n");
		}
		return r.toString();
	}

	/**
	 * Determines how often a body literal is negated. Under here-and-there
	 * semantics a doubly negated literal is not equivalent to its positive
	 * counterpart, hence all three are distinguished.
	 */
	public enum Sign {
		NONE(0), NEGATION(1), DOUBLE_NEGATION(2);

		private final int depth;

		private Sign(int depth) {
			this.depth = depth;
		}

		public int depth() {
			return depth;
		}
	}

	/**
	 * A body literal, which is either an atom or a binary comparison, possibly
	 * negated.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Literal extends SyntacticElement.Impl {
		private final Sign sign;
		private final Formula atom;

		public Literal(Sign sign, Formula atom, Attribute... attributes) {
			super(attributes);
			if (!(atom instanceof Formula.Atom) && !(atom instanceof Formula.Comparison)) {
				throw new IllegalArgumentException("literal must be an atom or comparison: " + atom);
			}
			this.sign = sign;
			this.atom = atom;
		}

		public Sign sign() {
			return sign;
		}

		/**
		 * Get the underlying atom or comparison of this literal.
		 *
		 * @return
		 */
		public Formula atom() {
			return atom;
		}

		public boolean isPositive() {
			return sign == Sign.NONE;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Literal) {
				Literal l = (Literal) o;
				return sign == l.sign && atom.equals(l.atom);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return sign.hashCode() ^ atom.hashCode();
		}

		@Override
		public String toString() {
			switch (sign) {
			case NEGATION:
				return "not " + atom;
			case DOUBLE_NEGATION:
				return "not not " + atom;
			default:
				return atom.toString();
			}
		}
	}

	public enum Kind {
		BASIC, CHOICE, CONSTRAINT
	}

	/**
	 * A single rule of the form <code>H :- B1, ..., Bn.</code>, where the head
	 * is absent for a constraint and enclosed in braces for a choice rule.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Rule extends SyntacticElement.Impl {
		private final Kind kind;
		private final Formula.Atom head;
		private final ImmutableList<Literal> body;

		public Rule(Kind kind, Formula.Atom head, List<Literal> body, Attribute... attributes) {
			super(attributes);
			if ((kind == Kind.CONSTRAINT) != (head == null)) {
				throw new IllegalArgumentException("only constraints have no head");
			}
			this.kind = kind;
			this.head = head;
			this.body = ImmutableList.copyOf(body);
		}

		public Kind kind() {
			return kind;
		}

		/**
		 * Get the head atom of this rule, or null for a constraint.
		 *
		 * @return
		 */
		public Formula.Atom head() {
			return head;
		}

		public ImmutableList<Literal> body() {
			return body;
		}

		/**
		 * Determine the variables of this rule, in order of first occurrence
		 * (head first).
		 *
		 * @return
		 */
		public Set<Term.Variable> variables() {
			LinkedHashSet<Term.Variable> result = new LinkedHashSet<>();
			if (head != null) {
				result.addAll(Syntax.freeVariables(head));
			}
			for (Literal l : body) {
				result.addAll(Syntax.freeVariables(l.atom()));
			}
			return result;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Rule) {
				Rule r = (Rule) o;
				return kind == r.kind && Objects.equals(head, r.head) && body.equals(r.body);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return kind.hashCode() ^ body.hashCode();
		}

		@Override
		public String toString() {
			StringBuilder r = new StringBuilder();
			if (kind == Kind.CHOICE) {
				r.append("{").append(head).append("}");
			} else if (kind == Kind.BASIC) {
				r.append(head);
			}
			if (!body.isEmpty()) {
				r.append(kind == Kind.CONSTRAINT ? ":- " : " :- ");
				for (int i = 0; i != body.size(); ++i) {
					if (i != 0) {
						r.append(", ");
					}
					r.append(body.get(i));
				}
			} else if (kind == Kind.CONSTRAINT) {
				r.append(":-");
			}
			return r.append(".").toString();
		}
	}
}
