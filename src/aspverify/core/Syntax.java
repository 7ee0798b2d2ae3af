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
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import aspverify.util.SyntacticElement;
import aspverify.util.ValidationError;

/**
 * The many-sorted first-order language shared by every stage of the pipeline.
 * Terms and formulas are immutable trees, tagged with an opcode so that
 * transformers can dispatch over them exhaustively.
 *
 * @author David J. Pearce
 *
 */
public class Syntax {
	public final static int TERM_integer = 0;
	public final static int TERM_symbol = 1;
	public final static int TERM_variable = 2;
	public final static int TERM_placeholder = 3;
	public final static int TERM_infimum = 4;
	public final static int TERM_supremum = 5;
	public final static int TERM_binary = 6;
	public final static int TERM_interval = 7;

	public final static int FORMULA_truth = 10;
	public final static int FORMULA_falsity = 11;
	public final static int FORMULA_atom = 12;
	public final static int FORMULA_comparison = 13;
	public final static int FORMULA_negation = 14;
	public final static int FORMULA_conjunction = 15;
	public final static int FORMULA_disjunction = 16;
	public final static int FORMULA_implication = 17;
	public final static int FORMULA_equivalence = 18;
	public final static int FORMULA_universal = 19;
	public final static int FORMULA_existential = 20;

	/**
	 * The sorts of the language. General is the supersort containing the
	 * integers, the symbols and the two distinguished constants
	 * <code>#inf</code> and <code>#sup</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public enum Sort {
		GENERAL("", "$g"), INTEGER("$i", "$i"), SYMBOL("$s", "$s");

		private final String variableSuffix;
		private final String constantSuffix;

		private Sort(String variableSuffix, String constantSuffix) {
			this.variableSuffix = variableSuffix;
			this.constantSuffix = constantSuffix;
		}

		/**
		 * Check whether every value of the given sort is also a value of this
		 * sort.
		 *
		 * @param sort
		 * @return
		 */
		public boolean contains(Sort sort) {
			return this == GENERAL || this == sort;
		}

		public String variableSuffix() {
			return variableSuffix;
		}

		public String constantSuffix() {
			return constantSuffix;
		}

		@Override
		public String toString() {
			return name().toLowerCase();
		}
	}

	/**
	 * A predicate symbol together with its arity.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Predicate implements Comparable<Predicate> {
		private final String symbol;
		private final int arity;

		public Predicate(String symbol, int arity) {
			this.symbol = symbol;
			this.arity = arity;
		}

		public String symbol() {
			return symbol;
		}

		public int arity() {
			return arity;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Predicate) {
				Predicate p = (Predicate) o;
				return symbol.equals(p.symbol) && arity == p.arity;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return symbol.hashCode() ^ arity;
		}

		@Override
		public int compareTo(Predicate o) {
			int c = symbol.compareTo(o.symbol);
			return c != 0 ? c : Integer.compare(arity, o.arity);
		}

		@Override
		public String toString() {
			return symbol + "/" + arity;
		}
	}

	// =============================================================================
	// Terms
	// =============================================================================

	public interface Term extends SyntacticElement {

		/**
		 * Get the opcode associated with the syntactic form of this term.
		 *
		 * @return
		 */
		public int getOpcode();

		/**
		 * Get the most precise sort known to contain every value of this term.
		 *
		 * @return
		 */
		public Sort sort();

		/**
		 * An abstract term to be implemented by all other terms.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static abstract class AbstractTerm extends SyntacticElement.Impl implements Term {
			private final int opcode;

			public AbstractTerm(int opcode, Attribute... attributes) {
				super(attributes);
				this.opcode = opcode;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}
		}

		/**
		 * Represents an integer numeral, such as <code>1</code> or
		 * <code>-3</code>.
		 */
		public static class IntegerConstant extends AbstractTerm {
			private final int value;

			public IntegerConstant(int value, Attribute... attributes) {
				super(TERM_integer, attributes);
				this.value = value;
			}

			public int value() {
				return value;
			}

			@Override
			public Sort sort() {
				return Sort.INTEGER;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof IntegerConstant && ((IntegerConstant) o).value == value;
			}

			@Override
			public int hashCode() {
				return value;
			}

			@Override
			public String toString() {
				return Integer.toString(value);
			}
		}

		/**
		 * Represents a symbolic constant, such as <code>a</code>.
		 */
		public static class SymbolicConstant extends AbstractTerm {
			private final String name;

			public SymbolicConstant(String name, Attribute... attributes) {
				super(TERM_symbol, attributes);
				this.name = name;
			}

			public String name() {
				return name;
			}

			@Override
			public Sort sort() {
				return Sort.SYMBOL;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof SymbolicConstant && ((SymbolicConstant) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}

			@Override
			public String toString() {
				return name;
			}
		}

		/**
		 * Represents a sorted variable, such as <code>X</code> (general) or
		 * <code>N$i</code> (integer). Two variables are the same only when both
		 * their names and sorts agree.
		 */
		public static class Variable extends AbstractTerm {
			private final String name;
			private final Sort sort;

			public Variable(String name, Sort sort, Attribute... attributes) {
				super(TERM_variable, attributes);
				this.name = name;
				this.sort = sort;
			}

			public Variable(String name, Attribute... attributes) {
				this(name, Sort.GENERAL, attributes);
			}

			public String name() {
				return name;
			}

			@Override
			public Sort sort() {
				return sort;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Variable) {
					Variable v = (Variable) o;
					return name.equals(v.name) && sort == v.sort;
				}
				return false;
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ sort.hashCode();
			}

			@Override
			public String toString() {
				return name + sort.variableSuffix();
			}
		}

		/**
		 * Represents a placeholder, i.e. a constant whose value is fixed but
		 * unknown (e.g. <code>n$i</code> standing for an arbitrary integer).
		 */
		public static class Placeholder extends AbstractTerm {
			private final String name;
			private final Sort sort;

			public Placeholder(String name, Sort sort, Attribute... attributes) {
				super(TERM_placeholder, attributes);
				this.name = name;
				this.sort = sort;
			}

			public String name() {
				return name;
			}

			@Override
			public Sort sort() {
				return sort;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Placeholder) {
					Placeholder p = (Placeholder) o;
					return name.equals(p.name) && sort == p.sort;
				}
				return false;
			}

			@Override
			public int hashCode() {
				return name.hashCode() ^ sort.hashCode();
			}

			@Override
			public String toString() {
				return name + sort.constantSuffix();
			}
		}

		/**
		 * The least element of the general sort, <code>#inf</code>.
		 */
		public static class Infimum extends AbstractTerm {
			public Infimum(Attribute... attributes) {
				super(TERM_infimum, attributes);
			}

			@Override
			public Sort sort() {
				return Sort.GENERAL;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Infimum;
			}

			@Override
			public int hashCode() {
				return 17;
			}

			@Override
			public String toString() {
				return "#inf";
			}
		}

		/**
		 * The greatest element of the general sort, <code>#sup</code>.
		 */
		public static class Supremum extends AbstractTerm {
			public Supremum(Attribute... attributes) {
				super(TERM_supremum, attributes);
			}

			@Override
			public Sort sort() {
				return Sort.GENERAL;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Supremum;
			}

			@Override
			public int hashCode() {
				return 19;
			}

			@Override
			public String toString() {
				return "#sup";
			}
		}

		public enum Operator {
			ADD("+", 1), SUBTRACT("-", 1), MULTIPLY("*", 2), DIVIDE("/", 2), MODULO("\\", 2);

			private final String symbol;
			private final int precedence;

			private Operator(String symbol, int precedence) {
				this.symbol = symbol;
				this.precedence = precedence;
			}

			public int precedence() {
				return precedence;
			}

			@Override
			public String toString() {
				return symbol;
			}
		}

		/**
		 * Represents an arithmetic operation, such as <code>X + 1</code>.
		 * Division and modulo are partial (undefined on a zero divisor).
		 */
		public static class BinaryOperation extends AbstractTerm {
			private final Operator operator;
			private final Term lhs;
			private final Term rhs;

			public BinaryOperation(Operator operator, Term lhs, Term rhs, Attribute... attributes) {
				super(TERM_binary, attributes);
				this.operator = operator;
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Operator operator() {
				return operator;
			}

			public Term lhs() {
				return lhs;
			}

			public Term rhs() {
				return rhs;
			}

			@Override
			public Sort sort() {
				return Sort.INTEGER;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof BinaryOperation) {
					BinaryOperation b = (BinaryOperation) o;
					return operator == b.operator && lhs.equals(b.lhs) && rhs.equals(b.rhs);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return operator.hashCode() ^ lhs.hashCode() ^ (31 * rhs.hashCode());
			}

			@Override
			public String toString() {
				String l = precedence(lhs) < operator.precedence ? "(" + lhs + ")" : lhs.toString();
				String r = precedence(rhs) <= operator.precedence ? "(" + rhs + ")" : rhs.toString();
				return l + " " + operator + " " + r;
			}
		}

		/**
		 * Represents an interval, such as <code>1..n</code>, which denotes every
		 * integer in the given range (and nothing if the range is empty).
		 */
		public static class Interval extends AbstractTerm {
			private final Term lower;
			private final Term upper;

			public Interval(Term lower, Term upper, Attribute... attributes) {
				super(TERM_interval, attributes);
				this.lower = lower;
				this.upper = upper;
			}

			public Term lower() {
				return lower;
			}

			public Term upper() {
				return upper;
			}

			@Override
			public Sort sort() {
				return Sort.INTEGER;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Interval) {
					Interval i = (Interval) o;
					return lower.equals(i.lower) && upper.equals(i.upper);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return lower.hashCode() ^ (7 * upper.hashCode());
			}

			@Override
			public String toString() {
				String l = lower instanceof Interval ? "(" + lower + ")" : lower.toString();
				String u = upper instanceof Interval ? "(" + upper + ")" : upper.toString();
				return l + ".." + u;
			}
		}
	}

	private static int precedence(Term t) {
		if (t instanceof Term.BinaryOperation) {
			return ((Term.BinaryOperation) t).operator().precedence();
		} else if (t instanceof Term.Interval) {
			return 0;
		} else if (t instanceof Term.IntegerConstant && ((Term.IntegerConstant) t).value() < 0) {
			// e.g. "1 - -2" is fine but "-2 * 3" should not be read as "-(2*3)"
			return 2;
		} else {
			return 3;
		}
	}

	// =============================================================================
	// Relations
	// =============================================================================

	public enum Relation {
		EQUAL("="), NOT_EQUAL("!="), LESS("<"), LESS_EQUAL("<="), GREATER(">"), GREATER_EQUAL(">=");

		private final String symbol;

		private Relation(String symbol) {
			this.symbol = symbol;
		}

		/**
		 * Determine whether this relation holds between a term and itself.
		 *
		 * @return
		 */
		public boolean isReflexive() {
			return this == EQUAL || this == LESS_EQUAL || this == GREATER_EQUAL;
		}

		public static Relation fromSymbol(String symbol) {
			for (Relation r : values()) {
				if (r.symbol.equals(symbol)) {
					return r;
				}
			}
			throw new IllegalArgumentException("unknown relation: " + symbol);
		}

		@Override
		public String toString() {
			return symbol;
		}
	}

	// =============================================================================
	// Formulas
	// =============================================================================

	public interface Formula extends SyntacticElement {

		/**
		 * Get the opcode associated with the syntactic form of this formula.
		 *
		 * @return
		 */
		public int getOpcode();

		public static abstract class AbstractFormula extends SyntacticElement.Impl implements Formula {
			private final int opcode;

			public AbstractFormula(int opcode, Attribute... attributes) {
				super(attributes);
				this.opcode = opcode;
			}

			@Override
			public int getOpcode() {
				return opcode;
			}
		}

		/**
		 * The formula <code>#true</code>.
		 */
		public static class Truth extends AbstractFormula {
			public Truth(Attribute... attributes) {
				super(FORMULA_truth, attributes);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Truth;
			}

			@Override
			public int hashCode() {
				return 1;
			}

			@Override
			public String toString() {
				return "#true";
			}
		}

		/**
		 * The formula <code>#false</code>.
		 */
		public static class Falsity extends AbstractFormula {
			public Falsity(Attribute... attributes) {
				super(FORMULA_falsity, attributes);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Falsity;
			}

			@Override
			public int hashCode() {
				return 0;
			}

			@Override
			public String toString() {
				return "#false";
			}
		}

		/**
		 * Represents an atom such as <code>p(X, 1)</code>.
		 */
		public static class Atom extends AbstractFormula {
			private final String symbol;
			private final ImmutableList<Term> terms;

			public Atom(String symbol, List<? extends Term> terms, Attribute... attributes) {
				super(FORMULA_atom, attributes);
				this.symbol = symbol;
				this.terms = ImmutableList.copyOf(terms);
			}

			public Atom(String symbol, Term... terms) {
				this(symbol, ImmutableList.copyOf(terms));
			}

			public String symbol() {
				return symbol;
			}

			public ImmutableList<Term> terms() {
				return terms;
			}

			public Predicate predicate() {
				return new Predicate(symbol, terms.size());
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Atom) {
					Atom a = (Atom) o;
					return symbol.equals(a.symbol) && terms.equals(a.terms);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return symbol.hashCode() ^ terms.hashCode();
			}

			@Override
			public String toString() {
				if (terms.isEmpty()) {
					return symbol;
				}
				return symbol + "(" + join(terms, ", ") + ")";
			}
		}

		/**
		 * A single link <code>rel t</code> in a comparison chain.
		 */
		public static final class Guard {
			private final Relation relation;
			private final Term term;

			public Guard(Relation relation, Term term) {
				this.relation = relation;
				this.term = term;
			}

			public Relation relation() {
				return relation;
			}

			public Term term() {
				return term;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Guard) {
					Guard g = (Guard) o;
					return relation == g.relation && term.equals(g.term);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return relation.hashCode() ^ term.hashCode();
			}

			@Override
			public String toString() {
				return relation + " " + term;
			}
		}

		/**
		 * Represents a chain of comparisons, such as <code>3 &lt; I &lt; 5</code>,
		 * which holds when each adjacent pair of terms is related as given.
		 */
		public static class Comparison extends AbstractFormula {
			private final Term term;
			private final ImmutableList<Guard> guards;

			public Comparison(Term term, List<Guard> guards, Attribute... attributes) {
				super(FORMULA_comparison, attributes);
				if (guards.isEmpty()) {
					throw new IllegalArgumentException("comparison requires at least one guard");
				}
				this.term = term;
				this.guards = ImmutableList.copyOf(guards);
			}

			public Comparison(Term lhs, Relation relation, Term rhs, Attribute... attributes) {
				this(lhs, ImmutableList.of(new Guard(relation, rhs)), attributes);
			}

			public Term term() {
				return term;
			}

			public ImmutableList<Guard> guards() {
				return guards;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Comparison) {
					Comparison c = (Comparison) o;
					return term.equals(c.term) && guards.equals(c.guards);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return term.hashCode() ^ guards.hashCode();
			}

			@Override
			public String toString() {
				return term + " " + join(guards, " ");
			}
		}

		/**
		 * Represents <code>not F</code>.
		 */
		public static class Negation extends AbstractFormula {
			private final Formula operand;

			public Negation(Formula operand, Attribute... attributes) {
				super(FORMULA_negation, attributes);
				this.operand = operand;
			}

			public Formula operand() {
				return operand;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Negation && ((Negation) o).operand.equals(operand);
			}

			@Override
			public int hashCode() {
				return 37 * operand.hashCode();
			}

			@Override
			public String toString() {
				String s = operand.toString();
				return "not " + (isConnective(operand) ? "(" + s + ")" : s);
			}
		}

		/**
		 * Common base for conjunctions and disjunctions of zero or more
		 * operands.
		 */
		public static abstract class Nary extends AbstractFormula {
			private final ImmutableList<Formula> operands;

			public Nary(int opcode, List<? extends Formula> operands, Attribute... attributes) {
				super(opcode, attributes);
				this.operands = ImmutableList.copyOf(operands);
			}

			public ImmutableList<Formula> operands() {
				return operands;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Nary) {
					Nary n = (Nary) o;
					return getOpcode() == n.getOpcode() && operands.equals(n.operands);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return getOpcode() ^ operands.hashCode();
			}

			protected String toString(String connective) {
				StringBuilder r = new StringBuilder();
				for (int i = 0; i != operands.size(); ++i) {
					if (i != 0) {
						r.append(" ").append(connective).append(" ");
					}
					Formula f = operands.get(i);
					boolean braces = isConnective(f) && !(this instanceof Disjunction && f instanceof Conjunction);
					r.append(braces ? "(" + f + ")" : f.toString());
				}
				return r.toString();
			}
		}

		public static class Conjunction extends Nary {
			public Conjunction(List<? extends Formula> operands, Attribute... attributes) {
				super(FORMULA_conjunction, operands, attributes);
			}

			public Conjunction(Formula... operands) {
				this(ImmutableList.copyOf(operands));
			}

			@Override
			public String toString() {
				return toString("and");
			}
		}

		public static class Disjunction extends Nary {
			public Disjunction(List<? extends Formula> operands, Attribute... attributes) {
				super(FORMULA_disjunction, operands, attributes);
			}

			public Disjunction(Formula... operands) {
				this(ImmutableList.copyOf(operands));
			}

			@Override
			public String toString() {
				return toString("or");
			}
		}

		/**
		 * Common base for implications and equivalences.
		 */
		public static abstract class Binary extends AbstractFormula {
			private final Formula lhs;
			private final Formula rhs;

			public Binary(int opcode, Formula lhs, Formula rhs, Attribute... attributes) {
				super(opcode, attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Formula lhs() {
				return lhs;
			}

			public Formula rhs() {
				return rhs;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Binary) {
					Binary b = (Binary) o;
					return getOpcode() == b.getOpcode() && lhs.equals(b.lhs) && rhs.equals(b.rhs);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return getOpcode() ^ lhs.hashCode() ^ (13 * rhs.hashCode());
			}

			protected String toString(String connective) {
				String l = lhs instanceof Binary ? "(" + lhs + ")" : lhs.toString();
				String r = rhs instanceof Binary ? "(" + rhs + ")" : rhs.toString();
				return l + " " + connective + " " + r;
			}
		}

		public static class Implication extends Binary {
			public Implication(Formula lhs, Formula rhs, Attribute... attributes) {
				super(FORMULA_implication, lhs, rhs, attributes);
			}

			@Override
			public String toString() {
				return toString("->");
			}
		}

		public static class Equivalence extends Binary {
			public Equivalence(Formula lhs, Formula rhs, Attribute... attributes) {
				super(FORMULA_equivalence, lhs, rhs, attributes);
			}

			@Override
			public String toString() {
				return toString("<->");
			}
		}

		/**
		 * Common base for universal and existential quantification over one or
		 * more variables.
		 */
		public static abstract class Quantifier extends AbstractFormula {
			private final ImmutableList<Term.Variable> variables;
			private final Formula body;

			public Quantifier(int opcode, List<Term.Variable> variables, Formula body, Attribute... attributes) {
				super(opcode, attributes);
				this.variables = ImmutableList.copyOf(variables);
				this.body = body;
			}

			public ImmutableList<Term.Variable> variables() {
				return variables;
			}

			public Formula body() {
				return body;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Quantifier) {
					Quantifier q = (Quantifier) o;
					return getOpcode() == q.getOpcode() && variables.equals(q.variables) && body.equals(q.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return getOpcode() ^ variables.hashCode() ^ (3 * body.hashCode());
			}

			protected String toString(String quantifier) {
				String b = body.toString();
				return quantifier + " " + join(variables, " ") + " " + (isConnective(body) ? "(" + b + ")" : b);
			}
		}

		public static class Universal extends Quantifier {
			public Universal(List<Term.Variable> variables, Formula body, Attribute... attributes) {
				super(FORMULA_universal, variables, body, attributes);
			}

			@Override
			public String toString() {
				return toString("forall");
			}
		}

		public static class Existential extends Quantifier {
			public Existential(List<Term.Variable> variables, Formula body, Attribute... attributes) {
				super(FORMULA_existential, variables, body, attributes);
			}

			@Override
			public String toString() {
				return toString("exists");
			}
		}
	}

	public static final Formula.Truth TRUE = new Formula.Truth();
	public static final Formula.Falsity FALSE = new Formula.Falsity();

	private static boolean isConnective(Formula f) {
		return f instanceof Formula.Nary || f instanceof Formula.Binary;
	}

	private static String join(Collection<?> items, String separator) {
		StringBuilder r = new StringBuilder();
		for (Object item : items) {
			if (r.length() > 0) {
				r.append(separator);
			}
			r.append(item);
		}
		return r.toString();
	}

	// =============================================================================
	// Constructors
	// =============================================================================

	/**
	 * Construct the conjunction of zero or more formulas, avoiding trivial
	 * conjunctions where possible.
	 *
	 * @param operands
	 * @return
	 */
	public static Formula conjunction(List<? extends Formula> operands) {
		switch (operands.size()) {
		case 0:
			return TRUE;
		case 1:
			return operands.get(0);
		default:
			return new Formula.Conjunction(operands);
		}
	}

	public static Formula conjunction(Formula... operands) {
		return conjunction(ImmutableList.copyOf(operands));
	}

	/**
	 * Construct the disjunction of zero or more formulas, avoiding trivial
	 * disjunctions where possible.
	 *
	 * @param operands
	 * @return
	 */
	public static Formula disjunction(List<? extends Formula> operands) {
		switch (operands.size()) {
		case 0:
			return FALSE;
		case 1:
			return operands.get(0);
		default:
			return new Formula.Disjunction(operands);
		}
	}

	public static Formula forall(Collection<Term.Variable> variables, Formula body) {
		return variables.isEmpty() ? body : new Formula.Universal(ImmutableList.copyOf(variables), body);
	}

	public static Formula exists(Collection<Term.Variable> variables, Formula body) {
		return variables.isEmpty() ? body : new Formula.Existential(ImmutableList.copyOf(variables), body);
	}

	/**
	 * Construct a negation applied the given number of times.
	 *
	 * @param depth
	 * @param f
	 * @return
	 */
	public static Formula negate(int depth, Formula f) {
		for (int i = 0; i < depth; ++i) {
			f = new Formula.Negation(f);
		}
		return f;
	}

	// =============================================================================
	// Queries
	// =============================================================================

	/**
	 * Determine the set of variables occurring in a given term.
	 *
	 * @param term
	 * @return
	 */
	public static Set<Term.Variable> variables(Term term) {
		LinkedHashSet<Term.Variable> result = new LinkedHashSet<>();
		variables(term, result);
		return result;
	}

	private static void variables(Term term, Set<Term.Variable> result) {
		switch (term.getOpcode()) {
		case TERM_variable:
			result.add((Term.Variable) term);
			break;
		case TERM_binary: {
			Term.BinaryOperation b = (Term.BinaryOperation) term;
			variables(b.lhs(), result);
			variables(b.rhs(), result);
			break;
		}
		case TERM_interval: {
			Term.Interval i = (Term.Interval) term;
			variables(i.lower(), result);
			variables(i.upper(), result);
			break;
		}
		default:
			// constants have no variables
		}
	}

	/**
	 * Determine the set of free variables of a given formula, in order of first
	 * occurrence.
	 *
	 * @param formula
	 * @return
	 */
	public static Set<Term.Variable> freeVariables(Formula formula) {
		LinkedHashSet<Term.Variable> result = new LinkedHashSet<>();
		freeVariables(formula, result);
		return result;
	}

	private static void freeVariables(Formula formula, Set<Term.Variable> result) {
		switch (formula.getOpcode()) {
		case FORMULA_truth:
		case FORMULA_falsity:
			break;
		case FORMULA_atom:
			for (Term t : ((Formula.Atom) formula).terms()) {
				variables(t, result);
			}
			break;
		case FORMULA_comparison: {
			Formula.Comparison c = (Formula.Comparison) formula;
			variables(c.term(), result);
			for (Formula.Guard g : c.guards()) {
				variables(g.term(), result);
			}
			break;
		}
		case FORMULA_negation:
			freeVariables(((Formula.Negation) formula).operand(), result);
			break;
		case FORMULA_conjunction:
		case FORMULA_disjunction:
			for (Formula f : ((Formula.Nary) formula).operands()) {
				freeVariables(f, result);
			}
			break;
		case FORMULA_implication:
		case FORMULA_equivalence: {
			Formula.Binary b = (Formula.Binary) formula;
			freeVariables(b.lhs(), result);
			freeVariables(b.rhs(), result);
			break;
		}
		case FORMULA_universal:
		case FORMULA_existential: {
			Formula.Quantifier q = (Formula.Quantifier) formula;
			Set<Term.Variable> body = freeVariables(q.body());
			body.removeAll(q.variables());
			result.addAll(body);
			break;
		}
		default:
			throw new IllegalArgumentException("Invalid formula encountered: " + formula);
		}
	}

	/**
	 * Determine every variable name occurring anywhere in a formula, whether
	 * free or bound.
	 *
	 * @param formula
	 * @return
	 */
	public static Set<String> variableNames(Formula formula) {
		LinkedHashSet<String> result = new LinkedHashSet<>();
		for (Term t : terms(formula)) {
			for (Term.Variable v : variables(t)) {
				result.add(v.name());
			}
		}
		collectBinders(formula, result);
		return result;
	}

	private static void collectBinders(Formula formula, Set<String> result) {
		if (formula instanceof Formula.Quantifier) {
			Formula.Quantifier q = (Formula.Quantifier) formula;
			for (Term.Variable v : q.variables()) {
				result.add(v.name());
			}
			collectBinders(q.body(), result);
		} else if (formula instanceof Formula.Negation) {
			collectBinders(((Formula.Negation) formula).operand(), result);
		} else if (formula instanceof Formula.Nary) {
			for (Formula f : ((Formula.Nary) formula).operands()) {
				collectBinders(f, result);
			}
		} else if (formula instanceof Formula.Binary) {
			collectBinders(((Formula.Binary) formula).lhs(), result);
			collectBinders(((Formula.Binary) formula).rhs(), result);
		}
	}

	/**
	 * Determine every (top-level) term occurring in a formula.
	 *
	 * @param formula
	 * @return
	 */
	public static List<Term> terms(Formula formula) {
		ArrayList<Term> result = new ArrayList<>();
		terms(formula, result);
		return result;
	}

	private static void terms(Formula formula, List<Term> result) {
		switch (formula.getOpcode()) {
		case FORMULA_atom:
			result.addAll(((Formula.Atom) formula).terms());
			break;
		case FORMULA_comparison: {
			Formula.Comparison c = (Formula.Comparison) formula;
			result.add(c.term());
			for (Formula.Guard g : c.guards()) {
				result.add(g.term());
			}
			break;
		}
		case FORMULA_negation:
			terms(((Formula.Negation) formula).operand(), result);
			break;
		case FORMULA_conjunction:
		case FORMULA_disjunction:
			for (Formula f : ((Formula.Nary) formula).operands()) {
				terms(f, result);
			}
			break;
		case FORMULA_implication:
		case FORMULA_equivalence:
			terms(((Formula.Binary) formula).lhs(), result);
			terms(((Formula.Binary) formula).rhs(), result);
			break;
		case FORMULA_universal:
		case FORMULA_existential:
			terms(((Formula.Quantifier) formula).body(), result);
			break;
		default:
			// truth constants contain no terms
		}
	}

	/**
	 * Determine every atom occurring in a formula, in order of occurrence.
	 *
	 * @param formula
	 * @return
	 */
	public static List<Formula.Atom> atoms(Formula formula) {
		ArrayList<Formula.Atom> result = new ArrayList<>();
		atoms(formula, result);
		return result;
	}

	private static void atoms(Formula formula, List<Formula.Atom> result) {
		if (formula instanceof Formula.Atom) {
			result.add((Formula.Atom) formula);
		} else if (formula instanceof Formula.Negation) {
			atoms(((Formula.Negation) formula).operand(), result);
		} else if (formula instanceof Formula.Nary) {
			for (Formula f : ((Formula.Nary) formula).operands()) {
				atoms(f, result);
			}
		} else if (formula instanceof Formula.Binary) {
			atoms(((Formula.Binary) formula).lhs(), result);
			atoms(((Formula.Binary) formula).rhs(), result);
		} else if (formula instanceof Formula.Quantifier) {
			atoms(((Formula.Quantifier) formula).body(), result);
		}
	}

	/**
	 * Determine the set of predicates used in a formula.
	 *
	 * @param formula
	 * @return
	 */
	public static Set<Predicate> predicates(Formula formula) {
		LinkedHashSet<Predicate> result = new LinkedHashSet<>();
		for (Formula.Atom a : atoms(formula)) {
			result.add(a.predicate());
		}
		return result;
	}

	/**
	 * Determine every constant (symbolic constant or placeholder) appearing
	 * within a term, recursively.
	 *
	 * @param term
	 * @param result
	 */
	public static void constants(Term term, Set<Term> result) {
		switch (term.getOpcode()) {
		case TERM_symbol:
		case TERM_placeholder:
			result.add(term);
			break;
		case TERM_binary:
			constants(((Term.BinaryOperation) term).lhs(), result);
			constants(((Term.BinaryOperation) term).rhs(), result);
			break;
		case TERM_interval:
			constants(((Term.Interval) term).lower(), result);
			constants(((Term.Interval) term).upper(), result);
			break;
		default:
		}
	}

	/**
	 * Count the nodes of a formula (including its terms). This is the measure
	 * which every simplification strictly decreases.
	 *
	 * @param formula
	 * @return
	 */
	public static int size(Formula formula) {
		switch (formula.getOpcode()) {
		case FORMULA_truth:
		case FORMULA_falsity:
			return 1;
		case FORMULA_negation:
			return 1 + size(((Formula.Negation) formula).operand());
		case FORMULA_conjunction:
		case FORMULA_disjunction: {
			int r = 1;
			for (Formula f : ((Formula.Nary) formula).operands()) {
				r += size(f);
			}
			return r;
		}
		case FORMULA_implication:
		case FORMULA_equivalence:
			return 1 + size(((Formula.Binary) formula).lhs()) + size(((Formula.Binary) formula).rhs());
		case FORMULA_universal:
		case FORMULA_existential: {
			Formula.Quantifier q = (Formula.Quantifier) formula;
			return 1 + q.variables().size() + size(q.body());
		}
		default: {
			int r = 1;
			for (Term t : terms(formula)) {
				r += size(t);
			}
			return r;
		}
		}
	}

	public static int size(Term term) {
		switch (term.getOpcode()) {
		case TERM_binary:
			return 1 + size(((Term.BinaryOperation) term).lhs()) + size(((Term.BinaryOperation) term).rhs());
		case TERM_interval:
			return 1 + size(((Term.Interval) term).lower()) + size(((Term.Interval) term).upper());
		default:
			return 1;
		}
	}

	/**
	 * Choose a variable name based on a given stem which is not already taken.
	 * The stem itself is preferred, followed by <code>stem1</code>,
	 * <code>stem2</code> and so on.
	 *
	 * @param stem
	 * @param taken
	 * @return
	 */
	public static String fresh(String stem, Set<String> taken) {
		if (!taken.contains(stem)) {
			return stem;
		}
		for (int i = 1;; ++i) {
			String name = stem + i;
			if (!taken.contains(name)) {
				return name;
			}
		}
	}

	/**
	 * Check that no variable name is used at two different sorts within the
	 * same scope of a formula.
	 *
	 * @param formula
	 * @throws ValidationError
	 *             if the check fails
	 */
	public static void checkSorts(Formula formula) {
		checkSorts(formula, new HashMap<>(), new HashMap<>(), formula);
	}

	private static void checkSorts(Formula formula, Map<String, Sort> bound, Map<String, Sort> free, Formula root) {
		if (formula instanceof Formula.Quantifier) {
			Formula.Quantifier q = (Formula.Quantifier) formula;
			HashMap<String, Sort> inner = new HashMap<>(bound);
			for (Term.Variable v : q.variables()) {
				inner.put(v.name(), v.sort());
			}
			checkSorts(q.body(), inner, free, root);
		} else if (formula instanceof Formula.Negation) {
			checkSorts(((Formula.Negation) formula).operand(), bound, free, root);
		} else if (formula instanceof Formula.Nary) {
			for (Formula f : ((Formula.Nary) formula).operands()) {
				checkSorts(f, bound, free, root);
			}
		} else if (formula instanceof Formula.Binary) {
			checkSorts(((Formula.Binary) formula).lhs(), bound, free, root);
			checkSorts(((Formula.Binary) formula).rhs(), bound, free, root);
		} else {
			for (Term t : terms(formula)) {
				for (Term.Variable v : variables(t)) {
					Map<String, Sort> scope = bound.containsKey(v.name()) ? bound : free;
					Sort s = scope.get(v.name());
					if (s == null) {
						scope.put(v.name(), v.sort());
					} else if (s != v.sort()) {
						throw sortMismatch(v, s, root);
					}
				}
			}
		}
	}

	private static ValidationError sortMismatch(Term.Variable v, Sort expected, Formula root) {
		return new ValidationError(ValidationError.Kind.SORT_MISMATCH,
				"variable " + v.name() + " used as " + v.sort() + " and " + expected, root);
	}

	/**
	 * Check whether a given term may be duplicated or removed freely, i.e. it
	 * denotes exactly one value and contains no partial operations.
	 *
	 * @param term
	 * @return
	 */
	public static boolean isTotal(Term term) {
		switch (term.getOpcode()) {
		case TERM_interval:
			return false;
		case TERM_binary: {
			Term.BinaryOperation b = (Term.BinaryOperation) term;
			if (b.operator() == Term.Operator.DIVIDE || b.operator() == Term.Operator.MODULO) {
				return false;
			}
			return isTotal(b.lhs()) && isTotal(b.rhs()) && isArithmetic(b.lhs()) && isArithmetic(b.rhs());
		}
		default:
			return true;
		}
	}

	/**
	 * Check whether a term can only ever denote an integer.
	 *
	 * @param term
	 * @return
	 */
	public static boolean isArithmetic(Term term) {
		return term.sort() == Sort.INTEGER;
	}
}
