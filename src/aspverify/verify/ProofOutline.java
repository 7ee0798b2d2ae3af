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
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import aspverify.core.Specification;
import aspverify.core.Specification.AnnotatedFormula;
import aspverify.core.Specification.Direction;
import aspverify.core.Specification.Role;
import aspverify.core.Syntax;
import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Term.Operator;
import aspverify.core.Syntax.Predicate;
import aspverify.core.Syntax.Relation;
import aspverify.core.Syntax.Sort;
import aspverify.core.Syntax.Term;
import aspverify.translate.Substitution;
import aspverify.util.ValidationError;

/**
 * A sequence of helper steps used to guide the prover towards the final
 * conjectures. Each step is one of:
 *
 * <ul>
 * <li><b>Definition</b> <code>forall V (p(V) &lt;-&gt; F)</code>, introducing a
 * fresh predicate <code>p</code> defined only in terms of predicates which are
 * already known. Definitions are conservative extensions, and are admitted as
 * axioms without proof.</li>
 * <li><b>Lemma</b> <code>F</code>, which must be proved before it can be used.</li>
 * <li><b>Inductive lemma</b> <code>forall X N (N &gt;= n -&gt; F)</code>, which
 * is proved by a base case <code>F[n/N]</code> and an inductive step
 * <code>(N &gt;= n and F) -&gt; F[N+1/N]</code>.</li>
 * </ul>
 *
 * Once a step is proved it becomes available as an axiom for all subsequent
 * steps. An outline is checked for well-formedness when constructed.
 *
 * @author David J. Pearce
 *
 */
public class ProofOutline {
	public static final String BASE_CASE = "_base_case";
	public static final String INDUCTIVE_STEP = "_inductive_step";

	/**
	 * A single step of a proof outline.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Step {
		private final AnnotatedFormula source;
		private final ImmutableList<AnnotatedFormula> obligations;

		private Step(AnnotatedFormula source, List<AnnotatedFormula> obligations) {
			this.source = source;
			this.obligations = ImmutableList.copyOf(obligations);
		}

		public Role role() {
			return source.role();
		}

		public String name() {
			return source.name();
		}

		public Direction direction() {
			return source.direction();
		}

		/**
		 * The formula which becomes an axiom once this step is established.
		 *
		 * @return
		 */
		public Formula formula() {
			return source.formula();
		}

		/**
		 * The formulas which must be proved to establish this step. This is
		 * empty for a definition.
		 *
		 * @return
		 */
		public ImmutableList<AnnotatedFormula> obligations() {
			return obligations;
		}

		@Override
		public String toString() {
			return source.toString();
		}
	}

	private final ImmutableList<Step> steps;

	/**
	 * Construct a proof outline.
	 *
	 * @param outline
	 *            The outline's annotated formulas, in order.
	 * @param base
	 *            The predicates of the programs and specifications being
	 *            compared, which definitions may use but not redefine.
	 * @throws ValidationError
	 *             if the outline is malformed.
	 */
	public ProofOutline(Specification outline, Set<Predicate> base) {
		ArrayList<Step> steps = new ArrayList<>();
		LinkedHashSet<Predicate> known = new LinkedHashSet<>(base);
		int index = 0;
		for (AnnotatedFormula f : outline.formulas()) {
			index = index + 1;
			if (f.name().equals(Specification.UNNAMED)) {
				f = f.withName(f.role() == Role.DEFINITION ? "definition_" + index : "lemma_" + index);
			}
			switch (f.role()) {
			case DEFINITION:
				known.add(checkDefinition(f, known));
				steps.add(new Step(f, ImmutableList.of()));
				break;
			case LEMMA:
				steps.add(new Step(f, ImmutableList.of(f)));
				break;
			case INDUCTIVE_LEMMA:
				steps.add(new Step(f, induction(f)));
				break;
			default:
				throw malformed(f.role() + " is not permitted in a proof outline", f);
			}
		}
		this.steps = ImmutableList.copyOf(steps);
	}

	public static ProofOutline empty() {
		return new ProofOutline(new Specification(ImmutableList.of()), ImmutableSet.of());
	}

	public ImmutableList<Step> steps() {
		return steps;
	}

	/**
	 * Get the steps which apply to a given direction, in order.
	 *
	 * @param direction
	 * @return
	 */
	public List<Step> steps(Direction direction) {
		ArrayList<Step> result = new ArrayList<>();
		for (Step s : steps) {
			if (s.direction().includes(direction)) {
				result.add(s);
			}
		}
		return result;
	}

	/**
	 * Check a definition <code>forall V (p(V) &lt;-&gt; F)</code>, returning the
	 * predicate being defined.
	 */
	private static Predicate checkDefinition(AnnotatedFormula definition, Set<Predicate> known) {
		ArrayList<Term.Variable> variables = new ArrayList<>();
		Formula body = definition.formula();
		while (body instanceof Formula.Universal) {
			variables.addAll(((Formula.Universal) body).variables());
			body = ((Formula.Universal) body).body();
		}
		if (!(body instanceof Formula.Equivalence) || !(((Formula.Equivalence) body).lhs() instanceof Formula.Atom)) {
			throw malformed("definition must have the form forall V (p(V) <-> F)", definition);
		}
		Formula.Atom head = (Formula.Atom) ((Formula.Equivalence) body).lhs();
		Formula rhs = ((Formula.Equivalence) body).rhs();
		HashSet<Term> arguments = new HashSet<>();
		for (Term t : head.terms()) {
			if (!variables.contains(t) || !arguments.add(t)) {
				throw malformed("arguments of " + head.predicate() + " must be distinct quantified variables",
						definition);
			}
		}
		if (arguments.size() != variables.size()) {
			throw malformed("every quantified variable must be an argument of " + head.predicate(), definition);
		}
		if (known.contains(head.predicate())) {
			throw malformed("predicate " + head.predicate() + " is already defined", definition);
		}
		if (!arguments.containsAll(Syntax.freeVariables(rhs))) {
			throw malformed("definition of " + head.predicate() + " has free variables", definition);
		}
		if (!Syntax.freeVariables(rhs).containsAll(arguments)) {
			throw malformed("every argument of " + head.predicate() + " must occur in its definition", definition);
		}
		for (Predicate p : Syntax.predicates(rhs)) {
			if (!known.contains(p)) {
				throw malformed("definition of " + head.predicate() + " uses undefined predicate " + p, definition);
			}
		}
		return head.predicate();
	}

	/**
	 * Split an inductive lemma <code>forall X N (N &gt;= n -&gt; F)</code> into
	 * its base case and inductive step.
	 */
	private static List<AnnotatedFormula> induction(AnnotatedFormula lemma) {
		ArrayList<Term.Variable> variables = new ArrayList<>();
		Formula body = lemma.formula();
		while (body instanceof Formula.Universal) {
			variables.addAll(((Formula.Universal) body).variables());
			body = ((Formula.Universal) body).body();
		}
		if (!(body instanceof Formula.Implication)) {
			throw malformed("inductive lemma must have the form forall X N (N >= n -> F)", lemma);
		}
		Formula.Implication implication = (Formula.Implication) body;
		Term.Variable n = inductionVariable(implication.lhs(), variables);
		if (n == null) {
			throw malformed("inductive lemma must have the form forall X N (N >= n -> F)", lemma);
		}
		Term start = ((Formula.Comparison) implication.lhs()).guards().get(0).term();
		Formula f = implication.rhs();
		ArrayList<Term.Variable> rest = new ArrayList<>(variables);
		rest.remove(n);
		Formula base = Syntax.forall(rest, Substitution.apply(f, n, start));
		Term successor = new Term.BinaryOperation(Operator.ADD, n, new Term.IntegerConstant(1));
		Formula step = Syntax.forall(variables, new Formula.Implication(
				new Formula.Conjunction(implication.lhs(), f), Substitution.apply(f, n, successor)));
		return ImmutableList.of(lemma.withFormula(base).withName(lemma.name() + BASE_CASE),
				lemma.withFormula(step).withName(lemma.name() + INDUCTIVE_STEP));
	}

	/**
	 * Check whether a formula has the form <code>N &gt;= n</code>, where
	 * <code>N</code> is an integer variable from the given list and
	 * <code>n</code> an integer term not involving any of them.
	 */
	private static Term.Variable inductionVariable(Formula f, List<Term.Variable> variables) {
		if (!(f instanceof Formula.Comparison)) {
			return null;
		}
		Formula.Comparison c = (Formula.Comparison) f;
		if (c.guards().size() != 1 || c.guards().get(0).relation() != Relation.GREATER_EQUAL
				|| !(c.term() instanceof Term.Variable)) {
			return null;
		}
		Term.Variable n = (Term.Variable) c.term();
		Term start = c.guards().get(0).term();
		if (n.sort() != Sort.INTEGER || !variables.contains(n) || start.sort() != Sort.INTEGER) {
			return null;
		}
		for (Term.Variable v : Syntax.variables(start)) {
			if (variables.contains(v)) {
				return null;
			}
		}
		return n;
	}

	private static ValidationError malformed(String message, AnnotatedFormula f) {
		return new ValidationError(ValidationError.Kind.MALFORMED_PROOF_OUTLINE, message, f);
	}
}
