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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import aspverify.analysis.DependencyGraph;
import aspverify.core.Syntax;
import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Predicate;
import aspverify.core.Syntax.Relation;
import aspverify.core.Syntax.Term;
import aspverify.util.AbstractRewriter;
import aspverify.util.ValidationError;

/**
 * Computes the (Clark) completion of a tight theory of rules. Each rule must
 * have the form <code>forall X (B -&gt; p(t))</code>, and all rules defining
 * <code>p</code> are combined into a single definition:
 *
 * <pre>
 * forall V (p(V) &lt;-&gt; exists U1 (V = t1 and B1) or ... or exists Uk (V = tk and Bk))
 * </pre>
 *
 * Where all rules for <code>p</code> share the same head made of distinct
 * variables (as produced by tau-star), those variables are used directly and
 * the equalities are omitted. Constraints <code>forall X not B</code> are
 * retained unchanged.
 *
 * @author David J. Pearce
 *
 */
public class Completion {
	private final List<Formula> theory;
	private final Set<Predicate> intensional;
	private boolean checkTightness = true;

	/**
	 * Construct a completion where every head predicate is intensional.
	 *
	 * @param theory
	 */
	public Completion(List<Formula> theory) {
		this(theory, null);
	}

	/**
	 * Construct a completion for a given set of intensional predicates. An
	 * intensional predicate without rules is completed as false everywhere.
	 *
	 * @param theory
	 * @param intensional
	 *            The intensional predicates, or null to use the head predicates.
	 */
	public Completion(List<Formula> theory, Set<Predicate> intensional) {
		this.theory = ImmutableList.copyOf(theory);
		this.intensional = intensional;
	}

	public static List<Formula> apply(List<Formula> theory) {
		return new Completion(theory).complete();
	}

	/**
	 * Configure whether the theory is checked for positive cycles before being
	 * completed. Completing a theory which is not tight is sound, but the
	 * result may admit models which are not stable.
	 *
	 * @param flag
	 * @return
	 */
	public Completion setCheckTightness(boolean flag) {
		this.checkTightness = flag;
		return this;
	}

	/**
	 * Compute the completion.
	 *
	 * @return
	 * @throws ValidationError
	 *             If the theory is not tight, or contains a formula which is
	 *             neither a rule nor a constraint.
	 */
	public List<Formula> complete() {
		ArrayList<Formula> constraints = new ArrayList<>();
		Map<Predicate, List<Definition>> definitions = group(constraints, checkTightness);
		ArrayList<Formula> result = new ArrayList<>();
		for (Map.Entry<Predicate, List<Definition>> e : definitions.entrySet()) {
			if (isIntensional(e.getKey())) {
				result.add(complete(e.getKey(), e.getValue()));
			} else {
				// extensional predicates keep their rules
				for (Definition d : e.getValue()) {
					result.add(d.original);
				}
			}
		}
		if (intensional != null) {
			for (Predicate p : intensional) {
				if (!definitions.containsKey(p)) {
					result.add(complete(p, ImmutableList.of()));
				}
			}
		}
		result.addAll(constraints);
		return result;
	}

	/**
	 * Compute the completed definition of every intensional predicate, without
	 * the constraints or the rules of extensional predicates.
	 *
	 * @return
	 */
	public Map<Predicate, Formula> definitions() {
		Map<Predicate, List<Definition>> definitions = group(new ArrayList<>(), checkTightness);
		LinkedHashMap<Predicate, Formula> result = new LinkedHashMap<>();
		for (Map.Entry<Predicate, List<Definition>> e : definitions.entrySet()) {
			if (isIntensional(e.getKey())) {
				result.put(e.getKey(), complete(e.getKey(), e.getValue()));
			}
		}
		if (intensional != null) {
			for (Predicate p : intensional) {
				if (!definitions.containsKey(p)) {
					result.put(p, complete(p, ImmutableList.of()));
				}
			}
		}
		return result;
	}

	/**
	 * Compute the ordered completion, which also applies to theories which are
	 * not tight. For each head predicate <code>p</code>, the rules become
	 *
	 * <pre>
	 * forall V (B1 or ... or Bk -&gt; p(V))
	 * forall V (p(V) -&gt; B1' or ... or Bk')
	 * </pre>
	 *
	 * where <code>Bi'</code> conjoins each positive atom <code>q(Z)</code> of
	 * <code>Bi</code> with the order atom <code>less_q_p(Z, V)</code>. The
	 * constraints come first, followed by the rules then the ordered
	 * definitions.
	 *
	 * @return
	 * @throws ValidationError
	 *             If the rules for some predicate do not share a common head.
	 */
	public List<Formula> completeOrdered() {
		ArrayList<Formula> result = new ArrayList<>();
		Map<Predicate, List<Definition>> definitions = group(result, false);
		ArrayList<Formula> ordered = new ArrayList<>();
		for (Map.Entry<Predicate, List<Definition>> e : definitions.entrySet()) {
			List<Term.Variable> head = commonHead(e.getValue());
			if (head == null) {
				throw new ValidationError(ValidationError.Kind.NOT_COMPLETABLE,
						"rules for " + e.getKey() + " do not share a common head", e.getValue().get(0).original);
			}
			Formula.Atom atom = new Formula.Atom(e.getKey().symbol(), head);
			List<Formula> bodies = bodies(head, e.getValue());
			OrderAtoms order = new OrderAtoms(atom);
			ArrayList<Formula> orderedBodies = new ArrayList<>();
			for (Formula b : bodies) {
				orderedBodies.add(order.apply(b));
			}
			result.add(Syntax.forall(head, new Formula.Implication(Syntax.disjunction(bodies), atom)));
			ordered.add(Syntax.forall(head, new Formula.Implication(atom, Syntax.disjunction(orderedBodies))));
		}
		result.addAll(ordered);
		return result;
	}

	private boolean isIntensional(Predicate p) {
		return intensional == null || intensional.contains(p);
	}

	/**
	 * Group the rules of the theory by head predicate, in order of first
	 * appearance, whilst collecting the constraints. Optionally, check the
	 * theory is tight.
	 */
	private Map<Predicate, List<Definition>> group(List<Formula> constraints, boolean tight) {
		LinkedHashMap<Predicate, List<Definition>> definitions = new LinkedHashMap<>();
		for (Formula f : theory) {
			Definition d = Definition.of(f);
			if (d != null) {
				definitions.computeIfAbsent(d.head.predicate(), k -> new ArrayList<>()).add(d);
			} else if (isConstraint(f)) {
				constraints.add(f);
			} else {
				throw new ValidationError(ValidationError.Kind.NOT_COMPLETABLE,
						"formula is neither a rule nor a constraint", f);
			}
		}
		List<Predicate> cycle = tight ? DependencyGraph.of(theory).positiveCycle() : ImmutableList.of();
		if (!cycle.isEmpty()) {
			throw new ValidationError(ValidationError.Kind.NOT_TIGHT,
					"theory is not tight, positive cycle through " + cycle);
		}
		return definitions;
	}

	/**
	 * Complete a single predicate from the rules defining it.
	 *
	 * @param predicate
	 * @param rules
	 * @return
	 */
	private Formula complete(Predicate predicate, List<Definition> rules) {
		List<Term.Variable> head = commonHead(rules);
		ArrayList<Formula> disjuncts = new ArrayList<>();
		if (head != null) {
			disjuncts.addAll(bodies(head, rules));
		} else {
			HashSet<String> taken = new HashSet<>();
			for (Definition d : rules) {
				taken.addAll(Syntax.variableNames(d.original));
			}
			ArrayList<Term.Variable> fresh = new ArrayList<>();
			for (int i = 0; i != predicate.arity(); ++i) {
				String name = Syntax.fresh("V" + (i + 1), taken);
				taken.add(name);
				fresh.add(new Term.Variable(name));
			}
			head = fresh;
			for (Definition d : rules) {
				ArrayList<Formula> conjuncts = new ArrayList<>();
				for (int i = 0; i != predicate.arity(); ++i) {
					conjuncts.add(new Formula.Comparison(fresh.get(i), Relation.EQUAL, d.head.terms().get(i)));
				}
				conjuncts.add(d.body);
				Formula body = Syntax.conjunction(conjuncts);
				LinkedHashSet<Term.Variable> local = new LinkedHashSet<>(Syntax.freeVariables(body));
				local.removeAll(fresh);
				disjuncts.add(Syntax.exists(local, body));
			}
		}
		Formula.Atom atom = new Formula.Atom(predicate.symbol(), head);
		if (rules.isEmpty()) {
			return Syntax.forall(head, new Formula.Negation(atom));
		}
		return Syntax.forall(head, new Formula.Equivalence(atom, Syntax.disjunction(disjuncts)));
	}

	/**
	 * Existentially close the body of each rule over the variables not in the
	 * head.
	 */
	private static List<Formula> bodies(List<Term.Variable> head, List<Definition> rules) {
		ArrayList<Formula> result = new ArrayList<>();
		for (Definition d : rules) {
			Set<Term.Variable> local = Syntax.freeVariables(d.body);
			local.removeAll(head);
			result.add(Syntax.exists(local, d.body));
		}
		return result;
	}

	/**
	 * Determine whether every rule has the same head consisting of distinct
	 * variables and, if so, return those variables.
	 *
	 * @param rules
	 * @return
	 */
	private static List<Term.Variable> commonHead(List<Definition> rules) {
		if (rules.isEmpty()) {
			return null;
		}
		Formula.Atom head = rules.get(0).head;
		HashSet<Term.Variable> seen = new HashSet<>();
		ArrayList<Term.Variable> result = new ArrayList<>();
		for (Term t : head.terms()) {
			if (!(t instanceof Term.Variable) || !seen.add((Term.Variable) t)) {
				return null;
			}
			result.add((Term.Variable) t);
		}
		for (Definition d : rules) {
			if (!d.head.equals(head)) {
				return null;
			}
		}
		return result;
	}

	/**
	 * Conjoins every atom not under a negation with its order atom relative to
	 * a given head.
	 *
	 * @author David J. Pearce
	 *
	 */
	private static final class OrderAtoms extends AbstractRewriter {
		private final Formula.Atom head;

		private OrderAtoms(Formula.Atom head) {
			this.head = head;
		}

		@Override
		protected Formula apply(Formula.Atom formula) {
			ArrayList<Term> terms = new ArrayList<>(formula.terms());
			terms.addAll(head.terms());
			Formula.Atom less = new Formula.Atom("less_" + formula.predicate().symbol() + "_" + head.predicate().symbol(),
					terms);
			return new Formula.Conjunction(formula, less);
		}

		@Override
		protected Formula apply(Formula.Negation formula) {
			return formula;
		}
	}

	private static boolean isConstraint(Formula f) {
		while (f instanceof Formula.Universal) {
			f = ((Formula.Universal) f).body();
		}
		return f instanceof Formula.Negation || f instanceof Formula.Falsity
				|| (f instanceof Formula.Implication && ((Formula.Implication) f).rhs() instanceof Formula.Falsity);
	}

	/**
	 * A single rule <code>forall X (B -&gt; p(t))</code>, where the universal
	 * closure is implicit.
	 *
	 * @author David J. Pearce
	 *
	 */
	private static final class Definition {
		private final Formula original;
		private final Formula body;
		private final Formula.Atom head;

		private Definition(Formula original, Formula body, Formula.Atom head) {
			this.original = original;
			this.body = body;
			this.head = head;
		}

		/**
		 * Recognise a rule, returning null if the formula is not one.
		 *
		 * @param f
		 * @return
		 */
		public static Definition of(Formula f) {
			Formula inner = f;
			while (inner instanceof Formula.Universal) {
				inner = ((Formula.Universal) inner).body();
			}
			if (inner instanceof Formula.Atom) {
				return new Definition(f, Syntax.TRUE, (Formula.Atom) inner);
			} else if (inner instanceof Formula.Implication) {
				Formula.Implication i = (Formula.Implication) inner;
				if (i.rhs() instanceof Formula.Atom) {
					return new Definition(f, i.lhs(), (Formula.Atom) i.rhs());
				}
			}
			return null;
		}
	}
}
