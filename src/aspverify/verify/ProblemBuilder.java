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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;

import aspverify.analysis.DependencyGraph;
import aspverify.core.Program;
import aspverify.core.Specification;
import aspverify.core.Specification.AnnotatedFormula;
import aspverify.core.Specification.Direction;
import aspverify.core.Specification.Role;
import aspverify.core.Syntax;
import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Predicate;
import aspverify.core.UserGuide;
import aspverify.translate.Completion;
import aspverify.translate.Gamma;
import aspverify.translate.PredicateRenaming;
import aspverify.translate.Simplifier;
import aspverify.translate.TauStar;
import aspverify.util.ValidationError;

/**
 * Turns an equivalence claim into proof schedules, one for each direction
 * being verified. Two kinds of claim are supported:
 *
 * <ul>
 * <li><b>Strong equivalence</b> of two programs, reduced to classical logic via
 * tau-star and gamma.</li>
 * <li><b>External equivalence</b> of a program with another program or a
 * specification, relative to a user guide. Each program is completed, such
 * that its private predicates are defined as axioms and its public behaviour
 * becomes a list of formulas to prove (or assume, depending on the
 * direction).</li>
 * </ul>
 *
 * @author David J. Pearce
 *
 */
public class ProblemBuilder {
	public enum Decomposition {
		/**
		 * Every conjecture is proved from the same axioms.
		 */
		INDEPENDENT,
		/**
		 * Each conjecture may use those before it as axioms.
		 */
		SEQUENTIAL;

		@Override
		public String toString() {
			return name().toLowerCase();
		}
	}

	private boolean simplify = true;
	private boolean breakEquivalences = true;
	private Decomposition decomposition = Decomposition.INDEPENDENT;
	private Direction direction = Direction.UNIVERSAL;
	private boolean bypassTightness = false;

	/**
	 * Configure whether translated programs are simplified.
	 *
	 * @param flag
	 * @return
	 */
	public ProblemBuilder setSimplify(boolean flag) {
		this.simplify = flag;
		return this;
	}

	/**
	 * Configure whether conjectures of the form <code>forall X (F &lt;-&gt; G)</code>
	 * are split into two implications.
	 *
	 * @param flag
	 * @return
	 */
	public ProblemBuilder setBreakEquivalences(boolean flag) {
		this.breakEquivalences = flag;
		return this;
	}

	/**
	 * Configure whether programs are completed even when they are not tight.
	 * The completion of such a program may have models which are not stable,
	 * so a successful verification no longer implies external equivalence.
	 *
	 * @param flag
	 * @return
	 */
	public ProblemBuilder setBypassTightness(boolean flag) {
		this.bypassTightness = flag;
		return this;
	}

	public ProblemBuilder setDecomposition(Decomposition decomposition) {
		this.decomposition = decomposition;
		return this;
	}

	/**
	 * Configure which directions are verified. The universal direction means
	 * both forward and backward.
	 *
	 * @param direction
	 * @return
	 */
	public ProblemBuilder setDirection(Direction direction) {
		this.direction = direction;
		return this;
	}

	// =============================================================================
	// Strong Equivalence
	// =============================================================================

	/**
	 * Construct the schedules showing two programs are strongly equivalent. In
	 * the forward direction, the here-and-there translation of every rule of the
	 * right program must follow from that of the left program (and vice versa
	 * for the backward direction).
	 *
	 * @param left
	 * @param right
	 * @return
	 */
	public List<ProofSchedule> strongEquivalence(Program left, Program right) {
		List<Formula> lhs = translate(left);
		List<Formula> rhs = translate(right);
		LinkedHashSet<Predicate> predicates = new LinkedHashSet<>(left.predicates());
		predicates.addAll(right.predicates());
		List<Formula> ordering = Gamma.orderingAxioms(predicates);
		ArrayList<ProofSchedule> schedules = new ArrayList<>();
		for (Direction d : direction.expand()) {
			List<Formula> premises = d == Direction.FORWARD ? lhs : rhs;
			List<Formula> conclusions = d == Direction.FORWARD ? rhs : lhs;
			ArrayList<Formula> axioms = new ArrayList<>(ordering);
			for (Formula f : premises) {
				axioms.add(simplify(Gamma.here(f)));
				axioms.add(simplify(Gamma.there(f)));
			}
			ArrayList<AnnotatedFormula> conjectures = new ArrayList<>();
			for (int i = 0; i != conclusions.size(); ++i) {
				// there(F) follows from here(F) under the ordering axioms
				Formula here = simplify(Gamma.here(conclusions.get(i)));
				conjectures.add(new AnnotatedFormula(Role.SPEC, d, "rule_" + (i + 1), here));
			}
			schedules.add(new ProofSchedule(d, decompose(d, axioms, conjectures)));
		}
		return schedules;
	}

	private List<Formula> translate(Program program) {
		List<Formula> theory = TauStar.apply(program);
		return simplify ? Simplifier.simplify(theory) : theory;
	}

	private Formula simplify(Formula f) {
		return simplify ? Simplifier.simplify(f) : f;
	}

	// =============================================================================
	// External Equivalence
	// =============================================================================

	/**
	 * Construct the schedules showing a program is externally equivalent to a
	 * specification. The forward direction shows the specification implies the
	 * program's behaviour, and the backward direction the converse.
	 *
	 * @param left
	 * @param right
	 * @param guide
	 * @param outline
	 *            Helper steps, or null if there are none.
	 * @return
	 */
	public List<ProofSchedule> externalEquivalence(Specification left, Program right, UserGuide guide,
			Specification outline) {
		PlaceholderSubstitution placeholders = new PlaceholderSubstitution(guide);
		return externalEquivalence(theory(left, placeholders), theory(right, guide, placeholders), guide, outline,
				placeholders);
	}

	/**
	 * Construct the schedules showing two programs are externally equivalent.
	 *
	 * @param left
	 * @param right
	 * @param guide
	 * @param outline
	 *            Helper steps, or null if there are none.
	 * @return
	 */
	public List<ProofSchedule> externalEquivalence(Program left, Program right, UserGuide guide,
			Specification outline) {
		PlaceholderSubstitution placeholders = new PlaceholderSubstitution(guide);
		return externalEquivalence(theory(left, guide, placeholders), theory(right, guide, placeholders), guide,
				outline, placeholders);
	}

	private List<ProofSchedule> externalEquivalence(Theory left, Theory right, UserGuide guide,
			Specification outline, PlaceholderSubstitution placeholders) {
		// separate the left's private predicates from everything on the right
		PredicateRenaming renaming = PredicateRenaming.separate(guide.privatePredicates(left.predicates),
				right.predicates);
		if (!renaming.mapping().isEmpty()) {
			left = left.rename(renaming);
		}
		ArrayList<AnnotatedFormula> assumptions = new ArrayList<>(placeholders.applyAllAnnotated(guide.assumptions()));
		assumptions.addAll(left.assumptions);
		assumptions.addAll(right.assumptions);
		for (AnnotatedFormula a : assumptions) {
			for (Predicate p : Syntax.predicates(a.formula())) {
				if (!guide.inputs().contains(p)) {
					throw new ValidationError(ValidationError.Kind.OUTPUT_SYMBOL_IN_ASSUMPTION,
							"assumption mentions " + p + " which is not an input", a);
				}
			}
		}
		ArrayList<Formula> base = new ArrayList<>();
		for (AnnotatedFormula a : assumptions) {
			base.add(a.formula());
		}
		base.addAll(left.privates);
		base.addAll(right.privates);
		//
		LinkedHashSet<Predicate> known = new LinkedHashSet<>(left.predicates);
		known.addAll(right.predicates);
		known.addAll(guide.inputs());
		known.addAll(guide.outputs());
		ProofOutline steps = outline == null ? ProofOutline.empty()
				: new ProofOutline(placeholders.apply(outline), known);
		//
		ArrayList<ProofSchedule> schedules = new ArrayList<>();
		for (Direction d : direction.expand()) {
			Theory premise = d == Direction.FORWARD ? left : right;
			Theory conclusion = d == Direction.FORWARD ? right : left;
			ArrayList<Formula> axioms = new ArrayList<>(base);
			for (AnnotatedFormula f : premise.publics) {
				if (f.direction().includes(d)) {
					axioms.add(f.formula());
				}
			}
			ArrayList<AnnotatedFormula> conjectures = new ArrayList<>();
			for (AnnotatedFormula f : conclusion.publics) {
				if (f.direction().includes(d)) {
					conjectures.add(f);
				}
			}
			ArrayList<List<ProofProblem>> stages = new ArrayList<>();
			for (ProofOutline.Step step : steps.steps(d)) {
				if (!step.obligations().isEmpty()) {
					stages.add(problems(d, axioms, step.obligations(), 0));
				}
				axioms.add(step.formula());
			}
			stages.addAll(decompose(d, axioms, conjectures));
			schedules.add(new ProofSchedule(d, stages));
		}
		return schedules;
	}

	/**
	 * Arrange the final conjectures into stages, according to the chosen
	 * decomposition.
	 */
	private List<List<ProofProblem>> decompose(Direction d, List<Formula> axioms,
			List<AnnotatedFormula> conjectures) {
		ArrayList<List<ProofProblem>> stages = new ArrayList<>();
		if (decomposition == Decomposition.INDEPENDENT) {
			stages.add(problems(d, axioms, conjectures, 0));
		} else {
			ArrayList<Formula> known = new ArrayList<>(axioms);
			// unnamed conjectures are numbered across all stages
			int count = 0;
			for (AnnotatedFormula c : conjectures) {
				List<ProofProblem> stage = problems(d, known, ImmutableList.of(c), count);
				count = count + stage.size();
				stages.add(stage);
				for (ProofProblem p : stage) {
					known.add(p.conjecture());
				}
			}
		}
		return stages;
	}

	/**
	 * Construct one problem for each conjecture (or each half of a conjecture,
	 * when breaking equivalences), all sharing the same axioms. Unnamed
	 * conjectures are numbered from <code>offset + 1</code>.
	 */
	private List<ProofProblem> problems(Direction d, List<Formula> axioms, List<AnnotatedFormula> conjectures,
			int offset) {
		if (breakEquivalences) {
			conjectures = EquivalenceBreaker.applyAll(conjectures);
		}
		ArrayList<ProofProblem> result = new ArrayList<>();
		for (int i = 0; i != conjectures.size(); ++i) {
			AnnotatedFormula c = conjectures.get(i);
			String name = c.name().equals(Specification.UNNAMED) ? "conjecture_" + (offset + i + 1) : c.name();
			result.add(new ProofProblem(name, d, axioms, c.formula()));
		}
		return result;
	}

	// =============================================================================
	// Theories
	// =============================================================================

	/**
	 * Translate a program into a theory by completing it. The definitions of
	 * private predicates become private axioms, whilst the definitions of
	 * output predicates and the constraints describe its public behaviour.
	 */
	private Theory theory(Program program, UserGuide guide, PlaceholderSubstitution placeholders) {
		program = placeholders.apply(program);
		DependencyGraph graph = DependencyGraph.of(program);
		List<Predicate> cycle = bypassTightness ? ImmutableList.of() : graph.positiveCycle();
		if (!cycle.isEmpty()) {
			throw new ValidationError(ValidationError.Kind.NOT_TIGHT,
					"program is not tight, positive cycle through " + cycle, program);
		}
		Set<Predicate> privates = guide.privatePredicates(program.predicates());
		List<Predicate> recursion = graph.privateRecursion(privates);
		if (!recursion.isEmpty()) {
			throw new ValidationError(ValidationError.Kind.PRIVATE_RECURSION,
					"private predicates defined recursively or by choice: " + recursion, program);
		}
		LinkedHashSet<Predicate> intensional = new LinkedHashSet<>(program.predicates());
		intensional.removeAll(guide.inputs());
		intensional.addAll(guide.outputs());
		Completion completion = new Completion(TauStar.apply(program), intensional)
				.setCheckTightness(!bypassTightness);
		Map<Predicate, Formula> definitions = completion.definitions();
		ArrayList<AnnotatedFormula> publics = new ArrayList<>();
		ArrayList<Formula> secrets = new ArrayList<>();
		int constraints = 0;
		for (Formula f : completion.complete()) {
			Predicate defined = definedBy(f, definitions);
			f = simplify(f);
			if (defined != null && privates.contains(defined)) {
				secrets.add(f);
			} else if (defined != null) {
				String name = "completed_definition_of_" + defined.symbol() + "_" + defined.arity();
				publics.add(new AnnotatedFormula(Role.SPEC, Direction.UNIVERSAL, name, f));
			} else {
				constraints = constraints + 1;
				publics.add(new AnnotatedFormula(Role.SPEC, Direction.UNIVERSAL, "constraint_" + constraints, f));
			}
		}
		return new Theory(ImmutableList.of(), publics, secrets, program.predicates());
	}

	private static Predicate definedBy(Formula f, Map<Predicate, Formula> definitions) {
		for (Map.Entry<Predicate, Formula> e : definitions.entrySet()) {
			if (e.getValue().equals(f)) {
				return e.getKey();
			}
		}
		return null;
	}

	/**
	 * Translate a specification into a theory. Specification formulas describe
	 * public behaviour, whilst definitions (of private predicates) are axioms.
	 */
	private static Theory theory(Specification specification, PlaceholderSubstitution placeholders) {
		specification = placeholders.apply(specification);
		ArrayList<AnnotatedFormula> assumptions = new ArrayList<>();
		ArrayList<AnnotatedFormula> publics = new ArrayList<>();
		ArrayList<Formula> privates = new ArrayList<>();
		for (AnnotatedFormula f : specification.formulas()) {
			Syntax.checkSorts(f.formula());
			switch (f.role()) {
			case ASSUMPTION:
				assumptions.add(f);
				break;
			case SPEC:
				publics.add(f);
				break;
			case DEFINITION:
				privates.add(f.formula());
				break;
			default:
				throw new ValidationError(ValidationError.Kind.MALFORMED_PROOF_OUTLINE,
						f.role() + " belongs in a proof outline", f);
			}
		}
		return new Theory(assumptions, publics, privates, specification.predicates());
	}

	/**
	 * One side of an external equivalence claim.
	 *
	 * @author David J. Pearce
	 *
	 */
	private static final class Theory {
		private final ImmutableList<AnnotatedFormula> assumptions;
		private final ImmutableList<AnnotatedFormula> publics;
		private final ImmutableList<Formula> privates;
		private final Set<Predicate> predicates;

		private Theory(List<AnnotatedFormula> assumptions, List<AnnotatedFormula> publics, List<Formula> privates,
				Set<Predicate> predicates) {
			this.assumptions = ImmutableList.copyOf(assumptions);
			this.publics = ImmutableList.copyOf(publics);
			this.privates = ImmutableList.copyOf(privates);
			this.predicates = predicates;
		}

		private Theory rename(PredicateRenaming renaming) {
			ArrayList<AnnotatedFormula> publics = new ArrayList<>();
			for (AnnotatedFormula f : this.publics) {
				publics.add(f.withFormula(renaming.apply(f.formula())));
			}
			ArrayList<Formula> privates = new ArrayList<>();
			for (Formula f : this.privates) {
				privates.add(renaming.apply(f));
			}
			LinkedHashSet<Predicate> predicates = new LinkedHashSet<>();
			for (Predicate p : this.predicates) {
				predicates.add(renaming.apply(p));
			}
			return new Theory(assumptions, publics, privates, predicates);
		}
	}
}
