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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import aspverify.core.Program;
import aspverify.core.Program.Literal;
import aspverify.core.Program.Rule;
import aspverify.core.Specification;
import aspverify.core.Specification.AnnotatedFormula;
import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Sort;
import aspverify.core.Syntax.Term;
import aspverify.core.UserGuide;
import aspverify.core.UserGuide.PlaceholderDeclaration;
import aspverify.util.AbstractRewriter;
import aspverify.util.ValidationError;

/**
 * Replaces symbolic constants declared as placeholders in a user guide with
 * placeholder terms of the declared sort. Placeholders written directly with a
 * sort suffix (e.g. <code>n$i</code>) are checked against the declarations.
 *
 * @author David J. Pearce
 *
 */
public class PlaceholderSubstitution extends AbstractRewriter {
	private final Map<String, Sort> placeholders;

	public PlaceholderSubstitution(UserGuide guide) {
		this.placeholders = new LinkedHashMap<>();
		for (PlaceholderDeclaration d : guide.placeholders()) {
			Sort s = placeholders.get(d.name());
			if (s != null && s != d.sort()) {
				throw new ValidationError(ValidationError.Kind.PLACEHOLDER_SORT_CONFLICT,
						"placeholder " + d.name() + " declared as both " + s + " and " + d.sort(), d);
			}
			placeholders.put(d.name(), d.sort());
		}
	}

	public Map<String, Sort> placeholders() {
		return placeholders;
	}

	@Override
	public Term apply(Term term) {
		if (term instanceof Term.SymbolicConstant) {
			String name = ((Term.SymbolicConstant) term).name();
			Sort sort = placeholders.get(name);
			return sort == null ? term : new Term.Placeholder(name, sort, term.attributes());
		} else if (term instanceof Term.Placeholder) {
			Term.Placeholder p = (Term.Placeholder) term;
			Sort sort = placeholders.get(p.name());
			if (sort != null && sort != p.sort()) {
				throw new ValidationError(ValidationError.Kind.PLACEHOLDER_SORT_CONFLICT,
						"placeholder " + p.name() + " used as " + p.sort() + " but declared as " + sort, p);
			}
			return term;
		}
		return super.apply(term);
	}

	public Program apply(Program program) {
		ArrayList<Rule> rules = new ArrayList<>();
		for (Rule r : program.rules()) {
			Formula.Atom head = r.head() == null ? null : (Formula.Atom) apply(r.head());
			ArrayList<Literal> body = new ArrayList<>();
			for (Literal l : r.body()) {
				body.add(new Literal(l.sign(), apply(l.atom()), l.attributes()));
			}
			rules.add(new Rule(r.kind(), head, body, r.attributes()));
		}
		return new Program(rules, program.attributes());
	}

	public AnnotatedFormula apply(AnnotatedFormula formula) {
		return formula.withFormula(apply(formula.formula()));
	}

	public List<AnnotatedFormula> applyAllAnnotated(List<AnnotatedFormula> formulas) {
		ArrayList<AnnotatedFormula> result = new ArrayList<>();
		for (AnnotatedFormula f : formulas) {
			result.add(apply(f));
		}
		return result;
	}

	public Specification apply(Specification specification) {
		return new Specification(applyAllAnnotated(specification.formulas()), specification.attributes());
	}
}
