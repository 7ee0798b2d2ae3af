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

import com.google.common.collect.ImmutableList;

import aspverify.core.Program;
import aspverify.core.Program.Kind;
import aspverify.core.Program.Literal;
import aspverify.core.Program.Rule;
import aspverify.core.Program.Sign;
import aspverify.core.Syntax;
import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Predicate;
import aspverify.core.Syntax.Term;

/**
 * Transforms a program into a tight one by counting derivation steps. Every
 * predicate <code>p/n</code> gains an extra argument recording the step at
 * which it was derived:
 *
 * <pre>
 * p(t, N + 1) :- q(s, N), not r(u).
 * </pre>
 *
 * Positive body atoms are derived at step <code>N</code>, whilst negated atoms
 * and constraints are left alone. Finally, a rule
 * <code>p(X1, ..., Xn) :- p(X1, ..., Xn, N).</code> forgets the step for each
 * predicate of the original program. A derived atom then depends positively
 * only on atoms derived at an earlier step.
 *
 * @author David J. Pearce
 *
 */
public class Tightening {
	private final Program program;
	private final Term.Variable step;

	public Tightening(Program program) {
		this.program = program;
		this.step = new Term.Variable(Syntax.fresh("N", program.variableNames()));
	}

	public static Program apply(Program program) {
		return new Tightening(program).tighten();
	}

	public Program tighten() {
		ArrayList<Rule> rules = new ArrayList<>();
		for (Rule r : program.rules()) {
			rules.add(tighten(r));
		}
		for (Predicate p : program.predicates()) {
			rules.add(forget(p));
		}
		return new Program(rules, program.attributes());
	}

	private Rule tighten(Rule rule) {
		if (rule.kind() == Kind.CONSTRAINT) {
			return rule;
		}
		Term successor = new Term.BinaryOperation(Term.Operator.ADD, step, new Term.IntegerConstant(1));
		Formula.Atom head = extend(rule.head(), successor);
		ArrayList<Literal> body = new ArrayList<>();
		for (Literal l : rule.body()) {
			if (l.sign() == Sign.NONE && l.atom() instanceof Formula.Atom) {
				body.add(new Literal(Sign.NONE, extend((Formula.Atom) l.atom(), step), l.attributes()));
			} else {
				body.add(l);
			}
		}
		return new Rule(rule.kind(), head, body, rule.attributes());
	}

	/**
	 * Construct the rule <code>p(X1, ..., Xn) :- p(X1, ..., Xn, N).</code> for a
	 * predicate <code>p/n</code>.
	 */
	private Rule forget(Predicate p) {
		ArrayList<Term> terms = new ArrayList<>();
		for (int i = 0; i != p.arity(); ++i) {
			terms.add(new Term.Variable("X" + (i + 1)));
		}
		Formula.Atom head = new Formula.Atom(p.symbol(), terms);
		Literal body = new Literal(Sign.NONE, extend(head, step));
		return new Rule(Kind.BASIC, head, ImmutableList.of(body));
	}

	private static Formula.Atom extend(Formula.Atom atom, Term term) {
		ArrayList<Term> terms = new ArrayList<>(atom.terms());
		terms.add(term);
		return new Formula.Atom(atom.predicate().symbol(), terms, atom.attributes());
	}
}
