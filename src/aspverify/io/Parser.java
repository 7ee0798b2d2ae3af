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
package aspverify.io;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

import aspverify.core.Program;
import aspverify.core.Program.Literal;
import aspverify.core.Program.Rule;
import aspverify.core.Program.Sign;
import aspverify.core.Specification;
import aspverify.core.Specification.AnnotatedFormula;
import aspverify.core.Specification.Direction;
import aspverify.core.Specification.Role;
import aspverify.core.Syntax;
import aspverify.core.Syntax.Formula;
import aspverify.core.Syntax.Predicate;
import aspverify.core.Syntax.Relation;
import aspverify.core.Syntax.Sort;
import aspverify.core.Syntax.Term;
import aspverify.core.UserGuide;
import aspverify.core.UserGuide.PlaceholderDeclaration;
import aspverify.io.Lexer.Identifier;
import aspverify.io.Lexer.Int;
import aspverify.io.Lexer.Keyword;
import aspverify.io.Lexer.Token;
import aspverify.util.SyntacticElement.Attribute;
import aspverify.util.SyntaxError;

/**
 * A recursive-descent parser for logic programs, first-order formulas,
 * specifications, proof outlines and user guides. Programs are written in the
 * usual clingo style:
 *
 * <pre>
 * Rule ::= Atom [':-' Body] '.'
 *        | '{' Atom '}' [':-' Body] '.'
 *        | ':-' Body '.'
 * Body ::= Literal (',' Literal)*
 * Literal ::= ('not')* (Atom | Term Relation Term)
 * </pre>
 *
 * Formulas use the connectives <code>not</code>, <code>and</code>,
 * <code>or</code>, <code>-&gt;</code>, <code>&lt;-</code> and
 * <code>&lt;-&gt;</code> (in order of decreasing precedence) together with the
 * quantifiers <code>forall</code> and <code>exists</code>. Variables and
 * placeholders within formulas may be annotated with a sort, as in
 * <code>N$i</code> (integer), <code>S$s</code> (symbol) or
 * <code>X$g</code> (general).
 *
 * @author David J. Pearce
 *
 */
public class Parser {
	private final String sourcefile;
	private final String text;
	private final ArrayList<Token> tokens;
	private final Attribute.Origin origin;
	private int index;
	private int anonymous;

	public Parser(Lexer lexer) {
		this.sourcefile = lexer.filename();
		this.text = lexer.text();
		this.tokens = new ArrayList<>(lexer.scan());
		this.origin = new Attribute.Origin(sourcefile, text);
	}

	/**
	 * Construct a parser for some text held in memory.
	 *
	 * @param sourcefile
	 *            Name used when reporting errors (may be null).
	 * @param text
	 */
	public Parser(String sourcefile, String text) {
		this(new Lexer(sourcefile, text));
	}

	// =============================================================================
	// Programs
	// =============================================================================

	/**
	 * Parse a logic program, consisting of zero or more rules. Directives (e.g.
	 * <code>#show p/1.</code>) have no bearing on the translation and are
	 * skipped.
	 *
	 * @return
	 */
	public Program parseProgram() {
		ArrayList<Rule> rules = new ArrayList<>();
		while (index < tokens.size()) {
			Token lookahead = tokens.get(index);
			if (lookahead instanceof Keyword && lookahead.text.equals("#show")) {
				skipDirective();
			} else {
				rules.add(parseRule());
			}
		}
		return new Program(rules, origin);
	}

	/**
	 * Parse a single rule.
	 *
	 * @return
	 */
	public Rule parseRule() {
		checkNotEof();
		int start = index;
		Token lookahead = tokens.get(index);
		Program.Kind kind;
		Formula.Atom head = null;
		if (lookahead.text.equals(":-")) {
			kind = Program.Kind.CONSTRAINT;
		} else if (lookahead.text.equals("#false")) {
			match("#false");
			kind = Program.Kind.CONSTRAINT;
		} else if (lookahead.text.equals("{")) {
			match("{");
			head = parseAtom(false);
			match("}");
			kind = Program.Kind.CHOICE;
		} else {
			head = parseAtom(false);
			kind = Program.Kind.BASIC;
		}
		ArrayList<Literal> body = new ArrayList<>();
		if (kind == Program.Kind.CONSTRAINT || lookahead(":-")) {
			match(":-");
			body.add(parseLiteral());
			while (lookahead(",")) {
				match(",");
				body.add(parseLiteral());
			}
		}
		match(".");
		return new Rule(kind, head, body, sourceAttr(start, index - 1), origin);
	}

	/**
	 * Parse a literal, which is an atom or comparison preceded by up to two
	 * negations.
	 *
	 * @return
	 */
	public Literal parseLiteral() {
		int start = index;
		int depth = 0;
		while (lookahead("not")) {
			match("not");
			depth = depth + 1;
		}
		if (depth >= Sign.values().length) {
			syntaxError("too many negations", tokens.get(start));
		}
		Formula atom = parseAtomOrComparison(false);
		return new Literal(Sign.values()[depth], atom, sourceAttr(start, index - 1));
	}

	private void skipDirective() {
		while (!lookahead(".")) {
			checkNotEof();
			index = index + 1;
		}
		match(".");
	}

	// =============================================================================
	// Specifications, Outlines and User Guides
	// =============================================================================

	/**
	 * Parse a sequence of formulas, each terminated by a full stop.
	 *
	 * @return
	 */
	public List<Formula> parseTheory() {
		ArrayList<Formula> formulas = new ArrayList<>();
		while (index < tokens.size()) {
			formulas.add(parseFormula());
			match(".");
		}
		return formulas;
	}

	/**
	 * Parse a specification or proof outline, consisting of zero or more
	 * annotated formulas.
	 *
	 * @return
	 */
	public Specification parseSpecification() {
		ArrayList<AnnotatedFormula> formulas = new ArrayList<>();
		while (index < tokens.size()) {
			formulas.add(parseAnnotatedFormula());
		}
		return new Specification(formulas, origin);
	}

	/**
	 * Parse an annotated formula, of the form:
	 *
	 * <pre>
	 * AnnotatedFormula ::= Role ['(' Direction ')'] ['[' Name ']'] ':' Formula '.'
	 * </pre>
	 *
	 * @return
	 */
	public AnnotatedFormula parseAnnotatedFormula() {
		int start = index;
		Role role = parseRole();
		Direction direction = null;
		String name = null;
		if (lookahead("(")) {
			match("(");
			Token t = match("forward", "backward", "universal");
			direction = Direction.valueOf(t.text.toUpperCase());
			match(")");
		}
		if (lookahead("[")) {
			match("[");
			checkNotEof();
			Token t = tokens.get(index);
			if (!(t instanceof Identifier) && !(t instanceof Int)) {
				syntaxError("name expected", t);
			}
			index = index + 1;
			name = t.text;
			match("]");
		}
		match(":");
		Formula formula = parseFormula();
		match(".");
		return new AnnotatedFormula(role, direction, name, formula, sourceAttr(start, index - 1), origin);
	}

	private Role parseRole() {
		checkNotEof();
		Token t = tokens.get(index);
		switch (t.text) {
		case "assumption":
		case "assume":
			index = index + 1;
			return Role.ASSUMPTION;
		case "spec":
			index = index + 1;
			return Role.SPEC;
		case "definition":
			index = index + 1;
			return Role.DEFINITION;
		case "lemma":
			index = index + 1;
			return Role.LEMMA;
		case "inductive":
			index = index + 1;
			match("-");
			match("lemma");
			return Role.INDUCTIVE_LEMMA;
		default:
			syntaxError("unknown role '" + t.text + "'", t);
			return null; // unreachable
		}
	}

	/**
	 * Parse a user guide, consisting of entries of the form:
	 *
	 * <pre>
	 * Entry ::= 'input' ':' Predicate (',' Predicate)* '.'
	 *         | 'input' ':' Name '-&gt;' Sort '.'
	 *         | 'output' ':' Predicate (',' Predicate)* '.'
	 *         | 'assumption' ':' Formula '.'
	 * Predicate ::= Name '/' Int
	 * </pre>
	 *
	 * @return
	 */
	public UserGuide parseUserGuide() {
		LinkedHashSet<Predicate> inputs = new LinkedHashSet<>();
		LinkedHashSet<Predicate> outputs = new LinkedHashSet<>();
		ArrayList<PlaceholderDeclaration> placeholders = new ArrayList<>();
		ArrayList<AnnotatedFormula> assumptions = new ArrayList<>();
		while (index < tokens.size()) {
			int start = index;
			Token t = match("input", "output", "assumption", "assume");
			switch (t.text) {
			case "input":
				match(":");
				if (index + 1 < tokens.size() && tokens.get(index + 1).text.equals("->")) {
					Identifier name = matchIdentifier();
					match("->");
					Token s = match("integer", "symbol", "general");
					Sort sort = Sort.valueOf(s.text.toUpperCase());
					placeholders.add(new PlaceholderDeclaration(name.text, sort, sourceAttr(start, index - 1), origin));
				} else {
					inputs.addAll(parsePredicates());
				}
				break;
			case "output":
				match(":");
				outputs.addAll(parsePredicates());
				break;
			default:
				match(":");
				Formula f = parseFormula();
				assumptions.add(new AnnotatedFormula(Role.ASSUMPTION, null, null, f, sourceAttr(start, index - 1),
						origin));
			}
			match(".");
		}
		return new UserGuide(inputs, outputs, placeholders, assumptions, origin);
	}

	private List<Predicate> parsePredicates() {
		ArrayList<Predicate> predicates = new ArrayList<>();
		predicates.add(parsePredicate());
		while (lookahead(",")) {
			match(",");
			predicates.add(parsePredicate());
		}
		return predicates;
	}

	private Predicate parsePredicate() {
		Identifier name = matchIdentifier();
		match("/");
		int arity = match(Int.class, "an integer").value;
		return new Predicate(name.text, arity);
	}

	// =============================================================================
	// Formulas
	// =============================================================================

	/**
	 * Parse a first-order formula.
	 *
	 * @return
	 */
	public Formula parseFormula() {
		return parseEquivalence();
	}

	private Formula parseEquivalence() {
		int start = index;
		Formula lhs = parseImplication();
		if (lookahead("<->")) {
			match("<->");
			Formula rhs = parseEquivalence();
			return new Formula.Equivalence(lhs, rhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	private Formula parseImplication() {
		int start = index;
		Formula lhs = parseDisjunction();
		if (lookahead("->")) {
			match("->");
			Formula rhs = parseImplication();
			return new Formula.Implication(lhs, rhs, sourceAttr(start, index - 1));
		}
		while (lookahead("<-")) {
			match("<-");
			Formula rhs = parseDisjunction();
			lhs = new Formula.Implication(rhs, lhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	private Formula parseDisjunction() {
		int start = index;
		ArrayList<Formula> operands = new ArrayList<>();
		operands.add(parseConjunction());
		while (lookahead("or")) {
			match("or");
			operands.add(parseConjunction());
		}
		if (operands.size() == 1) {
			return operands.get(0);
		}
		return new Formula.Disjunction(operands, sourceAttr(start, index - 1));
	}

	private Formula parseConjunction() {
		int start = index;
		ArrayList<Formula> operands = new ArrayList<>();
		operands.add(parseUnary());
		while (lookahead("and")) {
			match("and");
			operands.add(parseUnary());
		}
		if (operands.size() == 1) {
			return operands.get(0);
		}
		return new Formula.Conjunction(operands, sourceAttr(start, index - 1));
	}

	private Formula parseUnary() {
		checkNotEof();
		int start = index;
		Token lookahead = tokens.get(index);
		if (lookahead.text.equals("not")) {
			match("not");
			Formula operand = parseUnary();
			return new Formula.Negation(operand, sourceAttr(start, index - 1));
		} else if (lookahead.text.equals("forall") || lookahead.text.equals("exists")) {
			index = index + 1;
			ArrayList<Term.Variable> variables = new ArrayList<>();
			do {
				variables.add(parseVariable(true));
			} while (index < tokens.size() && tokens.get(index) instanceof Identifier
					&& ((Identifier) tokens.get(index)).isVariable());
			Formula body = parseUnary();
			if (lookahead.text.equals("forall")) {
				return new Formula.Universal(variables, body, sourceAttr(start, index - 1));
			} else {
				return new Formula.Existential(variables, body, sourceAttr(start, index - 1));
			}
		}
		return parsePrimary();
	}

	private Formula parsePrimary() {
		checkNotEof();
		Token lookahead = tokens.get(index);
		if (lookahead.text.equals("#true")) {
			match("#true");
			return Syntax.TRUE;
		} else if (lookahead.text.equals("#false")) {
			match("#false");
			return Syntax.FALSE;
		} else if (lookahead.text.equals("(")) {
			int saved = index;
			try {
				match("(");
				Formula f = parseFormula();
				match(")");
				if (!isTermContinuation()) {
					return f;
				}
			} catch (SyntaxError e) {
				// not a bracketed formula, hence must be a bracketed term
			}
			index = saved;
		}
		return parseAtomOrComparison(true);
	}

	/**
	 * Parse an atom or a comparison. An identifier starting with a lowercase
	 * letter begins an atom, unless it is followed by a relation or an
	 * arithmetic operator.
	 *
	 * @param sorted
	 *            Whether sort annotations are permitted.
	 * @return
	 */
	private Formula parseAtomOrComparison(boolean sorted) {
		checkNotEof();
		Token lookahead = tokens.get(index);
		if (lookahead instanceof Identifier && !((Identifier) lookahead).isVariable()
				&& ((Identifier) lookahead).annotation() == null) {
			index = index + 1;
			boolean comparison = isTermContinuation();
			index = index - 1;
			if (!comparison) {
				return parseAtom(sorted);
			}
		}
		return parseComparison(sorted);
	}

	private Formula.Atom parseAtom(boolean sorted) {
		int start = index;
		Identifier name = matchIdentifier();
		if (name.isVariable() || name.annotation() != null) {
			syntaxError("predicate name expected", name);
		}
		ArrayList<Term> terms = new ArrayList<>();
		if (lookahead("(")) {
			match("(");
			terms.add(parseTerm(sorted));
			while (lookahead(",")) {
				match(",");
				terms.add(parseTerm(sorted));
			}
			match(")");
		}
		return new Formula.Atom(name.text, terms, sourceAttr(start, index - 1));
	}

	private Formula.Comparison parseComparison(boolean sorted) {
		int start = index;
		Term lhs = parseTerm(sorted);
		ArrayList<Formula.Guard> guards = new ArrayList<>();
		while (index < tokens.size() && isRelation(tokens.get(index))) {
			Relation relation = Relation.fromSymbol(tokens.get(index).text);
			index = index + 1;
			guards.add(new Formula.Guard(relation, parseTerm(sorted)));
		}
		if (guards.isEmpty()) {
			checkNotEof();
			syntaxError("expecting comparison, found '" + tokens.get(index).text + "'", tokens.get(index));
		}
		return new Formula.Comparison(lhs, guards, sourceAttr(start, index - 1));
	}

	// =============================================================================
	// Terms
	// =============================================================================

	/**
	 * Parse a term, of the form:
	 *
	 * <pre>
	 * Term ::= Additive ['..' Additive]
	 * Additive ::= Multiplicative (('+' | '-') Multiplicative)*
	 * Multiplicative ::= Unary (('*' | '/' | '\\') Unary)*
	 * Unary ::= '-' Unary | Primary
	 * </pre>
	 *
	 * @param sorted
	 *            Whether sort annotations are permitted.
	 * @return
	 */
	public Term parseTerm(boolean sorted) {
		int start = index;
		Term lhs = parseAdditive(sorted);
		if (lookahead("..")) {
			match("..");
			Term rhs = parseAdditive(sorted);
			return new Term.Interval(lhs, rhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	private Term parseAdditive(boolean sorted) {
		int start = index;
		Term lhs = parseMultiplicative(sorted);
		while (lookahead("+") || lookahead("-")) {
			Term.Operator op = match("+", "-").text.equals("+") ? Term.Operator.ADD : Term.Operator.SUBTRACT;
			Term rhs = parseMultiplicative(sorted);
			lhs = new Term.BinaryOperation(op, lhs, rhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	private Term parseMultiplicative(boolean sorted) {
		int start = index;
		Term lhs = parseUnaryTerm(sorted);
		while (lookahead("*") || lookahead("/") || lookahead("\\")) {
			Token t = match("*", "/", "\\");
			Term.Operator op = t.text.equals("*") ? Term.Operator.MULTIPLY
					: t.text.equals("/") ? Term.Operator.DIVIDE : Term.Operator.MODULO;
			Term rhs = parseUnaryTerm(sorted);
			lhs = new Term.BinaryOperation(op, lhs, rhs, sourceAttr(start, index - 1));
		}
		return lhs;
	}

	private Term parseUnaryTerm(boolean sorted) {
		int start = index;
		if (lookahead("-")) {
			match("-");
			if (index < tokens.size() && tokens.get(index) instanceof Int) {
				int value = match(Int.class, "an integer").value;
				return new Term.IntegerConstant(-value, sourceAttr(start, index - 1));
			}
			Term operand = parseUnaryTerm(sorted);
			return new Term.BinaryOperation(Term.Operator.SUBTRACT, new Term.IntegerConstant(0), operand,
					sourceAttr(start, index - 1));
		}
		return parsePrimaryTerm(sorted);
	}

	private Term parsePrimaryTerm(boolean sorted) {
		checkNotEof();
		int start = index;
		Token lookahead = tokens.get(index);
		if (lookahead instanceof Int) {
			int value = match(Int.class, "an integer").value;
			return new Term.IntegerConstant(value, sourceAttr(start, index - 1));
		} else if (lookahead.text.equals("#inf") || lookahead.text.equals("#infimum")) {
			index = index + 1;
			return new Term.Infimum(sourceAttr(start, index - 1));
		} else if (lookahead.text.equals("#sup") || lookahead.text.equals("#supremum")) {
			index = index + 1;
			return new Term.Supremum(sourceAttr(start, index - 1));
		} else if (lookahead.text.equals("(")) {
			match("(");
			Term t = parseTerm(sorted);
			match(")");
			return t;
		} else if (lookahead instanceof Identifier && ((Identifier) lookahead).isVariable()) {
			return parseVariable(sorted);
		}
		Identifier name = matchIdentifier();
		String annotation = name.annotation();
		if (annotation == null) {
			return new Term.SymbolicConstant(name.text, sourceAttr(start, index - 1));
		} else if (!sorted) {
			syntaxError("sort annotations are not permitted here", name);
		}
		return new Term.Placeholder(name.name(), sort(annotation, name), sourceAttr(start, index - 1));
	}

	private Term.Variable parseVariable(boolean sorted) {
		int start = index;
		Identifier name = matchIdentifier();
		if (!name.isVariable()) {
			syntaxError("variable expected", name);
		}
		String annotation = name.annotation();
		if (annotation != null && !sorted) {
			syntaxError("sort annotations are not permitted here", name);
		}
		String variable = name.name();
		if (variable.equals("_")) {
			// each anonymous variable is distinct
			anonymous = anonymous + 1;
			variable = "Anon" + anonymous;
		}
		Sort sort = annotation == null ? Sort.GENERAL : sort(annotation, name);
		return new Term.Variable(variable, sort, sourceAttr(start, index - 1));
	}

	private Sort sort(String annotation, Token t) {
		switch (annotation) {
		case "":
		case "i":
			return Sort.INTEGER;
		case "s":
			return Sort.SYMBOL;
		case "g":
			return Sort.GENERAL;
		default:
			syntaxError("unknown sort annotation '$" + annotation + "'", t);
			return null; // unreachable
		}
	}

	// =============================================================================
	// Helpers
	// =============================================================================

	private static final String[] relations = { "=", "!=", "<", "<=", ">", ">=" };
	private static final String[] arithmetic = { "+", "-", "*", "/", "\\", ".." };

	private static boolean isRelation(Token t) {
		if (t instanceof Lexer.Operator) {
			for (String r : relations) {
				if (r.equals(t.text)) {
					return true;
				}
			}
		}
		return false;
	}

	/**
	 * Check whether the next token continues a term into a comparison, i.e. is
	 * a relation or an arithmetic operator.
	 */
	private boolean isTermContinuation() {
		if (index >= tokens.size()) {
			return false;
		}
		Token t = tokens.get(index);
		if (isRelation(t)) {
			return true;
		}
		for (String a : arithmetic) {
			if (a.equals(t.text)) {
				return true;
			}
		}
		return false;
	}

	private boolean lookahead(String text) {
		return index < tokens.size() && tokens.get(index).text.equals(text);
	}

	private void checkNotEof() {
		if (index >= tokens.size()) {
			int end = text.length() - 1;
			throw new SyntaxError("unexpected end-of-file", sourcefile, text, end, end);
		}
	}

	private Token match(String op) {
		checkNotEof();
		Token t = tokens.get(index);
		if (!t.text.equals(op)) {
			syntaxError("expecting '" + op + "', found '" + t.text + "'", t);
		}
		index = index + 1;
		return t;
	}

	private Token match(String... options) {
		checkNotEof();
		Token t = tokens.get(index);
		for (int i = 0; i != options.length; ++i) {
			if (t.text.equals(options[i])) {
				index = index + 1;
				return t;
			}
		}
		String s = "";
		for (int i = 0; i != options.length; ++i) {
			if (i != 0) {
				s += " or ";
			}
			s += "'" + options[i] + "'";
		}
		syntaxError("expecting " + s + ", found '" + t.text + "'", t);
		return null;
	}

	@SuppressWarnings("unchecked")
	private <T extends Token> T match(Class<T> c, String name) {
		checkNotEof();
		Token t = tokens.get(index);
		if (!c.isInstance(t)) {
			syntaxError("expecting " + name + ", found '" + t.text + "'", t);
		}
		index = index + 1;
		return (T) t;
	}

	private Identifier matchIdentifier() {
		checkNotEof();
		Token t = tokens.get(index);
		if (t instanceof Identifier) {
			Identifier i = (Identifier) t;
			index = index + 1;
			return i;
		}
		syntaxError("identifier expected, found '" + t.text + "'", t);
		return null; // unreachable.
	}

	private Attribute.Source sourceAttr(int start, int end) {
		Token t1 = tokens.get(start);
		Token t2 = tokens.get(Math.max(start, end));
		return new Attribute.Source(t1.start, t2.end());
	}

	private void syntaxError(String msg, Token t) {
		throw new SyntaxError(msg, sourcefile, text, t.start, t.end());
	}
}
