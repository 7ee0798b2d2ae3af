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
package aspverify.util;

import java.io.PrintStream;

import aspverify.util.SyntacticElement.Attribute;

/**
 * Thrown when well-formed input violates a structural requirement of the
 * pipeline (e.g. completing a theory which is not tight). Such errors are
 * always raised before any problem is handed to a prover and abort the whole
 * task.
 *
 * @author David J. Pearce
 *
 */
public class ValidationError extends RuntimeException {
	public enum Kind {
		/**
		 * A variable name is used at two different sorts within one scope.
		 */
		SORT_MISMATCH,
		/**
		 * A placeholder is declared (or used) at two different sorts.
		 */
		PLACEHOLDER_SORT_CONFLICT,
		/**
		 * Completion requested for a theory with a positive dependency cycle.
		 */
		NOT_TIGHT,
		/**
		 * Private predicates are defined recursively, or by a choice rule.
		 */
		PRIVATE_RECURSION,
		/**
		 * An assumption mentions an output predicate.
		 */
		OUTPUT_SYMBOL_IN_ASSUMPTION,
		/**
		 * A proof outline step is not of the required shape.
		 */
		MALFORMED_PROOF_OUTLINE,
		/**
		 * A formula given to completion is neither a rule nor a constraint.
		 */
		NOT_COMPLETABLE
	}

	private final Kind kind;
	private final SyntacticElement element;

	public ValidationError(Kind kind, String msg, SyntacticElement element) {
		super(msg);
		this.kind = kind;
		this.element = element;
	}

	public ValidationError(Kind kind, String msg) {
		this(kind, msg, null);
	}

	public Kind kind() {
		return kind;
	}

	/**
	 * The offending rule, formula or other element, if known.
	 *
	 * @return
	 */
	public SyntacticElement element() {
		return element;
	}

	/**
	 * Output this error to a given output stream, pointing into the source text
	 * where the offending element originates from a parsed file.
	 */
	public void outputSourceError(PrintStream output) {
		String kindName = kind.name().toLowerCase().replace('_', ' ');
		if (element == null) {
			SyntaxError.outputSourceError(output, kindName, getMessage(), null, null, -1, -1);
		} else {
			Attribute.Source span = element.attribute(Attribute.Source.class);
			Attribute.Origin origin = element.attribute(Attribute.Origin.class);
			String filename = origin == null ? null : origin.filename;
			String text = origin == null ? null : origin.text;
			int start = span == null ? -1 : span.start;
			int end = span == null ? -1 : span.end;
			SyntaxError.outputSourceError(output, kindName, getMessage() + " (in " + element + ")", filename, text,
					start, end);
		}
	}

	public static final long serialVersionUID = 1l;
}
