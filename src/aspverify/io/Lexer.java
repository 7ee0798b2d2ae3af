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

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import aspverify.util.SyntaxError;

/**
 * Responsible for turning a stream of characters into a sequence of tokens.
 * The same lexer serves logic programs, first-order formulas, user guides and
 * proof outlines.
 *
 * @author David J. Pearce
 *
 */
public class Lexer {

	private final String filename;
	private final String input;
	private int pos;

	public Lexer(String filename) throws IOException {
		this(filename, new InputStreamReader(new FileInputStream(filename), "UTF8"));
	}

	public Lexer(String filename, Reader reader) throws IOException {
		BufferedReader in = new BufferedReader(reader);

		StringBuilder text = new StringBuilder();
		String tmp;
		while ((tmp = in.readLine()) != null) {
			text.append(tmp);
			text.append("\n");
		}

		this.filename = filename;
		this.input = text.toString();
	}

	/**
	 * Construct a lexer for some text held in memory.
	 *
	 * @param filename
	 *            Name used when reporting errors (may be null).
	 * @param text
	 */
	public Lexer(String filename, String text) {
		this.filename = filename;
		this.input = text;
	}

	public String filename() {
		return filename;
	}

	public String text() {
		return input;
	}

	/**
	 * Scan all characters from the input stream and generate a corresponding
	 * list of tokens, whilst discarding all whitespace and comments.
	 *
	 * @return
	 */
	public List<Token> scan() {
		ArrayList<Token> tokens = new ArrayList<>();
		pos = 0;

		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (Character.isDigit(c)) {
				tokens.add(scanNumericConstant());
			} else if (c == '%' && (pos + 1) < input.length() && input.charAt(pos + 1) == '*') {
				scanBlockComment();
			} else if (c == '%') {
				scanLineComment();
			} else if (c == '#') {
				tokens.add(scanDirective());
			} else if (isOperatorStart(c)) {
				tokens.add(scanOperator());
			} else if (Character.isLetter(c) || c == '_') {
				tokens.add(scanIdentifier());
			} else if (Character.isWhitespace(c)) {
				skipWhitespace();
			} else {
				syntaxError("syntax error");
			}
		}

		return tokens;
	}

	/**
	 * Scan a numeric constant. That is a sequence of digits which gives an
	 * integer constant.
	 *
	 * @return
	 */
	public Token scanNumericConstant() {
		int start = pos;
		while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
			pos = pos + 1;
		}
		BigInteger r = new BigInteger(input.substring(start, pos));
		if (r.bitLength() >= 32) {
			throw new SyntaxError("integer constant too large", filename, input, start, pos - 1);
		}
		return new Int(r.intValue(), input.substring(start, pos), start);
	}

	/**
	 * Operators in order of decreasing length, such that the longest match is
	 * always found first.
	 */
	static final String[] operators = { "<->", ":-", "<-", "->", "<=", ">=", "!=", "..", "(", ")", "{", "}", "[",
			"]", ",", ".", ":", ";", "=", "<", ">", "+", "-", "*", "/", "\\" };

	public boolean isOperatorStart(char c) {
		for (String o : operators) {
			if (c == o.charAt(0)) {
				return true;
			}
		}
		return false;
	}

	public Token scanOperator() {
		for (String o : operators) {
			if (input.startsWith(o, pos)) {
				Token t = new Operator(o, pos);
				pos += o.length();
				return t;
			}
		}
		syntaxError("unknown operator encountered: " + input.charAt(pos));
		return null;
	}

	public static final String[] keywords = { "not", "and", "or", "forall", "exists" };

	/**
	 * Scan an identifier, which may carry a sort annotation such as
	 * <code>N$i</code> or <code>X$</code>.
	 *
	 * @return
	 */
	public Token scanIdentifier() {
		int start = pos;
		while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
			pos++;
		}
		if (pos < input.length() && input.charAt(pos) == '$') {
			pos++;
			while (pos < input.length() && Character.isLetter(input.charAt(pos))) {
				pos++;
			}
		}
		String text = input.substring(start, pos);

		// now, check for keywords
		for (String keyword : keywords) {
			if (keyword.equals(text)) {
				return new Keyword(text, start);
			}
		}

		// otherwise, must be identifier
		return new Identifier(text, start);
	}

	/**
	 * Scan a keyword beginning with a hash, such as <code>#true</code> or
	 * <code>#show</code>.
	 *
	 * @return
	 */
	public Token scanDirective() {
		int start = pos++;
		while (pos < input.length() && Character.isLetter(input.charAt(pos))) {
			pos++;
		}
		if (pos == start + 1) {
			syntaxError("directive expected");
		}
		return new Keyword(input.substring(start, pos), start);
	}

	private static boolean isIdentifierPart(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '\'';
	}

	public void scanLineComment() {
		while (pos < input.length() && input.charAt(pos) != '\n') {
			pos++;
		}
	}

	public void scanBlockComment() {
		while ((pos + 1) < input.length() && (input.charAt(pos) != '*' || input.charAt(pos + 1) != '%')) {
			pos++;
		}
		pos++;
		pos++;
	}

	/**
	 * Skip over any whitespace at the current index position in the input
	 * string.
	 */
	public void skipWhitespace() {
		while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
			pos++;
		}
	}

	/**
	 * Raise a syntax error with a given message at the current index.
	 *
	 * @param msg
	 */
	private void syntaxError(String msg) {
		throw new SyntaxError(msg, filename, input, pos, pos);
	}

	/**
	 * The base class for all tokens.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static abstract class Token {

		public final String text;
		public final int start;

		public Token(String text, int pos) {
			this.text = text;
			this.start = pos;
		}

		public int end() {
			return start + text.length() - 1;
		}

		@Override
		public String toString() {
			return text;
		}
	}

	/**
	 * Represents an integer constant. That is, a sequence of 1 or more digits.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Int extends Token {

		public final int value;

		public Int(int r, String text, int pos) {
			super(text, pos);
			value = r;
		}
	}

	/**
	 * Represents a variable, constant or predicate name. That is, an
	 * alphabetic character (or '_'), followed by a sequence of zero or more
	 * alpha-numeric characters, and an optional sort annotation.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Identifier extends Token {

		public Identifier(String text, int pos) {
			super(text, pos);
		}

		/**
		 * Check whether this identifier names a variable (i.e. begins with an
		 * uppercase letter or an underscore).
		 *
		 * @return
		 */
		public boolean isVariable() {
			char c = text.charAt(0);
			return Character.isUpperCase(c) || c == '_';
		}

		/**
		 * Get the identifier without any sort annotation.
		 *
		 * @return
		 */
		public String name() {
			int i = text.indexOf('$');
			return i < 0 ? text : text.substring(0, i);
		}

		/**
		 * Get the sort annotation (without the dollar), or null if there is
		 * none.
		 *
		 * @return
		 */
		public String annotation() {
			int i = text.indexOf('$');
			return i < 0 ? null : text.substring(i + 1);
		}
	}

	/**
	 * Represents a known keyword. In essence, a keyword is a sequence of one or
	 * more alphabetic characters which is defined in advance.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Keyword extends Token {

		public Keyword(String text, int pos) {
			super(text, pos);
		}
	}

	/**
	 * Represents an operator or punctuation symbol.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Operator extends Token {
		public Operator(String text, int pos) {
			super(text, pos);
		}
	}
}
