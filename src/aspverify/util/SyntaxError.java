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
 * This exception is thrown when a syntax error occurs in the lexer or parser.
 *
 * @author David J. Pearce
 */
public class SyntaxError extends RuntimeException {

	private final String msg;
	private final String filename;
	private final String text;
	private final int start;
	private final int end;

	/**
	 * Identify a syntax error at a particular point in a file.
	 *
	 * @param msg
	 *            Message detailing the problem.
	 * @param filename
	 *            The source file this error is referring to (may be null).
	 * @param text
	 *            The source text this error is referring to (may be null).
	 * @param start
	 *            Index of first character of offending location.
	 * @param end
	 *            Index of last character of offending location.
	 */
	public SyntaxError(String msg, String filename, String text, int start, int end) {
		this.msg = msg;
		this.filename = filename;
		this.text = text;
		this.start = start;
		this.end = end;
	}

	@Override
	public String getMessage() {
		if (msg != null) {
			return msg;
		} else {
			return "";
		}
	}

	/**
	 * Filename for file where the error arose.
	 *
	 * @return
	 */
	public String filename() {
		return filename;
	}

	/**
	 * Get index of first character of offending location.
	 *
	 * @return
	 */
	public int start() {
		return start;
	}

	/**
	 * Get index of last character of offending location.
	 *
	 * @return
	 */
	public int end() {
		return end;
	}

	/**
	 * Output the syntax error to a given output stream.
	 */
	public void outputSourceError(PrintStream output) {
		outputSourceError(output, "syntax error", getMessage(), filename, text, start, end);
	}

	/**
	 * Print a diagnostic pointing into some source text, highlighting the
	 * offending span with carets. Where no source text is available, only the
	 * message is printed.
	 */
	static void outputSourceError(PrintStream output, String kind, String message, String filename, String text,
			int start, int end) {
		String prefix = filename == null ? "" : filename + ":";
		if (text == null || start < 0) {
			output.println(prefix + kind + ": " + message);
			return;
		}
		int line = 0;
		int lineStart = 0;
		int lineEnd = 0;
		while (lineEnd < text.length() && lineEnd <= start) {
			lineStart = lineEnd;
			lineEnd = parseLine(text, lineEnd);
			line = line + 1;
		}
		lineEnd = Math.min(lineEnd, text.length());
		output.println(prefix + line + ": " + message);
		String str = text.substring(lineStart, lineEnd);
		if (str.endsWith("\n")) {
			output.print(str);
		} else {
			output.println(str);
		}
		StringBuilder marker = new StringBuilder();
		for (int i = lineStart; i < start; ++i) {
			marker.append(text.charAt(i) == '\t' ? '\t' : ' ');
		}
		// clip the marker to the end of the first line
		int last = Math.min(end, lineEnd - 1);
		for (int i = start; i <= Math.max(start, last); ++i) {
			marker.append('^');
		}
		output.println(marker);
	}

	private static int parseLine(String text, int index) {
		while (index < text.length() && text.charAt(index) != '\n') {
			index++;
		}
		return index + 1;
	}

	public static final long serialVersionUID = 1l;

	public static void syntaxError(String msg, SyntacticElement elem) {
		int start = -1;
		int end = -1;
		String filename = null;
		String text = null;
		Attribute.Source attr = elem.attribute(Attribute.Source.class);
		if (attr != null) {
			start = attr.start;
			end = attr.end;
		}
		Attribute.Origin origin = elem.attribute(Attribute.Origin.class);
		if (origin != null) {
			filename = origin.filename;
			text = origin.text;
		}
		throw new SyntaxError(msg, filename, text, start, end);
	}
}
