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

/**
 * A Syntactic Element represents any part of a program, specification or user
 * guide which is relevant to its syntactic structure, and in particular parts
 * we may wish to attach information to (e.g. source spans). Attributes never
 * participate in structural equality.
 *
 * @author David J. Pearce
 */
public interface SyntacticElement {

	/**
	 * Get the list of attributes associated with this syntactic element.
	 *
	 * @return
	 */
	public Attribute[] attributes();

	/**
	 * Get the first attribute of the given class type. This is useful short-hand.
	 *
	 * @param c
	 * @return
	 */
	public <T extends Attribute> T attribute(Class<T> c);

	public class Impl implements SyntacticElement {
		private static final Attribute[] NONE = new Attribute[0];

		private final Attribute[] attributes;

		public Impl(Attribute[] attributes) {
			this.attributes = attributes == null ? NONE : attributes;
		}

		@Override
		public Attribute[] attributes() {
			return attributes;
		}

		@Override
		@SuppressWarnings("unchecked")
		public <T extends Attribute> T attribute(Class<T> c) {
			for (Attribute a : attributes) {
				if (c.isInstance(a)) {
					return (T) a;
				}
			}
			return null;
		}
	}

	/**
	 * Represents an attribute that can be associated with a syntactic element.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Attribute {

		/**
		 * Identifies the span of characters in the source text from which an
		 * element was parsed.
		 */
		public static class Source implements Attribute {

			public final int start;
			public final int end;

			public Source(int start, int end) {
				this.start = start;
				this.end = end;
			}

			@Override
			public String toString() {
				return "@" + start + ":" + end;
			}
		}

		/**
		 * Identifies the file (and its text) from which an element was parsed,
		 * such that diagnostics raised long after parsing can still point back
		 * into the source.
		 */
		public static class Origin implements Attribute {
			public final String filename;
			public final String text;

			public Origin(String filename, String text) {
				this.filename = filename;
				this.text = text;
			}

			@Override
			public String toString() {
				return filename;
			}
		}
	}
}
