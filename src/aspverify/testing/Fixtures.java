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
package aspverify.testing;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;

import com.google.common.io.Resources;

import aspverify.core.Program;
import aspverify.core.Specification;
import aspverify.core.UserGuide;
import aspverify.io.Parser;

/**
 * Loads the example programs, specifications, user guides and proof outlines
 * from the test classpath.
 *
 * @author David J. Pearce
 *
 */
public class Fixtures {

	public static String text(String name) {
		try {
			return Resources.toString(Resources.getResource(name), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	/**
	 * Get the location of a fixture on disk, for use on the command line.
	 *
	 * @param name
	 * @return
	 */
	public static String path(String name) {
		URL url = Resources.getResource(name);
		try {
			return new File(url.toURI()).getPath();
		} catch (URISyntaxException e) {
			throw new IllegalArgumentException(e);
		}
	}

	public static Program program(String name) {
		return new Parser(name, text(name)).parseProgram();
	}

	public static Specification specification(String name) {
		return new Parser(name, text(name)).parseSpecification();
	}

	public static UserGuide guide(String name) {
		return new Parser(name, text(name)).parseUserGuide();
	}
}
