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
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * A command-line option. Options are either flags (e.g.
 * <code>--verbose</code>) or take a single value (e.g.
 * <code>--time-limit 30</code> or <code>--time-limit=30</code>). Options may be
 * given anywhere on the command line, and are removed from it when parsed.
 *
 * @author David J. Pearce
 *
 */
public class OptArg {
	/**
	 * The kind of value an option accepts.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Kind {
		Object process(String arg, String value);
	}

	public static final Kind STRING = new Kind() {
		@Override
		public Object process(String arg, String value) {
			return value;
		}

		@Override
		public String toString() {
			return "<string>";
		}
	};

	public static final Kind INT = new Kind() {
		@Override
		public Object process(String arg, String value) {
			try {
				return Integer.parseInt(value);
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("invalid integer for --" + arg + ": " + value, e);
			}
		}

		@Override
		public String toString() {
			return "<n>";
		}
	};

	/**
	 * A comma-separated list of strings, such as <code>a,b,c</code>.
	 */
	public static final Kind STRINGLIST = new Kind() {
		@Override
		public Object process(String arg, String value) {
			return ImmutableList.copyOf(Splitter.on(',').trimResults().omitEmptyStrings().split(value));
		}

		@Override
		public String toString() {
			return "<s1,s2,...>";
		}
	};

	/**
	 * A string drawn from a fixed set of choices.
	 *
	 * @param choices
	 * @return
	 */
	public static Kind CHOICE(String... choices) {
		return new Kind() {
			@Override
			public Object process(String arg, String value) {
				for (String c : choices) {
					if (c.equals(value)) {
						return value;
					}
				}
				throw new IllegalArgumentException("invalid value for --" + arg + ": " + value + " (expected "
						+ String.join("|", choices) + ")");
			}

			@Override
			public String toString() {
				return String.join("|", choices);
			}
		};
	}

	public final String option;
	public final String shortForm;
	public final Kind argument;
	public final String description;
	public final Object defaultValue;

	/**
	 * Construct a flag with no short form.
	 */
	public OptArg(String option, String description) {
		this(option, null, null, description, null);
	}

	/**
	 * Construct a flag.
	 */
	public OptArg(String option, String shortForm, String description) {
		this(option, shortForm, null, description, null);
	}

	public OptArg(String option, Kind argument, String description) {
		this(option, null, argument, description, null);
	}

	public OptArg(String option, String shortForm, Kind argument, String description) {
		this(option, shortForm, argument, description, null);
	}

	public OptArg(String option, Kind argument, String description, Object defaultValue) {
		this(option, null, argument, description, defaultValue);
	}

	/**
	 * Construct an option which accepts a value.
	 *
	 * @param option
	 *            The long name, given as <code>--option</code>.
	 * @param shortForm
	 *            The short name, given as <code>-s</code> (may be null).
	 * @param argument
	 *            The kind of value accepted, or null for a flag.
	 * @param description
	 * @param defaultValue
	 *            The value used when the option is not given (may be null).
	 */
	public OptArg(String option, String shortForm, Kind argument, String description, Object defaultValue) {
		this.option = option;
		this.shortForm = shortForm;
		this.argument = argument;
		this.description = description;
		this.defaultValue = defaultValue;
	}

	public boolean isFlag() {
		return argument == null;
	}

	@Override
	public String toString() {
		String s = "--" + option;
		if (argument != null) {
			s += " " + argument;
		}
		return s;
	}

	/**
	 * Parse the options from a list of command-line arguments. Every recognised
	 * option (and its value) is removed from the list, leaving only the
	 * positional arguments. Options not given take their default value (if
	 * any); flags which are given map to <code>true</code>. The argument
	 * <code>--</code> ends option processing.
	 *
	 * @param args
	 * @param options
	 * @return
	 */
	public static Map<String, Object> parseOptions(List<String> args, OptArg... options) {
		HashMap<String, Object> result = new HashMap<>();
		HashMap<String, OptArg> lookup = new HashMap<>();
		for (OptArg opt : options) {
			if (opt.defaultValue != null) {
				result.put(opt.option, opt.defaultValue);
			}
			lookup.put("--" + opt.option, opt);
			if (opt.shortForm != null) {
				lookup.put("-" + opt.shortForm, opt);
			}
		}
		Iterator<String> iter = args.iterator();
		boolean done = false;
		while (iter.hasNext()) {
			String arg = iter.next();
			if (done || !arg.startsWith("-") || arg.equals("-")) {
				continue;
			}
			iter.remove();
			if (arg.equals("--")) {
				done = true;
				continue;
			}
			String value = null;
			int eq = arg.indexOf('=');
			if (arg.startsWith("--") && eq > 0) {
				value = arg.substring(eq + 1);
				arg = arg.substring(0, eq);
			}
			OptArg opt = lookup.get(arg);
			if (opt == null) {
				throw new IllegalArgumentException("unknown command-line option: " + arg);
			} else if (opt.isFlag()) {
				if (value != null) {
					throw new IllegalArgumentException("option " + arg + " takes no value");
				}
				result.put(opt.option, true);
			} else {
				if (value == null) {
					if (!iter.hasNext()) {
						throw new IllegalArgumentException("missing value for option " + arg);
					}
					value = iter.next();
					iter.remove();
				}
				result.put(opt.option, opt.argument.process(opt.option, value));
			}
		}
		return result;
	}

	/**
	 * Print a summary of the given options.
	 *
	 * @param out
	 * @param options
	 */
	public static void usage(PrintStream out, OptArg... options) {
		int width = 0;
		for (OptArg opt : options) {
			width = Math.max(width, opt.toString().length());
		}
		for (OptArg opt : options) {
			String s = opt.toString();
			StringBuilder line = new StringBuilder("  ");
			line.append(opt.shortForm == null ? "    " : "-" + opt.shortForm + ", ");
			line.append(s);
			for (int i = s.length(); i < width + 2; ++i) {
				line.append(' ');
			}
			line.append(opt.description);
			if (opt.defaultValue != null) {
				line.append(" (default ").append(opt.defaultValue).append(")");
			}
			out.println(line);
		}
	}
}
