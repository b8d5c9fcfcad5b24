package latticeflow.util;

import java.util.Map;

/**
 * Utilities for TTY formatting.
 */
public final class Tty {
	/** Whether we are attached to a console. */
	public static final boolean IS_A_TTY = System.console() != null;

	private static final Map<String, String> ESCAPES = Map.ofEntries(
		Map.entry("<b>", "\033[1m"),
		Map.entry("</b>", "\033[22m"),

		Map.entry("<i>", "\033[3m"),
		Map.entry("</i>", "\033[23m"),

		Map.entry("<fg=gray>", "\033[90m"),
		Map.entry("<fg=red>", "\033[31m"),
		Map.entry("<fg=yellow>", "\033[33m"),
		Map.entry("<fg=cyan>", "\033[36m"),
		Map.entry("</fg>", "\033[39m")
	);

	private Tty() {
	}

	/**
	 * Replace markup tags with terminal escapes, or strip them.
	 *
	 * @param markup
	 *            Text with tags like {@code <b>} or {@code <fg=red>}.
	 * @param colors
	 *            Whether to emit escape sequences.
	 * @return The rendered text.
	 */
	public static String render(String markup, boolean colors) {
		var ret = markup;
		for (var escape : ESCAPES.entrySet()) {
			ret = ret.replace(escape.getKey(), colors ? escape.getValue() : "");
		}
		return ret;
	}
}
