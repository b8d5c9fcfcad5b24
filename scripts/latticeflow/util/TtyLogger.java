package latticeflow.util;

import latticeflow.util.Log.Level;

import com.google.common.base.Throwables;

import java.io.PrintStream;

/**
 * Logging backend with colors.
 */
final class TtyLogger {
	static final TtyLogger INSTANCE = new TtyLogger(System.err);

	private final PrintStream out;

	TtyLogger(PrintStream out) {
		this.out = out;
	}

	private static String color(Level level) {
		switch (level) {
		case INFO:
			return "cyan";
		case WARN:
			return "yellow";
		case ERROR:
			return "red";
		default:
			return "gray";
		}
	}

	/**
	 * @return The markup for one line of a log message.
	 */
	static String format(Level level, String tag, String line) {
		var fg = "<fg=" + color(level) + ">";
		if (level.compareTo(Level.WARN) >= 0) {
			return fg + "<b>" + String.format("%-5s", level) + "</b> <i>" + String.format("%-20s", tag) + "</i> <b>" + line + "</b></fg>";
		} else {
			return fg + "<b>" + String.format("%-5s", level) + "</b> <i>" + String.format("%-20s", tag) + "</i></fg> " + line;
		}
	}

	void log(Level level, Class<?> src, String msg, Throwable e) {
		if (!level.isEnabled()) {
			return;
		}

		var tag = src == null ? "?" : src.getSimpleName();
		var fg = "<fg=" + color(level) + ">";

		// Avoid interleaved lines
		synchronized (this) {
			var str = String.valueOf(msg);
			if (str.contains("\n")) {
				print(format(level, tag, ""));
				str.lines()
					.forEach(line -> print(fg + line + "</fg>"));
			} else {
				print(format(level, tag, str));
			}

			if (e != null) {
				Throwables.getStackTraceAsString(e)
					.lines()
					.forEach(line -> print(fg + line + "</fg>"));
			}
		}
	}

	private void print(String markup) {
		this.out.println(Tty.render(markup, Tty.IS_A_TTY));
	}
}
