package latticeflow.util;

import latticeflow.LatticeConfig;

import com.google.common.base.Throwables;

import java.util.Locale;

/**
 * Simple logging class with formatting support.
 */
public final class Log {
	/**
	 * Available log levels.
	 */
	public enum Level {
		TRACE,
		DEBUG,
		INFO,
		WARN,
		ERROR;

		/**
		 * @return Whether this log level is enabled.
		 */
		public boolean isEnabled() {
			return this.ordinal() >= LEVEL.ordinal();
		}

		/**
		 * @return The level with the given (case-insensitive) name, or INFO
		 *         if there is none.
		 */
		public static Level parse(String name) {
			if (name == null) {
				return INFO;
			}

			try {
				return valueOf(name.trim().toUpperCase(Locale.ROOT));
			} catch (IllegalArgumentException e) {
				return INFO;
			}
		}
	}

	/** The current log level (from $LATTICEFLOW_LOG_LEVEL). */
	public static final Level LEVEL = Level.parse(LatticeConfig.LOG_LEVEL);

	private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);
	private static final TtyLogger LOGGER = TtyLogger.INSTANCE;

	private Log() {
	}

	private static String getMessage(Throwable e) {
		return Throwables.getRootCause(e).getMessage();
	}

	public static void trace(String format, Object... args) {
		LOGGER.log(Level.TRACE, WALKER.getCallerClass(), String.format(format, args), null);
	}

	public static void trace(Throwable e) {
		LOGGER.log(Level.TRACE, WALKER.getCallerClass(), getMessage(e), e);
	}

	public static void debug(String format, Object... args) {
		LOGGER.log(Level.DEBUG, WALKER.getCallerClass(), String.format(format, args), null);
	}

	public static void debug(Throwable e) {
		LOGGER.log(Level.DEBUG, WALKER.getCallerClass(), getMessage(e), e);
	}

	public static void info(String format, Object... args) {
		LOGGER.log(Level.INFO, WALKER.getCallerClass(), String.format(format, args), null);
	}

	public static void info(Throwable e) {
		LOGGER.log(Level.INFO, WALKER.getCallerClass(), getMessage(e), e);
	}

	public static void warn(String format, Object... args) {
		LOGGER.log(Level.WARN, WALKER.getCallerClass(), String.format(format, args), null);
	}

	public static void warn(Throwable e) {
		LOGGER.log(Level.WARN, WALKER.getCallerClass(), getMessage(e), e);
	}

	public static void error(String format, Object... args) {
		LOGGER.log(Level.ERROR, WALKER.getCallerClass(), String.format(format, args), null);
	}

	public static void error(Throwable e) {
		LOGGER.log(Level.ERROR, WALKER.getCallerClass(), getMessage(e), e);
	}
}
