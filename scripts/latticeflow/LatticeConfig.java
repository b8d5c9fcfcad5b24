package latticeflow;

/**
 * LatticeFlow configuration.
 */
public final class LatticeConfig {
	/** Minimum level for log messages. */
	public static final String LOG_LEVEL = stringEnv("LATTICEFLOW_LOG_LEVEL", "INFO");

	/** Maximum number of samples checked by {@link LatticeLaws}. */
	public static final int MAX_LAW_SAMPLES = intEnv("LATTICEFLOW_MAX_LAW_SAMPLES", 16);

	private LatticeConfig() {
	}

	/**
	 * Get a string value from the environment.
	 */
	static String stringEnv(String var, String def) {
		return stringValue(System.getenv(var), def);
	}

	/**
	 * Get an integer value from the environment.
	 */
	static int intEnv(String var, int def) {
		return intValue(System.getenv(var), def);
	}

	static String stringValue(String value, String def) {
		if (value != null && !value.isEmpty()) {
			return value;
		} else {
			return def;
		}
	}

	static int intValue(String value, int def) {
		if (value != null && !value.isEmpty()) {
			return Integer.parseInt(value.trim());
		} else {
			return def;
		}
	}
}
