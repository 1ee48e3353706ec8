package com.obsinity.autometrics.naming;

import com.obsinity.autometrics.config.InstrumentationConfig;

/**
 * Computes {@link MetricNames} from an explicit base name or, failing that, from the declaration path.
 *
 * <p>The path's separator is replaced with a single underscore; nothing else is escaped. Whether the result is a
 * valid metric name is left to the backend.
 */
public final class MetricNameDeriver {

	static final String BASE_SEPARATOR = "_";

	private MetricNameDeriver() {}

	public static MetricNames derive(InstrumentationConfig config, DeclarationPath path) {
		return MetricNames.fromBase(baseName(config, path));
	}

	public static String baseName(InstrumentationConfig config, DeclarationPath path) {
		return config.explicitBaseName().orElseGet(() -> path.join(BASE_SEPARATOR));
	}
}
