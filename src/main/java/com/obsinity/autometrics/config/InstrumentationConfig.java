package com.obsinity.autometrics.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Validated instrumentation arguments. An empty {@code explicitBaseName} means the base name is derived from the
 * declaration path.
 */
public record InstrumentationConfig(Optional<String> explicitBaseName) {

	private static final InstrumentationConfig DERIVED = new InstrumentationConfig(Optional.empty());

	public InstrumentationConfig {
		Objects.requireNonNull(explicitBaseName, "explicitBaseName");
	}

	public static InstrumentationConfig derived() {
		return DERIVED;
	}

	public static InstrumentationConfig named(String baseName) {
		return new InstrumentationConfig(Optional.of(baseName));
	}
}
