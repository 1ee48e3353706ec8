package com.obsinity.autometrics.config;

import java.util.Objects;

/**
 * One keyed argument as supplied on an instrumentation annotation, e.g. {@code name = "req_latency"}.
 */
public record AnnotationArgument(String key, Object value) {

	public AnnotationArgument {
		Objects.requireNonNull(key, "key");
	}

	@Override
	public String toString() {
		return (value instanceof String s) ? key + " = \"" + s + "\"" : key + " = " + value;
	}
}
