package com.obsinity.autometrics.labels;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Immutable, insertion-ordered label key to label value mapping attached to one emission.
 */
public final class LabelSet {

	private static final LabelSet EMPTY = new LabelSet(Map.of());

	private final Map<String, String> labels;

	private LabelSet(Map<String, String> labels) {
		this.labels = labels;
	}

	public static LabelSet empty() {
		return EMPTY;
	}

	public static LabelSet of(String key, String value) {
		Map<String, String> m = new LinkedHashMap<>(2);
		m.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
		return new LabelSet(Collections.unmodifiableMap(m));
	}

	/** Copies {@code labels}, keeping its iteration order. */
	public static LabelSet of(Map<String, String> labels) {
		if (labels == null || labels.isEmpty()) return EMPTY;
		Map<String, String> m = new LinkedHashMap<>(labels.size() * 2);
		labels.forEach((k, v) -> m.put(Objects.requireNonNull(k, "key"), Objects.requireNonNull(v, "value")));
		return new LabelSet(Collections.unmodifiableMap(m));
	}

	/** Returns a new set with {@code key} added (or replaced in place). */
	public LabelSet with(String key, String value) {
		Map<String, String> m = new LinkedHashMap<>(labels);
		m.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
		return new LabelSet(Collections.unmodifiableMap(m));
	}

	public String get(String key) {
		return labels.get(key);
	}

	public boolean isEmpty() {
		return labels.isEmpty();
	}

	public int size() {
		return labels.size();
	}

	public void forEach(BiConsumer<String, String> action) {
		labels.forEach(action);
	}

	/** @return an unmodifiable ordered view */
	public Map<String, String> asMap() {
		return labels;
	}

	@Override
	public boolean equals(Object o) {
		return (o instanceof LabelSet other) && labels.equals(other.labels);
	}

	@Override
	public int hashCode() {
		return labels.hashCode();
	}

	@Override
	public String toString() {
		return labels.toString();
	}
}
