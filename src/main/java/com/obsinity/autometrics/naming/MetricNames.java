package com.obsinity.autometrics.naming;

import java.util.Objects;

/**
 * Counter and histogram identifiers of one instrumented method. Both always share one base.
 */
public record MetricNames(String counterName, String histogramName) {

	public static final String COUNTER_SUFFIX = "_total";
	public static final String HISTOGRAM_SUFFIX = "_duration_seconds";

	public MetricNames {
		Objects.requireNonNull(counterName, "counterName");
		Objects.requireNonNull(histogramName, "histogramName");
		if (!counterName.endsWith(COUNTER_SUFFIX) || !histogramName.endsWith(HISTOGRAM_SUFFIX)) {
			throw new IllegalArgumentException("metric names must end with " + COUNTER_SUFFIX + " and "
					+ HISTOGRAM_SUFFIX + ": " + counterName + ", " + histogramName);
		}
		String stem = counterName.substring(0, counterName.length() - COUNTER_SUFFIX.length());
		if (!histogramName.equals(stem + HISTOGRAM_SUFFIX)) {
			throw new IllegalArgumentException(
					"counter and histogram names must share one base: " + counterName + ", " + histogramName);
		}
	}

	public static MetricNames fromBase(String base) {
		return new MetricNames(base + COUNTER_SUFFIX, base + HISTOGRAM_SUFFIX);
	}

	/** @return the common stem of both names */
	public String baseName() {
		return counterName.substring(0, counterName.length() - COUNTER_SUFFIX.length());
	}
}
