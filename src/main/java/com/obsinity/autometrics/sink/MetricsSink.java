package com.obsinity.autometrics.sink;

import com.obsinity.autometrics.labels.LabelSet;

/**
 * Receives the two emissions of every instrumented call. Implementations should not block; anything they throw is
 * logged and dropped by the caller.
 */
public interface MetricsSink {

	/** Observe {@code value} (seconds) on histogram {@code name}. */
	void recordHistogram(String name, double value, LabelSet labels);

	/** Add one to counter {@code name}. */
	void incrementCounter(String name, LabelSet labels);
}
