package com.obsinity.autometrics.sink;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import com.obsinity.autometrics.labels.LabelSet;

/**
 * Emits through the OpenTelemetry metrics API. Instruments are created on first use of a name and reused.
 *
 * <p>Histograms are in seconds and advise second-scaled bucket boundaries; the SDK defaults are millisecond-scaled.
 */
public class OpenTelemetryMetricsSink implements MetricsSink {

	static final List<Double> SECONDS_BUCKETS =
			List.of(0.005, 0.01, 0.025, 0.05, 0.075, 0.1, 0.25, 0.5, 0.75, 1.0, 2.5, 5.0, 7.5, 10.0);

	private final Meter meter;
	private final ConcurrentMap<String, DoubleHistogram> histograms = new ConcurrentHashMap<>();
	private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();

	public OpenTelemetryMetricsSink(Meter meter) {
		this.meter = meter;
	}

	@Override
	public void recordHistogram(String name, double value, LabelSet labels) {
		histograms.computeIfAbsent(name, n -> meter.histogramBuilder(n)
						.setUnit("s")
						.setDescription("Duration of calls instrumented with @Autometrics")
						.setExplicitBucketBoundariesAdvice(SECONDS_BUCKETS)
						.build())
				.record(value, toAttributes(labels));
	}

	@Override
	public void incrementCounter(String name, LabelSet labels) {
		counters.computeIfAbsent(name, n -> meter.counterBuilder(n)
						.setDescription("Calls instrumented with @Autometrics")
						.build())
				.add(1L, toAttributes(labels));
	}

	static Attributes toAttributes(LabelSet labels) {
		if (labels == null || labels.isEmpty()) return Attributes.empty();
		AttributesBuilder b = Attributes.builder();
		labels.forEach((k, v) -> b.put(k, v));
		return b.build();
	}
}
