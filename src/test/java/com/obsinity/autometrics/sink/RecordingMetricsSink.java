package com.obsinity.autometrics.sink;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.obsinity.autometrics.labels.LabelSet;

/** Test sink that keeps every emission in memory. */
public class RecordingMetricsSink implements MetricsSink {

	public enum Kind {
		HISTOGRAM,
		COUNTER
	}

	public record Emission(Kind kind, String name, double value, LabelSet labels) {}

	private final List<Emission> emissions = new CopyOnWriteArrayList<>();

	@Override
	public void recordHistogram(String name, double value, LabelSet labels) {
		emissions.add(new Emission(Kind.HISTOGRAM, name, value, labels));
	}

	@Override
	public void incrementCounter(String name, LabelSet labels) {
		emissions.add(new Emission(Kind.COUNTER, name, 1, labels));
	}

	public List<Emission> all() {
		return List.copyOf(emissions);
	}

	public List<Emission> histograms() {
		return emissions.stream().filter(e -> e.kind() == Kind.HISTOGRAM).toList();
	}

	public List<Emission> counters() {
		return emissions.stream().filter(e -> e.kind() == Kind.COUNTER).toList();
	}

	/** Completion callbacks of suspending methods may run after the caller has seen the value. */
	public boolean awaitCounters(int count, Duration timeout) throws InterruptedException {
		long deadline = System.nanoTime() + timeout.toNanos();
		while (counters().size() < count) {
			if (System.nanoTime() > deadline) return false;
			Thread.sleep(5);
		}
		return true;
	}

	public void clear() {
		emissions.clear();
	}
}
