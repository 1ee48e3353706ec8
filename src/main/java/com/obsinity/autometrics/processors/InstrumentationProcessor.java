package com.obsinity.autometrics.processors;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

import lombok.RequiredArgsConstructor;
import org.aspectj.lang.ProceedingJoinPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsinity.autometrics.aspect.EvaluationMode;
import com.obsinity.autometrics.aspect.InstrumentedMethod;
import com.obsinity.autometrics.labels.LabelSet;
import com.obsinity.autometrics.sink.MetricsSink;

/**
 * Runs one instrumented call: start timer, evaluate, measure, label, emit, return.
 *
 * <p>For a {@link EvaluationMode#SUSPENDING} method the timer stops when the returned stage completes, so the
 * duration includes every suspension. The stage itself is returned to the caller untouched; the measurement is a
 * completion callback on it and adds no suspension point.
 *
 * <p>Exceptions from the body are measured, counted and rethrown unchanged. Failures in label extraction or in any
 * {@link MetricsSink} are logged and never reach the caller.
 */
@RequiredArgsConstructor
public class InstrumentationProcessor {

	private static final Logger log = LoggerFactory.getLogger(InstrumentationProcessor.class);

	private static final double NANOS_PER_SECOND = 1_000_000_000d;

	/** Every emission goes to each of these, histogram first, each call isolated from the others. */
	private final List<MetricsSink> sinks;

	public final Object proceed(ProceedingJoinPoint joinPoint, InstrumentedMethod plan) throws Throwable {
		final long startNanos = System.nanoTime();

		final Object produced;
		try {
			produced = joinPoint.proceed();
		} catch (Throwable t) {
			complete(plan, startNanos, failureLabels(plan, t));
			throw t;
		}

		if (plan.mode() == EvaluationMode.SUSPENDING && produced instanceof CompletionStage<?> stage) {
			observe(plan, startNanos, stage);
			return produced;
		}

		complete(plan, startNanos, valueLabels(plan, produced));
		return produced;
	}

	/* --------------------- suspending --------------------- */

	private void observe(InstrumentedMethod plan, long startNanos, CompletionStage<?> stage) {
		stage.whenComplete((value, error) -> {
			if (error == null) {
				complete(plan, startNanos, valueLabels(plan, value));
				return;
			}
			Throwable cause = unwrap(error);
			if (cause instanceof CancellationException) {
				log.debug("autometrics {} cancelled; not recorded", plan.names().counterName());
				return;
			}
			complete(plan, startNanos, failureLabels(plan, cause));
		});
	}

	private static Throwable unwrap(Throwable error) {
		Throwable t = error;
		while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
			t = t.getCause();
		}
		return t;
	}

	/* --------------------- measure + emit --------------------- */

	private void complete(InstrumentedMethod plan, long startNanos, LabelSet labels) {
		final double seconds = (System.nanoTime() - startNanos) / NANOS_PER_SECOND;
		emit(plan, seconds, labels);
	}

	protected void emit(InstrumentedMethod plan, double seconds, LabelSet labels) {
		if (sinks == null || sinks.isEmpty()) return;
		final String histogram = plan.names().histogramName();
		final String counter = plan.names().counterName();
		for (MetricsSink sink : sinks) {
			try {
				sink.recordHistogram(histogram, seconds, labels);
			} catch (RuntimeException e) {
				sinkFailed(sink, histogram, e);
			}
			try {
				sink.incrementCounter(counter, labels);
			} catch (RuntimeException e) {
				sinkFailed(sink, counter, e);
			}
		}
	}

	private static void sinkFailed(MetricsSink sink, String metric, RuntimeException e) {
		log.warn("autometrics sink {} failed for {}: {}", sink.getClass().getSimpleName(), metric, e.toString());
	}

	/* --------------------- labels --------------------- */

	private static LabelSet valueLabels(InstrumentedMethod plan, Object value) {
		try {
			return plan.labels().fromValue(value);
		} catch (RuntimeException e) {
			log.warn("autometrics label extraction failed for {}: {}", plan.names().counterName(), e.toString());
			return LabelSet.empty();
		}
	}

	private static LabelSet failureLabels(InstrumentedMethod plan, Throwable error) {
		try {
			return plan.labels().fromFailure(error);
		} catch (RuntimeException e) {
			log.warn("autometrics label extraction failed for {}: {}", plan.names().counterName(), e.toString());
			return LabelSet.empty();
		}
	}
}
