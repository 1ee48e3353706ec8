package com.obsinity.autometrics.labels;

import org.springframework.core.Ordered;
import org.springframework.core.ResolvableType;

/**
 * Derives labels from the value an instrumented method produced.
 *
 * <p>Capabilities are consulted once per method, when it is planned, in {@link Ordered} order (lowest value first).
 * The first capability whose {@link #supports(ResolvableType)} accepts the method's declared value type is bound to
 * the method for good; calls never re-select. Register additional capabilities as Spring beans.
 *
 * @param <T> the value type this capability reads
 */
public interface LabelCapability<T> extends Ordered {

	/**
	 * @param valueType the declared return type, or the payload type of a returned {@code CompletionStage}
	 * @return true if every value of {@code valueType} can be passed to {@link #labels(Object)}
	 */
	boolean supports(ResolvableType valueType);

	/** Labels for a produced value; {@code value} may be null. */
	LabelSet labels(T value);

	/** Labels for a call that failed with {@code error} instead of producing a value. */
	default LabelSet failureLabels(Throwable error) {
		return LabelSet.empty();
	}
}
