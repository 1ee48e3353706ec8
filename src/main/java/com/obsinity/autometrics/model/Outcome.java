package com.obsinity.autometrics.model;

/**
 * A value that is exactly one of two variants: success or failure.
 *
 * <p>Return types implementing this interface are labelled {@code result=ok} / {@code result=err} by
 * {@link com.obsinity.autometrics.labels.OutcomeLabelCapability}. Only the discriminant is consulted, never the
 * payload.
 */
public interface Outcome {

	/** @return true for the success variant, false for the failure variant. */
	boolean isSuccess();
}
