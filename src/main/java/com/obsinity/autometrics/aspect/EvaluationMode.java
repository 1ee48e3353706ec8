package com.obsinity.autometrics.aspect;

import java.util.concurrent.CompletionStage;

/** How the instrumented body produces its value. Fixed per method when it is planned. */
public enum EvaluationMode {
	/** The body returns its value directly. */
	DIRECT,
	/** The body returns a {@link CompletionStage}; the value is available once the stage completes. */
	SUSPENDING;

	public static EvaluationMode of(Class<?> declaredReturnType) {
		return (declaredReturnType != null && CompletionStage.class.isAssignableFrom(declaredReturnType))
				? SUSPENDING
				: DIRECT;
	}
}
