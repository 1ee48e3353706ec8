package com.obsinity.autometrics.config;

/**
 * Raised while an annotated method is being planned, i.e. when the application context starts, never while the
 * method is being called.
 */
public abstract class InstrumentationConfigException extends RuntimeException {

	private final String key;

	protected InstrumentationConfigException(String key, String message) {
		super(message);
		this.key = key;
	}

	/** @return the argument key the diagnostic points at */
	public String key() {
		return key;
	}
}
