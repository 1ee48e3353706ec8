package com.obsinity.autometrics.config;

/** The same keyed argument was supplied more than once. */
public final class DuplicateArgumentException extends InstrumentationConfigException {

	public DuplicateArgumentException(AnnotationArgument duplicate) {
		super(duplicate.key(), "expected only a single `" + duplicate.key() + "` argument, found duplicate: " + duplicate);
	}
}
