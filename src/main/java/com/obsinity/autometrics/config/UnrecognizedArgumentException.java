package com.obsinity.autometrics.config;

import java.util.Set;

/** A keyed argument outside the accepted set was supplied. */
public final class UnrecognizedArgumentException extends InstrumentationConfigException {

	public UnrecognizedArgumentException(AnnotationArgument argument, Set<String> expected) {
		super(argument.key(), "unrecognized argument `" + argument + "`; expected "
				+ (expected.isEmpty() ? "no arguments" : "one of " + expected));
	}
}
