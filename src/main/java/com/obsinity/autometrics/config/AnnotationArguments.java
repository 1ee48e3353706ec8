package com.obsinity.autometrics.config;

import java.util.ArrayList;
import java.util.List;

import com.obsinity.autometrics.annotations.Autometrics;

/** Turns an {@link Autometrics} instance into the raw argument list the resolver consumes. */
public final class AnnotationArguments {

	private AnnotationArguments() {}

	/**
	 * Every explicitly supplied attribute becomes one argument. {@code value} is the shorthand for {@code name}, so
	 * supplying both yields two {@code name} arguments.
	 */
	public static List<AnnotationArgument> of(Autometrics annotation) {
		if (annotation == null) return List.of();
		List<AnnotationArgument> args = new ArrayList<>(2);
		if (!annotation.value().isBlank()) {
			args.add(new AnnotationArgument(InstrumentationConfigResolver.NAME, annotation.value()));
		}
		if (!annotation.name().isBlank()) {
			args.add(new AnnotationArgument(InstrumentationConfigResolver.NAME, annotation.name()));
		}
		return List.copyOf(args);
	}
}
