package com.obsinity.autometrics.aspect;

import java.util.Objects;

import com.obsinity.autometrics.labels.LabelExtractor;
import com.obsinity.autometrics.naming.DeclarationPath;
import com.obsinity.autometrics.naming.MetricNames;

/**
 * Everything fixed about an instrumented method before its first call: names, evaluation mode and the bound label
 * extractor. Immutable and shared by all concurrent calls.
 */
public record InstrumentedMethod(
		FunctionDescriptor descriptor,
		DeclarationPath path,
		MetricNames names,
		LabelExtractor labels) {

	public InstrumentedMethod {
		Objects.requireNonNull(descriptor, "descriptor");
		Objects.requireNonNull(path, "path");
		Objects.requireNonNull(names, "names");
		Objects.requireNonNull(labels, "labels");
	}

	public EvaluationMode mode() {
		return descriptor.mode();
	}

	@Override
	public String toString() {
		return path + " -> counter=" + names.counterName() + " histogram=" + names.histogramName()
				+ " mode=" + mode() + " labels=" + labels;
	}
}
