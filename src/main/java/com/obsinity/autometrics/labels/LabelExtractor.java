package com.obsinity.autometrics.labels;

import java.util.Objects;

import org.springframework.core.ResolvableType;

/**
 * A capability bound to one method's declared value type. Built once by {@link LabelCapabilityResolver}; holds no
 * per-call state.
 */
public final class LabelExtractor {

	private final LabelCapability<Object> capability;
	private final ResolvableType valueType;

	LabelExtractor(LabelCapability<Object> capability, ResolvableType valueType) {
		this.capability = Objects.requireNonNull(capability, "capability");
		this.valueType = Objects.requireNonNull(valueType, "valueType");
	}

	public LabelSet fromValue(Object value) {
		return capability.labels(value);
	}

	public LabelSet fromFailure(Throwable error) {
		return capability.failureLabels(error);
	}

	public LabelCapability<?> capability() {
		return capability;
	}

	public ResolvableType valueType() {
		return valueType;
	}

	@Override
	public String toString() {
		return capability + "<" + valueType + ">";
	}
}
