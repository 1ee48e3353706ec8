package com.obsinity.autometrics.labels;

import org.springframework.core.ResolvableType;

/** Applies to every type; never adds labels. */
public final class DefaultLabelCapability implements LabelCapability<Object> {

	public static final DefaultLabelCapability INSTANCE = new DefaultLabelCapability();

	@Override
	public boolean supports(ResolvableType valueType) {
		return true;
	}

	@Override
	public LabelSet labels(Object value) {
		return LabelSet.empty();
	}

	@Override
	public int getOrder() {
		return LOWEST_PRECEDENCE;
	}

	@Override
	public String toString() {
		return "default";
	}
}
