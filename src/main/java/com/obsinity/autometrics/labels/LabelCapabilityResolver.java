package com.obsinity.autometrics.labels;

import java.util.ArrayList;
import java.util.List;

import org.springframework.core.ResolvableType;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;

/**
 * Selects, for a declared value type, the most specific {@link LabelCapability} that applies.
 *
 * <p>Capabilities are sorted by order; equal orders keep registration order. {@link DefaultLabelCapability} is
 * always appended last, so every type resolves to exactly one capability.
 */
public class LabelCapabilityResolver {

	private final List<LabelCapability<?>> capabilities;

	public LabelCapabilityResolver(List<? extends LabelCapability<?>> capabilities) {
		List<LabelCapability<?>> sorted = new ArrayList<>();
		if (capabilities != null) {
			for (LabelCapability<?> c : capabilities) {
				if (c != null && !(c instanceof DefaultLabelCapability)) sorted.add(c);
			}
		}
		AnnotationAwareOrderComparator.sort(sorted); // stable
		sorted.add(DefaultLabelCapability.INSTANCE);
		this.capabilities = List.copyOf(sorted);
	}

	/** Outcome capability plus the default. */
	public static LabelCapabilityResolver standard() {
		return new LabelCapabilityResolver(List.of(new OutcomeLabelCapability()));
	}

	@SuppressWarnings("unchecked")
	public LabelExtractor resolve(ResolvableType valueType) {
		for (LabelCapability<?> c : capabilities) {
			if (c.supports(valueType)) {
				// supports() vouches that every value of valueType is acceptable to c
				return new LabelExtractor((LabelCapability<Object>) c, valueType);
			}
		}
		throw new IllegalStateException("no label capability for " + valueType); // unreachable: default supports all
	}

	/** @return capabilities in consultation order, default last */
	public List<LabelCapability<?>> capabilities() {
		return capabilities;
	}
}
