package com.obsinity.autometrics.aspect;

import java.lang.reflect.Method;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.springframework.core.MethodClassKey;

/**
 * One {@link InstrumentedMethod} per (method, target class), built on first request and never rebuilt.
 *
 * <p>{@link AutometricsValidator} fills the registry while the context starts, so calls normally only read it.
 */
public class InstrumentationRegistry {

	private final InstrumentedMethodFactory factory;
	private final ConcurrentMap<MethodClassKey, InstrumentedMethod> plans = new ConcurrentHashMap<>();

	public InstrumentationRegistry(InstrumentedMethodFactory factory) {
		this.factory = factory;
	}

	public InstrumentedMethod planFor(Method method, Class<?> targetClass) {
		return plans.computeIfAbsent(new MethodClassKey(method, targetClass), k -> factory.fromMethod(method, targetClass));
	}

	/** Every planned method, ordered by counter name. */
	public List<InstrumentedMethod> catalog() {
		return plans.values().stream()
				.sorted(Comparator.comparing((InstrumentedMethod p) -> p.names().counterName())
						.thenComparing(p -> p.descriptor().signature()))
				.toList();
	}

	public int size() {
		return plans.size();
	}
}
