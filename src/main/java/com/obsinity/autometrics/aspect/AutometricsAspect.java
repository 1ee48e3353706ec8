package com.obsinity.autometrics.aspect;

import java.lang.reflect.Method;

import lombok.RequiredArgsConstructor;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;

import com.obsinity.autometrics.annotations.Autometrics;
import com.obsinity.autometrics.configuration.AutometricsProperties;
import com.obsinity.autometrics.processors.InstrumentationProcessor;

/**
 * Spring AOP aspect that wraps methods carrying {@link Autometrics}, directly or through their type, and delegates
 * to {@link InstrumentationProcessor}.
 *
 * <p>The proxy overrides the method with the same name, parameters, return type and visibility, so call sites are
 * unaffected. The per-method {@link InstrumentedMethod} comes from {@link InstrumentationRegistry}; it is built when
 * the bean is created, not per call.
 *
 * <p>When {@code obsinity.autometrics.enabled=false} the advice proceeds without measuring anything.
 *
 * @see Autometrics
 * @see InstrumentationProcessor
 */
@Aspect
@RequiredArgsConstructor
public class AutometricsAspect {

	private final InstrumentationProcessor processor;
	private final InstrumentationRegistry registry;
	private final AutometricsProperties properties;

	/**
	 * Around advice for methods annotated with {@link Autometrics}.
	 *
	 * @param joinPoint   the current method invocation
	 * @param autometrics the annotation on the invoked method
	 * @return the original method's return value
	 * @throws Throwable any exception thrown by the original method; rethrown unchanged
	 */
	@Around(value = "execution(* *(..)) && @annotation(autometrics)", argNames = "joinPoint,autometrics")
	public Object interceptMethod(ProceedingJoinPoint joinPoint, Autometrics autometrics) throws Throwable { // NOSONAR
		return instrument(joinPoint);
	}

	/**
	 * Around advice for public methods of types annotated with {@link Autometrics}. Methods carrying their own
	 * annotation and the {@code Object} contract methods are left to {@link #interceptMethod} or not instrumented.
	 */
	@Around(value = "execution(public * *(..)) && @within(autometrics)"
			+ " && !@annotation(com.obsinity.autometrics.annotations.Autometrics)"
			+ " && !execution(String toString()) && !execution(int hashCode()) && !execution(boolean equals(Object))",
			argNames = "joinPoint,autometrics")
	public Object interceptType(ProceedingJoinPoint joinPoint, Autometrics autometrics) throws Throwable { // NOSONAR
		return instrument(joinPoint);
	}

	private Object instrument(ProceedingJoinPoint joinPoint) throws Throwable {
		if (properties != null && !properties.isEnabled()) {
			return joinPoint.proceed();
		}
		Method method = InstrumentedMethodFactory.mostSpecificMethod(joinPoint);
		InstrumentedMethod plan = registry.planFor(method, InstrumentedMethodFactory.targetClass(joinPoint));
		return processor.proceed(joinPoint, plan);
	}
}
