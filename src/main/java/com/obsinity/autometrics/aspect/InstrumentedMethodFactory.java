package com.obsinity.autometrics.aspect;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.aop.support.AopUtils;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.util.ReflectionUtils;

import com.obsinity.autometrics.annotations.Autometrics;
import com.obsinity.autometrics.config.AnnotationArguments;
import com.obsinity.autometrics.config.DeclarationTarget;
import com.obsinity.autometrics.config.InstrumentationConfig;
import com.obsinity.autometrics.config.InstrumentationConfigResolver;
import com.obsinity.autometrics.labels.LabelCapabilityResolver;
import com.obsinity.autometrics.labels.LabelExtractor;
import com.obsinity.autometrics.naming.DeclarationPath;
import com.obsinity.autometrics.naming.MetricNameDeriver;
import com.obsinity.autometrics.naming.MetricNames;

/**
 * Builds {@link InstrumentedMethod} plans from annotated methods.
 *
 * <ul>
 *   <li>{@code @Autometrics} on the method: its arguments are resolved at method level.</li>
 *   <li>{@code @Autometrics} on the type only: resolved at type level, which accepts no arguments.</li>
 * </ul>
 *
 * Configuration errors surface here as {@link com.obsinity.autometrics.config.InstrumentationConfigException}.
 */
public class InstrumentedMethodFactory {

	private final LabelCapabilityResolver labelResolver;

	public InstrumentedMethodFactory(LabelCapabilityResolver labelResolver) {
		this.labelResolver = labelResolver;
	}

	/** Build a plan from a reflective method (expects most-specific method). */
	public InstrumentedMethod fromMethod(Method method, Class<?> targetClass) {
		Class<?> type = (targetClass != null) ? targetClass : method.getDeclaringClass();

		InstrumentationConfig config;
		Autometrics onMethod = AnnotatedElementUtils.findMergedAnnotation(method, Autometrics.class);
		if (onMethod != null) {
			config = InstrumentationConfigResolver.resolve(AnnotationArguments.of(onMethod), DeclarationTarget.METHOD);
		} else {
			Autometrics onType = AnnotatedElementUtils.findMergedAnnotation(type, Autometrics.class);
			if (onType == null) {
				throw new IllegalArgumentException("Method lacks @Autometrics on itself or its type: " + method);
			}
			config = InstrumentationConfigResolver.resolve(AnnotationArguments.of(onType), DeclarationTarget.TYPE);
		}

		FunctionDescriptor descriptor = FunctionDescriptor.of(method, type);
		DeclarationPath path = DeclarationPath.of(method);
		MetricNames names = MetricNameDeriver.derive(config, path);
		LabelExtractor labels = labelResolver.resolve(descriptor.valueType());

		return new InstrumentedMethod(descriptor, path, names, labels);
	}

	/** Build a plan by class + method name + parameter types. */
	public InstrumentedMethod fromClassAndMethod(Class<?> type, String methodName, Class<?>... paramTypes) {
		Method m = ReflectionUtils.findMethod(type, methodName, paramTypes);
		if (m == null) {
			throw new IllegalArgumentException(
					"No such method: " + type.getName() + "#" + methodName + Arrays.toString(paramTypes));
		}
		return fromMethod(AopUtils.getMostSpecificMethod(m, type), type);
	}

	/** Build a plan by class + method name; the name must not be overloaded. */
	public InstrumentedMethod fromClassAndMethod(Class<?> type, String methodName) {
		List<Method> sameName = Arrays.stream(ReflectionUtils.getAllDeclaredMethods(type))
				.filter(m -> m.getName().equals(methodName) && !m.isBridge())
				.toList();
		if (sameName.isEmpty()) {
			throw new IllegalArgumentException("No method named '" + methodName + "' on " + type.getName());
		}
		if (sameName.size() > 1) {
			throw new IllegalStateException(
					"Ambiguous overloads for " + type.getName() + "#" + methodName + ", specify parameter types");
		}
		return fromMethod(AopUtils.getMostSpecificMethod(sameName.get(0), type), type);
	}

	/** Resolves the most specific method behind a join point. */
	public static Method mostSpecificMethod(ProceedingJoinPoint pjp) {
		MethodSignature sig = (MethodSignature) pjp.getSignature();
		Method method = sig.getMethod();
		Class<?> targetClass = targetClass(pjp);
		return AopUtils.getMostSpecificMethod(method, targetClass);
	}

	public static Class<?> targetClass(ProceedingJoinPoint pjp) {
		Object target = pjp.getTarget();
		return (target != null)
				? AopUtils.getTargetClass(target)
				: ((MethodSignature) pjp.getSignature()).getMethod().getDeclaringClass();
	}
}
