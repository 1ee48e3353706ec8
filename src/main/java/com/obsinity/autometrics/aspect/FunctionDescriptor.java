package com.obsinity.autometrics.aspect;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.stream.Collectors;

import org.springframework.core.ResolvableType;

/**
 * Read-only view of the method being instrumented.
 *
 * @param method        the most specific method (on the user class, not the proxy)
 * @param targetClass   the bean class the method is resolved against
 * @param mode          direct or suspending evaluation, from the declared return type
 */
public record FunctionDescriptor(Method method, Class<?> targetClass, EvaluationMode mode) {

	public FunctionDescriptor {
		Objects.requireNonNull(method, "method");
		Objects.requireNonNull(mode, "mode");
		if (targetClass == null) targetClass = method.getDeclaringClass();
	}

	public static FunctionDescriptor of(Method method, Class<?> targetClass) {
		return new FunctionDescriptor(method, targetClass, EvaluationMode.of(method.getReturnType()));
	}

	public String name() {
		return method.getName();
	}

	public List<Class<?>> parameterTypes() {
		return List.of(method.getParameterTypes());
	}

	public Type returnType() {
		return method.getGenericReturnType();
	}

	public boolean isSuspending() {
		return mode == EvaluationMode.SUSPENDING;
	}

	/** {@code public}, {@code protected}, {@code private} or blank for package-private. */
	public String visibility() {
		return Modifier.toString(method.getModifiers() & (Modifier.PUBLIC | Modifier.PROTECTED | Modifier.PRIVATE));
	}

	/**
	 * Type of the value labels are derived from: the declared return type, or for a suspending method the
	 * {@code CompletionStage} payload type.
	 */
	public ResolvableType valueType() {
		ResolvableType declared = ResolvableType.forMethodReturnType(method, targetClass);
		if (mode == EvaluationMode.SUSPENDING) {
			return declared.as(CompletionStage.class).getGeneric(0);
		}
		return declared;
	}

	/** e.g. {@code public Result<User, String> createUser(java.lang.String)} */
	public String signature() {
		String params = Arrays.stream(method.getGenericParameterTypes())
				.map(Type::getTypeName)
				.collect(Collectors.joining(", "));
		String vis = visibility();
		return (vis.isEmpty() ? "" : vis + " ") + returnType().getTypeName() + " " + name() + "(" + params + ")";
	}
}
