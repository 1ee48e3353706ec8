package com.obsinity.autometrics.naming;

import java.lang.reflect.Method;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Nested scope names leading to a declaration, outermost first, e.g. {@code [com, acme, UserService, createUser]}.
 */
public record DeclarationPath(List<String> segments) {

	public DeclarationPath {
		Objects.requireNonNull(segments, "segments");
		segments = List.copyOf(segments);
		if (segments.isEmpty()) {
			throw new IllegalArgumentException("declaration path must have at least one segment");
		}
	}

	public static DeclarationPath of(String... segments) {
		return new DeclarationPath(Arrays.asList(segments));
	}

	/** Splits a rendered path on a literal separator sequence, e.g. {@code parse("svc::create_user", "::")}. */
	public static DeclarationPath parse(String path, String separator) {
		return new DeclarationPath(Arrays.asList(path.split(Pattern.quote(separator), -1)));
	}

	/** Package segments, enclosing type names (outermost first), declaring type, method name. */
	public static DeclarationPath of(Method method) {
		Deque<String> out = new ArrayDeque<>();
		out.addFirst(method.getName());
		Class<?> type = method.getDeclaringClass();
		while (type != null) {
			out.addFirst(scopeName(type));
			type = type.getEnclosingClass();
		}
		String pkg = method.getDeclaringClass().getPackageName();
		if (!pkg.isEmpty()) {
			String[] parts = pkg.split("\\.");
			for (int i = parts.length - 1; i >= 0; i--) out.addFirst(parts[i]);
		}
		return new DeclarationPath(List.copyOf(out));
	}

	/** Anonymous classes have no simple name; their binary-name suffix ({@code 1} in {@code Outer$1}) stands in. */
	private static String scopeName(Class<?> type) {
		String simple = type.getSimpleName();
		if (!simple.isEmpty()) return simple;
		String binary = type.getName();
		return binary.substring(binary.lastIndexOf('$') + 1);
	}

	public String join(String separator) {
		return String.join(separator, segments);
	}

	@Override
	public String toString() {
		return join(".");
	}
}
