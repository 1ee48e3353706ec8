package com.obsinity.autometrics.config;

import java.util.List;
import java.util.Set;

/**
 * Parses raw annotation arguments into an {@link InstrumentationConfig}.
 *
 * <ul>
 *   <li>Method level: one optional {@code name} argument holding a string.</li>
 *   <li>Type level: no arguments. A shared base name would put every method of the type on one stem.</li>
 * </ul>
 *
 * Pure; no state.
 */
public final class InstrumentationConfigResolver {

	public static final String NAME = "name";

	private static final Set<String> METHOD_ARGUMENTS = Set.of(NAME);

	private InstrumentationConfigResolver() {}

	/**
	 * @throws DuplicateArgumentException if {@code name} appears more than once
	 * @throws UnrecognizedArgumentException if any other key appears, or any key at all on a type
	 */
	public static InstrumentationConfig resolve(List<AnnotationArgument> arguments, DeclarationTarget target) {
		if (arguments == null || arguments.isEmpty()) return InstrumentationConfig.derived();

		final Set<String> accepted = (target == DeclarationTarget.TYPE) ? Set.of() : METHOD_ARGUMENTS;
		String name = null;

		for (AnnotationArgument arg : arguments) {
			if (!accepted.contains(arg.key())) {
				throw new UnrecognizedArgumentException(arg, accepted);
			}
			if (name != null) {
				throw new DuplicateArgumentException(arg);
			}
			if (!(arg.value() instanceof String s)) {
				throw new UnrecognizedArgumentException(arg, accepted);
			}
			name = s;
		}
		return InstrumentationConfig.named(name);
	}
}
