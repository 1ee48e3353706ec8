package com.obsinity.autometrics.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Records a duration histogram and an invocation counter around every call of the annotated method.
 *
 * <p>Two metrics are produced per method, sharing one base name:
 * <ul>
 *   <li>{@code <base>_duration_seconds}: histogram of the call duration in seconds</li>
 *   <li>{@code <base>_total}: counter of calls</li>
 * </ul>
 * When no {@link #name()} is given the base is the method's declaration path with dots replaced by
 * underscores, e.g. {@code com_acme_UserService_createUser}.
 *
 * <p>Methods returning a {@link java.util.concurrent.CompletionStage} are timed until the stage completes.
 * Methods returning an {@link com.obsinity.autometrics.model.Outcome} (such as
 * {@link com.obsinity.autometrics.model.Result}) are labelled {@code result=ok} or {@code result=err}.
 *
 * <p>On a type, every public method is instrumented with a derived name; a type-level annotation takes no
 * arguments. A method-level annotation wins over the type-level one.
 *
 * <h4>Usage example:</h4>
 *
 * <pre>{@code
 * @Autometrics(name = "req_latency")
 * public Result<User, String> createUser(NewUser user) {
 *     ...
 * }
 * }</pre>
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Autometrics {

	/**
	 * Shorthand for {@link #name()}. Supplying both is a configuration error.
	 *
	 * @return the metric base name, or blank to derive it
	 */
	String value() default "";

	/**
	 * Base metric name. The counter and histogram names are formed by appending {@code _total} and
	 * {@code _duration_seconds}. The value is used verbatim; it is not validated against any backend's naming
	 * rules.
	 *
	 * @return the metric base name, or blank to derive it from the declaration path
	 */
	String name() default "";
}
