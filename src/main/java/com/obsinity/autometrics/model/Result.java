package com.obsinity.autometrics.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Success-or-failure return type with a payload on either side.
 *
 * <pre>{@code
 * @Autometrics
 * public Result<Order, String> place(Cart cart) {
 *     if (cart.isEmpty()) return Result.err("empty cart");
 *     return Result.ok(persist(cart));
 * }
 * }</pre>
 *
 * @param <T> success payload
 * @param <E> failure payload
 */
public sealed interface Result<T, E> extends Outcome permits Result.Ok, Result.Err {

	static <T, E> Result<T, E> ok(T value) {
		return new Ok<>(value);
	}

	static <T, E> Result<T, E> err(E error) {
		return new Err<>(error);
	}

	default boolean isOk() {
		return this instanceof Ok;
	}

	default boolean isErr() {
		return this instanceof Err;
	}

	@Override
	default boolean isSuccess() {
		return isOk();
	}

	default <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
		Objects.requireNonNull(mapper, "mapper");
		if (this instanceof Ok<T, E> ok) {
			return new Ok<>(mapper.apply(ok.value()));
		}
		return new Err<>(((Err<T, E>) this).error());
	}

	default <R> R fold(Function<? super T, ? extends R> onOk, Function<? super E, ? extends R> onErr) {
		if (this instanceof Ok<T, E> ok) {
			return onOk.apply(ok.value());
		}
		return onErr.apply(((Err<T, E>) this).error());
	}

	record Ok<T, E>(T value) implements Result<T, E> {}

	record Err<T, E>(E error) implements Result<T, E> {}
}
