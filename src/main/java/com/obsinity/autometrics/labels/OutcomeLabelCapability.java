package com.obsinity.autometrics.labels;

import org.springframework.core.ResolvableType;

import com.obsinity.autometrics.model.Outcome;

/**
 * Labels {@link Outcome} values with {@code result=ok} or {@code result=err}.
 *
 * <p>Applies to any type assignable to {@link Outcome}, whatever its payload types, because only
 * {@link Outcome#isSuccess()} is read. A thrown failure counts as {@code err}; a {@code null} value carries no
 * variant and gets no label.
 */
public final class OutcomeLabelCapability implements LabelCapability<Outcome> {

	public static final String RESULT_KEY = "result";
	public static final String OK = "ok";
	public static final String ERR = "err";

	public static final int ORDER = 0;

	private static final LabelSet OK_LABELS = LabelSet.of(RESULT_KEY, OK);
	private static final LabelSet ERR_LABELS = LabelSet.of(RESULT_KEY, ERR);

	@Override
	public boolean supports(ResolvableType valueType) {
		Class<?> raw = valueType.resolve();
		return raw != null && Outcome.class.isAssignableFrom(raw);
	}

	@Override
	public LabelSet labels(Outcome value) {
		if (value == null) return LabelSet.empty();
		return value.isSuccess() ? OK_LABELS : ERR_LABELS;
	}

	@Override
	public LabelSet failureLabels(Throwable error) {
		return ERR_LABELS;
	}

	@Override
	public int getOrder() {
		return ORDER;
	}

	@Override
	public String toString() {
		return "outcome";
	}
}
