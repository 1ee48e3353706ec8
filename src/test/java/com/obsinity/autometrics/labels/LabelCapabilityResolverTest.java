package com.obsinity.autometrics.labels;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.ResolvableType;

import com.obsinity.autometrics.model.Outcome;
import com.obsinity.autometrics.model.Result;

class LabelCapabilityResolverTest {

	private final LabelCapabilityResolver resolver = LabelCapabilityResolver.standard();

	@Test
	void outcome_types_resolve_to_the_outcome_capability_whatever_the_payloads() {
		for (ResolvableType t : List.of(
				ResolvableType.forClassWithGenerics(Result.class, String.class, Integer.class),
				ResolvableType.forClassWithGenerics(Result.class, Void.class, Exception.class),
				ResolvableType.forClass(Result.Ok.class),
				ResolvableType.forClass(Health.class))) {
			assertThat(resolver.resolve(t).capability()).as(t.toString()).isInstanceOf(OutcomeLabelCapability.class);
		}
	}

	@Test
	void other_types_resolve_to_the_default() {
		for (ResolvableType t : List.of(
				ResolvableType.forClass(String.class),
				ResolvableType.forClass(Object.class),
				ResolvableType.forClass(int.class),
				ResolvableType.forClass(void.class),
				ResolvableType.forClassWithGenerics(Optional.class, String.class),
				ResolvableType.NONE)) {
			assertThat(resolver.resolve(t).capability()).as(t.toString()).isSameAs(DefaultLabelCapability.INSTANCE);
		}
	}

	@Test
	@DisplayName("success -> result=ok, failure -> result=err")
	void outcome_labels() {
		LabelExtractor ex = resolver.resolve(ResolvableType.forClassWithGenerics(Result.class, String.class, String.class));

		assertThat(ex.fromValue(Result.ok("x")).asMap()).containsExactly(Map.entry("result", "ok"));
		assertThat(ex.fromValue(Result.err("boom")).asMap()).containsExactly(Map.entry("result", "err"));
		assertThat(ex.fromValue(Result.ok(null)).asMap()).containsExactly(Map.entry("result", "ok"));
		assertThat(ex.fromFailure(new IllegalStateException())).isEqualTo(LabelSet.of("result", "err"));
		assertThat(ex.fromValue(null)).isEqualTo(LabelSet.empty());
	}

	@Test
	void default_never_labels() {
		LabelExtractor ex = resolver.resolve(ResolvableType.forClass(Object.class));

		assertThat(ex.fromValue("anything").isEmpty()).isTrue();
		assertThat(ex.fromValue(null).isEmpty()).isTrue();
		assertThat(ex.fromFailure(new RuntimeException()).isEmpty()).isTrue();
	}

	@Test
	void resolution_uses_the_declared_type_not_the_runtime_value() {
		// declared as Object: the Result value is not inspected
		LabelExtractor ex = resolver.resolve(ResolvableType.forClass(Object.class));
		assertThat(ex.fromValue(Result.err("x")).isEmpty()).isTrue();
	}

	@Test
	void the_more_specific_capability_wins_and_the_default_stays_last() {
		LabelCapability<Outcome> detailed = new FixedCapability(-10, LabelSet.of("result", "detailed"));
		LabelCapabilityResolver r = new LabelCapabilityResolver(List.of(new OutcomeLabelCapability(), detailed));

		assertThat(r.capabilities()).hasSize(3);
		assertThat(r.capabilities().get(0)).isSameAs(detailed);
		assertThat(r.capabilities().get(2)).isSameAs(DefaultLabelCapability.INSTANCE);
		assertThat(r.resolve(ResolvableType.forClass(Result.class)).fromValue(Result.ok(1)))
				.isEqualTo(LabelSet.of("result", "detailed"));
	}

	@Test
	void equal_orders_keep_registration_order() {
		FixedCapability first = new FixedCapability(5, LabelSet.of("k", "first"));
		FixedCapability second = new FixedCapability(5, LabelSet.of("k", "second"));

		LabelCapabilityResolver r = new LabelCapabilityResolver(List.of(first, second));
		assertThat(r.resolve(ResolvableType.forClass(Health.class)).capability()).isSameAs(first);
	}

	@Test
	void a_registered_default_is_not_duplicated() {
		LabelCapabilityResolver r = new LabelCapabilityResolver(List.of(DefaultLabelCapability.INSTANCE));
		assertThat(r.capabilities()).containsExactly(DefaultLabelCapability.INSTANCE);
	}

	@Test
	void completable_future_payload_is_a_separate_type() {
		ResolvableType future = ResolvableType.forClassWithGenerics(CompletableFuture.class, Result.class);
		assertThat(resolver.resolve(future).capability()).isSameAs(DefaultLabelCapability.INSTANCE);
		assertThat(resolver.resolve(future.getGeneric(0)).capability()).isInstanceOf(OutcomeLabelCapability.class);
	}

	@Test
	void label_set_keeps_insertion_order_and_is_immutable() {
		LabelSet labels = LabelSet.of("b", "2").with("a", "1").with("b", "3");
		assertThat(labels.asMap()).containsExactly(Map.entry("b", "3"), Map.entry("a", "1"));
		assertThat(labels.size()).isEqualTo(2);
		assertThat(labels.get("a")).isEqualTo("1");
		assertThatThrownBy(() -> labels.asMap().put("c", "x"))
				.isInstanceOf(UnsupportedOperationException.class);
	}

	/** An outcome type that is not a {@link Result}. */
	record Health(boolean up) implements Outcome {
		@Override
		public boolean isSuccess() {
			return up;
		}
	}

	static final class FixedCapability implements LabelCapability<Outcome> {
		private final int order;
		private final LabelSet labels;

		FixedCapability(int order, LabelSet labels) {
			this.order = order;
			this.labels = labels;
		}

		@Override
		public boolean supports(ResolvableType valueType) {
			Class<?> raw = valueType.resolve();
			return raw != null && Outcome.class.isAssignableFrom(raw);
		}

		@Override
		public LabelSet labels(Outcome value) {
			return labels;
		}

		@Override
		public int getOrder() {
			return order;
		}
	}
}
