package com.obsinity.autometrics.aspect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import org.junit.jupiter.api.Test;

import com.obsinity.autometrics.annotations.Autometrics;
import com.obsinity.autometrics.config.DuplicateArgumentException;
import com.obsinity.autometrics.config.UnrecognizedArgumentException;
import com.obsinity.autometrics.labels.DefaultLabelCapability;
import com.obsinity.autometrics.labels.LabelCapabilityResolver;
import com.obsinity.autometrics.labels.OutcomeLabelCapability;
import com.obsinity.autometrics.model.Result;

class InstrumentedMethodFactoryTest {

	private static final String PREFIX = "com_obsinity_autometrics_aspect_InstrumentedMethodFactoryTest_";

	private final InstrumentedMethodFactory factory = new InstrumentedMethodFactory(LabelCapabilityResolver.standard());

	@Test
	void derived_names_follow_the_declaration_path() {
		InstrumentedMethod plan = factory.fromClassAndMethod(Orders.class, "place", String.class);

		assertThat(plan.path().toString())
				.isEqualTo("com.obsinity.autometrics.aspect.InstrumentedMethodFactoryTest.Orders.place");
		assertThat(plan.names().counterName()).isEqualTo(PREFIX + "Orders_place_total");
		assertThat(plan.names().histogramName()).isEqualTo(PREFIX + "Orders_place_duration_seconds");
	}

	@Test
	void explicit_name_ignores_the_path() {
		InstrumentedMethod plan = factory.fromClassAndMethod(Orders.class, "latency");

		assertThat(plan.names().counterName()).isEqualTo("req_latency_total");
		assertThat(plan.names().histogramName()).isEqualTo("req_latency_duration_seconds");
	}

	@Test
	void capability_and_mode_are_fixed_from_the_declared_return_type() {
		InstrumentedMethod direct = factory.fromClassAndMethod(Orders.class, "place", String.class);
		InstrumentedMethod async = factory.fromClassAndMethod(Orders.class, "placeAsync", String.class);
		InstrumentedMethod plain = factory.fromClassAndMethod(Orders.class, "latency");
		InstrumentedMethod voidAsync = factory.fromClassAndMethod(Orders.class, "flush");

		assertThat(direct.mode()).isEqualTo(EvaluationMode.DIRECT);
		assertThat(direct.labels().capability()).isInstanceOf(OutcomeLabelCapability.class);

		assertThat(async.mode()).isEqualTo(EvaluationMode.SUSPENDING);
		assertThat(async.descriptor().isSuspending()).isTrue();
		assertThat(async.labels().capability()).isInstanceOf(OutcomeLabelCapability.class);

		assertThat(plain.labels().capability()).isSameAs(DefaultLabelCapability.INSTANCE);
		assertThat(voidAsync.mode()).isEqualTo(EvaluationMode.SUSPENDING);
		assertThat(voidAsync.labels().capability()).isSameAs(DefaultLabelCapability.INSTANCE);
	}

	@Test
	void descriptor_reads_the_signature() {
		FunctionDescriptor d = factory.fromClassAndMethod(Orders.class, "place", String.class).descriptor();

		assertThat(d.name()).isEqualTo("place");
		assertThat(d.visibility()).isEqualTo("public");
		assertThat(d.parameterTypes()).containsExactly(String.class);
		assertThat(d.signature()).isEqualTo(
				"public com.obsinity.autometrics.model.Result<java.lang.String, java.lang.String> place(java.lang.String)");

		FunctionDescriptor pkg = factory.fromClassAndMethod(Orders.class, "internal").descriptor();
		assertThat(pkg.visibility()).isEmpty();
		assertThat(pkg.signature()).isEqualTo("int internal()");
	}

	@Test
	void type_level_annotation_derives_every_name() {
		InstrumentedMethod plan = factory.fromClassAndMethod(Inventory.class, "reserve", String.class, int.class);

		assertThat(plan.names().counterName()).isEqualTo(PREFIX + "Inventory_reserve_total");
	}

	@Test
	void method_level_annotation_wins_over_type_level() {
		InstrumentedMethod plan = factory.fromClassAndMethod(Inventory.class, "audit");

		assertThat(plan.names().counterName()).isEqualTo("inventory_audit_total");
	}

	@Test
	void type_level_name_is_rejected() {
		assertThatThrownBy(() -> factory.fromClassAndMethod(SharedName.class, "a"))
				.isInstanceOf(UnrecognizedArgumentException.class);
	}

	@Test
	void duplicate_arguments_are_rejected() {
		assertThatThrownBy(() -> factory.fromClassAndMethod(Broken.class, "twice"))
				.isInstanceOf(DuplicateArgumentException.class);
	}

	@Test
	void unannotated_method_is_rejected() {
		assertThatThrownBy(() -> factory.fromClassAndMethod(Broken.class, "bare"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("lacks @Autometrics");
	}

	@Test
	void registry_plans_once_and_lists_the_catalog() throws Exception {
		InstrumentationRegistry registry = new InstrumentationRegistry(factory);

		InstrumentedMethod first = registry.planFor(Orders.class.getMethod("latency"), Orders.class);
		InstrumentedMethod second = registry.planFor(Orders.class.getMethod("latency"), Orders.class);
		registry.planFor(Orders.class.getMethod("place", String.class), Orders.class);

		assertThat(second).isSameAs(first);
		assertThat(registry.size()).isEqualTo(2);
		List<InstrumentedMethod> catalog = registry.catalog();
		assertThat(catalog).extracting(p -> p.names().counterName())
				.containsExactly(PREFIX + "Orders_place_total", "req_latency_total");
	}

	static class Orders {
		@Autometrics
		public Result<String, String> place(String sku) {
			return Result.ok(sku);
		}

		@Autometrics
		public CompletableFuture<Result<String, String>> placeAsync(String sku) {
			return CompletableFuture.completedFuture(Result.ok(sku));
		}

		@Autometrics(name = "req_latency")
		public String latency() {
			return "";
		}

		@Autometrics
		public CompletionStage<Void> flush() {
			return CompletableFuture.completedFuture(null);
		}

		@Autometrics
		int internal() {
			return 0;
		}
	}

	@Autometrics
	static class Inventory {
		public boolean reserve(String sku, int qty) {
			return qty > 0;
		}

		@Autometrics("inventory_audit")
		public void audit() {}
	}

	@Autometrics(name = "shared")
	static class SharedName {
		public void a() {}
	}

	static class Broken {
		@Autometrics(value = "x", name = "y")
		public void twice() {}

		public void bare() {}
	}
}
