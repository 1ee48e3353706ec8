package com.obsinity.autometrics.configuration;

import static org.springframework.core.Ordered.HIGHEST_PRECEDENCE;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfigureOrder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import com.obsinity.autometrics.aspect.AutometricsAspect;
import com.obsinity.autometrics.aspect.AutometricsValidator;
import com.obsinity.autometrics.aspect.InstrumentationRegistry;
import com.obsinity.autometrics.aspect.InstrumentedMethodFactory;
import com.obsinity.autometrics.labels.LabelCapability;
import com.obsinity.autometrics.labels.LabelCapabilityResolver;
import com.obsinity.autometrics.labels.OutcomeLabelCapability;
import com.obsinity.autometrics.processors.InstrumentationProcessor;
import com.obsinity.autometrics.sink.LoggingMetricsSink;
import com.obsinity.autometrics.sink.MetricsSink;
import com.obsinity.autometrics.sink.OpenTelemetryMetricsSink;

/**
 * Wires {@code @Autometrics}: the aspect, the per-method plan registry, label capabilities and the sinks.
 *
 * <p>The OpenTelemetry sink uses the application's {@link OpenTelemetry} bean when there is one, otherwise
 * {@link GlobalOpenTelemetry}. Any {@link MetricsSink} or {@link LabelCapability} bean the application declares is
 * picked up as well.
 */
@Configuration(proxyBeanMethods = false)
@AutoConfigureOrder(value = HIGHEST_PRECEDENCE)
@EnableAspectJAutoProxy(proxyTargetClass = true)
@EnableConfigurationProperties(AutometricsProperties.class)
public class AutoConfiguration {

	@Bean
	public static AutometricsValidator autometricsValidator(ObjectProvider<InstrumentationRegistry> registry) {
		return new AutometricsValidator(registry);
	}

	@Bean
	@ConditionalOnMissingBean
	public OutcomeLabelCapability outcomeLabelCapability() {
		return new OutcomeLabelCapability();
	}

	@Bean
	@ConditionalOnMissingBean
	public LabelCapabilityResolver labelCapabilityResolver(ObjectProvider<LabelCapability<?>> capabilities) {
		return new LabelCapabilityResolver(capabilities.orderedStream().toList());
	}

	@Bean
	@ConditionalOnMissingBean
	public InstrumentationRegistry instrumentationRegistry(LabelCapabilityResolver labelCapabilityResolver) {
		return new InstrumentationRegistry(new InstrumentedMethodFactory(labelCapabilityResolver));
	}

	@Bean
	@ConditionalOnProperty(prefix = "obsinity.autometrics.sinks.opentelemetry", name = "enabled",
			havingValue = "true", matchIfMissing = true)
	public OpenTelemetryMetricsSink openTelemetryMetricsSink(
			ObjectProvider<OpenTelemetry> openTelemetry, AutometricsProperties properties) {
		OpenTelemetry otel = openTelemetry.getIfAvailable(GlobalOpenTelemetry::get);
		return new OpenTelemetryMetricsSink(otel.getMeter(properties.getInstrumentationScope()));
	}

	@Bean
	@ConditionalOnProperty(prefix = "obsinity.autometrics.sinks.logging", name = "enabled", havingValue = "true")
	public LoggingMetricsSink loggingMetricsSink(ObjectProvider<ObjectMapper> mapper, AutometricsProperties properties) {
		return new LoggingMetricsSink(mapper.getIfAvailable(), properties.getSinks().getLogging().getLevel());
	}

	@Bean
	@ConditionalOnMissingBean
	public InstrumentationProcessor instrumentationProcessor(ObjectProvider<MetricsSink> sinks) {
		return new InstrumentationProcessor(sinks.orderedStream().toList());
	}

	@Bean
	@ConditionalOnMissingBean
	public AutometricsAspect autometricsAspect(
			InstrumentationProcessor processor, InstrumentationRegistry registry, AutometricsProperties properties) {
		return new AutometricsAspect(processor, registry, properties);
	}
}
