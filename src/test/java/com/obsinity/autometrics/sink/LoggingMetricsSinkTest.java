package com.obsinity.autometrics.sink;

import static org.assertj.core.api.Assertions.assertThatCode;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.spi.StandardLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.obsinity.autometrics.labels.LabelSet;

class LoggingMetricsSinkTest {

	@ParameterizedTest(name = "level {0}")
	@EnumSource(StandardLevel.class)
	void every_level_logs_without_failing(StandardLevel level) {
		LoggingMetricsSink sink = new LoggingMetricsSink(new ObjectMapper(), level);

		assertThatCode(() -> {
			sink.recordHistogram("orders_place_duration_seconds", 0.1, LabelSet.of("result", "ok"));
			sink.incrementCounter("orders_place_total", LabelSet.empty());
		}).doesNotThrowAnyException();
	}

	@Test
	void defaults_apply_when_collaborators_are_missing() {
		LoggingMetricsSink sink = new LoggingMetricsSink(null, null);

		assertThatCode(() -> sink.incrementCounter("x_total", LabelSet.of("k", "v"))).doesNotThrowAnyException();
	}
}
