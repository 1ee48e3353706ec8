package com.obsinity.autometrics.sink;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.spi.StandardLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsinity.autometrics.labels.LabelSet;

/**
 * Logs every emission; meant for local development.
 * - configured level: compact line with name, value and labels
 * - DEBUG: JSON payload of the emission
 */
public class LoggingMetricsSink implements MetricsSink {

	private static final Logger log = LoggerFactory.getLogger(LoggingMetricsSink.class);

	private final ObjectMapper mapper;
	private final StandardLevel level;

	public LoggingMetricsSink(ObjectMapper mapper, StandardLevel level) {
		this.mapper = (mapper != null) ? mapper : new ObjectMapper();
		this.level = (level != null) ? level : StandardLevel.INFO;
	}

	@Override
	public void recordHistogram(String name, double value, LabelSet labels) {
		write("autometrics histogram name={} value={} labels={}", name, value, labels);
		if (log.isDebugEnabled()) {
			log.debug("histogram payload: {}", toJson(new Emission("histogram", name, value, labels.asMap())));
		}
	}

	@Override
	public void incrementCounter(String name, LabelSet labels) {
		write("autometrics counter name={} increment={} labels={}", name, 1, labels);
		if (log.isDebugEnabled()) {
			log.debug("counter payload: {}", toJson(new Emission("counter", name, null, labels.asMap())));
		}
	}

	private void write(String format, Object name, Object value, Object labels) {
		switch (level) {
			case FATAL, ERROR -> log.error(format, name, value, labels);
			case WARN -> log.warn(format, name, value, labels);
			case INFO -> log.info(format, name, value, labels);
			case DEBUG -> log.debug(format, name, value, labels);
			case TRACE, ALL -> log.trace(format, name, value, labels);
			case OFF -> {
			}
		}
	}

	private String toJson(Emission emission) {
		try {
			return mapper.writeValueAsString(emission);
		} catch (JsonProcessingException e) {
			return String.valueOf(emission);
		}
	}

	@JsonInclude(Include.NON_NULL)
	record Emission(String type, String name, Double value, Map<String, String> labels) {}
}
