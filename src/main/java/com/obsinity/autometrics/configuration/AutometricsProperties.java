package com.obsinity.autometrics.configuration;

import org.apache.logging.log4j.spi.StandardLevel;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for {@code @Autometrics} instrumentation.
 *
 * <h3>Configuration Example:</h3>
 * <pre>{@code
 * # application.yml
 * obsinity:
 *   autometrics:
 *     enabled: true                  # master switch (default true)
 *     instrumentation-scope: orders  # OpenTelemetry meter name
 *     sinks:
 *       opentelemetry:
 *         enabled: true              # default true
 *       logging:
 *         enabled: false             # default false
 *         level: INFO
 * }</pre>
 */
@ConfigurationProperties(prefix = "obsinity.autometrics")
public class AutometricsProperties {

	public static final String DEFAULT_SCOPE = "com.obsinity.autometrics";

	/**
	 * Master switch. When disabled the aspect proceeds straight into the method; nothing is measured or emitted.
	 * Names are still validated at startup.
	 */
	private boolean enabled = true;

	/** Instrumentation scope (meter name) used to obtain the OpenTelemetry {@code Meter}. */
	private String instrumentationScope = DEFAULT_SCOPE;

	private final Sinks sinks = new Sinks();

	public boolean isEnabled() {
		return enabled;
	}

	public void setEnabled(boolean enabled) {
		this.enabled = enabled;
	}

	public String getInstrumentationScope() {
		return instrumentationScope;
	}

	public void setInstrumentationScope(String instrumentationScope) {
		this.instrumentationScope = instrumentationScope;
	}

	public Sinks getSinks() {
		return sinks;
	}

	public static class Sinks {

		private final OpenTelemetry opentelemetry = new OpenTelemetry();
		private final Logging logging = new Logging();

		public OpenTelemetry getOpentelemetry() {
			return opentelemetry;
		}

		public Logging getLogging() {
			return logging;
		}
	}

	public static class OpenTelemetry {

		private boolean enabled = true;

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}
	}

	public static class Logging {

		private boolean enabled = false;

		/** Level of the per-emission line; the JSON payload is always DEBUG. */
		private StandardLevel level = StandardLevel.INFO;

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}

		public StandardLevel getLevel() {
			return level;
		}

		public void setLevel(StandardLevel level) {
			this.level = level;
		}
	}
}
