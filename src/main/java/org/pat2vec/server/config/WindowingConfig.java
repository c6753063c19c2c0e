package org.pat2vec.server.config;

import org.pat2vec.model.WindowingContext;
import org.pat2vec.server.config.binding.StringToRelativeDurationConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WindowingConfig {

	private final Logger logger = LoggerFactory.getLogger(getClass());

	@Bean
	@ConfigurationPropertiesBinding
	public static StringToRelativeDurationConverter stringToRelativeDurationConverter() {
		return new StringToRelativeDurationConverter();
	}

	@Bean
	public WindowingProperties windowingProperties() {
		return new WindowingProperties();
	}

	@Bean
	public WindowingContext windowingContext(WindowingProperties windowingProperties) {
		WindowingContext windowingContext = windowingProperties.toContext();
		logger.info("Global window bounds: {}", windowingContext.getGlobalBounds());
		logger.info("{} with span {} and interval {}", windowingContext.isLookback() ? "Looking back" : "Looking forward",
				windowingContext.getSpan(), windowingContext.getInterval());
		if (windowingContext.isIndividualPatientWindow()) {
			logger.info("Individual patient windows active, controls method '{}'", windowingContext.getControlsMethod());
		}
		return windowingContext;
	}
}
