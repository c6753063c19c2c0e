package org.pat2vec.server.config.binding;

import org.pat2vec.model.RelativeDuration;
import org.springframework.core.convert.converter.Converter;

import java.time.Period;

public class StringToRelativeDurationConverter implements Converter<String, RelativeDuration> {

	@Override
	public RelativeDuration convert(String source) {
		return RelativeDuration.from(Period.parse(source.trim()));
	}

}
