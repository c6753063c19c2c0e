package org.pat2vec.server.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.pat2vec.model.*;
import org.pat2vec.server.AbstractWindowingTest;
import org.springframework.beans.factory.annotation.Autowired;

import java.io.IOException;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class JsonSerializationTest extends AbstractWindowingTest {

	@Autowired
	private ObjectMapper objectMapper;

	@Test
	public void testDatesAndSequences() throws IOException {
		assertEquals("\"2021-06-15\"", objectMapper.writeValueAsString(date("2021-06-15")));
		assertEquals(date("2021-06-15"), objectMapper.readValue("\"2021-06-15\"", CalendarDate.class));

		WindowSequence sequence = WindowSequence.of(Arrays.asList(date("2021-06-14"), date("2021-06-15")));
		String json = objectMapper.writeValueAsString(sequence);
		assertEquals("[\"2021-06-14\",\"2021-06-15\"]", json);
		assertEquals(sequence, objectMapper.readValue(json, WindowSequence.class));
	}

	@Test
	public void testRelativeDuration() throws IOException {
		String json = objectMapper.writeValueAsString(RelativeDuration.of(1, 2, 3));
		JsonNode node = objectMapper.readTree(json);
		assertEquals(3, node.size());
		assertEquals(2, node.get("months").asInt());
		assertEquals(RelativeDuration.of(1, 2, 3), objectMapper.readValue(json, RelativeDuration.class));
	}

	@Test
	public void testTimeWindowAsIsoTimestamps() throws IOException {
		JsonNode node = objectMapper.readTree(objectMapper.writeValueAsString(TimeWindow.of(date("2021-06-08"), date("2021-06-15"))));
		assertEquals(2, node.size());
		assertEquals("2021-06-08T00:00:00Z", node.get("start").asText());
		assertEquals("2021-06-15T23:59:59.999999Z", node.get("end").asText());
	}
}
