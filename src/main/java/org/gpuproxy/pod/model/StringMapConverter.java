/*
 * Licensed under MIT (see the LICENSE file at the root of this project)
 */
package org.gpuproxy.pod.model;

import java.util.HashMap;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Store a string map as a JSON column.
 */
@Converter
public class StringMapConverter implements AttributeConverter<Map<String, String>, String> {

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private static final TypeReference<Map<String, String>> MAP_TYPE = new TypeReference<>() {
	};

	@Override
	public String convertToDatabaseColumn(final Map<String, String> attribute) {
		if (attribute == null || attribute.isEmpty()) {
			return null;
		}
		try {
			return MAPPER.writeValueAsString(attribute);
		} catch (final JsonProcessingException e) {
			throw new IllegalArgumentException("Unable to serialize the map", e);
		}
	}

	@Override
	public Map<String, String> convertToEntityAttribute(final String dbData) {
		if (StringUtils.isBlank(dbData)) {
			return new HashMap<>();
		}
		try {
			return MAPPER.readValue(dbData, MAP_TYPE);
		} catch (final JsonProcessingException e) {
			throw new IllegalArgumentException("Unable to read the map " + dbData, e);
		}
	}
}
