package com.eyelevel.documentindexer.model.converter;

import com.eyelevel.documentindexer.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Persists an embedding vector as a JSON array of floats.
 */
@Converter
public class FloatVectorConverter implements AttributeConverter<float[], String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(float[] attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new JsonParsingException("Could not serialize embedding vector", e);
        }
    }

    @Override
    public float[] convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        try {
            return MAPPER.readValue(dbData, float[].class);
        } catch (JsonProcessingException e) {
            throw new JsonParsingException("Could not read embedding vector", e);
        }
    }
}
