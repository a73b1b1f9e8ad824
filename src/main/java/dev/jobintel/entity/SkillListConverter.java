package dev.jobintel.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

/**
 * Stores the ordered skill list as a JSON array column.
 */
@Converter
public class SkillListConverter implements AttributeConverter<List<String>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(List<String> skills) {
        try {
            return MAPPER.writeValueAsString(skills == null ? List.of() : skills);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize skills", e);
        }
    }

    @Override
    public List<String> convertToEntityAttribute(String column) {
        if (column == null || column.isBlank()) {
            return List.of();
        }
        try {
            return List.copyOf(MAPPER.readValue(column, LIST_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not read skills column: " + column, e);
        }
    }
}
