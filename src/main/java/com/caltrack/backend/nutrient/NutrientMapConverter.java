package com.caltrack.backend.nutrient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.Map;

/**
 * Stores a {@link NutrientMap} as a json object text column, e.g. {@code {"iron":2.1,"vitaminC":40.0}}.
 * Empty maps are stored as null.
 */
@Converter(autoApply = false)
public class NutrientMapConverter implements AttributeConverter<NutrientMap, String> {

    private static final ObjectMapper OM = new ObjectMapper();
    private static final TypeReference<Map<String, Double>> MAP_TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(NutrientMap attribute) {
        if (attribute == null || attribute.isEmpty()) return null;
        try {
            return OM.writeValueAsString(attribute.toJsonKeys());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("NUTRIENT_MAP_WRITE_FAILED", e);
        }
    }

    @Override
    public NutrientMap convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) return NutrientMap.EMPTY;
        try {
            return NutrientMap.fromJsonKeys(OM.readValue(dbData, MAP_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("NUTRIENT_MAP_READ_FAILED", e);
        }
    }
}
