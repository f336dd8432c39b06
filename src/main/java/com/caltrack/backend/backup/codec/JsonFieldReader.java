package com.caltrack.backend.backup.codec;

import com.caltrack.backend.nutrient.NutrientId;
import com.caltrack.backend.nutrient.NutrientMap;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.UUID;

/**
 * Typed field access on one backup object. Every failure names the offending path,
 * e.g. {@code foodEntries[3].timestamp}.
 */
final class JsonFieldReader {

    private static final String INVALID = "BACKUP_INVALID_FIELD";

    private final JsonNode node;
    private final String path;

    JsonFieldReader(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw new MalformedBackupException(INVALID, path + " is not an object");
        }
        this.node = node;
        this.path = path;
    }

    String id(String field) {
        String v = requiredText(field);
        try {
            UUID.fromString(v);
        } catch (IllegalArgumentException e) {
            throw invalid(field, "not a UUID");
        }
        return v;
    }

    String optionalId(String field) {
        String v = optionalText(field);
        if (v == null || v.isEmpty()) return null;
        try {
            UUID.fromString(v);
        } catch (IllegalArgumentException e) {
            throw invalid(field, "not a UUID");
        }
        return v;
    }

    String requiredText(String field) {
        String v = optionalText(field);
        if (v == null) throw invalid(field, "missing");
        return v;
    }

    String optionalText(String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        if (!v.isTextual()) throw invalid(field, "not a string");
        return v.textValue();
    }

    String text(String field, String fallback) {
        String v = optionalText(field);
        return v == null ? fallback : v;
    }

    Double optionalDouble(String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        if (!v.isNumber()) throw invalid(field, "not a number");
        return v.doubleValue();
    }

    double requiredDouble(String field) {
        Double v = optionalDouble(field);
        if (v == null) throw invalid(field, "missing");
        return v;
    }

    double number(String field, double fallback) {
        Double v = optionalDouble(field);
        return v == null ? fallback : v;
    }

    Integer optionalInt(String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        if (!v.isIntegralNumber()) throw invalid(field, "not an integer");
        if (!v.canConvertToInt()) throw invalid(field, "out of int range");
        return v.intValue();
    }

    boolean bool(String field, boolean fallback) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return fallback;
        if (!v.isBoolean()) throw invalid(field, "not a boolean");
        return v.booleanValue();
    }

    Instant requiredInstant(String field) {
        Instant v = optionalInstant(field);
        if (v == null) throw invalid(field, "missing");
        return v;
    }

    /** ISO-8601 with offset or Z, fractional seconds optional */
    Instant optionalInstant(String field) {
        String v = optionalText(field);
        if (v == null) return null;
        try {
            return OffsetDateTime.parse(v).toInstant();
        } catch (DateTimeParseException e) {
            throw invalid(field, "not an ISO-8601 date-time");
        }
    }

    byte[] optionalBase64(String field) {
        String v = optionalText(field);
        if (v == null) return null;
        try {
            return Base64.getDecoder().decode(v);
        } catch (IllegalArgumentException e) {
            throw invalid(field, "not base64");
        }
    }

    /** Nutrient values stored as top-level fields named by their json key. */
    NutrientMap flatNutrients() {
        Map<NutrientId, Double> out = new EnumMap<>(NutrientId.class);
        for (NutrientId id : NutrientId.values()) {
            Double v = optionalDouble(id.jsonKey());
            if (v != null) out.put(id, v);
        }
        return NutrientMap.of(out);
    }

    /** Nested nutrient object; unknown keys are ignored. */
    NutrientMap nestedNutrients(String field) {
        JsonNode obj = node.get(field);
        if (obj == null || obj.isNull()) return NutrientMap.EMPTY;
        if (!obj.isObject()) throw invalid(field, "not an object");

        Map<NutrientId, Double> out = new EnumMap<>(NutrientId.class);
        Iterator<Map.Entry<String, JsonNode>> it = obj.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            NutrientId id = NutrientId.fromJsonKey(e.getKey()).orElse(null);
            if (id == null || e.getValue().isNull()) continue;
            if (!e.getValue().isNumber()) throw invalid(field + "." + e.getKey(), "not a number");
            out.put(id, e.getValue().doubleValue());
        }
        return NutrientMap.of(out);
    }

    private MalformedBackupException invalid(String field, String reason) {
        return new MalformedBackupException(INVALID, path + "." + field + " " + reason);
    }
}
