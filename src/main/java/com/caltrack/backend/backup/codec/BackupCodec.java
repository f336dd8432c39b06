package com.caltrack.backend.backup.codec;

import com.caltrack.backend.backup.config.BackupProperties;
import com.caltrack.backend.common.time.LocalDayResolver;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Whole-store JSON document, version 1.
 *
 * Encoding is deterministic: arrays are ordered by id and object keys are sorted,
 * so an unchanged store exported with the same exportDate gives identical bytes.
 * Decoding never touches the store.
 */
@Component
public class BackupCodec {

    public static final int CURRENT_VERSION = 1;

    private static final String UNPARSEABLE = "BACKUP_UNPARSEABLE";

    private final ObjectMapper mapper = new ObjectMapper();
    private final ObjectWriter writer;
    private final BackupEntityMapper entities;

    public BackupCodec(BackupProperties props, LocalDayResolver days) {
        this.writer = props.isPrettyPrint() ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
        this.entities = new BackupEntityMapper(days);
    }

    public byte[] encode(BackupGraph graph, Instant exportDate) {
        ObjectNode root = mapper.createObjectNode();
        root.put("version", CURRENT_VERSION);
        root.put("exportDate", exportDate.toString());
        root.set("products", array(graph.products(), p -> p.getId(), entities::writeProduct));
        root.set("dailyLogs", array(graph.dailyLogs(), d -> d.getId(), entities::writeDailyLog));
        root.set("foodEntries", array(graph.foodEntries(), e -> e.getId(), entities::writeFoodEntry));
        root.set("aiTemplates", array(graph.aiTemplates(), t -> t.getId(), entities::writeAiTemplate));
        root.set("supplements", array(graph.supplements(), s -> s.getId(), entities::writeSupplement));
        root.set("supplementEntries", array(graph.supplementEntries(), e -> e.getId(), entities::writeSupplementEntry));

        try {
            return writer.writeValueAsBytes(sortKeys(root));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("BACKUP_WRITE_FAILED", e);
        }
    }

    public DecodedBackup decode(byte[] document) {
        if (document == null || document.length == 0) {
            throw new MalformedBackupException(UNPARSEABLE, "empty document");
        }

        JsonNode root;
        try {
            root = mapper.readTree(document);
        } catch (IOException e) {
            throw new MalformedBackupException(UNPARSEABLE, e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedBackupException(UNPARSEABLE, "root is not an object");
        }

        int version = readVersion(root.get("version"));
        Instant exportDate = new JsonFieldReader(root, "$").optionalInstant("exportDate");

        BackupGraph graph = new BackupGraph(
                list(root, "products", entities::readProduct),
                list(root, "dailyLogs", entities::readDailyLog),
                list(root, "foodEntries", entities::readFoodEntry),
                list(root, "aiTemplates", entities::readAiTemplate),
                list(root, "supplements", entities::readSupplement),
                list(root, "supplementEntries", entities::readSupplementEntry)
        );
        return new DecodedBackup(version, exportDate, graph);
    }

    private static int readVersion(JsonNode v) {
        if (v == null || v.isNull()) {
            throw new MalformedBackupException("BACKUP_VERSION_MISSING");
        }
        if (!v.isIntegralNumber() || !v.canConvertToInt()) {
            throw new MalformedBackupException("BACKUP_INVALID_FIELD", "$.version not an integer");
        }
        int version = v.intValue();
        if (version != CURRENT_VERSION) {
            throw new UnsupportedVersionException(version);
        }
        return version;
    }

    private <T> ArrayNode array(List<T> items, Function<T, String> id, Function<T, ObjectNode> write) {
        List<T> sorted = new ArrayList<>(items);
        sorted.sort(Comparator.comparing(id, Comparator.nullsFirst(Comparator.naturalOrder())));

        ArrayNode arr = mapper.createArrayNode();
        for (T item : sorted) arr.add(write.apply(item));
        return arr;
    }

    /** absent array = empty; older exports carry no supplement arrays */
    private static <T> List<T> list(JsonNode root, String field, ElementReader<T> read) {
        JsonNode arr = root.get(field);
        if (arr == null || arr.isNull()) return List.of();
        if (!arr.isArray()) {
            throw new MalformedBackupException("BACKUP_INVALID_FIELD", "$." + field + " not an array");
        }

        List<T> out = new ArrayList<>(arr.size());
        for (int i = 0; i < arr.size(); i++) {
            out.add(read.read(arr.get(i), field + "[" + i + "]"));
        }
        return out;
    }

    private JsonNode sortKeys(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            names.sort(Comparator.naturalOrder());

            ObjectNode sorted = mapper.createObjectNode();
            for (String name : names) sorted.set(name, sortKeys(node.get(name)));
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode sorted = mapper.createArrayNode();
            for (JsonNode child : node) sorted.add(sortKeys(child));
            return sorted;
        }
        return node;
    }

    @FunctionalInterface
    private interface ElementReader<T> {
        T read(JsonNode node, String path);
    }
}
