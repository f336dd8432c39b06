package com.caltrack.backend.backup.codec;

import com.caltrack.backend.backup.config.BackupProperties;
import com.caltrack.backend.common.time.LocalDayResolver;
import com.caltrack.backend.common.time.StoreTimeProperties;
import com.caltrack.backend.dailylog.entity.FoodEntryEntity;
import com.caltrack.backend.nutrient.NutrientId;
import com.caltrack.backend.nutrient.NutrientMap;
import com.caltrack.backend.product.entity.ProductEntity;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static com.caltrack.backend.testsupport.Fixtures.*;
import static org.assertj.core.api.Assertions.*;

class BackupCodecTest {

    private static final Instant EXPORTED = Instant.parse("2026-01-20T09:30:00Z");

    private final BackupCodec codec = new BackupCodec(new BackupProperties(), resolver("UTC"));

    private static LocalDayResolver resolver(String zone) {
        StoreTimeProperties props = new StoreTimeProperties();
        props.setZone(zone);
        return new LocalDayResolver(props, Clock.fixed(EXPORTED, ZoneOffset.UTC));
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void export_is_byte_identical_regardless_of_load_order() {
        ProductEntity a = product("00000000-0000-0000-0000-00000000000a", "Apple", null, null);
        ProductEntity b = product("00000000-0000-0000-0000-00000000000b", "Bread", "Hovis", "5010");
        FoodEntryEntity e = entry("00000000-0000-0000-0000-0000000000e1", a.getId(), null,
                Instant.parse("2026-01-15T08:00:00Z"), 52.0);

        byte[] first = codec.encode(new BackupGraph(List.of(a, b), null, List.of(e), null, null, null), EXPORTED);
        byte[] second = codec.encode(new BackupGraph(List.of(b, a), null, List.of(e), null, null, null), EXPORTED);

        assertThat(second).isEqualTo(first);

        String json = new String(first, StandardCharsets.UTF_8);
        assertThat(json.indexOf("\"aiTemplates\"")).isLessThan(json.indexOf("\"dailyLogs\""));
        assertThat(json.indexOf("\"calories\"")).isLessThan(json.indexOf("\"name\""));
        assertThat(json.indexOf("Apple")).isLessThan(json.indexOf("Bread"));
    }

    @Test
    void decodes_a_version_1_document_without_supplement_arrays() {
        String doc = """
            {
              "version": 1,
              "exportDate": "2026-01-16T07:00:00Z",
              "products": [{
                "id": "6F9619FF-8B86-D011-B42D-00C04FC964FF",
                "name": "Oats", "brand": "Quaker", "servingSize": 100, "servingSizeUnit": "g",
                "portionSize": 40, "portionsPerPackage": 25,
                "calories": 389, "protein": 16.9, "carbohydrates": 66.3, "fat": 6.9,
                "fibre": 0, "iron": 4.7, "magnesium": 177,
                "dateAdded": "2025-12-01T10:00:00Z", "isCustom": false
              }],
              "dailyLogs": [{
                "id": "1b4e28ba-2fa1-11d2-883f-0016d3cca427",
                "date": "2026-01-15T23:59:00Z",
                "calorieTarget": 2000, "proteinTarget": 50, "carbTarget": 250, "fatTarget": 65
              }],
              "foodEntries": [{
                "id": "2c1d2e3f-0000-4000-8000-000000000001",
                "productId": "6F9619FF-8B86-D011-B42D-00C04FC964FF",
                "dailyLogId": "1b4e28ba-2fa1-11d2-883f-0016d3cca427",
                "amount": 40, "unit": "g", "timestamp": "2026-01-15T07:30:00.250Z",
                "calories": 155.6, "protein": 6.76, "carbohydrates": 26.52, "fat": 2.76,
                "sugar": 0.4, "naturalSugar": 0.4, "addedSugar": 0, "fibre": 4, "sodium": 0.002,
                "aiGenerated": false
              }],
              "aiTemplates": []
            }
            """;

        DecodedBackup decoded = codec.decode(utf8(doc));
        BackupGraph g = decoded.graph();

        assertThat(decoded.version()).isEqualTo(1);
        assertThat(decoded.exportDate()).isEqualTo(Instant.parse("2026-01-16T07:00:00Z"));

        ProductEntity oats = g.products().get(0);
        assertThat(oats.getPortionGrams()).isEqualTo(40.0);
        assertThat(oats.getPortionsPerPackage()).isEqualTo(25);
        assertThat(oats.getFibrePer100g()).isEqualTo(0.0);
        assertThat(oats.getSugarPer100g()).isNull();
        assertThat(oats.getNutrientsPer100g().valueOrNull(NutrientId.IRON)).isEqualTo(4.7);
        assertThat(oats.getNutrientsPer100g().size()).isEqualTo(2);

        assertThat(g.dailyLogs().get(0).getLogDate()).isEqualTo(LocalDate.of(2026, 1, 15));

        FoodEntryEntity e = g.foodEntries().get(0);
        assertThat(e.getProductId()).isEqualTo("6F9619FF-8B86-D011-B42D-00C04FC964FF");
        assertThat(e.getTimestamp()).isEqualTo(Instant.parse("2026-01-15T07:30:00.250Z"));
        assertThat(e.getNutrients()).isEqualTo(NutrientMap.EMPTY);

        assertThat(g.supplements()).isEmpty();
        assertThat(g.supplementEntries()).isEmpty();
    }

    @Test
    void day_boundaries_follow_the_store_zone() {
        BackupCodec tokyo = new BackupCodec(new BackupProperties(), resolver("Asia/Tokyo"));
        String doc = """
            {"version":1,"dailyLogs":[{"id":"1b4e28ba-2fa1-11d2-883f-0016d3cca427","date":"2026-01-15T16:00:01Z",
              "calorieTarget":2000,"proteinTarget":50,"carbTarget":250,"fatTarget":65}]}
            """;

        assertThat(tokyo.decode(utf8(doc)).graph().dailyLogs().get(0).getLogDate())
                .isEqualTo(LocalDate.of(2026, 1, 16));
        assertThat(codec.decode(utf8(doc)).graph().dailyLogs().get(0).getLogDate())
                .isEqualTo(LocalDate.of(2026, 1, 15));
    }

    @Test
    void images_travel_as_base64_and_absent_values_stay_absent() {
        ProductEntity p = product("00000000-0000-0000-0000-00000000000a", "Apple", null, null);
        p.setImageData(new byte[]{1, 2, 3});
        p.setSugarPer100g(0.0);
        p.setSodiumPer100g(null);

        byte[] doc = codec.encode(new BackupGraph(List.of(p), null, null, null, null, null), EXPORTED);
        assertThat(new String(doc, StandardCharsets.UTF_8)).contains("\"imageDataBase64\" : \"AQID\"");

        ProductEntity back = codec.decode(doc).graph().products().get(0);
        assertThat(back.getImageData()).containsExactly(1, 2, 3);
        assertThat(back.getMainImageData()).isNull();
        assertThat(back.getSugarPer100g()).isEqualTo(0.0);
        assertThat(back.getSodiumPer100g()).isNull();
        assertThat(back.getNutrientsPer100g()).isEqualTo(p.getNutrientsPer100g());
    }

    @Test
    void missing_version_is_rejected() {
        assertThatThrownBy(() -> codec.decode(utf8("{\"products\":[]}")))
                .isInstanceOf(MalformedBackupException.class)
                .extracting(ex -> ((MalformedBackupException) ex).getCode())
                .isEqualTo("BACKUP_VERSION_MISSING");
    }

    @Test
    void unknown_version_is_rejected() {
        assertThatThrownBy(() -> codec.decode(utf8("{\"version\":2,\"products\":[]}")))
                .isInstanceOf(UnsupportedVersionException.class)
                .isInstanceOf(MalformedBackupException.class)
                .satisfies(ex -> assertThat(((UnsupportedVersionException) ex).getVersion()).isEqualTo(2));
    }

    @Test
    void garbage_is_unparseable() {
        for (String doc : new String[]{"not json", "[1,2,3]", ""}) {
            assertThatThrownBy(() -> codec.decode(utf8(doc)))
                    .isInstanceOf(MalformedBackupException.class)
                    .extracting(ex -> ((MalformedBackupException) ex).getCode())
                    .isEqualTo("BACKUP_UNPARSEABLE");
        }
    }

    @Test
    void bad_fields_name_their_path() {
        String doc = """
            {"version":1,"foodEntries":[{"id":"2c1d2e3f-0000-4000-8000-000000000001",
              "amount":40,"timestamp":"yesterday"}]}
            """;

        assertThatThrownBy(() -> codec.decode(utf8(doc)))
                .isInstanceOf(MalformedBackupException.class)
                .hasMessageContaining("BACKUP_INVALID_FIELD")
                .hasMessageContaining("foodEntries[0].timestamp");

        assertThatThrownBy(() -> codec.decode(utf8("{\"version\":1,\"products\":{}}")))
                .hasMessageContaining("$.products not an array");
    }

    @Test
    void integers_outside_int_range_are_rejected() {
        String doc = """
            {"version":1,"products":[{"id":"6F9619FF-8B86-D011-B42D-00C04FC964FF",
              "name":"Rice","servingSize":100,"servingSizeUnit":"g",
              "calories":130,"protein":2.7,"carbohydrates":28,"fat":0.3,
              "portionsPerPackage":3000000000,
              "dateAdded":"2025-12-01T10:00:00Z","isCustom":false}]}
            """;

        assertThatThrownBy(() -> codec.decode(utf8(doc)))
                .isInstanceOf(MalformedBackupException.class)
                .hasMessageContaining("BACKUP_INVALID_FIELD")
                .hasMessageContaining("products[0].portionsPerPackage");
    }

    @Test
    void export_file_name() {
        assertThat(BackupFileNames.exportFileName(LocalDateTime.of(2026, 1, 15, 8, 30, 5)))
                .isEqualTo("CalorieTracker_Backup_2026-01-15_083005.json");
    }
}
