package com.caltrack.backend.backup.codec;

import com.caltrack.backend.common.time.LocalDayResolver;
import com.caltrack.backend.dailylog.entity.DailyLogEntity;
import com.caltrack.backend.dailylog.entity.FoodEntryEntity;
import com.caltrack.backend.nutrient.NutrientMap;
import com.caltrack.backend.product.entity.ProductEntity;
import com.caltrack.backend.supplement.entity.SupplementEntity;
import com.caltrack.backend.supplement.entity.SupplementEntryEntity;
import com.caltrack.backend.template.entity.AiFoodTemplateEntity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Base64;
import java.util.Map;

/**
 * Entity <-> JSON object for every backup array.
 * Products and templates keep nutrients as top-level fields; entries and supplements nest them under "nutrients".
 * Absent values are omitted on write and stay null on read.
 */
final class BackupEntityMapper {

    private static final JsonNodeFactory F = JsonNodeFactory.instance;

    private final LocalDayResolver days;

    BackupEntityMapper(LocalDayResolver days) {
        this.days = days;
    }

    // ===== products =====

    ObjectNode writeProduct(ProductEntity p) {
        ObjectNode n = F.objectNode();
        n.put("id", p.getId());
        n.put("name", p.getName());
        putText(n, "barcode", p.getBarcode());
        putText(n, "brand", p.getBrand());
        putNumber(n, "servingSize", p.getServingSize());
        putText(n, "servingSizeUnit", p.getServingSizeUnit());
        putNumber(n, "portionSize", p.getPortionGrams());
        if (p.getPortionsPerPackage() != null) n.put("portionsPerPackage", p.getPortionsPerPackage());
        putNumber(n, "calories", p.getCaloriesPer100g());
        putNumber(n, "protein", p.getProteinPer100g());
        putNumber(n, "carbohydrates", p.getCarbsPer100g());
        putNumber(n, "fat", p.getFatPer100g());
        putNumber(n, "saturatedFat", p.getSaturatedFatPer100g());
        putNumber(n, "transFat", p.getTransFatPer100g());
        putNumber(n, "fibre", p.getFibrePer100g());
        putNumber(n, "sugar", p.getSugarPer100g());
        putNumber(n, "naturalSugar", p.getNaturalSugarPer100g());
        putNumber(n, "addedSugar", p.getAddedSugarPer100g());
        putNumber(n, "sodium", p.getSodiumPer100g());
        putNumber(n, "cholesterol", p.getCholesterolPer100g());
        putFlatNutrients(n, p.getNutrientsPer100g());
        putInstant(n, "dateAdded", p.getDateAdded());
        n.put("isCustom", p.isCustom());
        putBase64(n, "imageDataBase64", p.getImageData());
        putBase64(n, "mainImageDataBase64", p.getMainImageData());
        putText(n, "notes", p.getNotes());
        return n;
    }

    ProductEntity readProduct(JsonNode node, String path) {
        JsonFieldReader r = new JsonFieldReader(node, path);
        ProductEntity p = new ProductEntity();
        p.setId(r.id("id"));
        p.setName(r.requiredText("name"));
        p.setBarcode(r.optionalText("barcode"));
        p.setBrand(r.optionalText("brand"));
        p.setServingSize(r.number("servingSize", 100.0));
        p.setServingSizeUnit(r.text("servingSizeUnit", "g"));
        p.setPortionGrams(r.optionalDouble("portionSize"));
        p.setPortionsPerPackage(r.optionalInt("portionsPerPackage"));
        p.setCaloriesPer100g(r.optionalDouble("calories"));
        p.setProteinPer100g(r.optionalDouble("protein"));
        p.setCarbsPer100g(r.optionalDouble("carbohydrates"));
        p.setFatPer100g(r.optionalDouble("fat"));
        p.setSaturatedFatPer100g(r.optionalDouble("saturatedFat"));
        p.setTransFatPer100g(r.optionalDouble("transFat"));
        p.setFibrePer100g(r.optionalDouble("fibre"));
        p.setSugarPer100g(r.optionalDouble("sugar"));
        p.setNaturalSugarPer100g(r.optionalDouble("naturalSugar"));
        p.setAddedSugarPer100g(r.optionalDouble("addedSugar"));
        p.setSodiumPer100g(r.optionalDouble("sodium"));
        p.setCholesterolPer100g(r.optionalDouble("cholesterol"));
        p.setNutrientsPer100g(r.flatNutrients());
        p.setDateAdded(r.optionalInstant("dateAdded"));
        p.setCustom(r.bool("isCustom", false));
        p.setImageData(r.optionalBase64("imageDataBase64"));
        p.setMainImageData(r.optionalBase64("mainImageDataBase64"));
        p.setNotes(r.optionalText("notes"));
        return p;
    }

    // ===== daily logs =====

    /** date is exported as the instant of local midnight */
    ObjectNode writeDailyLog(DailyLogEntity d) {
        ObjectNode n = F.objectNode();
        n.put("id", d.getId());
        putInstant(n, "date", days.startOfDay(d.getLogDate()));
        n.put("calorieTarget", d.getCalorieTarget());
        n.put("proteinTarget", d.getProteinTarget());
        n.put("carbTarget", d.getCarbTarget());
        n.put("fatTarget", d.getFatTarget());
        return n;
    }

    DailyLogEntity readDailyLog(JsonNode node, String path) {
        JsonFieldReader r = new JsonFieldReader(node, path);
        DailyLogEntity d = new DailyLogEntity();
        d.setId(r.id("id"));
        d.setLogDate(days.dayOf(r.requiredInstant("date")));
        d.setCalorieTarget(r.requiredDouble("calorieTarget"));
        d.setProteinTarget(r.requiredDouble("proteinTarget"));
        d.setCarbTarget(r.requiredDouble("carbTarget"));
        d.setFatTarget(r.requiredDouble("fatTarget"));
        return d;
    }

    // ===== food entries =====

    ObjectNode writeFoodEntry(FoodEntryEntity e) {
        ObjectNode n = F.objectNode();
        n.put("id", e.getId());
        putText(n, "productId", e.getProductId());
        putText(n, "productName", e.getProductName());
        putText(n, "dailyLogId", e.getDailyLogId());
        putText(n, "customFoodName", e.getCustomFoodName());
        n.put("amount", e.getAmount());
        putText(n, "unit", e.getUnit());
        putInstant(n, "timestamp", e.getTimestamp());
        putNumber(n, "calories", e.getCalories());
        putNumber(n, "protein", e.getProtein());
        putNumber(n, "carbohydrates", e.getCarbohydrates());
        putNumber(n, "fat", e.getFat());
        putNumber(n, "sugar", e.getSugar());
        putNumber(n, "naturalSugar", e.getNaturalSugar());
        putNumber(n, "addedSugar", e.getAddedSugar());
        putNumber(n, "fibre", e.getFibre());
        putNumber(n, "sodium", e.getSodium());
        putNestedNutrients(n, e.getNutrients());
        n.put("aiGenerated", e.isAiGenerated());
        putText(n, "aiPrompt", e.getAiPrompt());
        return n;
    }

    FoodEntryEntity readFoodEntry(JsonNode node, String path) {
        JsonFieldReader r = new JsonFieldReader(node, path);
        FoodEntryEntity e = new FoodEntryEntity();
        e.setId(r.id("id"));
        e.setProductId(r.optionalId("productId"));
        e.setProductName(r.optionalText("productName"));
        e.setDailyLogId(r.optionalId("dailyLogId"));
        e.setCustomFoodName(r.optionalText("customFoodName"));
        e.setAmount(r.requiredDouble("amount"));
        e.setUnit(r.text("unit", "g"));
        e.setTimestamp(r.requiredInstant("timestamp"));
        e.setCalories(r.optionalDouble("calories"));
        e.setProtein(r.optionalDouble("protein"));
        e.setCarbohydrates(r.optionalDouble("carbohydrates"));
        e.setFat(r.optionalDouble("fat"));
        e.setSugar(r.optionalDouble("sugar"));
        e.setNaturalSugar(r.optionalDouble("naturalSugar"));
        e.setAddedSugar(r.optionalDouble("addedSugar"));
        e.setFibre(r.optionalDouble("fibre"));
        e.setSodium(r.optionalDouble("sodium"));
        e.setNutrients(r.nestedNutrients("nutrients"));
        e.setAiGenerated(r.bool("aiGenerated", false));
        e.setAiPrompt(r.optionalText("aiPrompt"));
        return e;
    }

    // ===== ai templates =====

    ObjectNode writeAiTemplate(AiFoodTemplateEntity t) {
        ObjectNode n = F.objectNode();
        n.put("id", t.getId());
        n.put("name", t.getName());
        n.put("amount", t.getAmount());
        putText(n, "unit", t.getUnit());
        n.put("weightInGrams", t.getWeightInGrams());
        putNumber(n, "calories", t.getCalories());
        putNumber(n, "protein", t.getProtein());
        putNumber(n, "carbohydrates", t.getCarbohydrates());
        putNumber(n, "fat", t.getFat());
        putNumber(n, "sugar", t.getSugar());
        putNumber(n, "naturalSugar", t.getNaturalSugar());
        putNumber(n, "addedSugar", t.getAddedSugar());
        putNumber(n, "fibre", t.getFibre());
        putNumber(n, "sodium", t.getSodium());
        putFlatNutrients(n, t.getNutrients());
        putText(n, "aiPrompt", t.getAiPrompt());
        n.put("useCount", t.getUseCount());
        putInstant(n, "lastUsed", t.getLastUsed());
        putInstant(n, "dateCreated", t.getDateCreated());
        return n;
    }

    AiFoodTemplateEntity readAiTemplate(JsonNode node, String path) {
        JsonFieldReader r = new JsonFieldReader(node, path);
        AiFoodTemplateEntity t = new AiFoodTemplateEntity();
        t.setId(r.id("id"));
        t.setName(r.requiredText("name"));
        t.setAmount(r.requiredDouble("amount"));
        t.setUnit(r.text("unit", "serving"));
        t.setWeightInGrams(r.requiredDouble("weightInGrams"));
        t.setCalories(r.optionalDouble("calories"));
        t.setProtein(r.optionalDouble("protein"));
        t.setCarbohydrates(r.optionalDouble("carbohydrates"));
        t.setFat(r.optionalDouble("fat"));
        t.setSugar(r.optionalDouble("sugar"));
        t.setNaturalSugar(r.optionalDouble("naturalSugar"));
        t.setAddedSugar(r.optionalDouble("addedSugar"));
        t.setFibre(r.optionalDouble("fibre"));
        t.setSodium(r.optionalDouble("sodium"));
        t.setNutrients(r.flatNutrients());
        t.setAiPrompt(r.optionalText("aiPrompt"));
        Integer useCount = r.optionalInt("useCount");
        t.setUseCount(useCount == null ? 1 : useCount);
        t.setLastUsed(r.optionalInstant("lastUsed"));
        t.setDateCreated(r.optionalInstant("dateCreated"));
        return t;
    }

    // ===== supplements =====

    ObjectNode writeSupplement(SupplementEntity s) {
        ObjectNode n = F.objectNode();
        n.put("id", s.getId());
        n.put("name", s.getName());
        putText(n, "brand", s.getBrand());
        putText(n, "dosageForm", s.getDosageForm());
        n.put("servingSize", s.getServingSize());
        putText(n, "servingSizeUnit", s.getServingSizeUnit());
        putNestedNutrients(n, s.getNutrientsPerServing());
        putText(n, "notes", s.getNotes());
        putBase64(n, "imageDataBase64", s.getImageData());
        putInstant(n, "dateAdded", s.getDateAdded());
        return n;
    }

    SupplementEntity readSupplement(JsonNode node, String path) {
        JsonFieldReader r = new JsonFieldReader(node, path);
        SupplementEntity s = new SupplementEntity();
        s.setId(r.id("id"));
        s.setName(r.requiredText("name"));
        s.setBrand(r.optionalText("brand"));
        s.setDosageForm(r.text("dosageForm", "tablet"));
        s.setServingSize(r.number("servingSize", 1.0));
        s.setServingSizeUnit(r.text("servingSizeUnit", "tablet"));
        s.setNutrientsPerServing(r.nestedNutrients("nutrients"));
        s.setNotes(r.optionalText("notes"));
        s.setImageData(r.optionalBase64("imageDataBase64"));
        s.setDateAdded(r.optionalInstant("dateAdded"));
        return s;
    }

    ObjectNode writeSupplementEntry(SupplementEntryEntity e) {
        ObjectNode n = F.objectNode();
        n.put("id", e.getId());
        putText(n, "supplementId", e.getSupplementId());
        putText(n, "supplementName", e.getSupplementName());
        putText(n, "dailyLogId", e.getDailyLogId());
        n.put("amount", e.getAmount());
        putText(n, "unit", e.getUnit());
        putInstant(n, "timestamp", e.getTimestamp());
        putNestedNutrients(n, e.getNutrients());
        return n;
    }

    SupplementEntryEntity readSupplementEntry(JsonNode node, String path) {
        JsonFieldReader r = new JsonFieldReader(node, path);
        SupplementEntryEntity e = new SupplementEntryEntity();
        e.setId(r.id("id"));
        e.setSupplementId(r.optionalId("supplementId"));
        e.setSupplementName(r.optionalText("supplementName"));
        e.setDailyLogId(r.optionalId("dailyLogId"));
        e.setAmount(r.requiredDouble("amount"));
        e.setUnit(r.text("unit", "tablet"));
        e.setTimestamp(r.requiredInstant("timestamp"));
        e.setNutrients(r.nestedNutrients("nutrients"));
        return e;
    }

    // ===== helpers =====

    private static void putText(ObjectNode n, String key, String v) {
        if (v != null) n.put(key, v);
    }

    private static void putNumber(ObjectNode n, String key, Double v) {
        if (v != null) n.put(key, v);
    }

    private static void putInstant(ObjectNode n, String key, Instant v) {
        if (v != null) n.put(key, v.toString());
    }

    private static void putBase64(ObjectNode n, String key, byte[] v) {
        if (v != null) n.put(key, Base64.getEncoder().encodeToString(v));
    }

    private static void putFlatNutrients(ObjectNode n, NutrientMap m) {
        if (m == null) return;
        for (Map.Entry<String, Double> e : m.toJsonKeys().entrySet()) {
            n.put(e.getKey(), e.getValue());
        }
    }

    private static void putNestedNutrients(ObjectNode n, NutrientMap m) {
        ObjectNode nested = F.objectNode();
        if (m != null) {
            for (Map.Entry<String, Double> e : m.toJsonKeys().entrySet()) {
                nested.put(e.getKey(), e.getValue());
            }
        }
        n.set("nutrients", nested);
    }
}
