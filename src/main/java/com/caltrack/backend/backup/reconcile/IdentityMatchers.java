package com.caltrack.backend.backup.reconcile;

import com.caltrack.backend.dailylog.entity.FoodEntryEntity;
import com.caltrack.backend.product.entity.ProductEntity;
import com.caltrack.backend.supplement.entity.SupplementEntity;
import com.caltrack.backend.supplement.entity.SupplementEntryEntity;
import com.caltrack.backend.template.entity.AiFoodTemplateEntity;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Identity rules used when an incoming entity is compared with the store.
 * <ul>
 *   <li>product: same non-empty barcode, otherwise same (name, brand); a missing brand only matches a missing brand</li>
 *   <li>daily log: same calendar day</li>
 *   <li>food entry: timestamps within the tolerance and identical calories.
 *       Two real entries logged in the same second with the same calories collapse into one.</li>
 *   <li>AI template: name, ignoring case</li>
 *   <li>supplement: same (name, brand)</li>
 *   <li>supplement entry: timestamps within the tolerance and identical amount</li>
 * </ul>
 */
public final class IdentityMatchers {

    private IdentityMatchers() {}

    /** null when the product has no usable barcode */
    public static String barcodeKey(ProductEntity p) {
        String b = p.getBarcode();
        return (b == null || b.isEmpty()) ? null : b;
    }

    public static NameBrand nameBrandKey(ProductEntity p) {
        return new NameBrand(p.getName(), p.getBrand());
    }

    public static NameBrand nameBrandKey(SupplementEntity s) {
        return new NameBrand(s.getName(), s.getBrand());
    }

    public static String templateKey(AiFoodTemplateEntity t) {
        return t.getName() == null ? "" : t.getName().toLowerCase(Locale.ROOT);
    }

    public static boolean withinTolerance(Instant a, Instant b, Duration tolerance) {
        if (a == null || b == null) return false;
        return Duration.between(a, b).abs().compareTo(tolerance) <= 0;
    }

    public static boolean sameFoodEntry(FoodEntryEntity existing, FoodEntryEntity incoming, Duration tolerance) {
        return withinTolerance(existing.getTimestamp(), incoming.getTimestamp(), tolerance)
                && sameValue(existing.getCalories(), incoming.getCalories());
    }

    // null == null; 0.0 == -0.0
    static boolean sameValue(Double a, Double b) {
        if (a == null || b == null) return a == b;
        return a.doubleValue() == b.doubleValue();
    }

    public static boolean sameSupplementEntry(SupplementEntryEntity existing,
                                              SupplementEntryEntity incoming,
                                              Duration tolerance) {
        return withinTolerance(existing.getTimestamp(), incoming.getTimestamp(), tolerance)
                && Double.compare(existing.getAmount(), incoming.getAmount()) == 0;
    }

    /** exact, case-sensitive; null equals null */
    public record NameBrand(String name, String brand) {}
}
