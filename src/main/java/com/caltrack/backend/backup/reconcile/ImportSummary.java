package com.caltrack.backend.backup.reconcile;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-type import counts. danglingReferences counts foreign keys that pointed nowhere and were dropped.
 */
public record ImportSummary(
        Counts products,
        Counts dailyLogs,
        Counts foodEntries,
        Counts aiTemplates,
        Counts supplements,
        Counts supplementEntries,
        int danglingReferences
) {

    public record Counts(int imported, int skipped) {}

    public int totalImported() {
        return products.imported() + dailyLogs.imported() + foodEntries.imported()
                + aiTemplates.imported() + supplements.imported() + supplementEntries.imported();
    }

    public int totalSkipped() {
        return products.skipped() + dailyLogs.skipped() + foodEntries.skipped()
                + aiTemplates.skipped() + supplements.skipped() + supplementEntries.skipped();
    }

    /** "Imported: 2 products, 1 days" */
    public String summaryText() {
        List<String> parts = new ArrayList<>();
        if (products.imported() > 0) parts.add(products.imported() + " products");
        if (dailyLogs.imported() > 0) parts.add(dailyLogs.imported() + " days");
        if (foodEntries.imported() > 0) parts.add(foodEntries.imported() + " entries");
        if (aiTemplates.imported() > 0) parts.add(aiTemplates.imported() + " templates");
        if (supplements.imported() > 0) parts.add(supplements.imported() + " supplements");
        if (supplementEntries.imported() > 0) parts.add(supplementEntries.imported() + " supplement entries");

        if (parts.isEmpty()) return "No new data imported (all items already exist)";
        return "Imported: " + String.join(", ", parts);
    }

    /** empty when nothing was skipped */
    public String skippedText() {
        int total = totalSkipped();
        return total == 0 ? "" : total + " duplicate items skipped";
    }

    static final class Builder {
        private int productsImported, productsSkipped;
        private int daysImported, daysSkipped;
        private int entriesImported, entriesSkipped;
        private int templatesImported, templatesSkipped;
        private int supplementsImported, supplementsSkipped;
        private int supplementEntriesImported, supplementEntriesSkipped;
        private int dangling;

        void product(boolean imported) { if (imported) productsImported++; else productsSkipped++; }
        void day(boolean imported) { if (imported) daysImported++; else daysSkipped++; }
        void foodEntry(boolean imported) { if (imported) entriesImported++; else entriesSkipped++; }
        void template(boolean imported) { if (imported) templatesImported++; else templatesSkipped++; }
        void supplement(boolean imported) { if (imported) supplementsImported++; else supplementsSkipped++; }
        void supplementEntry(boolean imported) { if (imported) supplementEntriesImported++; else supplementEntriesSkipped++; }
        void dangling() { dangling++; }

        ImportSummary build() {
            return new ImportSummary(
                    new Counts(productsImported, productsSkipped),
                    new Counts(daysImported, daysSkipped),
                    new Counts(entriesImported, entriesSkipped),
                    new Counts(templatesImported, templatesSkipped),
                    new Counts(supplementsImported, supplementsSkipped),
                    new Counts(supplementEntriesImported, supplementEntriesSkipped),
                    dangling
            );
        }
    }
}
