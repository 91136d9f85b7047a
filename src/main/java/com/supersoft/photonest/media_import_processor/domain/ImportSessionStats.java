package com.supersoft.photonest.media_import_processor.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counters derived from a session's selections. Recomputed from the store, never authoritative.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportSessionStats {

    public static final int SCHEMA_VERSION = 1;

    private int schemaVersion;
    private int total;
    private int pending;
    private int processing;
    private int success;
    private int failed;
    private int skipped;
    private double successRate;
    private Map<String, Integer> countsByStatus;

    public static ImportSessionStats fromCounts(Map<PickerSelection.SelectionStatus, Integer> counts) {
        Map<String, Integer> byStatus = new TreeMap<>();
        int total = 0;
        int pending = 0;
        int processing = 0;
        int success = 0;
        int failed = 0;
        int skipped = 0;

        for (Map.Entry<PickerSelection.SelectionStatus, Integer> entry : counts.entrySet()) {
            int count = entry.getValue() == null ? 0 : entry.getValue();
            if (count == 0) {
                continue;
            }
            byStatus.put(entry.getKey().name().toLowerCase(Locale.ROOT), count);
            total += count;
            switch (entry.getKey()) {
                case ENQUEUED:
                    pending += count;
                    break;
                case RUNNING:
                    processing += count;
                    break;
                case IMPORTED:
                case DUP:
                    success += count;
                    break;
                case FAILED:
                case EXPIRED:
                    failed += count;
                    break;
                case SKIPPED:
                    skipped += count;
                    break;
                default:
                    break;
            }
        }

        return ImportSessionStats.builder()
                .schemaVersion(SCHEMA_VERSION)
                .total(total)
                .pending(pending)
                .processing(processing)
                .success(success)
                .failed(failed)
                .skipped(skipped)
                .successRate(total == 0 ? 0.0 : (double) success / total)
                .countsByStatus(byStatus)
                .build();
    }

    @JsonIgnore
    public boolean isAllTerminal() {
        return pending == 0 && processing == 0;
    }
}
