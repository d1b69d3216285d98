package com.crossstitch.publisher.application.users;

/**
 * Counters of one users maintenance pass.
 *
 * @param scanned items read
 * @param updated items changed
 * @param skipped items that already had every attribute
 * @param incomplete items lacking an attribute the pass needs, such as the key, the sort key or {@code CreatedAt}
 * @param errors items whose update failed and was skipped
 * @since 0.1.0
 */
public record MaintenanceReport(int scanned, int updated, int skipped, int incomplete, int errors) {
}
