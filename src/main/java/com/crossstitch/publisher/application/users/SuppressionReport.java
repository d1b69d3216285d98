package com.crossstitch.publisher.application.users;

/**
 * Counters of one suppressed-user removal.
 *
 * @param emails suppressed emails processed
 * @param deleted user items deleted, or that would be deleted in a dry run
 * @param missing emails without any user item
 * @param missingSortKey user items without {@code NPage}, which cannot be addressed for deletion
 * @param errors emails whose lookup or delete failed
 * @param dryRun whether deletes were only reported
 * @since 0.1.0
 */
public record SuppressionReport(int emails, int deleted, int missing, int missingSortKey, int errors, boolean dryRun) {
}
