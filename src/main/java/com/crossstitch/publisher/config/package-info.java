/**
 * Configuration loading and composition root wiring for the publisher CLI.
 * <p><strong>Role:</strong> Application bootstrap layer: YAML and CLI values are merged by {@link
 * com.crossstitch.publisher.config.ConfigMerger}, turned into typed records by the {@code *Config.fromMap}
 * factories, and wired to adapters by {@link com.crossstitch.publisher.config.CompositionRoot}.</p>
 * <p><strong>Concurrency:</strong> Configuration records are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Access tokens and the unsubscribe secret never appear in {@code toString} or
 * dry-run output.</p>
 */
package com.crossstitch.publisher.config;
