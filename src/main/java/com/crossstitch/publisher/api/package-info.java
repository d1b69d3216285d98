/**
 * CLI entry points for publishing designs, running campaigns and the maintenance commands.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and telemetry,
 * and invokes use cases through {@link com.crossstitch.publisher.config.CompositionRoot}.</p>
 * <p><strong>Exit codes:</strong> see {@link com.crossstitch.publisher.api.ExitCode}.</p>
 * <p><strong>Security:</strong> Tokens and secrets are never echoed; dry-run output masks them.</p>
 */
package com.crossstitch.publisher.api;
