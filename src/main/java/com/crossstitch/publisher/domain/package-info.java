/**
 * Domain model of the design publisher: designs, albums, recipients, fleet state and pipeline failures.
 * <p><strong>Role:</strong> Pure value objects with no I/O; shared by application use cases and adapters.</p>
 * <p><strong>Concurrency:</strong> All types are immutable.</p>
 *
 * @since 0.1.0
 */
package com.crossstitch.publisher.domain;
