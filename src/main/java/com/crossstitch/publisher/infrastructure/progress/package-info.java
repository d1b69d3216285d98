/**
 * Single-owner delivery of progress messages.
 *
 * @since 0.1.0
 */
package com.crossstitch.publisher.infrastructure.progress;
