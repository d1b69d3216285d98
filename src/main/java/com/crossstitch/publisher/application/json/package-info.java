/**
 * Streaming JSON helpers built on Jackson core.
 *
 * @since 0.1.0
 */
package com.crossstitch.publisher.application.json;
