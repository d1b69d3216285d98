/**
 * Pattern metadata sources for design batches.
 */
package com.crossstitch.publisher.infrastructure.pattern;
