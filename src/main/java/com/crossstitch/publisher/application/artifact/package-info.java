/**
 * Batch discovery, PDF conversion and artifact upload.
 *
 * @since 0.1.0
 */
package com.crossstitch.publisher.application.artifact;
