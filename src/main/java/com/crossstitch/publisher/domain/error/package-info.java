/**
 * Checked failure hierarchy of the publish pipeline, tagged by {@link com.crossstitch.publisher.domain.error.ErrorKind}.
 *
 * @since 0.1.0
 */
package com.crossstitch.publisher.domain.error;
