/**
 * Design, album and batch value objects shared by the publish pipeline.
 *
 * @since 0.1.0
 */
package com.crossstitch.publisher.domain.design;
