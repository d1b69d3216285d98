/**
 * Design catalog persistence.
 *
 * @since 0.1.0
 */
package com.crossstitch.publisher.application.catalog;
