/**
 * Item store port and its query, scan and item value types.
 *
 * @since 0.1.0
 */
package com.crossstitch.publisher.application.port.store;
