/**
 * Pin publication: board resolution, theme detection and SEO text.
 *
 * @since 0.1.0
 */
package com.crossstitch.publisher.application.pin;
