/**
 * Public URL construction for designs, images and albums.
 *
 * @since 0.1.0
 */
package com.crossstitch.publisher.application.links;
