/**
 * Campaign value objects: recipients and outbound messages.
 *
 * @since 0.1.0
 */
package com.crossstitch.publisher.domain.campaign;
