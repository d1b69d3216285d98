/**
 * Compute fleet value objects and the verification state machine states.
 *
 * @since 0.1.0
 */
package com.crossstitch.publisher.domain.fleet;
