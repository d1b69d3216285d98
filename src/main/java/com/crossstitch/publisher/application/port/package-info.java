/**
 * Ports connecting the publish pipeline to external collaborators.
 * <p><strong>Role:</strong> Interfaces implemented by the {@code infrastructure} adapters and by in-memory
 * test doubles.</p>
 * <p><strong>Concurrency:</strong> Each port documents its own threading contract.</p>
 *
 * @since 0.1.0
 */
package com.crossstitch.publisher.application.port;
