/**
 * Post-deploy infrastructure verification.
 * <p><strong>Concurrency:</strong> State polling fans out to one worker per instance; all other stages run on the
 * calling thread.</p>
 *
 * @since 0.1.0
 */
package com.crossstitch.publisher.application.infra;
