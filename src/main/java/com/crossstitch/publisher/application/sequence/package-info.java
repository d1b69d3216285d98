/**
 * Sequence allocation for design ids and page numbers.
 * <p><strong>Concurrency:</strong> {@link com.crossstitch.publisher.application.sequence.AtomicCounterSequence}
 * is safe across concurrent publishers; {@link com.crossstitch.publisher.application.sequence.MaxQuerySequence}
 * is not.</p>
 *
 * @since 0.1.0
 */
package com.crossstitch.publisher.application.sequence;
