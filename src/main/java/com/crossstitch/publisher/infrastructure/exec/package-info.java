/**
 * Executor factories for bounded worker pools.
 * <p><strong>Role:</strong> Infrastructure utilities configuring the verifier's polling threads.</p>
 * <p><strong>Concurrency:</strong> Factory methods are thread-safe and return managed executors that callers shut down.</p>
 */
package com.crossstitch.publisher.infrastructure.exec;
