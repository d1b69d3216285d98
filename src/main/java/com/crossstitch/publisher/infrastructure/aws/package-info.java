/**
 * AWS SDK v2 adapters for object storage, the item store, the compute fleet and email delivery.
 * <p><strong>Role:</strong> Adapter layer; each class implements one application port and owns its client.</p>
 * <p><strong>Concurrency:</strong> SDK clients are thread-safe; adapters add no mutable state.</p>
 * <p><strong>Errors:</strong> {@code SdkException} is translated at this boundary, to {@code IOException} or
 * {@code StoreException}; SDK types never reach the application layer.</p>
 * <p><strong>Credentials:</strong> Resolved by the SDK default provider chain.</p>
 */
package com.crossstitch.publisher.infrastructure.aws;
