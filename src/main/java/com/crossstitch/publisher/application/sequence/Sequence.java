package com.crossstitch.publisher.application.sequence;

import com.crossstitch.publisher.domain.error.StoreException;

/**
 * Strategy producing the next value of a sequence.
 *
 * @since 0.1.0
 * @see MaxQuerySequence
 * @see AtomicCounterSequence
 */
public interface Sequence {
  /**
   * Allocates the next value.
   *
   * @param kind sequence to advance
   * @param partitionKey album partition key ({@code ALB#0007}) for partitioned sequences, otherwise {@code null}
   * @return allocated value, at least 1
   * @throws StoreException if the item store fails
   */
  long next(SequenceKind kind, String partitionKey) throws StoreException;
}
