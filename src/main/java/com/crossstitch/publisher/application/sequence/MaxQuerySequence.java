package com.crossstitch.publisher.application.sequence;

import com.crossstitch.publisher.domain.error.StoreException;
import java.util.Objects;

/**
 * Legacy allocation: reads the current maximum and adds one.
 *
 * <p>Not safe against concurrent publishers. Two runs that read the same maximum allocate the same value;
 * the later catalog write overwrites the earlier one. Use {@link AtomicCounterSequence} unless the store
 * cannot hold counter items.</p>
 *
 * @since 0.1.0
 */
public final class MaxQuerySequence implements Sequence {
  private final CatalogMaxima maxima;

  public MaxQuerySequence(CatalogMaxima maxima) {
    this.maxima = Objects.requireNonNull(maxima, "maxima");
  }

  @Override
  public long next(SequenceKind kind, String partitionKey) throws StoreException {
    return maxima.currentMax(kind, partitionKey) + 1;
  }
}
