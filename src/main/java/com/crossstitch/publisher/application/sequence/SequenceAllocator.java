package com.crossstitch.publisher.application.sequence;

import com.crossstitch.publisher.domain.design.DesignRecord;
import com.crossstitch.publisher.domain.error.StoreException;
import java.util.Objects;

/**
 * Derives the next design id, album page and global page for a publish run.
 *
 * <p>Design ids and global pages are returned unpadded; album pages are zero-padded to 5 digits.</p>
 *
 * @since 0.1.0
 */
public final class SequenceAllocator {
  private final Sequence sequence;

  public SequenceAllocator(Sequence sequence) {
    this.sequence = Objects.requireNonNull(sequence, "sequence");
  }

  /**
   * Allocates the next value of a sequence and formats it for storage.
   *
   * @param kind sequence to advance
   * @param partitionKey album partition key for {@link SequenceKind#ALBUM_PAGE}, otherwise {@code null}
   * @return formatted value ({@code "12"}, or {@code "00043"} for album pages)
   * @throws StoreException if the item store fails
   */
  public String allocateNext(SequenceKind kind, String partitionKey) throws StoreException {
    long value = sequence.next(kind, partitionKey);
    return kind == SequenceKind.ALBUM_PAGE ? formatPage(value) : Long.toString(value);
  }

  public int nextDesignId() throws StoreException {
    return Math.toIntExact(sequence.next(SequenceKind.DESIGN_ID, null));
  }

  public int nextGlobalPage() throws StoreException {
    return Math.toIntExact(sequence.next(SequenceKind.GLOBAL_PAGE, null));
  }

  public String nextAlbumPage(int albumId) throws StoreException {
    return allocateNext(SequenceKind.ALBUM_PAGE, DesignRecord.albumPartitionKey(albumId));
  }

  static String formatPage(long value) {
    return String.format("%05d", value);
  }
}
