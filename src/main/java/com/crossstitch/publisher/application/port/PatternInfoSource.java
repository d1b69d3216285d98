package com.crossstitch.publisher.application.port;

import com.crossstitch.publisher.domain.design.DesignBatch;
import com.crossstitch.publisher.domain.design.PatternInfo;
import com.crossstitch.publisher.domain.error.NotFoundException;
import java.io.IOException;

/**
 * Extracts title, notes and dimensions for the design in a batch.
 *
 * @since 0.1.0
 */
public interface PatternInfoSource {
  /**
   * Reads pattern metadata for a batch.
   *
   * @param batch batch being published
   * @return pattern metadata
   * @throws NotFoundException if the batch carries no pattern metadata
   * @throws IOException if the metadata cannot be read or parsed
   */
  PatternInfo read(DesignBatch batch) throws NotFoundException, IOException;
}
