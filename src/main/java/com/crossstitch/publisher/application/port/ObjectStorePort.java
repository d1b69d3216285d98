package com.crossstitch.publisher.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> Port over the object storage bucket that serves charts, PDFs and photos.
 * <p><strong>Role:</strong> Implemented by {@code S3ObjectStoreAdapter}; tests use an in-memory store.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for sequential use from one thread; the
 * pipeline never uploads concurrently.</p>
 *
 * @since 0.1.0
 */
public interface ObjectStorePort {
  /**
   * Uploads a local file under the given key, replacing any existing object.
   *
   * @param key object key such as {@code pdfs/7/12/Stitch12_1_Kit.pdf}
   * @param file local file to upload
   * @param contentType MIME type stored with the object
   * @throws IOException if the file cannot be read or the store rejects the upload
   */
  void put(String key, Path file, String contentType) throws IOException;

  /**
   * Deletes an object; deleting a missing key succeeds.
   *
   * @param key object key
   * @throws IOException if the store rejects the request
   */
  void delete(String key) throws IOException;

  /**
   * Lists every key under a prefix, following continuation tokens.
   *
   * @param prefix key prefix such as {@code pdfs/}
   * @return all matching keys
   * @throws IOException if listing fails
   */
  List<String> listKeys(String prefix) throws IOException;
}
