package com.crossstitch.publisher.infrastructure.aws;

import com.crossstitch.publisher.application.port.ObjectStorePort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * <strong>What:</strong> {@link ObjectStorePort} backed by one S3 bucket.
 * <p><strong>Errors:</strong> SDK failures are rethrown as {@link IOException} so callers classify them as
 * upload or I/O failures.</p>
 * <p><strong>Thread-safety:</strong> {@link S3Client} is thread-safe; the adapter holds no other state.</p>
 *
 * @since 0.1.0
 */
public final class S3ObjectStoreAdapter implements ObjectStorePort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(S3ObjectStoreAdapter.class);

  private final S3Client client;
  private final String bucket;

  /**
   * Creates an adapter with a client for the given region using the default credential chain.
   *
   * @param region AWS region id such as {@code us-east-1}
   * @param bucket bucket name
   */
  public S3ObjectStoreAdapter(String region, String bucket) {
    this(S3Client.builder().region(Region.of(region)).build(), bucket);
  }

  /**
   * Creates an adapter over an existing client.
   *
   * @param client S3 client; closed by {@link #close()}
   * @param bucket bucket name
   */
  public S3ObjectStoreAdapter(S3Client client, String bucket) {
    this.client = Objects.requireNonNull(client, "client");
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalArgumentException("bucket must not be blank");
    }
    this.bucket = bucket.trim();
  }

  @Override
  public void put(String key, Path file, String contentType) throws IOException {
    if (!Files.isRegularFile(file)) {
      throw new IOException("Upload source is not a file: " + file);
    }
    PutObjectRequest request = PutObjectRequest.builder()
        .bucket(bucket)
        .key(key)
        .contentType(contentType)
        .build();
    try {
      PutObjectResponse response = client.putObject(request, RequestBody.fromFile(file));
      log.debug("Stored s3://{}/{} etag={}", bucket, key, response.eTag());
    } catch (SdkException ex) {
      throw new IOException("S3 put failed for s3://" + bucket + "/" + key + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public void delete(String key) throws IOException {
    try {
      client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
      log.info("Deleted s3://{}/{}", bucket, key);
    } catch (SdkException ex) {
      throw new IOException("S3 delete failed for s3://" + bucket + "/" + key + ": " + ex.getMessage(), ex);
    }
  }

  @Override
  public List<String> listKeys(String prefix) throws IOException {
    ListObjectsV2Request request = ListObjectsV2Request.builder().bucket(bucket).prefix(prefix).build();
    List<String> keys = new ArrayList<>();
    try {
      for (S3Object object : client.listObjectsV2Paginator(request).contents()) {
        keys.add(object.key());
      }
    } catch (SdkException ex) {
      throw new IOException("S3 listing failed for s3://" + bucket + "/" + prefix + ": " + ex.getMessage(), ex);
    }
    log.debug("Listed {} key(s) under s3://{}/{}", keys.size(), bucket, prefix);
    return keys;
  }

  @Override
  public void close() {
    client.close();
  }
}
