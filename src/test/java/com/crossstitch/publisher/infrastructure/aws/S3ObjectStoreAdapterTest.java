package com.crossstitch.publisher.infrastructure.aws;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.paginators.ListObjectsV2Iterable;

class S3ObjectStoreAdapterTest {
  @TempDir Path tempDir;

  @Test
  void putSendsBucketKeyContentTypeAndBody() throws Exception {
    RecordingS3 s3 = new RecordingS3();
    S3ObjectStoreAdapter adapter = new S3ObjectStoreAdapter(s3, " designs-bucket ");
    Path file = tempDir.resolve("00042.pdf");
    Files.writeString(file, "%PDF-1.4", StandardCharsets.UTF_8);

    adapter.put("pdfs/00042.pdf", file, "application/pdf");

    PutObjectRequest request = s3.puts.get(0);
    assertEquals("designs-bucket", request.bucket());
    assertEquals("pdfs/00042.pdf", request.key());
    assertEquals("application/pdf", request.contentType());
    assertEquals("%PDF-1.4", s3.bodies.get(0));
  }

  @Test
  void putRejectsMissingSourceWithoutCallingS3() {
    RecordingS3 s3 = new RecordingS3();
    S3ObjectStoreAdapter adapter = new S3ObjectStoreAdapter(s3, "designs-bucket");

    IOException ex = assertThrows(IOException.class,
        () -> adapter.put("pdfs/x.pdf", tempDir.resolve("missing.pdf"), "application/pdf"));

    assertTrue(ex.getMessage().contains("missing.pdf"));
    assertTrue(s3.puts.isEmpty());
  }

  @Test
  void serviceFailuresBecomeIoExceptions() {
    RecordingS3 s3 = new RecordingS3();
    s3.failDeletes = true;
    S3ObjectStoreAdapter adapter = new S3ObjectStoreAdapter(s3, "designs-bucket");

    IOException ex = assertThrows(IOException.class, () -> adapter.delete("pdfs/x.pdf"));

    assertTrue(ex.getMessage().contains("s3://designs-bucket/pdfs/x.pdf"));
    assertTrue(ex.getCause() instanceof S3Exception);
  }

  @Test
  void deleteTargetsConfiguredBucket() throws Exception {
    RecordingS3 s3 = new RecordingS3();
    new S3ObjectStoreAdapter(s3, "designs-bucket").delete("images/00042.png");

    assertEquals("designs-bucket", s3.deletes.get(0).bucket());
    assertEquals("images/00042.png", s3.deletes.get(0).key());
  }

  @Test
  void listKeysFollowsContinuationTokens() throws Exception {
    RecordingS3 s3 = new RecordingS3();

    List<String> keys = new S3ObjectStoreAdapter(s3, "designs-bucket").listKeys("pdfs/");

    assertEquals(List.of("pdfs/00001.pdf", "pdfs/00002.pdf", "pdfs/00003.pdf"), keys);
    assertEquals(2, s3.listCalls);
  }

  @Test
  void blankBucketIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new S3ObjectStoreAdapter(new RecordingS3(), " "));
  }

  private static final class RecordingS3 implements S3Client {
    final List<PutObjectRequest> puts = new ArrayList<>();
    final List<String> bodies = new ArrayList<>();
    final List<DeleteObjectRequest> deletes = new ArrayList<>();
    boolean failDeletes;
    int listCalls;

    @Override
    public PutObjectResponse putObject(PutObjectRequest request, RequestBody body) {
      puts.add(request);
      try (InputStream in = body.contentStreamProvider().newStream()) {
        bodies.add(new String(in.readAllBytes(), StandardCharsets.UTF_8));
      } catch (IOException ex) {
        throw new IllegalStateException(ex);
      }
      return PutObjectResponse.builder().eTag("\"etag\"").build();
    }

    @Override
    public DeleteObjectResponse deleteObject(DeleteObjectRequest request) {
      if (failDeletes) {
        throw S3Exception.builder().message("Access Denied").statusCode(403).build();
      }
      deletes.add(request);
      return DeleteObjectResponse.builder().build();
    }

    @Override
    public ListObjectsV2Iterable listObjectsV2Paginator(ListObjectsV2Request request) {
      return new ListObjectsV2Iterable(this, request);
    }

    @Override
    public ListObjectsV2Response listObjectsV2(ListObjectsV2Request request) {
      listCalls++;
      if (request.continuationToken() == null) {
        return ListObjectsV2Response.builder()
            .contents(object("pdfs/00001.pdf"), object("pdfs/00002.pdf"))
            .isTruncated(true)
            .nextContinuationToken("page-2")
            .build();
      }
      return ListObjectsV2Response.builder()
          .contents(object("pdfs/00003.pdf"))
          .isTruncated(false)
          .build();
    }

    private static S3Object object(String key) {
      return S3Object.builder().key(key).build();
    }

    @Override
    public String serviceName() {
      return "s3";
    }

    @Override
    public void close() {
    }
  }
}
