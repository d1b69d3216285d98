package com.crossstitch.publisher.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.crossstitch.publisher.domain.error.ConfigurationException;
import com.crossstitch.publisher.domain.error.ConversionException;
import com.crossstitch.publisher.domain.error.NotFoundException;
import com.crossstitch.publisher.domain.error.PublishException;
import com.crossstitch.publisher.domain.error.SendException;
import com.crossstitch.publisher.domain.error.StoreException;
import com.crossstitch.publisher.domain.error.UploadException;
import com.crossstitch.publisher.domain.error.VerificationException;
import com.crossstitch.publisher.domain.fleet.VerificationResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExitCodeTest {

  @Test
  void codesAreStable() {
    assertEquals(0, ExitCode.SUCCESS.code());
    assertEquals(2, ExitCode.INVALID_ARGS.code());
    assertEquals(3, ExitCode.IO_ERROR.code());
    assertEquals(4, ExitCode.CONFIG_ERROR.code());
    assertEquals(5, ExitCode.RUNTIME_FAILURE.code());
    assertEquals(130, ExitCode.INTERRUPTED.code());
  }

  @Test
  void failuresMapByKind() {
    assertEquals(ExitCode.CONFIG_ERROR, ExitCode.forFailure(new ConfigurationException("no token")));
    assertEquals(ExitCode.IO_ERROR, ExitCode.forFailure(new NotFoundException("no batch")));
    assertEquals(ExitCode.IO_ERROR, ExitCode.forFailure(new StoreException("scan failed", null)));
    assertEquals(ExitCode.IO_ERROR, ExitCode.forFailure(new UploadException("charts/x.scc", null)));
    assertEquals(ExitCode.RUNTIME_FAILURE, ExitCode.forFailure(new ConversionException("exit 3", 3, "")));
    assertEquals(ExitCode.RUNTIME_FAILURE, ExitCode.forFailure(new PublishException("createPin", 400, "{}")));
    assertEquals(ExitCode.RUNTIME_FAILURE, ExitCode.forFailure(new SendException("a@b.com", 2, null)));
    assertEquals(ExitCode.RUNTIME_FAILURE, ExitCode.forFailure(
        new VerificationException(VerificationResult.failed("No instances found", List.of()))));
  }

  @Test
  void failurePayloadMasksRecipients() {
    assertEquals(" (recipient b***@example.com, sent 2)",
        CommandSupport.payload(new SendException("bob@example.com", 2, null)));
    assertEquals(" (key charts/x.scc)", CommandSupport.payload(new UploadException("charts/x.scc", null)));
    assertEquals("", CommandSupport.payload(new ConfigurationException("no token")));
  }
}
