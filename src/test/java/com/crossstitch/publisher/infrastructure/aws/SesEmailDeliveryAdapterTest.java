package com.crossstitch.publisher.infrastructure.aws;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.crossstitch.publisher.domain.campaign.EmailMessage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.ses.SesClient;
import software.amazon.awssdk.services.ses.model.SendEmailRequest;
import software.amazon.awssdk.services.ses.model.SendEmailResponse;
import software.amazon.awssdk.services.ses.model.SendRawEmailRequest;
import software.amazon.awssdk.services.ses.model.SendRawEmailResponse;
import software.amazon.awssdk.services.ses.model.SesException;

class SesEmailDeliveryAdapterTest {
  private final RecordingSes ses = new RecordingSes();
  private final SesEmailDeliveryAdapter adapter =
      new SesEmailDeliveryAdapter(ses, new MimeMessageBuilder(() -> "B1"));

  @Test
  void messageWithoutHeadersUsesSimpleSend() throws Exception {
    adapter.send(new EmailMessage("ann@cross-stitch.com", "bob@example.com", "New design",
        "Plain", Optional.of("<p>Html</p>"), Map.of()));

    assertTrue(ses.raw.isEmpty());
    SendEmailRequest request = ses.simple.get(0);
    assertEquals("ann@cross-stitch.com", request.source());
    assertEquals(List.of("bob@example.com"), request.destination().toAddresses());
    assertEquals("New design", request.message().subject().data());
    assertEquals("Plain", request.message().body().text().data());
    assertEquals("<p>Html</p>", request.message().body().html().data());
    assertEquals("UTF-8", request.message().body().text().charset());
  }

  @Test
  void messageWithHeadersUsesRawMime() throws Exception {
    adapter.send(new EmailMessage("ann@cross-stitch.com", "bob@example.com", "New design",
        "Plain", Optional.empty(), Map.of("List-Unsubscribe", "<https://u.example.com/t>")));

    assertTrue(ses.simple.isEmpty());
    SendRawEmailRequest request = ses.raw.get(0);
    assertEquals(List.of("bob@example.com"), request.destinations());
    String mime = request.rawMessage().data().asUtf8String();
    assertTrue(mime.contains("List-Unsubscribe: <https://u.example.com/t>\r\n"));
    assertTrue(mime.contains("boundary=\"B1\""));
  }

  @Test
  void serviceFailureIsWrappedWithMaskedRecipient() {
    ses.fail = true;

    IOException ex = assertThrows(IOException.class, () -> adapter.send(new EmailMessage(
        "ann@cross-stitch.com", "bob@example.com", "s", "b", Optional.empty(), Map.of())));

    assertFalse(ex.getMessage().contains("bob@example.com"));
    assertTrue(ex.getMessage().contains("Throttling"));
  }

  private static final class RecordingSes implements SesClient {
    final List<SendEmailRequest> simple = new ArrayList<>();
    final List<SendRawEmailRequest> raw = new ArrayList<>();
    boolean fail;

    @Override
    public SendEmailResponse sendEmail(SendEmailRequest request) {
      if (fail) {
        throw SesException.builder().message("Throttling").statusCode(400).build();
      }
      simple.add(request);
      return SendEmailResponse.builder().messageId("m-1").build();
    }

    @Override
    public SendRawEmailResponse sendRawEmail(SendRawEmailRequest request) {
      raw.add(request);
      return SendRawEmailResponse.builder().messageId("m-2").build();
    }

    @Override
    public String serviceName() {
      return "ses";
    }

    @Override
    public void close() {
    }
  }
}
