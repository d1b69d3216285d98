package com.crossstitch.publisher.infrastructure.aws;

import com.crossstitch.publisher.application.port.EmailDeliveryPort;
import com.crossstitch.publisher.domain.campaign.EmailMessage;
import com.crossstitch.publisher.logging.Logs;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ses.SesClient;
import software.amazon.awssdk.services.ses.model.Body;
import software.amazon.awssdk.services.ses.model.Content;
import software.amazon.awssdk.services.ses.model.Destination;
import software.amazon.awssdk.services.ses.model.Message;
import software.amazon.awssdk.services.ses.model.RawMessage;
import software.amazon.awssdk.services.ses.model.SendEmailRequest;
import software.amazon.awssdk.services.ses.model.SendRawEmailRequest;

/**
 * <strong>What:</strong> {@link EmailDeliveryPort} backed by Amazon SES.
 * <p><strong>Routing:</strong> messages without custom headers go through {@code SendEmail}; messages with
 * headers (for example {@code List-Unsubscribe}) are rendered by {@link MimeMessageBuilder} and sent with
 * {@code SendRawEmail}.</p>
 * <p><strong>Errors:</strong> SDK failures are rethrown as {@link IOException}; nothing is retried here.</p>
 *
 * @since 0.1.0
 */
public final class SesEmailDeliveryAdapter implements EmailDeliveryPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SesEmailDeliveryAdapter.class);
  private static final String CHARSET = StandardCharsets.UTF_8.name();

  private final SesClient client;
  private final MimeMessageBuilder mime;

  public SesEmailDeliveryAdapter(String region) {
    this(SesClient.builder().region(Region.of(region)).build(), new MimeMessageBuilder());
  }

  public SesEmailDeliveryAdapter(SesClient client, MimeMessageBuilder mime) {
    this.client = Objects.requireNonNull(client, "client");
    this.mime = Objects.requireNonNull(mime, "mime");
  }

  @Override
  public void send(EmailMessage message) throws IOException {
    try {
      if (message.headers().isEmpty()) {
        client.sendEmail(simpleRequest(message));
      } else {
        SendRawEmailRequest request = SendRawEmailRequest.builder()
            .source(message.from())
            .destinations(message.to())
            .rawMessage(RawMessage.builder().data(SdkBytes.fromUtf8String(mime.build(message))).build())
            .build();
        client.sendRawEmail(request);
      }
      log.debug("Sent '{}' to {}", Logs.truncate(message.subject(), 80), Logs.maskEmail(message.to()));
    } catch (SdkException ex) {
      throw new IOException("SES send to " + Logs.maskEmail(message.to()) + " failed: " + ex.getMessage(), ex);
    }
  }

  private static SendEmailRequest simpleRequest(EmailMessage message) {
    Body.Builder body = Body.builder().text(content(message.textBody()));
    message.htmlBody().ifPresent(html -> body.html(content(html)));
    return SendEmailRequest.builder()
        .source(message.from())
        .destination(Destination.builder().toAddresses(message.to()).build())
        .message(Message.builder().subject(content(message.subject())).body(body.build()).build())
        .build();
  }

  private static Content content(String data) {
    return Content.builder().data(data).charset(CHARSET).build();
  }

  @Override
  public void close() {
    client.close();
  }
}
