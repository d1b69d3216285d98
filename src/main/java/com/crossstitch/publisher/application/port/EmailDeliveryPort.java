package com.crossstitch.publisher.application.port;

import com.crossstitch.publisher.domain.campaign.EmailMessage;
import java.io.IOException;

/**
 * Port over the email provider. One call sends one message.
 *
 * @since 0.1.0
 */
public interface EmailDeliveryPort {
  /**
   * Sends a message.
   *
   * @param message message to send
   * @throws IOException if the provider rejects the message or cannot be reached
   */
  void send(EmailMessage message) throws IOException;
}
