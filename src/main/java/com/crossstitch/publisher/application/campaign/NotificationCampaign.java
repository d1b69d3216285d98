package com.crossstitch.publisher.application.campaign;

import com.crossstitch.publisher.application.port.ClockPort;
import com.crossstitch.publisher.application.port.EmailDeliveryPort;
import com.crossstitch.publisher.application.port.MetricsPort;
import com.crossstitch.publisher.application.port.ProgressSink;
import com.crossstitch.publisher.domain.campaign.EmailMessage;
import com.crossstitch.publisher.domain.campaign.Recipient;
import com.crossstitch.publisher.domain.design.AlbumRecord;
import com.crossstitch.publisher.domain.error.ConfigurationException;
import com.crossstitch.publisher.domain.error.SendException;
import com.crossstitch.publisher.domain.error.StoreException;
import com.crossstitch.publisher.logging.Logs;
import java.io.IOException;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Sends personalized, unsubscribe-enabled campaign mail to the users table.
 * <p><strong>Campaigns:</strong>
 * <ul>
 *   <li>{@link #sendUploadNotice} - admin-only "Upload Successful" summary of a publish.</li>
 *   <li>{@link #announce} - new-design announcement with tracked links and album suggestions.</li>
 *   <li>{@link #broadcast} - configured plain-text broadcast converted to HTML paragraphs.</li>
 * </ul>
 * <p><strong>Send loop:</strong> sequential on the calling thread. The admin, when configured, receives the same
 * content first with {@code cid=admin} and is then excluded from the user loop case-insensitively. The first
 * delivery failure aborts the loop with {@link SendException}; a failed {@code LastEmailDate} stamp only logs a
 * WARN.</p>
 * <p><strong>Cancellation:</strong> the interrupt flag is checked between recipients.</p>
 * <p><strong>Observability:</strong> {@code campaign.sent}, {@code campaign.send.failed},
 * {@code campaign.lastSentUpdate.failed}; loop logs carry the {@code campaign} MDC key.</p>
 *
 * @since 0.1.0
 */
public final class NotificationCampaign {
  private static final Logger log = LoggerFactory.getLogger(NotificationCampaign.class);
  static final String ADMIN_CID = "admin";
  static final String USERS_LABEL = "[CrossStitchUsers]";
  static final String BROADCAST_LABEL = "[TextEmail]";
  static final String UPLOAD_NOTICE_SUBJECT = "Upload Successful";
  private static final DateTimeFormatter EID_FORMAT = DateTimeFormatter.ofPattern("yyMMdd");

  private final RecipientDirectory directory;
  private final EmailDeliveryPort delivery;
  private final UnsubscribeLinks unsubscribe;
  private final AlbumSuggestions albums;
  private final CampaignSettings settings;
  private final ClockPort clock;
  private final ProgressSink progress;
  private final MetricsPort metrics;

  public NotificationCampaign(
      RecipientDirectory directory,
      EmailDeliveryPort delivery,
      UnsubscribeLinks unsubscribe,
      AlbumSuggestions albums,
      CampaignSettings settings,
      ClockPort clock,
      ProgressSink progress,
      MetricsPort metrics) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.delivery = Objects.requireNonNull(delivery, "delivery");
    this.unsubscribe = Objects.requireNonNull(unsubscribe, "unsubscribe");
    this.albums = Objects.requireNonNull(albums, "albums");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.progress = progress == null ? ProgressSink.NO_OP : progress;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Sends the admin-only upload summary. Does nothing when no admin is configured.
   *
   * @param design published design
   * @param suggestions albums to list under the summary
   * @return {@code true} when the notice was sent
   * @throws SendException if delivery fails
   */
  public boolean sendUploadNotice(DesignAnnouncement design, List<AlbumRecord> suggestions) throws SendException {
    Optional<String> admin = settings.adminEmail();
    if (admin.isEmpty()) {
      log.debug("No admin address configured; upload notice skipped");
      return false;
    }
    LocalDate today = today();
    String unsubscribeUrl = unsubscribe.url(admin.get());
    String html = EmailTemplates.uploadNoticeHtml(design, TrackingUrls.withUtm(design.patternUrl(), today))
        + albums.html(suggestions, null, null, today)
        + EmailTemplates.unsubscribeFooterHtml(unsubscribeUrl);
    String text = EmailTemplates.uploadNoticeText(design)
        + albums.text(suggestions, null, null, today)
        + EmailTemplates.unsubscribeLineText(unsubscribeUrl);
    deliver(message(admin.get(), UPLOAD_NOTICE_SUBJECT, text, html, unsubscribeUrl), 0);
    progress.report("Sent notification email to admin.");
    return true;
  }

  /**
   * Announces a published design: upload notice to the admin, then the announcement to every verified,
   * subscribed user. When no user qualifies the admin copy of the announcement is not sent either.
   *
   * @param design published design
   * @return report of the user loop
   * @throws SendException if any delivery fails
   * @throws StoreException if recipients cannot be read or counted
   * @throws InterruptedException if interrupted between recipients
   */
  public CampaignReport announce(DesignAnnouncement design)
      throws SendException, StoreException, InterruptedException {
    List<AlbumRecord> suggestions = albums.pick(design.albumId(), settings.albumSuggestionCount());
    sendUploadNotice(design, suggestions);

    List<Recipient> recipients = directory.fetchRecipients(true, true);
    if (recipients.isEmpty()) {
      progress.report(USERS_LABEL + " No user recipients found.");
      return new CampaignReport(USERS_LABEL, false, 0, 0);
    }
    long eligible = directory.countEligible();
    LocalDate today = today();
    String eid = EID_FORMAT.format(today);
    String subject = settings.notificationSubjectFor(design.title());
    CampaignReport report = sendBatch(USERS_LABEL, recipients, eligible,
        recipient -> announcementFor(recipient, design, suggestions, subject, eid, today));
    progress.report("Sent notification email to " + report.sent()
        + " verified, subscribed users from " + directory.schema().table() + ".");
    return report;
  }

  /**
   * Sends the configured text broadcast to every verified, subscribed user.
   *
   * @return report of the user loop
   * @throws ConfigurationException if the subject or body is blank
   * @throws SendException if any delivery fails
   * @throws StoreException if recipients cannot be read or counted
   * @throws InterruptedException if interrupted between recipients
   */
  public CampaignReport broadcast()
      throws ConfigurationException, SendException, StoreException, InterruptedException {
    String subject = settings.broadcastSubject();
    String body = settings.broadcastBody();
    if (subject.isBlank()) {
      throw new ConfigurationException("Text email subject is empty.");
    }
    if (body.isBlank()) {
      throw new ConfigurationException("Text email body is empty.");
    }
    String htmlTemplate = EmailTemplates.plainTextToHtml(body);
    List<Recipient> recipients = directory.fetchRecipients(true, true);
    long eligible = directory.countEligible();
    return sendBatch(BROADCAST_LABEL, recipients, eligible,
        recipient -> broadcastFor(recipient, subject, body, htmlTemplate));
  }

  /**
   * Runs the sequential send loop: admin copy first, then every other recipient.
   *
   * @param label label prefixed to progress lines
   * @param recipients users to send to; the admin address is skipped
   * @param eligibleCount server-side eligible count used as the progress target
   * @param composer builds the message for one recipient
   * @return loop report
   * @throws SendException on the first failed delivery
   * @throws InterruptedException if interrupted between recipients
   */
  public CampaignReport sendBatch(
      String label, List<Recipient> recipients, long eligibleCount, Function<Recipient, EmailMessage> composer)
      throws SendException, InterruptedException {
    String previous = MDC.get("campaign");
    MDC.put("campaign", label);
    try {
      boolean adminSent = false;
      Optional<String> admin = settings.adminEmail();
      if (admin.isPresent()) {
        deliver(composer.apply(Recipient.adHoc(admin.get(), ADMIN_CID)), 0);
        adminSent = true;
        progress.report(label + " Sent email to admin.");
      }
      List<Recipient> users = admin
          .map(address -> recipients.stream().filter(r -> !r.sameAddress(address)).toList())
          .orElse(recipients);
      if (users.isEmpty()) {
        progress.report(label + " No user recipients found.");
        return new CampaignReport(label, adminSent, 0, 0);
      }

      long target = Math.max(eligibleCount, users.size());
      long started = clock.nowMillis();
      int sent = 0;
      int stampFailures = 0;
      for (Recipient recipient : users) {
        if (Thread.currentThread().isInterrupted()) {
          throw new InterruptedException("Campaign " + label + " interrupted after " + sent + " email(s)");
        }
        deliver(composer.apply(recipient), sent);
        metrics.increment("campaign.sent");
        if (!stampLastEmailDate(label, recipient)) {
          stampFailures++;
        }
        sent++;
        if (sent % settings.progressEvery() == 0 || sent == users.size()) {
          progress.report(SendProgress.line(label, sent, target, clock.nowMillis() - started));
        }
      }
      progress.report(SendProgress.finished(label, sent, clock.nowMillis() - started));
      log.info("{} sent {} email(s), {} LastEmailDate update failure(s)", label, sent, stampFailures);
      return new CampaignReport(label, adminSent, sent, stampFailures);
    } finally {
      if (previous == null) {
        MDC.remove("campaign");
      } else {
        MDC.put("campaign", previous);
      }
    }
  }

  EmailMessage announcementFor(
      Recipient recipient,
      DesignAnnouncement design,
      List<AlbumRecord> suggestions,
      String subject,
      String eid,
      LocalDate today) {
    String cid = recipient.cid().orElse("");
    String name = recipient.firstName().orElse(null);
    String patternUrl = TrackingUrls.withTracking(design.patternUrl(), cid, eid, today);
    String siteUrl = TrackingUrls.withTracking(design.siteUrl(), cid, eid, today);
    String unsubscribeUrl = unsubscribe.url(recipient.email());
    String text = EmailTemplates.greetingText(name)
        + EmailTemplates.announcementText(design.title(), patternUrl, siteUrl, settings.facebookUrl())
        + albums.text(suggestions, cid, eid, today)
        + EmailTemplates.unsubscribeLineText(unsubscribeUrl);
    String html = EmailTemplates.greetingHtml(name)
        + EmailTemplates.announcementHtml(design.title(), patternUrl, design.imageUrl(), siteUrl,
            settings.facebookUrl(), design.altText())
        + albums.html(suggestions, cid, eid, today)
        + EmailTemplates.unsubscribeFooterHtml(unsubscribeUrl);
    return message(recipient.email(), subject, text, html, unsubscribeUrl);
  }

  EmailMessage broadcastFor(Recipient recipient, String subject, String body, String htmlTemplate) {
    String name = recipient.firstName().orElse(null);
    String unsubscribeUrl = unsubscribe.url(recipient.email());
    String text = EmailTemplates.personalizeText(body, name)
        + EmailTemplates.CRLF + EmailTemplates.unsubscribeLineText(unsubscribeUrl);
    String personalizedHtml = EmailTemplates.personalizeHtml(htmlTemplate, name);
    String html = personalizedHtml.isBlank()
        ? null
        : personalizedHtml + EmailTemplates.unsubscribeFooterHtml(unsubscribeUrl);
    return message(recipient.email(), subject, text, html, unsubscribeUrl);
  }

  private EmailMessage message(String to, String subject, String text, String html, String unsubscribeUrl) {
    return new EmailMessage(settings.sender(), to, subject, text, Optional.ofNullable(html),
        UnsubscribeLinks.headers(unsubscribeUrl, settings.sender()));
  }

  private void deliver(EmailMessage message, int sentBefore) throws SendException {
    try {
      delivery.send(message);
    } catch (IOException | RuntimeException ex) {
      metrics.increment("campaign.send.failed");
      log.error("Delivery to {} failed after {} email(s)", Logs.maskEmail(message.to()), sentBefore, ex);
      throw new SendException(message.to(), sentBefore, ex);
    }
  }

  private boolean stampLastEmailDate(String label, Recipient recipient) {
    try {
      directory.markSent(recipient);
      return true;
    } catch (StoreException | RuntimeException ex) {
      metrics.increment("campaign.lastSentUpdate.failed");
      log.warn("{} Failed to update LastEmailDate for {}: {}", label, Logs.maskEmail(recipient.email()),
          ex.getMessage());
      return false;
    }
  }

  private LocalDate today() {
    return clock.now().atZone(ZoneOffset.UTC).toLocalDate();
  }
}
