package com.crossstitch.publisher.application.campaign;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class TrackingUrlsTest {
  private static final LocalDate TODAY = LocalDate.of(2025, 10, 16);

  @Test
  void addsRecipientCampaignAndUtmParameters() {
    String url = TrackingUrls.withTracking("https://www.cross-stitch-pattern.net/p.aspx", "c1", "251016", TODAY);

    assertEquals("https://www.cross-stitch-pattern.net/p.aspx?cid=c1&eid=251016"
        + "&utm_source=newsletter&utm_medium=email&utm_campaign=2025-10-16", url);
  }

  @Test
  void applyingTwiceChangesNothing() {
    String once = TrackingUrls.withTracking("https://site.net/a?x=1", "c1", "e1", TODAY);

    assertEquals(once, TrackingUrls.withTracking(once, "c1", "e1", TODAY));
  }

  @Test
  void existingParametersAreMatchedCaseInsensitively() {
    String url = TrackingUrls.withTracking("https://site.net/a?CID=keep&UTM_SOURCE=ads", "c1", "", TODAY);

    assertEquals("https://site.net/a?CID=keep&UTM_SOURCE=ads&utm_medium=email&utm_campaign=2025-10-16", url);
  }

  @Test
  void fragmentStaysAtTheEnd() {
    String url = TrackingUrls.withUtm("https://site.net/a?x=1#gallery", TODAY);

    assertEquals("https://site.net/a?x=1&utm_source=newsletter&utm_medium=email&utm_campaign=2025-10-16#gallery",
        url);
  }

  @Test
  void blankUrlsAreReturnedUnchanged() {
    assertEquals(" ", TrackingUrls.withTracking(" ", "c1", "e1", TODAY));
    assertNull(TrackingUrls.withUtm(null, TODAY));
  }

  @Test
  void parameterValuesAreEscaped() {
    String url = TrackingUrls.withTracking("https://site.net/", "a b&c", null, TODAY);

    assertEquals("https://site.net/?cid=a%20b%26c&utm_source=newsletter&utm_medium=email"
        + "&utm_campaign=2025-10-16", url);
  }
}
