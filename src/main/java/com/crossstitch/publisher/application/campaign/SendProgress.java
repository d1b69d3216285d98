package com.crossstitch.publisher.application.campaign;

import java.util.Locale;

/**
 * Formats send-loop progress lines, for example
 * {@code [TextEmail] Sent 50/120 | Elapsed 00:01:02 | Avg 1.24s/email | ETA 00:01:27 | Remaining 70 (58.3% left).}
 *
 * @since 0.1.0
 */
public final class SendProgress {

  private SendProgress() {
    // Utility
  }

  /**
   * Formats a progress line.
   *
   * @param label loop label such as {@code [CrossStitchUsers]}
   * @param sent emails sent so far
   * @param target expected total; the larger of the eligible count and the list size
   * @param elapsedMillis elapsed time since the loop started
   * @return progress line
   */
  public static String line(String label, int sent, long target, long elapsedMillis) {
    double avgSeconds = sent > 0 ? (elapsedMillis / 1000.0) / sent : 0;
    long remaining = Math.max(target - sent, 0);
    long etaMillis = avgSeconds > 0 ? Math.round(avgSeconds * remaining * 1000) : 0;
    double percentLeft = target > 0 ? remaining * 100.0 / target : 0;
    return String.format(Locale.ROOT,
        "%s Sent %d/%d | Elapsed %s | Avg %.2fs/email | ETA %s | Remaining %d (%.1f%% left).",
        label, sent, target, duration(elapsedMillis), avgSeconds, duration(etaMillis), remaining, percentLeft);
  }

  public static String finished(String label, int sent, long elapsedMillis) {
    return label + " Finished sending " + sent + " email(s) in " + duration(elapsedMillis) + ".";
  }

  /**
   * Formats a duration as {@code hh:mm:ss}.
   *
   * @param millis duration in milliseconds
   * @return formatted duration
   */
  public static String duration(long millis) {
    long totalSeconds = Math.max(millis, 0) / 1000;
    return String.format(Locale.ROOT, "%02d:%02d:%02d",
        totalSeconds / 3600, (totalSeconds / 60) % 60, totalSeconds % 60);
  }
}
