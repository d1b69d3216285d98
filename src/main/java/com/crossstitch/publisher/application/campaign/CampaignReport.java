package com.crossstitch.publisher.application.campaign;

/**
 * Outcome of one send loop.
 *
 * @param label loop label
 * @param adminSent whether the admin copy was sent
 * @param sent number of user emails sent
 * @param lastEmailDateFailures number of sends whose {@code LastEmailDate} stamp failed
 * @since 0.1.0
 */
public record CampaignReport(String label, boolean adminSent, int sent, int lastEmailDateFailures) {
}
