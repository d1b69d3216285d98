/**
 * Notification campaign: recipient selection, email content, tracking links, unsubscribe tokens and the
 * sequential send loop.
 */
package com.crossstitch.publisher.application.campaign;
