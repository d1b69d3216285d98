/**
 * Maintenance passes that backfill unsubscribe and tracking attributes on the users table.
 */
package com.crossstitch.publisher.application.users;
