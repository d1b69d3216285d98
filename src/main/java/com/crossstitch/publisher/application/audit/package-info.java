/**
 * Audit of object storage against the design catalog.
 */
package com.crossstitch.publisher.application.audit;
