/**
 * End-to-end publish pipeline wiring allocation, conversion, upload, pin, catalog, verification and campaign.
 */
package com.crossstitch.publisher.application.pipeline;
