/**
 * Access token providers for the pinboard API.
 */
package com.crossstitch.publisher.infrastructure.token;
