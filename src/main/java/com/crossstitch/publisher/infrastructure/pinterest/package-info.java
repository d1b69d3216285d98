/**
 * HTTP adapter for the Pinterest REST API.
 */
package com.crossstitch.publisher.infrastructure.pinterest;
