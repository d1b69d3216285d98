/**
 * Clock adapters.
 */
package com.crossstitch.publisher.infrastructure.time;
