/**
 * Local process execution for the external PDF converter.
 */
package com.crossstitch.publisher.infrastructure.process;
