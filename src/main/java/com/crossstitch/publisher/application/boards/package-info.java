/**
 * Board provisioning: album-to-board CSV, board creation and SEO renaming.
 */
package com.crossstitch.publisher.application.boards;
