/*
 * Where: Notification engine configuration binding
 * What: Holds retention cleanup settings
 * Why: Keep retention policy and schedule tunable per environment
 */
package com.example.docnotify.engine.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Notifications expire on their own {@code expires_on}; only processed events use the day window. */
@Validated
@ConfigurationProperties(prefix = "notification.retention")
public record NotificationRetentionProperties(
    boolean enabled, @Min(1) int processedEventRetentionDays, @NotNull Duration cleanupInterval) {}
