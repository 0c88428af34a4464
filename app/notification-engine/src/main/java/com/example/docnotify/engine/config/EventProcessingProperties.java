/*
 * Where: Notification engine configuration binding
 * What: Holds polling, locking and recipient paging settings for event processing
 * Why: Keep operational parameters tunable per environment
 */
package com.example.docnotify.engine.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "notification.processing")
public record EventProcessingProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Min(1) int maxEventsPerRun,
    @NotNull Duration lockTtl,
    @Min(1) int userBatchSize,
    @Min(1) int errorMessageMaxLength) {}
