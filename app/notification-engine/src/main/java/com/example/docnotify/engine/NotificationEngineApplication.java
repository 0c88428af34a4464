/*
 * Where: Notification engine entry point
 * What: Boots Spring and scans configuration properties
 * Why: Enables the scheduled processing and retention workers in one place
 */
package com.example.docnotify.engine;

import com.example.docnotify.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class NotificationEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(NotificationEngineApplication.class, args);
  }
}
