/*
 * Where: Shared configuration
 * What: Makes the Clock injectable
 * Why: Every application and test uses the same time source
 */
package com.example.docnotify.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
