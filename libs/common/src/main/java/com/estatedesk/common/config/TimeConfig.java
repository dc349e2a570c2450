/*
 * Where: shared configuration
 * What: exposes the Clock as a bean
 * Why: services read time from an injected clock so tests can pin it
 */
package com.estatedesk.common.config;

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
