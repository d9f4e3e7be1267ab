package io.b2mash.taskflow.config;

import java.time.Clock;
import java.time.ZoneId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link Clock} every derived view reads "now" from. The clock's zone is the zone in
 * which calendar days (today, tomorrow, overdue) are evaluated.
 */
@Configuration
@EnableConfigurationProperties(TaskflowProperties.class)
public class ClockConfig {

  private static final Logger log = LoggerFactory.getLogger(ClockConfig.class);

  @Bean
  public Clock clock(TaskflowProperties properties) {
    var zone = ZoneId.of(properties.zoneId());
    log.info("Evaluating calendar days in zone {}", zone);
    return Clock.system(zone);
  }
}
