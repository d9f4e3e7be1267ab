package io.b2mash.taskflow.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Application settings under the {@code taskflow} prefix.
 *
 * @param zoneId zone whose midnight defines a calendar day for due-date classification
 * @param presentation presentation draft settings
 */
@ConfigurationProperties(prefix = "taskflow")
public record TaskflowProperties(
    @DefaultValue("UTC") String zoneId, @DefaultValue Presentation presentation) {

  /**
   * @param defaultTheme theme applied to a new draft when none is given
   * @param defaultDurationMinutes duration applied to a new draft when none is given
   * @param maxOpenDrafts upper bound on concurrently open editing sessions
   * @param draftIdleTimeout how long a draft may go untouched before the expiry job discards it
   */
  public record Presentation(
      @DefaultValue("modern") String defaultTheme,
      @DefaultValue("30") int defaultDurationMinutes,
      @DefaultValue("100") int maxOpenDrafts,
      @DefaultValue("PT12H") Duration draftIdleTimeout) {}
}
