package io.b2mash.b2b.taskengine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ScheduleConfig.ScheduleProperties.class)
public class ScheduleConfig {

  /**
   * Limits on schedule queries.
   *
   * @param maxOccurrenceWindowDays widest {@code from..to} window, in days, an occurrence listing
   *     may ask for
   */
  @ConfigurationProperties("taskengine.schedule")
  public record ScheduleProperties(@DefaultValue("1830") int maxOccurrenceWindowDays) {

    public ScheduleProperties {
      if (maxOccurrenceWindowDays < 1) {
        throw new IllegalArgumentException(
            "taskengine.schedule.max-occurrence-window-days must be >= 1, got: "
                + maxOccurrenceWindowDays);
      }
    }
  }
}
