package io.b2mash.b2b.taskengine.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FiscalCalendarConfig.FiscalCalendarProperties.class)
public class FiscalCalendarConfig {

  /**
   * Fiscal calendar settings.
   *
   * @param firstMonth calendar month (1-12) in which the fiscal year starts
   * @param zone zone used to decide the current month
   * @param displayHorizonYears how many years ahead period pickers are allowed to show
   */
  @ConfigurationProperties("taskengine.fiscal")
  public record FiscalCalendarProperties(
      @DefaultValue("4") int firstMonth,
      @DefaultValue("Asia/Kolkata") String zone,
      @DefaultValue("5") int displayHorizonYears) {

    public FiscalCalendarProperties {
      if (firstMonth < 1 || firstMonth > 12) {
        throw new IllegalArgumentException("taskengine.fiscal.first-month must be 1-12");
      }
      if (displayHorizonYears < 1) {
        throw new IllegalArgumentException(
            "taskengine.fiscal.display-horizon-years must be >= 1, got: " + displayHorizonYears);
      }
    }

    public ZoneId zoneId() {
      return ZoneId.of(zone);
    }
  }

  @Bean
  Clock clock(FiscalCalendarProperties properties) {
    return Clock.system(properties.zoneId());
  }
}
