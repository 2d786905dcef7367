package io.dealmotion.autopilot.config;

import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine-wide tuning knobs. Per-owner behaviour lives in {@code AutopilotSettings}; the values here
 * bound what a single run or job may do.
 *
 * @param watchdogThreshold how long a proposal may sit in accepted/executing before the watchdog
 *     settles it
 * @param completedLookbackDays trailing window for "completed" and "recently closed" proposal sets
 * @param maxCandidatesPerDetector upper bound on candidates a single detector may yield per run
 * @param maxOwnersPerRun owners visited by one periodic detection run
 * @param defaultMaxConcurrentProposals surfaced-proposal cap for owners without settings
 * @param snoozeTimezone zone used to resolve snooze presets such as "tomorrow morning"
 * @param snoozeMorningHour local hour (0-23) that "morning" presets resolve to; 9 when unset
 * @param executor sizing of the engine's task executor
 */
@ConfigurationProperties(prefix = "autopilot")
public record AutopilotProperties(
    Duration watchdogThreshold,
    int completedLookbackDays,
    int maxCandidatesPerDetector,
    int maxOwnersPerRun,
    int defaultMaxConcurrentProposals,
    String snoozeTimezone,
    Integer snoozeMorningHour,
    ExecutorSettings executor) {

  public AutopilotProperties {
    if (watchdogThreshold == null) {
      watchdogThreshold = Duration.ofMinutes(10);
    }
    if (completedLookbackDays <= 0) {
      completedLookbackDays = 7;
    }
    if (maxCandidatesPerDetector <= 0) {
      maxCandidatesPerDetector = 3;
    }
    if (maxOwnersPerRun <= 0) {
      maxOwnersPerRun = 50;
    }
    if (defaultMaxConcurrentProposals <= 0) {
      defaultMaxConcurrentProposals = 2;
    }
    if (snoozeTimezone == null || snoozeTimezone.isBlank()) {
      snoozeTimezone = "UTC";
    }
    if (snoozeMorningHour == null) {
      snoozeMorningHour = 9;
    } else if (snoozeMorningHour < 0 || snoozeMorningHour > 23) {
      throw new IllegalArgumentException(
          "autopilot.snooze-morning-hour must be between 0 and 23, got " + snoozeMorningHour);
    }
    if (executor == null) {
      executor = new ExecutorSettings(4, 8, 200);
    }
  }

  /** Properties with every value at its default. */
  public static AutopilotProperties defaults() {
    return new AutopilotProperties(null, 0, 0, 0, 0, null, null, null);
  }

  public Duration completedLookback() {
    return Duration.ofDays(completedLookbackDays);
  }

  public ZoneId snoozeZone() {
    return ZoneId.of(snoozeTimezone);
  }

  public record ExecutorSettings(int corePoolSize, int maxPoolSize, int queueCapacity) {

    public ExecutorSettings {
      if (corePoolSize <= 0) {
        corePoolSize = 4;
      }
      if (maxPoolSize < corePoolSize) {
        maxPoolSize = corePoolSize;
      }
      if (queueCapacity <= 0) {
        queueCapacity = 200;
      }
    }
  }
}
