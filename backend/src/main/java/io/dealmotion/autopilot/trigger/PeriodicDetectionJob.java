package io.dealmotion.autopilot.trigger;

import io.dealmotion.autopilot.config.AutopilotProperties;
import io.dealmotion.autopilot.detection.DetectionEngine;
import io.dealmotion.autopilot.settings.AutopilotSettingsService;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs detection for a page of enabled owners on every tick. The page advances each run and wraps
 * around, so every enabled owner is visited even when there are more than fit in one run.
 */
@Component
public class PeriodicDetectionJob {

  private static final Logger log = LoggerFactory.getLogger(PeriodicDetectionJob.class);

  private final AutopilotSettingsService settingsService;
  private final DetectionEngine detectionEngine;
  private final AutopilotProperties properties;
  private final AtomicInteger nextPage = new AtomicInteger();

  public PeriodicDetectionJob(
      AutopilotSettingsService settingsService,
      DetectionEngine detectionEngine,
      AutopilotProperties properties) {
    this.settingsService = settingsService;
    this.detectionEngine = detectionEngine;
    this.properties = properties;
  }

  @Scheduled(fixedRateString = "${autopilot.detection.interval:900000}")
  public void runDetection() {
    log.info("Periodic detection started");
    int page = nextPage.get();
    var owners = settingsService.findEnabledOwners(page, properties.maxOwnersPerRun());
    if (owners.isEmpty() && page > 0) {
      page = 0;
      owners = settingsService.findEnabledOwners(0, properties.maxOwnersPerRun());
    }
    nextPage.set(owners.size() < properties.maxOwnersPerRun() ? 0 : page + 1);

    int created = 0;
    int failed = 0;
    for (var owner : owners) {
      try {
        created += detectionEngine.run(owner).created();
      } catch (Exception e) {
        failed++;
        log.error("Periodic detection failed for user {}", owner.userId(), e);
      }
    }
    log.info(
        "Periodic detection completed: {} owners, {} proposals created, {} failures",
        owners.size(),
        created,
        failed);
  }
}
