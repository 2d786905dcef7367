package io.dealmotion.autopilot.detection;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of one detection run for one owner.
 *
 * @param userId the owner's user id
 * @param skipped true when autopilot is disabled for the owner and nothing ran
 * @param candidates candidates yielded by detectors after per-detector caps
 * @param created proposals actually inserted
 * @param duplicates candidates the store rejected because a live proposal holds the key
 * @param filtered candidates dropped by sequencing, counted per reason
 * @param failedDetectors types of detectors that threw during this run
 */
public record DetectionResult(
    UUID userId,
    boolean skipped,
    int candidates,
    int created,
    int duplicates,
    Map<String, Integer> filtered,
    List<String> failedDetectors) {

  public DetectionResult {
    filtered = Map.copyOf(filtered);
    failedDetectors = List.copyOf(failedDetectors);
  }

  public static DetectionResult skipped(UUID userId) {
    return new DetectionResult(userId, true, 0, 0, 0, Map.of(), List.of());
  }
}
