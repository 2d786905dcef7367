package io.dealmotion.autopilot.detection;

import io.dealmotion.autopilot.audit.AuditEventBuilder;
import io.dealmotion.autopilot.audit.AuditService;
import io.dealmotion.autopilot.config.AsyncConfig;
import io.dealmotion.autopilot.proposal.Proposal;
import io.dealmotion.autopilot.proposal.ProposalCandidate;
import io.dealmotion.autopilot.proposal.ProposalOwner;
import io.dealmotion.autopilot.proposal.ProposalStore;
import io.dealmotion.autopilot.sequencing.QueueState;
import io.dealmotion.autopilot.sequencing.SequencingFilter;
import io.dealmotion.autopilot.settings.AutopilotSettingsService;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one detection pass for one owner: build the context, evaluate every detector concurrently,
 * sequence and cap the candidates, then insert the survivors.
 *
 * <p>Re-running with unchanged inputs creates nothing: detectors skip keys already held, and the
 * store's unique constraint rejects whatever slips past them.
 */
@Service
public class DetectionEngine {

  private static final Logger log = LoggerFactory.getLogger(DetectionEngine.class);

  private final AutopilotSettingsService settingsService;
  private final DetectionContextFactory contextFactory;
  private final List<Detector> detectors;
  private final SequencingFilter sequencingFilter;
  private final ProposalStore store;
  private final AuditService auditService;
  private final Executor executor;

  public DetectionEngine(
      AutopilotSettingsService settingsService,
      DetectionContextFactory contextFactory,
      List<Detector> detectors,
      SequencingFilter sequencingFilter,
      ProposalStore store,
      AuditService auditService,
      @Qualifier(AsyncConfig.AUTOPILOT_EXECUTOR) Executor executor) {
    this.settingsService = settingsService;
    this.contextFactory = contextFactory;
    this.detectors = List.copyOf(detectors);
    this.sequencingFilter = sequencingFilter;
    this.store = store;
    this.auditService = auditService;
    this.executor = executor;
  }

  public DetectionResult run(ProposalOwner owner) {
    var settings = settingsService.resolve(owner);
    if (!settings.enabled()) {
      log.debug("Autopilot disabled for user {}, skipping detection", owner.userId());
      return DetectionResult.skipped(owner.userId());
    }

    var context = contextFactory.create(owner, settings, Instant.now());
    var failed = Collections.synchronizedList(new ArrayList<String>());
    var candidates = evaluate(context, failed);

    var sequenced =
        sequencingFilter.apply(
            candidates,
            new QueueState(
                context.completedTypesByEntity(),
                context.sequentialPending(),
                context.surfacedCount(),
                settings.maxConcurrentProposals()));

    int created = 0;
    int duplicates = 0;
    for (var candidate : sequenced.admitted()) {
      var inserted = store.insert(new Proposal(owner, candidate));
      if (inserted.isPresent()) {
        recordCreated(inserted.get());
        created++;
      } else {
        duplicates++;
      }
    }

    var filtered = new LinkedHashMap<String, Integer>();
    sequenced.droppedByReason().forEach((reason, count) -> filtered.put(reason.name(), count));

    log.info(
        "Detection completed for user {}: {} candidates, {} created, {} duplicates, {} filtered,"
            + " {} failed detectors",
        owner.userId(),
        candidates.size(),
        created,
        duplicates,
        sequenced.dropped().size(),
        failed.size());
    return new DetectionResult(
        owner.userId(), false, candidates.size(), created, duplicates, filtered, failed);
  }

  /**
   * Evaluates detectors on the shared executor. A detector that throws contributes nothing and is
   * reported in {@code failed}; the others still count.
   */
  private List<ProposalCandidate> evaluate(DetectionContext context, List<String> failed) {
    var futures = new ArrayList<CompletableFuture<List<ProposalCandidate>>>();
    for (var detector : detectors) {
      futures.add(
          CompletableFuture.supplyAsync(() -> runDetector(detector, context), executor)
              .exceptionally(
                  e -> {
                    log.error(
                        "Detector {} failed for user {}",
                        detector.type().key(),
                        context.owner().userId(),
                        e);
                    failed.add(detector.type().key());
                    return List.of();
                  }));
    }

    // Same key from two detectors keeps the first, in detector order.
    var byKey = new LinkedHashMap<String, ProposalCandidate>();
    for (var future : futures) {
      for (var candidate : future.join()) {
        byKey.putIfAbsent(candidate.dedupeKey(), candidate);
      }
    }
    return new ArrayList<>(byKey.values());
  }

  private static List<ProposalCandidate> runDetector(Detector detector, DetectionContext context) {
    var produced = detector.detect(context);
    if (produced == null || produced.isEmpty()) {
      return List.of();
    }
    return produced.stream()
        .filter(c -> !context.isBlocked(c.dedupeKey()))
        .limit(Math.max(0, detector.maxCandidates(context)))
        .toList();
  }

  private void recordCreated(Proposal proposal) {
    var details = new LinkedHashMap<String, Object>();
    details.put("type", proposal.getType().key());
    details.put("dedupe_key", proposal.getDedupeKey());
    details.put("priority", proposal.getPriority());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("autopilot_proposal.created")
            .entityType("autopilot_proposal")
            .entityId(proposal.getId())
            .details(Map.copyOf(details))
            .build());
  }
}
