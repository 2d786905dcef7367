package io.dealmotion.autopilot.settings;

import io.dealmotion.autopilot.audit.AuditEventBuilder;
import io.dealmotion.autopilot.audit.AuditService;
import io.dealmotion.autopilot.config.AutopilotProperties;
import io.dealmotion.autopilot.exception.InvalidStateException;
import io.dealmotion.autopilot.proposal.ProposalOwner;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AutopilotSettingsService {

  private static final Logger log = LoggerFactory.getLogger(AutopilotSettingsService.class);

  static final int MAX_CONCURRENT_LIMIT = 10;
  static final int MAX_PREP_REMINDER_HOURS = 168;
  static final int MAX_DAYS = 365;

  private final AutopilotSettingsRepository settingsRepository;
  private final AuditService auditService;
  private final AutopilotProperties properties;

  public AutopilotSettingsService(
      AutopilotSettingsRepository settingsRepository,
      AuditService auditService,
      AutopilotProperties properties) {
    this.settingsRepository = settingsRepository;
    this.auditService = auditService;
    this.properties = properties;
  }

  /**
   * Returns the owner's settings. Never returns null: owners without a stored row get the defaults
   * without anything being persisted.
   */
  @Transactional(readOnly = true)
  public OwnerSettings resolve(ProposalOwner owner) {
    return settingsRepository
        .findByUserId(owner.userId())
        .map(AutopilotSettings::toOwnerSettings)
        .orElseGet(this::defaults);
  }

  public OwnerSettings defaults() {
    return OwnerSettings.defaults(properties.defaultMaxConcurrentProposals());
  }

  /** Applies a partial update, creating the owner's row on first write. */
  @Transactional
  public OwnerSettings update(ProposalOwner owner, SettingsUpdate update) {
    Objects.requireNonNull(update, "update must not be null");
    var normalized = validate(update);

    var settings =
        settingsRepository
            .findByUserId(owner.userId())
            .orElseGet(
                () ->
                    new AutopilotSettings(owner.userId(), owner.organizationId(), defaults()));
    settings.apply(normalized);
    settings = settingsRepository.save(settings);

    var details = new LinkedHashMap<String, Object>();
    details.put("enabled", settings.isEnabled());
    if (normalized.maxConcurrentProposals() != null) {
      details.put("max_concurrent_proposals", normalized.maxConcurrentProposals());
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("autopilot_settings.updated")
            .entityType("autopilot_settings")
            .entityId(settings.getId())
            .actorId(owner.userId())
            .source("USER_ACTION")
            .details(details)
            .build());

    log.info("Updated autopilot settings for user {}", owner.userId());
    return settings.toOwnerSettings();
  }

  /**
   * Returns one page of owners with autopilot enabled, in a stable order, for the periodic
   * detection job to walk through.
   */
  @Transactional(readOnly = true)
  public List<ProposalOwner> findEnabledOwners(int page, int pageSize) {
    return settingsRepository
        .findByEnabledTrueOrderByUserId(PageRequest.of(Math.max(0, page), pageSize))
        .stream()
        .map(s -> new ProposalOwner(s.getUserId(), s.getOrganizationId()))
        .toList();
  }

  private SettingsUpdate validate(SettingsUpdate update) {
    requireRange(
        "maxConcurrentProposals", update.maxConcurrentProposals(), 1, MAX_CONCURRENT_LIMIT);
    requireRange("prepReminderHours", update.prepReminderHours(), 1, MAX_PREP_REMINDER_HOURS);
    requireRange("outreachCooldownDays", update.outreachCooldownDays(), 0, MAX_DAYS);
    requireRange("reactivationDaysThreshold", update.reactivationDaysThreshold(), 1, MAX_DAYS);

    List<String> keywords = null;
    if (update.excludedMeetingKeywords() != null) {
      keywords =
          update.excludedMeetingKeywords().stream()
              .filter(Objects::nonNull)
              .map(k -> k.trim().toLowerCase(Locale.ROOT))
              .filter(k -> !k.isEmpty())
              .distinct()
              .toList();
    }
    return new SettingsUpdate(
        update.enabled(),
        update.autoResearchNewMeetings(),
        update.autoPrepKnownProspects(),
        update.autoFollowupAfterMeeting(),
        update.outreachCooldownDays(),
        update.prepReminderHours(),
        keywords,
        update.maxConcurrentProposals(),
        update.reactivationDaysThreshold());
  }

  private static void requireRange(String field, Integer value, int min, int max) {
    if (value != null && (value < min || value > max)) {
      throw new InvalidStateException(
          "Invalid autopilot settings",
          field + " must be between " + min + " and " + max + " but was " + value);
    }
  }
}
