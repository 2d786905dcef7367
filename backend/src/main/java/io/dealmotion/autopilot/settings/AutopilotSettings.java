package io.dealmotion.autopilot.settings;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** Per-user autopilot settings. One row per user; absent rows mean "use the defaults". */
@Entity
@Table(name = "autopilot_settings")
public class AutopilotSettings {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "user_id", nullable = false, updatable = false, unique = true)
  private UUID userId;

  @Column(name = "organization_id", nullable = false)
  private UUID organizationId;

  @Column(name = "enabled", nullable = false)
  private boolean enabled;

  @Column(name = "auto_research_new_meetings", nullable = false)
  private boolean autoResearchNewMeetings;

  @Column(name = "auto_prep_known_prospects", nullable = false)
  private boolean autoPrepKnownProspects;

  @Column(name = "auto_followup_after_meeting", nullable = false)
  private boolean autoFollowupAfterMeeting;

  @Column(name = "outreach_cooldown_days", nullable = false)
  private int outreachCooldownDays;

  @Column(name = "prep_reminder_hours", nullable = false)
  private int prepReminderHours;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "excluded_meeting_keywords", nullable = false, columnDefinition = "jsonb")
  private List<String> excludedMeetingKeywords = new ArrayList<>();

  @Column(name = "max_concurrent_proposals", nullable = false)
  private int maxConcurrentProposals;

  @Column(name = "reactivation_days_threshold", nullable = false)
  private int reactivationDaysThreshold;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  /** JPA-required no-arg constructor. */
  protected AutopilotSettings() {}

  /** Creates a row initialised from {@code initial}. */
  public AutopilotSettings(UUID userId, UUID organizationId, OwnerSettings initial) {
    this.userId = Objects.requireNonNull(userId, "userId must not be null");
    this.organizationId = Objects.requireNonNull(organizationId, "organizationId must not be null");
    this.enabled = initial.enabled();
    this.autoResearchNewMeetings = initial.autoResearchNewMeetings();
    this.autoPrepKnownProspects = initial.autoPrepKnownProspects();
    this.autoFollowupAfterMeeting = initial.autoFollowupAfterMeeting();
    this.outreachCooldownDays = initial.outreachCooldownDays();
    this.prepReminderHours = initial.prepReminderHours();
    this.excludedMeetingKeywords = new ArrayList<>(initial.excludedMeetingKeywords());
    this.maxConcurrentProposals = initial.maxConcurrentProposals();
    this.reactivationDaysThreshold = initial.reactivationDaysThreshold();
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  /** Applies the non-null fields of {@code update}. Validation happens in the service. */
  public void apply(SettingsUpdate update) {
    if (update.enabled() != null) {
      this.enabled = update.enabled();
    }
    if (update.autoResearchNewMeetings() != null) {
      this.autoResearchNewMeetings = update.autoResearchNewMeetings();
    }
    if (update.autoPrepKnownProspects() != null) {
      this.autoPrepKnownProspects = update.autoPrepKnownProspects();
    }
    if (update.autoFollowupAfterMeeting() != null) {
      this.autoFollowupAfterMeeting = update.autoFollowupAfterMeeting();
    }
    if (update.outreachCooldownDays() != null) {
      this.outreachCooldownDays = update.outreachCooldownDays();
    }
    if (update.prepReminderHours() != null) {
      this.prepReminderHours = update.prepReminderHours();
    }
    if (update.excludedMeetingKeywords() != null) {
      this.excludedMeetingKeywords = new ArrayList<>(update.excludedMeetingKeywords());
    }
    if (update.maxConcurrentProposals() != null) {
      this.maxConcurrentProposals = update.maxConcurrentProposals();
    }
    if (update.reactivationDaysThreshold() != null) {
      this.reactivationDaysThreshold = update.reactivationDaysThreshold();
    }
  }

  public OwnerSettings toOwnerSettings() {
    return new OwnerSettings(
        enabled,
        autoResearchNewMeetings,
        autoPrepKnownProspects,
        autoFollowupAfterMeeting,
        outreachCooldownDays,
        prepReminderHours,
        excludedMeetingKeywords,
        maxConcurrentProposals,
        reactivationDaysThreshold);
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
