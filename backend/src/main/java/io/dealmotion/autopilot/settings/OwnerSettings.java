package io.dealmotion.autopilot.settings;

import java.util.List;
import java.util.Locale;

/**
 * Immutable view of one owner's autopilot settings, as consumed by detectors and sequencing.
 * Built from the stored row, or from defaults when the owner never saved any.
 */
public record OwnerSettings(
    boolean enabled,
    boolean autoResearchNewMeetings,
    boolean autoPrepKnownProspects,
    boolean autoFollowupAfterMeeting,
    int outreachCooldownDays,
    int prepReminderHours,
    List<String> excludedMeetingKeywords,
    int maxConcurrentProposals,
    int reactivationDaysThreshold) {

  public static final List<String> DEFAULT_EXCLUDED_KEYWORDS =
      List.of("internal", "1:1", "standup", "sync");

  public static final int DEFAULT_OUTREACH_COOLDOWN_DAYS = 14;
  public static final int DEFAULT_PREP_REMINDER_HOURS = 24;
  public static final int DEFAULT_REACTIVATION_DAYS = 14;

  public OwnerSettings {
    excludedMeetingKeywords =
        excludedMeetingKeywords != null ? List.copyOf(excludedMeetingKeywords) : List.of();
  }

  public static OwnerSettings defaults(int maxConcurrentProposals) {
    return new OwnerSettings(
        true,
        true,
        true,
        true,
        DEFAULT_OUTREACH_COOLDOWN_DAYS,
        DEFAULT_PREP_REMINDER_HOURS,
        DEFAULT_EXCLUDED_KEYWORDS,
        maxConcurrentProposals,
        DEFAULT_REACTIVATION_DAYS);
  }

  /** Case-insensitive substring match of the meeting title against the keyword blocklist. */
  public boolean isExcludedMeeting(String title) {
    if (title == null || title.isBlank()) {
      return false;
    }
    var lower = title.toLowerCase(Locale.ROOT);
    return excludedMeetingKeywords.stream()
        .anyMatch(keyword -> lower.contains(keyword.toLowerCase(Locale.ROOT)));
  }
}
