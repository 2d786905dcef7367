package io.dealmotion.autopilot.settings;

import java.util.List;

/** Partial update of an owner's settings. Null fields keep their current value. */
public record SettingsUpdate(
    Boolean enabled,
    Boolean autoResearchNewMeetings,
    Boolean autoPrepKnownProspects,
    Boolean autoFollowupAfterMeeting,
    Integer outreachCooldownDays,
    Integer prepReminderHours,
    List<String> excludedMeetingKeywords,
    Integer maxConcurrentProposals,
    Integer reactivationDaysThreshold) {

  public static SettingsUpdate enabled(boolean enabled) {
    return new SettingsUpdate(enabled, null, null, null, null, null, null, null, null);
  }
}
