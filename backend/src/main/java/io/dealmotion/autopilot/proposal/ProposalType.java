package io.dealmotion.autopilot.proposal;

import java.time.Duration;

/**
 * The closed catalog of proposal kinds. Each kind owns exactly one detector, a base priority, its
 * sequencing class and the time-to-live used when the detector has no better deadline.
 *
 * <p>Sequential kinds form the post-meeting workflow; at most one of them may be live per owner.
 */
public enum ProposalType {
  START_RESEARCH("start_research", 70, false, Duration.ofDays(7)),
  REVIEW_RESEARCH("review_research", 75, false, Duration.ofDays(14)),
  ADD_CONTACTS("add_contacts", 80, false, Duration.ofDays(7)),
  PREPARE_OUTREACH("prepare_outreach", 65, false, Duration.ofDays(14)),
  FIRST_TOUCH_SENT("first_touch_sent", 40, false, Duration.ofDays(3)),
  SUGGEST_MEETING_CREATION("suggest_meeting_creation", 60, false, Duration.ofDays(7)),
  CREATE_PREP("create_prep", 75, false, Duration.ofDays(1)),
  PREP_READY("prep_ready", 85, false, Duration.ofDays(2)),
  REVIEW_MEETING_SUMMARY("review_meeting_summary", 90, true, Duration.ofDays(3)),
  REVIEW_CUSTOMER_REPORT("review_customer_report", 85, true, Duration.ofDays(3)),
  SEND_FOLLOWUP_EMAIL("send_followup_email", 80, true, Duration.ofDays(3)),
  CREATE_ACTION_ITEMS("create_action_items", 75, true, Duration.ofDays(5)),
  UPDATE_CRM_NOTES("update_crm_notes", 70, false, Duration.ofDays(3)),
  SETUP_COMPANY_PROFILE("setup_company_profile", 90, false, Duration.ofDays(7)),
  REACTIVATE_PROSPECT("reactivate_prospect", 50, false, Duration.ofDays(7));

  private final String key;
  private final int basePriority;
  private final boolean sequential;
  private final Duration defaultTtl;

  ProposalType(String key, int basePriority, boolean sequential, Duration defaultTtl) {
    this.key = key;
    this.basePriority = basePriority;
    this.sequential = sequential;
    this.defaultTtl = defaultTtl;
  }

  /** Stable lowercase identifier used in dedupe keys, events and audit details. */
  public String key() {
    return key;
  }

  public int basePriority() {
    return basePriority;
  }

  public boolean isSequential() {
    return sequential;
  }

  public Duration defaultTtl() {
    return defaultTtl;
  }

  /** Builds a dedupe key of the form {@code <type>:<part>:<part>...}. */
  public String dedupeKey(Object... parts) {
    var key = new StringBuilder(this.key);
    for (var part : parts) {
      key.append(':').append(part);
    }
    return key.toString();
  }
}
