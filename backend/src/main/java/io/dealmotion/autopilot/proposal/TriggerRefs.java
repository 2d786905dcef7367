package io.dealmotion.autopilot.proposal;

import java.util.UUID;

/**
 * Ids of the pipeline records that caused a proposal, at most one per axis.
 *
 * <p>{@link #entityKey()} resolves the single entity a proposal is "about" for dependency checks,
 * using the precedence meeting, followup, prospect, research, contact. A proposal with none of
 * those maps to {@link #GLOBAL_ENTITY}.
 */
public record TriggerRefs(
    UUID prospectId,
    UUID contactId,
    UUID meetingId,
    UUID researchId,
    UUID prepId,
    UUID followupId,
    UUID outreachId) {

  public static final String GLOBAL_ENTITY = "global";

  public static TriggerRefs none() {
    return new TriggerRefs(null, null, null, null, null, null, null);
  }

  public static Builder builder() {
    return new Builder();
  }

  public String entityKey() {
    if (meetingId != null) {
      return "meeting:" + meetingId;
    }
    if (followupId != null) {
      return "followup:" + followupId;
    }
    if (prospectId != null) {
      return "prospect:" + prospectId;
    }
    if (researchId != null) {
      return "research:" + researchId;
    }
    if (contactId != null) {
      return "contact:" + contactId;
    }
    return GLOBAL_ENTITY;
  }

  public static class Builder {

    private UUID prospectId;
    private UUID contactId;
    private UUID meetingId;
    private UUID researchId;
    private UUID prepId;
    private UUID followupId;
    private UUID outreachId;

    private Builder() {}

    public Builder prospect(UUID prospectId) {
      this.prospectId = prospectId;
      return this;
    }

    public Builder contact(UUID contactId) {
      this.contactId = contactId;
      return this;
    }

    public Builder meeting(UUID meetingId) {
      this.meetingId = meetingId;
      return this;
    }

    public Builder research(UUID researchId) {
      this.researchId = researchId;
      return this;
    }

    public Builder prep(UUID prepId) {
      this.prepId = prepId;
      return this;
    }

    public Builder followup(UUID followupId) {
      this.followupId = followupId;
      return this;
    }

    public Builder outreach(UUID outreachId) {
      this.outreachId = outreachId;
      return this;
    }

    public TriggerRefs build() {
      return new TriggerRefs(
          prospectId, contactId, meetingId, researchId, prepId, followupId, outreachId);
    }
  }
}
