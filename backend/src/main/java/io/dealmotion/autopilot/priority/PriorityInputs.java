package io.dealmotion.autopilot.priority;

import java.math.BigDecimal;

/**
 * Situational inputs to {@link PriorityCalculator}. Every field is optional; a null field simply
 * contributes nothing.
 *
 * @param urgency time-to-event bucket, for proposals tied to an upcoming event
 * @param dealValue estimated value of the related deal
 * @param entityStatus pipeline status of the related prospect (e.g. "qualified")
 * @param daysSilent days since the related prospect last showed activity
 * @param flowStep position hint within a multi-step flow (e.g. "plan_meeting")
 */
public record PriorityInputs(
    UrgencyWindow urgency,
    BigDecimal dealValue,
    String entityStatus,
    Integer daysSilent,
    String flowStep) {

  public static PriorityInputs none() {
    return new PriorityInputs(null, null, null, null, null);
  }

  public static PriorityInputs forDeal(BigDecimal dealValue, String entityStatus) {
    return new PriorityInputs(null, dealValue, entityStatus, null, null);
  }

  public PriorityInputs withUrgency(UrgencyWindow urgency) {
    return new PriorityInputs(urgency, dealValue, entityStatus, daysSilent, flowStep);
  }

  public PriorityInputs withDaysSilent(Integer daysSilent) {
    return new PriorityInputs(urgency, dealValue, entityStatus, daysSilent, flowStep);
  }

  public PriorityInputs withFlowStep(String flowStep) {
    return new PriorityInputs(urgency, dealValue, entityStatus, daysSilent, flowStep);
  }
}
