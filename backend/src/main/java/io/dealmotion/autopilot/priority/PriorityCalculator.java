package io.dealmotion.autopilot.priority;

import io.dealmotion.autopilot.proposal.ProposalType;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Computes a proposal's priority as its type's base value plus independent, bounded boosts,
 * clamped once to [0, 100].
 *
 * <ul>
 *   <li>urgency: 24h +0, 4h +5, 1h +15
 *   <li>deal value: at least 10k +5, 50k +10, 100k +15
 *   <li>status: qualified or proposal_sent +5, meeting_scheduled +10
 *   <li>staleness: silent 14 days +5, 30 days +15
 *   <li>flow step: plan_meeting +5, complete_actions +3
 * </ul>
 */
@Component
public class PriorityCalculator {

  public static final int MIN_PRIORITY = 0;
  public static final int MAX_PRIORITY = 100;

  private static final BigDecimal TEN_K = BigDecimal.valueOf(10_000);
  private static final BigDecimal FIFTY_K = BigDecimal.valueOf(50_000);
  private static final BigDecimal HUNDRED_K = BigDecimal.valueOf(100_000);

  public int calculate(ProposalType type, PriorityInputs inputs) {
    int score = type.basePriority();
    if (inputs != null) {
      score += urgencyBoost(inputs.urgency());
      score += dealValueBoost(inputs.dealValue());
      score += statusBoost(inputs.entityStatus());
      score += stalenessBoost(inputs.daysSilent());
      score += flowStepBoost(inputs.flowStep());
    }
    return Math.max(MIN_PRIORITY, Math.min(MAX_PRIORITY, score));
  }

  static int urgencyBoost(UrgencyWindow urgency) {
    return urgency != null ? urgency.boost() : 0;
  }

  static int dealValueBoost(BigDecimal dealValue) {
    if (dealValue == null) {
      return 0;
    }
    if (dealValue.compareTo(HUNDRED_K) >= 0) {
      return 15;
    }
    if (dealValue.compareTo(FIFTY_K) >= 0) {
      return 10;
    }
    if (dealValue.compareTo(TEN_K) >= 0) {
      return 5;
    }
    return 0;
  }

  static int statusBoost(String entityStatus) {
    if (entityStatus == null) {
      return 0;
    }
    return switch (entityStatus) {
      case "meeting_scheduled" -> 10;
      case "qualified", "proposal_sent" -> 5;
      default -> 0;
    };
  }

  static int stalenessBoost(Integer daysSilent) {
    if (daysSilent == null) {
      return 0;
    }
    if (daysSilent >= 30) {
      return 15;
    }
    if (daysSilent >= 14) {
      return 5;
    }
    return 0;
  }

  static int flowStepBoost(String flowStep) {
    if (flowStep == null) {
      return 0;
    }
    return switch (flowStep) {
      case "plan_meeting" -> 5;
      case "complete_actions" -> 3;
      default -> 0;
    };
  }
}
