package io.dealmotion.autopilot.sequencing;

import io.dealmotion.autopilot.proposal.ProposalType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Static prerequisites between proposal types. A type with prerequisites may only be surfaced for
 * an entity once every prerequisite has completed for that same entity.
 *
 * <pre>
 * review_meeting_summary
 *   ├── review_customer_report
 *   │     └── send_followup_email
 *   │           └── create_action_items
 *   └── update_crm_notes
 * </pre>
 */
public final class DependencyGraph {

  private static final Map<ProposalType, Set<ProposalType>> PREREQUISITES = build();

  private DependencyGraph() {}

  private static Map<ProposalType, Set<ProposalType>> build() {
    var graph = new EnumMap<ProposalType, Set<ProposalType>>(ProposalType.class);
    graph.put(
        ProposalType.REVIEW_CUSTOMER_REPORT,
        Collections.unmodifiableSet(EnumSet.of(ProposalType.REVIEW_MEETING_SUMMARY)));
    graph.put(
        ProposalType.SEND_FOLLOWUP_EMAIL,
        Collections.unmodifiableSet(EnumSet.of(ProposalType.REVIEW_CUSTOMER_REPORT)));
    graph.put(
        ProposalType.CREATE_ACTION_ITEMS,
        Collections.unmodifiableSet(EnumSet.of(ProposalType.SEND_FOLLOWUP_EMAIL)));
    graph.put(
        ProposalType.UPDATE_CRM_NOTES,
        Collections.unmodifiableSet(EnumSet.of(ProposalType.REVIEW_MEETING_SUMMARY)));
    return Collections.unmodifiableMap(graph);
  }

  public static Set<ProposalType> prerequisitesOf(ProposalType type) {
    return PREREQUISITES.getOrDefault(type, Set.of());
  }

  public static boolean hasPrerequisites(ProposalType type) {
    return !prerequisitesOf(type).isEmpty();
  }

  /** True if every prerequisite of {@code type} is among {@code completedForEntity}. */
  public static boolean isSatisfied(ProposalType type, Set<ProposalType> completedForEntity) {
    return completedForEntity.containsAll(prerequisitesOf(type));
  }

  /** Convenience overload looking the entity up in a per-entity completion map. */
  public static boolean isSatisfied(
      ProposalType type, String entityKey, Map<String, Set<ProposalType>> completedByEntity) {
    if (!hasPrerequisites(type)) {
      return true;
    }
    return isSatisfied(type, completedByEntity.getOrDefault(entityKey, Set.of()));
  }
}
