package io.dealmotion.autopilot.pipeline;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

@Repository
public class ResearchBriefReadRepository {

  static final String COMPLETED = "completed";

  private final JdbcClient jdbc;

  public ResearchBriefReadRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant != null ? Timestamp.from(instant) : null;
  }

  public List<ResearchRecord> findCompletedSince(UUID organizationId, Instant since) {
    return jdbc.sql(
            """
            SELECT id, user_id, organization_id, prospect_id, company_name, status,
                   completed_at, created_at
            FROM research_briefs
            WHERE organization_id = :orgId
              AND status = :completed
              AND completed_at > :since
            ORDER BY completed_at DESC
            """)
        .param("orgId", organizationId)
        .param("completed", COMPLETED)
        .param("since", toTimestamp(since))
        .query(ResearchRecord.class)
        .list();
  }

  /** Prospects that have research in any status, so a new request would duplicate it. */
  public Set<UUID> findProspectIdsWithResearch(UUID organizationId) {
    return new HashSet<>(
        jdbc.sql(
                """
                SELECT DISTINCT prospect_id FROM research_briefs
                WHERE organization_id = :orgId AND prospect_id IS NOT NULL
                """)
            .param("orgId", organizationId)
            .query((rs, rowNum) -> rs.getObject("prospect_id", UUID.class))
            .list());
  }

  public boolean existsCompletedForProspect(UUID prospectId) {
    return jdbc.sql(
                """
            SELECT COUNT(*) FROM research_briefs
            WHERE prospect_id = :prospectId AND status = :completed
            """)
            .param("prospectId", prospectId)
            .param("completed", COMPLETED)
            .query(Integer.class)
            .single()
        > 0;
  }
}
