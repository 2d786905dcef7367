package io.dealmotion.autopilot.pipeline;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

@Repository
public class FollowupReadRepository {

  private final JdbcClient jdbc;

  public FollowupReadRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant != null ? Timestamp.from(instant) : null;
  }

  /** Completed meeting analyses with an executive summary, newest first. */
  public List<FollowupRecord> findAnalysedSince(UUID userId, Instant since) {
    return jdbc.sql(
            """
            SELECT id, user_id, organization_id, prospect_id, meeting_id, status,
                   executive_summary, action_item_count, completed_at, created_at
            FROM followups
            WHERE user_id = :userId
              AND status = 'completed'
              AND executive_summary IS NOT NULL
              AND completed_at > :since
            ORDER BY completed_at DESC
            """)
        .param("userId", userId)
        .param("since", toTimestamp(since))
        .query(FollowupRecord.class)
        .list();
  }
}
