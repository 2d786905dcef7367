package io.dealmotion.autopilot.pipeline;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

@Repository
public class MeetingPrepReadRepository {

  private final JdbcClient jdbc;

  public MeetingPrepReadRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant != null ? Timestamp.from(instant) : null;
  }

  /** True if any prep, in any status, exists for the meeting. */
  public boolean existsForMeeting(UUID meetingId) {
    return jdbc.sql("SELECT COUNT(*) FROM meeting_preps WHERE meeting_id = :meetingId")
            .param("meetingId", meetingId)
            .query(Integer.class)
            .single()
        > 0;
  }

  public List<PrepRecord> findCompletedSince(UUID userId, Instant since) {
    return jdbc.sql(
            """
            SELECT id, user_id, organization_id, prospect_id, meeting_id, status, completed_at,
                   created_at
            FROM meeting_preps
            WHERE user_id = :userId
              AND status = 'completed'
              AND completed_at > :since
            ORDER BY completed_at DESC
            """)
        .param("userId", userId)
        .param("since", toTimestamp(since))
        .query(PrepRecord.class)
        .list();
  }
}
