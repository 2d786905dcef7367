package io.dealmotion.autopilot.pipeline;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

@Repository
public class CalendarMeetingReadRepository {

  static final String CANCELLED = "cancelled";

  private final JdbcClient jdbc;

  public CalendarMeetingReadRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant != null ? Timestamp.from(instant) : null;
  }

  public Optional<MeetingRecord> findById(UUID meetingId) {
    return jdbc.sql(
            """
            SELECT id, user_id, organization_id, prospect_id, title, start_time, end_time, status
            FROM calendar_meetings
            WHERE id = :id
            """)
        .param("id", meetingId)
        .query(MeetingRecord.class)
        .optional();
  }

  /** Non-cancelled meetings of the user starting in {@code (from, to]}, soonest first. */
  public List<MeetingRecord> findUpcoming(UUID userId, Instant from, Instant to) {
    return jdbc.sql(
            """
            SELECT id, user_id, organization_id, prospect_id, title, start_time, end_time, status
            FROM calendar_meetings
            WHERE user_id = :userId
              AND status <> :cancelled
              AND start_time > :from
              AND start_time <= :to
            ORDER BY start_time
            """)
        .param("userId", userId)
        .param("cancelled", CANCELLED)
        .param("from", toTimestamp(from))
        .param("to", toTimestamp(to))
        .query(MeetingRecord.class)
        .list();
  }

  /** True if the prospect has any non-cancelled meeting, past or future. */
  public boolean existsForProspect(UUID prospectId) {
    return jdbc.sql(
                """
            SELECT COUNT(*) FROM calendar_meetings
            WHERE prospect_id = :prospectId AND status <> :cancelled
            """)
            .param("prospectId", prospectId)
            .param("cancelled", CANCELLED)
            .query(Integer.class)
            .single()
        > 0;
  }
}
