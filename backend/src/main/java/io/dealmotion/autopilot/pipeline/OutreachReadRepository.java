package io.dealmotion.autopilot.pipeline;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

@Repository
public class OutreachReadRepository {

  static final List<String> DRAFT_OR_SENT = List.of("draft", "sent");

  private final JdbcClient jdbc;

  public OutreachReadRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant != null ? Timestamp.from(instant) : null;
  }

  public List<OutreachRecord> findSentSince(UUID userId, Instant since) {
    return jdbc.sql(
            """
            SELECT id, user_id, organization_id, prospect_id, contact_id, status, sent_at,
                   created_at
            FROM outreach_messages
            WHERE user_id = :userId
              AND status = 'sent'
              AND sent_at > :since
            ORDER BY sent_at DESC
            """)
        .param("userId", userId)
        .param("since", toTimestamp(since))
        .query(OutreachRecord.class)
        .list();
  }

  /** True if a draft or sent message to the contact was created after {@code since}. */
  public boolean existsForContactSince(UUID contactId, Instant since) {
    return jdbc.sql(
                """
            SELECT COUNT(*) FROM outreach_messages
            WHERE contact_id = :contactId
              AND status IN (:statuses)
              AND created_at > :since
            """)
            .param("contactId", contactId)
            .param("statuses", DRAFT_OR_SENT)
            .param("since", toTimestamp(since))
            .query(Integer.class)
            .single()
        > 0;
  }
}
