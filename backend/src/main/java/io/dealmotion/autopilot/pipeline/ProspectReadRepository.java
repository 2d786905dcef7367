package io.dealmotion.autopilot.pipeline;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/** Read-only access to prospects, their contacts and the organization's company profile. */
@Repository
public class ProspectReadRepository {

  private final JdbcClient jdbc;

  public ProspectReadRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant != null ? Timestamp.from(instant) : null;
  }

  public Optional<ProspectRecord> findById(UUID prospectId) {
    return jdbc.sql(
            """
            SELECT id, organization_id, company_name, status, deal_value, last_activity_at,
                   created_at
            FROM prospects
            WHERE id = :id
            """)
        .param("id", prospectId)
        .query(ProspectRecord.class)
        .optional();
  }

  /** Prospects not yet won, lost or marked inactive. */
  public List<ProspectRecord> findActive(UUID organizationId) {
    return jdbc.sql(
            """
            SELECT id, organization_id, company_name, status, deal_value, last_activity_at,
                   created_at
            FROM prospects
            WHERE organization_id = :orgId
              AND status NOT IN (:closed)
            ORDER BY created_at DESC
            """)
        .param("orgId", organizationId)
        .param("closed", List.copyOf(ProspectRecord.CLOSED_STATUSES))
        .query(ProspectRecord.class)
        .list();
  }

  public List<ProspectRecord> findByStatuses(UUID organizationId, Collection<String> statuses) {
    return jdbc.sql(
            """
            SELECT id, organization_id, company_name, status, deal_value, last_activity_at,
                   created_at
            FROM prospects
            WHERE organization_id = :orgId
              AND status IN (:statuses)
            ORDER BY created_at DESC
            """)
        .param("orgId", organizationId)
        .param("statuses", List.copyOf(statuses))
        .query(ProspectRecord.class)
        .list();
  }

  /** Prospects in the given statuses whose last activity is older than {@code cutoff}. */
  public List<ProspectRecord> findSilentSince(
      UUID organizationId, Collection<String> statuses, Instant cutoff) {
    return jdbc.sql(
            """
            SELECT id, organization_id, company_name, status, deal_value, last_activity_at,
                   created_at
            FROM prospects
            WHERE organization_id = :orgId
              AND status IN (:statuses)
              AND last_activity_at < :cutoff
            ORDER BY last_activity_at
            """)
        .param("orgId", organizationId)
        .param("statuses", List.copyOf(statuses))
        .param("cutoff", toTimestamp(cutoff))
        .query(ProspectRecord.class)
        .list();
  }

  public boolean hasActivitySince(UUID prospectId, Instant since) {
    return jdbc.sql(
                """
            SELECT COUNT(*) FROM prospects
            WHERE id = :id AND last_activity_at > :since
            """)
            .param("id", prospectId)
            .param("since", toTimestamp(since))
            .query(Integer.class)
            .single()
        > 0;
  }

  public List<ContactRecord> findContacts(UUID prospectId) {
    return jdbc.sql(
            """
            SELECT id, prospect_id, organization_id, name, created_at
            FROM prospect_contacts
            WHERE prospect_id = :prospectId
            ORDER BY created_at DESC
            """)
        .param("prospectId", prospectId)
        .query(ContactRecord.class)
        .list();
  }

  public boolean hasContacts(UUID prospectId) {
    return jdbc.sql("SELECT COUNT(*) FROM prospect_contacts WHERE prospect_id = :prospectId")
            .param("prospectId", prospectId)
            .query(Integer.class)
            .single()
        > 0;
  }

  public boolean hasCompanyProfile(UUID organizationId) {
    return jdbc.sql("SELECT COUNT(*) FROM company_profiles WHERE organization_id = :orgId")
            .param("orgId", organizationId)
            .query(Integer.class)
            .single()
        > 0;
  }
}
