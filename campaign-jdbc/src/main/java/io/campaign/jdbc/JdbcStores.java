package io.campaign.jdbc;

import io.campaign.jdbc.dialect.Dialects;
import io.campaign.jdbc.spi.Dialect;
import io.campaign.jdbc.store.JdbcCampaignStore;
import io.campaign.jdbc.store.JdbcGroupStore;
import io.campaign.jdbc.store.JdbcJobStore;
import io.campaign.jdbc.store.JdbcRecipientStore;
import io.campaign.spi.CampaignStore;
import io.campaign.spi.GroupStore;
import io.campaign.spi.JobStore;
import io.campaign.spi.RecipientStore;
import io.campaign.util.TargetCodec;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * The four JDBC stores for one database, sharing a {@link Dialect}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * JdbcStores stores = JdbcStores.detect(dataSource);
 * CampaignJobs jobs = CampaignJobs.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .recipientStore(stores.recipients())
 *     .groupStore(stores.groups())
 *     .campaignStore(stores.campaigns())
 *     .jobStore(stores.jobs())
 *     .build();
 * }</pre>
 */
public final class JdbcStores {
  private final Dialect dialect;
  private final JdbcRecipientStore recipients;
  private final JdbcGroupStore groups;
  private final JdbcCampaignStore campaigns;
  private final JdbcJobStore jobs;

  private JdbcStores(Dialect dialect, String jobTable, TargetCodec targetCodec) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.recipients = new JdbcRecipientStore(dialect);
    this.groups = new JdbcGroupStore(dialect);
    this.campaigns = new JdbcCampaignStore();
    this.jobs = new JdbcJobStore(dialect, jobTable, targetCodec);
  }

  /**
   * Detects the dialect from the data source URL and uses the default job table.
   *
   * @throws IllegalArgumentException if no dialect matches the URL
   */
  public static JdbcStores detect(DataSource dataSource) {
    return create(Dialects.detect(dataSource), TableNames.DEFAULT_JOB_TABLE, TargetCodec.getDefault());
  }

  public static JdbcStores create(Dialect dialect) {
    return create(dialect, TableNames.DEFAULT_JOB_TABLE, TargetCodec.getDefault());
  }

  /**
   * @param jobTable    job table name, a plain SQL identifier
   * @param targetCodec codec for the job payload column
   * @throws IllegalArgumentException if {@code jobTable} is not a valid identifier
   */
  public static JdbcStores create(Dialect dialect, String jobTable, TargetCodec targetCodec) {
    return new JdbcStores(dialect, jobTable, targetCodec == null ? TargetCodec.getDefault() : targetCodec);
  }

  public Dialect dialect() {
    return dialect;
  }

  public RecipientStore recipients() {
    return recipients;
  }

  public GroupStore groups() {
    return groups;
  }

  public CampaignStore campaigns() {
    return campaigns;
  }

  public JobStore jobs() {
    return jobs;
  }
}
