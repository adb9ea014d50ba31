package io.campaign.jdbc;

import java.util.Objects;

/**
 * Table names used by the JDBC stores. Only the job table is configurable.
 */
public final class TableNames {
  public static final String RECIPIENT_GROUP = "recipient_group";
  public static final String RECIPIENT = "recipient";
  public static final String CAMPAIGN = "campaign";
  public static final String CAMPAIGN_RECIPIENT = "campaign_recipient";
  public static final String CAMPAIGN_DELIVERY_FAILURE = "campaign_delivery_failure";
  public static final String DEFAULT_JOB_TABLE = "campaign_job";

  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  /**
   * Returns {@code tableName} if it is a plain SQL identifier.
   *
   * @throws IllegalArgumentException otherwise
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
