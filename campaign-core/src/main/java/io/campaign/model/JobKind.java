package io.campaign.model;

/**
 * Kinds of background jobs carried by the job queue. Each kind names the scope of its
 * target id, used to serialize jobs that touch the same campaign or group.
 */
public enum JobKind {
  /** Deduplicate raw addresses and link the resulting recipients to a campaign. */
  LINK_RECIPIENTS("campaign"),
  /** Send a campaign to its eligible linked recipients. */
  DISPATCH_CAMPAIGN("campaign"),
  /** Upsert raw addresses and move eligible recipients into a group. */
  ASSIGN_GROUP("group");

  private final String scope;

  JobKind(String scope) {
    this.scope = scope;
  }

  public String scope() {
    return scope;
  }
}
