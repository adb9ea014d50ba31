package io.campaign.model;

import java.util.List;

/**
 * Outcome of one recipient ingestion run (campaign linking or group assignment).
 *
 * @param targetId  campaign id or group id
 * @param submitted raw entries received
 * @param unique    distinct valid addresses after normalization
 * @param affected  associations newly created (linking) or recipients moved into the group
 * @param rejected  raw entries skipped as blank or malformed
 */
public record LinkingReport(long targetId, int submitted, int unique, int affected, List<String> rejected) {

  public LinkingReport {
    rejected = List.copyOf(rejected);
  }
}
