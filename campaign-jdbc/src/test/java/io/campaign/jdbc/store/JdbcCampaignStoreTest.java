package io.campaign.jdbc.store;

import io.campaign.jdbc.support.TestDatabases;
import io.campaign.model.Campaign;
import io.campaign.model.CampaignStatus;
import io.campaign.model.DeliveryFailure;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdbcCampaignStoreTest {
  private JdbcDataSource dataSource;
  private final JdbcCampaignStore campaigns = new JdbcCampaignStore();

  @BeforeEach
  void setUp() {
    dataSource = TestDatabases.h2("campaigns");
  }

  @Test
  void createStartsPendingAndRoundTrips() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      Campaign created = campaigns.create(conn, "Spring sale", "20% off");
      assertTrue(created.id() > 0);
      assertEquals(CampaignStatus.PENDING, created.status());

      Campaign loaded = campaigns.get(conn, created.id()).orElseThrow();
      assertEquals(created, loaded);
    }
  }

  @Test
  void idsAreDistinct() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      assertNotEquals(campaigns.create(conn, "a", "m").id(), campaigns.create(conn, "b", "m").id());
    }
  }

  @Test
  void getUnknownIsEmpty() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      assertTrue(campaigns.get(conn, 404).isEmpty());
    }
  }

  @Test
  void setStatusWritesCode() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      long id = campaigns.create(conn, "t", "m").id();
      assertEquals(1, campaigns.setStatus(conn, id, CampaignStatus.READY));
      assertEquals(CampaignStatus.READY, campaigns.get(conn, id).orElseThrow().status());
      assertEquals(0, campaigns.setStatus(conn, 404, CampaignStatus.READY));
    }
  }

  @Test
  void compareAndSetOnlyFromExpectedStatuses() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      long id = campaigns.create(conn, "t", "m").id();

      assertEquals(0, campaigns.compareAndSetStatus(conn, id, CampaignStatus.dispatchable(), CampaignStatus.SENDING));
      assertEquals(1, campaigns.compareAndSetStatus(conn, id,
          EnumSet.of(CampaignStatus.PENDING, CampaignStatus.READY), CampaignStatus.PROCESSING));
      assertEquals(CampaignStatus.PROCESSING, campaigns.get(conn, id).orElseThrow().status());
      assertEquals(0, campaigns.compareAndSetStatus(conn, id, Set.of(), CampaignStatus.SENT));
    }
  }

  @Test
  void deliveryFailuresAreReplacedInOrder() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      long id = campaigns.create(conn, "t", "m").id();
      campaigns.replaceDeliveryFailures(conn, id, List.of(
          new DeliveryFailure("b@x.io", "mailbox full"),
          new DeliveryFailure("a@x.io", "timeout")));
      assertEquals(List.of(new DeliveryFailure("b@x.io", "mailbox full"), new DeliveryFailure("a@x.io", "timeout")),
          campaigns.listDeliveryFailures(conn, id));

      campaigns.replaceDeliveryFailures(conn, id, List.of(new DeliveryFailure("c@x.io", "x".repeat(1500))));
      List<DeliveryFailure> latest = campaigns.listDeliveryFailures(conn, id);
      assertEquals(1, latest.size());
      assertEquals(1000, latest.get(0).reason().length());

      campaigns.replaceDeliveryFailures(conn, id, List.of());
      assertTrue(campaigns.listDeliveryFailures(conn, id).isEmpty());
    }
  }

  @Test
  void listReturnsEveryCampaignOldestFirst() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      assertTrue(campaigns.list(conn).isEmpty());
      Campaign first = campaigns.create(conn, "first", "m");
      Campaign second = campaigns.create(conn, "second", "m");
      campaigns.setStatus(conn, second.id(), CampaignStatus.SENDING);

      List<Campaign> listed = campaigns.list(conn);

      assertEquals(List.of(first.id(), second.id()), listed.stream().map(Campaign::id).toList());
      assertEquals(CampaignStatus.SENDING, listed.get(1).status());
    }
  }

  @Test
  void countRecipientsOfEmptyCampaignIsZero() throws SQLException {
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(0, campaigns.countRecipients(conn, campaigns.create(conn, "t", "m").id()));
    }
  }
}
