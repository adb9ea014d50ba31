package io.campaign.job;

import io.campaign.InvalidStateTransitionException;
import io.campaign.JobEnvelope;
import io.campaign.NotFoundException;
import io.campaign.model.Campaign;
import io.campaign.model.CampaignStatus;
import io.campaign.model.LinkingReport;
import io.campaign.model.Recipient;
import io.campaign.model.RecipientTarget;
import io.campaign.support.InMemoryCampaignData;
import io.campaign.support.StubConnections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecipientLinkingJobTest {

    private InMemoryCampaignData data;
    private RecipientLinkingJob job;

    @BeforeEach
    void setUp() {
        data = new InMemoryCampaignData();
        job = new RecipientLinkingJob(StubConnections.provider(), data.recipients(), data.campaigns());
    }

    @Test
    void linksDeduplicatedRecipientsAndMarksReady() throws Exception {
        Campaign campaign = data.campaign("Launch", CampaignStatus.PENDING);

        LinkingReport report = job.link(campaign.id(), targets("a@x.com", "b@x.com", "a@x.com"));

        assertEquals(3, report.submitted());
        assertEquals(2, report.unique());
        assertEquals(2, report.affected());
        assertEquals(2, data.recipientCount());
        assertEquals(2, data.campaigns().countRecipients(null, campaign.id()));
        assertEquals(CampaignStatus.READY, data.status(campaign.id()));
        assertEquals(List.of(CampaignStatus.PROCESSING, CampaignStatus.READY), data.statusHistory());
    }

    @Test
    void normalizesCaseAndWhitespaceBeforeDeduplicating() throws Exception {
        Campaign campaign = data.campaign("Launch", CampaignStatus.PENDING);

        LinkingReport report = job.link(campaign.id(), targets("A@Example.com", " a@example.com "));

        assertEquals(1, report.unique());
        List<Recipient> linked = data.recipients().listByCampaign(null, campaign.id());
        assertEquals(1, linked.size());
        assertEquals("a@example.com", linked.get(0).email());
    }

    @Test
    void rerunningTheSameInputCreatesNoNewRows() throws Exception {
        Campaign campaign = data.campaign("Launch", CampaignStatus.PENDING);
        job.link(campaign.id(), targets("a@x.com", "b@x.com"));

        LinkingReport second = job.link(campaign.id(), targets("a@x.com", "b@x.com"));

        assertEquals(0, second.affected());
        assertEquals(2, data.recipientCount());
        assertEquals(2, data.campaigns().countRecipients(null, campaign.id()));
        assertEquals(CampaignStatus.READY, data.status(campaign.id()));
    }

    @Test
    void existingOptOutIsPreservedAndRecipientStillLinked() throws Exception {
        data.recipient("opted@x.com", true);
        Campaign campaign = data.campaign("Launch", CampaignStatus.PENDING);

        job.link(campaign.id(), targets("OPTED@x.com", "fresh@x.com"));

        Recipient opted = data.recipients().findByEmail(null, "opted@x.com").orElseThrow();
        assertTrue(opted.optOut());
        assertEquals(2, data.recipients().listByCampaign(null, campaign.id()).size());
        assertEquals(1, data.recipients().listEligible(null, campaign.id()).size());
    }

    @Test
    void malformedEntriesAreSkippedAndReported() throws Exception {
        Campaign campaign = data.campaign("Launch", CampaignStatus.PENDING);

        LinkingReport report = job.link(campaign.id(), targets("ok@x.com", "   ", "not-an-email"));

        assertEquals(1, report.unique());
        assertEquals(List.of("   ", "not-an-email"), report.rejected());
        assertEquals(CampaignStatus.READY, data.status(campaign.id()));
    }

    @Test
    void emptyListStillMovesCampaignToReady() throws Exception {
        Campaign campaign = data.campaign("Empty", CampaignStatus.PENDING);

        LinkingReport report = job.link(campaign.id(), List.of());

        assertEquals(0, report.unique());
        assertEquals(CampaignStatus.READY, data.status(campaign.id()));
    }

    @Test
    void readyCampaignAcceptsMoreRecipients() throws Exception {
        Campaign campaign = data.campaign("Launch", CampaignStatus.READY);
        data.link(campaign.id(), "a@x.com");

        LinkingReport report = job.link(campaign.id(), targets("a@x.com", "c@x.com"));

        assertEquals(1, report.affected());
        assertEquals(CampaignStatus.READY, data.status(campaign.id()));
    }

    @Test
    void sentCampaignRejectsLinking() {
        Campaign campaign = data.campaign("Done", CampaignStatus.SENT);

        InvalidStateTransitionException e = assertThrows(InvalidStateTransitionException.class,
                () -> job.link(campaign.id(), targets("a@x.com")));

        assertEquals(CampaignStatus.SENT, e.current());
        assertEquals(0, data.recipientCount());
        assertEquals(CampaignStatus.SENT, data.status(campaign.id()));
    }

    @Test
    void campaignBeingSentRejectsLinking() {
        Campaign campaign = data.campaign("Sending", CampaignStatus.SENDING);

        InvalidStateTransitionException e = assertThrows(InvalidStateTransitionException.class,
                () -> job.link(campaign.id(), targets("a@x.com")));

        assertEquals(CampaignStatus.SENDING, e.current());
        assertEquals(0, data.recipientCount());
        assertEquals(CampaignStatus.SENDING, data.status(campaign.id()));
        assertTrue(data.statusHistory().isEmpty());
    }

    @Test
    void missingCampaignIsNotFound() {
        assertThrows(NotFoundException.class, () -> job.link(404L, targets("a@x.com")));
    }

    @Test
    void handleRunsTheEnvelopeTargets() throws Exception {
        Campaign campaign = data.campaign("Launch", CampaignStatus.PENDING);
        JobEnvelope envelope = JobEnvelope.linking(campaign.id(), List.of("a@x.com", "A@x.com"));

        job.handle(JobExecution.first(envelope));

        assertEquals(1, data.campaigns().countRecipients(null, campaign.id()));
        assertEquals(CampaignStatus.READY, data.status(campaign.id()));
    }

    private static List<RecipientTarget> targets(String... emails) {
        return Arrays.stream(emails).map(RecipientTarget::of).toList();
    }
}
