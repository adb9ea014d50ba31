package io.campaign.job;

import io.campaign.InvalidStateTransitionException;
import io.campaign.JobEnvelope;
import io.campaign.NotFoundException;
import io.campaign.dispatch.UnroutableJobException;
import io.campaign.model.Campaign;
import io.campaign.model.CampaignStatus;
import io.campaign.model.DeliveryFailure;
import io.campaign.model.DispatchReport;
import io.campaign.notify.DefaultNotifierRegistry;
import io.campaign.support.CountingMetrics;
import io.campaign.support.InMemoryCampaignData;
import io.campaign.support.RecordingNotifier;
import io.campaign.support.StubConnections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CampaignDispatchJobTest {

    private InMemoryCampaignData data;
    private RecordingNotifier notifier;

    @BeforeEach
    void setUp() {
        data = new InMemoryCampaignData();
        notifier = new RecordingNotifier();
    }

    @Test
    void sendsToEveryEligibleRecipientAndMarksSent() throws Exception {
        Campaign campaign = data.campaign("Launch", CampaignStatus.READY);
        data.link(campaign.id(), "a@x.com", "b@x.com", "c@x.com");

        DispatchReport report = newJob(10, Duration.ofSeconds(5)).dispatch(campaign.id());

        assertEquals(3, report.eligible());
        assertEquals(3, report.sent());
        assertTrue(report.allDelivered());
        assertEquals(CampaignStatus.SENT, report.status());
        assertEquals(CampaignStatus.SENT, data.status(campaign.id()));
        assertEquals(Set.of("a@x.com", "b@x.com", "c@x.com"), Set.copyOf(notifier.destinations));
        assertEquals(List.of(CampaignStatus.SENDING, CampaignStatus.SENT), data.statusHistory());
    }

    @Test
    void optedOutRecipientsAreNeverContacted() throws Exception {
        Campaign campaign = data.campaign("Launch", CampaignStatus.READY);
        data.link(campaign.id(), "a@x.com", "gone@x.com");
        data.recipients().setOptOut(null, "gone@x.com", true, "unsubscribed");

        DispatchReport report = newJob(10, Duration.ofSeconds(5)).dispatch(campaign.id());

        assertEquals(1, report.eligible());
        assertEquals(List.of("a@x.com"), notifier.destinations);
    }

    @Test
    void partialFailureMarksSendFailedWithFailureList() throws Exception {
        Campaign campaign = data.campaign("Launch", CampaignStatus.READY);
        data.link(campaign.id(), "r1@x.com", "r2@x.com", "r3@x.com", "r4@x.com", "r5@x.com");
        notifier.rejecting("r2@x.com").throwing("r4@x.com");

        DispatchReport report = newJob(10, Duration.ofSeconds(5)).dispatch(campaign.id());

        assertEquals(5, report.eligible());
        assertEquals(3, report.sent());
        assertEquals(CampaignStatus.SEND_FAILED, report.status());
        assertEquals(5, notifier.destinations.size());
        assertEquals(Set.of(new DeliveryFailure("r2@x.com", "mailbox unavailable"),
                        new DeliveryFailure("r4@x.com", "SMTP connection refused")),
                Set.copyOf(data.campaigns().listDeliveryFailures(null, campaign.id())));
        assertEquals(CampaignStatus.SEND_FAILED, data.status(campaign.id()));
    }

    @Test
    void noEligibleRecipientsMeansSent() throws Exception {
        Campaign campaign = data.campaign("Nobody", CampaignStatus.READY);
        data.link(campaign.id(), "gone@x.com");
        data.recipients().setOptOut(null, "gone@x.com", true, null);

        DispatchReport report = newJob(10, Duration.ofSeconds(5)).dispatch(campaign.id());

        assertEquals(0, report.eligible());
        assertEquals(CampaignStatus.SENT, report.status());
        assertTrue(notifier.destinations.isEmpty());
    }

    @Test
    void sendTimeoutCountsAsFailureForThatRecipientOnly() throws Exception {
        Campaign campaign = data.campaign("Slow", CampaignStatus.READY);
        data.link(campaign.id(), "fast@x.com", "stuck@x.com");
        notifier.hanging("stuck@x.com");

        DispatchReport report = newJob(10, Duration.ofMillis(200)).dispatch(campaign.id());

        assertEquals(1, report.sent());
        assertEquals(1, report.failures().size());
        assertEquals("stuck@x.com", report.failures().get(0).email());
        assertTrue(report.failures().get(0).reason().startsWith("Timed out"));
        assertEquals(CampaignStatus.SEND_FAILED, data.status(campaign.id()));
    }

    @Test
    void concurrentSendsAreBounded() throws Exception {
        Campaign campaign = data.campaign("Wide", CampaignStatus.READY);
        for (int i = 0; i < 12; i++) {
            String email = "r" + i + "@x.com";
            data.link(campaign.id(), email);
            notifier.delaying(email, 50);
        }

        DispatchReport report = newJob(3, Duration.ofSeconds(5)).dispatch(campaign.id());

        assertEquals(12, report.sent());
        assertTrue(notifier.maxInFlight.get() <= 3, "max in flight was " + notifier.maxInFlight.get());
    }

    @Test
    void sendFailedCampaignCanBeDispatchedAgain() throws Exception {
        Campaign campaign = data.campaign("Retry", CampaignStatus.SEND_FAILED);
        data.link(campaign.id(), "a@x.com");
        data.campaigns().replaceDeliveryFailures(null, campaign.id(), List.of(new DeliveryFailure("a@x.com", "old")));

        DispatchReport report = newJob(10, Duration.ofSeconds(5)).dispatch(campaign.id());

        assertEquals(CampaignStatus.SENT, report.status());
        assertTrue(data.campaigns().listDeliveryFailures(null, campaign.id()).isEmpty());
    }

    @Test
    void pendingCampaignIsRejectedWithoutSending() {
        Campaign campaign = data.campaign("Early", CampaignStatus.PENDING);
        data.link(campaign.id(), "a@x.com");

        assertThrows(InvalidStateTransitionException.class,
                () -> newJob(10, Duration.ofSeconds(5)).dispatch(campaign.id()));

        assertTrue(notifier.destinations.isEmpty());
        assertEquals(CampaignStatus.PENDING, data.status(campaign.id()));
    }

    @Test
    void sentCampaignIsRejected() {
        Campaign campaign = data.campaign("Done", CampaignStatus.SENT);

        assertThrows(InvalidStateTransitionException.class,
                () -> newJob(10, Duration.ofSeconds(5)).dispatch(campaign.id()));
        assertEquals(CampaignStatus.SENT, data.status(campaign.id()));
    }

    @Test
    void campaignBeingLinkedIsRejectedEvenOnRedelivery() {
        Campaign campaign = data.campaign("Linking", CampaignStatus.PROCESSING);
        data.link(campaign.id(), "a@x.com");
        CampaignDispatchJob job = newJob(10, Duration.ofSeconds(5));
        JobEnvelope envelope = JobEnvelope.dispatch(campaign.id());

        assertThrows(InvalidStateTransitionException.class, () -> job.handle(new JobExecution(envelope, 0, 1)));
        InvalidStateTransitionException e = assertThrows(InvalidStateTransitionException.class,
                () -> job.handle(new JobExecution(envelope, 1, 2)));

        assertEquals(CampaignStatus.PROCESSING, e.current());
        assertTrue(notifier.destinations.isEmpty());
        assertEquals(CampaignStatus.PROCESSING, data.status(campaign.id()));
    }

    @Test
    void sendingIsRejectedOnFirstDeliveryButResumedOnRedelivery() throws Exception {
        Campaign campaign = data.campaign("Crashed", CampaignStatus.SENDING);
        data.link(campaign.id(), "a@x.com");
        CampaignDispatchJob job = newJob(10, Duration.ofSeconds(5));
        JobEnvelope envelope = JobEnvelope.dispatch(campaign.id());

        assertThrows(InvalidStateTransitionException.class, () -> job.handle(new JobExecution(envelope, 0, 1)));
        assertTrue(notifier.destinations.isEmpty());

        job.handle(new JobExecution(envelope, 0, 2));
        assertEquals(CampaignStatus.SENT, data.status(campaign.id()));
        assertEquals(List.of("a@x.com"), notifier.destinations);
    }

    @Test
    void redeliveryOfAnAlreadySentCampaignIsANoOp() throws Exception {
        Campaign campaign = data.campaign("Done", CampaignStatus.SENT);
        data.link(campaign.id(), "a@x.com");

        newJob(10, Duration.ofSeconds(5)).handle(new JobExecution(JobEnvelope.dispatch(campaign.id()), 0, 2));

        assertTrue(notifier.destinations.isEmpty());
        assertEquals(CampaignStatus.SENT, data.status(campaign.id()));
        assertTrue(data.statusHistory().isEmpty());
    }

    @Test
    void missingCampaignIsNotFound() {
        assertThrows(NotFoundException.class, () -> newJob(10, Duration.ofSeconds(5)).dispatch(99L));
    }

    @Test
    void missingNotifierIsUnroutableAndLeavesStatusAlone() {
        Campaign campaign = data.campaign("Launch", CampaignStatus.READY);
        CampaignDispatchJob job = CampaignDispatchJob.builder()
                .connectionProvider(StubConnections.provider())
                .campaignStore(data.campaigns())
                .recipientStore(data.recipients())
                .notifierRegistry(new DefaultNotifierRegistry())
                .build();

        assertThrows(UnroutableJobException.class, () -> job.dispatch(campaign.id()));
        assertEquals(CampaignStatus.READY, data.status(campaign.id()));
    }

    @Test
    void exhaustedDispatchLeavesCampaignSendFailed() {
        Campaign campaign = data.campaign("Stuck", CampaignStatus.SENDING);

        newJob(10, Duration.ofSeconds(5)).onExhausted(JobEnvelope.dispatch(campaign.id()), new RuntimeException("db down"));

        assertEquals(CampaignStatus.SEND_FAILED, data.status(campaign.id()));
    }

    @Test
    void exhaustedDispatchDoesNotTouchACampaignBeingLinked() {
        Campaign campaign = data.campaign("Linking", CampaignStatus.PROCESSING);

        newJob(10, Duration.ofSeconds(5)).onExhausted(JobEnvelope.dispatch(campaign.id()), new RuntimeException("db down"));

        assertEquals(CampaignStatus.PROCESSING, data.status(campaign.id()));
    }

    @Test
    void sendCountersReachMetrics() throws Exception {
        Campaign campaign = data.campaign("Launch", CampaignStatus.READY);
        data.link(campaign.id(), "a@x.com", "b@x.com");
        notifier.rejecting("b@x.com");
        CountingMetrics metrics = new CountingMetrics();

        CampaignDispatchJob.builder()
                .connectionProvider(StubConnections.provider())
                .campaignStore(data.campaigns())
                .recipientStore(data.recipients())
                .notifierRegistry(new DefaultNotifierRegistry().register(notifier))
                .metrics(metrics)
                .build()
                .dispatch(campaign.id());

        assertEquals(1, metrics.sendSuccess.get());
        assertEquals(1, metrics.sendFailure.get());
    }

    @Test
    void builderValidatesSettings() {
        assertThrows(IllegalArgumentException.class, () -> builder().sendConcurrency(0).build());
        assertThrows(IllegalArgumentException.class, () -> builder().sendTimeout(Duration.ZERO).build());
        assertThrows(NullPointerException.class, () -> CampaignDispatchJob.builder().build());
    }

    private CampaignDispatchJob.Builder builder() {
        return CampaignDispatchJob.builder()
                .connectionProvider(StubConnections.provider())
                .campaignStore(data.campaigns())
                .recipientStore(data.recipients())
                .notifierRegistry(new DefaultNotifierRegistry().register(notifier));
    }

    private CampaignDispatchJob newJob(int concurrency, Duration sendTimeout) {
        return builder().sendConcurrency(concurrency).sendTimeout(sendTimeout).build();
    }
}
