package io.campaign;

import com.github.f4b6a3.ulid.UlidCreator;
import io.campaign.model.JobKind;
import io.campaign.model.RecipientTarget;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable job request carried through the queue: a kind, the id of the campaign or group
 * it targets and, for ingestion kinds, the raw address list.
 *
 * <p>Each envelope is assigned a ULID-based {@code jobId} by default. The address list is
 * limited to {@value #MAX_TARGETS} entries. Use the {@linkplain Builder builder} or the
 * {@code linking}, {@code dispatch} and {@code groupAssignment} factories.
 *
 * @see JobSubmitter
 * @see JobKind
 */
public final class JobEnvelope {
    public static final int MAX_TARGETS = 100_000;

    private final String jobId;
    private final JobKind kind;
    private final long targetId;
    private final List<RecipientTarget> targets;
    private final Instant occurredAt;

    private JobEnvelope(Builder builder) {
        this.jobId = builder.jobId == null ? newJobId() : builder.jobId;
        if (this.jobId.isEmpty()) {
            throw new IllegalArgumentException("jobId cannot be empty");
        }
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        if (builder.targetId <= 0) {
            throw new IllegalArgumentException("targetId must be > 0, got: " + builder.targetId);
        }
        this.targetId = builder.targetId;
        this.occurredAt = builder.occurredAt == null ? Instant.now() : builder.occurredAt;

        List<RecipientTarget> copy = new ArrayList<>(builder.targets.size());
        for (RecipientTarget target : builder.targets) {
            copy.add(Objects.requireNonNull(target, "targets cannot contain null entries"));
        }
        if (copy.size() > MAX_TARGETS) {
            throw new IllegalArgumentException("Address list exceeds maximum size of " + MAX_TARGETS);
        }
        if (kind == JobKind.DISPATCH_CAMPAIGN && !copy.isEmpty()) {
            throw new IllegalArgumentException("Dispatch jobs do not carry addresses");
        }
        this.targets = Collections.unmodifiableList(copy);
    }

    public static Builder builder(JobKind kind) {
        Objects.requireNonNull(kind, "kind");
        return new Builder(kind);
    }

    /**
     * Creates a linking job for raw email strings without display names.
     */
    public static JobEnvelope linking(long campaignId, List<String> rawEmails) {
        return builder(JobKind.LINK_RECIPIENTS).targetId(campaignId).emails(rawEmails).build();
    }

    public static JobEnvelope dispatch(long campaignId) {
        return builder(JobKind.DISPATCH_CAMPAIGN).targetId(campaignId).build();
    }

    public static JobEnvelope groupAssignment(long groupId, List<String> rawEmails) {
        return builder(JobKind.ASSIGN_GROUP).targetId(groupId).emails(rawEmails).build();
    }

    public String jobId() {
        return jobId;
    }

    public JobKind kind() {
        return kind;
    }

    public long targetId() {
        return targetId;
    }

    public List<RecipientTarget> targets() {
        return targets;
    }

    public Instant occurredAt() {
        return occurredAt;
    }

    /**
     * Key shared by all jobs touching the same campaign or group, e.g. {@code campaign:42}.
     */
    public String targetKey() {
        return kind.scope() + ":" + targetId;
    }

    @Override
    public String toString() {
        return "JobEnvelope{jobId=" + jobId
                + ", kind=" + kind
                + ", targetId=" + targetId
                + ", targets=" + targets.size() + '}';
    }

    /**
     * Builder for {@link JobEnvelope}.
     */
    public static final class Builder {
        private final JobKind kind;
        private String jobId;
        private long targetId;
        private Instant occurredAt;
        private final List<RecipientTarget> targets = new ArrayList<>();

        private Builder(JobKind kind) {
            this.kind = kind;
        }

        /**
         * Sets a custom job identifier.
         *
         * <p>Optional. Defaults to a monotonic ULID.
         *
         * @param jobId the job identifier
         * @return this builder
         */
        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        /**
         * Sets the id of the campaign or group this job acts on.
         *
         * <p><b>Required.</b> Must be &gt; 0.
         *
         * @param targetId campaign id or group id, depending on the kind
         * @return this builder
         */
        public Builder targetId(long targetId) {
            this.targetId = targetId;
            return this;
        }

        /**
         * Sets the submission timestamp.
         *
         * <p>Optional. Defaults to {@link Instant#now()}.
         *
         * @param occurredAt the submission timestamp
         * @return this builder
         */
        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        /**
         * Appends raw email strings, in order, without display names.
         *
         * @param rawEmails email strings as submitted; not yet normalized
         * @return this builder
         */
        public Builder emails(List<String> rawEmails) {
            Objects.requireNonNull(rawEmails, "rawEmails");
            for (String email : rawEmails) {
                targets.add(RecipientTarget.of(Objects.requireNonNull(email, "rawEmails cannot contain null entries")));
            }
            return this;
        }

        /**
         * Appends address entries, in order.
         *
         * @param targets raw entries with optional display names
         * @return this builder
         */
        public Builder targets(List<RecipientTarget> targets) {
            this.targets.addAll(Objects.requireNonNull(targets, "targets"));
            return this;
        }

        /**
         * Builds an immutable {@link JobEnvelope}.
         *
         * @return a new job envelope
         * @throws IllegalArgumentException if {@code targetId <= 0}, the address list is too
         *                                  large, or a dispatch job is given addresses
         */
        public JobEnvelope build() {
            return new JobEnvelope(this);
        }
    }

    private static String newJobId() {
        return UlidCreator.getMonotonicUlid().toString();
    }
}
