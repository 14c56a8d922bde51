package org.changeflow.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.changeflow.models.enums.ChangeRequestStatus;
import org.changeflow.models.enums.DecisionStatus;
import org.changeflow.models.enums.ValidationState;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Getter
@Setter
@Entity
@Table(name = "change_request", schema = "curation")
public class ChangeRequest {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "change_request_id", nullable = false)
    private Long id;

    @Column(name = "change_request_uid", nullable = false, length = 40, unique = true)
    private String changeRequestUid;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @JoinColumn(name = "dataset_id", nullable = false)
    private Dataset dataset;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "requester_id", nullable = false)
    private ApplicationUser requester;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description", length = Integer.MAX_VALUE)
    private String description;

    @Enumerated(EnumType.STRING)
    @ColumnDefault("'PENDING'")
    @Column(name = "status", nullable = false, length = 20)
    private ChangeRequestStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "validation_state", length = 20)
    private ValidationState validationState;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "validation_report")
    private Map<String, Object> validationReport;

    @Column(name = "source_filename")
    private String sourceFilename;

    @Column(name = "source_bytes")
    private Long sourceBytes;

    @Column(name = "source_checksum", length = 64)
    private String sourceChecksum;

    @ColumnDefault("0")
    @Column(name = "staged_row_count", nullable = false)
    private Integer stagedRowCount;

    @Column(name = "staging_location", length = 200)
    private String stagingLocation;

    @OneToMany(mappedBy = "changeRequest", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    private List<ReviewerDecision> decisions = new ArrayList<>();

    @Column(name = "quorum_reached_at")
    private Instant quorumReachedAt;

    @ColumnDefault("0")
    @Column(name = "merge_attempts", nullable = false)
    private Integer mergeAttempts;

    @Column(name = "last_merge_error", length = Integer.MAX_VALUE)
    private String lastMergeError;

    @Column(name = "merged_at")
    private Instant mergedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @ColumnDefault("now()")
    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public boolean isPending() {
        return status == ChangeRequestStatus.PENDING;
    }

    public Optional<ReviewerDecision> decisionOf(String reviewerEmail) {
        return decisions.stream()
                .filter(d -> d.getReviewer().getEmail().equalsIgnoreCase(reviewerEmail))
                .findFirst();
    }

    public boolean isRequestedBy(String email) {
        return requester != null && requester.getEmail().equalsIgnoreCase(email);
    }

    /**
     * True once an approving reviewer other than the requester has acknowledged the validation warnings.
     */
    public boolean hasWarningsAcknowledged() {
        return decisions.stream().anyMatch(d -> d.getDecision() == DecisionStatus.APPROVED
                && Boolean.TRUE.equals(d.getWarningsAcknowledged())
                && !isRequestedBy(d.getReviewer().getEmail()));
    }
}
