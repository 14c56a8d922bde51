package org.changeflow.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;

@Getter
@Setter
@Entity
@Table(name = "dataset_version", schema = "curation")
public class DatasetVersion {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "dataset_version_id", nullable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @JoinColumn(name = "dataset_id", nullable = false)
    private Dataset dataset;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "change_request_id")
    private ChangeRequest changeRequest;

    @Column(name = "table_location", nullable = false, length = 200)
    private String tableLocation;

    @Column(name = "row_count", nullable = false)
    private Long rowCount;

    @Column(name = "rows_appended", nullable = false)
    private Long rowsAppended;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "approvers")
    private List<String> approvers;

    @Column(name = "applied_by", length = 120)
    private String appliedBy;

    @ColumnDefault("now()")
    @Column(name = "applied_at", nullable = false)
    private Instant appliedAt;
}
