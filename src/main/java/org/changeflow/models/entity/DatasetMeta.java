package org.changeflow.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "dataset_meta", schema = "curation")
public class DatasetMeta {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "dataset_meta_id", nullable = false)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @JoinColumn(name = "dataset_id", nullable = false, unique = true)
    private Dataset dataset;

    @Column(name = "owner_name", length = 60)
    private String ownerName;

    @ColumnDefault("0")
    @Column(name = "row_count", nullable = false)
    private Long rowCount;

    @ColumnDefault("0")
    @Column(name = "column_count", nullable = false)
    private Integer columnCount;

    @ColumnDefault("0")
    @Column(name = "pending_approvals", nullable = false)
    private Integer pendingApprovals;

    @Column(name = "table_location", length = 200)
    private String tableLocation;

    @Column(name = "last_update_at")
    private Instant lastUpdateAt;
}
