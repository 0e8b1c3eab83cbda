package com.sitecheck.data.entity;

import com.sitecheck.common.constants.QueueStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "audit_queue", indexes = {
    @Index(name = "idx_audit_queue_status", columnList = "status"),
    @Index(name = "idx_audit_queue_created_at", columnList = "created_at"),
    @Index(name = "idx_audit_queue_audit_id", columnList = "audit_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditQueueItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "audit_id", nullable = false)
    private UUID auditId;

    @Column(name = "status", nullable = false)
    @Builder.Default
    private QueueStatus status = QueueStatus.PENDING;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private Integer retryCount = 0;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    // token of the invocation holding the claim
    @Column(name = "locked_by", length = 64)
    private String lockedBy;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
