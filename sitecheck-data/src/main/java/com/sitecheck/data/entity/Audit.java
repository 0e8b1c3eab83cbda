package com.sitecheck.data.entity;

import com.sitecheck.common.constants.AuditStatus;
import com.sitecheck.common.model.EmailMarker;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One purchased audit. Written by checkout (creation) and by the queue coordinator
 * (status, report, email marker); everything else is read-only here.
 */
@Entity
@Table(name = "audits")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Audit {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "customer_id", nullable = false)
    private Customer customer;

    @Column(name = "url", nullable = false)
    private String url;

    @Column(name = "status", nullable = false)
    @Builder.Default
    private AuditStatus status = AuditStatus.PENDING;

    @Column(name = "total_price_cents", nullable = false)
    @Builder.Default
    private Integer totalPriceCents = 0;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "formatted_report_html", columnDefinition = "TEXT")
    private String formattedReportHtml;

    @Column(name = "formatted_report_plaintext", columnDefinition = "TEXT")
    private String formattedReportPlaintext;

    /**
     * Raw value, see {@link EmailMarker} for the format.
     */
    @Column(name = "email_marker", length = 100)
    private String emailMarker;

    @Column(name = "error_log", columnDefinition = "TEXT")
    private String errorLog;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public EmailMarker getParsedEmailMarker() {
        return EmailMarker.parse(emailMarker);
    }

    public boolean hasReport() {
        return formattedReportHtml != null && !formattedReportHtml.isBlank();
    }
}
