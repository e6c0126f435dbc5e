package com.moddock.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * Moderation report filed by a user against a project, version or user.
 *
 * Lifecycle: created open, toggled between open and closed by moderators,
 * deleted by moderators. Every report is bound to one thread at creation;
 * the binding never changes.
 */
@Entity
@Table(name = "reports", indexes = {
    @Index(name = "idx_reports_reporter", columnList = "reporter"),
    @Index(name = "idx_reports_open", columnList = "closed, created"),
    @Index(name = "idx_reports_thread", columnList = "thread_id")
})
public class Report {

    public static final int MAX_BODY_LENGTH = 65536;

    @Id
    private Long id;

    @NotNull
    @Column(name = "report_type_id", nullable = false)
    private Integer reportTypeId;

    @Column(name = "project_id")
    private Long projectId;

    @Column(name = "version_id")
    private Long versionId;

    @Column(name = "user_id")
    private Long userId;

    @NotNull
    @Column(nullable = false, columnDefinition = "TEXT")
    private String body;

    @NotNull
    @Column(nullable = false)
    private Long reporter;

    @NotNull
    @Column(nullable = false, updatable = false)
    private Instant created;

    @Column(nullable = false)
    private boolean closed;

    @NotNull
    @Column(name = "thread_id", nullable = false, updatable = false)
    private Long threadId;

    protected Report() {}

    public static Report file(long id, int reportTypeId, ReportTarget target, String body,
                              long reporter, long threadId, Instant created) {
        if (target == null) {
            throw new IllegalArgumentException("Target is required");
        }
        if (body == null) {
            throw new IllegalArgumentException("Body is required");
        }
        if (created == null) {
            throw new IllegalArgumentException("Creation time is required");
        }
        Report report = new Report();
        report.id = id;
        report.reportTypeId = reportTypeId;
        report.body = body;
        report.reporter = reporter;
        report.threadId = threadId;
        report.created = created;
        report.closed = false;
        report.applyTarget(target);
        return report;
    }

    private void applyTarget(ReportTarget target) {
        this.projectId = null;
        this.versionId = null;
        this.userId = null;
        if (target instanceof ReportTarget.Project project) {
            this.projectId = project.id();
        } else if (target instanceof ReportTarget.Version version) {
            this.versionId = version.id();
        } else if (target instanceof ReportTarget.User user) {
            this.userId = user.id();
        }
    }

    public ReportTarget getTarget() {
        return ReportTarget.fromColumns(projectId, versionId, userId);
    }

    /**
     * True when this report targets the given user account.
     */
    public boolean targetsUser(long userId) {
        return this.userId != null && this.userId == userId;
    }

    public boolean isFiledBy(long userId) {
        return reporter == userId;
    }

    public void replaceBody(String body) {
        if (body == null) {
            throw new IllegalArgumentException("Body is required");
        }
        if (body.length() > MAX_BODY_LENGTH) {
            throw new IllegalArgumentException("Body exceeds " + MAX_BODY_LENGTH + " characters");
        }
        this.body = body;
    }

    public void close() {
        this.closed = true;
    }

    public void reopen() {
        this.closed = false;
    }

    // Getters
    public Long getId() { return id; }
    public Integer getReportTypeId() { return reportTypeId; }
    public String getBody() { return body; }
    public Long getReporter() { return reporter; }
    public Instant getCreated() { return created; }
    public boolean isClosed() { return closed; }
    public Long getThreadId() { return threadId; }
}
