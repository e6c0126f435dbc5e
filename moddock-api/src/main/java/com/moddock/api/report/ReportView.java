package com.moddock.api.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.moddock.api.ids.Base62;
import com.moddock.core.domain.Report;
import com.moddock.core.domain.ReportTarget;

import java.time.Instant;

/**
 * Denormalized report as returned to clients. The target is flattened to
 * one {@code (item_id, item_type)} pair; a report without a target shows as
 * {@code unknown} with an empty id.
 */
public record ReportView(
        String id,
        @JsonProperty("report_type") String reportType,
        @JsonProperty("item_id") String itemId,
        @JsonProperty("item_type") String itemType,
        String reporter,
        String body,
        Instant created,
        boolean closed,
        @JsonProperty("thread_id") String threadId
) {

    public static ReportView of(Report report, String reportTypeName) {
        ReportTarget target = report.getTarget();
        return new ReportView(
                Base62.encode(report.getId()),
                reportTypeName,
                itemIdOf(target),
                target.itemType().value(),
                Base62.encode(report.getReporter()),
                report.getBody(),
                report.getCreated(),
                report.isClosed(),
                Base62.encode(report.getThreadId())
        );
    }

    private static String itemIdOf(ReportTarget target) {
        if (target instanceof ReportTarget.Project project) {
            return Base62.encode(project.id());
        }
        if (target instanceof ReportTarget.Version version) {
            return Base62.encode(version.id());
        }
        if (target instanceof ReportTarget.User user) {
            return Base62.encode(user.id());
        }
        return "";
    }
}
