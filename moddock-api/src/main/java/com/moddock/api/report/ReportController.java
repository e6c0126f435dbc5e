package com.moddock.api.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.moddock.api.auth.AccessPolicy;
import com.moddock.api.auth.Authenticator;
import com.moddock.api.error.NotFoundException;
import com.moddock.api.ids.Base62;
import com.moddock.api.ids.MalformedTokenException;
import com.moddock.core.domain.Report;
import com.moddock.core.domain.User;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Moderation report endpoints.
 */
@RestController
@RequestMapping("/v2/report")
public class ReportController {

    private final ReportService reportService;
    private final Authenticator authenticator;
    private final AccessPolicy accessPolicy;

    public ReportController(ReportService reportService, Authenticator authenticator, AccessPolicy accessPolicy) {
        this.reportService = reportService;
        this.authenticator = authenticator;
        this.accessPolicy = accessPolicy;
    }

    @PostMapping
    public ResponseEntity<ReportView> create(HttpServletRequest request, @Valid @RequestBody CreateReportRequest body) {
        User user = authenticator.authenticate(request);
        return ResponseEntity.ok(reportService.create(
                user, body.reportType(), body.itemType(), body.itemId(), body.body()));
    }

    @GetMapping
    public ResponseEntity<List<ReportView>> list(
            HttpServletRequest request,
            @RequestParam(name = "count", defaultValue = "100") int count,
            @RequestParam(name = "all", defaultValue = "true") boolean all) {
        User user = authenticator.authenticate(request);
        return ResponseEntity.ok(reportService.list(user, count, all));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ReportView> get(HttpServletRequest request, @PathVariable("id") String id) {
        User user = authenticator.authenticate(request);
        return ResponseEntity.ok(reportService.get(user, parseId(id)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<Void> edit(
            HttpServletRequest request,
            @PathVariable("id") String id,
            @Valid @RequestBody EditReportRequest edit) {
        User user = authenticator.authenticate(request);
        reportService.edit(user, parseId(id), edit.body(), edit.closed());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(HttpServletRequest request, @PathVariable("id") String id) {
        User user = authenticator.authenticate(request);
        accessPolicy.requireModerator(user);
        reportService.delete(parseId(id));
        return ResponseEntity.noContent().build();
    }

    // An id that cannot be decoded cannot exist.
    private long parseId(String id) {
        try {
            return Base62.decode(id);
        } catch (MalformedTokenException e) {
            throw new NotFoundException("Report " + id + " not found");
        }
    }

    public record CreateReportRequest(
            @NotNull @JsonProperty("report_type") String reportType,
            @NotNull @JsonProperty("item_id") String itemId,
            @NotNull @JsonProperty("item_type") String itemType,
            @NotNull String body
    ) {}

    public record EditReportRequest(
            @Size(max = Report.MAX_BODY_LENGTH) String body,
            Boolean closed
    ) {}
}
