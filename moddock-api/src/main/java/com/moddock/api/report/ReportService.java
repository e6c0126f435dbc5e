package com.moddock.api.report;

import com.moddock.api.auth.AccessPolicy;
import com.moddock.api.error.InvalidInputException;
import com.moddock.api.error.NotFoundException;
import com.moddock.api.ids.Base62;
import com.moddock.api.ids.IdGenerator;
import com.moddock.api.ids.IdKind;
import com.moddock.api.ids.MalformedTokenException;
import com.moddock.api.thread.ThreadService;
import com.moddock.core.domain.DiscussionThread.ThreadType;
import com.moddock.core.domain.MessageBody;
import com.moddock.core.domain.Report;
import com.moddock.core.domain.ReportTarget;
import com.moddock.core.domain.ReportTarget.ItemType;
import com.moddock.core.domain.ReportType;
import com.moddock.core.domain.User;
import com.moddock.core.repository.ReportRepository;
import com.moddock.core.repository.ReportTypeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Report lifecycle: filing, listing, reading, editing, deleting.
 *
 * State machine: OPEN -close-> CLOSED -reopen-> OPEN, deletion from either
 * state. Each report owns one thread, created with the report; status flips
 * are recorded there as system messages.
 *
 * Reports a caller may not see are reported as missing rather than
 * forbidden.
 */
@Service
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    private final ReportRepository reportRepository;
    private final ReportTypeRepository reportTypeRepository;
    private final EntityExistenceOracle existenceOracle;
    private final ThreadService threadService;
    private final IdGenerator idGenerator;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    public ReportService(
            ReportRepository reportRepository,
            ReportTypeRepository reportTypeRepository,
            EntityExistenceOracle existenceOracle,
            ThreadService threadService,
            IdGenerator idGenerator,
            AccessPolicy accessPolicy,
            Clock clock) {
        this.reportRepository = reportRepository;
        this.reportTypeRepository = reportTypeRepository;
        this.existenceOracle = existenceOracle;
        this.threadService = threadService;
        this.idGenerator = idGenerator;
        this.accessPolicy = accessPolicy;
        this.clock = clock;
    }

    /**
     * Files a report. Type and target are validated before anything is
     * written; the report and its empty thread commit together.
     */
    @Transactional
    public ReportView create(User reporter, String reportTypeName, String itemType, String itemId, String body) {
        if (body == null) {
            throw new InvalidInputException("Report body is required");
        }
        ReportType reportType = reportTypeRepository.findByName(reportTypeName)
                .orElseThrow(() -> new InvalidInputException("Invalid report type: " + reportTypeName));

        ReportTarget target = resolveTarget(itemType, itemId);

        long id = idGenerator.generate(IdKind.REPORT);
        long threadId = threadService.createThread(ThreadType.REPORT, List.of());

        Report report = reportRepository.save(Report.file(
                id, reportType.getId(), target, body, reporter.getId(), threadId, clock.instant()));

        log.info("Created report {} against {} {}", Base62.encode(id), target.itemType().value(), itemId);
        return ReportView.of(report, reportType.getName());
    }

    /**
     * Open reports, oldest first. Moderators asking for everything see all
     * open reports; everyone else sees the ones they filed.
     */
    @Transactional(readOnly = true)
    public List<ReportView> list(User caller, int count, boolean includeAll) {
        if (count < 1) {
            throw new InvalidInputException("count must be at least 1");
        }
        PageRequest page = PageRequest.of(0, count);
        List<Report> reports = caller.isModerator() && includeAll
                ? reportRepository.findByClosedFalseOrderByCreatedAscIdAsc(page)
                : reportRepository.findByClosedFalseAndReporterOrderByCreatedAscIdAsc(caller.getId(), page);
        return toViews(reports);
    }

    @Transactional(readOnly = true)
    public ReportView get(User caller, long id) {
        Report report = reportRepository.findById(id)
                .filter(r -> accessPolicy.canView(caller, r))
                .orElseThrow(() -> notFound(id));
        return toViews(List.of(report)).get(0);
    }

    /**
     * Replaces the body and/or flips the closed flag. Only moderators may
     * change the flag; a flip posts a system message to the report thread in
     * the same transaction.
     */
    @Transactional
    public void edit(User caller, long id, String newBody, Boolean newClosed) {
        Report report = reportRepository.findById(id)
                .filter(r -> accessPolicy.canEdit(caller, r))
                .orElseThrow(() -> notFound(id));

        if (newClosed != null && !accessPolicy.canChangeStatus(caller)) {
            throw new InvalidInputException("You cannot reopen or close a report!");
        }
        if (newBody != null) {
            if (newBody.length() > Report.MAX_BODY_LENGTH) {
                throw new InvalidInputException("Report body exceeds " + Report.MAX_BODY_LENGTH + " characters");
            }
            report.replaceBody(newBody);
        }
        if (newClosed != null && newClosed != report.isClosed()) {
            if (newClosed) {
                threadService.postMessage(report.getThreadId(), null, MessageBody.closure());
                report.close();
            } else {
                threadService.postMessage(report.getThreadId(), null, MessageBody.reopen());
                report.reopen();
            }
            log.info("Report {} {} by {}", Base62.encode(id), newClosed ? "closed" : "reopened",
                    Base62.encode(caller.getId()));
        }
        reportRepository.save(report);
    }

    /**
     * Removes the report and its thread. Callers must have checked the
     * moderator role already.
     */
    @Transactional
    public void delete(long id) {
        Report report = reportRepository.findById(id).orElseThrow(() -> notFound(id));
        long threadId = report.getThreadId();

        threadService.deleteThread(threadId);
        reportRepository.deleteById(id);

        log.info("Deleted report {}", Base62.encode(id));
    }

    private ReportTarget resolveTarget(String itemTypeName, String itemId) {
        ItemType itemType = ItemType.fromValue(itemTypeName);
        if (itemType == ItemType.UNKNOWN) {
            throw new InvalidInputException("Invalid report item type: " + itemTypeName);
        }
        long targetId;
        try {
            targetId = Base62.decode(itemId);
        } catch (MalformedTokenException e) {
            throw new InvalidInputException("Invalid item id: " + itemId, e);
        }

        boolean exists;
        String label;
        switch (itemType) {
            case PROJECT:
                exists = existenceOracle.projectExists(targetId);
                label = "Project";
                break;
            case VERSION:
                exists = existenceOracle.versionExists(targetId);
                label = "Version";
                break;
            case USER:
                exists = existenceOracle.userExists(targetId);
                label = "User";
                break;
            default:
                throw new InvalidInputException("Invalid report item type: " + itemTypeName);
        }
        if (!exists) {
            throw new InvalidInputException(label + " could not be found: " + itemId);
        }
        return ReportTarget.of(itemType, targetId);
    }

    private List<ReportView> toViews(List<Report> reports) {
        Map<Integer, String> typeNames = reportTypeRepository.findAllById(
                        reports.stream().map(Report::getReportTypeId).distinct().toList())
                .stream()
                .collect(Collectors.toMap(ReportType::getId, ReportType::getName));
        return reports.stream()
                .map(report -> ReportView.of(report, typeNames.get(report.getReportTypeId())))
                .toList();
    }

    private NotFoundException notFound(long id) {
        return new NotFoundException("Report " + Base62.encode(id) + " not found");
    }
}
