package com.moddock.api.auth;

import com.moddock.api.error.ForbiddenException;
import com.moddock.core.domain.DiscussionThread;
import com.moddock.core.domain.Report;
import com.moddock.core.domain.User;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Moderator, reporter and owner checks for reports and their threads.
 */
@Component
public class AccessPolicy {

    public void requireModerator(User user) {
        if (!user.isModerator()) {
            throw new ForbiddenException("Moderator role required");
        }
    }

    /**
     * Read access: moderators and the user who filed the report.
     */
    public boolean canView(User user, Report report) {
        return user.isModerator() || report.isFiledBy(user.getId());
    }

    /**
     * Edit access: moderators and the user the report is filed against.
     * The reporter is not included.
     */
    public boolean canEdit(User user, Report report) {
        return user.isModerator() || report.targetsUser(user.getId());
    }

    public boolean canChangeStatus(User user) {
        return user.isModerator();
    }

    /**
     * Thread access: moderators, members, and the reporter of the report the
     * thread belongs to.
     */
    public boolean canAccessThread(User user, DiscussionThread thread, Optional<Report> boundReport) {
        if (user.isModerator() || thread.hasMember(user.getId())) {
            return true;
        }
        return boundReport.map(report -> report.isFiledBy(user.getId())).orElse(false);
    }
}
