package com.moddock.api.thread;

import com.moddock.api.auth.AccessPolicy;
import com.moddock.api.error.InvalidInputException;
import com.moddock.api.error.NotFoundException;
import com.moddock.api.ids.Base62;
import com.moddock.api.ids.IdGenerator;
import com.moddock.api.ids.IdKind;
import com.moddock.core.domain.DiscussionThread;
import com.moddock.core.domain.DiscussionThread.ThreadType;
import com.moddock.core.domain.MessageBody;
import com.moddock.core.domain.Report;
import com.moddock.core.domain.ThreadMessage;
import com.moddock.core.domain.User;
import com.moddock.core.repository.DiscussionThreadRepository;
import com.moddock.core.repository.ReportRepository;
import com.moddock.core.repository.ThreadMessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Discussion threads and their messages.
 *
 * Threads start empty. System events (closure, reopen) are posted without an
 * author. Deleting a thread removes all of its messages.
 */
@Service
public class ThreadService {

    private static final Logger log = LoggerFactory.getLogger(ThreadService.class);

    private final DiscussionThreadRepository threadRepository;
    private final ThreadMessageRepository messageRepository;
    private final ReportRepository reportRepository;
    private final IdGenerator idGenerator;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    public ThreadService(
            DiscussionThreadRepository threadRepository,
            ThreadMessageRepository messageRepository,
            ReportRepository reportRepository,
            IdGenerator idGenerator,
            AccessPolicy accessPolicy,
            Clock clock) {
        this.threadRepository = threadRepository;
        this.messageRepository = messageRepository;
        this.reportRepository = reportRepository;
        this.idGenerator = idGenerator;
        this.accessPolicy = accessPolicy;
        this.clock = clock;
    }

    @Transactional
    public long createThread(ThreadType type, Collection<Long> members) {
        long id = idGenerator.generate(IdKind.THREAD);
        threadRepository.save(DiscussionThread.open(id, type, members, clock.instant()));
        log.debug("Created {} thread {}", type, Base62.encode(id));
        return id;
    }

    /**
     * Appends a message. A null author marks a system message.
     */
    @Transactional
    public ThreadMessage postMessage(long threadId, Long authorId, MessageBody body) {
        if (!threadRepository.existsById(threadId)) {
            throw new NotFoundException("Thread " + Base62.encode(threadId) + " not found");
        }
        long id = idGenerator.generate(IdKind.THREAD_MESSAGE);
        return messageRepository.save(ThreadMessage.post(id, threadId, authorId, body, clock.instant()));
    }

    /**
     * Deletes the thread with all its messages and members.
     *
     * @return false if there was no such thread
     */
    @Transactional
    public boolean deleteThread(long threadId) {
        if (!threadRepository.existsById(threadId)) {
            return false;
        }
        int removed = messageRepository.deleteAllByThreadId(threadId);
        threadRepository.deleteById(threadId);
        log.info("Deleted thread {} with {} messages", Base62.encode(threadId), removed);
        return true;
    }

    @Transactional(readOnly = true)
    public Optional<ThreadView> findThread(long threadId) {
        return threadRepository.findById(threadId)
                .map(thread -> new ThreadView(thread, messageRepository.findByThreadIdOrderByCreatedAscIdAsc(threadId)));
    }

    /**
     * Thread as seen by a user. Threads the user may not access are
     * reported as missing.
     */
    @Transactional(readOnly = true)
    public ThreadView getThreadFor(User user, long threadId) {
        DiscussionThread thread = accessibleThread(user, threadId);
        return new ThreadView(thread, messageRepository.findByThreadIdOrderByCreatedAscIdAsc(threadId));
    }

    @Transactional
    public ThreadMessage postUserMessage(User user, long threadId, String text) {
        accessibleThread(user, threadId);
        MessageBody body;
        try {
            body = MessageBody.text(text);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException(e.getMessage(), e);
        }
        return postMessage(threadId, user.getId(), body);
    }

    private DiscussionThread accessibleThread(User user, long threadId) {
        DiscussionThread thread = threadRepository.findById(threadId)
                .orElseThrow(() -> new NotFoundException("Thread " + Base62.encode(threadId) + " not found"));
        Optional<Report> report = thread.getType() == ThreadType.REPORT
                ? reportRepository.findByThreadId(threadId)
                : Optional.empty();
        if (!accessPolicy.canAccessThread(user, thread, report)) {
            log.debug("User {} denied access to thread {}", Base62.encode(user.getId()), Base62.encode(threadId));
            throw new NotFoundException("Thread " + Base62.encode(threadId) + " not found");
        }
        return thread;
    }

    public record ThreadView(
            DiscussionThread thread,
            List<ThreadMessage> messages
    ) {}
}
