package com.moddock.api.thread;

import com.moddock.api.config.MutableClock;
import com.moddock.api.config.TestClockConfiguration;
import com.moddock.api.error.InvalidInputException;
import com.moddock.api.error.NotFoundException;
import com.moddock.api.ids.Base62;
import com.moddock.api.report.ReportService;
import com.moddock.api.report.ReportView;
import com.moddock.core.domain.DiscussionThread.ThreadType;
import com.moddock.core.domain.MessageBody;
import com.moddock.core.domain.MessageBody.MessageType;
import com.moddock.core.domain.ThreadMessage;
import com.moddock.core.domain.User;
import com.moddock.core.repository.ThreadMessageRepository;
import com.moddock.core.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for ThreadService.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
@Transactional
class ThreadServiceTest {

    @Autowired
    private ThreadService threadService;

    @Autowired
    private ReportService reportService;

    @Autowired
    private ThreadMessageRepository messageRepository;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private MutableClock clock;

    private User alice;
    private User bob;
    private User moderator;

    @BeforeEach
    void setUp() {
        clock.set(TestClockConfiguration.START);
        alice = saveUser(7_100_001L, "ext-alice", User.Role.DEVELOPER);
        bob = saveUser(7_100_002L, "ext-bob", User.Role.DEVELOPER);
        moderator = saveUser(7_100_003L, "ext-thread-mod", User.Role.ADMIN);
    }

    @Test
    void createThread_startsEmpty() {
        long id = threadService.createThread(ThreadType.DIRECT_MESSAGE, List.of(alice.getId(), bob.getId()));

        ThreadService.ThreadView view = threadService.findThread(id).orElseThrow();
        assertEquals(ThreadType.DIRECT_MESSAGE, view.thread().getType());
        assertTrue(view.thread().hasMember(alice.getId()));
        assertTrue(view.thread().hasMember(bob.getId()));
        assertTrue(view.messages().isEmpty());
    }

    @Test
    void postMessage_appendsInOrder() {
        long id = threadService.createThread(ThreadType.DIRECT_MESSAGE, List.of(alice.getId(), bob.getId()));

        threadService.postMessage(id, alice.getId(), MessageBody.text("first"));
        clock.advance(Duration.ofSeconds(30));
        threadService.postMessage(id, bob.getId(), MessageBody.text("second"));
        clock.advance(Duration.ofSeconds(30));
        threadService.postMessage(id, null, MessageBody.closure());

        List<ThreadMessage> messages = threadService.findThread(id).orElseThrow().messages();
        assertEquals(3, messages.size());
        assertEquals("first", messages.get(0).getBody().text());
        assertEquals(bob.getId(), messages.get(1).getAuthorId());
        assertEquals(MessageType.THREAD_CLOSURE, messages.get(2).getBody().type());
        assertNull(messages.get(2).getAuthorId());
    }

    @Test
    void postMessage_missingThreadIsNotFound() {
        assertThrows(NotFoundException.class,
                () -> threadService.postMessage(42L, alice.getId(), MessageBody.text("hello")));
    }

    @Test
    void deleteThread_removesMessages() {
        long id = threadService.createThread(ThreadType.DIRECT_MESSAGE, List.of(alice.getId()));
        threadService.postMessage(id, alice.getId(), MessageBody.text("one"));
        threadService.postMessage(id, alice.getId(), MessageBody.text("two"));

        assertTrue(threadService.deleteThread(id));

        assertTrue(threadService.findThread(id).isEmpty());
        assertEquals(0, messageRepository.countByThreadId(id));
        assertFalse(threadService.deleteThread(id));
    }

    @Test
    void getThreadFor_membersAndModeratorsOnly() {
        long id = threadService.createThread(ThreadType.DIRECT_MESSAGE, List.of(alice.getId()));

        assertEquals(id, threadService.getThreadFor(alice, id).thread().getId());
        assertEquals(id, threadService.getThreadFor(moderator, id).thread().getId());
        assertThrows(NotFoundException.class, () -> threadService.getThreadFor(bob, id));
    }

    @Test
    void reportThread_openToReporter() {
        jdbcTemplate.update("INSERT INTO projects (id) VALUES (?)", 7_100_100L);
        ReportView report = reportService.create(alice, "spam", "project", Base62.encode(7_100_100L), "body");
        long threadId = Base62.decode(report.threadId());

        threadService.postUserMessage(alice, threadId, "More context");

        ThreadService.ThreadView view = threadService.getThreadFor(alice, threadId);
        assertEquals(1, view.messages().size());
        assertEquals(alice.getId(), view.messages().get(0).getAuthorId());
        assertThrows(NotFoundException.class, () -> threadService.postUserMessage(bob, threadId, "hi"));
    }

    @Test
    void postUserMessage_rejectsBlankText() {
        long id = threadService.createThread(ThreadType.DIRECT_MESSAGE, List.of(alice.getId()));

        assertThrows(InvalidInputException.class, () -> threadService.postUserMessage(alice, id, "   "));
    }

    private User saveUser(long id, String externalId, User.Role role) {
        return userRepository.saveAndFlush(User.create(id, externalId, externalId, role, clock.instant()));
    }
}
