package com.moddock.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * Message in a discussion thread. A null author marks a system message.
 */
@Entity
@Table(name = "thread_messages", indexes = {
    @Index(name = "idx_tm_thread", columnList = "thread_id, created")
})
public class ThreadMessage {

    @Id
    private Long id;

    @NotNull
    @Column(name = "thread_id", nullable = false, updatable = false)
    private Long threadId;

    @Column(name = "author_id", updatable = false)
    private Long authorId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "message_type", nullable = false, length = 20, updatable = false)
    private MessageBody.MessageType messageType;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String body;

    @NotNull
    @Column(nullable = false, updatable = false)
    private Instant created;

    protected ThreadMessage() {}

    public static ThreadMessage post(long id, long threadId, Long authorId, MessageBody body, Instant created) {
        if (body == null) {
            throw new IllegalArgumentException("Message body is required");
        }
        ThreadMessage message = new ThreadMessage();
        message.id = id;
        message.threadId = threadId;
        message.authorId = authorId;
        message.messageType = body.type();
        message.body = body.text();
        message.created = created;
        return message;
    }

    public MessageBody getBody() {
        return new MessageBody(messageType, body);
    }

    public boolean isSystemMessage() {
        return authorId == null;
    }

    // Getters
    public Long getId() { return id; }
    public Long getThreadId() { return threadId; }
    public Long getAuthorId() { return authorId; }
    public Instant getCreated() { return created; }
}
