package com.moddock.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Discussion thread. Created empty; messages are stored separately in
 * {@link ThreadMessage} and are removed together with the thread.
 */
@Entity
@Table(name = "threads")
public class DiscussionThread {

    @Id
    private Long id;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "thread_type", nullable = false, length = 20)
    private ThreadType type;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "thread_members", joinColumns = @JoinColumn(name = "thread_id"))
    @Column(name = "user_id", nullable = false)
    private Set<Long> members = new LinkedHashSet<>();

    @NotNull
    @Column(nullable = false, updatable = false)
    private Instant created;

    protected DiscussionThread() {}

    public static DiscussionThread open(long id, ThreadType type, Collection<Long> members, Instant created) {
        if (type == null) {
            throw new IllegalArgumentException("Thread type is required");
        }
        DiscussionThread thread = new DiscussionThread();
        thread.id = id;
        thread.type = type;
        thread.created = created;
        if (members != null) {
            thread.members.addAll(members);
        }
        return thread;
    }

    public boolean hasMember(long userId) {
        return members.contains(userId);
    }

    // Getters
    public Long getId() { return id; }
    public ThreadType getType() { return type; }
    public Set<Long> getMembers() { return Set.copyOf(members); }
    public Instant getCreated() { return created; }

    public enum ThreadType {
        REPORT,
        PROJECT,
        DIRECT_MESSAGE
    }
}
