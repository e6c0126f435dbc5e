package com.moddock.core.repository;

import com.moddock.core.domain.ThreadMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for thread messages.
 */
@Repository
public interface ThreadMessageRepository extends JpaRepository<ThreadMessage, Long> {

    List<ThreadMessage> findByThreadIdOrderByCreatedAscIdAsc(Long threadId);

    long countByThreadId(Long threadId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ThreadMessage m WHERE m.threadId = :threadId")
    int deleteAllByThreadId(@Param("threadId") Long threadId);
}
