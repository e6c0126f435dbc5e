package com.moddock.core.repository;

import com.moddock.core.domain.DiscussionThread;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DiscussionThreadRepository extends JpaRepository<DiscussionThread, Long> {
}
