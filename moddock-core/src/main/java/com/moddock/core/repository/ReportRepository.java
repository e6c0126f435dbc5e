package com.moddock.core.repository;

import com.moddock.core.domain.Report;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for moderation reports.
 */
@Repository
public interface ReportRepository extends JpaRepository<Report, Long> {

    /**
     * Open reports platform-wide, oldest first.
     */
    List<Report> findByClosedFalseOrderByCreatedAscIdAsc(Pageable pageable);

    /**
     * Open reports filed by one user, oldest first.
     */
    List<Report> findByClosedFalseAndReporterOrderByCreatedAscIdAsc(Long reporter, Pageable pageable);

    Optional<Report> findByThreadId(Long threadId);
}
