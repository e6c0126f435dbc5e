package com.moddock.core.repository;

import com.moddock.core.domain.PersonalAccessToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for personal access tokens.
 */
@Repository
public interface PersonalAccessTokenRepository extends JpaRepository<PersonalAccessToken, Long> {

    Optional<PersonalAccessToken> findByAccessToken(Long accessToken);

    /**
     * Lookup by secret and owner; another user's token never matches.
     */
    Optional<PersonalAccessToken> findByAccessTokenAndUserId(Long accessToken, Long userId);

    List<PersonalAccessToken> findByUserIdOrderByExpiresAtAsc(Long userId);

    boolean existsByAccessToken(Long accessToken);
}
