package com.moddock.api.pat;

import com.moddock.api.error.InvalidInputException;
import com.moddock.api.error.NotFoundException;
import com.moddock.api.ids.Base62;
import com.moddock.api.ids.IdGenerator;
import com.moddock.api.ids.IdKind;
import com.moddock.api.ids.MalformedTokenException;
import com.moddock.core.domain.PersonalAccessToken;
import com.moddock.core.domain.User;
import com.moddock.core.repository.PersonalAccessTokenRepository;
import com.moddock.core.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Personal access token store: issue, list, edit, revoke, and the
 * validation lookup used on every PAT-authenticated request.
 *
 * Tokens are always addressed by (secret, owner), so an owner can only
 * reach their own tokens; a foreign token looks exactly like a missing one.
 */
@Service
public class PatService {

    private static final Logger log = LoggerFactory.getLogger(PatService.class);

    static final long MAX_TTL_DAYS = 36_500;

    private final PersonalAccessTokenRepository patRepository;
    private final UserRepository userRepository;
    private final IdGenerator idGenerator;
    private final Clock clock;

    public PatService(
            PersonalAccessTokenRepository patRepository,
            UserRepository userRepository,
            IdGenerator idGenerator,
            Clock clock) {
        this.patRepository = patRepository;
        this.userRepository = userRepository;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    /**
     * Issues a new token expiring {@code ttlDays} from now.
     */
    @Transactional
    public PersonalAccessToken create(long ownerId, String scope, long ttlDays) {
        if (scope == null) {
            throw new InvalidInputException("Scope is required");
        }
        Instant expiresAt = expiryFromNow(ttlDays);

        long id = idGenerator.generate(IdKind.PAT);
        long secret = idGenerator.generate(IdKind.PAT_TOKEN);

        PersonalAccessToken token = patRepository.save(
                PersonalAccessToken.issue(id, secret, ownerId, scope, expiresAt));

        log.info("Issued personal access token {} for user {}", Base62.encode(id), Base62.encode(ownerId));
        return token;
    }

    /**
     * Every token of the owner, expired ones included.
     */
    @Transactional(readOnly = true)
    public List<PersonalAccessToken> list(long ownerId) {
        return patRepository.findByUserIdOrderByExpiresAtAsc(ownerId);
    }

    /**
     * Replaces the scope and/or resets the expiry to {@code ttlDays} from now.
     * Absent arguments leave the stored value alone.
     */
    @Transactional
    public PersonalAccessToken edit(long ownerId, String accessToken, String scope, Long ttlDays) {
        PersonalAccessToken token = findOwned(ownerId, accessToken);

        if (scope != null) {
            token.changeScope(scope);
        }
        if (ttlDays != null) {
            token.changeExpiry(expiryFromNow(ttlDays));
        }

        PersonalAccessToken saved = patRepository.save(token);
        log.info("Updated personal access token {}", Base62.encode(saved.getId()));
        return saved;
    }

    @Transactional
    public void revoke(long ownerId, String accessToken) {
        PersonalAccessToken token = findOwned(ownerId, accessToken);
        patRepository.delete(token);
        log.info("Revoked personal access token {}", Base62.encode(token.getId()));
    }

    /**
     * Resolves a presented token to its owner. Fails closed: unknown,
     * undecodable and expired tokens all resolve to nothing.
     */
    public Optional<User> resolve(String accessToken) {
        long secret;
        try {
            secret = Base62.decode(accessToken);
        } catch (MalformedTokenException e) {
            log.debug("Undecodable access token presented");
            return Optional.empty();
        }

        Optional<PersonalAccessToken> token = patRepository.findByAccessToken(secret);
        if (token.isEmpty()) {
            return Optional.empty();
        }
        if (token.get().isExpired(clock.instant())) {
            log.debug("Expired personal access token {} presented", Base62.encode(token.get().getId()));
            return Optional.empty();
        }
        return userRepository.findById(token.get().getUserId());
    }

    private PersonalAccessToken findOwned(long ownerId, String accessToken) {
        if (accessToken == null || accessToken.isBlank()) {
            throw new InvalidInputException("access_token is required");
        }
        long secret = Base62.decode(accessToken);
        return patRepository.findByAccessTokenAndUserId(secret, ownerId)
                .orElseThrow(() -> new NotFoundException("Personal access token not found"));
    }

    private Instant expiryFromNow(long ttlDays) {
        if (ttlDays < 1 || ttlDays > MAX_TTL_DAYS) {
            throw new InvalidInputException("expire_in_days must be between 1 and " + MAX_TTL_DAYS);
        }
        return clock.instant().plus(Duration.ofDays(ttlDays));
    }
}
