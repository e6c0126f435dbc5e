package com.moddock.api.pat;

import com.moddock.api.config.MutableClock;
import com.moddock.api.config.TestClockConfiguration;
import com.moddock.api.error.InvalidInputException;
import com.moddock.api.error.NotFoundException;
import com.moddock.api.ids.Base62;
import com.moddock.api.ids.MalformedTokenException;
import com.moddock.core.domain.PersonalAccessToken;
import com.moddock.core.domain.User;
import com.moddock.core.repository.PersonalAccessTokenRepository;
import com.moddock.core.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for PatService against the test database.
 * Clock is driven by {@link MutableClock}; each test rolls back.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
@Transactional
class PatServiceTest {

    @Autowired
    private PatService patService;

    @Autowired
    private PersonalAccessTokenRepository patRepository;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private MutableClock clock;

    private User owner;
    private User other;

    @BeforeEach
    void setUp() {
        clock.set(TestClockConfiguration.START);
        owner = userRepository.saveAndFlush(
                User.create(5_000_001L, "ext-pat-owner", "owner", User.Role.DEVELOPER, clock.instant()));
        other = userRepository.saveAndFlush(
                User.create(5_000_002L, "ext-pat-other", "other", User.Role.DEVELOPER, clock.instant()));
    }

    @Test
    void create_expiresAfterTtlAndResolvesToOwner() {
        Instant issuedAt = clock.instant();

        PersonalAccessToken token = patService.create(owner.getId(), "read", 30);

        assertEquals(issuedAt.plus(Duration.ofDays(30)), token.getExpiresAt());
        assertEquals("read", token.getScope());
        assertEquals(owner.getId(), token.getUserId());

        Optional<User> resolved = patService.resolve(Base62.encode(token.getAccessToken()));
        assertTrue(resolved.isPresent());
        assertEquals(owner.getId(), resolved.get().getId());
    }

    @Test
    void create_secretAndIdEncodeToFixedLengths() {
        PersonalAccessToken token = patService.create(owner.getId(), "read", 1);

        assertEquals(11, Base62.encode(token.getAccessToken()).length());
        assertEquals(8, Base62.encode(token.getId()).length());
    }

    @Test
    void resolve_expiredTokenIsRejectedButStillListed() {
        PersonalAccessToken token = patService.create(owner.getId(), "read", 30);
        String secret = Base62.encode(token.getAccessToken());

        clock.advance(Duration.ofDays(31));

        assertTrue(patService.resolve(secret).isEmpty());
        List<PersonalAccessToken> listed = patService.list(owner.getId());
        assertEquals(1, listed.size());
        assertEquals(token.getId(), listed.get(0).getId());
    }

    @Test
    void resolve_unknownOrMalformedSecretYieldsNothing() {
        assertTrue(patService.resolve("zzzzzzzzzzz").isEmpty());
        assertTrue(patService.resolve("not a token!").isEmpty());
        assertTrue(patService.resolve("").isEmpty());
    }

    @Test
    void edit_recomputesExpiryFromNow() {
        PersonalAccessToken token = patService.create(owner.getId(), "read", 30);
        String secret = Base62.encode(token.getAccessToken());

        clock.advance(Duration.ofDays(31));
        PersonalAccessToken edited = patService.edit(owner.getId(), secret, null, 10L);

        assertEquals(clock.instant().plus(Duration.ofDays(10)), edited.getExpiresAt());
        assertEquals("read", edited.getScope());
        assertTrue(patService.resolve(secret).isPresent());
    }

    @Test
    void edit_replacesScopeOnly() {
        PersonalAccessToken token = patService.create(owner.getId(), "read", 30);
        Instant expiry = token.getExpiresAt();

        PersonalAccessToken edited = patService.edit(
                owner.getId(), Base62.encode(token.getAccessToken()), "read write", null);

        assertEquals("read write", edited.getScope());
        assertEquals(expiry, edited.getExpiresAt());
    }

    @Test
    void edit_foreignTokenLooksMissing() {
        PersonalAccessToken token = patService.create(owner.getId(), "read", 30);
        String secret = Base62.encode(token.getAccessToken());

        assertThrows(NotFoundException.class,
                () -> patService.edit(other.getId(), secret, "admin", null));
        assertEquals("read", patRepository.findById(token.getId()).orElseThrow().getScope());
    }

    @Test
    void edit_malformedSecretIsInvalidInput() {
        assertThrows(MalformedTokenException.class,
                () -> patService.edit(owner.getId(), "bad-token", "read", null));
    }

    @Test
    void revoke_deletesTokenForOwnerOnly() {
        PersonalAccessToken token = patService.create(owner.getId(), "read", 30);
        String secret = Base62.encode(token.getAccessToken());

        assertThrows(NotFoundException.class, () -> patService.revoke(other.getId(), secret));
        assertTrue(patRepository.existsById(token.getId()));

        patService.revoke(owner.getId(), secret);

        assertFalse(patRepository.existsById(token.getId()));
        assertTrue(patService.resolve(secret).isEmpty());
        assertTrue(patService.list(owner.getId()).isEmpty());
    }

    @Test
    void create_rejectsTtlOutsideBounds() {
        assertThrows(InvalidInputException.class, () -> patService.create(owner.getId(), "read", 0));
        assertThrows(InvalidInputException.class, () -> patService.create(owner.getId(), "read", -5));
        assertThrows(InvalidInputException.class,
                () -> patService.create(owner.getId(), "read", PatService.MAX_TTL_DAYS + 1));
        assertTrue(patService.list(owner.getId()).isEmpty());
    }

    @Test
    void list_onlyReturnsOwnTokens() {
        patService.create(owner.getId(), "read", 10);
        patService.create(owner.getId(), "write", 5);
        patService.create(other.getId(), "read", 10);

        List<PersonalAccessToken> tokens = patService.list(owner.getId());

        assertEquals(2, tokens.size());
        assertEquals("write", tokens.get(0).getScope());
        assertTrue(tokens.stream().allMatch(t -> t.isOwnedBy(owner.getId())));
    }
}
