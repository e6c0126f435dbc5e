package com.moddock.api.ids;

import com.moddock.core.repository.DiscussionThreadRepository;
import com.moddock.core.repository.PersonalAccessTokenRepository;
import com.moddock.core.repository.ReportRepository;
import com.moddock.core.repository.ThreadMessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.util.EnumMap;
import java.util.Map;
import java.util.Random;
import java.util.function.LongPredicate;

/**
 * Generates random, non-sequential identifiers.
 *
 * Values are drawn uniformly from the kind's range and checked against the
 * store; a collision triggers a fresh draw. After {@value #MAX_ATTEMPTS}
 * collisions generation fails with {@link IdGenerationException}.
 *
 * Must run inside the caller's transaction so the existence check and the
 * subsequent insert see the same snapshot.
 */
@Service
public class IdGenerator {

    private static final Logger log = LoggerFactory.getLogger(IdGenerator.class);
    static final int MAX_ATTEMPTS = 20;

    private final Map<IdKind, LongPredicate> existenceChecks;
    private final Random random;

    @Autowired
    public IdGenerator(
            PersonalAccessTokenRepository patRepository,
            ReportRepository reportRepository,
            DiscussionThreadRepository threadRepository,
            ThreadMessageRepository messageRepository) {
        this(checks(patRepository, reportRepository, threadRepository, messageRepository), new SecureRandom());
    }

    IdGenerator(Map<IdKind, LongPredicate> existenceChecks, Random random) {
        for (IdKind kind : IdKind.values()) {
            if (!existenceChecks.containsKey(kind)) {
                throw new IllegalArgumentException("No existence check for " + kind);
            }
        }
        this.existenceChecks = new EnumMap<>(existenceChecks);
        this.random = random;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public long generate(IdKind kind) {
        LongPredicate exists = existenceChecks.get(kind);
        // Not atomic with the caller's insert: two transactions drawing the same id
        // leave the later one to fail on the primary key.
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            long candidate = draw(kind);
            if (!exists.test(candidate)) {
                return candidate;
            }
            log.warn("Generated {} id collided with an existing one (attempt {})", kind, attempt);
        }
        log.error("Exhausted {} attempts generating a {} id", MAX_ATTEMPTS, kind);
        throw new IdGenerationException(kind, MAX_ATTEMPTS);
    }

    private long draw(IdKind kind) {
        long span = kind.upperBound() - kind.lowerBound();
        long offset;
        synchronized (random) {
            offset = nextLong(span);
        }
        return kind.lowerBound() + offset;
    }

    // Uniform in [0, bound) without modulo bias.
    private long nextLong(long bound) {
        long bits;
        long value;
        do {
            bits = random.nextLong() >>> 1;
            value = bits % bound;
        } while (bits - value + (bound - 1) < 0);
        return value;
    }

    private static Map<IdKind, LongPredicate> checks(
            PersonalAccessTokenRepository patRepository,
            ReportRepository reportRepository,
            DiscussionThreadRepository threadRepository,
            ThreadMessageRepository messageRepository) {
        Map<IdKind, LongPredicate> checks = new EnumMap<>(IdKind.class);
        checks.put(IdKind.PAT, patRepository::existsById);
        checks.put(IdKind.PAT_TOKEN, patRepository::existsByAccessToken);
        checks.put(IdKind.REPORT, reportRepository::existsById);
        checks.put(IdKind.THREAD, threadRepository::existsById);
        checks.put(IdKind.THREAD_MESSAGE, messageRepository::existsById);
        return checks;
    }
}
