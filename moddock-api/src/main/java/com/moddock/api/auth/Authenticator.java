package com.moddock.api.auth;

import com.moddock.api.error.UnauthorizedException;
import com.moddock.api.pat.PatService;
import com.moddock.core.domain.User;
import com.moddock.core.repository.UserRepository;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Resolves request credentials to a platform user.
 *
 * A valid provider session wins; otherwise the {@code Authorization} header
 * is treated as a personal access token.
 */
@Service
public class Authenticator {

    private static final Logger log = LoggerFactory.getLogger(Authenticator.class);

    private final SessionTokenVerifier sessionTokenVerifier;
    private final UserRepository userRepository;
    private final PatService patService;
    private final String sessionCookieName;

    public Authenticator(
            SessionTokenVerifier sessionTokenVerifier,
            UserRepository userRepository,
            PatService patService,
            @Value("${moddock.session.cookie-name:moddock_session}") String sessionCookieName) {
        this.sessionTokenVerifier = sessionTokenVerifier;
        this.userRepository = userRepository;
        this.patService = patService;
        this.sessionCookieName = sessionCookieName;
    }

    public User authenticate(HttpServletRequest request) {
        return authenticate(credentialsOf(request));
    }

    /**
     * Session cookie only; a personal access token is not accepted here.
     */
    public User authenticateSession(HttpServletRequest request) {
        return authenticateSession(credentialsOf(request));
    }

    public User authenticate(Credentials credentials) {
        Optional<User> sessionUser = fromSession(credentials);
        if (sessionUser.isPresent()) {
            return sessionUser.get();
        }
        if (credentials.hasAccessToken()) {
            return patService.resolve(credentials.accessToken())
                    .orElseThrow(() -> new UnauthorizedException("Invalid or expired access token"));
        }
        throw new UnauthorizedException("Authentication required");
    }

    public User authenticateSession(Credentials credentials) {
        return fromSession(credentials)
                .orElseThrow(() -> new UnauthorizedException("A valid session is required"));
    }

    private Optional<User> fromSession(Credentials credentials) {
        if (!credentials.hasSession()) {
            return Optional.empty();
        }
        Optional<User> user = sessionTokenVerifier.verify(credentials.sessionToken())
                .flatMap(userRepository::findByExternalId);
        if (user.isEmpty()) {
            log.debug("Session cookie did not resolve to a user");
        }
        return user;
    }

    private Credentials credentialsOf(HttpServletRequest request) {
        String session = null;
        Cookie[] cookies = request.getCookies();
        if (cookies != null) {
            for (Cookie cookie : cookies) {
                if (sessionCookieName.equals(cookie.getName())) {
                    session = cookie.getValue();
                    break;
                }
            }
        }
        return Credentials.of(session, request.getHeader(HttpHeaders.AUTHORIZATION));
    }
}
