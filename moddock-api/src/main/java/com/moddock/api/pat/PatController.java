package com.moddock.api.pat;

import com.moddock.api.auth.Authenticator;
import com.moddock.core.domain.User;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Personal access token endpoints. All of them require the identity
 * provider's session cookie.
 */
@RestController
@RequestMapping("/v2/pat")
public class PatController {

    private final PatService patService;
    private final Authenticator authenticator;

    public PatController(PatService patService, Authenticator authenticator) {
        this.patService = patService;
        this.authenticator = authenticator;
    }

    @GetMapping
    public ResponseEntity<List<PatResponse>> list(HttpServletRequest request) {
        User user = authenticator.authenticateSession(request);
        List<PatResponse> tokens = patService.list(user.getId()).stream()
                .map(PatResponse::from)
                .toList();
        return ResponseEntity.ok(tokens);
    }

    /**
     * Issues a token. The response is the only time the caller needs to
     * capture the secret.
     */
    @PostMapping
    public ResponseEntity<PatResponse> create(
            HttpServletRequest request,
            @RequestParam("scope") String scope,
            @RequestParam("expire_in_days") long expireInDays) {
        User user = authenticator.authenticateSession(request);
        return ResponseEntity.ok(PatResponse.from(patService.create(user.getId(), scope, expireInDays)));
    }

    @PatchMapping
    public ResponseEntity<PatResponse> edit(
            HttpServletRequest request,
            @RequestParam("access_token") String accessToken,
            @RequestParam(name = "scope", required = false) String scope,
            @RequestParam(name = "expire_in_days", required = false) Long expireInDays) {
        User user = authenticator.authenticateSession(request);
        return ResponseEntity.ok(PatResponse.from(patService.edit(user.getId(), accessToken, scope, expireInDays)));
    }

    @DeleteMapping
    public ResponseEntity<Void> revoke(
            HttpServletRequest request,
            @RequestParam("access_token") String accessToken) {
        User user = authenticator.authenticateSession(request);
        patService.revoke(user.getId(), accessToken);
        return ResponseEntity.noContent().build();
    }
}
