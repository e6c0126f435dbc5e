package com.moddock.api.auth;

/**
 * Credentials presented with a request: the provider session cookie, a
 * personal access token, both or neither.
 */
public record Credentials(
        String sessionToken,
        String accessToken
) {

    private static final String BEARER = "Bearer";

    public static Credentials of(String sessionCookie, String authorizationHeader) {
        return new Credentials(blankToNull(sessionCookie), stripBearer(blankToNull(authorizationHeader)));
    }

    public boolean hasSession() {
        return sessionToken != null;
    }

    public boolean hasAccessToken() {
        return accessToken != null;
    }

    // Header arrives trimmed, so a bare "Bearer" means no token.
    private static String stripBearer(String header) {
        if (header == null || !header.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            return header;
        }
        if (header.length() == BEARER.length()) {
            return null;
        }
        if (Character.isWhitespace(header.charAt(BEARER.length()))) {
            return blankToNull(header.substring(BEARER.length()));
        }
        return header;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
