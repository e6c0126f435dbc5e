package com.moddock.api.pat;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.moddock.api.ids.Base62;
import com.moddock.core.domain.PersonalAccessToken;

import java.time.Instant;

/**
 * Wire form of a personal access token. Ids and secret are base62.
 */
public record PatResponse(
        String id,
        @JsonProperty("access_token") String accessToken,
        String scope,
        @JsonProperty("user_id") String userId,
        @JsonProperty("expires_at") Instant expiresAt
) {

    public static PatResponse from(PersonalAccessToken token) {
        return new PatResponse(
                Base62.encode(token.getId()),
                Base62.encode(token.getAccessToken()),
                token.getScope(),
                Base62.encode(token.getUserId()),
                token.getExpiresAt()
        );
    }
}
