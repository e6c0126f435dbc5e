package com.moddock.api.thread;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.moddock.api.ids.Base62;
import com.moddock.core.domain.ThreadMessage;

import java.time.Instant;
import java.util.List;

public record ThreadResponse(
        String id,
        String type,
        List<String> members,
        List<MessageResponse> messages
) {

    public static ThreadResponse from(ThreadService.ThreadView view) {
        return new ThreadResponse(
                Base62.encode(view.thread().getId()),
                view.thread().getType().name().toLowerCase(),
                view.thread().getMembers().stream().sorted().map(Base62::encode).toList(),
                view.messages().stream().map(MessageResponse::from).toList()
        );
    }

    public record MessageResponse(
            String id,
            @JsonProperty("author_id") String authorId,
            @JsonProperty("message_type") String messageType,
            String body,
            Instant created
    ) {

        static MessageResponse from(ThreadMessage message) {
            return new MessageResponse(
                    Base62.encode(message.getId()),
                    message.getAuthorId() == null ? null : Base62.encode(message.getAuthorId()),
                    message.getBody().type().name().toLowerCase(),
                    message.getBody().text(),
                    message.getCreated()
            );
        }
    }
}
