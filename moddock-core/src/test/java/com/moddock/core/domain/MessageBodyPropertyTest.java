package com.moddock.core.domain;

import com.moddock.core.domain.MessageBody.MessageType;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Property-based tests for thread message bodies.
 *
 * Text messages carry non-blank text; system events carry none.
 */
class MessageBodyPropertyTest {

    @Property(tries = 100)
    void textMessagesKeepTheirText(@ForAll @AlphaChars @StringLength(min = 1, max = 200) String text) {
        MessageBody body = MessageBody.text(text);

        assertThat(body.type()).isEqualTo(MessageType.TEXT);
        assertThat(body.text()).isEqualTo(text);
        assertThat(body.isSystemEvent()).isFalse();
    }

    @Property(tries = 50)
    void blankTextIsRejected(@ForAll @Whitespace @StringLength(max = 10) String blank) {
        assertThatThrownBy(() -> MessageBody.text(blank))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Example
    void systemEventsCarryNoText() {
        assertThat(MessageBody.closure().isSystemEvent()).isTrue();
        assertThat(MessageBody.closure().text()).isNull();
        assertThat(MessageBody.reopen().type()).isEqualTo(MessageType.THREAD_REOPEN);

        assertThatThrownBy(() -> new MessageBody(MessageType.THREAD_CLOSURE, "closing"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Example
    void oversizedTextIsRejected() {
        String oversized = "z".repeat(MessageBody.MAX_TEXT_LENGTH + 1);

        assertThatThrownBy(() -> MessageBody.text(oversized))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Example
    void messagesWithoutAuthorAreSystemMessages() {
        Instant now = Instant.parse("2026-03-01T12:00:00Z");

        ThreadMessage closure = ThreadMessage.post(1L, 2L, null, MessageBody.closure(), now);
        ThreadMessage text = ThreadMessage.post(3L, 2L, 5L, MessageBody.text("hello"), now);

        assertThat(closure.isSystemMessage()).isTrue();
        assertThat(closure.getBody()).isEqualTo(MessageBody.closure());
        assertThat(text.isSystemMessage()).isFalse();
        assertThat(text.getBody().text()).isEqualTo("hello");
    }
}
