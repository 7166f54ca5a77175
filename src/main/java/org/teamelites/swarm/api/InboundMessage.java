package org.teamelites.swarm.api;

import java.time.Instant;
import java.util.Objects;

/**
 * A chat message delivered by a channel adapter.
 *
 * @param channel   channel identifier (e.g. {@code discord}).
 * @param chatId    platform chat/conversation id.
 * @param userId    platform user id.
 * @param text      message text, never null.
 * @param timestamp receive time.
 * @param userName  optional display name.
 * @param messageId optional platform message id.
 * @param threadId  optional thread id.
 */
public record InboundMessage(
        String channel,
        String chatId,
        String userId,
        String text,
        Instant timestamp,
        String userName,
        String messageId,
        String threadId) {

    public InboundMessage {
        Objects.requireNonNull(channel, "channel");
        if (text == null) {
            text = "";
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    /**
     * Creates a message without the optional fields.
     */
    public static InboundMessage of(String channel, String chatId, String userId, String text) {
        return new InboundMessage(channel, chatId, userId, text, Instant.now(), null, null, null);
    }
}
