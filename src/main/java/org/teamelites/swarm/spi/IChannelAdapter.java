package org.teamelites.swarm.spi;

import java.nio.file.Path;

/**
 * Outbound side of a channel adapter (Discord, Slack, Telegram, ...). Protocol details live
 * outside the core.
 */
public interface IChannelAdapter {

    /**
     * @return channel identifier, matching {@code InboundMessage.channel()}.
     */
    String id();

    /**
     * Delivers text to a chat.
     *
     * @param chatId   target chat.
     * @param text     message text.
     * @param threadId optional thread, may be null.
     * @return platform message id.
     */
    String sendMessage(String chatId, String text, String threadId) throws Exception;

    /**
     * Delivers a file to a chat.
     *
     * @param chatId  target chat.
     * @param file    file to upload.
     * @param caption optional caption, may be null.
     */
    void sendFile(String chatId, Path file, String caption) throws Exception;
}
