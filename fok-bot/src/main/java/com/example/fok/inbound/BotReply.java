package com.example.fok.inbound;

import java.util.List;

/**
 * Messages to send back to the user, with an optional keyboard attached to the last one.
 */
public record BotReply(List<String> messages, List<List<BotButton>> keyboard) {

    private static final BotReply EMPTY = new BotReply(List.of(), List.of());

    public BotReply {
        messages = messages == null ? List.of() : List.copyOf(messages);
        keyboard = keyboard == null ? List.of() : keyboard.stream().map(List::copyOf).toList();
    }

    public static BotReply empty() {
        return EMPTY;
    }

    public static BotReply of(String... messages) {
        return new BotReply(List.of(messages), List.of());
    }

    public BotReply withKeyboard(List<List<BotButton>> rows) {
        return new BotReply(messages, rows);
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }
}
