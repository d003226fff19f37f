package com.example.fok.inbound;

public record BotButton(String text, String callbackData, boolean requestContact) {

    public static BotButton callback(String text, String callbackData) {
        return new BotButton(text, callbackData, false);
    }

    public static BotButton contactRequest(String text) {
        return new BotButton(text, null, true);
    }
}
