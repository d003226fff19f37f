package com.example.fok.inbound;

public enum InboundEventType {
    TEXT,
    COMMAND,
    CONTACT,
    CALLBACK
}
