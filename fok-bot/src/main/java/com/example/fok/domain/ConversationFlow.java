package com.example.fok.domain;

public enum ConversationFlow {
    NONE,
    REGISTRATION,
    SUBMIT_APPLICATION
}
