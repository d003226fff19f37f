package com.example.fok.domain;

/**
 * Registration progress as stored on the user record.
 *
 * <p>{@code AWAITING_NAME} means the name prompt has been sent; the dialog cursor itself stays at
 * {@code STARTED} until a valid name arrives.
 */
public enum RegistrationState {
    STARTED,
    AWAITING_NAME,
    AWAITING_PHONE,
    COMPLETED
}
