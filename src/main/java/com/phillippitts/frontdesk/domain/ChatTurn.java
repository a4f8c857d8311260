package com.phillippitts.frontdesk.domain;

import java.util.Objects;

/**
 * One role-tagged conversation turn sent to the reply generator.
 */
public record ChatTurn(Role role, String text) {

    public enum Role { SYSTEM, USER, ASSISTANT }

    public ChatTurn {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    public static ChatTurn system(String text) {
        return new ChatTurn(Role.SYSTEM, text);
    }

    public static ChatTurn user(String text) {
        return new ChatTurn(Role.USER, text);
    }

    public static ChatTurn assistant(String text) {
        return new ChatTurn(Role.ASSISTANT, text);
    }
}
