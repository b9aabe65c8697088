package com.comparo.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;

/**
 * One prior turn of a conversation, or one rendered prompt message.
 *
 * @param role who produced the turn
 * @param text the turn's text content
 */
public record ChatTurn(
    TurnRole role,
    String text
) implements Serializable {

    public static ChatTurn user(String text) {
        return new ChatTurn(TurnRole.USER, text);
    }

    public static ChatTurn assistant(String text) {
        return new ChatTurn(TurnRole.ASSISTANT, text);
    }

    public static ChatTurn system(String text) {
        return new ChatTurn(TurnRole.SYSTEM, text);
    }

    /** A turn is well-formed when both role and text are present. */
    @JsonIgnore
    public boolean isWellFormed() {
        return role != null && text != null;
    }
}
