package com.comparo.core.model;

/**
 * Speaker of a single chat turn.
 */
public enum TurnRole {
    USER,
    ASSISTANT,
    SYSTEM
}
