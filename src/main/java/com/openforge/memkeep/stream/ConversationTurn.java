package com.openforge.memkeep.stream;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * One entry of the Stream.  Order within the Stream is the dialogue history.
 *
 * @param role speaker of this turn
 * @param text turn content; never null
 */
public record ConversationTurn(Role role, String text) {

    public ConversationTurn {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        text = text == null ? "" : text;
    }

    public static ConversationTurn user(String text) {
        return new ConversationTurn(Role.USER, text);
    }

    public static ConversationTurn assistant(String text) {
        return new ConversationTurn(Role.ASSISTANT, text);
    }

    public static ConversationTurn system(String text) {
        return new ConversationTurn(Role.SYSTEM, text);
    }

    /** "role: text", the line format used by consolidation snapshots. */
    public String render() {
        return role.wireName() + ": " + text;
    }

    public enum Role {
        USER,
        ASSISTANT,
        SYSTEM;

        /** Lower-case name used both in the snapshot file and on the LLM wire. */
        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Role fromWire(String value) {
            return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
