package com.comparo.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A stored per-target prompt customization.
 *
 * @param customSystemMessage  system text to prepend or substitute; blank means no change
 * @param replaceSystemMessage true replaces existing system turns, false prepends to them
 * @param lastModified         when the modification was last saved
 */
public record PromptModification(
    String customSystemMessage,
    boolean replaceSystemMessage,
    Instant lastModified
) implements Serializable {

    public PromptModification withLastModified(Instant timestamp) {
        return new PromptModification(customSystemMessage, replaceSystemMessage, timestamp);
    }

    @JsonIgnore
    public boolean hasCustomMessage() {
        return customSystemMessage != null && !customSystemMessage.isBlank();
    }

    /**
     * Builds the modifier that applies this customization to rendered messages.
     * In replace mode every existing system turn is dropped; otherwise the custom text is
     * prepended to the first system turn, or inserted as a new leading system turn.
     */
    public PromptModifier toModifier() {
        if (!hasCustomMessage()) {
            return rendered -> rendered;
        }
        String custom = customSystemMessage;
        boolean replace = replaceSystemMessage;
        return rendered -> {
            List<ChatTurn> result = new ArrayList<>(rendered.size() + 1);
            if (replace) {
                result.add(ChatTurn.system(custom));
                for (ChatTurn turn : rendered) {
                    if (turn.role() != TurnRole.SYSTEM) {
                        result.add(turn);
                    }
                }
                return List.copyOf(result);
            }
            boolean merged = false;
            for (ChatTurn turn : rendered) {
                if (!merged && turn.role() == TurnRole.SYSTEM) {
                    result.add(ChatTurn.system(custom + "\n\n" + turn.text()));
                    merged = true;
                } else {
                    result.add(turn);
                }
            }
            if (!merged) {
                result.add(0, ChatTurn.system(custom));
            }
            return List.copyOf(result);
        };
    }
}
