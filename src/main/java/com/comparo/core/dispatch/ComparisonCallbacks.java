package com.comparo.core.dispatch;

import com.comparo.core.aggregate.AggregatedResponse;
import com.comparo.core.aggregate.TargetEvent;
import com.comparo.core.model.ChatTurn;

import java.util.List;

/**
 * Caller hooks for one comparison. Methods may be called from several threads at once.
 */
public interface ComparisonCallbacks {

    ComparisonCallbacks NONE = new ComparisonCallbacks() {};

    /** Called after every applied event with the aggregate as of that event. */
    default void onDelta(AggregatedResponse.Snapshot snapshot, TargetEvent event) {}

    /** Called once when every target has finished. */
    default void onComplete(AggregatedResponse.Snapshot snapshot) {}

    /** Called with the final prompt messages rendered for a target, before modification. */
    default void onPromptRendered(String targetId, List<ChatTurn> rendered) {}
}
