package com.slashsync.core.node;

import com.slashsync.core.model.OptionChoice;

import java.util.List;

/**
 * Outcome of invoking a node's handler or autocomplete handler.
 *
 * @param status  what happened
 * @param choices autocomplete suggestions, empty for full invocations
 * @param error   the failure that was routed to an error handler or sink
 */
public record InvocationResult(Status status, List<OptionChoice> choices, Throwable error) {

    public enum Status {
        COMPLETED,
        CHECK_FAILED,
        HANDLER_FAILED,
        NO_HANDLER
    }

    public InvocationResult {
        choices = choices == null ? List.of() : List.copyOf(choices);
    }

    public static InvocationResult completed(List<OptionChoice> choices) {
        return new InvocationResult(Status.COMPLETED, choices, null);
    }

    public static InvocationResult noHandler() {
        return new InvocationResult(Status.NO_HANDLER, List.of(), null);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
