package com.slashsync.core.dispatch;

import com.slashsync.core.model.OptionChoice;
import com.slashsync.core.node.InvocableCommand;
import com.slashsync.core.node.InvocationResult;

import java.util.List;

/**
 * Outcome of dispatching one interaction.
 *
 * @param target       the node the interaction was routed to, {@code null} on a
 *                     routing failure
 * @param arguments    bound arguments, {@code null} on a routing failure
 * @param invocation   result of the handler call, {@code null} on a routing failure
 * @param routingError why routing failed, {@code null} otherwise
 */
public record DispatchResult(InvocableCommand target, BoundArguments arguments, InvocationResult invocation,
        CommandRoutingException routingError) {

    static DispatchResult routed(InvocableCommand target, BoundArguments arguments, InvocationResult invocation) {
        return new DispatchResult(target, arguments, invocation, null);
    }

    static DispatchResult dropped(CommandRoutingException error) {
        return new DispatchResult(null, null, null, error);
    }

    public boolean isRouted() {
        return routingError == null;
    }

    /**
     * Autocomplete suggestions to send back; empty for full invocations.
     */
    public List<OptionChoice> choices() {
        return invocation == null ? List.of() : invocation.choices();
    }
}
