package com.slashsync.core.node;

import com.slashsync.core.dispatch.BoundArguments;
import com.slashsync.core.dispatch.ErrorSink;
import com.slashsync.core.dispatch.Interaction;
import com.slashsync.core.model.CommandOption;

import java.util.List;
import java.util.Map;

/**
 * A node that can be the target of an invocation: a leaf slash command, a
 * sub-command, or a user/message command.
 */
public sealed interface InvocableCommand permits SlashCommand, SubCommand, ContextMenuCommand {

    CommandHandlers getHandlers();

    /**
     * Declared options, empty for context menu commands.
     */
    List<CommandOption> getOptions();

    /**
     * Handler parameter name to option name.
     */
    Map<String, String> getConnector();

    /**
     * The node itself; every invocable is a {@link CommandNode}.
     */
    default CommandNode asNode() {
        return (CommandNode) this;
    }

    default InvocationResult invoke(Interaction interaction, BoundArguments args, ErrorSink sink) {
        return getHandlers().invoke(asNode(), interaction, args, sink);
    }

    default InvocationResult invokeAutocomplete(Interaction interaction, BoundArguments args, ErrorSink sink) {
        return getHandlers().invokeAutocomplete(asNode(), interaction, args, sink);
    }

    default void setHandler(CommandHandlers.Handler handler) {
        getHandlers().setHandler(handler);
    }

    default void setErrorHandler(CommandHandlers.ErrorHandler errorHandler) {
        getHandlers().setErrorHandler(errorHandler);
    }

    default void setAutocompleteHandler(CommandHandlers.AutocompleteHandler autocompleteHandler) {
        getHandlers().setAutocompleteHandler(autocompleteHandler);
    }

    default void addCheck(CommandHandlers.Check check) {
        getHandlers().addCheck(check);
    }
}
