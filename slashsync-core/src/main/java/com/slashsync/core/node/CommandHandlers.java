package com.slashsync.core.node;

import com.slashsync.core.dispatch.BoundArguments;
import com.slashsync.core.dispatch.CheckFailureException;
import com.slashsync.core.dispatch.ErrorSink;
import com.slashsync.core.dispatch.Interaction;
import com.slashsync.core.model.CommandValidation;
import com.slashsync.core.model.OptionChoice;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Callbacks attached to one invocable node: the handler, an optional
 * autocomplete handler, an optional error handler and a chain of checks.
 * <p>
 * Checks inherited from the owning unit run before the node's own checks. A
 * failing or throwing check aborts the invocation. Every failure goes to the
 * node's error handler when one is set, otherwise to the {@link ErrorSink};
 * nothing escapes {@link #invoke} or {@link #invokeAutocomplete}.
 */
@Slf4j
public final class CommandHandlers {

    @FunctionalInterface
    public interface Handler {
        void handle(Interaction interaction, BoundArguments args) throws Exception;
    }

    @FunctionalInterface
    public interface AutocompleteHandler {
        List<OptionChoice> complete(Interaction interaction, BoundArguments args) throws Exception;
    }

    @FunctionalInterface
    public interface ErrorHandler {
        void onError(Interaction interaction, Throwable error) throws Exception;
    }

    @FunctionalInterface
    public interface Check {
        boolean test(Interaction interaction) throws Exception;
    }

    private volatile Handler handler;
    private volatile AutocompleteHandler autocompleteHandler;
    private volatile ErrorHandler errorHandler;
    private final List<Check> checks = new CopyOnWriteArrayList<>();
    private final List<Check> inheritedChecks = new CopyOnWriteArrayList<>();

    CommandHandlers(Handler handler, AutocompleteHandler autocompleteHandler,
            ErrorHandler errorHandler, List<Check> checks) {
        this.handler = handler;
        this.autocompleteHandler = autocompleteHandler;
        this.errorHandler = errorHandler;
        if (checks != null) {
            this.checks.addAll(checks);
        }
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public Handler getHandler() {
        return handler;
    }

    public void setHandler(Handler handler) {
        this.handler = handler;
    }

    public AutocompleteHandler getAutocompleteHandler() {
        return autocompleteHandler;
    }

    public void setAutocompleteHandler(AutocompleteHandler autocompleteHandler) {
        this.autocompleteHandler = autocompleteHandler;
    }

    public ErrorHandler getErrorHandler() {
        return errorHandler;
    }

    public void setErrorHandler(ErrorHandler errorHandler) {
        this.errorHandler = errorHandler;
    }

    public void addCheck(Check check) {
        checks.add(check);
    }

    public List<Check> getChecks() {
        List<Check> all = new ArrayList<>(inheritedChecks);
        all.addAll(checks);
        return all;
    }

    /**
     * Replace the checks contributed by the owning unit.
     */
    public void setInheritedChecks(List<Check> unitChecks) {
        inheritedChecks.clear();
        if (unitChecks != null) {
            inheritedChecks.addAll(unitChecks);
        }
    }

    /**
     * Drop the handler and autocomplete handler, e.g. when the command was
     * removed from code but its remote entry is kept.
     */
    void clear() {
        handler = null;
        autocompleteHandler = null;
    }

    // =========================================================================
    // Invocation
    // =========================================================================

    InvocationResult invoke(CommandNode node, Interaction interaction, BoundArguments args, ErrorSink sink) {
        Handler current = handler;
        if (current == null) {
            log.warn("Command {} has no handler, ignoring interaction {}", node.getQualifiedName(),
                    interaction.getId());
            return InvocationResult.noHandler();
        }
        InvocationResult failed = runChecks(node, interaction, sink);
        if (failed != null)
            return failed;
        try {
            current.handle(interaction, args);
            return InvocationResult.completed(List.of());
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            routeError(node, interaction, e, sink);
            return new InvocationResult(InvocationResult.Status.HANDLER_FAILED, List.of(), e);
        }
    }

    InvocationResult invokeAutocomplete(CommandNode node, Interaction interaction, BoundArguments args,
            ErrorSink sink) {
        AutocompleteHandler current = autocompleteHandler;
        if (current == null) {
            log.warn("Autocomplete requested for {} (option {}) but no autocomplete handler is registered",
                    node.getQualifiedName(), args.getFocused());
            return InvocationResult.noHandler();
        }
        InvocationResult failed = runChecks(node, interaction, sink);
        if (failed != null)
            return failed;
        try {
            List<OptionChoice> choices = current.complete(interaction, args);
            if (choices == null) {
                choices = List.of();
            }
            if (choices.size() > CommandValidation.MAX_CHOICES) {
                log.debug("Autocomplete for {} returned {} choices, keeping the first {}",
                        node.getQualifiedName(), choices.size(), CommandValidation.MAX_CHOICES);
                choices = choices.subList(0, CommandValidation.MAX_CHOICES);
            }
            return InvocationResult.completed(choices);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            routeError(node, interaction, e, sink);
            return new InvocationResult(InvocationResult.Status.HANDLER_FAILED, List.of(), e);
        }
    }

    private InvocationResult runChecks(CommandNode node, Interaction interaction, ErrorSink sink) {
        List<Check> all = getChecks();
        for (int index = 0; index < all.size(); index++) {
            Throwable failure;
            try {
                if (all.get(index).test(interaction))
                    continue;
                failure = new CheckFailureException(node.getQualifiedName(), index);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                failure = e;
            }
            routeError(node, interaction, failure, sink);
            return new InvocationResult(InvocationResult.Status.CHECK_FAILED, List.of(), failure);
        }
        return null;
    }

    private void routeError(CommandNode node, Interaction interaction, Throwable error, ErrorSink sink) {
        ErrorHandler current = errorHandler;
        if (current == null) {
            sink.report(node, interaction, error);
            return;
        }
        try {
            current.onError(interaction, error);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable handlerError) {
            handlerError.addSuppressed(error);
            sink.report(node, interaction, handlerError);
        }
    }
}
