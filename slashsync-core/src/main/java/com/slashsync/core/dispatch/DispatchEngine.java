package com.slashsync.core.dispatch;

import com.slashsync.core.model.CommandType;
import com.slashsync.core.model.OptionType;
import com.slashsync.core.model.Scope;
import com.slashsync.core.node.ApplicationCommand;
import com.slashsync.core.node.CommandNode;
import com.slashsync.core.node.ContextMenuCommand;
import com.slashsync.core.node.InvocableCommand;
import com.slashsync.core.node.InvocationResult;
import com.slashsync.core.node.SlashCommand;
import com.slashsync.core.node.SubCommand;
import com.slashsync.core.node.SubCommandGroup;
import com.slashsync.core.registry.CommandRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Routes an inbound interaction to the addressed node and invokes it with
 * resolved arguments.
 * <p>
 * The top-level command is looked up in the interaction's guild first, then
 * globally. Routing failures are reported to the {@link ErrorSink} once and
 * the interaction is dropped; handler failures are contained by the node.
 * Never throws for a well-formed interaction and never touches remote
 * bindings.
 */
@Slf4j
public class DispatchEngine {

    private final CommandRegistry registry;
    private final ErrorSink errorSink;
    private final ArgumentResolver resolver;

    public DispatchEngine(CommandRegistry registry) {
        this(registry, new LoggingErrorSink());
    }

    public DispatchEngine(CommandRegistry registry, ErrorSink errorSink) {
        this.registry = registry;
        this.errorSink = errorSink;
        this.resolver = new ArgumentResolver();
    }

    public ErrorSink getErrorSink() {
        return errorSink;
    }

    public DispatchResult dispatch(Interaction interaction) {
        ApplicationCommand command = lookup(interaction);
        if (command == null) {
            return drop(null, interaction, new CommandRoutingException(
                    "Received an interaction for unknown command " + describe(interaction),
                    interaction.getCommandName()));
        }
        if (command.isDisabled()) {
            return drop(command, interaction, new CommandRoutingException(
                    "Command " + command.getName() + " is no longer defined", command.getName()));
        }

        if (command instanceof ContextMenuCommand menu) {
            BoundArguments args = resolver.resolveTarget(menu.getType(), interaction.getTargetId(),
                    interaction.getResolved());
            return invoke(menu, interaction, args);
        }
        return routeSlash((SlashCommand) command, interaction);
    }

    private DispatchResult routeSlash(SlashCommand command, Interaction interaction) {
        List<InteractionOption> options = interaction.getOptions();
        if (!command.isContainer()) {
            if (!options.isEmpty() && options.get(0).isLayer()) {
                String path = command.getName() + " " + options.get(0).name();
                return drop(command, interaction, new CommandRoutingException(
                        "Unknown sub-command or group " + path, path));
            }
            return invoke(command, interaction, resolver.resolve(command, options, interaction.getResolved()));
        }

        InteractionOption first = options.isEmpty() ? null : options.get(0);
        if (first == null || !first.isLayer()) {
            return drop(command, interaction, new CommandRoutingException(
                    "Command " + command.getName() + " was invoked without a sub-command", command.getName()));
        }
        CommandNode child = command.getChild(first.name());
        String path = command.getName() + " " + first.name();
        if (child instanceof SubCommand sub && first.type() == OptionType.SUB_COMMAND) {
            log.debug("Routing {} to sub-command {}", interaction.getId(), sub.getQualifiedName());
            return invoke(sub, interaction, resolver.resolve(sub, first.options(), interaction.getResolved()));
        }
        if (!(child instanceof SubCommandGroup group) || first.type() != OptionType.SUB_COMMAND_GROUP) {
            return drop(command, interaction, new CommandRoutingException(
                    "Unknown sub-command or group " + path, path));
        }

        InteractionOption second = first.options().isEmpty() ? null : first.options().get(0);
        SubCommand sub = second == null ? null : group.getSubCommand(second.name());
        if (sub == null || second.type() != OptionType.SUB_COMMAND) {
            String fullPath = second == null ? path : path + " " + second.name();
            return drop(group, interaction, new CommandRoutingException(
                    "Unknown sub-command " + fullPath, fullPath));
        }
        log.debug("Routing {} to sub-command {}", interaction.getId(), sub.getQualifiedName());
        return invoke(sub, interaction, resolver.resolve(sub, second.options(), interaction.getResolved()));
    }

    private DispatchResult invoke(InvocableCommand target, Interaction interaction, BoundArguments args) {
        InvocationResult result = interaction.isAutocomplete()
                ? target.invokeAutocomplete(interaction, args, errorSink)
                : target.invoke(interaction, args, errorSink);
        return DispatchResult.routed(target, args, result);
    }

    private ApplicationCommand lookup(Interaction interaction) {
        CommandType type = interaction.getCommandType() == null ? CommandType.CHAT_INPUT : interaction.getCommandType();
        String name = interaction.getCommandName();
        if (name != null) {
            if (interaction.getGuildId() != null) {
                ApplicationCommand found = registry.get(Scope.guild(interaction.getGuildId()), type, name);
                if (found != null)
                    return found;
            }
            ApplicationCommand found = registry.get(Scope.GLOBAL, type, name);
            if (found != null)
                return found;
        }
        // disabled commands are only reachable by id
        return interaction.getCommandId() == null ? null : registry.findById(interaction.getCommandId());
    }

    private DispatchResult drop(CommandNode node, Interaction interaction, CommandRoutingException error) {
        log.debug("Dropping interaction {}: {}", interaction.getId(), error.getMessage());
        errorSink.report(node, interaction, error);
        return DispatchResult.dropped(error);
    }

    private static String describe(Interaction interaction) {
        return interaction.getCommandName() + " (id " + interaction.getCommandId() + ", "
                + interaction.scope() + ")";
    }
}
