package com.slashsync.core.registry;

import com.slashsync.core.model.CommandType;
import com.slashsync.core.model.CommandValidationException;
import com.slashsync.core.model.RemoteBinding;
import com.slashsync.core.model.Scope;
import com.slashsync.core.node.ApplicationCommand;
import com.slashsync.core.node.CommandHandlers;
import com.slashsync.core.node.CommandNode;
import com.slashsync.core.node.MessageCommand;
import com.slashsync.core.node.SlashCommand;
import com.slashsync.core.node.SubCommand;
import com.slashsync.core.node.SubCommandGroup;
import com.slashsync.core.node.UserCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class CommandRegistryTest {

    CommandRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new CommandRegistry();
    }

    private static RemoteBinding binding(long id) {
        return new RemoteBinding(id, 42, null, null, Instant.EPOCH, null);
    }

    // --- Registration ---

    @Test
    void registerIndexesByScopeTypeAndName() {
        SlashCommand ping = registry.register(SlashCommand.builder().name("ping").build());
        UserCommand info = registry.register(UserCommand.builder().name("ping").build());

        assertSame(ping, registry.get(Scope.GLOBAL, CommandType.CHAT_INPUT, "ping"));
        assertSame(info, registry.get(Scope.GLOBAL, CommandType.USER, "ping"));
        assertNull(registry.get(Scope.GLOBAL, CommandType.MESSAGE, "ping"));
        assertEquals(2, registry.commands(Scope.GLOBAL).size());
    }

    @Test
    void duplicateNameInSameScopeFails() {
        registry.register(SlashCommand.builder().name("ping").build());
        assertThrows(CommandValidationException.class,
                () -> registry.register(SlashCommand.builder().name("ping").build()));
    }

    @Test
    void guildCommandAppearsInEveryGuildScope() {
        SlashCommand local = registry.register(SlashCommand.builder().name("local").guildIds(List.of(1L, 2L)).build());

        assertSame(local, registry.get(Scope.guild(1), CommandType.CHAT_INPUT, "local"));
        assertSame(local, registry.get(Scope.guild(2), CommandType.CHAT_INPUT, "local"));
        assertTrue(registry.commands(Scope.GLOBAL).isEmpty());
        assertEquals(Set.of(Scope.guild(1), Scope.guild(2)), registry.guildScopes());
        assertEquals(List.of(local), registry.allCommands());
    }

    @Nested
    class SubCommands {

        private SubCommand sub(String name) {
            return SubCommand.builder().name(name).build();
        }

        @Test
        void createsBaseCommandAndGroupOnDemand() {
            registry.registerSubCommand("config", "set", sub("prefix"));
            registry.registerSubCommand("config", "set", sub("color"));
            registry.registerSubCommand("config", null, sub("show"));

            SlashCommand config = (SlashCommand) registry.get(Scope.GLOBAL, CommandType.CHAT_INPUT, "config");
            assertNotNull(config);
            CommandNode set = config.getChild("set");
            SubCommandGroup group = assertInstanceOf(SubCommandGroup.class, set);
            assertEquals(2, group.getSubCommands().size());
            assertInstanceOf(SubCommand.class, config.getChild("show"));
        }

        @Test
        void mismatchedGuildSetsFail() {
            registry.registerSubCommand("config", null, sub("show"), List.of(1L, 2L));
            assertThrows(CommandValidationException.class,
                    () -> registry.registerSubCommand("config", null, sub("hide"), List.of(1L)));
        }

        @Test
        void invocableCommandCannotGainSubCommands() {
            registry.register(SlashCommand.builder().name("ping").handler((i, args) -> {
            }).build());
            assertThrows(CommandValidationException.class,
                    () -> registry.registerSubCommand("ping", null, sub("more")));
        }

        @Test
        void subCommandCannotBeUsedAsGroup() {
            registry.registerSubCommand("config", null, sub("show"));
            assertThrows(CommandValidationException.class,
                    () -> registry.registerSubCommand("config", "show", sub("x")));
        }
    }

    // --- Binding and removal ---

    @Test
    void bindIndexesById() {
        SlashCommand ping = registry.register(SlashCommand.builder().name("ping").build());
        registry.bind(Scope.GLOBAL, ping, binding(10));
        assertSame(ping, registry.findById(10));

        registry.bind(Scope.GLOBAL, ping, binding(11));
        assertNull(registry.findById(10));
        assertSame(ping, registry.findById(11));
    }

    @Test
    void softRemoveDisablesButKeepsIdLookup() {
        SlashCommand ping = registry.register(SlashCommand.builder().name("ping").handler((i, args) -> {
        }).build());
        registry.bind(Scope.GLOBAL, ping, binding(10));

        registry.remove(ping, false);

        assertNull(registry.get(Scope.GLOBAL, CommandType.CHAT_INPUT, "ping"));
        assertSame(ping, registry.findById(10));
        assertTrue(ping.isDisabled());
        assertNull(ping.getHandlers().getHandler());
    }

    @Test
    void removeFromCacheForgetsId() {
        SlashCommand ping = registry.register(SlashCommand.builder().name("ping").build());
        registry.bind(Scope.GLOBAL, ping, binding(10));

        registry.remove(ping, true);

        assertNull(registry.findById(10));
        assertFalse(ping.isDisabled());
    }

    // --- Units ---

    @Nested
    class Units {

        private CommandUnit unit(String name, Supplier<List<ApplicationCommand>> commands,
                List<CommandHandlers.Check> checks) {
            return new CommandUnit() {
                @Override
                public String getName() {
                    return name;
                }

                @Override
                public List<ApplicationCommand> commands() {
                    return commands.get();
                }

                @Override
                public List<CommandHandlers.Check> checks() {
                    return checks;
                }
            };
        }

        @Test
        void loadAppliesUnitNameAndChecks() {
            CommandHandlers.Check unitCheck = i -> true;
            List<ApplicationCommand> loaded = registry.loadUnit(unit("admin",
                    () -> List.of(SlashCommand.builder().name("ban").build()), List.of(unitCheck)));

            assertEquals("admin", loaded.get(0).getUnitName());
            assertEquals(List.of(unitCheck), ((SlashCommand) loaded.get(0)).getHandlers().getChecks());
            assertEquals(Set.of("admin"), registry.loadedUnits());
        }

        @Test
        void failedLoadRegistersNothing() {
            registry.register(SlashCommand.builder().name("taken").build());
            CommandUnit broken = unit("broken", () -> List.of(
                    SlashCommand.builder().name("fresh").build(),
                    SlashCommand.builder().name("taken").build()), List.of());

            assertThrows(CommandValidationException.class, () -> registry.loadUnit(broken));
            assertNull(registry.get(Scope.GLOBAL, CommandType.CHAT_INPUT, "fresh"));
            assertTrue(registry.loadedUnits().isEmpty());
        }

        @Test
        void unloadRemovesEveryCommand() {
            registry.loadUnit(unit("fun", () -> List.of(SlashCommand.builder().name("joke").build(),
                    MessageCommand.builder().name("Laugh").build()), List.of()));

            assertEquals(2, registry.unloadUnit("fun", true).size());
            assertTrue(registry.commands(Scope.GLOBAL).isEmpty());
        }

        @Test
        void reloadRebindsKeptCommandsAndDisablesDroppedOnes() {
            boolean[] second = { false };
            CommandUnit unit = unit("fun", () -> second[0]
                    ? List.of(SlashCommand.builder().name("joke").build())
                    : List.of(SlashCommand.builder().name("joke").build(),
                            SlashCommand.builder().name("pun").handler((i, args) -> {
                            }).build()),
                    List.of());
            List<ApplicationCommand> first = registry.loadUnit(unit);
            registry.bind(Scope.GLOBAL, first.get(0), binding(1));
            registry.bind(Scope.GLOBAL, first.get(1), binding(2));

            second[0] = true;
            UnitReload reload = registry.reloadUnit(unit, false);

            ApplicationCommand joke = registry.get(Scope.GLOBAL, CommandType.CHAT_INPUT, "joke");
            assertNotSame(first.get(0), joke);
            assertEquals(Long.valueOf(1), joke.getId(Scope.GLOBAL));
            assertSame(joke, registry.findById(1));
            assertEquals(1, reload.rebound());

            assertEquals(List.of(first.get(1)), reload.removed());
            assertTrue(first.get(1).isDisabled());
            assertNull(registry.get(Scope.GLOBAL, CommandType.CHAT_INPUT, "pun"));
            assertSame(first.get(1), registry.findById(2));
        }

        @Test
        void failedReloadKeepsTheLoadedVersion() {
            boolean[] second = { false };
            CommandUnit unit = unit("fun", () -> second[0]
                    ? List.of(SlashCommand.builder().name("Joke").build())
                    : List.of(SlashCommand.builder().name("joke").build()), List.of());
            List<ApplicationCommand> first = registry.loadUnit(unit);
            registry.bind(Scope.GLOBAL, first.get(0), binding(7));

            second[0] = true;
            assertThrows(CommandValidationException.class, () -> registry.reloadUnit(unit, false));

            assertSame(first.get(0), registry.get(Scope.GLOBAL, CommandType.CHAT_INPUT, "joke"));
            assertSame(first.get(0), registry.findById(7));
            assertFalse(first.get(0).isDisabled());
            assertEquals(Set.of("fun"), registry.loadedUnits());
        }

        @Test
        void reloadClashingWithAnotherCommandKeepsTheLoadedVersion() {
            registry.register(SlashCommand.builder().name("taken").build());
            boolean[] second = { false };
            CommandUnit unit = unit("fun", () -> second[0]
                    ? List.of(SlashCommand.builder().name("joke").build(), SlashCommand.builder().name("taken").build())
                    : List.of(SlashCommand.builder().name("joke").build()), List.of());
            List<ApplicationCommand> first = registry.loadUnit(unit);
            registry.bind(Scope.GLOBAL, first.get(0), binding(7));

            second[0] = true;
            assertThrows(CommandValidationException.class, () -> registry.reloadUnit(unit, false));

            assertSame(first.get(0), registry.get(Scope.GLOBAL, CommandType.CHAT_INPUT, "joke"));
            assertSame(first.get(0), registry.findById(7));
            assertEquals(Set.of("fun"), registry.loadedUnits());
        }

        @Test
        void reloadWithDeletionForgetsDroppedCommands() {
            boolean[] second = { false };
            CommandUnit unit = unit("fun", () -> second[0]
                    ? List.of()
                    : List.of(SlashCommand.builder().name("pun").build()), List.of());
            List<ApplicationCommand> first = registry.loadUnit(unit);
            registry.bind(Scope.GLOBAL, first.get(0), binding(2));

            second[0] = true;
            UnitReload reload = registry.reloadUnit(unit, true);

            assertTrue(reload.hasRemovals());
            assertNull(registry.findById(2));
        }
    }
}
