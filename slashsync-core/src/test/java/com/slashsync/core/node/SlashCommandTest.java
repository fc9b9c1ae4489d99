package com.slashsync.core.node;

import com.slashsync.core.model.CommandOption;
import com.slashsync.core.model.CommandValidationException;
import com.slashsync.core.model.OptionType;
import com.slashsync.core.model.Scope;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SlashCommandTest {

    private static CommandOption option(String name, boolean required) {
        return CommandOption.builder().type(OptionType.STRING).name(name).description("Option " + name)
                .required(required).build();
    }

    private static SubCommand sub(String name) {
        return SubCommand.builder().name(name).description("Sub " + name)
                .options(List.of(option("value", true))).build();
    }

    @Nested
    class Construction {

        @Test
        void leafWithOptions() {
            SlashCommand command = SlashCommand.builder().name("echo").description("Echo text")
                    .options(List.of(option("text", true), option("times", false))).build();
            assertFalse(command.isContainer());
            assertEquals(NodeKind.SLASH_COMMAND, command.getNodeKind());
            assertEquals(2, command.getOptions().size());
        }

        @Test
        void descriptionDefaultsWhenMissing() {
            assertEquals(SlashCommand.DEFAULT_DESCRIPTION, SlashCommand.builder().name("ping").build().getDescription());
        }

        @Test
        void invalidNamesFail() {
            assertThrows(CommandValidationException.class, () -> SlashCommand.builder().name("Ping").build());
            assertThrows(CommandValidationException.class,
                    () -> SlashCommand.builder().name("x".repeat(33)).build());
            assertThrows(CommandValidationException.class,
                    () -> SlashCommand.builder().name("ping").description("d".repeat(101)).build());
        }

        @Test
        void requiredOptionsComeFirst() {
            assertThrows(CommandValidationException.class, () -> SlashCommand.builder().name("echo")
                    .options(List.of(option("later", false), option("text", true))).build());
        }

        @Test
        void atMostTwentyFiveOptions() {
            List<CommandOption> options = new ArrayList<>();
            for (int i = 0; i < 26; i++) {
                options.add(option("o" + i, false));
            }
            assertThrows(CommandValidationException.class,
                    () -> SlashCommand.builder().name("many").options(options).build());
        }

        @Test
        void duplicateOptionNamesFail() {
            assertThrows(CommandValidationException.class, () -> SlashCommand.builder().name("dup")
                    .options(List.of(option("a", false), option("a", false))).build());
        }

        @Test
        void connectorMustPointAtDeclaredOptions() {
            assertThrows(CommandValidationException.class, () -> SlashCommand.builder().name("echo")
                    .options(List.of(option("text", true))).connector(Map.of("message", "missing")).build());
        }
    }

    @Nested
    class Children {

        @Test
        void containerCollectsSubCommandsAndGroups() {
            SlashCommand command = SlashCommand.builder().name("config").description("Configure").build();
            command.addSubCommand(sub("show"));
            SubCommandGroup group = command.addGroup(SubCommandGroup.builder().name("set").description("Set")
                    .subCommands(List.of(sub("prefix"))).build());

            assertTrue(command.isContainer());
            assertEquals("config set", group.getQualifiedName());
            assertEquals("config set prefix", group.getSubCommand("prefix").getQualifiedName());
            assertEquals(3, command.invocables().size());
        }

        @Test
        void leafWithOptionsCannotTakeChildren() {
            SlashCommand command = SlashCommand.builder().name("echo").options(List.of(option("text", true))).build();
            assertThrows(CommandValidationException.class, () -> command.addSubCommand(sub("x")));
        }

        @Test
        void siblingNamesAreUnique() {
            SlashCommand command = SlashCommand.builder().name("config").build();
            command.addSubCommand(sub("show"));
            assertThrows(CommandValidationException.class, () -> command.addSubCommand(sub("show")));
        }

        @Test
        void groupNeedsAtLeastOneSubCommand() {
            assertThrows(CommandValidationException.class,
                    () -> SubCommandGroup.builder().name("set").subCommands(List.of()).build());
        }

        @Test
        void atMostTwentyFiveChildren() {
            SlashCommand command = SlashCommand.builder().name("big").build();
            for (int i = 0; i < 25; i++) {
                command.addSubCommand(sub("s" + i));
            }
            assertThrows(CommandValidationException.class, () -> command.addSubCommand(sub("s25")));
        }
    }

    @Nested
    class Wire {

        @Test
        void globalWireCarriesDmPermission() {
            SlashCommand command = SlashCommand.builder().name("ping").description("Pong")
                    .defaultMemberPermissions(8L).allowDm(false).build();
            Map<String, Object> wire = command.toWire(Scope.GLOBAL);
            assertEquals(1, wire.get("type"));
            assertEquals("8", wire.get("default_member_permissions"));
            assertEquals(false, wire.get("dm_permission"));
            assertFalse(wire.containsKey("options"));
        }

        @Test
        void guildWireOmitsDmPermission() {
            SlashCommand command = SlashCommand.builder().name("ping").guildIds(List.of(10L)).build();
            assertFalse(command.toWire(Scope.guild(10)).containsKey("dm_permission"));
            assertFalse(command.toWire().containsKey("dm_permission"));
        }

        @Test
        void containerWireNestsChildren() {
            SlashCommand command = SlashCommand.builder().name("config").build();
            command.addGroup(SubCommandGroup.builder().name("set").subCommands(List.of(sub("prefix"))).build());
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> options = (List<Map<String, Object>>) command.toWire().get("options");
            assertEquals(2, options.get(0).get("type"));
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> nested = (List<Map<String, Object>>) options.get(0).get("options");
            assertEquals("prefix", nested.get(0).get("name"));
            assertEquals(1, nested.get(0).get("type"));
        }

        @Test
        void matchesItsOwnWire() {
            SlashCommand command = SlashCommand.builder().name("config").build();
            command.addSubCommand(sub("show"));
            command.addGroup(SubCommandGroup.builder().name("set").subCommands(List.of(sub("prefix"))).build());
            assertTrue(command.matchesWire(command.toWire(Scope.GLOBAL), Scope.GLOBAL));

            SlashCommand guild = SlashCommand.builder().name("local").guildIds(List.of(3L))
                    .options(List.of(option("text", true))).build();
            assertTrue(guild.matchesWire(guild.toWire(Scope.guild(3)), Scope.guild(3)));
        }

        @Test
        void matchesRemoteFormWithExtraFieldsAndOmittedDefaults() {
            SlashCommand command = SlashCommand.builder().name("echo").description("Echo")
                    .options(List.of(option("text", true), option("times", false))).build();
            Map<String, Object> remote = new LinkedHashMap<>();
            remote.put("id", "123");
            remote.put("application_id", "42");
            remote.put("version", "77");
            remote.put("type", 1);
            remote.put("name", "echo");
            remote.put("description", "Echo");
            remote.put("default_member_permissions", null);
            remote.put("options", List.of(
                    Map.of("type", 3, "name", "text", "description", "Option text", "required", true),
                    Map.of("type", 3, "name", "times", "description", "Option times")));
            assertTrue(command.matchesWire(remote));

            remote.put("description", "Changed");
            assertFalse(command.matchesWire(remote));
        }

        @Test
        void subCommandNodesCompareStructurally() {
            SubCommand show = sub("show");
            assertTrue(show.matchesWire(show.toWire()));
            assertFalse(show.matchesWire(sub("hide").toWire()));
        }
    }
}
