package com.slashsync.core.node;

import com.slashsync.core.model.CommandType;
import com.slashsync.core.model.CommandValidationException;
import com.slashsync.core.model.RemoteBinding;
import com.slashsync.core.model.Scope;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextMenuCommandTest {

    @Test
    void namesMayContainSpacesAndCapitals() {
        UserCommand command = UserCommand.builder().name("Show Avatar").build();
        assertEquals(CommandType.USER, command.getType());
        assertEquals(NodeKind.USER_COMMAND, command.getNodeKind());
        assertThrows(CommandValidationException.class, () -> UserCommand.builder().name("").build());
        assertThrows(CommandValidationException.class, () -> MessageCommand.builder().name("x".repeat(33)).build());
    }

    @Test
    void wireHasEmptyDescriptionAndNoOptions() {
        Map<String, Object> wire = MessageCommand.builder().name("Bookmark").build().toWire(Scope.GLOBAL);
        assertEquals(3, wire.get("type"));
        assertEquals("", wire.get("description"));
        assertFalse(wire.containsKey("options"));
    }

    @Test
    void remoteWithoutDescriptionStillMatches() {
        MessageCommand command = MessageCommand.builder().name("Bookmark").build();
        assertTrue(command.matchesWire(Map.of("id", "5", "type", 3, "name", "Bookmark")));
        assertFalse(command.matchesWire(Map.of("id", "5", "type", 3, "name", "Bookmark", "nsfw", true)));
    }

    @Test
    void guildCommandHoldsOneBindingPerGuild() {
        UserCommand command = UserCommand.builder().name("Info").guildIds(List.of(1L, 2L)).build();
        assertEquals(2, command.getScopes().size());

        command.bind(Scope.guild(1), new RemoteBinding(100, 42, 1L, null, Instant.EPOCH, null));
        command.bind(Scope.guild(2), new RemoteBinding(200, 42, 2L, null, Instant.EPOCH, null));
        assertEquals(Long.valueOf(100), command.getId(Scope.guild(1)));
        assertEquals(Long.valueOf(200), command.getId(Scope.guild(2)));
        assertNull(command.getId(Scope.GLOBAL));
    }

    @Test
    void disableClearsHandlerButKeepsBindings() {
        UserCommand command = UserCommand.builder().name("Info").handler((interaction, args) -> {
        }).build();
        command.bind(Scope.GLOBAL, new RemoteBinding(100, 42, null, null, Instant.EPOCH, null));

        command.disable();

        assertTrue(command.isDisabled());
        assertNull(command.getHandlers().getHandler());
        assertEquals(Long.valueOf(100), command.getId(Scope.GLOBAL));
    }
}
