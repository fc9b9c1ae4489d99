package com.slashsync.core.dispatch;

import com.slashsync.core.model.CommandType;
import com.slashsync.core.model.Scope;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * An inbound application command or autocomplete interaction.
 */
@Data
@Builder
public class Interaction {

    public static final int TYPE_APPLICATION_COMMAND = 2;
    public static final int TYPE_AUTOCOMPLETE = 4;

    private long id;
    private long applicationId;
    private int type;
    private String token;
    private Long guildId;
    private Long channelId;
    private Long userId;
    private String locale;

    // command data
    private Long commandId;
    private String commandName;
    @Builder.Default
    private CommandType commandType = CommandType.CHAT_INPUT;
    private Long targetId;
    @Builder.Default
    private List<InteractionOption> options = List.of();
    @Builder.Default
    private ResolvedData resolved = ResolvedData.EMPTY;

    public boolean isAutocomplete() {
        return type == TYPE_AUTOCOMPLETE;
    }

    public Scope scope() {
        return guildId == null ? Scope.GLOBAL : Scope.guild(guildId);
    }
}
