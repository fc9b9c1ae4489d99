package com.slashsync.core.node;

import com.slashsync.core.model.CommandType;
import com.slashsync.core.model.RemoteBinding;
import com.slashsync.core.model.Scope;
import com.slashsync.core.model.WireComparison;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A top-level command: one logical value regardless of how many guilds it is
 * registered in. Each scope it lives in gets its own {@link RemoteBinding};
 * handlers are shared by all of them.
 */
public abstract sealed class ApplicationCommand implements CommandNode permits SlashCommand, ContextMenuCommand {

    private final CommandType type;
    private final String name;
    private final Map<String, String> nameLocalizations;
    private final Long defaultMemberPermissions;
    private final boolean allowDm;
    private final boolean nsfw;
    private final Set<Long> guildIds;
    private final Map<Scope, RemoteBinding> bindings = new ConcurrentHashMap<>();
    private volatile boolean disabled;
    private volatile String unitName;

    protected ApplicationCommand(CommandType type, String name, Map<String, String> nameLocalizations,
            Long defaultMemberPermissions, Boolean allowDm, boolean nsfw, Collection<Long> guildIds) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = name;
        this.nameLocalizations = Map.copyOf(nameLocalizations);
        this.defaultMemberPermissions = defaultMemberPermissions;
        this.allowDm = allowDm == null || allowDm;
        this.nsfw = nsfw;
        this.guildIds = guildIds == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(guildIds));
    }

    // =========================================================================
    // Metadata
    // =========================================================================

    public CommandType getType() {
        return type;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getQualifiedName() {
        return name;
    }

    public Map<String, String> getNameLocalizations() {
        return nameLocalizations;
    }

    public Long getDefaultMemberPermissions() {
        return defaultMemberPermissions;
    }

    public boolean isAllowDm() {
        return allowDm;
    }

    public boolean isNsfw() {
        return nsfw;
    }

    /**
     * Declared guilds; empty for a global command.
     */
    public Set<Long> getGuildIds() {
        return guildIds;
    }

    public boolean isGuildScoped() {
        return !guildIds.isEmpty();
    }

    /**
     * Every scope the command is registered in.
     */
    public Set<Scope> getScopes() {
        if (guildIds.isEmpty())
            return Set.of(Scope.GLOBAL);
        Set<Scope> scopes = new LinkedHashSet<>();
        guildIds.forEach(id -> scopes.add(Scope.guild(id)));
        return scopes;
    }

    public String getUnitName() {
        return unitName;
    }

    public void setUnitName(String unitName) {
        this.unitName = unitName;
    }

    // =========================================================================
    // Remote binding
    // =========================================================================

    public Optional<RemoteBinding> getBinding(Scope scope) {
        return Optional.ofNullable(bindings.get(scope));
    }

    public Map<Scope, RemoteBinding> getBindings() {
        return Collections.unmodifiableMap(bindings);
    }

    /**
     * Remote identifier in the given scope, {@code null} before synchronization.
     */
    public Long getId(Scope scope) {
        RemoteBinding binding = bindings.get(scope);
        return binding == null ? null : binding.id();
    }

    /**
     * Attach the remote identity for one scope. Only synchronization calls this.
     */
    public void bind(Scope scope, RemoteBinding binding) {
        bindings.put(scope, binding);
    }

    public boolean isDisabled() {
        return disabled;
    }

    /**
     * Mark the command as no longer defined in code: handlers are cleared but
     * the remote bindings are kept.
     */
    public void disable() {
        disabled = true;
        invocables().forEach(node -> node.getHandlers().clear());
    }

    /**
     * Every invocable node of this command, depth first.
     */
    public abstract List<InvocableCommand> invocables();

    // =========================================================================
    // Wire form
    // =========================================================================

    @Override
    public Map<String, Object> toWire() {
        return toWire(defaultScope());
    }

    /**
     * Wire form for one scope; {@code dm_permission} only exists globally.
     */
    public abstract Map<String, Object> toWire(Scope scope);

    @Override
    public boolean matchesWire(Map<String, Object> remote) {
        Object guild = remote.get("guild_id");
        return matchesWire(remote, guild == null ? Scope.GLOBAL : Scope.guild(RemoteBinding.parseId(guild)));
    }

    /**
     * Compare against a remote entry of the given scope. Fields the remote adds
     * are ignored and omitted defaults count as equal.
     */
    public boolean matchesWire(Map<String, Object> remote, Scope scope) {
        Map<String, Object> local = toWire(scope);
        if (!WireComparison.sameValue(local.get("type"), remote.get("type")))
            return false;
        if (!Objects.equals(local.get("name"), remote.get("name")))
            return false;
        if (!Objects.equals(textOrEmpty(local.get("description")), textOrEmpty(remote.get("description"))))
            return false;
        if (!Objects.equals(permissionString(local.get("default_member_permissions")),
                permissionString(remote.get("default_member_permissions"))))
            return false;
        if (scope.isGlobal() && dmPermission(local) != dmPermission(remote))
            return false;
        if (WireComparison.flag(local, "nsfw") != WireComparison.flag(remote, "nsfw"))
            return false;
        if (!WireComparison.localizationsMatch(local.get("name_localizations"), remote.get("name_localizations")))
            return false;
        if (!WireComparison.localizationsMatch(local.get("description_localizations"),
                remote.get("description_localizations")))
            return false;
        return WireComparison.optionsMatch(WireComparison.optionList(local), WireComparison.optionList(remote));
    }

    protected Map<String, Object> baseWire(Scope scope, String description, Map<String, String> descriptionLocalizations) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", type.value());
        wire.put("name", name);
        wire.put("name_localizations", nameLocalizations.isEmpty() ? null : new LinkedHashMap<>(nameLocalizations));
        wire.put("description", description);
        wire.put("description_localizations",
                descriptionLocalizations.isEmpty() ? null : new LinkedHashMap<>(descriptionLocalizations));
        wire.put("default_member_permissions",
                defaultMemberPermissions == null ? null : Long.toString(defaultMemberPermissions));
        if (scope.isGlobal()) {
            wire.put("dm_permission", allowDm);
        }
        wire.put("nsfw", nsfw);
        return wire;
    }

    private Scope defaultScope() {
        return guildIds.isEmpty() ? Scope.GLOBAL : Scope.guild(guildIds.iterator().next());
    }

    private static String textOrEmpty(Object value) {
        return value == null ? "" : value.toString();
    }

    private static String permissionString(Object value) {
        return value == null ? null : value.toString();
    }

    private static boolean dmPermission(Map<String, Object> wire) {
        Object value = wire.get("dm_permission");
        return value == null || Boolean.TRUE.equals(value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + name + ", type=" + type
                + (guildIds.isEmpty() ? "" : ", guilds=" + guildIds) + (disabled ? ", disabled" : "") + "}";
    }
}
