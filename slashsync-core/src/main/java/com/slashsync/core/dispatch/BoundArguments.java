package com.slashsync.core.dispatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolved arguments of one invocation, keyed by handler parameter name.
 */
public final class BoundArguments {

    private static final BoundArguments EMPTY = new BoundArguments(Map.of(), null, null);

    private final Map<String, Object> values;
    private final String focused;
    private final Object target;

    public BoundArguments(Map<String, Object> values, String focused, Object target) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.focused = focused;
        this.target = target;
    }

    public static BoundArguments empty() {
        return EMPTY;
    }

    public boolean has(String parameter) {
        return values.containsKey(parameter);
    }

    public Object get(String parameter) {
        return values.get(parameter);
    }

    /**
     * Typed access; throws {@link ClassCastException} on a type mismatch.
     */
    public <T> T get(String parameter, Class<T> type) {
        return type.cast(values.get(parameter));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Parameter name of the option being autocompleted, {@code null} otherwise.
     */
    public String getFocused() {
        return focused;
    }

    public Object getFocusedValue() {
        return focused == null ? null : values.get(focused);
    }

    /**
     * The user, member or message a context menu command was invoked on.
     */
    public Object getTarget() {
        return target;
    }

    @Override
    public String toString() {
        return "BoundArguments" + values + (focused == null ? "" : " focused=" + focused);
    }
}
