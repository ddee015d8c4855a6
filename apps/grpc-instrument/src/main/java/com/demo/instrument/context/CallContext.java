package com.demo.instrument.context;

import io.grpc.Context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Correlation metadata attached to a single call.
 *
 * <p>Instances are immutable: {@link #with(String, String)} returns a new carrier and leaves the
 * receiver untouched. The carrier travels with the call inside {@link io.grpc.Context}, so it is
 * visible to the handler and to any outgoing call started from it.
 */
public final class CallContext {

    public static final Context.Key<CallContext> KEY = Context.key("instrument-call-context");

    private static final CallContext EMPTY = new CallContext(Collections.emptyMap());

    private final Map<String, List<String>> values;

    private CallContext(Map<String, List<String>> values) {
        this.values = values;
    }

    public static CallContext empty() {
        return EMPTY;
    }

    /**
     * Carrier bound to the current {@link io.grpc.Context}, or an empty one.
     */
    public static CallContext current() {
        CallContext ctx = KEY.get();
        return ctx == null ? EMPTY : ctx;
    }

    /**
     * Derives a {@link io.grpc.Context} from the current one whose carrier also holds {@code key=value}.
     */
    public static Context withValue(String key, String value) {
        return Context.current().withValue(KEY, current().with(key, value));
    }

    public CallContext with(String key, String value) {
        String normalized = normalize(key);
        Objects.requireNonNull(value, "value");

        Map<String, List<String>> copy = new LinkedHashMap<>(values);
        List<String> existing = copy.get(normalized);
        List<String> merged = new ArrayList<>(existing == null ? 1 : existing.size() + 1);
        if (existing != null) {
            merged.addAll(existing);
        }
        merged.add(value);
        copy.put(normalized, Collections.unmodifiableList(merged));
        return new CallContext(Collections.unmodifiableMap(copy));
    }

    /**
     * First value stored under {@code key}, or {@code ""} when absent.
     */
    public String value(String key) {
        List<String> found = values.get(normalize(key));
        return found == null || found.isEmpty() ? "" : found.get(0);
    }

    public List<String> values(String key) {
        List<String> found = values.get(normalize(key));
        return found == null ? Collections.emptyList() : found;
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    static String normalize(String key) {
        Objects.requireNonNull(key, "key");
        return key.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "CallContext" + values;
    }
}
