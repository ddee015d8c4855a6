package com.demo.instrument.observability;

import io.grpc.Context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered name/value pairs describing one call, rendered as {@code name=value} pairs.
 *
 * <p>Owned by a single call. gRPC serializes the callbacks of a call, so no locking is done here.
 */
public final class FieldSet {

    public static final Context.Key<FieldSet> KEY = Context.key("instrument-field-set");

    private final List<Field> fields = new ArrayList<>(20);

    public record Field(String name, Object value) {
        @Override
        public String toString() {
            return name + "=" + (value == null ? "" : value);
        }
    }

    /**
     * Field set bound to the current {@link io.grpc.Context}, or {@code null}.
     */
    public static FieldSet current() {
        return KEY.get();
    }

    public FieldSet add(String name, Object value) {
        fields.add(new Field(name, value));
        return this;
    }

    /**
     * Replaces the value of the first field called {@code name}, or appends it.
     */
    public FieldSet put(String name, Object value) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equals(name)) {
                fields.set(i, new Field(name, value));
                return this;
            }
        }
        return add(name, value);
    }

    public Object get(String name) {
        for (Field field : fields) {
            if (field.name().equals(name)) {
                return field.value();
            }
        }
        return null;
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    public List<Field> fields() {
        return Collections.unmodifiableList(fields);
    }

    public int size() {
        return fields.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Field field : fields) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(field);
        }
        return sb.toString();
    }
}
