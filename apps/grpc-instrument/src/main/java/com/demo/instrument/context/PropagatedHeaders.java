package com.demo.instrument.context;

import io.grpc.Metadata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide set of header names that are extracted from incoming calls, re-attached to
 * outgoing calls and written to access logs.
 *
 * <p>The set is replaced as a whole: readers always see either the previous or the new snapshot.
 */
public final class PropagatedHeaders {

    private static final AtomicReference<List<String>> SNAPSHOT = new AtomicReference<>(List.of());

    private PropagatedHeaders() {
    }

    /**
     * Replaces the registered header names. Names are kept as registered, in order; a name equal to
     * an earlier one ignoring case is dropped. Metadata and {@link CallContext} lookups are
     * case-insensitive, log fields use the registered spelling.
     */
    public static void set(Collection<String> names) {
        Objects.requireNonNull(names, "names");
        Set<String> seen = new HashSet<>();
        List<String> ordered = new ArrayList<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("propagated header name must not be blank");
            }
            String trimmed = name.trim();
            String normalized = CallContext.normalize(trimmed);
            if (normalized.endsWith(Metadata.BINARY_HEADER_SUFFIX)) {
                throw new IllegalArgumentException("binary header cannot be propagated: " + name);
            }
            if (seen.add(normalized)) {
                ordered.add(trimmed);
            }
        }
        SNAPSHOT.set(List.copyOf(ordered));
    }

    public static List<String> keys() {
        return SNAPSHOT.get();
    }

    public static int size() {
        return SNAPSHOT.get().size();
    }
}
