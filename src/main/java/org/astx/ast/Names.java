package org.astx.ast;

import org.astx.api.MalformedNodeException;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Name checks shared by declaring nodes.
 */
public final class Names {

    private Names() {}

    public static String require(String name, String construct) {
        if (name == null || name.isBlank()) {
            throw new MalformedNodeException(construct + " requires a non-blank name");
        }
        return name;
    }

    /**
     * Fails when two items map to the same key.
     *
     * @param what Describes the items in the error message, for example "argument".
     */
    public static <T> void requireUnique(List<? extends T> items, Function<T, String> key, String what, String owner) {
        Set<String> seen = new HashSet<>();
        for (T item : items) {
            String k = key.apply(item);
            if (!seen.add(k)) {
                throw new MalformedNodeException(String.format("Duplicate %s '%s' in %s", what, k, owner));
            }
        }
    }
}
