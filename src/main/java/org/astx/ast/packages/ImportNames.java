package org.astx.ast.packages;

import org.astx.api.InvalidValueException;
import org.astx.api.MalformedNodeException;

import java.util.List;

/**
 * Checks shared by the import variants.
 */
final class ImportNames {

    private ImportNames() {}

    static void requireNames(List<AliasExpr> names, String construct) {
        if (names.isEmpty()) {
            throw new MalformedNodeException(construct + " requires at least one name");
        }
    }

    static String requireSource(String module, int level, String construct) {
        if (level < 0) {
            throw new InvalidValueException(construct + " level must not be negative: " + level);
        }
        String normalized = module == null ? "" : module;
        if (normalized.isEmpty() && level == 0) {
            throw new MalformedNodeException(construct + " requires a module or a relative level");
        }
        return normalized;
    }

    /**
     * @return The module reference with one leading dot per level, for example {@code ..pkg}.
     */
    static String qualified(String module, int level) {
        return ".".repeat(level) + module;
    }
}
