package db.parts.query;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Partition manipulations accepted by ALTER TABLE ... PARTITION.
 */
public enum PartitionOperation {
    /** Move the partition to the 'detached' directory and forget it. */
    DETACH,
    /** Delete the partition. */
    DROP,
    /** Add a part or partition from the 'detached' directory back to the table. */
    ATTACH,
    /** Create a local backup of the partition. */
    FREEZE,
    /** Download the partition from another replica. Needs a source path. */
    FETCH;

    public boolean requiresSourcePath() {
        return this == FETCH;
    }

    public static PartitionOperation fromName(String name) {
        if (name == null) throw new IllegalArgumentException("operation must not be null");
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("operation must be in [" + allowedNames() + "], got: " + name, e);
        }
    }

    private static String allowedNames() {
        return Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", "));
    }
}
