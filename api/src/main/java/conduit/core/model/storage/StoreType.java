package conduit.core.model.storage;

/**
 * Backend kinds understood by the store factory.
 */
public enum StoreType {
    /** Process-local map, lost on restart. */
    MEMORY,
    /** Redis-backed store, optionally fronted by a memory layer. */
    PERSISTENT,
    /** Operator-supplied backend registered through a {@code KeyValueStoreProvider}. */
    CUSTOM;

    /**
     * Parse a configured type name, case-insensitively.
     *
     * @param name configured value such as {@code memory} or {@code persistent}
     * @return the matching type
     * @throws IllegalArgumentException if the name is not recognised
     */
    public static StoreType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Store type must not be blank");
        }
        return switch (name.trim().toLowerCase()) {
            case "memory" -> MEMORY;
            case "persistent", "redis" -> PERSISTENT;
            case "custom" -> CUSTOM;
            default -> throw new IllegalArgumentException(
                    "Unknown store type '%s' (expected memory, persistent or custom)".formatted(name));
        };
    }
}
