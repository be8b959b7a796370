package spl.idstring.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import spl.idstring.document.DocumentStructureException;

/**
 * Index of extracted entities by their document-local key (chain local id, polymer code).
 */
public final class EntityLookup<T> {

    private final String kind;
    private final Map<String, T> entries;

    private EntityLookup(String kind, Map<String, T> entries) {
        this.kind = kind;
        this.entries = entries;
    }

    /**
     * @throws DocumentStructureException when two entities share a key
     */
    public static <T> EntityLookup<T> index(String kind, Collection<T> items, Function<T, String> key) {
        Map<String, T> entries = new LinkedHashMap<>();
        for (T item : items) {
            String itemKey = key.apply(item);
            if (entries.putIfAbsent(itemKey, item) != null) {
                throw new DocumentStructureException("Duplicate " + kind + " key: " + itemKey);
            }
        }
        return new EntityLookup<>(kind, Map.copyOf(entries));
    }

    public Optional<T> find(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * @throws CrossReferenceException when {@code key} is not indexed
     */
    public T require(String key) {
        return find(key).orElseThrow(() -> new CrossReferenceException(kind, key));
    }
}
