package com.pgschema.core.catalog;

import com.pgschema.core.UnknownCollectionException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only registry of every {@link CollectionDescriptor} the engine serves.
 *
 * <p>The catalog is filled once at construction and never mutated afterwards,
 * so lookups from any number of threads need no locking. Besides the
 * descriptors it is given, it always registers two collections describing
 * itself:
 * <ul>
 *   <li>{@code MetaDataCollections} – one row per collection with its number
 *       of restrictions and identifier parts</li>
 *   <li>{@code Restrictions} – one row per (collection, restriction column)
 *       with the column's 1-based position</li>
 * </ul>
 * Both come first in listing order, followed by the given descriptors in the
 * order they were supplied.
 */
public final class CollectionCatalog {

    private static final CollectionCatalog BUILTIN = new CollectionCatalog(BuiltinCollections.all());

    private final Map<String, CollectionDescriptor> descriptors;

    public CollectionCatalog(Collection<CollectionDescriptor> collections) {
        List<String> names = new ArrayList<>();
        names.add(BuiltinCollections.META_DATA_COLLECTIONS);
        names.add(BuiltinCollections.RESTRICTIONS);
        collections.forEach(d -> names.add(d.getName()));

        List<CollectionDescriptor> all = new ArrayList<>(collections.size() + 2);
        all.add(metaDataCollections(names, collections));
        all.add(restrictions(collections));
        all.addAll(collections);

        Map<String, CollectionDescriptor> byName = new LinkedHashMap<>();
        for (CollectionDescriptor d : all) {
            if (byName.putIfAbsent(d.getName(), d) != null) {
                throw new IllegalArgumentException("Collection registered twice: " + d.getName());
            }
        }
        this.descriptors = Collections.unmodifiableMap(byName);
    }

    /** The catalog of PostgreSQL metadata collections defined by {@link BuiltinCollections}. */
    public static CollectionCatalog builtin() {
        return BUILTIN;
    }

    /**
     * Resolves a collection by exact name.
     *
     * @param name the collection name, e.g. {@code "Tables"}
     * @return the registered descriptor
     * @throws UnknownCollectionException if no collection has that name
     */
    public CollectionDescriptor resolve(String name) throws UnknownCollectionException {
        CollectionDescriptor d = name == null ? null : descriptors.get(name);
        if (d == null) {
            throw new UnknownCollectionException(name);
        }
        return d;
    }

    public boolean contains(String name) {
        return name != null && descriptors.containsKey(name);
    }

    /** Name and restriction columns of every collection, in registration order. */
    public List<CollectionSummary> listCollections() {
        return descriptors.values().stream().map(CollectionDescriptor::summary).toList();
    }

    /** Every registered descriptor, in registration order. */
    public Collection<CollectionDescriptor> descriptors() {
        return descriptors.values();
    }

    public int size() { return descriptors.size(); }

    // ------------------------------------------------------------------
    // Self-describing collections
    // ------------------------------------------------------------------

    private static CollectionDescriptor metaDataCollections(List<String> names,
                                                            Collection<CollectionDescriptor> collections) {
        Map<String, CollectionDescriptor> given = new LinkedHashMap<>();
        collections.forEach(d -> given.put(d.getName(), d));

        List<Map<String, Object>> rows = new ArrayList<>();
        for (String name : names) {
            CollectionDescriptor d = given.get(name);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("CollectionName",          name);
            row.put("NumberOfRestrictions",    d == null ? 0 : d.getRestrictionColumns().size());
            row.put("NumberOfIdentifierParts", d == null ? 0 : d.getIdentifierParts());
            rows.add(row);
        }
        return CollectionDescriptor.builder(BuiltinCollections.META_DATA_COLLECTIONS)
                .addTextColumn("CollectionName")
                .addIntColumn("NumberOfRestrictions")
                .addIntColumn("NumberOfIdentifierParts")
                .staticRows(rows)
                .build();
    }

    private static CollectionDescriptor restrictions(Collection<CollectionDescriptor> collections) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (CollectionDescriptor d : collections) {
            List<String> columns = d.getRestrictionColumns();
            for (int i = 0; i < columns.size(); i++) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("CollectionName",     d.getName());
                row.put("RestrictionName",    columns.get(i));
                row.put("RestrictionDefault", null);
                row.put("RestrictionNumber",  i + 1);
                rows.add(row);
            }
        }
        return CollectionDescriptor.builder(BuiltinCollections.RESTRICTIONS)
                .addTextColumn("CollectionName")
                .addTextColumn("RestrictionName")
                .addTextColumn("RestrictionDefault")
                .addIntColumn("RestrictionNumber")
                .staticRows(rows)
                .build();
    }
}
