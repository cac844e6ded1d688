package com.shafts.catalog.service.core;

import com.shafts.catalog.exception.DuplicateKeyException;
import com.shafts.catalog.exception.ShaftNotFoundException;
import com.shafts.catalog.model.ShaftKey;
import com.shafts.catalog.model.ShaftSpec;
import com.shafts.catalog.model.filter.FilterSpecification;

import java.util.List;

/**
 * Holds the canonical shaft records and serves structural queries.
 * <p>
 * Records are immutable; a correction is a {@link #replace(ShaftKey, ShaftSpec)} and a
 * discontinued model is an explicit {@link #remove(ShaftKey)}. Every result list is ordered by
 * {@link ShaftKey} order (manufacturer, model, generation, club type, then flex), so slicing a
 * result is deterministic.
 * </p>
 */
public interface ShaftCatalog {

    /**
     * @param spec canonical record
     * @throws DuplicateKeyException if a record with the same identity key exists
     */
    void insert(ShaftSpec spec);

    /**
     * Atomically swaps the record stored under {@code key} for {@code spec}. The new record may
     * carry a different key, provided that key is not taken by another record.
     *
     * @param key  key of the record to replace
     * @param spec replacement
     * @return the record that was replaced
     * @throws ShaftNotFoundException if {@code key} is absent
     * @throws DuplicateKeyException  if {@code spec} is re-keyed onto an existing record
     */
    ShaftSpec replace(ShaftKey key, ShaftSpec spec);

    /**
     * @param key key of the record to drop
     * @return the removed record
     * @throws ShaftNotFoundException if {@code key} is absent
     */
    ShaftSpec remove(ShaftKey key);

    /**
     * @param key identity key
     * @return the stored record
     * @throws ShaftNotFoundException if {@code key} is absent
     */
    ShaftSpec get(ShaftKey key);

    boolean contains(ShaftKey key);

    /**
     * @param filter constraints combined with AND
     * @return matching records in key order; empty, never an error, when nothing matches
     */
    List<ShaftSpec> query(FilterSpecification filter);

    /**
     * @return every record in key order
     */
    List<ShaftSpec> all();

    int size();

    void clear();
}
