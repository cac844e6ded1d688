package com.shafts.catalog.service.core;

import com.shafts.catalog.exception.DuplicateKeyException;
import com.shafts.catalog.exception.ShaftNotFoundException;
import com.shafts.catalog.model.ShaftKey;
import com.shafts.catalog.model.ShaftSpec;
import com.shafts.catalog.model.filter.FilterSpecification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Copy-on-write in-memory {@link ShaftCatalog}.
 * <p>
 * Mutations are serialized by a single writer lock; each one builds a new sorted map and
 * publishes it through a volatile reference. Readers never lock and always work on one whole
 * snapshot, so they observe the catalog either before or after a mutation, never in between.
 * </p>
 */
@Slf4j
@Component
public class InMemoryShaftCatalog implements ShaftCatalog {

    private final ReentrantLock writeLock = new ReentrantLock();

    private volatile NavigableMap<ShaftKey, ShaftSpec> snapshot = Collections.emptyNavigableMap();

    @Override
    public void insert(final ShaftSpec spec) {
        Objects.requireNonNull(spec, "spec");
        ShaftKey key = spec.key();
        mutate(current -> {
            if (current.containsKey(key)) {
                throw new DuplicateKeyException(key);
            }
            TreeMap<ShaftKey, ShaftSpec> next = new TreeMap<>(current);
            next.put(key, spec);
            return next;
        });
        log.debug("Inserted {}", key);
    }

    @Override
    public ShaftSpec replace(final ShaftKey key, final ShaftSpec spec) {
        Objects.requireNonNull(spec, "spec");
        ShaftSpec[] previous = new ShaftSpec[1];
        ShaftKey newKey = spec.key();
        mutate(current -> {
            previous[0] = current.get(key);
            if (previous[0] == null) {
                throw new ShaftNotFoundException(key);
            }
            if (!newKey.equals(key) && current.containsKey(newKey)) {
                throw new DuplicateKeyException(newKey);
            }
            TreeMap<ShaftKey, ShaftSpec> next = new TreeMap<>(current);
            next.remove(key);
            next.put(newKey, spec);
            return next;
        });
        log.debug("Replaced {} with {}", key, newKey);
        return previous[0];
    }

    @Override
    public ShaftSpec remove(final ShaftKey key) {
        ShaftSpec[] removed = new ShaftSpec[1];
        mutate(current -> {
            removed[0] = current.get(key);
            if (removed[0] == null) {
                throw new ShaftNotFoundException(key);
            }
            TreeMap<ShaftKey, ShaftSpec> next = new TreeMap<>(current);
            next.remove(key);
            return next;
        });
        log.debug("Removed {}", key);
        return removed[0];
    }

    @Override
    public ShaftSpec get(final ShaftKey key) {
        ShaftSpec spec = snapshot.get(key);
        if (spec == null) {
            throw new ShaftNotFoundException(key);
        }
        return spec;
    }

    @Override
    public boolean contains(final ShaftKey key) {
        return snapshot.containsKey(key);
    }

    @Override
    public List<ShaftSpec> query(final FilterSpecification filter) {
        NavigableMap<ShaftKey, ShaftSpec> view = snapshot;
        if (filter == null || filter.isEmpty()) {
            return List.copyOf(view.values());
        }
        return view.values().stream()
                .filter(filter::matches)
                .toList();
    }

    @Override
    public List<ShaftSpec> all() {
        return List.copyOf(snapshot.values());
    }

    @Override
    public int size() {
        return snapshot.size();
    }

    @Override
    public void clear() {
        mutate(current -> new TreeMap<>());
        log.info("Catalog cleared");
    }

    private void mutate(final UnaryOperator<NavigableMap<ShaftKey, ShaftSpec>> change) {
        writeLock.lock();
        try {
            snapshot = Collections.unmodifiableNavigableMap(change.apply(snapshot));
        } finally {
            writeLock.unlock();
        }
    }
}
