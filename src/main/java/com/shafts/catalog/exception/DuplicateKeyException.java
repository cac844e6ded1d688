package com.shafts.catalog.exception;

import com.shafts.catalog.model.ShaftKey;
import lombok.Getter;

/**
 * Insert (or re-keying replace) would create a second record with an existing identity key.
 */
@Getter
public class DuplicateKeyException extends CatalogException {

    private final ShaftKey key;

    public DuplicateKeyException(final ShaftKey key) {
        super("Shaft already exists: " + key);
        this.key = key;
    }

    @Override
    public String getCode() {
        return "DUPLICATE_KEY";
    }
}
