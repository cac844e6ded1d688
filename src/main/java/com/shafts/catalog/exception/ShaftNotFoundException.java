package com.shafts.catalog.exception;

import com.shafts.catalog.model.ShaftKey;
import lombok.Getter;

@Getter
public class ShaftNotFoundException extends CatalogException {

    private final ShaftKey key;

    public ShaftNotFoundException(final ShaftKey key) {
        super("Shaft not found: " + key);
        this.key = key;
    }

    @Override
    public String getCode() {
        return "NOT_FOUND";
    }
}
