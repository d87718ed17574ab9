package com.di.sheetload.exception;

import java.util.Collection;

/**
 * A required anchor column matches none of the source header labels.
 */
public class AnchorNotFoundException extends IngestionException {

    private final String anchor;

    public AnchorNotFoundException(String anchor, Collection<String> aliases, int headerRowNumber) {
        super(ErrorCategory.SCHEMA_DRIFT_ERROR,
                String.format("Required anchor '%s' not found in header (aliases tried: %s)", anchor, aliases),
                sheetRow(headerRowNumber));
        this.anchor = anchor;
    }

    public String getAnchor() {
        return anchor;
    }
}
