package com.di.sheetload.verify;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * What the backend reports after a load, compared with the loader's own tally.
 */
@Value
@Builder
public class VerificationResult {
    /** RUN_ID when counted by isolation column, TABLE_GROWTH otherwise. */
    String method;
    long expectedRows;
    /** Rows the backend reports; -1 when the count query failed. */
    long verifiedRows;
    boolean matched;
    List<Map<String, Object>> samples;
    List<String> warnings;
}
