package org.rostilos.labgate.core.model.item;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * A validated listing request: one item kind, one calendar year (UTC).
 */
public record ItemQuery(EItemKind kind, int year) {

    public ItemQuery {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (year < 1 || year > 9999) {
            throw new IllegalArgumentException("year must be a positive 4-digit number");
        }
    }

    /**
     * Inclusive lower bound: January 1st of the year, 00:00 UTC.
     */
    public OffsetDateTime rangeStart() {
        return OffsetDateTime.of(year, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
    }

    /**
     * Exclusive upper bound: January 1st of the following year, 00:00 UTC.
     */
    public OffsetDateTime rangeEnd() {
        return rangeStart().plusYears(1);
    }

    public boolean contains(OffsetDateTime createdAt) {
        return createdAt != null && !createdAt.isBefore(rangeStart()) && createdAt.isBefore(rangeEnd());
    }
}
