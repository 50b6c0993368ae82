package io.github.riemr.mobilepost.application.query;

import io.github.riemr.mobilepost.domain.model.SortDirection;
import io.github.riemr.mobilepost.domain.model.SortField;
import io.github.riemr.mobilepost.infrastructure.persistence.entity.MobilePost;
import lombok.Value;

import java.util.Comparator;

/**
 * Deterministic ordering: the requested key, then ascending id.
 */
@Value
public class SortSpec {
    SortField field;
    SortDirection direction;
    /** SQL ORDER BY body built from whitelisted column expressions only. */
    String orderByClause;
    /** The same ordering for rows already in memory. */
    Comparator<MobilePost> comparator;
}
