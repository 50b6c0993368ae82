package io.github.riemr.mobilepost.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * One validated list request. Built once per request and never persisted.
 */
@Value
@Builder
public class QueryFilterSpec {
    String search;
    String district;
    Integer dayOfWeek;
    String openAt;
    String mobileCode;
    Integer seq;
    @Builder.Default
    int page = 1;
    @Builder.Default
    int limit = 20;
    @Builder.Default
    SortField sortBy = SortField.ID;
    @Builder.Default
    SortDirection sortDir = SortDirection.ASC;
    @Builder.Default
    Language lang = Language.EN;
}
