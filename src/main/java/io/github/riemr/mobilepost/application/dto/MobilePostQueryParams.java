package io.github.riemr.mobilepost.application.dto;

import lombok.Data;

/**
 * Raw list query parameters. Kept as strings so malformed numbers surface as 0106 instead of a binding error.
 */
@Data
public class MobilePostQueryParams {
    private String search;
    private String district;
    private String dayOfWeek;
    private String openAt;
    private String mobileCode;
    private String seq;
    private String page;
    private String limit;
    private String sortBy;
    private String sortDir;
    private String lang;
}
