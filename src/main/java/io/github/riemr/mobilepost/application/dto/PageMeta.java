package io.github.riemr.mobilepost.application.dto;

import lombok.Value;

@Value
public class PageMeta {
    long total;
    int page;
    int limit;
    long totalPages;
}
