package io.github.riemr.mobilepost.application.query;

import io.github.riemr.mobilepost.application.dto.PageMeta;
import io.github.riemr.mobilepost.application.validation.MobilePostValidators;
import io.github.riemr.mobilepost.application.validation.Validation;

/**
 * Describes the requested window and the paging metadata. Never fetches anything itself.
 */
public final class Paginator {
    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 20;

    private Paginator() {}

    public static Validation<PageWindow> window(int page, int limit) {
        return MobilePostValidators.validatePagination(page, limit);
    }

    public static PageMeta meta(long total, PageWindow window) {
        return new PageMeta(total, window.page(), window.limit(), totalPages(total, window.limit()));
    }

    public static long totalPages(long total, int limit) {
        if (total <= 0) {
            return 0;
        }
        return (total + limit - 1) / limit;
    }
}
