package io.github.riemr.mobilepost.application.repository;

import io.github.riemr.mobilepost.application.query.MobilePostFilter;
import io.github.riemr.mobilepost.application.query.PageResult;
import io.github.riemr.mobilepost.application.query.PageWindow;
import io.github.riemr.mobilepost.application.query.SortSpec;
import io.github.riemr.mobilepost.infrastructure.persistence.entity.MobilePost;

import java.util.List;

public interface MobilePostRepository {

    /** Filters, then counts, then orders and windows; read-consistent within the call. */
    PageResult<MobilePost> find(MobilePostFilter filter, SortSpec sort, PageWindow window);

    /** @return the row, or {@code null} when absent */
    MobilePost findById(Long id);

    /** @throws io.github.riemr.mobilepost.application.exception.DuplicateRecordException on a uniqueness violation */
    MobilePost create(MobilePost post);

    /**
     * Overwrites every non-null client field of {@code changes}, leaves the rest untouched.
     *
     * @throws io.github.riemr.mobilepost.application.exception.RecordNotFoundException when no row has {@code id}
     */
    MobilePost update(Long id, MobilePost changes);

    /** @throws io.github.riemr.mobilepost.application.exception.RecordNotFoundException when no row has {@code id} */
    void delete(Long id);

    /** Columns that make up import dedup keys, for every stored row. */
    List<MobilePost> findAllIdentities();
}
