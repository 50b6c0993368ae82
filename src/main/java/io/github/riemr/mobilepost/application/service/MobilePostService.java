package io.github.riemr.mobilepost.application.service;

import io.github.riemr.mobilepost.application.dto.MobilePostQueryParams;
import io.github.riemr.mobilepost.application.dto.MobilePostRequest;
import io.github.riemr.mobilepost.application.dto.MobilePostView;
import io.github.riemr.mobilepost.application.dto.PagedResult;
import io.github.riemr.mobilepost.application.exception.RecordNotFoundException;
import io.github.riemr.mobilepost.application.query.LanguageResolver;
import io.github.riemr.mobilepost.application.query.MobilePostFilter;
import io.github.riemr.mobilepost.application.query.MobilePostFilterBuilder;
import io.github.riemr.mobilepost.application.query.MobilePostQueryParser;
import io.github.riemr.mobilepost.application.query.PageResult;
import io.github.riemr.mobilepost.application.query.PageWindow;
import io.github.riemr.mobilepost.application.query.Paginator;
import io.github.riemr.mobilepost.application.query.SortResolver;
import io.github.riemr.mobilepost.application.query.SortSpec;
import io.github.riemr.mobilepost.application.repository.MobilePostRepository;
import io.github.riemr.mobilepost.application.validation.MobilePostValidators;
import io.github.riemr.mobilepost.domain.model.Language;
import io.github.riemr.mobilepost.domain.model.QueryFilterSpec;
import io.github.riemr.mobilepost.infrastructure.persistence.entity.MobilePost;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * List/get/create/update/delete of mobile post offices. Every input is validated before storage is touched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MobilePostService {
    private final MobilePostRepository repository;
    private final MobilePostQueryParser queryParser;
    private final MobilePostFilterBuilder filterBuilder;
    private final SortResolver sortResolver;
    private final LanguageResolver languageResolver;

    public PagedResult<MobilePostView> list(MobilePostQueryParams params) {
        QueryFilterSpec spec = queryParser.parse(params).orElseThrow();
        return list(spec);
    }

    public PagedResult<MobilePostView> list(QueryFilterSpec spec) {
        PageWindow window = Paginator.window(spec.getPage(), spec.getLimit()).orElseThrow();
        MobilePostFilter filter = filterBuilder.build(spec);
        SortSpec sort = sortResolver.resolve(spec.getSortBy(), spec.getSortDir(), spec.getLang());
        log.debug("Listing mobile posts filter={} sort={} window={}", filter, sort.getOrderByClause(), window);

        PageResult<MobilePost> page = repository.find(filter, sort, window);
        List<MobilePostView> items = languageResolver.project(page.records(), spec.getLang());
        return new PagedResult<>(items, Paginator.meta(page.total(), window));
    }

    public MobilePostView get(Long id, String lang) {
        Language language = queryParser.parseLanguage(lang).orElseThrow();
        log.debug("Retrieving mobile post {}", id);
        MobilePost post = repository.findById(id);
        if (post == null) {
            throw new RecordNotFoundException(id);
        }
        return languageResolver.project(post, language);
    }

    public MobilePostView create(MobilePostRequest request) {
        MobilePostValidators.validateForCreate(request).orElseThrow();
        MobilePost created = repository.create(MobilePost.from(request));
        log.info("Created mobile post {} ({} / {})", created.getId(), created.getMobileCode(), created.getSeq());
        return languageResolver.project(created, Language.ALL);
    }

    public MobilePostView update(Long id, MobilePostRequest request) {
        MobilePostValidators.validateForUpdate(request).orElseThrow();
        MobilePost updated = repository.update(id, MobilePost.from(request));
        log.info("Updated mobile post {}", id);
        return languageResolver.project(updated, Language.ALL);
    }

    public void delete(Long id) {
        repository.delete(id);
        log.info("Deleted mobile post {}", id);
    }
}
