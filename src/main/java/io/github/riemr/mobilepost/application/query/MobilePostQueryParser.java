package io.github.riemr.mobilepost.application.query;

import io.github.riemr.mobilepost.application.dto.MobilePostQueryParams;
import io.github.riemr.mobilepost.application.exception.ErrorCode;
import io.github.riemr.mobilepost.application.validation.MobilePostValidators;
import io.github.riemr.mobilepost.application.validation.Validation;
import io.github.riemr.mobilepost.domain.model.Language;
import io.github.riemr.mobilepost.domain.model.QueryFilterSpec;
import io.github.riemr.mobilepost.domain.model.SortDirection;
import io.github.riemr.mobilepost.domain.model.SortField;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Validates raw list parameters into a {@link QueryFilterSpec}. The language is checked first so an
 * unsupported language fails before anything else is looked at.
 */
@Component
public class MobilePostQueryParser {

    public Validation<QueryFilterSpec> parse(MobilePostQueryParams params) {
        Validation<Language> lang = parseLanguage(params.getLang());
        if (!lang.isValid()) return lang.asFailure();

        Validation<Integer> page = parseInteger("page", params.getPage(), Paginator.DEFAULT_PAGE);
        if (!page.isValid()) return page.asFailure();
        Validation<Integer> limit = parseInteger("limit", params.getLimit(), Paginator.DEFAULT_LIMIT);
        if (!limit.isValid()) return limit.asFailure();
        Validation<PageWindow> window = Paginator.window(page.getValue(), limit.getValue());
        if (!window.isValid()) return window.asFailure();

        Validation<Integer> dayOfWeek = parseInteger("dayOfWeek", params.getDayOfWeek(), null);
        if (!dayOfWeek.isValid()) return dayOfWeek.asFailure();
        if (dayOfWeek.getValue() != null) {
            Validation<Integer> day = MobilePostValidators.validateDayOfWeek("dayOfWeek", dayOfWeek.getValue());
            if (!day.isValid()) return day.asFailure();
        }

        Validation<Integer> seq = parseInteger("seq", params.getSeq(), null);
        if (!seq.isValid()) return seq.asFailure();

        String openAt = blankToNull(params.getOpenAt());
        if (openAt != null) {
            Validation<String> time = MobilePostValidators.validateTime("openAt", openAt);
            if (!time.isValid()) return time.asFailure();
        }

        Validation<SortField> sortBy = parseSortField(params.getSortBy());
        if (!sortBy.isValid()) return sortBy.asFailure();
        Validation<SortDirection> sortDir = parseSortDirection(params.getSortDir());
        if (!sortDir.isValid()) return sortDir.asFailure();

        return Validation.valid(QueryFilterSpec.builder()
                .search(blankToNull(params.getSearch()))
                .district(blankToNull(params.getDistrict()))
                .dayOfWeek(dayOfWeek.getValue())
                .openAt(openAt)
                .mobileCode(blankToNull(params.getMobileCode()))
                .seq(seq.getValue())
                .page(window.getValue().page())
                .limit(window.getValue().limit())
                .sortBy(sortBy.getValue())
                .sortDir(sortDir.getValue())
                .lang(lang.getValue())
                .build());
    }

    public Validation<Language> parseLanguage(String raw) {
        String code = blankToNull(raw);
        if (code == null) {
            return Validation.valid(Language.EN);
        }
        return Language.fromCode(code)
                .map(Validation::valid)
                .orElseGet(() -> Validation.invalid(ErrorCode.INVALID_LANGUAGE, "lang",
                        "lang must be one of: en, tc, sc, all"));
    }

    private Validation<SortField> parseSortField(String raw) {
        String param = blankToNull(raw);
        if (param == null) {
            return Validation.valid(SortField.ID);
        }
        return SortField.fromParam(param)
                .map(Validation::valid)
                .orElseGet(() -> Validation.invalid(ErrorCode.INVALID_PARAMETER_VALUE, "sortBy",
                        "sortBy must be one of: " + SortField.allowedValues()));
    }

    private Validation<SortDirection> parseSortDirection(String raw) {
        String param = blankToNull(raw);
        if (param == null) {
            return Validation.valid(SortDirection.ASC);
        }
        return SortDirection.fromParam(param)
                .map(Validation::valid)
                .orElseGet(() -> Validation.invalid(ErrorCode.INVALID_PARAMETER_VALUE, "sortDir",
                        "sortDir must be asc or desc"));
    }

    private static Validation<Integer> parseInteger(String field, String raw, Integer defaultValue) {
        String value = blankToNull(raw);
        if (value == null) {
            return Validation.valid(defaultValue);
        }
        try {
            return Validation.valid(Integer.valueOf(value));
        } catch (NumberFormatException e) {
            return Validation.invalid(ErrorCode.INVALID_NUMERIC_VALUE, field, field + " must be an integer");
        }
    }

    private static String blankToNull(String s) {
        return StringUtils.hasText(s) ? s.trim() : null;
    }
}
