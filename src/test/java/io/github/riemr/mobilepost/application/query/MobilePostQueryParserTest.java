package io.github.riemr.mobilepost.application.query;

import io.github.riemr.mobilepost.application.dto.MobilePostQueryParams;
import io.github.riemr.mobilepost.application.exception.ErrorCode;
import io.github.riemr.mobilepost.application.validation.Validation;
import io.github.riemr.mobilepost.domain.model.Language;
import io.github.riemr.mobilepost.domain.model.QueryFilterSpec;
import io.github.riemr.mobilepost.domain.model.SortDirection;
import io.github.riemr.mobilepost.domain.model.SortField;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MobilePostQueryParserTest {

    private final MobilePostQueryParser parser = new MobilePostQueryParser();

    @Test
    void parse_appliesDefaults_whenNothingGiven() {
        QueryFilterSpec spec = parser.parse(new MobilePostQueryParams()).getValue();

        assertThat(spec.getPage()).isEqualTo(1);
        assertThat(spec.getLimit()).isEqualTo(20);
        assertThat(spec.getSortBy()).isEqualTo(SortField.ID);
        assertThat(spec.getSortDir()).isEqualTo(SortDirection.ASC);
        assertThat(spec.getLang()).isEqualTo(Language.EN);
        assertThat(spec.getSearch()).isNull();
    }

    @Test
    void parse_readsEveryParameter() {
        MobilePostQueryParams params = new MobilePostQueryParams();
        params.setSearch(" tsing ");
        params.setDistrict("Kwai Tsing");
        params.setDayOfWeek("3");
        params.setOpenAt("10:30");
        params.setMobileCode("MO1");
        params.setSeq("2");
        params.setPage("2");
        params.setLimit("50");
        params.setSortBy("name");
        params.setSortDir("desc");
        params.setLang("tc");

        QueryFilterSpec spec = parser.parse(params).getValue();

        assertThat(spec.getSearch()).isEqualTo("tsing");
        assertThat(spec.getDayOfWeek()).isEqualTo(3);
        assertThat(spec.getOpenAt()).isEqualTo("10:30");
        assertThat(spec.getSeq()).isEqualTo(2);
        assertThat(spec.getPage()).isEqualTo(2);
        assertThat(spec.getLimit()).isEqualTo(50);
        assertThat(spec.getSortBy()).isEqualTo(SortField.NAME);
        assertThat(spec.getSortDir()).isEqualTo(SortDirection.DESC);
        assertThat(spec.getLang()).isEqualTo(Language.TC);
    }

    @Test
    void parse_checksLanguageBeforeAnythingElse() {
        MobilePostQueryParams params = new MobilePostQueryParams();
        params.setLang("fr");
        params.setPage("zero");

        Validation<QueryFilterSpec> result = parser.parse(params);

        assertThat(result.getFailure().code()).isEqualTo(ErrorCode.INVALID_LANGUAGE);
    }

    @Test
    void parse_rejectsNonNumericPage_with0106() {
        MobilePostQueryParams params = new MobilePostQueryParams();
        params.setPage("abc");

        assertThat(parser.parse(params).getFailure().code()).isEqualTo(ErrorCode.INVALID_NUMERIC_VALUE);
    }

    @Test
    void parse_rejectsOutOfRangeValues_with0103() {
        MobilePostQueryParams limit = new MobilePostQueryParams();
        limit.setLimit("201");
        MobilePostQueryParams day = new MobilePostQueryParams();
        day.setDayOfWeek("8");
        MobilePostQueryParams sort = new MobilePostQueryParams();
        sort.setSortBy("latitude");
        MobilePostQueryParams dir = new MobilePostQueryParams();
        dir.setSortDir("up");

        assertThat(parser.parse(limit).getFailure().code()).isEqualTo(ErrorCode.INVALID_PARAMETER_VALUE);
        assertThat(parser.parse(day).getFailure().code()).isEqualTo(ErrorCode.INVALID_PARAMETER_VALUE);
        assertThat(parser.parse(sort).getFailure().code()).isEqualTo(ErrorCode.INVALID_PARAMETER_VALUE);
        assertThat(parser.parse(dir).getFailure().code()).isEqualTo(ErrorCode.INVALID_PARAMETER_VALUE);
    }

    @Test
    void parse_rejectsBadOpenAt_with0104() {
        MobilePostQueryParams params = new MobilePostQueryParams();
        params.setOpenAt("25:00");

        assertThat(parser.parse(params).getFailure().code()).isEqualTo(ErrorCode.INVALID_TIME_FORMAT);
    }

    @Test
    void parseLanguage_defaultsToEnglish() {
        assertThat(parser.parseLanguage("all").getValue()).isEqualTo(Language.ALL);
        assertThat(parser.parseLanguage(null).getValue()).isEqualTo(Language.EN);
        assertThat(parser.parseLanguage("EN").getFailure().code()).isEqualTo(ErrorCode.INVALID_LANGUAGE);
    }
}
