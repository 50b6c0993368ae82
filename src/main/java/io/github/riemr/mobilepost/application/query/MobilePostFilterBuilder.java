package io.github.riemr.mobilepost.application.query;

import io.github.riemr.mobilepost.application.validation.MobilePostValidators;
import io.github.riemr.mobilepost.domain.model.QueryFilterSpec;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class MobilePostFilterBuilder {

    public MobilePostFilter build(QueryFilterSpec spec) {
        String openAt = spec.getOpenAt() == null
                ? null
                : MobilePostValidators.validateTime("openAt", spec.getOpenAt()).orElseThrow();
        return MobilePostFilter.builder()
                .search(textOrNull(spec.getSearch()))
                .district(textOrNull(spec.getDistrict()))
                .dayOfWeek(spec.getDayOfWeek())
                .openAt(openAt)
                .mobileCode(textOrNull(spec.getMobileCode()))
                .seq(spec.getSeq())
                .build();
    }

    private static String textOrNull(String s) {
        return StringUtils.hasText(s) ? s.trim() : null;
    }
}
