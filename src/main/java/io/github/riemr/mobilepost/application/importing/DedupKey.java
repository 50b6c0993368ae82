package io.github.riemr.mobilepost.application.importing;

import io.github.riemr.mobilepost.domain.model.MobilePostFields;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.stream.Stream;

/**
 * Identity of an input row for duplicate detection. Uses {@code (mobileCode, seq)} when both are present,
 * otherwise the normalised {@code (name, district, openHour, dayOfWeekCode)} tuple, where name and
 * district are the English value or, failing that, the first non-empty translation.
 */
public record DedupKey(String mobileCode, Integer seq,
                       String name, String district, String openHour, Integer dayOfWeekCode) {

    public static DedupKey of(MobilePostFields f) {
        if (StringUtils.hasText(f.getMobileCode()) && f.getSeq() != null) {
            return new DedupKey(f.getMobileCode().trim(), f.getSeq(), null, null, null, null);
        }
        return new DedupKey(null, null,
                normalize(firstText(f.getNameEN(), f.getNameTC(), f.getNameSC())),
                normalize(firstText(f.getDistrictEN(), f.getDistrictTC(), f.getDistrictSC())),
                f.getOpenHour(),
                f.getDayOfWeekCode());
    }

    public boolean isNaturalKey() {
        return mobileCode != null;
    }

    private static String firstText(String... values) {
        return Stream.of(values).filter(StringUtils::hasText).findFirst().orElse(null);
    }

    private static String normalize(String s) {
        return s == null ? null : s.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
