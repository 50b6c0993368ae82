package io.github.riemr.mobilepost.application.query;

import io.github.riemr.mobilepost.application.dto.MobilePostAllLanguagesView;
import io.github.riemr.mobilepost.application.dto.MobilePostView;
import io.github.riemr.mobilepost.application.dto.MobilePostLocalizedView;
import io.github.riemr.mobilepost.domain.model.Language;
import io.github.riemr.mobilepost.domain.model.MobilePostFields;
import io.github.riemr.mobilepost.infrastructure.persistence.entity.MobilePost;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns stored rows into the language projection a client asked for.
 * Fallback stops at English: requested value, else English, else empty string.
 */
@Component
public class LanguageResolver {

    public String resolve(MobilePostFields record, LocalizedField field, Language language) {
        String requested = field.raw(record, language);
        if (StringUtils.hasText(requested)) {
            return requested;
        }
        String english = field.raw(record, Language.EN);
        return StringUtils.hasText(english) ? english : "";
    }

    /**
     * Ordering key matching {@code COALESCE(NULLIF(requested, ''), NULLIF(en, ''), '')}. Only the empty
     * string falls through, so a whitespace-only value sorts as itself.
     */
    public String sortKey(MobilePostFields record, LocalizedField field, Language language) {
        String requested = field.raw(record, language);
        if (requested != null && !requested.isEmpty()) {
            return requested;
        }
        String english = field.raw(record, Language.EN);
        return english != null ? english : "";
    }

    public MobilePostView project(MobilePost post, Language language) {
        if (language == Language.ALL) {
            return allLanguages(post);
        }
        return MobilePostLocalizedView.builder()
                .id(post.getId())
                .mobileCode(post.getMobileCode())
                .seq(post.getSeq())
                .name(resolve(post, LocalizedField.NAME, language))
                .district(resolve(post, LocalizedField.DISTRICT, language))
                .location(resolve(post, LocalizedField.LOCATION, language))
                .address(resolve(post, LocalizedField.ADDRESS, language))
                .openHour(post.getOpenHour())
                .closeHour(post.getCloseHour())
                .dayOfWeekCode(post.getDayOfWeekCode())
                .latitude(post.getLatitude())
                .longitude(post.getLongitude())
                .importedAt(post.getImportedAt())
                .updatedAt(post.getUpdatedAt())
                .build();
    }

    public List<MobilePostView> project(List<MobilePost> posts, Language language) {
        return posts.stream().map(p -> project(p, language)).collect(Collectors.toList());
    }

    private MobilePostView allLanguages(MobilePost post) {
        return MobilePostAllLanguagesView.builder()
                .id(post.getId())
                .mobileCode(post.getMobileCode())
                .seq(post.getSeq())
                .nameEN(nullToEmpty(post.getNameEN()))
                .nameTC(nullToEmpty(post.getNameTC()))
                .nameSC(nullToEmpty(post.getNameSC()))
                .districtEN(nullToEmpty(post.getDistrictEN()))
                .districtTC(nullToEmpty(post.getDistrictTC()))
                .districtSC(nullToEmpty(post.getDistrictSC()))
                .locationEN(nullToEmpty(post.getLocationEN()))
                .locationTC(nullToEmpty(post.getLocationTC()))
                .locationSC(nullToEmpty(post.getLocationSC()))
                .addressEN(nullToEmpty(post.getAddressEN()))
                .addressTC(nullToEmpty(post.getAddressTC()))
                .addressSC(nullToEmpty(post.getAddressSC()))
                .name(resolve(post, LocalizedField.NAME, Language.EN))
                .district(resolve(post, LocalizedField.DISTRICT, Language.EN))
                .openHour(post.getOpenHour())
                .closeHour(post.getCloseHour())
                .dayOfWeekCode(post.getDayOfWeekCode())
                .latitude(post.getLatitude())
                .longitude(post.getLongitude())
                .importedAt(post.getImportedAt())
                .updatedAt(post.getUpdatedAt())
                .build();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
