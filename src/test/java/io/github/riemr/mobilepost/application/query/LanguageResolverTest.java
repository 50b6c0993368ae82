package io.github.riemr.mobilepost.application.query;

import io.github.riemr.mobilepost.application.dto.MobilePostAllLanguagesView;
import io.github.riemr.mobilepost.application.dto.MobilePostLocalizedView;
import io.github.riemr.mobilepost.domain.model.Language;
import io.github.riemr.mobilepost.infrastructure.persistence.entity.MobilePost;
import org.junit.jupiter.api.Test;

import static io.github.riemr.mobilepost.support.MobilePosts.mobilePost;
import static org.assertj.core.api.Assertions.assertThat;

class LanguageResolverTest {

    private final LanguageResolver resolver = new LanguageResolver();

    @Test
    void resolve_returnsRequestedLanguage_whenPresent() {
        MobilePost p = mobilePost(1L, "MO1", 1, "Tsing Yi", "Kwai Tsing");
        p.setNameTC("青衣");

        assertThat(resolver.resolve(p, LocalizedField.NAME, Language.TC)).isEqualTo("青衣");
    }

    @Test
    void resolve_fallsBackToEnglish_thenEmpty() {
        MobilePost p = mobilePost(1L, "MO1", 1, "Tsing Yi", null);
        p.setNameSC("");

        assertThat(resolver.resolve(p, LocalizedField.NAME, Language.SC)).isEqualTo("Tsing Yi");
        assertThat(resolver.resolve(p, LocalizedField.DISTRICT, Language.SC)).isEmpty();
    }

    @Test
    void sortKey_keepsWhitespaceValue_andFallsBackOnlyWhenEmpty() {
        MobilePost p = mobilePost(1L, "MO1", 1, "Tsing Yi", "Kwai Tsing");
        p.setNameTC("  ");
        p.setDistrictTC("");

        assertThat(resolver.sortKey(p, LocalizedField.NAME, Language.TC)).isEqualTo("  ");
        assertThat(resolver.sortKey(p, LocalizedField.DISTRICT, Language.TC)).isEqualTo("Kwai Tsing");
        assertThat(resolver.sortKey(p, LocalizedField.LOCATION, Language.TC)).isEmpty();
    }

    @Test
    void resolve_neverFallsBackToOtherChineseVariant() {
        MobilePost p = mobilePost(1L, "MO1", 1, null, "Kwai Tsing");
        p.setNameTC("青衣");

        assertThat(resolver.resolve(p, LocalizedField.NAME, Language.SC)).isEmpty();
    }

    @Test
    void project_singleLanguage_hasResolvedFields() {
        MobilePost p = mobilePost(5L, "MO5", 2, "Tai Po", "Tai Po");
        p.setDistrictTC("大埔");
        p.setAddressEN("Tai Po Market");

        MobilePostLocalizedView view = (MobilePostLocalizedView) resolver.project(p, Language.TC);

        assertThat(view.getId()).isEqualTo(5L);
        assertThat(view.getName()).isEqualTo("Tai Po");
        assertThat(view.getDistrict()).isEqualTo("大埔");
        assertThat(view.getAddress()).isEqualTo("Tai Po Market");
        assertThat(view.getLocation()).isEmpty();
        assertThat(view.getOpenHour()).isEqualTo("09:00");
    }

    @Test
    void project_all_keepsEveryColumn_withEnglishAliases() {
        MobilePost p = mobilePost(7L, "MO7", 1, null, "Sha Tin");
        p.setNameTC("沙田");

        MobilePostAllLanguagesView view = (MobilePostAllLanguagesView) resolver.project(p, Language.ALL);

        assertThat(view.getNameEN()).isEmpty();
        assertThat(view.getNameTC()).isEqualTo("沙田");
        assertThat(view.getNameSC()).isEmpty();
        assertThat(view.getDistrictEN()).isEqualTo("Sha Tin");
        assertThat(view.getName()).isEmpty();
        assertThat(view.getDistrict()).isEqualTo("Sha Tin");
    }
}
