package io.github.riemr.mobilepost.application.query;

import io.github.riemr.mobilepost.domain.model.Language;
import io.github.riemr.mobilepost.domain.model.SortDirection;
import io.github.riemr.mobilepost.domain.model.SortField;
import io.github.riemr.mobilepost.infrastructure.persistence.entity.MobilePost;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static io.github.riemr.mobilepost.support.MobilePosts.mobilePost;
import static org.assertj.core.api.Assertions.assertThat;

class SortResolverTest {

    private final SortResolver resolver = new SortResolver(new LanguageResolver());

    @Test
    void resolve_id_ordersById() {
        SortSpec sort = resolver.resolve(SortField.ID, SortDirection.DESC, Language.EN);

        assertThat(sort.getOrderByClause()).isEqualTo("id DESC");
    }

    @Test
    void resolve_column_appendsNullsPlacement_andTieBreak() {
        assertThat(resolver.resolve(SortField.OPEN_HOUR, SortDirection.ASC, Language.EN).getOrderByClause())
                .isEqualTo("open_hour ASC NULLS LAST, id ASC");
        assertThat(resolver.resolve(SortField.SEQ, SortDirection.DESC, Language.EN).getOrderByClause())
                .isEqualTo("seq DESC NULLS FIRST, id ASC");
    }

    @Test
    void resolve_name_usesLanguageFallbackExpression() {
        assertThat(resolver.resolve(SortField.NAME, SortDirection.ASC, Language.TC).getOrderByClause())
                .isEqualTo("COALESCE(NULLIF(name_tc, ''), NULLIF(name_en, ''), '') ASC, id ASC");
        assertThat(resolver.resolve(SortField.DISTRICT, SortDirection.DESC, Language.ALL).getOrderByClause())
                .isEqualTo("COALESCE(NULLIF(district_en, ''), '') DESC, id ASC");
    }

    @Test
    void comparator_sortsByResolvedName_withAscendingIdTieBreak() {
        MobilePost a = mobilePost(3L, "A", 1, "Beta", "X");
        MobilePost b = mobilePost(1L, "B", 1, "Zeta", "X");
        b.setNameTC("甲");
        MobilePost c = mobilePost(2L, "C", 1, "Beta", "X");

        SortSpec sort = resolver.resolve(SortField.NAME, SortDirection.DESC, Language.TC);
        List<Long> ids = List.of(a, b, c).stream().sorted(sort.getComparator())
                .map(MobilePost::getId).collect(Collectors.toList());

        // "甲" sorts after the latin names; equal names keep ascending id
        assertThat(ids).containsExactly(1L, 2L, 3L);
    }

    @Test
    void comparator_fallsBackOnlyForEmptyLocalizedName_likeNullIf() {
        MobilePost blankTc = mobilePost(1L, "A", 1, "Zeta", "X");
        blankTc.setNameTC(" ");
        MobilePost noTc = mobilePost(2L, "B", 1, "Alpha", "X");
        MobilePost emptyTc = mobilePost(3L, "C", 1, "Beta", "X");
        emptyTc.setNameTC("");

        SortSpec sort = resolver.resolve(SortField.NAME, SortDirection.ASC, Language.TC);
        List<Long> ids = List.of(noTc, emptyTc, blankTc).stream().sorted(sort.getComparator())
                .map(MobilePost::getId).collect(Collectors.toList());

        // " " is kept as the key, the same as NULLIF(name_tc, '') in SQL
        assertThat(ids).containsExactly(1L, 2L, 3L);
    }

    @Test
    void comparator_placesNullsLastAscending() {
        MobilePost withSeq = mobilePost(2L, "A", 5, "n", "d");
        MobilePost noSeq = mobilePost(1L, "B", null, "n", "d");

        SortSpec sort = resolver.resolve(SortField.SEQ, SortDirection.ASC, Language.EN);
        List<Long> ids = List.of(noSeq, withSeq).stream().sorted(sort.getComparator())
                .map(MobilePost::getId).collect(Collectors.toList());

        assertThat(ids).containsExactly(2L, 1L);
    }
}
