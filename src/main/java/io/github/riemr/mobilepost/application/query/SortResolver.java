package io.github.riemr.mobilepost.application.query;

import io.github.riemr.mobilepost.domain.model.Language;
import io.github.riemr.mobilepost.domain.model.SortDirection;
import io.github.riemr.mobilepost.domain.model.SortField;
import io.github.riemr.mobilepost.infrastructure.persistence.entity.MobilePost;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.function.Function;

/**
 * Maps a sort key and direction to a physical ordering. {@code name} and {@code district} are
 * virtual keys ordered by the value the client sees in the requested language.
 */
@Component
@RequiredArgsConstructor
public class SortResolver {
    private static final String TIE_BREAK = "id ASC";

    private final LanguageResolver languageResolver;

    public SortSpec resolve(SortField field, SortDirection direction, Language language) {
        Language effective = language.effective();
        switch (field) {
            case NAME:
                return localized(field, direction, LocalizedField.NAME, effective);
            case DISTRICT:
                return localized(field, direction, LocalizedField.DISTRICT, effective);
            case SEQ:
                return column(field, direction, "seq", MobilePost::getSeq);
            case OPEN_HOUR:
                return column(field, direction, "open_hour", MobilePost::getOpenHour);
            case CLOSE_HOUR:
                return column(field, direction, "close_hour", MobilePost::getCloseHour);
            case ID:
            default:
                Comparator<MobilePost> byId = Comparator.comparing(MobilePost::getId, Comparator.nullsLast(Comparator.naturalOrder()));
                return new SortSpec(field, direction, "id " + direction.getSql(),
                        direction == SortDirection.DESC ? byId.reversed() : byId);
        }
    }

    private SortSpec localized(SortField field, SortDirection direction, LocalizedField localized, Language language) {
        String english = localized.column(Language.EN);
        String expression = language == Language.EN
                ? "COALESCE(NULLIF(" + english + ", ''), '')"
                : "COALESCE(NULLIF(" + localized.column(language) + ", ''), NULLIF(" + english + ", ''), '')";
        Comparator<MobilePost> key = Comparator.comparing(p -> languageResolver.sortKey(p, localized, language));
        return new SortSpec(field, direction,
                expression + " " + direction.getSql() + ", " + TIE_BREAK,
                withTieBreak(direction == SortDirection.DESC ? key.reversed() : key));
    }

    private <U extends Comparable<? super U>> SortSpec column(SortField field, SortDirection direction,
                                                               String column, Function<MobilePost, U> getter) {
        // NULLS placement mirrors the PostgreSQL default so SQL and in-memory order agree
        Comparator<MobilePost> key = Comparator.comparing(getter, Comparator.nullsLast(Comparator.<U>naturalOrder()));
        String nulls = direction == SortDirection.DESC ? " NULLS FIRST" : " NULLS LAST";
        return new SortSpec(field, direction,
                column + " " + direction.getSql() + nulls + ", " + TIE_BREAK,
                withTieBreak(direction == SortDirection.DESC ? key.reversed() : key));
    }

    private static Comparator<MobilePost> withTieBreak(Comparator<MobilePost> primary) {
        return primary.thenComparing(MobilePost::getId, Comparator.nullsLast(Comparator.naturalOrder()));
    }
}
