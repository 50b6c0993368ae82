package io.github.riemr.mobilepost.application.query;

import io.github.riemr.mobilepost.domain.model.Language;
import io.github.riemr.mobilepost.domain.model.MobilePostFields;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Filter description handed to storage. Clauses are ANDed; the text clauses are ORed across
 * their language columns. The mapper renders it as SQL, {@link #matches} evaluates it in memory.
 */
@Value
@Builder
public class MobilePostFilter {
    public static final List<String> SEARCH_COLUMNS = columns(LocalizedField.values());
    public static final List<String> DISTRICT_COLUMNS = columns(LocalizedField.DISTRICT);

    String search;
    String district;
    Integer dayOfWeek;
    String openAt;
    String mobileCode;
    Integer seq;

    public static MobilePostFilter none() {
        return MobilePostFilter.builder().build();
    }

    public List<String> getSearchColumns() {
        return SEARCH_COLUMNS;
    }

    public List<String> getDistrictColumns() {
        return DISTRICT_COLUMNS;
    }

    /** ILIKE pattern for {@link #search}, with LIKE metacharacters escaped by backslash. */
    public String getSearchPattern() {
        return search == null ? null : likePattern(search);
    }

    public String getDistrictPattern() {
        return district == null ? null : likePattern(district);
    }

    public boolean matches(MobilePostFields record) {
        if (search != null && !containsAny(record, search, LocalizedField.values())) {
            return false;
        }
        if (district != null && !containsAny(record, district, LocalizedField.DISTRICT)) {
            return false;
        }
        if (dayOfWeek != null && !dayOfWeek.equals(record.getDayOfWeekCode())) {
            return false;
        }
        if (openAt != null && !isOpenAt(record, openAt)) {
            return false;
        }
        if (mobileCode != null && !mobileCode.equals(record.getMobileCode())) {
            return false;
        }
        return seq == null || seq.equals(record.getSeq());
    }

    /** Same-day containment {@code openHour <= t < closeHour}; overnight spans never match. */
    static boolean isOpenAt(MobilePostFields record, String time) {
        String open = record.getOpenHour();
        String close = record.getCloseHour();
        if (open == null || close == null) {
            return false;
        }
        return open.compareTo(time) <= 0 && close.compareTo(time) > 0;
    }

    private static boolean containsAny(MobilePostFields record, String term, LocalizedField... fields) {
        String needle = term.toLowerCase(Locale.ROOT);
        return Stream.of(fields)
                .flatMap(f -> Stream.of(f.raw(record, Language.EN), f.raw(record, Language.TC), f.raw(record, Language.SC)))
                .filter(Objects::nonNull)
                .anyMatch(v -> v.toLowerCase(Locale.ROOT).contains(needle));
    }

    private static String likePattern(String term) {
        String escaped = term.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        return "%" + escaped + "%";
    }

    private static List<String> columns(LocalizedField... fields) {
        return Stream.of(fields)
                .flatMap(f -> Stream.of(f.column(Language.EN), f.column(Language.TC), f.column(Language.SC)))
                .collect(Collectors.toUnmodifiableList());
    }
}
