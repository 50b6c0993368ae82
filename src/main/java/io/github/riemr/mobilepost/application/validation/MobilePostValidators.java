package io.github.riemr.mobilepost.application.validation;

import io.github.riemr.mobilepost.application.exception.ErrorCode;
import io.github.riemr.mobilepost.application.query.PageWindow;
import io.github.riemr.mobilepost.domain.model.MobilePostFields;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Pure checks shared by the request layer and the import pipeline.
 */
public final class MobilePostValidators {
    public static final int MAX_LIMIT = 200;
    public static final int MAX_CODE_LENGTH = 32;
    public static final int MAX_NAME_LENGTH = 255;
    public static final int MAX_TEXT_LENGTH = 500;

    private static final Pattern TIME = Pattern.compile("^([01]\\d|2[0-3]):[0-5]\\d$");

    private MobilePostValidators() {}

    public static Validation<String> validateTime(String value) {
        return validateTime("time", value);
    }

    public static Validation<String> validateTime(String field, String value) {
        if (value == null || !TIME.matcher(value).matches()) {
            return Validation.invalid(ErrorCode.INVALID_TIME_FORMAT, field,
                    field + " must be a valid time in HH:MM format (00:00-23:59)");
        }
        return Validation.valid(value);
    }

    public static Validation<Integer> validateDayOfWeek(Integer value) {
        return validateDayOfWeek("dayOfWeekCode", value);
    }

    public static Validation<Integer> validateDayOfWeek(String field, Integer value) {
        if (value == null || value < 1 || value > 7) {
            return Validation.invalid(ErrorCode.INVALID_PARAMETER_VALUE, field,
                    field + " must be an integer between 1 (Monday) and 7 (Sunday)");
        }
        return Validation.valid(value);
    }

    /**
     * Latitude and longitude travel as a pair. Valid with a {@code null} value when both are absent.
     */
    public static Validation<GeoPoint> validateCoordinates(Double latitude, Double longitude) {
        List<String> fields = List.of("latitude", "longitude");
        if (latitude == null && longitude == null) {
            return Validation.valid(null);
        }
        if (latitude == null || longitude == null) {
            return Validation.invalid(ErrorCode.INVALID_PARAMETER_VALUE, fields,
                    "latitude and longitude must be provided together");
        }
        if (latitude.isNaN() || latitude < -90 || latitude > 90) {
            return Validation.invalid(ErrorCode.INVALID_PARAMETER_VALUE, "latitude",
                    "latitude must be between -90 and 90");
        }
        if (longitude.isNaN() || longitude < -180 || longitude > 180) {
            return Validation.invalid(ErrorCode.INVALID_PARAMETER_VALUE, "longitude",
                    "longitude must be between -180 and 180");
        }
        return Validation.valid(new GeoPoint(latitude, longitude));
    }

    public static Validation<MobilePostFields> validateRequiredGroups(MobilePostFields record) {
        boolean hasName = anyText(record.getNameEN(), record.getNameTC(), record.getNameSC());
        boolean hasDistrict = anyText(record.getDistrictEN(), record.getDistrictTC(), record.getDistrictSC());
        if (!hasName && !hasDistrict) {
            return Validation.invalid(ErrorCode.MISSING_REQUIRED_FIELD, List.of("name", "district"),
                    "At least one name (nameEN, nameTC, nameSC) and one district (districtEN, districtTC, districtSC) are required");
        }
        if (!hasName) {
            return Validation.invalid(ErrorCode.MISSING_REQUIRED_FIELD, List.of("nameEN", "nameTC", "nameSC"),
                    "At least one of nameEN, nameTC or nameSC is required");
        }
        if (!hasDistrict) {
            return Validation.invalid(ErrorCode.MISSING_REQUIRED_FIELD, List.of("districtEN", "districtTC", "districtSC"),
                    "At least one of districtEN, districtTC or districtSC is required");
        }
        return Validation.valid(record);
    }

    public static Validation<PageWindow> validatePagination(int page, int limit) {
        if (page < 1) {
            return Validation.invalid(ErrorCode.INVALID_PARAMETER_VALUE, "page", "page must be at least 1");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            return Validation.invalid(ErrorCode.INVALID_PARAMETER_VALUE, "limit",
                    "limit must be between 1 and " + MAX_LIMIT);
        }
        return Validation.valid(new PageWindow(page, limit));
    }

    /** Creation: required groups first, then every field that is present. */
    public static Validation<MobilePostFields> validateForCreate(MobilePostFields record) {
        return validateRequiredGroups(record).flatMap(MobilePostValidators::validatePresentFields);
    }

    /** Partial update: the payload must carry something, and whatever it carries must be valid. */
    public static Validation<MobilePostFields> validateForUpdate(MobilePostFields changes) {
        if (changes == null || !hasAnyField(changes)) {
            return Validation.invalid(ErrorCode.NO_UPDATABLE_FIELDS, List.of(),
                    "Update request must contain at least one updatable field");
        }
        return validatePresentFields(changes);
    }

    public static Validation<MobilePostFields> validatePresentFields(MobilePostFields record) {
        Validation<MobilePostFields> lengths = validateLengths(record);
        if (!lengths.isValid()) return lengths;
        if (record.getOpenHour() != null) {
            Validation<String> open = validateTime("openHour", record.getOpenHour());
            if (!open.isValid()) return open.asFailure();
        }
        if (record.getCloseHour() != null) {
            Validation<String> close = validateTime("closeHour", record.getCloseHour());
            if (!close.isValid()) return close.asFailure();
        }
        if (record.getDayOfWeekCode() != null) {
            Validation<Integer> day = validateDayOfWeek(record.getDayOfWeekCode());
            if (!day.isValid()) return day.asFailure();
        }
        Validation<GeoPoint> coordinates = validateCoordinates(record.getLatitude(), record.getLongitude());
        if (!coordinates.isValid()) return coordinates.asFailure();
        return Validation.valid(record);
    }

    /** Text columns are bounded in storage, mobileCode hardest of all. */
    public static Validation<MobilePostFields> validateLengths(MobilePostFields record) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("mobileCode", record.getMobileCode());
        values.put("nameEN", record.getNameEN());
        values.put("nameTC", record.getNameTC());
        values.put("nameSC", record.getNameSC());
        values.put("districtEN", record.getDistrictEN());
        values.put("districtTC", record.getDistrictTC());
        values.put("districtSC", record.getDistrictSC());
        values.put("locationEN", record.getLocationEN());
        values.put("locationTC", record.getLocationTC());
        values.put("locationSC", record.getLocationSC());
        values.put("addressEN", record.getAddressEN());
        values.put("addressTC", record.getAddressTC());
        values.put("addressSC", record.getAddressSC());
        for (Map.Entry<String, String> entry : values.entrySet()) {
            int max = maxLength(entry.getKey());
            if (entry.getValue() != null && entry.getValue().length() > max) {
                return Validation.invalid(ErrorCode.INVALID_PARAMETER_VALUE, entry.getKey(),
                        entry.getKey() + " must be at most " + max + " characters");
            }
        }
        return Validation.valid(record);
    }

    private static int maxLength(String field) {
        if (field.equals("mobileCode")) {
            return MAX_CODE_LENGTH;
        }
        if (field.startsWith("name") || field.startsWith("district")) {
            return MAX_NAME_LENGTH;
        }
        return MAX_TEXT_LENGTH;
    }

    public static boolean hasAnyField(MobilePostFields f) {
        return Stream.of(f.getMobileCode(), f.getSeq(),
                        f.getNameEN(), f.getNameTC(), f.getNameSC(),
                        f.getDistrictEN(), f.getDistrictTC(), f.getDistrictSC(),
                        f.getLocationEN(), f.getLocationTC(), f.getLocationSC(),
                        f.getAddressEN(), f.getAddressTC(), f.getAddressSC(),
                        f.getOpenHour(), f.getCloseHour(), f.getDayOfWeekCode(),
                        f.getLatitude(), f.getLongitude())
                .anyMatch(Objects::nonNull);
    }

    private static boolean anyText(String... values) {
        return Stream.of(values).anyMatch(StringUtils::hasText);
    }

    public record GeoPoint(double latitude, double longitude) {}
}
