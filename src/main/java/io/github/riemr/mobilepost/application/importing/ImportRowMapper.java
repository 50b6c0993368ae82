package io.github.riemr.mobilepost.application.importing;

import io.github.riemr.mobilepost.application.exception.ErrorCode;
import io.github.riemr.mobilepost.application.validation.MobilePostValidators;
import io.github.riemr.mobilepost.application.validation.Validation;
import io.github.riemr.mobilepost.domain.model.MobilePostFields;
import io.github.riemr.mobilepost.infrastructure.persistence.entity.MobilePost;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalises one raw row into a candidate record and runs the creation validators on it.
 * Never throws for bad input: every problem becomes a {@link RowOutcome.Rejected}.
 */
@Component
public class ImportRowMapper {
    private static final Pattern LOOSE_TIME = Pattern.compile("^(\\d{1,2}):(\\d{2})(?::00)?$");

    public RowOutcome map(ImportRow row) {
        MobilePost candidate = new MobilePost();
        candidate.setMobileCode(text(row, "mobileCode"));
        candidate.setNameEN(text(row, "nameEN"));
        candidate.setNameTC(text(row, "nameTC"));
        candidate.setNameSC(text(row, "nameSC"));
        candidate.setDistrictEN(text(row, "districtEN"));
        candidate.setDistrictTC(text(row, "districtTC"));
        candidate.setDistrictSC(text(row, "districtSC"));
        candidate.setLocationEN(text(row, "locationEN"));
        candidate.setLocationTC(text(row, "locationTC"));
        candidate.setLocationSC(text(row, "locationSC"));
        candidate.setAddressEN(text(row, "addressEN"));
        candidate.setAddressTC(text(row, "addressTC"));
        candidate.setAddressSC(text(row, "addressSC"));
        candidate.setOpenHour(time(text(row, "openHour")));
        candidate.setCloseHour(time(text(row, "closeHour")));

        Validation<Integer> seq = integer(row, "seq");
        if (!seq.isValid()) return RowOutcome.Rejected.of(row, seq.getFailure());
        candidate.setSeq(seq.getValue());

        Validation<Integer> day = integer(row, "dayOfWeekCode");
        if (!day.isValid()) return RowOutcome.Rejected.of(row, day.getFailure());
        candidate.setDayOfWeekCode(day.getValue());

        Validation<Double> latitude = decimal(row, "latitude");
        if (!latitude.isValid()) return RowOutcome.Rejected.of(row, latitude.getFailure());
        candidate.setLatitude(latitude.getValue());

        Validation<Double> longitude = decimal(row, "longitude");
        if (!longitude.isValid()) return RowOutcome.Rejected.of(row, longitude.getFailure());
        candidate.setLongitude(longitude.getValue());

        Validation<MobilePostFields> checked = MobilePostValidators.validateForCreate(candidate);
        if (!checked.isValid()) {
            return RowOutcome.Rejected.of(row, checked.getFailure());
        }
        return new RowOutcome.Accepted(row, candidate, DedupKey.of(candidate));
    }

    private static String text(ImportRow row, String field) {
        Object raw = row.get(field);
        if (raw == null) {
            return null;
        }
        String s = raw.toString().trim();
        return s.isEmpty() ? null : s;
    }

    /** {@code 9:30} becomes {@code 09:30}, {@code 09:30:00} becomes {@code 09:30}; anything else is left for the validator. */
    static String time(String raw) {
        if (raw == null) {
            return null;
        }
        Matcher m = LOOSE_TIME.matcher(raw);
        if (!m.matches()) {
            return raw;
        }
        String hour = m.group(1).length() == 1 ? "0" + m.group(1) : m.group(1);
        return hour + ":" + m.group(2);
    }

    private static Validation<Integer> integer(ImportRow row, String field) {
        Object raw = row.get(field);
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short) {
            return Validation.valid(((Number) raw).intValue());
        }
        String s = raw == null ? null : raw.toString().trim();
        if (!StringUtils.hasText(s)) {
            return Validation.valid(null);
        }
        try {
            return Validation.valid(new BigDecimal(s).intValueExact());
        } catch (NumberFormatException | ArithmeticException e) {
            return Validation.invalid(ErrorCode.INVALID_NUMERIC_VALUE, field, field + " must be an integer, got '" + s + "'");
        }
    }

    private static Validation<Double> decimal(ImportRow row, String field) {
        Object raw = row.get(field);
        if (raw instanceof Number) {
            return Validation.valid(((Number) raw).doubleValue());
        }
        String s = raw == null ? null : raw.toString().trim();
        if (!StringUtils.hasText(s)) {
            return Validation.valid(null);
        }
        try {
            return Validation.valid(Double.valueOf(s));
        } catch (NumberFormatException e) {
            return Validation.invalid(ErrorCode.INVALID_NUMERIC_VALUE, field, field + " must be a number, got '" + s + "'");
        }
    }
}
