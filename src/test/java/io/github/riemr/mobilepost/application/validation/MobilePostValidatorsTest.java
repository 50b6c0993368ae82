package io.github.riemr.mobilepost.application.validation;

import io.github.riemr.mobilepost.application.dto.MobilePostRequest;
import io.github.riemr.mobilepost.application.exception.ApiException;
import io.github.riemr.mobilepost.application.exception.ErrorCode;
import io.github.riemr.mobilepost.domain.model.MobilePostFields;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MobilePostValidatorsTest {

    @ParameterizedTest
    @ValueSource(strings = {"00:00", "09:30", "23:59", "19:05"})
    void validateTime_accepts_wellFormedTimes(String value) {
        assertThat(MobilePostValidators.validateTime(value).isValid()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"24:00", "9:30", "12:60", "12:5", "noon", "", "09:30:00"})
    void validateTime_rejects_malformedTimes(String value) {
        Validation<String> result = MobilePostValidators.validateTime("openHour", value);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getFailure().code()).isEqualTo(ErrorCode.INVALID_TIME_FORMAT);
        assertThat(result.getFailure().fields()).containsExactly("openHour");
        assertThat(result.getFailure().message()).contains("valid time");
    }

    @Test
    void validateDayOfWeek_acceptsOneToSeven_only() {
        assertThat(MobilePostValidators.validateDayOfWeek(1).isValid()).isTrue();
        assertThat(MobilePostValidators.validateDayOfWeek(7).isValid()).isTrue();
        assertThat(MobilePostValidators.validateDayOfWeek(0).getFailure().code()).isEqualTo(ErrorCode.INVALID_PARAMETER_VALUE);
        assertThat(MobilePostValidators.validateDayOfWeek(8).getFailure().code()).isEqualTo(ErrorCode.INVALID_PARAMETER_VALUE);
    }

    @Test
    void validateCoordinates_validWithoutValue_whenBothAbsent() {
        Validation<MobilePostValidators.GeoPoint> result = MobilePostValidators.validateCoordinates(null, null);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getValue()).isNull();
    }

    @Test
    void validateCoordinates_fails_whenOnlyOneProvided() {
        Validation<MobilePostValidators.GeoPoint> result = MobilePostValidators.validateCoordinates(22.3, null);

        assertThat(result.getFailure().code()).isEqualTo(ErrorCode.INVALID_PARAMETER_VALUE);
        assertThat(result.getFailure().fields()).containsExactly("latitude", "longitude");
    }

    @Test
    void validateCoordinates_checksRanges() {
        assertThat(MobilePostValidators.validateCoordinates(90.0, 180.0).isValid()).isTrue();
        assertThat(MobilePostValidators.validateCoordinates(-90.5, 114.0).getFailure().fields()).containsExactly("latitude");
        assertThat(MobilePostValidators.validateCoordinates(22.3, 180.01).getFailure().fields()).containsExactly("longitude");
    }

    @Test
    void validateRequiredGroups_acceptsAnyLanguage() {
        MobilePostRequest r = new MobilePostRequest();
        r.setNameSC("流动邮局");
        r.setDistrictTC("葵青");

        assertThat(MobilePostValidators.validateRequiredGroups(r).isValid()).isTrue();
    }

    @Test
    void validateRequiredGroups_fails0101_whenDistrictMissing() {
        MobilePostRequest r = new MobilePostRequest();
        r.setNameEN("Mobile Post Office 1");
        r.setDistrictEN("   ");

        Validation<MobilePostFields> result = MobilePostValidators.validateRequiredGroups(r);

        assertThat(result.getFailure().code()).isEqualTo(ErrorCode.MISSING_REQUIRED_FIELD);
        assertThat(result.getFailure().fields()).containsExactly("districtEN", "districtTC", "districtSC");
    }

    @Test
    void validatePagination_enforcesBounds() {
        assertThat(MobilePostValidators.validatePagination(1, 200).isValid()).isTrue();
        assertThat(MobilePostValidators.validatePagination(0, 20).getFailure().fields()).containsExactly("page");
        assertThat(MobilePostValidators.validatePagination(1, 0).getFailure().fields()).containsExactly("limit");
        assertThat(MobilePostValidators.validatePagination(1, 201).getFailure().code()).isEqualTo(ErrorCode.INVALID_PARAMETER_VALUE);
    }

    @Test
    void validateForUpdate_fails0102_whenNothingSupplied() {
        assertThat(MobilePostValidators.validateForUpdate(new MobilePostRequest()).getFailure().code())
                .isEqualTo(ErrorCode.NO_UPDATABLE_FIELDS);
        assertThat(MobilePostValidators.validateForUpdate(null).getFailure().code())
                .isEqualTo(ErrorCode.NO_UPDATABLE_FIELDS);
    }

    @Test
    void validateForUpdate_checksOnlyPresentFields() {
        MobilePostRequest r = new MobilePostRequest();
        r.setCloseHour("18:00");
        assertThat(MobilePostValidators.validateForUpdate(r).isValid()).isTrue();

        r.setOpenHour("25:00");
        assertThat(MobilePostValidators.validateForUpdate(r).getFailure().fields()).containsExactly("openHour");
    }

    @Test
    void validateLengths_boundsCodeNamesAndFreeText() {
        MobilePostRequest r = new MobilePostRequest();
        r.setMobileCode("M".repeat(32));
        r.setNameTC("n".repeat(255));
        r.setAddressEN("a".repeat(500));
        assertThat(MobilePostValidators.validateLengths(r).isValid()).isTrue();

        r.setAddressEN("a".repeat(501));
        assertThat(MobilePostValidators.validateLengths(r).getFailure().fields()).containsExactly("addressEN");

        r.setMobileCode("M".repeat(33));
        Validation<MobilePostFields> result = MobilePostValidators.validateForUpdate(r);
        assertThat(result.getFailure().code()).isEqualTo(ErrorCode.INVALID_PARAMETER_VALUE);
        assertThat(result.getFailure().fields()).containsExactly("mobileCode");
    }

    @Test
    void orElseThrow_raisesApiException_withFailureCode() {
        assertThatThrownBy(() -> MobilePostValidators.validateDayOfWeek(9).orElseThrow())
                .isInstanceOf(ApiException.class)
                .satisfies(e -> assertThat(((ApiException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_PARAMETER_VALUE));
    }
}
