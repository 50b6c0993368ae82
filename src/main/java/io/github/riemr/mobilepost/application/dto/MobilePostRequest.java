package io.github.riemr.mobilepost.application.dto;

import io.github.riemr.mobilepost.application.validation.MobilePostValidators;
import io.github.riemr.mobilepost.domain.model.MobilePostFields;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Body of create and partial-update requests. Absent and {@code null} properties are "not supplied".
 */
@Data
public class MobilePostRequest implements MobilePostFields {
    @Size(max = MobilePostValidators.MAX_CODE_LENGTH)
    private String mobileCode;
    private Integer seq;

    @Size(max = MobilePostValidators.MAX_NAME_LENGTH) private String nameEN;
    @Size(max = MobilePostValidators.MAX_NAME_LENGTH) private String nameTC;
    @Size(max = MobilePostValidators.MAX_NAME_LENGTH) private String nameSC;
    @Size(max = MobilePostValidators.MAX_NAME_LENGTH) private String districtEN;
    @Size(max = MobilePostValidators.MAX_NAME_LENGTH) private String districtTC;
    @Size(max = MobilePostValidators.MAX_NAME_LENGTH) private String districtSC;
    @Size(max = MobilePostValidators.MAX_TEXT_LENGTH) private String locationEN;
    @Size(max = MobilePostValidators.MAX_TEXT_LENGTH) private String locationTC;
    @Size(max = MobilePostValidators.MAX_TEXT_LENGTH) private String locationSC;
    @Size(max = MobilePostValidators.MAX_TEXT_LENGTH) private String addressEN;
    @Size(max = MobilePostValidators.MAX_TEXT_LENGTH) private String addressTC;
    @Size(max = MobilePostValidators.MAX_TEXT_LENGTH) private String addressSC;

    private String openHour;
    private String closeHour;
    private Integer dayOfWeekCode;

    private Double latitude;
    private Double longitude;
}
