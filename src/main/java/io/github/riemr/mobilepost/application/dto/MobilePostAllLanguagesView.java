package io.github.riemr.mobilepost.application.dto;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Projection for {@code lang=all}. {@code name} and {@code district} are English-resolved
 * aliases kept for single-language consumers.
 */
@Value
@Builder
public class MobilePostAllLanguagesView implements MobilePostView {
    Long id;
    String mobileCode;
    Integer seq;
    String nameEN;
    String nameTC;
    String nameSC;
    String districtEN;
    String districtTC;
    String districtSC;
    String locationEN;
    String locationTC;
    String locationSC;
    String addressEN;
    String addressTC;
    String addressSC;
    String name;
    String district;
    String openHour;
    String closeHour;
    Integer dayOfWeekCode;
    Double latitude;
    Double longitude;
    OffsetDateTime importedAt;
    OffsetDateTime updatedAt;
}
