package io.github.riemr.mobilepost.application.dto;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/** Projection for {@code lang=en|tc|sc}: one resolved value per language-grouped field. */
@Value
@Builder
public class MobilePostLocalizedView implements MobilePostView {
    Long id;
    String mobileCode;
    Integer seq;
    String name;
    String district;
    String location;
    String address;
    String openHour;
    String closeHour;
    Integer dayOfWeekCode;
    Double latitude;
    Double longitude;
    OffsetDateTime importedAt;
    OffsetDateTime updatedAt;
}
