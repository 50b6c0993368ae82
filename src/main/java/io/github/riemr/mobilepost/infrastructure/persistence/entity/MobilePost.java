package io.github.riemr.mobilepost.infrastructure.persistence.entity;

import io.github.riemr.mobilepost.domain.model.MobilePostFields;
import lombok.Data;

import java.io.Serializable;
import java.time.OffsetDateTime;

/**
 * Row of {@code mobile_post}. {@code id}, {@code importedAt} and {@code updatedAt} are owned by the database.
 */
@Data
public class MobilePost implements MobilePostFields, Serializable {
    private Long id;
    private String mobileCode;
    private Integer seq;

    private String nameEN;
    private String nameTC;
    private String nameSC;
    private String districtEN;
    private String districtTC;
    private String districtSC;
    private String locationEN;
    private String locationTC;
    private String locationSC;
    private String addressEN;
    private String addressTC;
    private String addressSC;

    private String openHour;  // HH:MM
    private String closeHour; // HH:MM
    private Integer dayOfWeekCode; // 1=Mon .. 7=Sun

    private Double latitude;
    private Double longitude;

    private OffsetDateTime importedAt;
    private OffsetDateTime updatedAt;

    private static final long serialVersionUID = 1L;

    /** Copies the client-suppliable columns, trimming text values. */
    public static MobilePost from(MobilePostFields src) {
        MobilePost p = new MobilePost();
        p.setMobileCode(trim(src.getMobileCode()));
        p.setSeq(src.getSeq());
        p.setNameEN(trim(src.getNameEN()));
        p.setNameTC(trim(src.getNameTC()));
        p.setNameSC(trim(src.getNameSC()));
        p.setDistrictEN(trim(src.getDistrictEN()));
        p.setDistrictTC(trim(src.getDistrictTC()));
        p.setDistrictSC(trim(src.getDistrictSC()));
        p.setLocationEN(trim(src.getLocationEN()));
        p.setLocationTC(trim(src.getLocationTC()));
        p.setLocationSC(trim(src.getLocationSC()));
        p.setAddressEN(trim(src.getAddressEN()));
        p.setAddressTC(trim(src.getAddressTC()));
        p.setAddressSC(trim(src.getAddressSC()));
        p.setOpenHour(trim(src.getOpenHour()));
        p.setCloseHour(trim(src.getCloseHour()));
        p.setDayOfWeekCode(src.getDayOfWeekCode());
        p.setLatitude(src.getLatitude());
        p.setLongitude(src.getLongitude());
        return p;
    }

    private static String trim(String s) {
        return s == null ? null : s.trim();
    }
}
