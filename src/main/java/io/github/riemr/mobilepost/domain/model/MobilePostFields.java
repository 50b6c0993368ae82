package io.github.riemr.mobilepost.domain.model;

/**
 * Client-suppliable columns of a mobile post office record. A {@code null} getter means
 * the value was not supplied.
 */
public interface MobilePostFields {
    String getMobileCode();

    Integer getSeq();

    String getNameEN();

    String getNameTC();

    String getNameSC();

    String getDistrictEN();

    String getDistrictTC();

    String getDistrictSC();

    String getLocationEN();

    String getLocationTC();

    String getLocationSC();

    String getAddressEN();

    String getAddressTC();

    String getAddressSC();

    String getOpenHour();

    String getCloseHour();

    Integer getDayOfWeekCode();

    Double getLatitude();

    Double getLongitude();
}
