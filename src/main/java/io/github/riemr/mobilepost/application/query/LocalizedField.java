package io.github.riemr.mobilepost.application.query;

import io.github.riemr.mobilepost.domain.model.Language;
import io.github.riemr.mobilepost.domain.model.MobilePostFields;

import java.util.function.Function;

/**
 * A logical attribute stored as three parallel columns, one per language.
 */
public enum LocalizedField {
    NAME("name", MobilePostFields::getNameEN, MobilePostFields::getNameTC, MobilePostFields::getNameSC),
    DISTRICT("district", MobilePostFields::getDistrictEN, MobilePostFields::getDistrictTC, MobilePostFields::getDistrictSC),
    LOCATION("location", MobilePostFields::getLocationEN, MobilePostFields::getLocationTC, MobilePostFields::getLocationSC),
    ADDRESS("address", MobilePostFields::getAddressEN, MobilePostFields::getAddressTC, MobilePostFields::getAddressSC);

    private final String columnPrefix;
    private final Function<MobilePostFields, String> en;
    private final Function<MobilePostFields, String> tc;
    private final Function<MobilePostFields, String> sc;

    LocalizedField(String columnPrefix,
                   Function<MobilePostFields, String> en,
                   Function<MobilePostFields, String> tc,
                   Function<MobilePostFields, String> sc) {
        this.columnPrefix = columnPrefix;
        this.en = en;
        this.tc = tc;
        this.sc = sc;
    }

    /** Raw stored value for one concrete language; {@code ALL} reads the English column. */
    public String raw(MobilePostFields record, Language language) {
        switch (language.effective()) {
            case TC:
                return tc.apply(record);
            case SC:
                return sc.apply(record);
            default:
                return en.apply(record);
        }
    }

    public String column(Language language) {
        return columnPrefix + "_" + language.effective().getCode();
    }
}
