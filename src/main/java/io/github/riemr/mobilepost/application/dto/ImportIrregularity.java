package io.github.riemr.mobilepost.application.dto;

import io.github.riemr.mobilepost.application.importing.IrregularityReason;

import java.util.List;

/**
 * One rejected or duplicate input row.
 *
 * @param index   position of the row in its source
 * @param reason  what went wrong
 * @param errCode error code of the matching request failure
 * @param fields  offending field(s)
 * @param message human readable detail
 */
public record ImportIrregularity(int index, IrregularityReason reason, String errCode, List<String> fields, String message) {

    public ImportIrregularity {
        fields = List.copyOf(fields);
    }

    public static ImportIrregularity of(int index, IrregularityReason reason, List<String> fields, String message) {
        return new ImportIrregularity(index, reason, reason.getErrorCode().getCode(), fields, message);
    }
}
