package io.github.riemr.mobilepost.application.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Result of one import run. {@code received = imported + skipped + duplicate}.
 */
@Value
@Builder
public class ImportReport {
    String source;
    OffsetDateTime startedAt;
    OffsetDateTime finishedAt;
    int received;
    int imported;
    int skipped;
    int duplicate;
    @Singular
    List<ImportIrregularity> irregularities;
}
