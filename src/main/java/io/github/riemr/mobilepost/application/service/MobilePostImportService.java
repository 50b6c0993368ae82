package io.github.riemr.mobilepost.application.service;

import io.github.riemr.mobilepost.application.dto.ImportIrregularity;
import io.github.riemr.mobilepost.application.dto.ImportReport;
import io.github.riemr.mobilepost.application.exception.DuplicateRecordException;
import io.github.riemr.mobilepost.application.importing.BatchSource;
import io.github.riemr.mobilepost.application.importing.DedupKey;
import io.github.riemr.mobilepost.application.importing.ImportRow;
import io.github.riemr.mobilepost.application.importing.ImportRowMapper;
import io.github.riemr.mobilepost.application.importing.IrregularityReason;
import io.github.riemr.mobilepost.application.importing.RowOutcome;
import io.github.riemr.mobilepost.application.repository.MobilePostRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Bulk import: validate every row, drop duplicates (first occurrence wins), persist the rest, report.
 * A bad row only ever skips itself. Runs are serialized because storage uniqueness covers
 * {@code (mobileCode, seq)} only, not the fallback key.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MobilePostImportService {
    private final MobilePostRepository repository;
    private final ImportRowMapper rowMapper;
    private final ReentrantLock runLock = new ReentrantLock();

    public ImportReport importFrom(BatchSource source) {
        runLock.lock();
        try {
            log.info("Import start. source={}", source.describe());
            List<ImportRow> rows = source.read();
            ImportReport report = run(source.describe(), rows);
            log.info("Import completed. source={} received={} imported={} skipped={} duplicate={}",
                    report.getSource(), report.getReceived(), report.getImported(),
                    report.getSkipped(), report.getDuplicate());
            return report;
        } finally {
            runLock.unlock();
        }
    }

    ImportReport run(String sourceName, List<ImportRow> rows) {
        ImportReport.ImportReportBuilder report = ImportReport.builder()
                .source(sourceName)
                .startedAt(OffsetDateTime.now())
                .received(rows.size());
        int skipped = 0;
        int duplicate = 0;
        int imported = 0;

        // validate
        List<RowOutcome> outcomes = rows.stream().map(rowMapper::map).collect(Collectors.toList());

        // deduplicate against storage, then against earlier rows of this batch
        Set<DedupKey> stored = repository.findAllIdentities().stream()
                .map(DedupKey::of)
                .collect(Collectors.toCollection(HashSet::new));
        Set<DedupKey> seen = new HashSet<>();
        List<RowOutcome.Accepted> toPersist = new ArrayList<>();
        for (RowOutcome outcome : outcomes) {
            if (outcome instanceof RowOutcome.Rejected rejected) {
                report.irregularity(flag(rejected.row(), rejected.reason(), rejected.fields(), rejected.message()));
                skipped++;
                continue;
            }
            RowOutcome.Accepted accepted = (RowOutcome.Accepted) outcome;
            if (stored.contains(accepted.key())) {
                report.irregularity(flag(accepted.row(), IrregularityReason.DUPLICATE_EXISTING, keyFields(accepted.key()),
                        "Record already exists"));
                duplicate++;
            } else if (!seen.add(accepted.key())) {
                report.irregularity(flag(accepted.row(), IrregularityReason.DUPLICATE_IN_BATCH, keyFields(accepted.key()),
                        "Duplicate of an earlier row in this batch"));
                duplicate++;
            } else {
                toPersist.add(accepted);
            }
        }

        // persist
        for (RowOutcome.Accepted accepted : toPersist) {
            try {
                repository.create(accepted.record());
                imported++;
            } catch (DuplicateRecordException e) {
                report.irregularity(flag(accepted.row(), IrregularityReason.STORAGE_CONFLICT, keyFields(accepted.key()),
                        e.getMessage()));
                duplicate++;
            } catch (DataIntegrityViolationException e) {
                report.irregularity(flag(accepted.row(), IrregularityReason.INVALID_PARAMETER_VALUE, List.of(),
                        "Row rejected by storage constraints"));
                log.debug("Storage constraint violation on import row {}", accepted.row().index(), e);
                skipped++;
            }
        }

        return report
                .imported(imported)
                .skipped(skipped)
                .duplicate(duplicate)
                .finishedAt(OffsetDateTime.now())
                .build();
    }

    private static ImportIrregularity flag(ImportRow row, IrregularityReason reason, List<String> fields, String message) {
        log.warn("Import row {} {}: {} {}", row.index(), reason, fields, message);
        return ImportIrregularity.of(row.index(), reason, fields, message);
    }

    private static List<String> keyFields(DedupKey key) {
        return key.isNaturalKey()
                ? List.of("mobileCode", "seq")
                : List.of("nameEN", "districtEN", "openHour", "dayOfWeekCode");
    }
}
