package io.github.riemr.mobilepost.application.importing;

import io.github.riemr.mobilepost.application.validation.ValidationFailure;
import io.github.riemr.mobilepost.infrastructure.persistence.entity.MobilePost;

import java.util.List;

/**
 * Per-row result of validation: {@link Accepted} or {@link Rejected}.
 */
public interface RowOutcome {

    ImportRow row();

    record Accepted(ImportRow row, MobilePost record, DedupKey key) implements RowOutcome {
    }

    record Rejected(ImportRow row, IrregularityReason reason, List<String> fields, String message) implements RowOutcome {

        public Rejected {
            fields = List.copyOf(fields);
        }

        static Rejected of(ImportRow row, ValidationFailure failure) {
            return new Rejected(row, IrregularityReason.of(failure.code()), failure.fields(), failure.message());
        }
    }
}
