package io.github.riemr.mobilepost.application.importing;

import java.util.List;

/**
 * Supplier of raw rows for one import run.
 */
public interface BatchSource {

    /** Short description used in logs and the report, e.g. the feed URL or file name. */
    String describe();

    /**
     * @return ordered, finite rows
     * @throws io.github.riemr.mobilepost.application.exception.BatchSourceException if the source cannot be read at all
     */
    List<ImportRow> read();
}
