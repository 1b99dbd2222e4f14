package com.laborjustice.casechain.ingest;

import com.laborjustice.casechain.model.record.CaseRecord;

import java.nio.file.Path;
import java.util.List;

/**
 * Source of case records for a reconciliation run.
 */
public interface CaseRecordLoader {

    /**
     * @param source a file, or a directory whose files are loaded in name order
     * @return records in source order
     * @throws com.laborjustice.casechain.exception.RecordLoadException if the source cannot be read or parsed
     */
    List<CaseRecord> load(Path source);
}
