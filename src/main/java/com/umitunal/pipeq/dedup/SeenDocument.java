package com.umitunal.pipeq.dedup;

import com.umitunal.pipeq.model.SeenRecord;

import java.util.HashMap;
import java.util.Map;

/**
 * The consolidated ledger: every seen record keyed by subject hash.
 */
public class SeenDocument {
    private HashMap<String, SeenRecord> records = new HashMap<>();

    public Map<String, SeenRecord> getRecords() {
        return records;
    }

    public void setRecords(Map<String, SeenRecord> records) {
        this.records = records == null ? new HashMap<>() : new HashMap<>(records);
    }
}
