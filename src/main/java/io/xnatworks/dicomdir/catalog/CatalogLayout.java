/*
 * XNAT DICOMDIR
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.dicomdir.catalog;

import java.util.Collections;
import java.util.List;

/**
 * Result of laying out a record tree: the records in the order they are written,
 * their absolute offsets and encoded lengths, and the root entity offsets.
 */
public final class CatalogLayout {

    private final List<DirectoryRecord> records;
    private final long[] offsets;
    private final int[] lengths;
    private final int itemOverhead;
    private final long recordsStart;
    private final long recordsEnd;
    private final long firstRootOffset;
    private final long lastRootOffset;

    CatalogLayout(List<DirectoryRecord> records, long[] offsets, int[] lengths, int itemOverhead,
                  long recordsStart, long recordsEnd, long firstRootOffset, long lastRootOffset) {
        this.records = Collections.unmodifiableList(records);
        this.offsets = offsets;
        this.lengths = lengths;
        this.itemOverhead = itemOverhead;
        this.recordsStart = recordsStart;
        this.recordsEnd = recordsEnd;
        this.firstRootOffset = firstRootOffset;
        this.lastRootOffset = lastRootOffset;
    }

    /**
     * Records in file order: each record, then its lower levels, then its later siblings.
     */
    public List<DirectoryRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public long getOffset(int index) {
        return offsets[index];
    }

    /**
     * Encoded length of the record's attributes, without the item header and delimiter.
     */
    public int getEncodedLength(int index) {
        return lengths[index];
    }

    /**
     * Bytes added around each record's attributes: the item header, plus the item
     * delimitation item when items are written with undefined length.
     */
    public int getItemOverhead() {
        return itemOverhead;
    }

    /**
     * Offset of the first record item, right after the Directory Record Sequence header.
     */
    public long getRecordsStart() {
        return recordsStart;
    }

    /**
     * Offset just past the last record item.
     */
    public long getRecordsEnd() {
        return recordsEnd;
    }

    public long getFirstRootOffset() {
        return firstRootOffset;
    }

    public long getLastRootOffset() {
        return lastRootOffset;
    }
}
