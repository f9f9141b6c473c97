/*
 * XNAT DICOMDIR
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.dicomdir.catalog;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Tag;
import org.dcm4che3.data.VR;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.OptionalLong;

/**
 * One entry of the directory record tree.
 *
 * A record owns its attributes, the chain of later siblings reachable through
 * {@link #getNext()} and the subordinate level reachable through {@link #getChild()}.
 * The absolute file offset is only known once the catalog has been laid out
 * for saving, or when the record was read from a file.
 */
public class DirectoryRecord {

    static final long NO_OFFSET = -1L;

    /** Record In-use Flag value for an active record. */
    static final int RECORD_IN_USE = 0xFFFF;

    private final RecordType type;
    private final Attributes attributes;
    private long offset = NO_OFFSET;
    private DirectoryRecord next;
    private DirectoryRecord child;

    /**
     * Source file the ReferencedFileID will be derived from when the catalog is saved.
     */
    private Path sourceFile;

    /**
     * Create a new, unlinked record of the given type with zeroed link fields.
     */
    public DirectoryRecord(RecordType type) {
        this.type = type;
        this.attributes = new Attributes();
        attributes.setInt(Tag.OffsetOfTheNextDirectoryRecord, VR.UL, 0);
        attributes.setInt(Tag.RecordInUseFlag, VR.US, RECORD_IN_USE);
        attributes.setInt(Tag.OffsetOfReferencedLowerLevelDirectoryEntity, VR.UL, 0);
        attributes.setString(Tag.DirectoryRecordType, VR.CS, type.getCode());
    }

    /**
     * Wrap attributes read from a file. The record type is taken from
     * DirectoryRecordType (0004,1430) and is not rewritten.
     */
    DirectoryRecord(Attributes attributes, long offset) {
        this.type = RecordType.fromCode(attributes.getString(Tag.DirectoryRecordType));
        this.attributes = attributes;
        this.offset = offset;
    }

    public RecordType getType() {
        return type;
    }

    /**
     * The record's attributes. Link fields are overwritten each time the catalog is saved.
     */
    public Attributes getAttributes() {
        return attributes;
    }

    /**
     * Absolute byte offset of the record's item in the DICOMDIR file, if known.
     */
    public OptionalLong getOffset() {
        return offset == NO_OFFSET ? OptionalLong.empty() : OptionalLong.of(offset);
    }

    void setOffset(long offset) {
        this.offset = offset;
    }

    public DirectoryRecord getNext() {
        return next;
    }

    void setNext(DirectoryRecord next) {
        this.next = next;
    }

    public DirectoryRecord getChild() {
        return child;
    }

    void setChild(DirectoryRecord child) {
        this.child = child;
    }

    Path getSourceFile() {
        return sourceFile;
    }

    void setSourceFile(Path sourceFile) {
        this.sourceFile = sourceFile;
    }

    /**
     * Value of Offset of the Next Directory Record (0004,1400) as unsigned 32 bit.
     */
    public long getNextOffset() {
        return readOffset(attributes, Tag.OffsetOfTheNextDirectoryRecord);
    }

    /**
     * Value of Offset of Referenced Lower-Level Directory Entity (0004,1420) as unsigned 32 bit.
     */
    public long getChildOffset() {
        return readOffset(attributes, Tag.OffsetOfReferencedLowerLevelDirectoryEntity);
    }

    void writeLinkOffsets(long nextOffset, long childOffset) {
        attributes.setInt(Tag.OffsetOfTheNextDirectoryRecord, VR.UL, (int) nextOffset);
        attributes.setInt(Tag.OffsetOfReferencedLowerLevelDirectoryEntity, VR.UL, (int) childOffset);
    }

    /**
     * Make sure the fixed-size link fields are present, so that the encoded
     * length does not change when they are patched.
     */
    void ensureLinkFields() {
        if (!attributes.contains(Tag.OffsetOfTheNextDirectoryRecord)) {
            attributes.setInt(Tag.OffsetOfTheNextDirectoryRecord, VR.UL, 0);
        }
        if (!attributes.contains(Tag.OffsetOfReferencedLowerLevelDirectoryEntity)) {
            attributes.setInt(Tag.OffsetOfReferencedLowerLevelDirectoryEntity, VR.UL, 0);
        }
    }

    /**
     * The last record of the sibling chain starting at this record.
     */
    public DirectoryRecord lastSibling() {
        DirectoryRecord last = this;
        while (last.next != null) {
            last = last.next;
        }
        return last;
    }

    /**
     * Append a record to the end of this record's sibling chain.
     */
    void appendSibling(DirectoryRecord record) {
        lastSibling().next = record;
    }

    /**
     * This record followed by its later siblings.
     */
    public Iterable<DirectoryRecord> siblings() {
        return () -> new ChainIterator(this);
    }

    /**
     * Records of the subordinate level, in chain order.
     */
    public Iterable<DirectoryRecord> children() {
        return () -> new ChainIterator(child);
    }

    public String getString(int tag) {
        return attributes.getString(tag);
    }

    @Override
    public String toString() {
        return type.getCode() + (offset == NO_OFFSET ? "" : "@" + offset);
    }

    static long readOffset(Attributes attrs, int tag) {
        return attrs.getInt(tag, 0) & 0xFFFFFFFFL;
    }

    private static final class ChainIterator implements Iterator<DirectoryRecord> {
        private DirectoryRecord current;

        ChainIterator(DirectoryRecord first) {
            this.current = first;
        }

        @Override
        public boolean hasNext() {
            return current != null;
        }

        @Override
        public DirectoryRecord next() {
            if (current == null) {
                throw new NoSuchElementException();
            }
            DirectoryRecord record = current;
            current = current.next;
            return record;
        }
    }
}
