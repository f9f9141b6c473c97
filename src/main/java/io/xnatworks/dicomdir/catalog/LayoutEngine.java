/*
 * XNAT DICOMDIR
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.dicomdir.catalog;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Sequence;
import org.dcm4che3.data.Tag;
import org.dcm4che3.data.UID;
import org.dcm4che3.data.VR;
import org.dcm4che3.io.DicomEncodingOptions;
import org.dcm4che3.io.DicomOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Writes a record tree as a DICOMDIR.
 *
 * Saving runs in fixed phases: the tree is flattened into file order, every record
 * gets its absolute offset from the encoded lengths of everything in front of it,
 * the link fields and the root entity offsets are patched with those offsets, and
 * finally the file is written. Link fields have a fixed size, so patching never
 * changes an encoded length.
 */
public class LayoutEngine {
    private static final Logger log = LoggerFactory.getLogger(LayoutEngine.class);

    /** Item tag and item length. */
    static final int ITEM_HEADER_LENGTH = 8;

    /** Item Delimitation Item tag and its zero length. */
    static final int ITEM_DELIMITATION_LENGTH = 8;

    /** Tag, VR, reserved bytes and 32 bit length of an explicit VR sequence. */
    static final int EXPLICIT_VR_SEQUENCE_HEADER_LENGTH = 12;

    /** Tag and 32 bit length of an implicit VR sequence. */
    static final int IMPLICIT_VR_SEQUENCE_HEADER_LENGTH = 8;

    static final long MAX_OFFSET = 0xFFFFFFFFL;

    private final DicomEncodingOptions encodingOptions;

    public LayoutEngine(DicomEncodingOptions encodingOptions) {
        this.encodingOptions = encodingOptions;
    }

    /**
     * Lay out and write the catalog.
     *
     * @param root        first patient level record
     * @param header      file-set header; its root entity offsets are updated
     * @param out         destination stream, left open
     * @param dicomDirFile where the DICOMDIR is being saved, used to derive pending file IDs
     * @return the layout that was written
     * @throws CatalogException if there is nothing to save or an instance record has no file ID
     * @throws IOException      if encoding or writing fails
     */
    public CatalogLayout write(DirectoryRecord root, CatalogHeader header, OutputStream out, Path dicomDirFile)
            throws CatalogException, IOException {
        CatalogLayout layout = layout(root, header, dicomDirFile);

        Attributes fmi = header.toFileMetaInformation();
        Attributes dataset = header.toDataset();
        Sequence sequence = dataset.newSequence(Tag.DirectoryRecordSequence, layout.size());
        for (DirectoryRecord record : layout.getRecords()) {
            sequence.add(new Attributes(record.getAttributes()));
        }

        DicomOutputStream dos = new DicomOutputStream(out, UID.ExplicitVRLittleEndian);
        dos.setEncodingOptions(encodingOptions);
        dos.writeDataset(fmi, dataset);
        dos.flush();

        log.debug("Wrote {} directory records, first root record at {}", layout.size(), layout.getFirstRootOffset());
        return layout;
    }

    /**
     * Compute the layout of the catalog and patch the records and header with it,
     * without writing anything.
     */
    public CatalogLayout layout(DirectoryRecord root, CatalogHeader header, Path dicomDirFile)
            throws CatalogException, IOException {
        if (root == null) {
            throw new CatalogException(CatalogException.Reason.EMPTY_CATALOG,
                    "No DICOM files added, cannot save DICOMDIR");
        }

        List<DirectoryRecord> records = flatten(root);
        resolveFileIds(records, dicomDirFile);

        boolean explicitVR = header.isExplicitVR();
        long start = recordsStart(header, explicitVR);
        int itemOverhead = ITEM_HEADER_LENGTH + (encodingOptions.undefItemLength ? ITEM_DELIMITATION_LENGTH : 0);

        long[] offsets = new long[records.size()];
        int[] lengths = new int[records.size()];
        long cursor = start;
        for (int i = 0; i < records.size(); i++) {
            DirectoryRecord record = records.get(i);
            record.ensureLinkFields();
            if (cursor > MAX_OFFSET) {
                throw new IOException("Directory record offset " + cursor + " exceeds 32 bit range");
            }
            offsets[i] = cursor;
            lengths[i] = record.getAttributes().calcLength(encodingOptions, explicitVR);
            record.setOffset(cursor);
            cursor += lengths[i] + itemOverhead;
        }

        backPatch(root);

        long firstRootOffset = root.getOffset().getAsLong();
        long lastRootOffset = root.lastSibling().getOffset().getAsLong();
        header.setFirstRootOffset(firstRootOffset);
        header.setLastRootOffset(lastRootOffset);

        return new CatalogLayout(records, offsets, lengths, itemOverhead, start, cursor,
                firstRootOffset, lastRootOffset);
    }

    /**
     * Records in file order: a record, then its whole lower-level subtree, then its later siblings.
     */
    static List<DirectoryRecord> flatten(DirectoryRecord root) {
        List<DirectoryRecord> records = new ArrayList<>();
        Deque<DirectoryRecord> pending = new ArrayDeque<>();
        if (root != null) {
            pending.push(root);
        }
        while (!pending.isEmpty()) {
            DirectoryRecord record = pending.pop();
            records.add(record);
            if (record.getNext() != null) {
                pending.push(record.getNext());
            }
            if (record.getChild() != null) {
                pending.push(record.getChild());
            }
        }
        return records;
    }

    /**
     * Offset of the first record item: preamble, DICM prefix and file meta information,
     * the dataset attributes sorting before the Directory Record Sequence, and the
     * sequence's own header.
     */
    long recordsStart(CatalogHeader header, boolean explicitVR) throws IOException {
        long metaLength = fileMetaInformationLength(header.toFileMetaInformation());

        Attributes leading = new Attributes(header.toDataset());
        for (int tag : leading.tags()) {
            if (Integer.compareUnsigned(tag, Tag.DirectoryRecordSequence) >= 0) {
                leading.remove(tag);
            }
        }
        int leadingLength = leading.isEmpty() ? 0 : leading.calcLength(encodingOptions, explicitVR);

        return metaLength + leadingLength
                + (explicitVR ? EXPLICIT_VR_SEQUENCE_HEADER_LENGTH : IMPLICIT_VR_SEQUENCE_HEADER_LENGTH);
    }

    /**
     * Length of preamble, DICM prefix and the file meta information group as the codec writes them.
     */
    static long fileMetaInformationLength(Attributes fmi) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        DicomOutputStream dos = new DicomOutputStream(buffer, UID.ExplicitVRLittleEndian);
        dos.writeFileMetaInformation(fmi);
        dos.flush();
        return buffer.size();
    }

    /**
     * Write each record's next and lower-level offsets, 0 where there is no link.
     */
    private static void backPatch(DirectoryRecord root) {
        Deque<DirectoryRecord> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            DirectoryRecord record = pending.pop();
            DirectoryRecord next = record.getNext();
            DirectoryRecord child = record.getChild();
            record.writeLinkOffsets(
                    next != null ? next.getOffset().getAsLong() : 0L,
                    child != null ? child.getOffset().getAsLong() : 0L);
            if (next != null) {
                pending.push(next);
            }
            if (child != null) {
                pending.push(child);
            }
        }
    }

    /**
     * Derive the Referenced File ID of records that were added with only a source file,
     * relative to the directory the DICOMDIR is saved in.
     */
    private static void resolveFileIds(List<DirectoryRecord> records, Path dicomDirFile) throws CatalogException {
        for (DirectoryRecord record : records) {
            Path source = record.getSourceFile();
            if (source == null) {
                continue;
            }
            if (dicomDirFile == null) {
                throw new CatalogException(CatalogException.Reason.MISSING_FILE_ID,
                        "Cannot derive file ID of " + source + " without the DICOMDIR location");
            }
            record.getAttributes().setString(Tag.ReferencedFileID, VR.CS,
                    RecordPaths.relativeFileId(dicomDirFile, source));
        }
    }
}
