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
import org.dcm4che3.io.DicomInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a DICOMDIR and rebuilds its record tree.
 *
 * All records are created first, keyed by the stream position the codec recorded
 * for each item. Links are resolved afterwards by looking up the offsets stored in
 * the records and in the root entity offset of the header.
 */
public class CatalogLoader {
    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

    /**
     * Read a DICOMDIR from {@code in}. The stream is left open.
     *
     * @throws CatalogException if the stream has no record sequence or the root offset is dangling
     * @throws IOException      if the stream cannot be decoded
     */
    public Result load(InputStream in) throws CatalogException, IOException {
        Attributes fmi;
        Attributes dataset;
        DicomInputStream dis = new DicomInputStream(in);
        fmi = dis.readFileMetaInformation();
        dataset = dis.readDataset();

        if (!dataset.contains(Tag.DirectoryRecordSequence)) {
            throw new CatalogException(CatalogException.Reason.MISSING_RECORD_SEQUENCE,
                    "No Directory Record Sequence found");
        }

        // A zero length sequence decodes without a Sequence value
        Sequence sequence = dataset.getSequence(Tag.DirectoryRecordSequence);
        Iterable<Attributes> items = sequence != null ? sequence : Collections.emptyList();
        Map<Long, DirectoryRecord> byOffset = new LinkedHashMap<>();
        for (Attributes item : items) {
            long position = item.getItemPosition();
            if (position < 0) {
                throw new IOException("Decoder did not record the position of a directory record item");
            }
            byOffset.put(position, new DirectoryRecord(new Attributes(item), position));
        }

        CatalogHeader header = CatalogHeader.from(fmi, dataset);
        DirectoryRecord root = null;
        long rootOffset = header.getFirstRootOffset();
        if (rootOffset != 0) {
            root = byOffset.get(rootOffset);
            if (root == null) {
                throw new CatalogException(CatalogException.Reason.DANGLING_ROOT_OFFSET,
                        "Unable to find root directory record at offset " + rootOffset);
            }
        }

        // Each record may be linked from one place only, so the result stays a tree
        Set<DirectoryRecord> linked = Collections.newSetFromMap(new IdentityHashMap<>());
        if (root != null) {
            linked.add(root);
        }
        List<LoadWarning> warnings = new ArrayList<>();
        for (DirectoryRecord record : byOffset.values()) {
            long recordOffset = record.getOffset().getAsLong();
            record.setNext(resolve(byOffset, linked, recordOffset, LoadWarning.Link.NEXT,
                    record.getNextOffset(), warnings));
            record.setChild(resolve(byOffset, linked, recordOffset, LoadWarning.Link.CHILD,
                    record.getChildOffset(), warnings));
        }

        log.debug("Loaded {} directory records, root at {}", byOffset.size(), rootOffset);
        return new Result(header, root, byOffset.size(), warnings);
    }

    private static DirectoryRecord resolve(Map<Long, DirectoryRecord> byOffset, Set<DirectoryRecord> linked,
                                           long recordOffset, LoadWarning.Link link, long targetOffset,
                                           List<LoadWarning> warnings) {
        if (targetOffset == 0) {
            return null;
        }
        DirectoryRecord target = byOffset.get(targetOffset);
        LoadWarning.Problem problem = null;
        if (target == null) {
            problem = LoadWarning.Problem.UNRESOLVED_OFFSET;
        } else if (!linked.add(target)) {
            problem = LoadWarning.Problem.ALREADY_LINKED;
        }
        if (problem != null) {
            LoadWarning warning = new LoadWarning(recordOffset, link, targetOffset, problem);
            log.warn("Ignoring link: {}", warning);
            warnings.add(warning);
            return null;
        }
        return target;
    }

    /**
     * A fully linked catalog read from a stream.
     */
    public static final class Result {
        private final CatalogHeader header;
        private final DirectoryRecord root;
        private final int recordCount;
        private final List<LoadWarning> warnings;

        Result(CatalogHeader header, DirectoryRecord root, int recordCount, List<LoadWarning> warnings) {
            this.header = header;
            this.root = root;
            this.recordCount = recordCount;
            this.warnings = Collections.unmodifiableList(warnings);
        }

        public CatalogHeader getHeader() {
            return header;
        }

        /**
         * First record of the root directory entity, or null for an empty catalog.
         */
        public DirectoryRecord getRoot() {
            return root;
        }

        /**
         * Number of items in the record sequence, linked or not.
         */
        public int getRecordCount() {
            return recordCount;
        }

        public List<LoadWarning> getWarnings() {
            return warnings;
        }
    }
}
