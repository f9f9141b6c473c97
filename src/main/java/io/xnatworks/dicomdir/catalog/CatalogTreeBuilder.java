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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Maintains the patient / study / series / instance record tree and inserts
 * instances into it, reusing existing records at each level.
 */
public class CatalogTreeBuilder {
    private static final Logger log = LoggerFactory.getLogger(CatalogTreeBuilder.class);

    private DirectoryRecord root;

    public DirectoryRecord getRoot() {
        return root;
    }

    /**
     * Replace the whole tree, e.g. with one read from a file.
     */
    void setRoot(DirectoryRecord root) {
        this.root = root;
    }

    /**
     * Insert an instance into the tree.
     *
     * Patients match on Patient ID and Patient's Name, studies on Study Instance UID,
     * series on Series Instance UID and instances on the referenced SOP Instance UID.
     * New records are appended to the end of their level.
     *
     * @return true if a new instance record was created, false if the instance was already catalogued
     * @throws CatalogException if the instance's SOP class has no record type or the instance
     *                          cannot be located; the tree is left untouched
     */
    public boolean insert(CatalogItem item) throws CatalogException {
        Objects.requireNonNull(item, "item");

        // Classify before touching the tree
        String sopClassUid = item.getSopClassUid();
        Optional<RecordType> instanceType = RecordTypeDirectory.typeFor(sopClassUid);
        if (instanceType.isEmpty()) {
            throw new CatalogException(CatalogException.Reason.UNSUPPORTED_RECORD_TYPE,
                    "No directory record type for SOP class " + sopClassUid + " (" + item + ")");
        }
        String sopInstanceUid = item.getSopInstanceUid();
        if (sopInstanceUid == null) {
            throw new CatalogException(CatalogException.Reason.UNSUPPORTED_RECORD_TYPE,
                    "Missing SOP Instance UID (" + item + ")");
        }
        if (item.getFileId() == null && item.getSourceFile() == null) {
            throw new CatalogException(CatalogException.Reason.MISSING_FILE_ID,
                    "Neither file ID nor source file given for instance " + sopInstanceUid);
        }

        Attributes dataset = item.getDataset();

        String patientId = dataset.getString(Tag.PatientID);
        String patientName = dataset.getString(Tag.PatientName);
        DirectoryRecord patient;
        if (root == null) {
            root = patient = createRecord(RecordType.PATIENT, dataset);
            log.debug("Created first patient record for {}", patientId);
        } else {
            patient = findOrAppend(root,
                    r -> Objects.equals(r.getString(Tag.PatientID), patientId)
                            && Objects.equals(r.getString(Tag.PatientName), patientName),
                    RecordType.PATIENT, dataset);
        }

        String studyUid = dataset.getString(Tag.StudyInstanceUID);
        DirectoryRecord study = findOrCreateChild(patient,
                r -> Objects.equals(r.getString(Tag.StudyInstanceUID), studyUid),
                RecordType.STUDY, dataset);

        String seriesUid = dataset.getString(Tag.SeriesInstanceUID);
        DirectoryRecord series = findOrCreateChild(study,
                r -> Objects.equals(r.getString(Tag.SeriesInstanceUID), seriesUid),
                RecordType.SERIES, dataset);

        Predicate<DirectoryRecord> sameInstance =
                r -> sopInstanceUid.equals(r.getString(Tag.ReferencedSOPInstanceUIDInFile));
        if (series.getChild() != null) {
            for (DirectoryRecord existing : series.children()) {
                if (sameInstance.test(existing)) {
                    log.debug("Instance {} is already catalogued", sopInstanceUid);
                    return false;
                }
            }
        }

        DirectoryRecord instance = createInstanceRecord(instanceType.get(), item, sopClassUid, sopInstanceUid);
        if (series.getChild() == null) {
            series.setChild(instance);
        } else {
            series.getChild().appendSibling(instance);
        }
        log.debug("Added {} record for instance {}", instance.getType(), sopInstanceUid);
        return true;
    }

    private DirectoryRecord findOrCreateChild(DirectoryRecord parent, Predicate<DirectoryRecord> matches,
                                              RecordType type, Attributes dataset) {
        if (parent.getChild() == null) {
            DirectoryRecord created = createRecord(type, dataset);
            parent.setChild(created);
            return created;
        }
        return findOrAppend(parent.getChild(), matches, type, dataset);
    }

    private DirectoryRecord findOrAppend(DirectoryRecord first, Predicate<DirectoryRecord> matches,
                                         RecordType type, Attributes dataset) {
        DirectoryRecord current = first;
        while (true) {
            if (matches.test(current)) {
                return current;
            }
            if (current.getNext() == null) {
                DirectoryRecord created = createRecord(type, dataset);
                current.setNext(created);
                return created;
            }
            current = current.getNext();
        }
    }

    private DirectoryRecord createInstanceRecord(RecordType type, CatalogItem item,
                                                 String sopClassUid, String sopInstanceUid) {
        DirectoryRecord record = createRecord(type, item.getDataset(), Tag.InstanceNumber);
        Attributes attrs = record.getAttributes();
        String fileId = item.getFileId();
        if (fileId != null) {
            attrs.setString(Tag.ReferencedFileID, VR.CS, RecordPaths.toFileIdComponents(fileId));
        } else {
            record.setSourceFile(item.getSourceFile());
        }
        attrs.setString(Tag.ReferencedSOPClassUIDInFile, VR.UI, sopClassUid);
        attrs.setString(Tag.ReferencedSOPInstanceUIDInFile, VR.UI, sopInstanceUid);
        String tsuid = item.getTransferSyntaxUid();
        if (tsuid != null) {
            attrs.setString(Tag.ReferencedTransferSyntaxUIDInFile, VR.UI, tsuid);
        }
        return record;
    }

    /**
     * Create a record of the given type, copying Specific Character Set and the
     * type's required attributes that are present in the source dataset.
     */
    static DirectoryRecord createRecord(RecordType type, Attributes source, int... extraTags) {
        DirectoryRecord record = new DirectoryRecord(type);
        Attributes attrs = record.getAttributes();

        int[] required = RecordTypeDirectory.requiredFields(type);
        int[] tags = Arrays.copyOf(required, required.length + extraTags.length + 1);
        System.arraycopy(extraTags, 0, tags, required.length, extraTags.length);
        tags[tags.length - 1] = Tag.SpecificCharacterSet;
        tags = Arrays.stream(tags).sorted().distinct().toArray();

        for (int tag : tags) {
            if (source.contains(tag)) {
                attrs.addSelected(source, tag);
            } else if (tag != Tag.SpecificCharacterSet && log.isDebugEnabled()) {
                log.debug("Cannot find tag {} for {} record", String.format("(%04X,%04X)",
                        tag >>> 16, tag & 0xFFFF), type);
            }
        }
        return record;
    }
}
