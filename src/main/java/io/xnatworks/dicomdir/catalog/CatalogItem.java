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
import org.dcm4che3.io.DicomInputStream;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A stored instance to be entered into a catalog: its file meta information,
 * its dataset, and where the instance lives.
 */
public class CatalogItem {

    private final Attributes fileMetaInformation;
    private final Attributes dataset;
    private final Path sourceFile;
    private final String fileId;

    /**
     * @param fileMetaInformation file meta information of the instance, may be null
     * @param dataset             the instance's dataset (pixel data is not needed)
     * @param sourceFile          where the instance is stored, may be null when {@code fileId} is given
     * @param fileId              explicit Referenced File ID, '/' or '\' separated, may be null
     */
    public CatalogItem(Attributes fileMetaInformation, Attributes dataset, Path sourceFile, String fileId) {
        this.fileMetaInformation = fileMetaInformation;
        this.dataset = Objects.requireNonNull(dataset, "dataset");
        this.sourceFile = sourceFile;
        this.fileId = fileId;
    }

    /**
     * Read the instance stored at {@code file}, skipping bulk data such as pixel data.
     */
    public static CatalogItem read(Path file, String fileId) throws IOException {
        Attributes fmi;
        Attributes dataset;
        try (DicomInputStream dis = new DicomInputStream(file.toFile())) {
            dis.setIncludeBulkData(DicomInputStream.IncludeBulkData.NO);
            fmi = dis.readFileMetaInformation();
            dataset = dis.readDataset();
        }
        return new CatalogItem(fmi, dataset, file, fileId);
    }

    public Attributes getDataset() {
        return dataset;
    }

    public Path getSourceFile() {
        return sourceFile;
    }

    /**
     * Explicit file ID, or null when it is derived from the source file at save time.
     */
    public String getFileId() {
        return fileId != null && !fileId.trim().isEmpty() ? fileId.trim() : null;
    }

    /**
     * Media Storage SOP Class UID, falling back to the dataset's SOP Class UID.
     */
    public String getSopClassUid() {
        return fromMetaOrDataset(Tag.MediaStorageSOPClassUID, Tag.SOPClassUID);
    }

    /**
     * Media Storage SOP Instance UID, falling back to the dataset's SOP Instance UID.
     */
    public String getSopInstanceUid() {
        return fromMetaOrDataset(Tag.MediaStorageSOPInstanceUID, Tag.SOPInstanceUID);
    }

    /**
     * Transfer syntax the instance is stored with, or null when unknown.
     */
    public String getTransferSyntaxUid() {
        return fileMetaInformation != null ? fileMetaInformation.getString(Tag.TransferSyntaxUID) : null;
    }

    private String fromMetaOrDataset(int metaTag, int datasetTag) {
        String value = fileMetaInformation != null ? fileMetaInformation.getString(metaTag) : null;
        return value != null ? value : dataset.getString(datasetTag);
    }

    @Override
    public String toString() {
        return sourceFile != null ? sourceFile.toString() : String.valueOf(getSopInstanceUid());
    }
}
