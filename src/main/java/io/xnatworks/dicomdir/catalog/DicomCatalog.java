/*
 * XNAT DICOMDIR
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.dicomdir.catalog;

import io.xnatworks.dicomdir.config.CatalogConfig;
import org.dcm4che3.data.Tag;
import org.dcm4che3.io.DicomEncodingOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * A DICOMDIR: the file-set header and the tree of directory records.
 *
 * <pre>
 * DicomCatalog catalog = new DicomCatalog("STORESCU");
 * catalog.getHeader().setFileSetId("MY FILE SET");
 * catalog.addFile(Paths.get("/media/DIR001/IMAGE001"));
 * catalog.addFile(Paths.get("/tmp/incoming/ct.dcm"), "DIR002/IMAGE001");
 * catalog.save(Paths.get("/media/DICOMDIR"));
 * </pre>
 *
 * A catalog is meant to be used by one thread at a time.
 */
public class DicomCatalog {
    private static final Logger log = LoggerFactory.getLogger(DicomCatalog.class);

    private CatalogHeader header;
    private final CatalogTreeBuilder builder = new CatalogTreeBuilder();
    private final LayoutEngine layoutEngine;
    private List<LoadWarning> loadWarnings = Collections.emptyList();
    private CatalogLayout lastLayout;

    /**
     * Create an empty catalog written by the given application entity.
     */
    public DicomCatalog(String aeTitle) {
        this.header = new CatalogHeader(aeTitle);
        this.layoutEngine = new LayoutEngine(DicomEncodingOptions.DEFAULT);
    }

    /**
     * Create an empty catalog using the configured header defaults and encoding.
     */
    public DicomCatalog(CatalogConfig config) {
        this.header = new CatalogHeader(config.getAeTitle());
        header.setFileSetId(config.getFileSetId());
        header.setTransferSyntaxUid(config.getTransferSyntax());
        if (config.getImplementationClassUid() != null) {
            header.setImplementationClassUid(config.getImplementationClassUid());
        }
        if (config.getImplementationVersionName() != null) {
            header.setImplementationVersionName(config.getImplementationVersionName());
        }
        this.layoutEngine = new LayoutEngine(config.getEncoding().toEncodingOptions());
    }

    /**
     * Read an existing DICOMDIR.
     */
    public static DicomCatalog open(Path dicomDirFile) throws CatalogException, IOException {
        DicomCatalog catalog = new DicomCatalog((String) null);
        catalog.load(dicomDirFile);
        return catalog;
    }

    public CatalogHeader getHeader() {
        return header;
    }

    /**
     * First record of the root directory entity, or null when the catalog is empty.
     */
    public DirectoryRecord getRootRecord() {
        return builder.getRoot();
    }

    /**
     * Records of the root directory entity (patients), in order.
     */
    public Iterable<DirectoryRecord> rootRecords() {
        DirectoryRecord root = builder.getRoot();
        return root != null ? root.siblings() : Collections.emptyList();
    }

    public boolean isEmpty() {
        return builder.getRoot() == null;
    }

    /**
     * Links that were dropped while loading the catalog.
     */
    public List<LoadWarning> getLoadWarnings() {
        return loadWarnings;
    }

    /**
     * Layout computed by the most recent save, or null.
     */
    public CatalogLayout getLastLayout() {
        return lastLayout;
    }

    /**
     * Enter an instance into the catalog.
     *
     * @return true if a new instance record was added
     */
    public boolean insert(CatalogItem item) throws CatalogException {
        return builder.insert(item);
    }

    /**
     * Add a DICOM file. Its file ID is derived from its location relative to the
     * DICOMDIR when the catalog is saved.
     */
    public boolean addFile(Path dicomFile) throws CatalogException, IOException {
        return addFile(dicomFile, null);
    }

    /**
     * Add a DICOM file under an explicit file ID, e.g. {@code "DIR001/IMAGE001"}.
     *
     * @param fileId the Referenced File ID, or null to derive it when the catalog is saved
     */
    public boolean addFile(Path dicomFile, String fileId) throws CatalogException, IOException {
        if (dicomFile == null || dicomFile.toString().isEmpty()) {
            throw new IllegalArgumentException("dicomFile");
        }
        if (!Files.isRegularFile(dicomFile)) {
            throw new NoSuchFileException(dicomFile.toString(), null, "cannot add DICOM file, does not exist");
        }
        try {
            return insert(CatalogItem.read(dicomFile, fileId));
        } catch (CatalogException | IOException e) {
            log.error("Error adding {} to directory: {}", dicomFile, e.getMessage());
            throw e;
        }
    }

    /**
     * Save the catalog to a file.
     */
    public CatalogLayout save(Path dicomDirFile) throws CatalogException, IOException {
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(dicomDirFile))) {
            return save(out, dicomDirFile);
        } catch (IOException e) {
            log.error("Error saving DICOMDIR {}", dicomDirFile);
            throw e;
        }
    }

    /**
     * Write the catalog to a stream.
     *
     * @param dicomDirFile where the bytes will end up; file IDs of files added without one
     *                     are derived relative to it. May be null when every file ID is explicit.
     */
    public CatalogLayout save(OutputStream out, Path dicomDirFile) throws CatalogException, IOException {
        lastLayout = layoutEngine.write(builder.getRoot(), header, out, dicomDirFile);
        log.info("Saved DICOMDIR with {} records ({} bytes of records)", lastLayout.size(),
                lastLayout.getRecordsEnd() - lastLayout.getRecordsStart());
        return lastLayout;
    }

    /**
     * Replace this catalog's header and records with the contents of a DICOMDIR file.
     */
    public void load(Path dicomDirFile) throws CatalogException, IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(dicomDirFile))) {
            load(in);
        } catch (CatalogException | IOException e) {
            log.error("Error loading DICOMDIR {}: {}", dicomDirFile, e.getMessage());
            throw e;
        }
    }

    /**
     * Replace this catalog's header and records with a DICOMDIR read from a stream.
     * On failure the catalog is left as it was.
     */
    public void load(InputStream in) throws CatalogException, IOException {
        CatalogLoader.Result result = new CatalogLoader().load(in);
        header = result.getHeader();
        builder.setRoot(result.getRoot());
        loadWarnings = result.getWarnings();
        lastLayout = null;
        log.info("Loaded DICOMDIR with {} records", result.getRecordCount());
    }

    /**
     * Records reachable from the root, in file order.
     */
    public List<DirectoryRecord> records() {
        return LayoutEngine.flatten(builder.getRoot());
    }

    /**
     * Number of records reachable from the root.
     */
    public int recordCount() {
        return records().size();
    }

    /**
     * Indented listing of the record tree, one record per line.
     */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append("File-set ID: ").append(header.getFileSetId()).append('\n');
        for (DirectoryRecord patient : rootRecords()) {
            dump(sb, patient, 0);
        }
        return sb.toString();
    }

    private static void dump(StringBuilder sb, DirectoryRecord record, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
        sb.append(record.getType().getCode());
        record.getOffset().ifPresent(offset -> sb.append(" @").append(offset));
        sb.append(": ").append(describe(record)).append('\n');
        for (DirectoryRecord child : record.children()) {
            dump(sb, child, depth + 1);
        }
    }

    private static String describe(DirectoryRecord record) {
        switch (record.getType()) {
            case PATIENT:
                return record.getString(Tag.PatientName) + " [" + record.getString(Tag.PatientID) + "]";
            case STUDY:
                return record.getString(Tag.StudyInstanceUID) + " " + nullToEmpty(record.getString(Tag.StudyDescription));
            case SERIES:
                return record.getString(Tag.SeriesInstanceUID) + " " + nullToEmpty(record.getString(Tag.Modality));
            default:
                if (!record.getType().isInstanceLevel()) {
                    return "";
                }
                String[] fileId = record.getAttributes().getStrings(Tag.ReferencedFileID);
                return record.getString(Tag.ReferencedSOPInstanceUIDInFile)
                        + (fileId != null ? " " + String.join("/", fileId) : "");
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
