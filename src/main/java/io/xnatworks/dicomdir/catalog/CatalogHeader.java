/*
 * XNAT DICOMDIR
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.dicomdir.catalog;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Implementation;
import org.dcm4che3.data.Tag;
import org.dcm4che3.data.UID;
import org.dcm4che3.data.VR;
import org.dcm4che3.util.UIDUtils;

/**
 * File-set level information of a DICOMDIR: the file meta information
 * and the File-set Identification and Directory Information module
 * attributes that are not directory records.
 */
public class CatalogHeader {

    public static final int MAX_FILE_SET_ID_LENGTH = 16;

    private String fileSetId = "";
    private String fileSetDescriptorFileId;
    private String descriptorFileCharacterSet;
    private String sourceApplicationEntityTitle;
    private String transferSyntaxUid = UID.ExplicitVRLittleEndian;
    private String implementationClassUid = Implementation.getClassUID();
    private String implementationVersionName = Implementation.getVersionName();
    private String mediaStorageSopInstanceUid = UIDUtils.createUID();
    private String privateInformationCreatorUid;
    private long firstRootOffset;
    private long lastRootOffset;
    private int consistencyFlag;

    public CatalogHeader() {
    }

    public CatalogHeader(String sourceApplicationEntityTitle) {
        this.sourceApplicationEntityTitle = sourceApplicationEntityTitle;
    }

    /**
     * Short human readable label of the file-set, at most 16 characters after trimming.
     */
    public String getFileSetId() {
        return fileSetId;
    }

    public void setFileSetId(String fileSetId) {
        String trimmed = fileSetId == null ? "" : fileSetId.trim();
        if (trimmed.length() > MAX_FILE_SET_ID_LENGTH) {
            throw new IllegalArgumentException(
                    "File-set ID can only be a maximum of " + MAX_FILE_SET_ID_LENGTH + " characters: " + trimmed);
        }
        this.fileSetId = trimmed;
    }

    public String getFileSetDescriptorFileId() {
        return fileSetDescriptorFileId;
    }

    public void setFileSetDescriptorFileId(String fileSetDescriptorFileId) {
        this.fileSetDescriptorFileId = fileSetDescriptorFileId;
    }

    public String getDescriptorFileCharacterSet() {
        return descriptorFileCharacterSet;
    }

    public void setDescriptorFileCharacterSet(String descriptorFileCharacterSet) {
        this.descriptorFileCharacterSet = descriptorFileCharacterSet;
    }

    public String getSourceApplicationEntityTitle() {
        return sourceApplicationEntityTitle;
    }

    public void setSourceApplicationEntityTitle(String sourceApplicationEntityTitle) {
        this.sourceApplicationEntityTitle = sourceApplicationEntityTitle;
    }

    public String getTransferSyntaxUid() {
        return transferSyntaxUid;
    }

    /**
     * Only the uncompressed little endian transfer syntaxes are valid for a DICOMDIR.
     */
    public void setTransferSyntaxUid(String transferSyntaxUid) {
        if (!UID.ExplicitVRLittleEndian.equals(transferSyntaxUid)
                && !UID.ImplicitVRLittleEndian.equals(transferSyntaxUid)) {
            throw new IllegalArgumentException("Unsupported transfer syntax for DICOMDIR: " + transferSyntaxUid);
        }
        this.transferSyntaxUid = transferSyntaxUid;
    }

    public boolean isExplicitVR() {
        return !UID.ImplicitVRLittleEndian.equals(transferSyntaxUid);
    }

    public String getImplementationClassUid() {
        return implementationClassUid;
    }

    public void setImplementationClassUid(String implementationClassUid) {
        this.implementationClassUid = implementationClassUid;
    }

    public String getImplementationVersionName() {
        return implementationVersionName;
    }

    public void setImplementationVersionName(String implementationVersionName) {
        this.implementationVersionName = implementationVersionName;
    }

    public String getMediaStorageSopInstanceUid() {
        return mediaStorageSopInstanceUid;
    }

    public void setMediaStorageSopInstanceUid(String mediaStorageSopInstanceUid) {
        this.mediaStorageSopInstanceUid = mediaStorageSopInstanceUid;
    }

    public String getPrivateInformationCreatorUid() {
        return privateInformationCreatorUid;
    }

    public void setPrivateInformationCreatorUid(String privateInformationCreatorUid) {
        this.privateInformationCreatorUid = privateInformationCreatorUid;
    }

    /**
     * Offset of the first record of the root directory entity, 0 when there is none.
     */
    public long getFirstRootOffset() {
        return firstRootOffset;
    }

    void setFirstRootOffset(long firstRootOffset) {
        this.firstRootOffset = firstRootOffset;
    }

    /**
     * Offset of the last record of the root directory entity, 0 when there is none.
     */
    public long getLastRootOffset() {
        return lastRootOffset;
    }

    void setLastRootOffset(long lastRootOffset) {
        this.lastRootOffset = lastRootOffset;
    }

    public int getConsistencyFlag() {
        return consistencyFlag;
    }

    public void setConsistencyFlag(int consistencyFlag) {
        this.consistencyFlag = consistencyFlag & 0xFFFF;
    }

    /**
     * Build the file meta information group written in front of the DICOMDIR dataset.
     */
    public Attributes toFileMetaInformation() {
        Attributes fmi = Attributes.createFileMetaInformation(
                mediaStorageSopInstanceUid, UID.MediaStorageDirectoryStorage, transferSyntaxUid);
        if (implementationClassUid != null) {
            fmi.setString(Tag.ImplementationClassUID, VR.UI, implementationClassUid);
        }
        if (implementationVersionName != null) {
            fmi.setString(Tag.ImplementationVersionName, VR.SH, implementationVersionName);
        }
        if (sourceApplicationEntityTitle != null && !sourceApplicationEntityTitle.isEmpty()) {
            fmi.setString(Tag.SourceApplicationEntityTitle, VR.AE, sourceApplicationEntityTitle);
        }
        if (privateInformationCreatorUid != null) {
            fmi.setString(Tag.PrivateInformationCreatorUID, VR.UI, privateInformationCreatorUid);
        }
        return fmi;
    }

    /**
     * Build the dataset attributes that precede and follow the record sequence.
     * The record sequence itself is added by the layout.
     */
    Attributes toDataset() {
        Attributes dataset = new Attributes();
        dataset.setString(Tag.FileSetID, VR.CS, fileSetId);
        if (fileSetDescriptorFileId != null && !fileSetDescriptorFileId.isEmpty()) {
            dataset.setString(Tag.FileSetDescriptorFileID, VR.CS, RecordPaths.toFileIdComponents(fileSetDescriptorFileId));
            if (descriptorFileCharacterSet != null) {
                dataset.setString(Tag.SpecificCharacterSetOfFileSetDescriptorFile, VR.CS, descriptorFileCharacterSet);
            }
        }
        dataset.setInt(Tag.OffsetOfTheFirstDirectoryRecordOfTheRootDirectoryEntity, VR.UL, (int) firstRootOffset);
        dataset.setInt(Tag.OffsetOfTheLastDirectoryRecordOfTheRootDirectoryEntity, VR.UL, (int) lastRootOffset);
        dataset.setInt(Tag.FileSetConsistencyFlag, VR.US, consistencyFlag);
        return dataset;
    }

    /**
     * Rebuild a header from the file meta information and dataset read from a DICOMDIR.
     *
     * @param fmi     file meta information, may be null for streams without one
     * @param dataset the DICOMDIR dataset
     */
    static CatalogHeader from(Attributes fmi, Attributes dataset) {
        CatalogHeader header = new CatalogHeader();
        if (fmi != null) {
            header.sourceApplicationEntityTitle = fmi.getString(Tag.SourceApplicationEntityTitle);
            header.transferSyntaxUid = fmi.getString(Tag.TransferSyntaxUID, UID.ExplicitVRLittleEndian);
            header.implementationClassUid = fmi.getString(Tag.ImplementationClassUID);
            header.implementationVersionName = fmi.getString(Tag.ImplementationVersionName);
            header.mediaStorageSopInstanceUid = fmi.getString(Tag.MediaStorageSOPInstanceUID,
                    header.mediaStorageSopInstanceUid);
            header.privateInformationCreatorUid = fmi.getString(Tag.PrivateInformationCreatorUID);
        }
        header.fileSetId = dataset.getString(Tag.FileSetID, "").trim();
        String[] descriptor = dataset.getStrings(Tag.FileSetDescriptorFileID);
        if (descriptor != null && descriptor.length > 0) {
            header.fileSetDescriptorFileId = String.join("/", descriptor);
        }
        header.descriptorFileCharacterSet = dataset.getString(Tag.SpecificCharacterSetOfFileSetDescriptorFile);
        header.firstRootOffset = DirectoryRecord.readOffset(dataset,
                Tag.OffsetOfTheFirstDirectoryRecordOfTheRootDirectoryEntity);
        header.lastRootOffset = DirectoryRecord.readOffset(dataset,
                Tag.OffsetOfTheLastDirectoryRecordOfTheRootDirectoryEntity);
        header.consistencyFlag = dataset.getInt(Tag.FileSetConsistencyFlag, 0) & 0xFFFF;
        return header;
    }
}
