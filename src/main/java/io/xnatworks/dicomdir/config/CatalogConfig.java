/*
 * XNAT DICOMDIR
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.dicomdir.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dcm4che3.data.UID;
import org.dcm4che3.io.DicomEncodingOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * Defaults used when writing DICOMDIR files.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogConfig {
    private static final Logger log = LoggerFactory.getLogger(CatalogConfig.class);

    /**
     * Source AE title recorded in the file meta information.
     */
    @JsonProperty("ae_title")
    private String aeTitle = "DICOMDIR";

    /**
     * File-set ID, at most 16 characters.
     */
    @JsonProperty("file_set_id")
    private String fileSetId = "";

    /**
     * Transfer syntax of the DICOMDIR: explicit (default) or implicit VR little endian.
     */
    @JsonProperty("transfer_syntax")
    private String transferSyntax = UID.ExplicitVRLittleEndian;

    /**
     * Implementation class UID, dcm4che's when not set.
     */
    @JsonProperty("implementation_class_uid")
    private String implementationClassUid;

    /**
     * Implementation version name, dcm4che's when not set.
     */
    @JsonProperty("implementation_version_name")
    private String implementationVersionName;

    private EncodingConfig encoding = new EncodingConfig();

    /**
     * Path to the config file (set when loaded).
     */
    private transient File configFile;

    public static CatalogConfig load(File configFile) throws IOException {
        log.info("Loading configuration from: {}", configFile.getAbsolutePath());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        CatalogConfig config = mapper.readValue(configFile, CatalogConfig.class);
        config.configFile = configFile;
        return config;
    }

    public static CatalogConfig load(String configPath) throws IOException {
        return load(new File(configPath));
    }

    /**
     * Save the configuration to a specific file.
     */
    public void save(File file) throws IOException {
        log.info("Saving configuration to: {}", file.getAbsolutePath());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.writerWithDefaultPrettyPrinter().writeValue(file, this);
    }

    @JsonIgnore
    public File getConfigFile() {
        return configFile;
    }

    public String getAeTitle() {
        return aeTitle;
    }

    public void setAeTitle(String aeTitle) {
        this.aeTitle = aeTitle;
    }

    public String getFileSetId() {
        return fileSetId;
    }

    public void setFileSetId(String fileSetId) {
        this.fileSetId = fileSetId;
    }

    public String getTransferSyntax() {
        return transferSyntax;
    }

    public void setTransferSyntax(String transferSyntax) {
        this.transferSyntax = transferSyntax;
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

    public EncodingConfig getEncoding() {
        return encoding;
    }

    public void setEncoding(EncodingConfig encoding) {
        this.encoding = encoding;
    }

    /**
     * How sequences and items of the DICOMDIR are delimited.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EncodingConfig {
        /**
         * Write the Directory Record Sequence with undefined length and a delimitation item.
         */
        @JsonProperty("undefined_sequence_length")
        private boolean undefinedSequenceLength = true;

        /**
         * Write each record item with undefined length and an item delimitation item.
         */
        @JsonProperty("undefined_item_length")
        private boolean undefinedItemLength = true;

        /**
         * Add group length elements.
         */
        @JsonProperty("group_length")
        private boolean groupLength = false;

        public boolean isUndefinedSequenceLength() {
            return undefinedSequenceLength;
        }

        public void setUndefinedSequenceLength(boolean undefinedSequenceLength) {
            this.undefinedSequenceLength = undefinedSequenceLength;
        }

        public boolean isUndefinedItemLength() {
            return undefinedItemLength;
        }

        public void setUndefinedItemLength(boolean undefinedItemLength) {
            this.undefinedItemLength = undefinedItemLength;
        }

        public boolean isGroupLength() {
            return groupLength;
        }

        public void setGroupLength(boolean groupLength) {
            this.groupLength = groupLength;
        }

        /**
         * The codec options matching this configuration. Empty sequences and items
         * are always written with explicit length.
         */
        public DicomEncodingOptions toEncodingOptions() {
            return new DicomEncodingOptions(groupLength, undefinedSequenceLength, false,
                    undefinedItemLength, false);
        }
    }
}
