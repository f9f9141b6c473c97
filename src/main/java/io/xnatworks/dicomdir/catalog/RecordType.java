/*
 * XNAT DICOMDIR
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.dicomdir.catalog;

import java.util.HashMap;
import java.util.Map;

/**
 * Directory record types (0004,1430) that may appear in a DICOMDIR.
 * Each constant carries the code string written to the record.
 */
public enum RecordType {
    PATIENT("PATIENT"),
    STUDY("STUDY"),
    SERIES("SERIES"),
    IMAGE("IMAGE"),
    RT_DOSE("RT DOSE"),
    RT_STRUCTURE_SET("RT STRUCTURE SET"),
    RT_PLAN("RT PLAN"),
    RT_TREAT_RECORD("RT TREAT RECORD"),
    PRESENTATION("PRESENTATION"),
    WAVEFORM("WAVEFORM"),
    SR_DOCUMENT("SR DOCUMENT"),
    KEY_OBJECT_DOC("KEY OBJECT DOC"),
    SPECTROSCOPY("SPECTROSCOPY"),
    RAW_DATA("RAW DATA"),
    REGISTRATION("REGISTRATION"),
    FIDUCIAL("FIDUCIAL"),
    HANGING_PROTOCOL("HANGING PROTOCOL"),
    ENCAP_DOC("ENCAP DOC"),
    HL7_STRUC_DOC("HL7 STRUC DOC"),
    VALUE_MAP("VALUE MAP"),
    STEREOMETRIC("STEREOMETRIC"),
    TOPIC("TOPIC"),
    VISIT("VISIT"),
    RESULTS("RESULTS"),
    INTERPRETATION("INTERPRETATION"),
    STUDY_COMPONENT("STUDY COMPONENT"),
    STORED_PRINT("STORED PRINT"),
    OVERLAY("OVERLAY"),
    MODALITY_LUT("MODALITY LUT"),
    VOI_LUT("VOI LUT"),
    CURVE("CURVE"),
    MRDR("MRDR"),
    PRIVATE("PRIVATE");

    private static final Map<String, RecordType> BY_CODE = new HashMap<>();
    static {
        for (RecordType type : values()) {
            BY_CODE.put(type.code, type);
        }
    }

    private final String code;

    RecordType(String code) {
        this.code = code;
    }

    /**
     * The code string stored in DirectoryRecordType (0004,1430).
     */
    public String getCode() {
        return code;
    }

    /**
     * Map a stored code string back to a record type.
     * Unknown or missing codes are treated as {@link #PRIVATE}.
     */
    public static RecordType fromCode(String code) {
        if (code == null) {
            return PRIVATE;
        }
        RecordType type = BY_CODE.get(code.trim().toUpperCase());
        return type != null ? type : PRIVATE;
    }

    /**
     * Whether records of this type reference a stored instance, as opposed to
     * the patient/study/series grouping levels above them.
     */
    public boolean isInstanceLevel() {
        switch (this) {
            case PATIENT:
            case STUDY:
            case SERIES:
            case TOPIC:
            case VISIT:
            case RESULTS:
            case INTERPRETATION:
            case STUDY_COMPONENT:
            case PRIVATE:
                return false;
            default:
                return true;
        }
    }

    @Override
    public String toString() {
        return code;
    }
}
