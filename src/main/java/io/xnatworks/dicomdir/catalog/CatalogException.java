/*
 * XNAT DICOMDIR
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.dicomdir.catalog;

/**
 * Exception thrown when a catalog cannot be built, saved or loaded.
 * Encoding and decoding failures of the DICOM stream itself are reported
 * as the {@link java.io.IOException}s raised by the codec.
 */
public class CatalogException extends Exception {

    /**
     * Why the catalog operation was rejected.
     */
    public enum Reason {
        /** The SOP class of an instance has no directory record type. */
        UNSUPPORTED_RECORD_TYPE,
        /** Save attempted on a catalog without records. */
        EMPTY_CATALOG,
        /** The stream has no Directory Record Sequence (0004,1220). */
        MISSING_RECORD_SEQUENCE,
        /** The first root record offset does not point at a record. */
        DANGLING_ROOT_OFFSET,
        /** An instance record has neither a file ID nor a source file to derive one from. */
        MISSING_FILE_ID
    }

    private final Reason reason;

    public CatalogException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
