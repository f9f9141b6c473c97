/*
 * XNAT DICOMDIR
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.dicomdir.catalog;

/**
 * A link field of a loaded record that could not be followed. The link is dropped;
 * media written by other applications sometimes carry such offsets, so this is
 * reported rather than rejected.
 */
public final class LoadWarning {

    /**
     * Which link field could not be resolved.
     */
    public enum Link {
        NEXT,
        CHILD
    }

    /**
     * Why the link was dropped.
     */
    public enum Problem {
        /** No record starts at the target offset. */
        UNRESOLVED_OFFSET,
        /** The target record is the root record or is already linked from another record. */
        ALREADY_LINKED
    }

    private final long recordOffset;
    private final Link link;
    private final long targetOffset;
    private final Problem problem;

    public LoadWarning(long recordOffset, Link link, long targetOffset, Problem problem) {
        this.recordOffset = recordOffset;
        this.link = link;
        this.targetOffset = targetOffset;
        this.problem = problem;
    }

    /**
     * Offset of the record holding the unresolved link.
     */
    public long getRecordOffset() {
        return recordOffset;
    }

    public Link getLink() {
        return link;
    }

    public long getTargetOffset() {
        return targetOffset;
    }

    public Problem getProblem() {
        return problem;
    }

    @Override
    public String toString() {
        String reason = problem == Problem.UNRESOLVED_OFFSET
                ? " does not point at a record"
                : " points at a record that is already linked";
        return "Record @" + recordOffset + ": " + link + " offset " + targetOffset + reason;
    }
}
