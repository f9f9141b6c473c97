/*
 * XNAT DICOMDIR
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.dicomdir.catalog;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Conversions between file system paths and Referenced File ID (0004,1500) values.
 * A file ID is stored as one CS value per path component.
 */
final class RecordPaths {

    private RecordPaths() {
    }

    /**
     * Split a file ID given with '/' or '\' separators into its components.
     */
    static String[] toFileIdComponents(String fileId) {
        List<String> components = new ArrayList<>();
        for (String part : fileId.split("[/\\\\]")) {
            if (!part.isEmpty()) {
                components.add(part);
            }
        }
        return components.toArray(new String[0]);
    }

    /**
     * File ID of {@code file} relative to the directory that holds the DICOMDIR.
     * Files on a different root keep their absolute path components.
     */
    static String[] relativeFileId(Path dicomDirFile, Path file) {
        Path absoluteFile = file.toAbsolutePath().normalize();
        Path baseDir = dicomDirFile.toAbsolutePath().normalize().getParent();
        Path relative;
        if (baseDir == null) {
            relative = absoluteFile;
        } else {
            try {
                relative = baseDir.relativize(absoluteFile);
            } catch (IllegalArgumentException e) {
                relative = absoluteFile;
            }
        }
        return toComponents(relative);
    }

    private static String[] toComponents(Path path) {
        List<String> components = new ArrayList<>();
        for (Path part : path) {
            components.add(part.toString());
        }
        return components.toArray(new String[0]);
    }
}
