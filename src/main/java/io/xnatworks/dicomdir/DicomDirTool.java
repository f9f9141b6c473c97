/*
 * XNAT DICOMDIR
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.dicomdir;

import io.xnatworks.dicomdir.catalog.CatalogException;
import io.xnatworks.dicomdir.catalog.CatalogLayout;
import io.xnatworks.dicomdir.catalog.DicomCatalog;
import io.xnatworks.dicomdir.catalog.DirectoryRecord;
import io.xnatworks.dicomdir.catalog.LoadWarning;
import io.xnatworks.dicomdir.config.CatalogConfig;
import org.dcm4che3.data.UID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * XNAT DICOMDIR - command line tool
 *
 * Creates, extends and inspects DICOMDIR files:
 * - create a DICOMDIR for a directory tree of DICOM files
 * - add files to an existing DICOMDIR
 * - list the patient / study / series / instance tree
 * - dump the attributes of every record
 * - verify that every record link resolves
 */
@Command(name = "dicomdir",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "Create and inspect DICOMDIR files",
        subcommands = {
                DicomDirTool.CreateCommand.class,
                DicomDirTool.AddCommand.class,
                DicomDirTool.ListCommand.class,
                DicomDirTool.DumpCommand.class,
                DicomDirTool.VerifyCommand.class
        })
public class DicomDirTool implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(DicomDirTool.class);

    @Option(names = {"-c", "--config"}, description = "Config file path", defaultValue = "dicomdir.yaml")
    protected File configFile;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DicomDirTool()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    /**
     * The configuration file if it exists, defaults otherwise.
     */
    CatalogConfig loadConfig() throws IOException {
        if (configFile != null && configFile.isFile()) {
            return CatalogConfig.load(configFile);
        }
        log.debug("No config file at {}, using defaults", configFile);
        return new CatalogConfig();
    }

    // ========================================================================
    // CREATE COMMAND - Build a new DICOMDIR
    // ========================================================================

    @Command(name = "create", description = "Create a DICOMDIR from DICOM files and directories")
    static class CreateCommand implements Callable<Integer> {

        @ParentCommand
        private DicomDirTool parent;

        @Option(names = {"-o", "--output"}, required = true, description = "DICOMDIR file to write")
        private File output;

        @Option(names = {"--fileset-id"}, description = "File-set ID (max 16 characters)")
        private String fileSetId;

        @Option(names = {"--implicit"}, description = "Write the DICOMDIR in Implicit VR Little Endian")
        private boolean implicitVR;

        @Parameters(arity = "1..*", description = "DICOM files or directories to scan")
        private List<File> inputs;

        @Override
        public Integer call() throws Exception {
            CatalogConfig config = parent.loadConfig();
            if (implicitVR) {
                config.setTransferSyntax(UID.ImplicitVRLittleEndian);
            }
            DicomCatalog catalog = new DicomCatalog(config);
            if (fileSetId != null) {
                catalog.getHeader().setFileSetId(fileSetId);
            }

            int failed = addAll(catalog, inputs);
            if (catalog.isEmpty()) {
                System.err.println("No DICOM files could be added.");
                return 1;
            }

            CatalogLayout layout = catalog.save(output.toPath());
            System.out.printf("Wrote %s with %d records%n", output.getAbsolutePath(), layout.size());
            return failed > 0 ? 2 : 0;
        }
    }

    // ========================================================================
    // ADD COMMAND - Add files to an existing DICOMDIR
    // ========================================================================

    @Command(name = "add", description = "Add DICOM files to an existing DICOMDIR")
    static class AddCommand implements Callable<Integer> {

        @ParentCommand
        private DicomDirTool parent;

        @Parameters(index = "0", description = "DICOMDIR file")
        private File dicomDir;

        @Parameters(index = "1..*", arity = "1..*", description = "DICOM files or directories to add")
        private List<File> inputs;

        @Override
        public Integer call() throws Exception {
            if (!dicomDir.isFile()) {
                System.err.println("DICOMDIR does not exist: " + dicomDir.getAbsolutePath());
                return 1;
            }
            // Rewrite with the configured encoding, not the codec defaults
            DicomCatalog catalog = new DicomCatalog(parent.loadConfig());
            catalog.load(dicomDir.toPath());
            int before = catalog.recordCount();
            int failed = addAll(catalog, inputs);
            CatalogLayout layout = catalog.save(dicomDir.toPath());
            System.out.printf("Added %d records, %s now has %d records%n",
                    layout.size() - before, dicomDir.getName(), layout.size());
            return failed > 0 ? 2 : 0;
        }
    }

    // ========================================================================
    // LIST COMMAND - Print the record tree
    // ========================================================================

    @Command(name = "list", description = "List the patient / study / series / instance tree")
    static class ListCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "DICOMDIR file")
        private File dicomDir;

        @Override
        public Integer call() throws Exception {
            DicomCatalog catalog = DicomCatalog.open(dicomDir.toPath());
            System.out.print(catalog.dump());
            return 0;
        }
    }

    // ========================================================================
    // DUMP COMMAND - Print every record's attributes
    // ========================================================================

    @Command(name = "dump", description = "Print the attributes of every directory record")
    static class DumpCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "DICOMDIR file")
        private File dicomDir;

        @Option(names = {"--width"}, description = "Maximum line width", defaultValue = "120")
        private int width;

        @Override
        public Integer call() throws Exception {
            DicomCatalog catalog = DicomCatalog.open(dicomDir.toPath());
            System.out.printf("File-set ID:     %s%n", catalog.getHeader().getFileSetId());
            System.out.printf("Transfer Syntax: %s%n", catalog.getHeader().getTransferSyntaxUid());
            System.out.printf("Root records:    %d - %d%n",
                    catalog.getHeader().getFirstRootOffset(), catalog.getHeader().getLastRootOffset());
            for (DirectoryRecord record : catalog.records()) {
                System.out.println();
                System.out.println(record);
                System.out.println(record.getAttributes().toString(Integer.MAX_VALUE, width));
            }
            return 0;
        }
    }

    // ========================================================================
    // VERIFY COMMAND - Check that all links resolve
    // ========================================================================

    @Command(name = "verify", description = "Load a DICOMDIR and report links that do not resolve")
    static class VerifyCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "DICOMDIR file")
        private File dicomDir;

        @Override
        public Integer call() {
            DicomCatalog catalog;
            try {
                catalog = DicomCatalog.open(dicomDir.toPath());
            } catch (CatalogException e) {
                System.err.println("Invalid DICOMDIR (" + e.getReason() + "): " + e.getMessage());
                return 1;
            } catch (IOException e) {
                System.err.println("Cannot read DICOMDIR: " + e.getMessage());
                return 1;
            }

            List<LoadWarning> warnings = catalog.getLoadWarnings();
            System.out.printf("%d linked records%n", catalog.recordCount());
            if (warnings.isEmpty()) {
                System.out.println("All record links resolve.");
                return 0;
            }
            System.out.printf("%d unresolved links:%n", warnings.size());
            for (LoadWarning warning : warnings) {
                System.out.println("  " + warning);
            }
            return 1;
        }
    }

    // ========================================================================
    // File scanning
    // ========================================================================

    /**
     * Add every DICOM file found under the inputs.
     *
     * @return number of files that could not be added
     */
    static int addAll(DicomCatalog catalog, List<File> inputs) {
        List<File> files = new ArrayList<>();
        for (File input : inputs) {
            if (input.isDirectory()) {
                scanDirectory(input, files);
            } else if (input.isFile()) {
                files.add(input);
            } else {
                System.err.println("Not found: " + input.getAbsolutePath());
            }
        }

        int added = 0;
        int failed = 0;
        for (File file : files) {
            Path path = file.toPath();
            try {
                if (catalog.addFile(path)) {
                    added++;
                }
            } catch (CatalogException | IOException e) {
                log.warn("Skipping {}: {}", path, e.getMessage());
                failed++;
            }
        }
        System.out.printf("Scanned %d files: %d added, %d skipped%n", files.size(), added, failed);
        return failed;
    }

    private static void scanDirectory(File dir, List<File> results) {
        File[] files = dir.listFiles();
        if (files == null) return;

        Arrays.sort(files);
        for (File f : files) {
            if (f.isFile()) {
                if (isDicomFile(f)) {
                    results.add(f);
                }
            } else if (f.isDirectory()) {
                scanDirectory(f, results);
            }
        }
    }

    static boolean isDicomFile(File file) {
        String name = file.getName();
        if ("DICOMDIR".equalsIgnoreCase(name)) {
            return false;
        }
        String lower = name.toLowerCase();
        if (lower.endsWith(".dcm") || lower.endsWith(".dicom")) {
            return true;
        }

        // DICM prefix after the 128 byte preamble
        if (file.length() > 132) {
            try (RandomAccessFile raf = new RandomAccessFile(file, "r")) {
                raf.seek(128);
                byte[] magic = new byte[4];
                raf.readFully(magic);
                return magic[0] == 'D' && magic[1] == 'I' && magic[2] == 'C' && magic[3] == 'M';
            } catch (IOException e) {
                log.debug("Cannot read {}: {}", file, e.getMessage());
            }
        }
        return false;
    }
}
