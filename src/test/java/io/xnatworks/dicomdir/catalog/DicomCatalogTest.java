/*
 * XNAT DICOMDIR
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.dicomdir.catalog;

import io.xnatworks.dicomdir.config.CatalogConfig;
import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Tag;
import org.dcm4che3.data.UID;
import org.dcm4che3.data.VR;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static io.xnatworks.dicomdir.catalog.CatalogFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DicomCatalog Tests")
class DicomCatalogTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("Adding Files Tests")
    class AddingFilesTests {

        @Test
        @DisplayName("Should derive file IDs relative to the saved DICOMDIR")
        void shouldDeriveFileIds() throws Exception {
            Path image1 = tempDir.resolve("DIR001").resolve("IMG001");
            Path image2 = tempDir.resolve("DIR001").resolve("IMG002");
            writeDicomFile(image1, ctImage("P1", "1.2.1", "1.2.1.1", "1.2.1.1.1"));
            writeDicomFile(image2, ctImage("P1", "1.2.1", "1.2.1.1", "1.2.1.1.2"));

            DicomCatalog catalog = new DicomCatalog("TEST");
            assertTrue(catalog.addFile(image1));
            assertTrue(catalog.addFile(image2));
            Path dicomDir = tempDir.resolve("DICOMDIR");
            catalog.save(dicomDir);

            DicomCatalog loaded = DicomCatalog.open(dicomDir);
            List<String> fileIds = new ArrayList<>();
            for (DirectoryRecord record : loaded.records()) {
                if (record.getType() == RecordType.IMAGE) {
                    fileIds.add(String.join("/", record.getAttributes().getStrings(Tag.ReferencedFileID)));
                }
            }
            assertEquals(List.of("DIR001/IMG001", "DIR001/IMG002"), fileIds);
        }

        @Test
        @DisplayName("Should use an explicit file ID as given")
        void shouldUseExplicitFileId() throws Exception {
            Path source = tempDir.resolve("incoming").resolve("ct.dcm");
            writeDicomFile(source, ctImage("P1", "1.2.1", "1.2.1.1", "1.2.1.1.1"));

            DicomCatalog catalog = new DicomCatalog("TEST");
            catalog.addFile(source, "DIR002\\IMG001");

            DirectoryRecord image = catalog.getRootRecord().getChild().getChild().getChild();
            assertArrayEquals(new String[] {"DIR002", "IMG001"}, image.getAttributes().getStrings(Tag.ReferencedFileID));
            assertEquals(UID.ExplicitVRLittleEndian, image.getString(Tag.ReferencedTransferSyntaxUIDInFile));
        }

        @Test
        @DisplayName("Should fail for files that do not exist")
        void shouldFailForMissingFile() {
            DicomCatalog catalog = new DicomCatalog("TEST");

            assertThrows(NoSuchFileException.class, () -> catalog.addFile(tempDir.resolve("missing.dcm")));
            assertThrows(IllegalArgumentException.class, () -> catalog.addFile(null));
            assertTrue(catalog.isEmpty());
        }

        @Test
        @DisplayName("Should report a duplicate file as not added")
        void shouldIgnoreDuplicateFile() throws Exception {
            Path image = tempDir.resolve("IMG001");
            writeDicomFile(image, ctImage("P1", "1.2.1", "1.2.1.1", "1.2.1.1.1"));

            DicomCatalog catalog = new DicomCatalog("TEST");
            assertTrue(catalog.addFile(image));
            assertFalse(catalog.addFile(image));
            assertEquals(4, catalog.recordCount());
        }
    }

    @Nested
    @DisplayName("Save And Load Tests")
    class SaveAndLoadTests {

        @Test
        @DisplayName("Should refuse to save an empty catalog")
        void shouldRefuseEmptySave() {
            DicomCatalog catalog = new DicomCatalog("TEST");

            CatalogException e = assertThrows(CatalogException.class,
                    () -> catalog.save(new ByteArrayOutputStream(), null));
            assertEquals(CatalogException.Reason.EMPTY_CATALOG, e.getReason());
        }

        @Test
        @DisplayName("Should restore header and records")
        void shouldRoundTrip() throws Exception {
            DicomCatalog catalog = new DicomCatalog("STORESCU");
            catalog.getHeader().setFileSetId("MY FILE SET");
            catalog.insert(ctItem("P1", "S1", "SE1", "I1"));
            catalog.insert(ctItem("P1", "S1", "SE2", "I2"));
            catalog.insert(ctItem("P2", "S2", "SE3", "I3"));
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            CatalogLayout layout = catalog.save(out, null);
            assertSame(layout, catalog.getLastLayout());

            DicomCatalog loaded = new DicomCatalog("OTHER");
            loaded.load(new ByteArrayInputStream(out.toByteArray()));

            assertEquals("MY FILE SET", loaded.getHeader().getFileSetId());
            assertEquals("STORESCU", loaded.getHeader().getSourceApplicationEntityTitle());
            assertEquals(catalog.getHeader().getMediaStorageSopInstanceUid(),
                    loaded.getHeader().getMediaStorageSopInstanceUid());
            assertEquals(catalog.recordCount(), loaded.recordCount());
            assertEquals(catalog.dump(), loaded.dump());
            assertTrue(loaded.getLoadWarnings().isEmpty());
            assertNull(loaded.getLastLayout());
        }

        @Test
        @DisplayName("Should extend a loaded catalog and save it again")
        void shouldExtendLoadedCatalog() throws Exception {
            DicomCatalog catalog = new DicomCatalog("TEST");
            catalog.insert(ctItem("P1", "S1", "SE1", "I1"));
            ByteArrayOutputStream first = new ByteArrayOutputStream();
            catalog.save(first, null);

            DicomCatalog loaded = new DicomCatalog("TEST");
            loaded.load(new ByteArrayInputStream(first.toByteArray()));
            assertTrue(loaded.insert(ctItem("P1", "S1", "SE1", "I2")));
            assertFalse(loaded.insert(ctItem("P1", "S1", "SE1", "I1")));
            ByteArrayOutputStream second = new ByteArrayOutputStream();
            loaded.save(second, null);

            DicomCatalog reloaded = new DicomCatalog("TEST");
            reloaded.load(new ByteArrayInputStream(second.toByteArray()));
            assertEquals(5, reloaded.recordCount());
            assertTrue(reloaded.getLoadWarnings().isEmpty());
        }

        @Test
        @DisplayName("Should leave the catalog unchanged when loading fails")
        void shouldKeepStateOnFailedLoad() throws Exception {
            DicomCatalog catalog = new DicomCatalog("TEST");
            catalog.insert(ctItem("P1", "S1", "SE1", "I1"));
            Path notADicomDir = tempDir.resolve("not-a-dicomdir");
            Attributes plain = new Attributes();
            plain.setString(Tag.SOPClassUID, VR.UI, UID.CTImageStorage);
            plain.setString(Tag.SOPInstanceUID, VR.UI, "1.2.3");
            plain.setString(Tag.PatientID, VR.LO, "P1");
            writeDicomFile(notADicomDir, plain);

            assertThrows(CatalogException.class, () -> catalog.load(notADicomDir));
            assertEquals(4, catalog.recordCount());
            assertEquals("TEST", catalog.getHeader().getSourceApplicationEntityTitle());
        }

        @Test
        @DisplayName("Should write Implicit VR when configured")
        void shouldUseConfiguredTransferSyntax() throws Exception {
            CatalogConfig config = new CatalogConfig();
            config.setFileSetId("CONFIGURED");
            config.setTransferSyntax(UID.ImplicitVRLittleEndian);
            config.getEncoding().setUndefinedItemLength(false);
            config.getEncoding().setUndefinedSequenceLength(false);

            DicomCatalog catalog = new DicomCatalog(config);
            catalog.insert(ctItem("P1", "S1", "SE1", "I1"));
            catalog.insert(ctItem("P2", "S2", "SE2", "I2"));
            Path dicomDir = tempDir.resolve("DICOMDIR");
            CatalogLayout layout = catalog.save(dicomDir);
            assertEquals(8, layout.getItemOverhead());

            DicomCatalog loaded = DicomCatalog.open(dicomDir);
            assertEquals(UID.ImplicitVRLittleEndian, loaded.getHeader().getTransferSyntaxUid());
            assertEquals("CONFIGURED", loaded.getHeader().getFileSetId());
            assertTrue(loaded.getLoadWarnings().isEmpty());
            assertEquals(8, loaded.recordCount());
            assertTrue(Files.size(dicomDir) > layout.getRecordsStart());
        }
    }

    @Test
    @DisplayName("Should list the tree with one indented line per record")
    void shouldDumpTree() throws Exception {
        DicomCatalog catalog = new DicomCatalog("TEST");
        catalog.getHeader().setFileSetId("SET");
        catalog.insert(ctItem("P1", "S1", "SE1", "I1"));

        String[] lines = catalog.dump().split("\n");

        assertEquals("File-set ID: SET", lines[0]);
        assertTrue(lines[1].startsWith("PATIENT: Doe^P1 [P1]"));
        assertTrue(lines[2].startsWith("  STUDY: S1"));
        assertTrue(lines[3].startsWith("    SERIES: SE1 CT"));
        assertTrue(lines[4].startsWith("      IMAGE: I1 DIR/I1"));
    }

    @Test
    @DisplayName("Should list records that do not reference an instance without file details")
    void shouldDumpNonInstanceRecord() throws Exception {
        DicomCatalog catalog = new DicomCatalog("TEST");
        catalog.insert(ctItem("P1", "S1", "SE1", "I1"));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        catalog.save(out, null);
        // Same encoded length as IMAGE
        byte[] bytes = rewrite(out.toByteArray(), dataset -> dataset.getSequence(Tag.DirectoryRecordSequence)
                .get(3).setString(Tag.DirectoryRecordType, VR.CS, "TOPIC"));

        DicomCatalog loaded = new DicomCatalog("TEST");
        loaded.load(new ByteArrayInputStream(bytes));
        String[] lines = loaded.dump().split("\n");

        assertEquals(5, lines.length);
        assertTrue(lines[4].startsWith("      TOPIC @"));
        assertTrue(lines[4].endsWith(": "));
        assertFalse(lines[4].contains("DIR/I1"));
    }
}
