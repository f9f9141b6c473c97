/*
 * XNAT DICOMDIR
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.dicomdir.catalog;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Sequence;
import org.dcm4che3.data.Tag;
import org.dcm4che3.data.UID;
import org.dcm4che3.io.DicomEncodingOptions;
import org.dcm4che3.io.DicomInputStream;
import org.junit.jupiter.api.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

import static io.xnatworks.dicomdir.catalog.CatalogFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LayoutEngine Tests")
class LayoutEngineTest {

    private CatalogTreeBuilder builder;
    private CatalogHeader header;

    @BeforeEach
    void setUp() throws Exception {
        builder = new CatalogTreeBuilder();
        header = new CatalogHeader("TEST");
        builder.insert(ctItem("P1", "S1", "SE1", "I1"));
        builder.insert(ctItem("P1", "S1", "SE1", "I2"));
        builder.insert(ctItem("P1", "S1", "SE2", "I3"));
        builder.insert(ctItem("P2", "S2", "SE3", "I4"));
    }

    @Nested
    @DisplayName("Flatten Tests")
    class FlattenTests {

        @Test
        @DisplayName("Should place each record before its subtree and its subtree before its next sibling")
        void shouldFlattenDepthFirst() {
            List<String> order = new ArrayList<>();
            for (DirectoryRecord record : LayoutEngine.flatten(builder.getRoot())) {
                order.add(key(record));
            }
            assertEquals(List.of("P1", "S1", "SE1", "I1", "I2", "SE2", "I3", "P2", "S2", "SE3", "I4"), order);
        }

        @Test
        @DisplayName("Should flatten an empty tree to nothing")
        void shouldFlattenEmpty() {
            assertTrue(LayoutEngine.flatten(null).isEmpty());
        }
    }

    @Nested
    @DisplayName("Offset Tests")
    class OffsetTests {

        @Test
        @DisplayName("Should lay out records back to back with undefined item lengths")
        void shouldLayOutContiguously() throws Exception {
            CatalogLayout layout = new LayoutEngine(DicomEncodingOptions.DEFAULT).layout(builder.getRoot(), header, null);
            assertContiguous(layout, 16);
        }

        @Test
        @DisplayName("Should lay out records back to back with explicit item lengths")
        void shouldLayOutContiguouslyWithExplicitLengths() throws Exception {
            DicomEncodingOptions options = new DicomEncodingOptions(false, false, false, false, false);
            CatalogLayout layout = new LayoutEngine(options).layout(builder.getRoot(), header, null);
            assertContiguous(layout, 8);
        }

        @Test
        @DisplayName("Should write next and lower-level offsets with zero for missing links")
        void shouldPatchLinks() throws Exception {
            CatalogLayout layout = new LayoutEngine(DicomEncodingOptions.DEFAULT).layout(builder.getRoot(), header, null);

            for (DirectoryRecord record : layout.getRecords()) {
                long expectedNext = record.getNext() != null ? record.getNext().getOffset().getAsLong() : 0;
                long expectedChild = record.getChild() != null ? record.getChild().getOffset().getAsLong() : 0;
                assertEquals(expectedNext, record.getNextOffset(), record.toString());
                assertEquals(expectedChild, record.getChildOffset(), record.toString());
            }

            DirectoryRecord lastPatient = builder.getRoot().lastSibling();
            assertEquals(0, lastPatient.getNextOffset());
            DirectoryRecord image = lastPatient.getChild().getChild().getChild();
            assertEquals(0, image.getChildOffset());
        }

        @Test
        @DisplayName("Should record the first and last root offsets in the header")
        void shouldSetRootOffsets() throws Exception {
            CatalogLayout layout = new LayoutEngine(DicomEncodingOptions.DEFAULT).layout(builder.getRoot(), header, null);

            assertEquals(layout.getRecordsStart(), header.getFirstRootOffset());
            assertEquals(builder.getRoot().getNext().getOffset().getAsLong(), header.getLastRootOffset());
            assertEquals(header.getFirstRootOffset(), layout.getFirstRootOffset());
            assertEquals(header.getLastRootOffset(), layout.getLastRootOffset());
        }

        @Test
        @DisplayName("Should give the same offsets when laid out twice")
        void shouldBeRepeatable() throws Exception {
            LayoutEngine engine = new LayoutEngine(DicomEncodingOptions.DEFAULT);
            CatalogLayout first = engine.layout(builder.getRoot(), header, null);
            CatalogLayout second = engine.layout(builder.getRoot(), header, null);

            for (int i = 0; i < first.size(); i++) {
                assertEquals(first.getOffset(i), second.getOffset(i));
                assertEquals(first.getEncodedLength(i), second.getEncodedLength(i));
            }
        }

        private void assertContiguous(CatalogLayout layout, int expectedOverhead) {
            assertEquals(11, layout.size());
            assertEquals(expectedOverhead, layout.getItemOverhead());
            assertEquals(layout.getRecordsStart(), layout.getOffset(0));
            for (int i = 0; i + 1 < layout.size(); i++) {
                assertEquals(layout.getOffset(i + 1),
                        layout.getOffset(i) + layout.getEncodedLength(i) + expectedOverhead,
                        "record " + i);
            }
            int last = layout.size() - 1;
            assertEquals(layout.getRecordsEnd(),
                    layout.getOffset(last) + layout.getEncodedLength(last) + expectedOverhead);
        }
    }

    @Nested
    @DisplayName("Write Tests")
    class WriteTests {

        @Test
        @DisplayName("Should write items at exactly the computed offsets")
        void shouldMatchDecodedPositions() throws Exception {
            assertPositionsMatch(new LayoutEngine(DicomEncodingOptions.DEFAULT));
        }

        @Test
        @DisplayName("Should write items at the computed offsets with explicit lengths")
        void shouldMatchDecodedPositionsWithExplicitLengths() throws Exception {
            assertPositionsMatch(new LayoutEngine(new DicomEncodingOptions(false, false, false, false, false)));
        }

        @Test
        @DisplayName("Should write items at the computed offsets in Implicit VR")
        void shouldMatchDecodedPositionsImplicitVR() throws Exception {
            header.setTransferSyntaxUid(UID.ImplicitVRLittleEndian);
            assertPositionsMatch(new LayoutEngine(DicomEncodingOptions.DEFAULT));
        }

        @Test
        @DisplayName("Should write items at the computed offsets with group lengths")
        void shouldMatchDecodedPositionsWithGroupLength() throws Exception {
            assertPositionsMatch(new LayoutEngine(new DicomEncodingOptions(true, true, false, true, false)));
        }

        @Test
        @DisplayName("Should write items at the computed offsets with group lengths in Implicit VR")
        void shouldMatchDecodedPositionsWithGroupLengthImplicitVR() throws Exception {
            header.setTransferSyntaxUid(UID.ImplicitVRLittleEndian);
            assertPositionsMatch(new LayoutEngine(new DicomEncodingOptions(true, true, false, true, false)));
        }

        @Test
        @DisplayName("Should write items at the computed offsets with group lengths and explicit lengths")
        void shouldMatchDecodedPositionsWithGroupLengthAndExplicitLengths() throws Exception {
            assertPositionsMatch(new LayoutEngine(new DicomEncodingOptions(true, false, false, false, false)));
        }

        @Test
        @DisplayName("Should refuse to write an empty catalog")
        void shouldRejectEmptyCatalog() {
            LayoutEngine engine = new LayoutEngine(DicomEncodingOptions.DEFAULT);
            CatalogException e = assertThrows(CatalogException.class,
                    () -> engine.write(null, header, new ByteArrayOutputStream(), null));
            assertEquals(CatalogException.Reason.EMPTY_CATALOG, e.getReason());
        }

        @Test
        @DisplayName("Should refuse to derive file IDs without the DICOMDIR location")
        void shouldRejectPendingFileIdWithoutLocation() throws Exception {
            CatalogTreeBuilder pending = new CatalogTreeBuilder();
            pending.insert(new CatalogItem(null, ctImage("P1", "S1", "SE1", "I1"),
                    java.nio.file.Paths.get("IMG001"), null));

            LayoutEngine engine = new LayoutEngine(DicomEncodingOptions.DEFAULT);
            CatalogException e = assertThrows(CatalogException.class,
                    () -> engine.layout(pending.getRoot(), header, null));
            assertEquals(CatalogException.Reason.MISSING_FILE_ID, e.getReason());
        }

        private void assertPositionsMatch(LayoutEngine engine) throws Exception {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            CatalogLayout layout = engine.write(builder.getRoot(), header, out, null);

            Attributes dataset;
            try (DicomInputStream dis = new DicomInputStream(new ByteArrayInputStream(out.toByteArray()))) {
                dis.readFileMetaInformation();
                dataset = dis.readDataset();
            }
            Sequence sequence = dataset.getSequence(Tag.DirectoryRecordSequence);
            assertEquals(layout.size(), sequence.size());
            for (int i = 0; i < sequence.size(); i++) {
                assertEquals(layout.getOffset(i), sequence.get(i).getItemPosition(), "record " + i);
            }
            assertEquals(header.getFirstRootOffset(),
                    dataset.getInt(Tag.OffsetOfTheFirstDirectoryRecordOfTheRootDirectoryEntity, -1) & 0xFFFFFFFFL);
        }
    }

    private static String key(DirectoryRecord record) {
        switch (record.getType()) {
            case PATIENT:
                return record.getString(Tag.PatientID);
            case STUDY:
                return record.getString(Tag.StudyInstanceUID);
            case SERIES:
                return record.getString(Tag.SeriesInstanceUID);
            default:
                return record.getString(Tag.ReferencedSOPInstanceUIDInFile);
        }
    }
}
