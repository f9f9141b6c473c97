/*
 * XNAT DICOMDIR
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.dicomdir.catalog;

import org.dcm4che3.data.Tag;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Static lookup tables used when building directory records:
 * storage SOP Class UID to record type, and record type to the attributes
 * copied from the referenced instance into its record.
 */
public final class RecordTypeDirectory {

    private static final Map<String, RecordType> SOP_CLASS_TYPES;
    private static final Map<RecordType, int[]> REQUIRED_FIELDS;

    private static final int[] NO_FIELDS = new int[0];

    static {
        Map<String, RecordType> types = new HashMap<>();

        // Waveforms
        types.put("1.2.840.10008.5.1.4.1.1.9.1.1", RecordType.WAVEFORM);      // 12-lead ECG
        types.put("1.2.840.10008.5.1.4.1.1.9.1.2", RecordType.WAVEFORM);      // General ECG
        types.put("1.2.840.10008.5.1.4.1.1.9.1.3", RecordType.WAVEFORM);      // Ambulatory ECG
        types.put("1.2.840.10008.5.1.4.1.1.9.2.1", RecordType.WAVEFORM);      // Hemodynamic
        types.put("1.2.840.10008.5.1.4.1.1.9.3.1", RecordType.WAVEFORM);      // Cardiac Electrophysiology
        types.put("1.2.840.10008.5.1.4.1.1.9.4.1", RecordType.WAVEFORM);      // Basic Voice Audio

        // Structured reports
        types.put("1.2.840.10008.5.1.4.1.1.88.11", RecordType.SR_DOCUMENT);   // Basic Text SR
        types.put("1.2.840.10008.5.1.4.1.1.88.22", RecordType.SR_DOCUMENT);   // Enhanced SR
        types.put("1.2.840.10008.5.1.4.1.1.88.33", RecordType.SR_DOCUMENT);   // Comprehensive SR
        types.put("1.2.840.10008.5.1.4.1.1.88.40", RecordType.SR_DOCUMENT);   // Procedure Log
        types.put("1.2.840.10008.5.1.4.1.1.88.50", RecordType.SR_DOCUMENT);   // Mammography CAD SR
        types.put("1.2.840.10008.5.1.4.1.1.88.65", RecordType.SR_DOCUMENT);   // Chest CAD SR
        types.put("1.2.840.10008.5.1.4.1.1.88.67", RecordType.SR_DOCUMENT);   // X-Ray Radiation Dose SR
        types.put("1.2.840.10008.1.42", RecordType.SR_DOCUMENT);              // Substance Administration Logging
        types.put("1.2.840.10008.5.1.4.1.1.88.59", RecordType.KEY_OBJECT_DOC); // Key Object Selection

        // Softcopy presentation states
        types.put("1.2.840.10008.5.1.4.1.1.11.1", RecordType.PRESENTATION);   // Grayscale
        types.put("1.2.840.10008.5.1.4.1.1.11.2", RecordType.PRESENTATION);   // Color
        types.put("1.2.840.10008.5.1.4.1.1.11.3", RecordType.PRESENTATION);   // Pseudo-Color
        types.put("1.2.840.10008.5.1.4.1.1.11.4", RecordType.PRESENTATION);   // Blending

        // Images
        types.put("1.2.840.10008.5.1.4.1.1.1", RecordType.IMAGE);             // Computed Radiography
        types.put("1.2.840.10008.5.1.4.1.1.1.1", RecordType.IMAGE);           // Digital X-Ray, For Presentation
        types.put("1.2.840.10008.5.1.4.1.1.1.1.1", RecordType.IMAGE);         // Digital X-Ray, For Processing
        types.put("1.2.840.10008.5.1.4.1.1.1.2", RecordType.IMAGE);           // Digital Mammography, For Presentation
        types.put("1.2.840.10008.5.1.4.1.1.1.2.1", RecordType.IMAGE);         // Digital Mammography, For Processing
        types.put("1.2.840.10008.5.1.4.1.1.1.3", RecordType.IMAGE);           // Digital Intra-oral, For Presentation
        types.put("1.2.840.10008.5.1.4.1.1.1.3.1", RecordType.IMAGE);         // Digital Intra-oral, For Processing
        types.put("1.2.840.10008.5.1.4.1.1.2", RecordType.IMAGE);             // CT
        types.put("1.2.840.10008.5.1.4.1.1.2.1", RecordType.IMAGE);           // Enhanced CT
        types.put("1.2.840.10008.5.1.4.1.1.3", RecordType.IMAGE);             // Ultrasound Multi-frame (retired)
        types.put("1.2.840.10008.5.1.4.1.1.3.1", RecordType.IMAGE);           // Ultrasound Multi-frame
        types.put("1.2.840.10008.5.1.4.1.1.4", RecordType.IMAGE);             // MR
        types.put("1.2.840.10008.5.1.4.1.1.4.1", RecordType.IMAGE);           // Enhanced MR
        types.put("1.2.840.10008.5.1.4.1.1.5", RecordType.IMAGE);             // Nuclear Medicine (retired)
        types.put("1.2.840.10008.5.1.4.1.1.6", RecordType.IMAGE);             // Ultrasound (retired)
        types.put("1.2.840.10008.5.1.4.1.1.6.1", RecordType.IMAGE);           // Ultrasound
        types.put("1.2.840.10008.5.1.4.1.1.7", RecordType.IMAGE);             // Secondary Capture
        types.put("1.2.840.10008.5.1.4.1.1.7.1", RecordType.IMAGE);           // Multi-frame Single Bit SC
        types.put("1.2.840.10008.5.1.4.1.1.7.2", RecordType.IMAGE);           // Multi-frame Grayscale Byte SC
        types.put("1.2.840.10008.5.1.4.1.1.7.3", RecordType.IMAGE);           // Multi-frame Grayscale Word SC
        types.put("1.2.840.10008.5.1.4.1.1.7.4", RecordType.IMAGE);           // Multi-frame True Color SC
        types.put("1.2.840.10008.5.1.4.1.1.12.1", RecordType.IMAGE);          // X-Ray Angiographic
        types.put("1.2.840.10008.5.1.4.1.1.12.1.1", RecordType.IMAGE);        // Enhanced XA
        types.put("1.2.840.10008.5.1.4.1.1.12.2", RecordType.IMAGE);          // X-Ray Radiofluoroscopic
        types.put("1.2.840.10008.5.1.4.1.1.12.2.1", RecordType.IMAGE);        // Enhanced XRF
        types.put("1.2.840.10008.5.1.4.1.1.12.3", RecordType.IMAGE);          // X-Ray Angiographic Bi-Plane (retired)
        types.put("1.2.840.10008.5.1.4.1.1.13.1.1", RecordType.IMAGE);        // X-Ray 3D Angiographic
        types.put("1.2.840.10008.5.1.4.1.1.13.1.2", RecordType.IMAGE);        // X-Ray 3D Craniofacial
        types.put("1.2.840.10008.5.1.4.1.1.20", RecordType.IMAGE);            // Nuclear Medicine
        types.put("1.2.840.10008.5.1.4.1.1.66.4", RecordType.IMAGE);          // Segmentation
        types.put("1.2.840.10008.5.1.4.1.1.77.1.1", RecordType.IMAGE);        // VL Endoscopic
        types.put("1.2.840.10008.5.1.4.1.1.77.1.1.1", RecordType.IMAGE);      // Video Endoscopic
        types.put("1.2.840.10008.5.1.4.1.1.77.1.2", RecordType.IMAGE);        // VL Microscopic
        types.put("1.2.840.10008.5.1.4.1.1.77.1.2.1", RecordType.IMAGE);      // Video Microscopic
        types.put("1.2.840.10008.5.1.4.1.1.77.1.3", RecordType.IMAGE);        // VL Slide-Coordinates Microscopic
        types.put("1.2.840.10008.5.1.4.1.1.77.1.4", RecordType.IMAGE);        // VL Photographic
        types.put("1.2.840.10008.5.1.4.1.1.77.1.4.1", RecordType.IMAGE);      // Video Photographic
        types.put("1.2.840.10008.5.1.4.1.1.77.1.5.1", RecordType.IMAGE);      // Ophthalmic Photography 8 Bit
        types.put("1.2.840.10008.5.1.4.1.1.77.1.5.2", RecordType.IMAGE);      // Ophthalmic Photography 16 Bit
        types.put("1.2.840.10008.5.1.4.1.1.77.1.5.4", RecordType.IMAGE);      // Ophthalmic Tomography
        types.put("1.2.840.10008.5.1.4.1.1.128", RecordType.IMAGE);           // PET
        types.put("1.2.840.10008.5.1.4.1.1.481.1", RecordType.IMAGE);         // RT Image

        // Spectroscopy, raw data and spatial objects
        types.put("1.2.840.10008.5.1.4.1.1.4.2", RecordType.SPECTROSCOPY);    // MR Spectroscopy
        types.put("1.2.840.10008.5.1.4.1.1.66", RecordType.RAW_DATA);         // Raw Data
        types.put("1.2.840.10008.5.1.4.1.1.66.1", RecordType.REGISTRATION);   // Spatial Registration
        types.put("1.2.840.10008.5.1.4.1.1.66.3", RecordType.REGISTRATION);   // Deformable Spatial Registration
        types.put("1.2.840.10008.5.1.4.1.1.66.2", RecordType.FIDUCIAL);       // Spatial Fiducials
        types.put("1.2.840.10008.5.1.4.1.1.67", RecordType.VALUE_MAP);        // Real World Value Mapping
        types.put("1.2.840.10008.5.1.4.1.1.77.1.5.3", RecordType.STEREOMETRIC); // Stereometric Relationship

        // Documents
        types.put("1.2.840.10008.5.1.4.1.1.104.1", RecordType.ENCAP_DOC);     // Encapsulated PDF
        types.put("1.2.840.10008.5.1.4.1.1.104.2", RecordType.HL7_STRUC_DOC); // Encapsulated CDA
        types.put("1.2.840.10008.5.1.4.38.1", RecordType.HANGING_PROTOCOL);   // Hanging Protocol

        // Radiotherapy
        types.put("1.2.840.10008.5.1.4.1.1.481.2", RecordType.RT_DOSE);
        types.put("1.2.840.10008.5.1.4.1.1.481.3", RecordType.RT_STRUCTURE_SET);
        types.put("1.2.840.10008.5.1.4.1.1.481.4", RecordType.RT_TREAT_RECORD); // Beams Treatment Record
        types.put("1.2.840.10008.5.1.4.1.1.481.5", RecordType.RT_PLAN);
        types.put("1.2.840.10008.5.1.4.1.1.481.6", RecordType.RT_TREAT_RECORD); // Brachy Treatment Record
        types.put("1.2.840.10008.5.1.4.1.1.481.7", RecordType.RT_TREAT_RECORD); // Treatment Summary Record
        types.put("1.2.840.10008.5.1.4.1.1.481.8", RecordType.RT_PLAN);         // Ion Plan
        types.put("1.2.840.10008.5.1.4.1.1.481.9", RecordType.RT_TREAT_RECORD); // Ion Beams Treatment Record

        SOP_CLASS_TYPES = Collections.unmodifiableMap(types);

        Map<RecordType, int[]> fields = new EnumMap<>(RecordType.class);
        fields.put(RecordType.PATIENT, new int[] {
                Tag.PatientName, Tag.PatientID, Tag.PatientBirthDate, Tag.PatientSex });
        fields.put(RecordType.STUDY, new int[] {
                Tag.StudyInstanceUID, Tag.StudyID, Tag.StudyDate, Tag.StudyTime,
                Tag.AccessionNumber, Tag.StudyDescription });
        fields.put(RecordType.SERIES, new int[] {
                Tag.SeriesInstanceUID, Tag.Modality, Tag.SeriesDate, Tag.SeriesTime,
                Tag.SeriesNumber, Tag.SeriesDescription });
        fields.put(RecordType.IMAGE, new int[] { Tag.InstanceNumber });
        fields.put(RecordType.RT_DOSE, new int[] { Tag.InstanceNumber, Tag.DoseSummationType });
        fields.put(RecordType.RT_STRUCTURE_SET, new int[] {
                Tag.InstanceNumber, Tag.StructureSetLabel, Tag.StructureSetDate, Tag.StructureSetTime });
        fields.put(RecordType.RT_PLAN, new int[] {
                Tag.InstanceNumber, Tag.RTPlanLabel, Tag.RTPlanDate, Tag.RTPlanTime });
        fields.put(RecordType.RT_TREAT_RECORD, new int[] { Tag.InstanceNumber });
        fields.put(RecordType.PRESENTATION, new int[] {
                Tag.PresentationCreationDate, Tag.PresentationCreationTime,
                Tag.ReferencedSeriesSequence, Tag.BlendingSequence });
        fields.put(RecordType.WAVEFORM, new int[] { Tag.InstanceNumber, Tag.ContentDate, Tag.ContentTime });
        fields.put(RecordType.SR_DOCUMENT, new int[] {
                Tag.InstanceNumber, Tag.CompletionFlag, Tag.VerificationFlag, Tag.ContentDate,
                Tag.ContentTime, Tag.VerificationDateTime, Tag.ConceptNameCodeSequence });
        fields.put(RecordType.KEY_OBJECT_DOC, new int[] {
                Tag.InstanceNumber, Tag.ContentDate, Tag.ContentTime, Tag.ConceptNameCodeSequence });
        fields.put(RecordType.SPECTROSCOPY, new int[] {
                Tag.ImageType, Tag.ContentDate, Tag.ContentTime, Tag.InstanceNumber, Tag.NumberOfFrames,
                Tag.Rows, Tag.Columns, Tag.DataPointRows, Tag.DataPointColumns });
        fields.put(RecordType.RAW_DATA, new int[] { Tag.ContentDate, Tag.ContentTime, Tag.InstanceNumber });
        int[] contentIdentification = {
                Tag.ContentDate, Tag.ContentTime, Tag.InstanceNumber, Tag.ContentLabel,
                Tag.ContentDescription, Tag.ContentCreatorName, Tag.PersonIdentificationCodeSequence };
        fields.put(RecordType.REGISTRATION, contentIdentification);
        fields.put(RecordType.FIDUCIAL, contentIdentification);
        fields.put(RecordType.VALUE_MAP, contentIdentification);
        fields.put(RecordType.HANGING_PROTOCOL, new int[] {
                Tag.HangingProtocolName, Tag.HangingProtocolDescription, Tag.HangingProtocolLevel,
                Tag.HangingProtocolCreator, Tag.HangingProtocolCreationDateTime,
                Tag.HangingProtocolDefinitionSequence, Tag.NumberOfPriorsReferenced,
                Tag.HangingProtocolUserIdentificationCodeSequence });
        fields.put(RecordType.ENCAP_DOC, new int[] {
                Tag.ContentDate, Tag.ContentTime, Tag.InstanceNumber, Tag.DocumentTitle,
                Tag.MIMETypeOfEncapsulatedDocument });
        fields.put(RecordType.HL7_STRUC_DOC, new int[] { Tag.HL7InstanceIdentifier, Tag.HL7DocumentEffectiveTime });
        fields.put(RecordType.STEREOMETRIC, NO_FIELDS);
        fields.put(RecordType.PRIVATE, NO_FIELDS);
        REQUIRED_FIELDS = Collections.unmodifiableMap(fields);
    }

    private RecordTypeDirectory() {
    }

    /**
     * Record type for instances of the given storage SOP class.
     *
     * @return the record type, or empty when the SOP class cannot be catalogued
     */
    public static Optional<RecordType> typeFor(String sopClassUid) {
        if (sopClassUid == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(SOP_CLASS_TYPES.get(sopClassUid.trim()));
    }

    /**
     * Attributes copied from an instance into a record of the given type.
     * Types without a table entry carry no extra attributes.
     */
    public static int[] requiredFields(RecordType type) {
        int[] tags = REQUIRED_FIELDS.get(type);
        return tags != null ? tags.clone() : NO_FIELDS.clone();
    }

    /**
     * Number of SOP classes that can be catalogued.
     */
    public static int knownSopClassCount() {
        return SOP_CLASS_TYPES.size();
    }
}
