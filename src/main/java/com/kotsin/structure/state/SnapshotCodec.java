package com.kotsin.structure.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.structure.exception.StructureDetectionException;
import com.kotsin.structure.exception.StructureDetectionException.ErrorCode;

/**
 * JSON codec for {@link DetectorSnapshot}.
 */
public class SnapshotCodec {

    private final ObjectMapper mapper;

    public SnapshotCodec() {
        this(new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .findAndRegisterModules());
    }

    public SnapshotCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String toJson(DetectorSnapshot snapshot) {
        try {
            return mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new StructureDetectionException(ErrorCode.INVALID_SNAPSHOT,
                    "Failed to serialize snapshot at bar " + snapshot.getLastBarIndex(), e);
        }
    }

    public DetectorSnapshot fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new StructureDetectionException(ErrorCode.INVALID_SNAPSHOT, "Snapshot JSON is empty");
        }
        DetectorSnapshot snapshot;
        try {
            snapshot = mapper.readValue(json, DetectorSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new StructureDetectionException(ErrorCode.INVALID_SNAPSHOT,
                    "Failed to parse snapshot: " + e.getOriginalMessage(), e);
        }
        if (snapshot.getFormatVersion() != DetectorSnapshot.FORMAT_VERSION) {
            throw new StructureDetectionException(ErrorCode.INVALID_SNAPSHOT,
                    "Unsupported snapshot format " + snapshot.getFormatVersion()
                            + ", expected " + DetectorSnapshot.FORMAT_VERSION);
        }
        return snapshot;
    }
}
