package com.architectai.generation.model;

import lombok.Getter;

import java.util.Comparator;

/**
 * A timestamp-keyed version collection written before stable artifact ids existed.
 * The reconciler consumes and deletes these; nothing references them afterwards.
 */
@Getter
public class LegacyVersionFile {

    /** Orders files of one base type chronologically; the suffix is fixed-width, so string order works. */
    public static final Comparator<LegacyVersionFile> BY_TIMESTAMP_SUFFIX =
            Comparator.comparing(LegacyVersionFile::getTimestampSuffix)
                    .thenComparing(LegacyVersionFile::getLegacyId);

    private final String legacyId;
    private final String baseType;
    private final String timestampSuffix;

    public LegacyVersionFile(String legacyId, String baseType, String timestampSuffix) {
        this.legacyId = legacyId;
        this.baseType = baseType;
        this.timestampSuffix = timestampSuffix;
    }

    @Override
    public String toString() {
        return legacyId;
    }
}
