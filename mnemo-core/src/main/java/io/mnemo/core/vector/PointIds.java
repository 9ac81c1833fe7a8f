package io.mnemo.core.vector;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

public final class PointIds {

    private PointIds() {
    }

    public static String of(String recordId) {
        if (recordId == null || recordId.isBlank()) {
            throw new IllegalArgumentException("recordId must not be blank");
        }
        if (isCanonicalUuid(recordId)) {
            return recordId;
        }
        return UUID.nameUUIDFromBytes(recordId.getBytes(StandardCharsets.UTF_8)).toString();
    }

    // fromString also accepts short and uppercase forms; only the canonical text is used as is
    private static boolean isCanonicalUuid(String recordId) {
        try {
            return UUID.fromString(recordId).toString().equals(recordId);
        } catch (IllegalArgumentException notUuid) {
            return false;
        }
    }
}
