// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.util;

import java.util.HexFormat;
import java.util.UUID;

public abstract class RandomId {

    private static final int UUID_STRING_LENGTH = 36;

    public static UUID createSessionId () {
        return UUID.randomUUID();
    }

    /// UUID.fromString() tolerates oddities like missing leading zeros in each group and throws
    /// when it fails, so check the canonical 8-4-4-4-12 form here first. Values that arrive in
    /// cookies or URLs are untrusted and are often garbage, which is not an exceptional condition.
    /// @return the parsed UUID, or null if the string is not a canonical UUID.
    public static UUID parseUuidOrNull (String id) {
        if (id == null || id.length() != UUID_STRING_LENGTH) return null;
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            if (i == 8 || i == 13 || i == 18 || i == 23) {
                if (c != '-') return null;
            } else if (!HexFormat.isHexDigit(c)) {
                return null;
            }
        }
        return UUID.fromString(id);
    }

}
