// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package com.formulafold;

import java.util.Collection;

/**
 * Thrown when a mode id is not registered.
 * This is the only exception thrown for input to fold, unfold and mode switching.
 */
public class InvalidModeException extends IllegalArgumentException {

    private final String modeId;

    public InvalidModeException(String modeId, Collection<String> registeredIds) {
        super("Unknown mode '" + modeId + "': registered modes are " + registeredIds);
        this.modeId = modeId;
    }

    /** Returns the id which is not registered */
    public String modeId() { return modeId; }

}
