package com.dcruver.smoothwrite.io;

import java.io.IOException;

/**
 * A stored note exists but cannot be turned back into a {@code Note}.
 */
public class CorruptNoteException extends IOException {

    public CorruptNoteException(String message) {
        super(message);
    }

    public CorruptNoteException(String message, Throwable cause) {
        super(message, cause);
    }
}
