package com.photosync.remote;

/**
 * A call to the remote library failed as a whole.
 */
public class RemoteLibraryException extends RuntimeException {

    public RemoteLibraryException(String message) {
        super(message);
    }

    public RemoteLibraryException(String message, Throwable cause) {
        super(message, cause);
    }
}
