package com.photosync.remote;

/**
 * The remote service rejected the credentials, or none are available.
 * Fatal for the current run; retrying needs fresh authorization.
 */
public class AuthorizationException extends RemoteLibraryException {

    public AuthorizationException(String message) {
        super(message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
