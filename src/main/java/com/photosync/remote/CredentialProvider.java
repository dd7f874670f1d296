package com.photosync.remote;

/**
 * Supplies the opaque authorization blob used by a {@link RemoteLibraryClient}.
 */
public interface CredentialProvider {

    /**
     * @throws AuthorizationException if no credentials are available.
     */
    byte[] credentials();
}
