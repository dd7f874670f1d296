package com.photosync.remote;

import com.photosync.repository.SyncDatabaseManager;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Returns credentials from the sync database.
 * <p>
 * If a token file exists it takes precedence: its bytes are copied into the database,
 * so later runs keep working after the file is removed. The blob is never parsed here.
 * Obtaining a token interactively is not supported; place a token file next to the library instead.
 * <p>
 * The blob is loaded on first use and kept for the lifetime of the provider, i.e. one run.
 */
public class StoredCredentialProvider implements CredentialProvider {

    public static final String CREDENTIAL_ID = "installed.main";

    private final SyncDatabaseManager dbManager;
    private final Path tokenFile;
    private byte[] cached;

    /**
     * @param dbManager The store holding the credentials.
     * @param tokenFile Optional file to import from, may be null.
     */
    public StoredCredentialProvider(SyncDatabaseManager dbManager, Path tokenFile) {
        this.dbManager = dbManager;
        this.tokenFile = tokenFile;
    }

    @Override
    public synchronized byte[] credentials() {
        if (cached == null) {
            cached = load();
        }
        return cached;
    }

    private byte[] load() {
        if (tokenFile != null && Files.isRegularFile(tokenFile)) {
            try {
                byte[] blob = Files.readAllBytes(tokenFile);
                dbManager.storeCredential(CREDENTIAL_ID, blob);
                return blob;
            } catch (IOException e) {
                throw new UncheckedIOException("Could not read token file " + tokenFile, e);
            }
        }

        byte[] stored = dbManager.getCredential(CREDENTIAL_ID);
        if (stored == null || stored.length == 0) {
            throw new AuthorizationException("No stored credentials found. Place a token file at "
                    + (tokenFile != null ? tokenFile : "the sync root") + " and run again.");
        }
        return stored;
    }
}
