package com.photosync;

import com.photosync.remote.AuthorizationException;
import com.photosync.remote.PhotosLibraryClient;
import com.photosync.remote.StoredCredentialProvider;
import com.photosync.repository.SyncDatabaseManager;
import com.photosync.service.DatePathMapper;
import com.photosync.service.SyncEngine;
import com.photosync.util.ProjectLogger;
import com.photosync.util.SettingsManager;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;

/**
 * Runs one synchronization of the library into the given directory (default: working directory).
 * Behaviour is configured through .photosync/settings.json in that directory.
 */
public class Launcher {

    public static void main(String[] args) {
        Path root = Paths.get(args.length > 0 ? args[0] : ".").toAbsolutePath().normalize();
        System.exit(run(root));
    }

    static int run(Path root) {
        SettingsManager settings = new SettingsManager(root);
        ProjectLogger logger = new ProjectLogger(root, true);
        SyncDatabaseManager dbManager = new SyncDatabaseManager(root);

        PhotosLibraryClient client = new PhotosLibraryClient(settings.getApiBaseUrl(),
                new StoredCredentialProvider(dbManager, settings.getTokenFile()), logger);
        SyncEngine engine = new SyncEngine(dbManager, client, root, new DatePathMapper(), logger,
                settings.getBatchSize(), Clock.systemUTC());

        try {
            if (settings.isResyncOnStart()) {
                engine.resync();
            }
            engine.drive(null, settings.isWindowHeuristic());
            return 0;
        } catch (AuthorizationException e) {
            logger.error("Launcher", "Authorization failed, nothing more will be synchronized in this run", e);
            System.err.println("Authorization failed: " + e.getMessage());
            return 2;
        } catch (RuntimeException e) {
            logger.error("Launcher", "Synchronization aborted", e);
            return 1;
        }
    }
}
