package com.eh.filemirror.autoupdate.model;

import java.nio.file.Path;
import java.time.Instant;

public record CachedFile(Account account, String repoId, String pathInRepo, String fileId, Path localPath, Instant syncedAt) {

    public CachedFile withSyncedAt ( Instant instant ) {
        return new CachedFile( account, repoId, pathInRepo, fileId, localPath, instant );
    }
}
