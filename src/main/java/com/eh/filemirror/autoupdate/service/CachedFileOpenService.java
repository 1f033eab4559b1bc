package com.eh.filemirror.autoupdate.service;

import com.eh.filemirror.autoupdate.model.Account;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

@Service
public class CachedFileOpenService {
    private static final Logger log = LoggerFactory.getLogger( CachedFileOpenService.class.getName( ) );

    private final FileCacheService fileCacheService;
    private final TransferManager transferManager;
    private final AutoUpdateManager autoUpdateManager;
    private final OpenedFileFilter openedFileFilter;

    public CachedFileOpenService ( FileCacheService fileCacheService, TransferManager transferManager, AutoUpdateManager autoUpdateManager, OpenedFileFilter openedFileFilter ) {
        this.fileCacheService = fileCacheService;
        this.transferManager = transferManager;
        this.autoUpdateManager = autoUpdateManager;
        this.openedFileFilter = openedFileFilter;
    }

    /**
     * Makes sure the file is in the local cache, downloading it if needed, and starts watching the cached
     * copy so edits made by the application that opens it are uploaded.
     *
     * @return future of the cached file's local path
     */
    public CompletableFuture< Path > openCachedFile ( Account account, String repoId, String pathInRepo ) {
        Path localPath = fileCacheService.getLocalCacheFilePath( repoId, pathInRepo );
        CompletableFuture< Path > cached;
        if ( fileCacheService.get( repoId, pathInRepo ).isPresent( ) && Files.exists( localPath ) ) {
            log.info( "openCachedFile :: using cached copy of {} at {}", pathInRepo, localPath );
            cached = CompletableFuture.completedFuture( localPath );
        } else {
            cached = transferManager.downloadFile( account, repoId, pathInRepo );
        }
        return cached.thenApply( path -> {
            openedFileFilter.fileOpened( path );
            autoUpdateManager.watchCachedFile( account, repoId, pathInRepo );
            return path;
        } );
    }
}
