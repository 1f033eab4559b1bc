package com.eh.filemirror.autoupdate.service;

import com.eh.filemirror.autoupdate.config.FileCacheProperties;
import com.eh.filemirror.autoupdate.model.Account;
import com.eh.filemirror.autoupdate.model.AccountChangedEvent;
import com.eh.filemirror.autoupdate.model.WatchedFileInfo;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Watches cached copies of repository files and uploads them again when a native application changes them.
 * <p>
 * Public methods may be called from any thread; the work is posted to the auto update loop, where all
 * watch state lives.
 */
@Service
public class AutoUpdateManager {
    private static final Logger log = LoggerFactory.getLogger( AutoUpdateManager.class.getName( ) );

    private final FileCacheService fileCacheService;
    private final WatchRegistry watchRegistry;
    private final DeferredRecreationQueue deferredQueue;
    private final UploadCoordinator uploadCoordinator;
    private final OpenedFileFilter openedFileFilter;
    private final CacheFileWatcher watcher;
    private final TransferManager transferManager;
    private final AccountManager accountManager;
    private final FileCacheProperties fileCacheProperties;
    private final ScheduledExecutorService loop;
    private final ExecutorService cacheCleanerExecutor;

    public AutoUpdateManager ( FileCacheService fileCacheService, WatchRegistry watchRegistry, DeferredRecreationQueue deferredQueue, UploadCoordinator uploadCoordinator, OpenedFileFilter openedFileFilter, CacheFileWatcher watcher, TransferManager transferManager, AccountManager accountManager, FileCacheProperties fileCacheProperties, @Qualifier( "autoUpdateLoop" ) ScheduledExecutorService loop, @Qualifier( "cacheCleanerExecutor" ) ExecutorService cacheCleanerExecutor ) {
        this.fileCacheService = fileCacheService;
        this.watchRegistry = watchRegistry;
        this.deferredQueue = deferredQueue;
        this.uploadCoordinator = uploadCoordinator;
        this.openedFileFilter = openedFileFilter;
        this.watcher = watcher;
        this.transferManager = transferManager;
        this.accountManager = accountManager;
        this.fileCacheProperties = fileCacheProperties;
        this.loop = loop;
        this.cacheCleanerExecutor = cacheCleanerExecutor;
    }

    @PostConstruct
    public void init ( ) {
        watcher.setListener( path -> post( "onFileChanged", ( ) -> onFileChanged( path ) ) );
    }

    public void start ( ) {
        cleanCachedFile( );
    }

    public void watchCachedFile ( Account account, String repoId, String pathInRepo ) {
        post( "watchCachedFile", ( ) -> doWatchCachedFile( account, repoId, pathInRepo ) );
    }

    public void unwatch ( Path localPath ) {
        post( "unwatch", ( ) -> {
            if ( watchRegistry.remove( localPath ) != null ) {
                log.debug( "unwatch :: stopped watching {}", localPath );
            }
        } );
    }

    /**
     * Drops everything cached for the current account.
     */
    public void cleanCachedFile ( ) {
        Account account = accountManager.currentAccount( );
        post( "cleanCachedFile", ( ) -> doCleanCachedFile( account ) );
    }

    @EventListener
    public void onAccountChanged ( AccountChangedEvent event ) {
        log.info( "onAccountChanged :: account changed from {} to {}", event.previous( ), event.current( ) );
        if ( event.previous( ) == null ) {
            return;
        }
        post( "onAccountChanged", ( ) -> doCleanCachedFile( event.previous( ) ) );
    }

    void doWatchCachedFile ( Account account, String repoId, String pathInRepo ) {
        Path localPath;
        try {
            localPath = fileCacheService.getLocalCacheFilePath( repoId, pathInRepo );
        } catch ( IllegalArgumentException e ) {
            log.warn( "doWatchCachedFile :: rejected watch request for {} in repo {}: {}", pathInRepo, repoId, e.getMessage( ) );
            return;
        }
        log.debug( "doWatchCachedFile :: watch cache file {}", localPath );
        if ( !Files.exists( localPath ) ) {
            log.warn( "doWatchCachedFile :: unable to watch non-existent cache file {}", localPath );
            return;
        }
        // a deleted file waiting for recreation is picked up again by the recheck
        if ( deferredQueue.contains( repoId, pathInRepo ) ) {
            log.debug( "doWatchCachedFile :: {} is waiting for recreation, skipping", localPath );
            return;
        }
        watchRegistry.add( localPath, new WatchedFileInfo( account, repoId, pathInRepo ) );
    }

    void doCleanCachedFile ( Account account ) {
        log.info( "doCleanCachedFile :: cancel all download tasks" );
        transferManager.cancelAllDownloadTasks( );
        watchRegistry.removeAllForAccount( account );
        fileCacheService.cleanCurrentAccountCache( account );
        cacheCleanerExecutor.execute( new CachedFilesCleaner( fileCacheProperties.getBasePath( ) ) );
    }

    void onFileChanged ( Path localPath ) {
        log.debug( "onFileChanged :: detected cache file {} changed", localPath );
        if ( openedFileFilter.isRecentlyOpened( localPath ) ) {
            log.debug( "onFileChanged :: ignoring change of recently opened file {}", localPath );
            return;
        }
        watchRegistry.stopMonitoring( localPath );
        WatchedFileInfo info = watchRegistry.get( localPath );
        if ( info == null ) {
            return;
        }
        if ( info.isUploading( ) ) {
            log.debug( "onFileChanged :: upload of {} already in progress", localPath );
            return;
        }

        if ( !Files.exists( localPath ) ) {
            log.debug( "onFileChanged :: detected cache file {} renamed or removed", localPath );
            WatchedFileInfo deferredInfo = info.copy( );
            watchRegistry.remove( localPath );
            deferredQueue.defer( deferredInfo, ( ) -> guarded( "checkFileRecreated", this::checkFileRecreated ) );
            return;
        }

        uploadCoordinator.upload( localPath, info );
    }

    void checkFileRecreated ( ) {
        Optional< WatchedFileInfo > next = deferredQueue.poll( );
        if ( next.isEmpty( ) ) {
            log.debug( "checkFileRecreated :: no deleted file pending" );
            return;
        }
        WatchedFileInfo info = next.get( );
        Path localPath = fileCacheService.getLocalCacheFilePath( info.getRepoId( ), info.getPathInRepo( ) );
        if ( !Files.exists( localPath ) ) {
            log.debug( "checkFileRecreated :: {} was not recreated, no longer watching it", localPath );
            return;
        }
        log.debug( "checkFileRecreated :: detected recreated file {}", localPath );
        watchRegistry.add( localPath, info );
        // the application replaced the file instead of writing to it, which is a modification too
        onFileChanged( localPath );
    }

    private void post ( String operation, Runnable work ) {
        loop.execute( ( ) -> guarded( operation, work ) );
    }

    // exceptions escaping a loop task are otherwise never reported
    private static void guarded ( String operation, Runnable work ) {
        try {
            work.run( );
        } catch ( RuntimeException e ) {
            log.error( "{} :: failed: {}", operation, e.getMessage( ), e );
        }
    }
}
