package com.eh.filemirror.autoupdate.service;

import com.eh.filemirror.autoupdate.model.CachedFileUpdatedEvent;
import com.eh.filemirror.autoupdate.model.WatchedFileInfo;
import com.eh.filemirror.autoupdate.util.FileCacheUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;

import static com.eh.filemirror.autoupdate.constants.FileCacheConstant.UPLOAD_FAILURE;
import static com.eh.filemirror.autoupdate.constants.FileCacheConstant.UPLOAD_SUCCESS;

/**
 * Uploads the new content of a modified cache file and settles its watch record when the upload ends:
 * monitoring resumes after a success, the record is dropped after a failure.
 */
@Service
public class UploadCoordinator {
    private static final Logger log = LoggerFactory.getLogger( UploadCoordinator.class.getName( ) );

    private final TransferManager transferManager;
    private final WatchRegistry watchRegistry;
    private final TrayNotifier trayNotifier;
    private final ApplicationEventPublisher eventPublisher;
    private final ScheduledExecutorService loop;

    public UploadCoordinator ( TransferManager transferManager, WatchRegistry watchRegistry, TrayNotifier trayNotifier, ApplicationEventPublisher eventPublisher, @Qualifier( "autoUpdateLoop" ) ScheduledExecutorService loop ) {
        this.transferManager = transferManager;
        this.watchRegistry = watchRegistry;
        this.trayNotifier = trayNotifier;
        this.eventPublisher = eventPublisher;
        this.loop = loop;
    }

    public void upload ( Path localPath, WatchedFileInfo info ) {
        FileUploadTask task = transferManager.createUploadTask( info.getAccount( ), info.getRepoId( ), FileCacheUtils.getParentPath( info.getPathInRepo( ) ), localPath, FileCacheUtils.getBaseName( localPath ), true );
        log.info( "upload :: start uploading new version of file {}", localPath );
        info.setUploading( true );
        CompletableFuture< Boolean > result;
        try {
            result = task.start( );
        } catch ( RuntimeException e ) {
            log.error( "upload :: unable to start upload of {}: {}", localPath, e.getMessage( ), e );
            onUpdateTaskFinished( task, info, false );
            return;
        }
        result.whenComplete( ( success, error ) -> {
            if ( error != null ) {
                log.error( "upload :: upload task for {} completed exceptionally: {}", localPath, error.getMessage( ) );
            }
            boolean uploaded = error == null && Boolean.TRUE.equals( success );
            loop.execute( ( ) -> onUpdateTaskFinished( task, info, uploaded ) );
        } );
    }

    /**
     * Settles {@code info}, the record the upload was started for. A record that was dropped or replaced
     * while the upload ran is left alone.
     */
    void onUpdateTaskFinished ( FileUploadTask task, WatchedFileInfo info, boolean success ) {
        try {
            Path localPath = task.getLocalFilePath( );
            String fileName = FileCacheUtils.getBaseName( localPath );
            boolean current = watchRegistry.get( localPath ) == info;
            if ( success ) {
                log.info( "onUpdateTaskFinished :: uploaded new version of file {}", localPath );
                trayNotifier.showMessage( UPLOAD_SUCCESS, String.format( "File \"%s\"\nuploaded successfully.", fileName ), task.getRepoId( ) );
                eventPublisher.publishEvent( new CachedFileUpdatedEvent( task.getRepoId( ), task.getPath( ) ) );
                if ( !current ) {
                    log.info( "onUpdateTaskFinished :: {} is no longer tracked by this upload, not watching it again", localPath );
                    return;
                }
                watchRegistry.startMonitoring( localPath );
                info.setUploading( false );
            } else {
                log.warn( "onUpdateTaskFinished :: failed to upload new version of file {}", localPath );
                trayNotifier.showMessage( UPLOAD_FAILURE, String.format( "File \"%s\"\nfailed to upload.", fileName ), task.getRepoId( ) );
                if ( current ) {
                    watchRegistry.remove( localPath );
                }
            }
        } catch ( RuntimeException e ) {
            log.error( "onUpdateTaskFinished :: failed to settle upload of {}: {}", task.getLocalFilePath( ), e.getMessage( ), e );
        }
    }
}
