package com.eh.filemirror.autoupdate.service;

import com.eh.filemirror.autoupdate.api.SeafileApiClient;
import com.eh.filemirror.autoupdate.model.Account;
import com.eh.filemirror.autoupdate.util.FileCacheUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One upload of a local file into a repository. {@link #start()} may be called once; the returned future
 * completes exactly once, with {@code true} on success and {@code false} on any failure.
 */
public class FileUploadTask {
    private static final Logger log = LoggerFactory.getLogger( FileUploadTask.class.getName( ) );

    private final SeafileApiClient apiClient;
    private final Account account;
    private final String repoId;
    private final String parentPath;
    private final Path localFilePath;
    private final String fileName;
    private final boolean update;
    private final AtomicBoolean started = new AtomicBoolean( );

    public FileUploadTask ( SeafileApiClient apiClient, Account account, String repoId, String parentPath, Path localFilePath, String fileName, boolean update ) {
        this.apiClient = apiClient;
        this.account = account;
        this.repoId = repoId;
        this.parentPath = parentPath;
        this.localFilePath = localFilePath;
        this.fileName = fileName;
        this.update = update;
    }

    public CompletableFuture< Boolean > start ( ) {
        if ( !started.compareAndSet( false, true ) ) {
            throw new IllegalStateException( "Upload task for " + localFilePath + " already started" );
        }
        log.info( "start :: uploading {} to repo {} at {}", localFilePath, repoId, getPath( ) );
        return apiClient.getUploadLink( account, repoId, update )
                .flatMap( link -> apiClient.uploadFile( account, link, parentPath, localFilePath, fileName, update ) )
                .map( fileId -> {
                    log.info( "start :: uploaded {}, new revision {}", localFilePath, fileId );
                    return Boolean.TRUE;
                } )
                .defaultIfEmpty( Boolean.TRUE )
                .onErrorResume( e -> {
                    log.error( "start :: upload of {} failed: {}", localFilePath, e.getMessage( ) );
                    return Mono.just( Boolean.FALSE );
                } )
                .toFuture( );
    }

    public Account getAccount ( ) {
        return account;
    }

    public String getRepoId ( ) {
        return repoId;
    }

    /**
     * Path of the uploaded file inside the repository.
     */
    public String getPath ( ) {
        return FileCacheUtils.joinRepoPath( parentPath, fileName );
    }

    public Path getLocalFilePath ( ) {
        return localFilePath;
    }

    public boolean isUpdate ( ) {
        return update;
    }
}
