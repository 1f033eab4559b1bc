package com.eh.filemirror.autoupdate.service;

import com.eh.filemirror.autoupdate.api.SeafileApiClient;
import com.eh.filemirror.autoupdate.model.Account;
import com.eh.filemirror.autoupdate.model.CachedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.Disposables;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class TransferManager {
    private static final Logger log = LoggerFactory.getLogger( TransferManager.class.getName( ) );

    private final SeafileApiClient apiClient;
    private final FileCacheService fileCacheService;
    private final Map< String, Disposable > downloadTasks = new ConcurrentHashMap<>( );

    public TransferManager ( SeafileApiClient apiClient, FileCacheService fileCacheService ) {
        this.apiClient = apiClient;
        this.fileCacheService = fileCacheService;
    }

    public FileUploadTask createUploadTask ( Account account, String repoId, String parentPath, Path localPath, String fileName, boolean update ) {
        return new FileUploadTask( apiClient, account, repoId, parentPath, localPath, fileName, update );
    }

    /**
     * Downloads a repository file into its cache location and records it in the cache index. A download
     * already running for the same file is returned as is.
     */
    public CompletableFuture< Path > downloadFile ( Account account, String repoId, String pathInRepo ) {
        Path localPath = fileCacheService.getLocalCacheFilePath( repoId, pathInRepo );
        String key = repoId + ":" + pathInRepo;
        CompletableFuture< Path > result = new CompletableFuture<>( );
        Disposable.Swap swap = Disposables.swap( );
        if ( downloadTasks.putIfAbsent( key, swap ) != null ) {
            log.info( "downloadFile :: download of {} already in progress", pathInRepo );
            result.completeExceptionally( new IllegalStateException( "Download of " + pathInRepo + " already in progress" ) );
            return result;
        }
        log.info( "downloadFile :: downloading {} of repo {} to {}", pathInRepo, repoId, localPath );
        swap.update( apiClient.getDownloadLink( account, repoId, pathInRepo )
                .flatMap( link -> apiClient.download( link.url( ), localPath )
                        .doOnSuccess( path -> fileCacheService.record( new CachedFile( account, repoId, pathInRepo, link.fileId( ), path, Instant.now( ) ) ) ) )
                .doOnCancel( ( ) -> result.completeExceptionally( new CancellationException( "Download of " + pathInRepo + " cancelled" ) ) )
                .doFinally( signal -> downloadTasks.remove( key, swap ) )
                .subscribe( result::complete, error -> {
                    log.error( "downloadFile :: failed to download {}: {}", pathInRepo, error.getMessage( ) );
                    result.completeExceptionally( error );
                } ) );
        return result;
    }

    public int cancelAllDownloadTasks ( ) {
        List< Disposable > tasks = new ArrayList<>( downloadTasks.values( ) );
        downloadTasks.clear( );
        tasks.forEach( Disposable::dispose );
        log.info( "cancelAllDownloadTasks :: cancelled {} download tasks", tasks.size( ) );
        return tasks.size( );
    }

    public int getDownloadTaskCount ( ) {
        return downloadTasks.size( );
    }
}
