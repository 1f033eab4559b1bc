package com.eh.filemirror.autoupdate.service;

import com.eh.filemirror.autoupdate.config.FileCacheProperties;
import com.eh.filemirror.autoupdate.constants.FileCacheConstant;
import com.eh.filemirror.autoupdate.model.Account;
import com.eh.filemirror.autoupdate.model.CachedFile;
import com.eh.filemirror.autoupdate.model.CachedFileUpdatedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Index of the files downloaded into the local file cache, and the mapping from repository paths to
 * cache locations.
 */
@Service
public class FileCacheService {
    private static final Logger log = LoggerFactory.getLogger( FileCacheService.class.getName( ) );

    private final FileCacheProperties fileCacheProperties;
    private final Map< String, CachedFile > cachedFiles = new ConcurrentHashMap<>( );

    public FileCacheService ( FileCacheProperties fileCacheProperties ) {
        this.fileCacheProperties = fileCacheProperties;
    }

    public Path getFileCacheDir ( ) {
        return fileCacheProperties.getBasePath( ).resolve( FileCacheConstant.FILE_CACHE_TOP_DIR_NAME );
    }

    /**
     * {@code <base-dir>/file-cache/<repoId>/<pathInRepo>}, absolute and normalized.
     *
     * @throws IllegalArgumentException if the path would leave the repository's cache directory
     */
    public Path getLocalCacheFilePath ( String repoId, String pathInRepo ) {
        Path repoDir = getFileCacheDir( ).resolve( repoId ).normalize( );
        String relative = pathInRepo.startsWith( "/" ) ? pathInRepo.substring( 1 ) : pathInRepo;
        Path localPath = repoDir.resolve( relative ).normalize( );
        if ( !localPath.startsWith( repoDir ) || localPath.equals( repoDir ) ) {
            throw new IllegalArgumentException( "Invalid path in repo " + repoId + ": " + pathInRepo );
        }
        return localPath;
    }

    public void record ( CachedFile cachedFile ) {
        cachedFiles.put( key( cachedFile.repoId( ), cachedFile.pathInRepo( ) ), cachedFile );
        log.debug( "record :: cached {} of repo {} at {}", cachedFile.pathInRepo( ), cachedFile.repoId( ), cachedFile.localPath( ) );
    }

    public Optional< CachedFile > get ( String repoId, String pathInRepo ) {
        return Optional.ofNullable( cachedFiles.get( key( repoId, pathInRepo ) ) );
    }

    public int size ( ) {
        return cachedFiles.size( );
    }

    public int cleanCurrentAccountCache ( Account account ) {
        int before = cachedFiles.size( );
        cachedFiles.values( ).removeIf( cachedFile -> Objects.equals( cachedFile.account( ), account ) );
        int removed = before - cachedFiles.size( );
        log.info( "cleanCurrentAccountCache :: removed {} cache entries of {}", removed, account );
        return removed;
    }

    @EventListener
    public void onCachedFileUpdated ( CachedFileUpdatedEvent event ) {
        cachedFiles.computeIfPresent( key( event.repoId( ), event.pathInRepo( ) ), ( k, cachedFile ) -> cachedFile.withSyncedAt( Instant.now( ) ) );
    }

    private static String key ( String repoId, String pathInRepo ) {
        return repoId + ":" + pathInRepo;
    }
}
