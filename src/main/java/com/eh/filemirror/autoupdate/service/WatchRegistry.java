package com.eh.filemirror.autoupdate.service;

import com.eh.filemirror.autoupdate.model.Account;
import com.eh.filemirror.autoupdate.model.WatchedFileInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Local cache path to watch record, at most one record per path. Confined to the auto update loop.
 */
@Component
public class WatchRegistry {
    private static final Logger log = LoggerFactory.getLogger( WatchRegistry.class.getName( ) );

    private final CacheFileWatcher watcher;
    private final Map< Path, WatchedFileInfo > watchInfos = new HashMap<>( );

    public WatchRegistry ( CacheFileWatcher watcher ) {
        this.watcher = watcher;
    }

    /**
     * Registers {@code info} for {@code localPath} and starts monitoring it. A record whose upload is
     * still in flight is left alone.
     *
     * @return false if an uploading record already owns the path
     */
    public boolean add ( Path localPath, WatchedFileInfo info ) {
        WatchedFileInfo existing = watchInfos.get( localPath );
        if ( existing != null && existing.isUploading( ) ) {
            log.debug( "add :: {} is being uploaded, keeping current record", localPath );
            return false;
        }
        watchInfos.put( localPath, info );
        startMonitoring( localPath );
        return true;
    }

    public WatchedFileInfo remove ( Path localPath ) {
        WatchedFileInfo removed = watchInfos.remove( localPath );
        stopMonitoring( localPath );
        return removed;
    }

    public WatchedFileInfo get ( Path localPath ) {
        return watchInfos.get( localPath );
    }

    public boolean contains ( Path localPath ) {
        return watchInfos.containsKey( localPath );
    }

    public int size ( ) {
        return watchInfos.size( );
    }

    public int removeAllForAccount ( Account account ) {
        int removed = 0;
        Iterator< Map.Entry< Path, WatchedFileInfo > > it = watchInfos.entrySet( ).iterator( );
        while ( it.hasNext( ) ) {
            Map.Entry< Path, WatchedFileInfo > entry = it.next( );
            if ( Objects.equals( entry.getValue( ).getAccount( ), account ) ) {
                it.remove( );
                stopMonitoring( entry.getKey( ) );
                removed++;
            }
        }
        log.info( "removeAllForAccount :: removed {} watched files of {}", removed, account );
        return removed;
    }

    public boolean startMonitoring ( Path localPath ) {
        if ( watcher.files( ).contains( localPath ) ) {
            return true;
        }
        boolean ok = watcher.addPath( localPath );
        if ( !ok ) {
            log.warn( "startMonitoring :: failed to watch cache file {}", localPath );
        }
        return ok;
    }

    public boolean stopMonitoring ( Path localPath ) {
        if ( !watcher.files( ).contains( localPath ) ) {
            return true;
        }
        boolean ok = watcher.removePath( localPath );
        if ( !ok ) {
            log.warn( "stopMonitoring :: failed to remove watch on cache file {}", localPath );
        }
        return ok;
    }
}
