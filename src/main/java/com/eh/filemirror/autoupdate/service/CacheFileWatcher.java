package com.eh.filemirror.autoupdate.service;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

/**
 * Per-file watch on top of {@link WatchService}, which only watches directories. The parent directory of
 * every watched file is registered once; events for files that are not in {@link #files()} are dropped.
 * <p>
 * The listener is invoked on the watcher thread.
 */
@Component
public class CacheFileWatcher {
    private static final Logger log = LoggerFactory.getLogger( CacheFileWatcher.class.getName( ) );

    private final ExecutorService watcherExecutor;
    private final Set< Path > files = ConcurrentHashMap.newKeySet( );
    private final Map< Path, WatchKey > directoryKeys = new ConcurrentHashMap<>( );
    private volatile Consumer< Path > listener = path -> { };
    private WatchService watchService;

    public CacheFileWatcher ( @Qualifier( "fileWatcherExecutor" ) ExecutorService watcherExecutor ) {
        this.watcherExecutor = watcherExecutor;
    }

    public void setListener ( Consumer< Path > listener ) {
        this.listener = listener;
    }

    public Set< Path > files ( ) {
        return Collections.unmodifiableSet( files );
    }

    public synchronized boolean addPath ( Path file ) {
        Path absolute = file.toAbsolutePath( ).normalize( );
        if ( !Files.isRegularFile( absolute ) ) {
            log.debug( "addPath :: not a regular file: {}", absolute );
            return false;
        }
        Path directory = absolute.getParent( );
        try {
            ensureStarted( );
            if ( !directoryKeys.containsKey( directory ) ) {
                WatchKey key = directory.register( watchService, StandardWatchEventKinds.ENTRY_CREATE, StandardWatchEventKinds.ENTRY_DELETE, StandardWatchEventKinds.ENTRY_MODIFY );
                directoryKeys.put( directory, key );
            }
            files.add( absolute );
            return true;
        } catch ( IOException | ClosedWatchServiceException e ) {
            log.error( "addPath :: unable to register {}: {}", directory, e.getMessage( ) );
            return false;
        }
    }

    public synchronized boolean removePath ( Path file ) {
        Path absolute = file.toAbsolutePath( ).normalize( );
        if ( !files.remove( absolute ) ) {
            return false;
        }
        Path directory = absolute.getParent( );
        boolean directoryStillUsed = files.stream( ).anyMatch( f -> directory.equals( f.getParent( ) ) );
        if ( !directoryStillUsed ) {
            WatchKey key = directoryKeys.remove( directory );
            if ( key != null ) {
                key.cancel( );
            }
        }
        return true;
    }

    private void ensureStarted ( ) throws IOException {
        if ( watchService == null ) {
            watchService = FileSystems.getDefault( ).newWatchService( );
            WatchService service = watchService;
            watcherExecutor.submit( ( ) -> pollEvents( service ) );
            log.info( "ensureStarted :: cache file watcher started" );
        }
    }

    void pollEvents ( WatchService service ) {
        try {
            for ( ; ; ) {
                WatchKey key = service.take( );
                Path directory = (Path) key.watchable( );
                for ( WatchEvent< ? > event : key.pollEvents( ) ) {
                    if ( event.kind( ) == StandardWatchEventKinds.OVERFLOW ) {
                        log.warn( "pollEvents :: OVERFLOW in {}; notifying every watched file there", directory );
                        notifyAll( directory );
                        continue;
                    }
                    Path changed = directory.resolve( (Path) event.context( ) );
                    if ( files.contains( changed ) ) {
                        log.trace( "pollEvents :: {} {}", event.kind( ).name( ), changed );
                        notifyListener( changed );
                    }
                }
                if ( !key.reset( ) ) {
                    log.warn( "pollEvents :: watch key for {} is no longer valid", directory );
                    directoryKeys.remove( directory, key );
                    notifyAll( directory );
                }
            }
        } catch ( InterruptedException e ) {
            log.info( "pollEvents :: watcher interrupted" );
            Thread.currentThread( ).interrupt( );
        } catch ( ClosedWatchServiceException e ) {
            log.info( "pollEvents :: watch service closed" );
        }
    }

    private void notifyAll ( Path directory ) {
        List< Path > affected = new ArrayList<>( );
        for ( Path file : files ) {
            if ( directory.equals( file.getParent( ) ) ) {
                affected.add( file );
            }
        }
        affected.forEach( this::notifyListener );
    }

    private void notifyListener ( Path file ) {
        try {
            listener.accept( file );
        } catch ( RuntimeException e ) {
            log.error( "notifyListener :: listener failed for {}: {}", file, e.getMessage( ), e );
        }
    }

    @PreDestroy
    public synchronized void close ( ) {
        if ( watchService != null ) {
            try {
                watchService.close( );
            } catch ( IOException e ) {
                log.warn( "close :: failed to close watch service: {}", e.getMessage( ) );
            }
            watchService = null;
        }
        files.clear( );
        directoryKeys.clear( );
    }
}
