package com.eh.filemirror.autoupdate.service;

import com.eh.filemirror.autoupdate.config.FileCacheProperties;
import com.eh.filemirror.autoupdate.model.WatchedFileInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Watch records of files that disappeared, kept for a short while in case the application that
 * deleted them writes them back (a save done as delete plus create).
 * <p>
 * Every timer consumes the oldest entry, not the entry it was scheduled for.
 */
@Component
public class DeferredRecreationQueue {
    private static final Logger log = LoggerFactory.getLogger( DeferredRecreationQueue.class.getName( ) );

    private final ScheduledExecutorService loop;
    private final Duration recheckDelay;
    private final Deque< WatchedFileInfo > deletedFileInfos = new ArrayDeque<>( );

    public DeferredRecreationQueue ( @Qualifier( "autoUpdateLoop" ) ScheduledExecutorService loop, FileCacheProperties fileCacheProperties ) {
        this.loop = loop;
        this.recheckDelay = fileCacheProperties.getRecheckDelay( );
    }

    public void defer ( WatchedFileInfo info, Runnable recheck ) {
        deletedFileInfos.addLast( info );
        loop.schedule( recheck, recheckDelay.toMillis( ), TimeUnit.MILLISECONDS );
        log.debug( "defer :: {} deferred for {} ms, {} pending", info.getPathInRepo( ), recheckDelay.toMillis( ), deletedFileInfos.size( ) );
    }

    public Optional< WatchedFileInfo > poll ( ) {
        return Optional.ofNullable( deletedFileInfos.pollFirst( ) );
    }

    public boolean contains ( String repoId, String pathInRepo ) {
        return deletedFileInfos.stream( ).anyMatch( info -> info.refersTo( repoId, pathInRepo ) );
    }

    public int size ( ) {
        return deletedFileInfos.size( );
    }
}
