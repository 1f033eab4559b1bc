package com.eh.filemirror.autoupdate.config;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger( ExecutorConfig.class );

    private ScheduledExecutorService autoUpdateLoop;
    private ExecutorService fileWatcherExecutor;
    private ExecutorService cacheCleanerExecutor;

    /**
     * Single control thread. Watch registry, deferred queue and upload bookkeeping are only ever
     * touched from tasks running here, so none of them need locking.
     */
    @Bean( name = "autoUpdateLoop" )
    public ScheduledExecutorService autoUpdateLoop ( ) {
        this.autoUpdateLoop = Executors.newSingleThreadScheduledExecutor( namedThreadFactory( "auto-update-loop", false ) );
        return this.autoUpdateLoop;
    }

    @Bean( name = "fileWatcherExecutor" )
    public ExecutorService fileWatcherExecutor ( ) {
        this.fileWatcherExecutor = Executors.newSingleThreadExecutor( namedThreadFactory( "cache-file-watcher", true ) );
        return this.fileWatcherExecutor;
    }

    @Bean( name = "cacheCleanerExecutor" )
    public ExecutorService cacheCleanerExecutor ( ) {
        this.cacheCleanerExecutor = Executors.newFixedThreadPool( Math.max( 1, Runtime.getRuntime( ).availableProcessors( ) / 2 ), namedThreadFactory( "cache-cleaner", true ) );
        return this.cacheCleanerExecutor;
    }

    @PreDestroy
    public void shutdownExecutors ( ) {
        shutdownExecutor( autoUpdateLoop, "Auto Update Loop ScheduledExecutorService" );
        shutdownExecutor( fileWatcherExecutor, "File Watcher ExecutorService" );
        shutdownExecutor( cacheCleanerExecutor, "Cache Cleaner ExecutorService" );
    }

    private void shutdownExecutor ( ExecutorService executor, String name ) {
        if ( executor != null ) {
            executor.shutdown( );
            try {
                if ( !executor.awaitTermination( 60, TimeUnit.SECONDS ) ) {
                    executor.shutdownNow( );
                    if ( !executor.awaitTermination( 60, TimeUnit.SECONDS ) ) {
                        log.error( "{} did not terminate", name );
                    }
                }
            } catch ( InterruptedException ex ) {
                executor.shutdownNow( );
                Thread.currentThread( ).interrupt( );
            }
        }
    }

    // the loop thread is the one keeping the application alive
    static ThreadFactory namedThreadFactory ( String prefix, boolean daemon ) {
        AtomicInteger counter = new AtomicInteger( );
        return runnable -> {
            Thread thread = new Thread( runnable, prefix + "-" + counter.incrementAndGet( ) );
            thread.setDaemon( daemon );
            return thread;
        };
    }
}
