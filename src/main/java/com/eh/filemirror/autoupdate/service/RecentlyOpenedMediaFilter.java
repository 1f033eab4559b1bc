package com.eh.filemirror.autoupdate.service;

import com.eh.filemirror.autoupdate.util.FileCacheUtils;
import com.github.benmanes.caffeine.cache.Cache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Remembers when image and PDF files were opened. Preview applications touch those on open,
 * which shows up as a modification for {@code window} afterwards.
 */
public class RecentlyOpenedMediaFilter implements OpenedFileFilter {
    private static final Logger log = LoggerFactory.getLogger( RecentlyOpenedMediaFilter.class.getName( ) );

    private final Cache< Path, Long > openedFiles;
    private final Duration window;
    private final Clock clock;

    public RecentlyOpenedMediaFilter ( Cache< Path, Long > openedFiles, Duration window, Clock clock ) {
        this.openedFiles = openedFiles;
        this.window = window;
        this.clock = clock;
    }

    @Override
    public void fileOpened ( Path path ) {
        if ( FileCacheUtils.isImageOrPdf( path ) ) {
            log.debug( "fileOpened :: remembering opened media file {}", path );
            openedFiles.put( path, clock.millis( ) );
        }
    }

    @Override
    public boolean isRecentlyOpened ( Path path ) {
        Long openedAt = openedFiles.getIfPresent( path );
        if ( openedAt == null ) {
            return false;
        }
        return clock.millis( ) < openedAt + window.toMillis( );
    }
}
