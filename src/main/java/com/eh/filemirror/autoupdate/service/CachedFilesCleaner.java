package com.eh.filemirror.autoupdate.service;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import static com.eh.filemirror.autoupdate.constants.FileCacheConstant.FILE_CACHE_DB_FILE_NAME;
import static com.eh.filemirror.autoupdate.constants.FileCacheConstant.FILE_CACHE_TEMP_TOP_DIR_NAME;
import static com.eh.filemirror.autoupdate.constants.FileCacheConstant.FILE_CACHE_TOP_DIR_NAME;

/**
 * Removes the file cache database and the file cache directory under {@code baseDir}.
 * <p>
 * The cache directory is first renamed to the temporary name and deleted from there, so an interrupted run
 * never leaves a half deleted directory under the live name. A temporary directory left behind by an
 * earlier run is deleted first.
 */
public class CachedFilesCleaner implements Runnable {
    private static final Logger log = LoggerFactory.getLogger( CachedFilesCleaner.class.getName( ) );

    private final Path fileCacheDir;
    private final Path fileCacheTmpDir;
    private final Path fileCacheDbFile;

    public CachedFilesCleaner ( Path baseDir ) {
        this.fileCacheDir = baseDir.resolve( FILE_CACHE_TOP_DIR_NAME );
        this.fileCacheTmpDir = baseDir.resolve( FILE_CACHE_TEMP_TOP_DIR_NAME );
        this.fileCacheDbFile = baseDir.resolve( FILE_CACHE_DB_FILE_NAME );
    }

    @Override
    public void run ( ) {
        log.info( "run :: removing cached files" );
        try {
            Files.deleteIfExists( fileCacheDbFile );
        } catch ( IOException e ) {
            log.warn( "run :: failed to remove db file {}: {}", fileCacheDbFile, e.getMessage( ) );
        }
        if ( Files.isDirectory( fileCacheTmpDir ) ) {
            deleteRecursively( fileCacheTmpDir );
        }
        if ( Files.isDirectory( fileCacheDir ) ) {
            if ( hide( fileCacheDir, fileCacheTmpDir ) ) {
                deleteRecursively( fileCacheTmpDir );
            } else {
                deleteRecursively( fileCacheDir );
            }
        }
        log.info( "run :: cached files removed" );
    }

    private static boolean hide ( Path source, Path target ) {
        try {
            try {
                Files.move( source, target, StandardCopyOption.ATOMIC_MOVE );
            } catch ( AtomicMoveNotSupportedException e ) {
                Files.move( source, target );
            }
            return true;
        } catch ( IOException e ) {
            log.warn( "hide :: failed to rename {} to {}: {}", source, target, e.getMessage( ) );
            return false;
        }
    }

    private static void deleteRecursively ( Path dir ) {
        try {
            FileUtils.deleteDirectory( dir.toFile( ) );
        } catch ( IOException e ) {
            log.warn( "deleteRecursively :: failed to delete {}: {}", dir, e.getMessage( ) );
        }
    }

    public Path getFileCacheDir ( ) {
        return fileCacheDir;
    }
}
