package com.eh.filemirror.autoupdate.config;

import com.eh.filemirror.autoupdate.service.OpenedFileFilter;
import com.eh.filemirror.autoupdate.service.RecentlyOpenedMediaFilter;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger( CacheConfig.class );

    private static final int MAX_OPENED_FILES = 1000;

    @Bean
    public Cache< Path, Long > recentlyOpenedFiles ( FileCacheProperties fileCacheProperties ) {
        return Caffeine.newBuilder( )
                .expireAfterWrite( fileCacheProperties.getOpenedFileWindow( ) )
                .maximumSize( MAX_OPENED_FILES )
                .build( );
    }

    @Bean
    public OpenedFileFilter openedFileFilter ( FileCacheProperties fileCacheProperties, Cache< Path, Long > recentlyOpenedFiles ) {
        Boolean configured = fileCacheProperties.getOpenedFileFilterEnabled( );
        boolean enabled = configured != null ? configured : isMacOs( System.getProperty( "os.name" ) );
        log.info( "openedFileFilter :: recently opened media filter enabled: {}", enabled );
        if ( !enabled ) {
            return OpenedFileFilter.NONE;
        }
        return new RecentlyOpenedMediaFilter( recentlyOpenedFiles, fileCacheProperties.getOpenedFileWindow( ), Clock.systemUTC( ) );
    }

    static boolean isMacOs ( String osName ) {
        return osName != null && osName.toLowerCase( ).startsWith( "mac" );
    }
}
