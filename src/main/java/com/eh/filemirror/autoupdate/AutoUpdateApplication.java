package com.eh.filemirror.autoupdate;

import com.eh.filemirror.autoupdate.service.AutoUpdateManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AutoUpdateApplication implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger( AutoUpdateApplication.class.getName( ) );

    private final AutoUpdateManager autoUpdateManager;

    public AutoUpdateApplication ( AutoUpdateManager autoUpdateManager ) {
        this.autoUpdateManager = autoUpdateManager;
    }

    public static void main ( String[] args ) {
        SpringApplication.run( AutoUpdateApplication.class, args );
    }

    @Override
    public void run ( String... args ) {
        log.info( "run :: starting auto update manager, clearing leftovers of the previous session" );
        autoUpdateManager.start( );
    }
}
