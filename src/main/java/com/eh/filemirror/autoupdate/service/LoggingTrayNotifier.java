package com.eh.filemirror.autoupdate.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingTrayNotifier implements TrayNotifier {
    private static final Logger log = LoggerFactory.getLogger( LoggingTrayNotifier.class.getName( ) );

    @Override
    public void showMessage ( String title, String message, String repoId ) {
        log.info( "showMessage :: [{}] {} (repo {})", title, message.replace( '\n', ' ' ), repoId );
    }
}
