package com.eh.filemirror.autoupdate.service;

import com.eh.filemirror.autoupdate.config.FileCacheProperties;
import com.eh.filemirror.autoupdate.model.Account;
import com.eh.filemirror.autoupdate.model.AccountChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.Objects;

@Service
public class AccountManager {
    private static final Logger log = LoggerFactory.getLogger( AccountManager.class.getName( ) );

    private final ApplicationEventPublisher eventPublisher;
    private Account currentAccount;

    public AccountManager ( FileCacheProperties fileCacheProperties, ApplicationEventPublisher eventPublisher ) {
        this.eventPublisher = eventPublisher;
        FileCacheProperties.AccountProperties configured = fileCacheProperties.getAccount( );
        Account account = new Account( configured.getServerUrl( ), configured.getUsername( ), configured.getToken( ) );
        this.currentAccount = account.isValid( ) ? account : null;
    }

    public synchronized Account currentAccount ( ) {
        return currentAccount;
    }

    public void switchAccount ( Account account ) {
        Account previous;
        synchronized ( this ) {
            if ( Objects.equals( currentAccount, account ) ) {
                return;
            }
            previous = currentAccount;
            currentAccount = account;
        }
        log.info( "switchAccount :: switched from {} to {}", previous, account );
        eventPublisher.publishEvent( new AccountChangedEvent( previous, account ) );
    }

    public void logout ( ) {
        switchAccount( null );
    }
}
