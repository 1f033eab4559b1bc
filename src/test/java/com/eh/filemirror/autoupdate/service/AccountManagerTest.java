package com.eh.filemirror.autoupdate.service;

import com.eh.filemirror.autoupdate.config.FileCacheProperties;
import com.eh.filemirror.autoupdate.model.Account;
import com.eh.filemirror.autoupdate.model.AccountChangedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith( MockitoExtension.class )
class AccountManagerTest {

    private static final Account ALICE = new Account( "https://cloud.example.com", "alice", "t1" );
    private static final Account BOB = new Account( "https://cloud.example.com", "bob", "t2" );

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private FileCacheProperties properties;

    @BeforeEach
    void setUp ( ) {
        properties = new FileCacheProperties( );
    }

    @Test
    void testConfiguredAccount_isCurrent ( ) {
        properties.getAccount( ).setServerUrl( "https://cloud.example.com" );
        properties.getAccount( ).setUsername( "alice" );
        properties.getAccount( ).setToken( "t1" );

        assertEquals( ALICE, new AccountManager( properties, eventPublisher ).currentAccount( ) );
    }

    @Test
    void testNoConfiguredAccount_currentIsNull ( ) {
        assertNull( new AccountManager( properties, eventPublisher ).currentAccount( ) );
    }

    @Test
    void testSwitchAccount_publishesPreviousAndCurrent ( ) {
        AccountManager accountManager = new AccountManager( properties, eventPublisher );
        accountManager.switchAccount( ALICE );

        accountManager.switchAccount( BOB );

        verify( eventPublisher ).publishEvent( new AccountChangedEvent( null, ALICE ) );
        verify( eventPublisher ).publishEvent( new AccountChangedEvent( ALICE, BOB ) );
        assertEquals( BOB, accountManager.currentAccount( ) );
    }

    @Test
    void testSwitchToSameAccount_publishesNothing ( ) {
        AccountManager accountManager = new AccountManager( properties, eventPublisher );
        accountManager.switchAccount( ALICE );
        clearInvocations( eventPublisher );

        accountManager.switchAccount( ALICE );

        verify( eventPublisher, never( ) ).publishEvent( any( Object.class ) );
    }

    @Test
    void testLogout ( ) {
        AccountManager accountManager = new AccountManager( properties, eventPublisher );
        accountManager.switchAccount( ALICE );

        accountManager.logout( );

        assertNull( accountManager.currentAccount( ) );
        verify( eventPublisher ).publishEvent( new AccountChangedEvent( ALICE, null ) );
    }
}
