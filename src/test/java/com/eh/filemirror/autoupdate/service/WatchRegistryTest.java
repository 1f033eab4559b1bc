package com.eh.filemirror.autoupdate.service;

import com.eh.filemirror.autoupdate.model.Account;
import com.eh.filemirror.autoupdate.model.WatchedFileInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith( MockitoExtension.class )
class WatchRegistryTest {

    private static final Account ALICE = new Account( "https://cloud.example.com", "alice", "t1" );
    private static final Account BOB = new Account( "https://cloud.example.com", "bob", "t2" );

    @Mock
    private CacheFileWatcher watcher;

    private final Set< Path > watchedFiles = new HashSet<>( );
    private WatchRegistry registry;

    @BeforeEach
    void setUp ( ) {
        lenient( ).when( watcher.files( ) ).thenAnswer( invocation -> Collections.unmodifiableSet( new HashSet<>( watchedFiles ) ) );
        lenient( ).when( watcher.addPath( any( Path.class ) ) ).thenAnswer( invocation -> watchedFiles.add( invocation.getArgument( 0 ) ) );
        lenient( ).when( watcher.removePath( any( Path.class ) ) ).thenAnswer( invocation -> watchedFiles.remove( invocation.getArgument( 0 ) ) );
        registry = new WatchRegistry( watcher );
    }

    @Test
    void testAdd_registersRecordAndWatch ( ) {
        Path path = Paths.get( "/cache/file-cache/repo/a.txt" );

        assertTrue( registry.add( path, new WatchedFileInfo( ALICE, "repo", "/a.txt" ) ) );

        assertTrue( registry.contains( path ) );
        assertTrue( watchedFiles.contains( path ) );
    }

    @Test
    void testAdd_samePathTwice_keepsOneRecordAndOneWatch ( ) {
        Path path = Paths.get( "/cache/file-cache/repo/a.txt" );

        registry.add( path, new WatchedFileInfo( ALICE, "repo", "/a.txt" ) );
        registry.add( path, new WatchedFileInfo( ALICE, "repo", "/a.txt" ) );

        assertEquals( 1, registry.size( ) );
        verify( watcher, times( 1 ) ).addPath( path );
    }

    @Test
    void testAdd_uploadingRecord_isNotReplaced ( ) {
        Path path = Paths.get( "/cache/file-cache/repo/a.txt" );
        WatchedFileInfo uploading = new WatchedFileInfo( ALICE, "repo", "/a.txt" );
        registry.add( path, uploading );
        registry.stopMonitoring( path );
        uploading.setUploading( true );

        assertFalse( registry.add( path, new WatchedFileInfo( BOB, "repo", "/a.txt" ) ) );

        assertSame( uploading, registry.get( path ) );
        assertFalse( watchedFiles.contains( path ) );
    }

    @Test
    void testAdd_watchFailure_keepsRecord ( ) {
        Path path = Paths.get( "/cache/file-cache/repo/missing.txt" );
        doReturn( false ).when( watcher ).addPath( path );

        registry.add( path, new WatchedFileInfo( ALICE, "repo", "/missing.txt" ) );

        assertTrue( registry.contains( path ) );
        assertFalse( watchedFiles.contains( path ) );
    }

    @Test
    void testRemove_isIdempotent ( ) {
        Path path = Paths.get( "/cache/file-cache/repo/a.txt" );
        WatchedFileInfo info = new WatchedFileInfo( ALICE, "repo", "/a.txt" );
        registry.add( path, info );

        assertSame( info, registry.remove( path ) );
        assertNull( registry.remove( path ) );

        assertFalse( registry.contains( path ) );
        verify( watcher, times( 1 ) ).removePath( path );
    }

    @Test
    void testRemoveAllForAccount_onlyRemovesMatchingAccount ( ) {
        Path a1 = Paths.get( "/cache/file-cache/repo/a1.txt" );
        Path a2 = Paths.get( "/cache/file-cache/repo/a2.txt" );
        Path b1 = Paths.get( "/cache/file-cache/repo/b1.txt" );
        registry.add( a1, new WatchedFileInfo( ALICE, "repo", "/a1.txt" ) );
        registry.add( a2, new WatchedFileInfo( ALICE, "repo", "/a2.txt" ) );
        registry.add( b1, new WatchedFileInfo( BOB, "repo", "/b1.txt" ) );

        int removed = registry.removeAllForAccount( new Account( "https://cloud.example.com", "alice", "t1" ) );

        assertEquals( 2, removed );
        assertEquals( 1, registry.size( ) );
        assertTrue( registry.contains( b1 ) );
        assertEquals( Set.of( b1 ), watchedFiles );
    }

    @Test
    void testStopMonitoring_unwatchedPath_doesNotCallWatcher ( ) {
        assertTrue( registry.stopMonitoring( Paths.get( "/cache/file-cache/repo/none.txt" ) ) );

        verify( watcher, never( ) ).removePath( any( Path.class ) );
    }
}
