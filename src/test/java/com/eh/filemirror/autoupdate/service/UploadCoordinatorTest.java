package com.eh.filemirror.autoupdate.service;

import com.eh.filemirror.autoupdate.model.Account;
import com.eh.filemirror.autoupdate.model.CachedFileUpdatedEvent;
import com.eh.filemirror.autoupdate.model.WatchedFileInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;

import static com.eh.filemirror.autoupdate.constants.FileCacheConstant.UPLOAD_FAILURE;
import static com.eh.filemirror.autoupdate.constants.FileCacheConstant.UPLOAD_SUCCESS;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith( MockitoExtension.class )
class UploadCoordinatorTest {

    private static final Account ACCOUNT = new Account( "https://cloud.example.com", "alice", "t1" );
    private static final String REPO_ID = "repo-1";
    private static final Path LOCAL_PATH = Paths.get( "/cache/file-cache/repo-1/projects/plan.xlsx" );

    @Mock
    private TransferManager transferManager;
    @Mock
    private WatchRegistry watchRegistry;
    @Mock
    private TrayNotifier trayNotifier;
    @Mock
    private ApplicationEventPublisher eventPublisher;
    @Mock
    private ScheduledExecutorService loop;
    @Mock
    private FileUploadTask task;

    @Captor
    private ArgumentCaptor< Runnable > completionCaptor;

    @InjectMocks
    private UploadCoordinator uploadCoordinator;

    private WatchedFileInfo info;

    @BeforeEach
    void setUp ( ) {
        info = new WatchedFileInfo( ACCOUNT, REPO_ID, "/projects/plan.xlsx" );
        lenient( ).when( task.getLocalFilePath( ) ).thenReturn( LOCAL_PATH );
        lenient( ).when( task.getRepoId( ) ).thenReturn( REPO_ID );
        lenient( ).when( task.getPath( ) ).thenReturn( "/projects/plan.xlsx" );
    }

    @Test
    void testUpload_createsUpdateTaskAndMarksUploading ( ) {
        when( transferManager.createUploadTask( ACCOUNT, REPO_ID, "/projects", LOCAL_PATH, "plan.xlsx", true ) ).thenReturn( task );
        when( task.start( ) ).thenReturn( new CompletableFuture<>( ) );

        uploadCoordinator.upload( LOCAL_PATH, info );

        assertTrue( info.isUploading( ) );
        verify( task ).start( );
        verify( loop, never( ) ).execute( any( Runnable.class ) );
    }

    @Test
    void testUpload_completionIsHandedToLoop ( ) {
        when( transferManager.createUploadTask( any( ), anyString( ), anyString( ), any( Path.class ), anyString( ), anyBoolean( ) ) ).thenReturn( task );
        CompletableFuture< Boolean > result = new CompletableFuture<>( );
        when( task.start( ) ).thenReturn( result );
        when( watchRegistry.get( LOCAL_PATH ) ).thenReturn( info );
        uploadCoordinator.upload( LOCAL_PATH, info );

        result.complete( true );

        verify( loop ).execute( completionCaptor.capture( ) );
        verifyNoInteractions( trayNotifier );
        completionCaptor.getValue( ).run( );
        verify( trayNotifier ).showMessage( UPLOAD_SUCCESS, "File \"plan.xlsx\"\nuploaded successfully.", REPO_ID );
        verify( watchRegistry ).startMonitoring( LOCAL_PATH );
        assertFalse( info.isUploading( ) );
    }

    @Test
    void testOnUpdateTaskFinished_success_publishesEvent ( ) {
        when( watchRegistry.get( LOCAL_PATH ) ).thenReturn( info );
        info.setUploading( true );

        uploadCoordinator.onUpdateTaskFinished( task, info, true );

        ArgumentCaptor< Object > event = ArgumentCaptor.forClass( Object.class );
        verify( eventPublisher ).publishEvent( event.capture( ) );
        assertEquals( new CachedFileUpdatedEvent( REPO_ID, "/projects/plan.xlsx" ), event.getValue( ) );
        verify( watchRegistry, never( ) ).remove( any( Path.class ) );
    }

    @Test
    void testOnUpdateTaskFinished_failure_removesRecord ( ) {
        when( watchRegistry.get( LOCAL_PATH ) ).thenReturn( info );

        uploadCoordinator.onUpdateTaskFinished( task, info, false );

        verify( trayNotifier ).showMessage( UPLOAD_FAILURE, "File \"plan.xlsx\"\nfailed to upload.", REPO_ID );
        verify( watchRegistry ).remove( LOCAL_PATH );
        verify( watchRegistry, never( ) ).startMonitoring( any( Path.class ) );
        verifyNoInteractions( eventPublisher );
    }

    @Test
    void testOnUpdateTaskFinished_success_recordGone_doesNotWatchAgain ( ) {
        when( watchRegistry.get( LOCAL_PATH ) ).thenReturn( null );

        uploadCoordinator.onUpdateTaskFinished( task, info, true );

        verify( watchRegistry, never( ) ).startMonitoring( any( Path.class ) );
        verify( trayNotifier ).showMessage( eq( UPLOAD_SUCCESS ), anyString( ), eq( REPO_ID ) );
    }

    @Test
    void testUpload_startThrows_settlesAsFailure ( ) {
        when( transferManager.createUploadTask( any( ), anyString( ), anyString( ), any( Path.class ), anyString( ), anyBoolean( ) ) ).thenReturn( task );
        when( task.start( ) ).thenThrow( new IllegalStateException( "no server url" ) );
        when( watchRegistry.get( LOCAL_PATH ) ).thenReturn( info );

        assertDoesNotThrow( ( ) -> uploadCoordinator.upload( LOCAL_PATH, info ) );

        verify( trayNotifier ).showMessage( UPLOAD_FAILURE, "File \"plan.xlsx\"\nfailed to upload.", REPO_ID );
        verify( watchRegistry ).remove( LOCAL_PATH );
        verifyNoInteractions( loop );
    }

    @Test
    void testOnUpdateTaskFinished_recordReplaced_leavesNewRecordAlone ( ) {
        WatchedFileInfo replacement = new WatchedFileInfo( ACCOUNT, REPO_ID, "/projects/plan.xlsx" );
        replacement.setUploading( true );
        when( watchRegistry.get( LOCAL_PATH ) ).thenReturn( replacement );

        uploadCoordinator.onUpdateTaskFinished( task, info, true );
        uploadCoordinator.onUpdateTaskFinished( task, info, false );

        assertTrue( replacement.isUploading( ) );
        verify( watchRegistry, never( ) ).startMonitoring( any( Path.class ) );
        verify( watchRegistry, never( ) ).remove( any( Path.class ) );
        verify( trayNotifier ).showMessage( eq( UPLOAD_SUCCESS ), anyString( ), eq( REPO_ID ) );
        verify( trayNotifier ).showMessage( eq( UPLOAD_FAILURE ), anyString( ), eq( REPO_ID ) );
    }
}
