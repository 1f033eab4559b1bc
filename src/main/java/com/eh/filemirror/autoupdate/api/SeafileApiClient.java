/**
 * SeafileApiClient talks to the repository server's web API: it asks for upload, update and
 * download links and moves file content through them. Every call returns a cold {@link Mono};
 * non-success responses are turned into {@link FileTransferException}.
 */

package com.eh.filemirror.autoupdate.api;

import com.eh.filemirror.autoupdate.exceptions.FileTransferException;
import com.eh.filemirror.autoupdate.model.Account;
import com.eh.filemirror.autoupdate.model.DownloadLink;
import com.eh.filemirror.autoupdate.util.FileCacheUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class SeafileApiClient {
    private static final Logger logger = LoggerFactory.getLogger( SeafileApiClient.class );

    static final String FILE_ID_HEADER = "oid";

    private final WebClient webClient;

    public SeafileApiClient ( WebClient webClient ) {
        this.webClient = webClient;
    }

    /**
     * Fetches a one-time link to which new content of an existing file ({@code update}) or a new file
     * is posted.
     */
    public Mono< String > getUploadLink ( Account account, String repoId, boolean update ) {
        String endpoint = update ? "update-link" : "upload-link";
        return Mono.defer( ( ) -> {
            logger.debug( "getUploadLink :: requesting {} for repo {}", endpoint, repoId );
            return webClient.get( )
                    .uri( apiBase( account ) + "/api2/repos/{repoId}/{endpoint}/", repoId, endpoint )
                    .header( HttpHeaders.AUTHORIZATION, authorization( account ) )
                    .retrieve( )
                    .onStatus( HttpStatusCode::isError, response -> toException( response, String.format( "Failed to get %s for repo %s", endpoint, repoId ) ) )
                    .bodyToMono( String.class )
                    .map( SeafileApiClient::unquote );
        } );
    }

    /**
     * Posts the local file to an upload link.
     *
     * @return id of the new file revision as reported by the server
     */
    public Mono< String > uploadFile ( Account account, String uploadLink, String parentPath, Path localPath, String fileName, boolean update ) {
        return Mono.defer( ( ) -> {
            if ( !Files.isRegularFile( localPath ) ) {
                return Mono.error( new FileTransferException( "Local file does not exist: " + localPath ) );
            }
            MultipartBodyBuilder builder = new MultipartBodyBuilder( );
            builder.part( "file", new FileSystemResource( localPath ) ).filename( fileName );
            if ( update ) {
                builder.part( "target_file", FileCacheUtils.joinRepoPath( parentPath, fileName ) );
            } else {
                builder.part( "parent_dir", parentPath );
            }
            logger.info( "uploadFile :: uploading {} to {}", localPath, FileCacheUtils.joinRepoPath( parentPath, fileName ) );
            return webClient.post( )
                    .uri( URI.create( uploadLink ) )
                    .header( HttpHeaders.AUTHORIZATION, authorization( account ) )
                    .contentType( MediaType.MULTIPART_FORM_DATA )
                    .body( BodyInserters.fromMultipartData( builder.build( ) ) )
                    .retrieve( )
                    .onStatus( HttpStatusCode::isError, response -> toException( response, String.format( "Failed to upload %s", localPath ) ) )
                    .bodyToMono( String.class )
                    .map( SeafileApiClient::unquote );
        } );
    }

    public Mono< DownloadLink > getDownloadLink ( Account account, String repoId, String pathInRepo ) {
        return Mono.defer( ( ) -> webClient.get( )
                .uri( apiBase( account ) + "/api2/repos/{repoId}/file/?p={path}", repoId, pathInRepo )
                .header( HttpHeaders.AUTHORIZATION, authorization( account ) )
                .retrieve( )
                .onStatus( HttpStatusCode::isError, response -> toException( response, String.format( "Failed to get download link for %s in repo %s", pathInRepo, repoId ) ) )
                .toEntity( String.class )
                .map( entity -> new DownloadLink( unquote( entity.getBody( ) ), entity.getHeaders( ).getFirst( FILE_ID_HEADER ) ) ) );
    }

    /**
     * Streams the content behind {@code downloadLink} into {@code target}, creating parent directories.
     */
    public Mono< Path > download ( String downloadLink, Path target ) {
        return Mono.fromCallable( ( ) -> Files.createDirectories( target.getParent( ) ) )
                .onErrorMap( e -> new FileTransferException( "Unable to create cache directory for " + target, e ) )
                .then( Mono.defer( ( ) -> {
                    Flux< DataBuffer > body = webClient.get( )
                            .uri( URI.create( downloadLink ) )
                            .retrieve( )
                            .onStatus( HttpStatusCode::isError, response -> toException( response, String.format( "Failed to download %s", target.getFileName( ) ) ) )
                            .bodyToFlux( DataBuffer.class );
                    return DataBufferUtils.write( body, target );
                } ) )
                .then( Mono.just( target ) )
                .doOnSuccess( path -> logger.info( "download :: downloaded {}", path ) );
    }

    private static Mono< ? extends Throwable > toException ( ClientResponse response, String message ) {
        return response.bodyToMono( String.class )
                .defaultIfEmpty( "" )
                .map( body -> new FileTransferException( String.format( "%s: %d %s", message, response.statusCode( ).value( ), body ) ) );
    }

    private static String apiBase ( Account account ) {
        String serverUrl = account.serverUrl( );
        if ( serverUrl == null || serverUrl.isBlank( ) ) {
            throw new FileTransferException( "No server URL configured for " + account.username( ) );
        }
        return serverUrl.endsWith( "/" ) ? serverUrl.substring( 0, serverUrl.length( ) - 1 ) : serverUrl;
    }

    private static String authorization ( Account account ) {
        return "Token " + account.token( );
    }

    static String unquote ( String value ) {
        if ( value == null ) {
            return null;
        }
        String trimmed = value.trim( );
        if ( trimmed.length( ) >= 2 && trimmed.startsWith( "\"" ) && trimmed.endsWith( "\"" ) ) {
            return trimmed.substring( 1, trimmed.length( ) - 1 );
        }
        return trimmed;
    }
}
