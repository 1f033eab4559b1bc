package com.eh.filemirror.autoupdate.util;

import java.net.URLConnection;
import java.nio.file.Path;

public class FileCacheUtils {

    private static final String PDF_MIME_TYPE = "application/pdf";
    private static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    private FileCacheUtils ( ) {
        throw new UnsupportedOperationException( "This is a utility class and cannot be instantiated" );
    }

    /**
     * Parent of a repository path, always starting with "/". The parent of a top level entry is "/".
     */
    public static String getParentPath ( String pathInRepo ) {
        if ( pathInRepo == null || pathInRepo.isEmpty( ) || "/".equals( pathInRepo ) ) {
            return "/";
        }
        String trimmed = pathInRepo.endsWith( "/" ) ? pathInRepo.substring( 0, pathInRepo.length( ) - 1 ) : pathInRepo;
        int idx = trimmed.lastIndexOf( '/' );
        if ( idx <= 0 ) {
            return "/";
        }
        return trimmed.substring( 0, idx );
    }

    public static String getBaseName ( String path ) {
        if ( path == null || path.isEmpty( ) ) {
            return "";
        }
        String trimmed = path.endsWith( "/" ) ? path.substring( 0, path.length( ) - 1 ) : path;
        return trimmed.substring( trimmed.lastIndexOf( '/' ) + 1 );
    }

    public static String getBaseName ( Path path ) {
        Path name = path.getFileName( );
        return name == null ? "" : name.toString( );
    }

    public static String joinRepoPath ( String parentPath, String name ) {
        if ( parentPath == null || parentPath.isEmpty( ) || "/".equals( parentPath ) ) {
            return "/" + name;
        }
        return parentPath.endsWith( "/" ) ? parentPath + name : parentPath + "/" + name;
    }

    public static String mimeTypeFromFileName ( String fileName ) {
        String mimeType = URLConnection.guessContentTypeFromName( fileName );
        return mimeType == null ? DEFAULT_MIME_TYPE : mimeType;
    }

    public static boolean isImageOrPdf ( Path path ) {
        String mimeType = mimeTypeFromFileName( getBaseName( path ) );
        return mimeType.startsWith( "image" ) || PDF_MIME_TYPE.equals( mimeType );
    }
}
