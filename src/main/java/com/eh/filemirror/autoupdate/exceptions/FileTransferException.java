/**
 * Raised when a request to the repository server fails, either with a non-success
 * status or because the local file could not be read or written.
 */

package com.eh.filemirror.autoupdate.exceptions;

public class FileTransferException extends RuntimeException {
    public FileTransferException ( String message ) {
        super( message );
    }

    public FileTransferException ( String message, Throwable cause ) {
        super( message, cause );
    }
}
