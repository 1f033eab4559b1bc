package com.eh.filemirror.autoupdate.service;

import java.nio.file.Path;

/**
 * Some viewers rewrite a file right after opening it. The dispatcher asks this filter whether a change
 * notification is one of those and must be dropped.
 */
public interface OpenedFileFilter {

    OpenedFileFilter NONE = new OpenedFileFilter( ) {
        @Override
        public void fileOpened ( Path path ) {
            // nothing to remember
        }

        @Override
        public boolean isRecentlyOpened ( Path path ) {
            return false;
        }
    };

    void fileOpened ( Path path );

    boolean isRecentlyOpened ( Path path );
}
