package com.eh.filemirror.autoupdate.model;

public record Account(String serverUrl, String username, String token) {

    public boolean isValid ( ) {
        return serverUrl != null && !serverUrl.isBlank( ) && username != null && !username.isBlank( );
    }

    @Override
    public String toString ( ) {
        return username + "@" + serverUrl;
    }
}
