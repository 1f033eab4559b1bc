package com.eh.filemirror.autoupdate.config;

import com.eh.filemirror.autoupdate.constants.FileCacheConstant;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

@Configuration
@ConfigurationProperties( prefix = "filecache" )
public class FileCacheProperties {

    private String baseDir = Paths.get( System.getProperty( "user.home" ), ".filemirror" ).toString( );

    private Duration recheckDelay = Duration.ofMillis( FileCacheConstant.DEFAULT_RECHECK_DELAY_MILLIS );

    private Duration openedFileWindow = Duration.ofMillis( FileCacheConstant.DEFAULT_OPENED_FILE_WINDOW_MILLIS );

    // null means "only where the platform needs it"
    private Boolean openedFileFilterEnabled;

    private Duration httpTimeout = Duration.ofMinutes( 2 );

    private final AccountProperties account = new AccountProperties( );

    public Path getBasePath ( ) {
        return Paths.get( baseDir ).toAbsolutePath( );
    }

    public String getBaseDir ( ) {
        return baseDir;
    }

    public void setBaseDir ( String baseDir ) {
        this.baseDir = baseDir;
    }

    public Duration getRecheckDelay ( ) {
        return recheckDelay;
    }

    public void setRecheckDelay ( Duration recheckDelay ) {
        this.recheckDelay = recheckDelay;
    }

    public Duration getOpenedFileWindow ( ) {
        return openedFileWindow;
    }

    public void setOpenedFileWindow ( Duration openedFileWindow ) {
        this.openedFileWindow = openedFileWindow;
    }

    public Boolean getOpenedFileFilterEnabled ( ) {
        return openedFileFilterEnabled;
    }

    public void setOpenedFileFilterEnabled ( Boolean openedFileFilterEnabled ) {
        this.openedFileFilterEnabled = openedFileFilterEnabled;
    }

    public Duration getHttpTimeout ( ) {
        return httpTimeout;
    }

    public void setHttpTimeout ( Duration httpTimeout ) {
        this.httpTimeout = httpTimeout;
    }

    public AccountProperties getAccount ( ) {
        return account;
    }

    public static class AccountProperties {
        private String serverUrl;
        private String username;
        private String token;

        public String getServerUrl ( ) {
            return serverUrl;
        }

        public void setServerUrl ( String serverUrl ) {
            this.serverUrl = serverUrl;
        }

        public String getUsername ( ) {
            return username;
        }

        public void setUsername ( String username ) {
            this.username = username;
        }

        public String getToken ( ) {
            return token;
        }

        public void setToken ( String token ) {
            this.token = token;
        }
    }
}
