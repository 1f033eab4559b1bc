package com.eh.filemirror.autoupdate.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_SIZE = 1024 * 1024;

    private final FileCacheProperties fileCacheProperties;

    public WebClientConfig ( FileCacheProperties fileCacheProperties ) {
        this.fileCacheProperties = fileCacheProperties;
    }

    /**
     * Server URLs differ per account, so no base URL is configured here.
     */
    @Bean
    public WebClient webClient ( ) {
        HttpClient httpClient = HttpClient.create( )
                .option( ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) fileCacheProperties.getHttpTimeout( ).toMillis( ) )
                .responseTimeout( fileCacheProperties.getHttpTimeout( ) );
        return WebClient.builder( )
                .clientConnector( new ReactorClientHttpConnector( httpClient ) )
                .exchangeStrategies( ExchangeStrategies.builder( ).codecs( c -> c.defaultCodecs( ).maxInMemorySize( MAX_IN_MEMORY_SIZE ) ).build( ) )
                .build( );
    }
}
