package com.vaultpost.config;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import com.vaultpost.crypto.HybridCipher;
import com.vaultpost.sync.MessageTransport;
import com.vaultpost.sync.WebClientMessageTransport;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Infrastructure beans shared by the key manager, the sync engine and the status monitor.
 */
@Configuration
@EnableConfigurationProperties({
        SyncProperties.class, StatusProperties.class, CryptoProperties.class, TransportProperties.class })
public class CourierConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HybridCipher hybridCipher() {
        return new HybridCipher();
    }

    /** Timers for retries, the periodic sync and the health check. */
    @Bean(destroyMethod = "dispose")
    public Scheduler courierScheduler() {
        return Schedulers.newParallel("courier-timers", 2);
    }

    @Bean
    @ConditionalOnMissingBean(MessageTransport.class)
    public MessageTransport messageTransport(WebClient.Builder webClientBuilder, TransportProperties properties) {
        return new WebClientMessageTransport(webClientBuilder, properties);
    }
}
