package com.phillippitts.ellie.config.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.ellie.config.properties.ProviderProperties;
import com.phillippitts.ellie.service.provider.ChatCompletionGenerationProvider;
import com.phillippitts.ellie.service.provider.OpenAiSynthesisProvider;
import com.phillippitts.ellie.service.provider.OpenAiTranscriptionProvider;
import com.phillippitts.ellie.service.provider.ProviderNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

/**
 * HTTP clients and provider beans for the upstream AI services.
 *
 * <p>All clients share one pooled connection provider sized by {@code ellie.providers.http.*}.
 * Providers without an API key are still created; they report {@code isConfigured() == false}
 * and are skipped by routing.
 */
@Configuration
public class ProviderClientConfig {

    private static final Logger LOG = LogManager.getLogger(ProviderClientConfig.class);

    private final ProviderProperties props;

    public ProviderClientConfig(ProviderProperties props) {
        this.props = props;
    }

    @Bean(destroyMethod = "dispose")
    public ConnectionProvider providerConnectionPool() {
        ProviderProperties.Http http = props.getHttp();
        return ConnectionProvider.builder("ellie-http")
                .maxConnections(http.getMaxConnections())
                .pendingAcquireTimeout(Duration.ofSeconds(http.getPendingAcquireTimeoutSeconds()))
                .build();
    }

    @Bean("openAiWebClient")
    public WebClient openAiWebClient(ConnectionProvider providerConnectionPool) {
        return createWebClient(props.getAccurate().getBaseUrl(), providerConnectionPool);
    }

    @Bean("groqWebClient")
    public WebClient groqWebClient(ConnectionProvider providerConnectionPool) {
        return createWebClient(props.getFast().getBaseUrl(), providerConnectionPool);
    }

    @Bean
    public OpenAiTranscriptionProvider transcriptionProvider(ConnectionProvider providerConnectionPool,
                                                             ObjectMapper objectMapper) {
        ProviderProperties.Endpoint endpoint = props.getTranscription();
        logConfigured(ProviderNames.WHISPER, endpoint);
        return new OpenAiTranscriptionProvider(
                createWebClient(endpoint.getBaseUrl(), providerConnectionPool), endpoint, objectMapper);
    }

    @Bean
    public OpenAiSynthesisProvider synthesisProvider(ConnectionProvider providerConnectionPool) {
        ProviderProperties.SynthesisEndpoint endpoint = props.getSynthesis();
        logConfigured(ProviderNames.TTS, endpoint);
        return new OpenAiSynthesisProvider(createWebClient(endpoint.getBaseUrl(), providerConnectionPool), endpoint);
    }

    @Bean("fastGenerationProvider")
    public ChatCompletionGenerationProvider fastGenerationProvider(
            @Qualifier("groqWebClient") WebClient groqWebClient, ObjectMapper objectMapper) {
        logConfigured(ProviderNames.GROQ, props.getFast());
        return new ChatCompletionGenerationProvider(ProviderNames.GROQ, groqWebClient, props.getFast(), objectMapper);
    }

    @Bean("accurateGenerationProvider")
    public ChatCompletionGenerationProvider accurateGenerationProvider(
            @Qualifier("openAiWebClient") WebClient openAiWebClient, ObjectMapper objectMapper) {
        logConfigured(ProviderNames.OPENAI_CHAT, props.getAccurate());
        return new ChatCompletionGenerationProvider(ProviderNames.OPENAI_CHAT, openAiWebClient, props.getAccurate(),
                objectMapper);
    }

    private WebClient createWebClient(String baseUrl, ConnectionProvider pool) {
        HttpClient httpClient = HttpClient.create(pool)
                .responseTimeout(Duration.ofSeconds(props.getHttp().getResponseTimeoutSeconds()));
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs()
                        .maxInMemorySize(props.getHttp().getMaxInMemorySizeBytes()))
                .build();
        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .build();
    }

    private static void logConfigured(String provider, ProviderProperties.Endpoint endpoint) {
        if (endpoint.hasApiKey()) {
            LOG.info("Provider {} configured: baseUrl={}, model={}", provider, endpoint.getBaseUrl(),
                    endpoint.getModel());
        } else {
            LOG.warn("Provider {} has no API key; it will be skipped and turns will fall back", provider);
        }
    }
}
