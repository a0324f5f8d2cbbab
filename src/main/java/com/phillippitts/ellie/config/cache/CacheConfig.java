package com.phillippitts.ellie.config.cache;

import com.phillippitts.ellie.config.properties.CacheProperties;
import com.phillippitts.ellie.service.cache.InMemoryResponseCache;
import com.phillippitts.ellie.service.cache.ResponseCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The two response caches: reply text keyed by normalized question, and synthesized audio keyed by
 * text, voice and speed.
 */
@Configuration
public class CacheConfig {

    @Bean
    public ResponseCache<String> textResponseCache(CacheProperties props) {
        return new InMemoryResponseCache<>("text", props.getMaxEntries());
    }

    @Bean
    public ResponseCache<byte[]> audioResponseCache(CacheProperties props) {
        return new InMemoryResponseCache<>("audio", props.getMaxEntries());
    }
}
