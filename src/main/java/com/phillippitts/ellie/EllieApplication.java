package com.phillippitts.ellie;

import com.phillippitts.ellie.config.properties.AudioValidationProperties;
import com.phillippitts.ellie.config.properties.CacheProperties;
import com.phillippitts.ellie.config.properties.ClassifierProperties;
import com.phillippitts.ellie.config.properties.ClientProperties;
import com.phillippitts.ellie.config.properties.FallbackProperties;
import com.phillippitts.ellie.config.properties.OrchestrationProperties;
import com.phillippitts.ellie.config.properties.ProviderProperties;
import com.phillippitts.ellie.config.properties.SessionProperties;
import com.phillippitts.ellie.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        AudioValidationProperties.class,
        CacheProperties.class,
        ClassifierProperties.class,
        ClientProperties.class,
        FallbackProperties.class,
        OrchestrationProperties.class,
        ProviderProperties.class,
        SessionProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class EllieApplication {

    public static void main(String[] args) {
        SpringApplication.run(EllieApplication.class, args);
    }

}
