package com.phillippitts.recallahead;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        com.phillippitts.recallahead.config.properties.OrchestratorProperties.class,
        com.phillippitts.recallahead.config.properties.RecallClientProperties.class,
        com.phillippitts.recallahead.config.properties.InputTriggerProperties.class
})
public class RecallAheadApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecallAheadApplication.class, args);
    }

}
