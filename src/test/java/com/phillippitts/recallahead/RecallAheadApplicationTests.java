package com.phillippitts.recallahead;

import com.phillippitts.recallahead.config.properties.InputTriggerProperties;
import com.phillippitts.recallahead.config.properties.OrchestratorProperties;
import com.phillippitts.recallahead.config.properties.RecallClientProperties;
import com.phillippitts.recallahead.service.eventloop.EventLoop;
import com.phillippitts.recallahead.service.eventloop.TaskSchedulerEventLoop;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
@SpringBootTest(properties = {
        "recall.client.api-key=",
        "recall.client.user-id="
})
class RecallAheadApplicationTests {

    @Autowired
    private EventLoop eventLoop;

    @Autowired
    private OrchestratorProperties orchestratorProperties;

    @Autowired
    private InputTriggerProperties triggerProperties;

    @Autowired
    private RecallClientProperties clientProperties;

    @Test
    void contextLoads() {
        assertThat(eventLoop).isInstanceOf(TaskSchedulerEventLoop.class);
    }

    @Test
    void bindsDeployedConfiguration() {
        assertThat(orchestratorProperties.toOptions().minLength()).isEqualTo(5);
        assertThat(orchestratorProperties.toOptions().debounce()).isEqualTo(Duration.ofMillis(400));
        assertThat(orchestratorProperties.toOptions().cacheTtl()).isEqualTo(Duration.ofMillis(300_000));
        assertThat(triggerProperties.getMinIntervalMs()).isEqualTo(100);
        assertThat(clientProperties.getSearchPath()).isEqualTo("/v2/memories/search/");
        assertThat(clientProperties.getTopK()).isEqualTo(10);
    }
}
