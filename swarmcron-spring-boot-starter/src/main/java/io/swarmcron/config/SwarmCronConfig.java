package io.swarmcron.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.swarmcron.Croner;
import io.swarmcron.ExecutionAggregator;
import io.swarmcron.ObjectClient;
import io.swarmcron.TriggerEngine;
import io.swarmcron.internal.DelayQueueTriggerEngine;
import io.swarmcron.internal.RunCommandBuilder;
import io.swarmcron.internal.swarm.DockerCliObjectClient;
import io.swarmcron.internal.swarm.LabelExecutionAggregator;
import io.swarmcron.internal.swarm.LabelJobRegistry;
import io.swarmcron.internal.swarm.SwarmCroner;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Duration;

/**
 * Spring Boot auto-configuration entrypoint for the Swarm scheduler.
 */
@AutoConfiguration
@ConditionalOnClass({Croner.class, ObjectMapper.class})
@EnableConfigurationProperties(SwarmCronProperties.class)
@ConditionalOnProperty(prefix = "swarmcron", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SwarmCronConfig {

    @Bean
    @ConditionalOnMissingBean
    public ObjectClient swarmCronObjectClient(SwarmCronProperties props, ObjectProvider<ObjectMapper> objectMapper) {
        return new DockerCliObjectClient(props, objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public RunCommandBuilder runCommandBuilder() {
        return new RunCommandBuilder();
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public TriggerEngine triggerEngine(SwarmCronProperties props) {
        return new DelayQueueTriggerEngine(props.getMaxConcurrency(), shutdownTimeout(props));
    }

    @Bean
    @ConditionalOnMissingBean
    public LabelJobRegistry labelJobRegistry(ObjectClient objectClient, RunCommandBuilder commandBuilder) {
        return new LabelJobRegistry(objectClient, commandBuilder);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionAggregator executionAggregator(ObjectClient objectClient) {
        return new LabelExecutionAggregator(objectClient);
    }

    @Bean
    @ConditionalOnMissingBean
    public Croner croner(SwarmCronProperties props,
                         ObjectClient objectClient,
                         RunCommandBuilder commandBuilder,
                         LabelJobRegistry jobRegistry,
                         ExecutionAggregator executionAggregator,
                         TriggerEngine triggerEngine) {
        return new SwarmCroner(props, objectClient, commandBuilder, jobRegistry, executionAggregator, triggerEngine);
    }

    @Bean
    @ConditionalOnMissingBean
    public SwarmCronLifecycle swarmCronLifecycle(Croner croner, SwarmCronProperties props) {
        return new SwarmCronLifecycle(croner, props.isRescheduleOnStartup());
    }

    // in-flight firings get one docker call worth of time to finish
    private static Duration shutdownTimeout(SwarmCronProperties props) {
        Duration timeout = props.getCommandTimeout();
        return timeout == null ? Duration.ofSeconds(30) : timeout;
    }
}
