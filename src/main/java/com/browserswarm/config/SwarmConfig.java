package com.browserswarm.config;

import static com.browserswarm.orchestration.SwarmConstants.EVENT_POOL_STATUS;

import com.browserswarm.orchestration.SwarmCoordinator;
import com.browserswarm.orchestration.api.PlanningOracle;
import com.browserswarm.orchestration.api.SynthesisOracle;
import com.browserswarm.orchestration.service.SwarmPromptService;
import com.browserswarm.pool.RegexFieldExtractor;
import com.browserswarm.pool.RestClientWorkerTransport;
import com.browserswarm.pool.StructuredFieldExtractor;
import com.browserswarm.pool.WorkerPool;
import com.browserswarm.pool.WorkerTransport;
import com.browserswarm.stream.StatusPublisher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.util.concurrent.ExecutorService;

/**
 * Coordinator role: worker pool, swarm coordinator and their collaborators.
 */
@Configuration
@ConditionalOnProperty(name = "swarm.worker.enabled", havingValue = "false", matchIfMissing = true)
public class SwarmConfig {

    @Bean
    public StructuredFieldExtractor structuredFieldExtractor() {
        return new RegexFieldExtractor();
    }

    @Bean
    public WorkerTransport workerTransport(RestClient.Builder restClientBuilder, SwarmProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getPool().getHealthTimeout());
        requestFactory.setReadTimeout(properties.getPool().getAssignmentTimeout());
        return new RestClientWorkerTransport(restClientBuilder.requestFactory(requestFactory).build());
    }

    @Bean(destroyMethod = "shutdown")
    public WorkerPool workerPool(SwarmProperties properties,
                                 WorkerTransport workerTransport,
                                 StructuredFieldExtractor structuredFieldExtractor,
                                 StatusPublisher statusPublisher) {
        WorkerPool pool = new WorkerPool(properties.getPool(), workerTransport, structuredFieldExtractor,
                status -> statusPublisher.publish(EVENT_POOL_STATUS, status));
        pool.initialize(properties.getPool().getSize());
        return pool;
    }

    @Bean
    public SwarmCoordinator swarmCoordinator(WorkerPool workerPool,
                                             PlanningOracle planningOracle,
                                             SynthesisOracle synthesisOracle,
                                             SwarmPromptService promptService,
                                             @Qualifier("orchestrationExecutor") ExecutorService orchestrationExecutor,
                                             StatusPublisher statusPublisher,
                                             SwarmProperties properties) {
        return new SwarmCoordinator(workerPool, planningOracle, synthesisOracle, promptService,
                orchestrationExecutor, statusPublisher::publish, properties.effectiveMaxAgents());
    }
}
