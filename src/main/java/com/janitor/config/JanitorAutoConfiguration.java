package com.janitor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.janitor.CleanupLoop;
import com.janitor.catalog.DeprecationTable;
import com.janitor.catalog.ResourceTypeCatalog;
import com.janitor.client.ClusterClient;
import com.janitor.client.Fabric8ClusterClient;
import com.janitor.client.NotificationSink;
import com.janitor.client.WebhookNotificationSink;
import com.janitor.context.ContextProvider;
import com.janitor.context.DefaultContextProvider;
import com.janitor.context.HookRegistry;
import com.janitor.context.PersistentVolumeClaimAnalyzer;
import com.janitor.dispatch.CleanupCoordinator;
import com.janitor.lifecycle.LifecycleEngine;
import com.janitor.rule.Rule;
import com.janitor.rule.RuleLoader;
import com.janitor.shutdown.ShutdownGate;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Spring Boot auto-configuration for the janitor.
 */
@Configuration
@ConditionalOnProperty(prefix = "janitor", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(JanitorProperties.class)
public class JanitorAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(JanitorAutoConfiguration.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofMinutes(5);

    private ShutdownGate shutdownGate;

    @Bean
    @ConditionalOnMissingBean
    public JanitorConfig janitorConfig(JanitorProperties properties) {
        JanitorConfig config = properties.toConfig();
        log.info("Janitor configuration: {}", config);
        return config;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public KubernetesClient kubernetesClient() {
        // in-cluster service account, else KUBECONFIG / ~/.kube/config
        return new KubernetesClientBuilder().build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ClusterClient clusterClient(KubernetesClient kubernetesClient, ObjectMapper objectMapper) {
        return new Fabric8ClusterClient(kubernetesClient, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean(name = "janitorRestTemplate")
    public RestTemplate janitorRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationSink notificationSink(JanitorConfig config, RestTemplate janitorRestTemplate) {
        if (config.webhookUrl() == null) {
            return NotificationSink.noop();
        }
        log.info("Sending deletion notices to webhook {}", config.webhookUrl());
        return new WebhookNotificationSink(janitorRestTemplate, config.webhookUrl());
    }

    @Bean
    @ConditionalOnMissingBean
    public HookRegistry hookRegistry() {
        return HookRegistry.builtin();
    }

    @Bean
    @ConditionalOnMissingBean
    public ContextProvider contextProvider(ClusterClient clusterClient, HookRegistry hookRegistry,
                                           JanitorConfig config) {
        return new DefaultContextProvider(
                new PersistentVolumeClaimAnalyzer(clusterClient),
                hookRegistry.resolve(config.resourceContextHook()));
    }

    @Bean
    @ConditionalOnMissingBean
    public LifecycleEngine lifecycleEngine(ClusterClient clusterClient,
                                           NotificationSink notificationSink,
                                           ContextProvider contextProvider,
                                           JanitorConfig config) {
        List<Rule> rules = config.rulesFile() != null ? RuleLoader.load(config.rulesFile()) : List.of();
        return new LifecycleEngine(clusterClient, notificationSink, contextProvider, rules, config,
                Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceTypeCatalog resourceTypeCatalog(ClusterClient clusterClient) {
        return new ResourceTypeCatalog(clusterClient, DeprecationTable.defaults());
    }

    @Bean
    @ConditionalOnMissingBean
    public ShutdownGate shutdownGate() {
        this.shutdownGate = new ShutdownGate();
        return this.shutdownGate;
    }

    @Bean
    @ConditionalOnMissingBean
    public CleanupCoordinator cleanupCoordinator(ClusterClient clusterClient,
                                                 ResourceTypeCatalog catalog,
                                                 LifecycleEngine engine,
                                                 JanitorConfig config,
                                                 ShutdownGate gate) {
        return new CleanupCoordinator(clusterClient, catalog, engine, config, gate::isShutdownRequested);
    }

    @Bean
    @ConditionalOnMissingBean
    public CleanupLoop cleanupLoop(CleanupCoordinator coordinator, ShutdownGate gate, JanitorConfig config) {
        return new CleanupLoop(coordinator, gate, config);
    }

    /**
     * Runs before any bean is destroyed, so a running pass still has its cluster client.
     */
    @EventListener(ContextClosedEvent.class)
    public void shutdown() throws InterruptedException {
        if (shutdownGate == null) {
            return;
        }
        shutdownGate.requestShutdown();
        if (!shutdownGate.awaitSafeToExit(SHUTDOWN_TIMEOUT)) {
            log.warn("Cleanup still running after {}s, exiting anyway", SHUTDOWN_TIMEOUT.getSeconds());
        }
    }
}
