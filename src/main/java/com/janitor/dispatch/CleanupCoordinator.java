package com.janitor.dispatch;

import com.janitor.catalog.ResourceTypeCatalog;
import com.janitor.client.ClusterClient;
import com.janitor.config.JanitorConfig;
import com.janitor.context.RunCache;
import com.janitor.exception.TransportException;
import com.janitor.lifecycle.LifecycleEngine;
import com.janitor.model.KubeResource;
import com.janitor.model.ResourceTypeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Runs one cleanup pass.
 * <p>
 * Each pass gets a fresh {@link RunCache}, {@link Counters} and {@link DedupSet}. Namespaces
 * are dispatched first, then the objects of every discovered type in every included
 * namespace. A type that cannot be listed is logged and skipped; failing to discover types
 * or to list namespaces aborts the pass.
 */
public class CleanupCoordinator {

    private static final Logger log = LoggerFactory.getLogger(CleanupCoordinator.class);

    private final ClusterClient client;
    private final ResourceTypeCatalog catalog;
    private final LifecycleEngine engine;
    private final ResourceFilter filter;
    private final JanitorConfig config;
    private final BooleanSupplier cancelled;

    public CleanupCoordinator(ClusterClient client,
                              ResourceTypeCatalog catalog,
                              LifecycleEngine engine,
                              JanitorConfig config,
                              BooleanSupplier cancelled) {
        this.client = client;
        this.catalog = catalog;
        this.engine = engine;
        this.filter = new ResourceFilter(config);
        this.config = config;
        this.cancelled = cancelled;
    }

    /**
     * Run one pass.
     *
     * @return Summary of the pass
     * @throws TransportException if types or namespaces cannot be listed
     * @throws InterruptedException if interrupted while dispatching
     */
    public RunSummary runOnce() throws InterruptedException {
        log.debug("Starting cleanup run");

        List<ResourceTypeDescriptor> types = catalog.discover();
        log.debug("Found {} resource types", types.size());
        List<KubeResource> namespaces = client.listNamespaces();

        Counters counters = new Counters();
        Dispatcher dispatcher = new Dispatcher(engine, config.parallelism(), config.queueCapacity(),
                new RunCache(), counters, new DedupSet(), cancelled);
        dispatcher.start();
        try {
            dispatchNamespaces(dispatcher, namespaces);
            for (ResourceTypeDescriptor type : types) {
                if (cancelled.getAsBoolean()) {
                    log.info("Cleanup run cancelled, not dispatching further resource types");
                    break;
                }
                dispatchType(dispatcher, type, namespaces);
            }
        } finally {
            dispatcher.awaitCompletion();
        }

        RunSummary summary = new RunSummary(counters.snapshot(), cancelled.getAsBoolean());
        if (!config.quiet()) {
            log.info(summary.format());
        }
        return summary;
    }

    private void dispatchNamespaces(Dispatcher dispatcher, List<KubeResource> namespaces) throws InterruptedException {
        if (!filter.includesType(ResourceTypeDescriptor.NAMESPACES.plural())) {
            log.debug("Namespaces not included in resources to process, skipping");
            return;
        }
        submitAll(dispatcher, namespaces);
    }

    private void dispatchType(Dispatcher dispatcher, ResourceTypeDescriptor type,
                              List<KubeResource> namespaces) throws InterruptedException {
        if (ResourceTypeDescriptor.NAMESPACES.key().equals(type.key())) {
            return;
        }
        if (!filter.includesType(type.plural())) {
            log.debug("Skipping excluded resource type: {}", type.plural());
            return;
        }

        if (type.namespaced()) {
            for (KubeResource namespace : namespaces) {
                String name = namespace.getName();
                if (!filter.includesNamespace(name)) {
                    continue;
                }
                List<KubeResource> resources;
                try {
                    resources = client.list(type, name);
                } catch (TransportException e) {
                    log.warn("Error listing {} in namespace {}: {}", type.plural(), name, e.getMessage());
                    continue;
                }
                submitAll(dispatcher, resources);
            }
        } else if (config.includeClusterResources()) {
            List<KubeResource> resources;
            try {
                resources = client.list(type, null);
            } catch (TransportException e) {
                log.warn("Error listing cluster-scoped {}: {}", type.plural(), e.getMessage());
                return;
            }
            submitAll(dispatcher, resources);
        }
    }

    private void submitAll(Dispatcher dispatcher, List<KubeResource> resources) throws InterruptedException {
        for (KubeResource resource : resources) {
            if (!filter.matches(resource)) {
                log.debug("{} does not match filters, skipping", resource);
                continue;
            }
            if (!dispatcher.submit(resource)) {
                return;
            }
        }
    }
}
