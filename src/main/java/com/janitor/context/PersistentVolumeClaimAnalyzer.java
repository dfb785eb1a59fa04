package com.janitor.context;

import com.janitor.client.ClusterClient;
import com.janitor.exception.TransportException;
import com.janitor.model.KubeResource;
import com.janitor.model.ResourceTypeDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Works out whether a PersistentVolumeClaim is still in use.
 * <ul>
 *   <li>{@code pvc_is_not_mounted}: no pod in the claim's namespace has a volume for it</li>
 *   <li>{@code pvc_is_not_referenced}: no StatefulSet volume claim template generates its name
 *       ({@code <template>-<statefulset>-<ordinal>}) and no Deployment, Job or CronJob pod
 *       template has a volume for it</li>
 * </ul>
 * Each check is one full listing of the namespace. Failing to list pods or StatefulSets fails
 * the analysis; Deployment, Job and CronJob listing errors are logged and skipped.
 */
public class PersistentVolumeClaimAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(PersistentVolumeClaimAnalyzer.class);

    public static final String KIND = "PersistentVolumeClaim";
    public static final String NOT_MOUNTED = "pvc_is_not_mounted";
    public static final String NOT_REFERENCED = "pvc_is_not_referenced";

    private static final List<String> POD_SPEC_PATH = List.of("spec");
    private static final List<String> TEMPLATE_POD_SPEC_PATH = List.of("spec", "template", "spec");
    private static final List<String> CRON_JOB_POD_SPEC_PATH =
            List.of("spec", "jobTemplate", "spec", "template", "spec");

    private final ClusterClient client;

    public PersistentVolumeClaimAnalyzer(ClusterClient client) {
        this.client = client;
    }

    public boolean supports(KubeResource resource) {
        return KIND.equalsIgnoreCase(resource.getKind());
    }

    /**
     * @throws TransportException if pods or StatefulSets cannot be listed
     */
    public Map<String, Object> analyze(KubeResource claim) {
        String namespace = claim.getNamespace();
        String claimName = claim.getName();

        boolean mounted = isMounted(namespace, claimName);
        boolean referenced = isReferencedByStatefulSet(namespace, claimName)
                || isReferencedBy(ResourceTypeDescriptor.DEPLOYMENTS, TEMPLATE_POD_SPEC_PATH, namespace, claimName)
                || isReferencedBy(ResourceTypeDescriptor.JOBS, TEMPLATE_POD_SPEC_PATH, namespace, claimName)
                || isReferencedBy(ResourceTypeDescriptor.CRON_JOBS, CRON_JOB_POD_SPEC_PATH, namespace, claimName);

        Map<String, Object> facts = new LinkedHashMap<>();
        facts.put(NOT_MOUNTED, !mounted);
        facts.put(NOT_REFERENCED, !referenced);
        return facts;
    }

    private boolean isMounted(String namespace, String claimName) {
        for (KubeResource pod : client.list(ResourceTypeDescriptor.PODS, namespace)) {
            if (mountsClaim(pod, POD_SPEC_PATH, claimName)) {
                log.debug("PVC {}/{} is mounted by pod {}", namespace, claimName, pod.getName());
                return true;
            }
        }
        return false;
    }

    private boolean isReferencedByStatefulSet(String namespace, String claimName) {
        for (KubeResource statefulSet : client.list(ResourceTypeDescriptor.STATEFUL_SETS, namespace)) {
            Object templates = path(statefulSet.getDocument(), List.of("spec", "volumeClaimTemplates"));
            if (!(templates instanceof List<?> list)) {
                continue;
            }
            for (Object template : list) {
                Object templateName = path(template, List.of("metadata", "name"));
                if (templateName == null) {
                    continue;
                }
                Pattern generated = Pattern.compile("^" + Pattern.quote(templateName.toString()) + "-"
                        + Pattern.quote(statefulSet.getName()) + "-[0-9]+$");
                if (generated.matcher(claimName).matches()) {
                    log.debug("PVC {}/{} is referenced by StatefulSet {}", namespace, claimName, statefulSet.getName());
                    return true;
                }
            }
        }
        return false;
    }

    private boolean isReferencedBy(ResourceTypeDescriptor type, List<String> podSpecPath,
                                   String namespace, String claimName) {
        List<KubeResource> workloads;
        try {
            workloads = client.list(type, namespace);
        } catch (TransportException e) {
            log.warn("Error checking {} in namespace {}: {}", type.plural(), namespace, e.getMessage());
            return false;
        }

        for (KubeResource workload : workloads) {
            if (mountsClaim(workload, podSpecPath, claimName)) {
                log.debug("PVC {}/{} is referenced by {} {}", namespace, claimName, workload.getKind(), workload.getName());
                return true;
            }
        }
        return false;
    }

    private static boolean mountsClaim(KubeResource workload, List<String> podSpecPath, String claimName) {
        Object volumes = path(path(workload.getDocument(), podSpecPath), List.of("volumes"));
        if (!(volumes instanceof List<?> list)) {
            return false;
        }
        for (Object volume : list) {
            Object name = path(volume, List.of("persistentVolumeClaim", "claimName"));
            if (claimName.equals(name)) {
                return true;
            }
        }
        return false;
    }

    private static Object path(Object node, List<String> keys) {
        Object current = node;
        for (String key : keys) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(key);
        }
        return current;
    }
}
