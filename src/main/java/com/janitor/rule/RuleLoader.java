package com.janitor.rule;

import com.janitor.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads rules from YAML files.
 * <pre>
 * rules:
 *   - id: require-application-label
 *     resources: [deployments, statefulsets]
 *     predicate: "!(spec.template.metadata.labels.application)"
 *     ttl: 4d
 * </pre>
 * {@code jmespath} is accepted in place of {@code predicate}. A single invalid rule fails the
 * whole load.
 */
public final class RuleLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleLoader.class);

    private static final String CLASSPATH_PREFIX = "classpath:";

    private RuleLoader() {
    }

    /**
     * Load rules from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the rules file
     * @return Validated rules in document order
     */
    public static List<Rule> load(String path) {
        log.info("Loading rules from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Rules file not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            List<Rule> rules = parse(inputStream);
            log.info("Loaded {} rules from {}", rules.size(), path);
            return rules;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load rules from: " + path, e);
        }
    }

    /**
     * Parse and validate a rules document.
     */
    public static List<Rule> parse(InputStream inputStream) {
        Object root;
        try {
            root = new Yaml().load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Rules file is not valid YAML: " + e.getMessage(), e);
        }

        if (root == null) {
            throw new ConfigurationException("Rules file is empty");
        }
        if (!(root instanceof Map<?, ?> rootMap) || !rootMap.containsKey("rules")) {
            throw new ConfigurationException("Rules file must contain a top-level 'rules' key");
        }

        Object entries = rootMap.get("rules");
        if (entries == null) {
            return List.of();
        }
        if (!(entries instanceof List<?> list)) {
            throw new ConfigurationException("'rules' must be a list");
        }

        List<Rule> rules = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            RuleDefinition definition = toDefinition(i, list.get(i));
            try {
                rules.add(Rule.compile(definition));
            } catch (ConfigurationException e) {
                throw new ConfigurationException("Invalid rule #" + i + " (" + definition.id() + "): "
                        + e.getMessage(), e);
            }
            log.debug("Parsed rule: id={}, resources={}, ttl={}",
                    definition.id(), definition.resources(), definition.ttl());
        }
        return rules;
    }

    private static RuleDefinition toDefinition(int index, Object entry) {
        if (!(entry instanceof Map<?, ?> map)) {
            throw new ConfigurationException("Invalid rule #" + index + ": expected a mapping");
        }

        String id = getString(map, "id");
        String predicate = getString(map, "predicate");
        if (predicate == null) {
            predicate = getString(map, "jmespath");
        }
        String ttl = getString(map, "ttl");
        List<String> resources = getStringList(index, map, "resources");
        return new RuleDefinition(id, resources, predicate, ttl);
    }

    private static Resource getResource(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(path.substring(CLASSPATH_PREFIX.length()));
        }
        return new FileSystemResource(path);
    }

    // Helper methods

    private static String getString(Map<?, ?> map, String key) {
        Object value = map.get(key);
        return value != null ? value.toString() : null;
    }

    private static List<String> getStringList(int index, Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("Invalid rule #" + index + ": '" + key + "' must be a list");
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            result.add(String.valueOf(item));
        }
        return result;
    }
}
