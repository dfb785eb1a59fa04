package com.janitor.rule;

import com.janitor.exception.ConfigurationException;
import com.janitor.exception.InvalidFormatException;
import com.janitor.exception.PredicateException;
import com.janitor.model.KubeResource;
import com.janitor.predicate.CompiledPredicate;
import com.janitor.predicate.PredicateCompiler;
import com.janitor.predicate.PredicateSyntax;
import com.janitor.time.TimeRules;
import com.janitor.time.Ttl;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A validated rule: a compiled predicate and a parsed TTL applied to objects of the
 * listed resource types. Immutable and shared read-only by all workers.
 */
public final class Rule {

    public static final String ALL_RESOURCES = "*";

    private static final Pattern ID_PATTERN = Pattern.compile("^[a-z][a-z0-9-]*$");

    private final String id;
    private final List<String> resources;
    private final CompiledPredicate predicate;
    private final Ttl ttl;

    private Rule(String id, List<String> resources, CompiledPredicate predicate, Ttl ttl) {
        this.id = id;
        this.resources = resources;
        this.predicate = predicate;
        this.ttl = ttl;
    }

    /**
     * Validate a definition and compile it.
     *
     * @throws ConfigurationException naming the rule if the id, TTL or predicate is invalid
     */
    public static Rule compile(RuleDefinition definition) {
        String id = definition.id();
        if (id == null || !ID_PATTERN.matcher(id).matches()) {
            throw new ConfigurationException("Invalid rule ID '" + id + "': must match " + ID_PATTERN.pattern());
        }

        Ttl ttl;
        try {
            ttl = TimeRules.parseTtl(definition.ttl());
        } catch (InvalidFormatException e) {
            throw new ConfigurationException("Rule '" + id + "' has invalid TTL: " + e.getMessage(), e);
        }

        CompiledPredicate predicate;
        try {
            predicate = PredicateCompiler.compile(definition.predicate());
        } catch (PredicateException e) {
            throw new ConfigurationException("Rule '" + id + "' has invalid predicate: " + e.getMessage(), e);
        }

        List<String> resources = definition.resources() == null ? List.of() : List.copyOf(definition.resources());
        return new Rule(id, resources, predicate, ttl);
    }

    /**
     * Whether this rule applies to the resource.
     * <p>
     * The resource type must be listed (or "*" present), then the predicate is evaluated
     * against the object with the context injected under {@code _context}. Never throws.
     */
    public boolean matches(KubeResource resource, Map<String, Object> context) {
        if (!appliesTo(resource.getTypeName())) {
            return false;
        }

        Map<String, Object> document = new LinkedHashMap<>(resource.getDocument());
        document.put(PredicateSyntax.CONTEXT_KEY, context != null ? context : Map.of());
        return predicate.matches(document);
    }

    public boolean appliesTo(String typeName) {
        return resources.contains(ALL_RESOURCES) || resources.contains(typeName);
    }

    public String getId() {
        return id;
    }

    public List<String> getResources() {
        return resources;
    }

    public CompiledPredicate getPredicate() {
        return predicate;
    }

    public Ttl getTtl() {
        return ttl;
    }

    @Override
    public String toString() {
        return "Rule{id=" + id + ", resources=" + resources + ", ttl=" + ttl + "}";
    }
}
