package com.janitor.rule;

import java.util.List;

/**
 * A rule as written in the rules document, before validation.
 *
 * @param id        Rule id (lowercase-kebab)
 * @param resources Resource type plural names, or "*"
 * @param predicate Predicate expression
 * @param ttl       TTL string
 */
public record RuleDefinition(String id, List<String> resources, String predicate, String ttl) {
}
