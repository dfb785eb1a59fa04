package com.janitor.client;

/**
 * An API group as advertised by discovery, reduced to its preferred version.
 *
 * @param name                  Group name, e.g. "apps"
 * @param preferredGroupVersion e.g. "apps/v1"
 * @param preferredVersion      e.g. "v1"
 */
public record ApiGroupInfo(String name, String preferredGroupVersion, String preferredVersion) {
}
