package io.surfworks.quantaforge.core.backend;

/**
 * Static description of a backend for introspection.
 *
 * @param name        registry name
 * @param description one-line summary
 * @param costScaling memory/time scaling, e.g. "O(2^n) memory"
 */
public record BackendInfo(String name, String description, String costScaling) {
}
