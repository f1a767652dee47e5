package com.raditha.armmerge.refactoring;

/**
 * Identifies a refactoring to the host that dispatches it.
 *
 * @param id   stable identifier, e.g. {@code merge_match_arms}
 * @param name display name of the operation
 */
public record AssistId(String id, String name) {
}
