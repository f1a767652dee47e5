package com.raditha.armmerge.refactoring;

import com.raditha.armmerge.model.SourceEdit;

/**
 * An applicable refactoring at a cursor.
 *
 * @param id    which operation produced it
 * @param label human readable label for menus
 * @param edit  what to change
 */
public record Assist(AssistId id, String label, SourceEdit edit) {
}
