package com.ai.codescope.dto;

import com.ai.codescope.model.ContextSlot;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Wire shape of a context slot. Exactly one of {@code content}/{@code stub} is set,
 * except for unknown paths where both are null.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ContextEntry(
        String path,
        String content,
        String stub,
        long tokens,
        boolean truncated) {

    public static ContextEntry from(ContextSlot slot) {
        if (slot instanceof ContextSlot.Full full) {
            return new ContextEntry(full.path(), full.content(), null, full.size(), false);
        }
        if (slot instanceof ContextSlot.Stub stub) {
            return new ContextEntry(stub.path(), null, stub.stub(), stub.size(), true);
        }
        return new ContextEntry(slot.path(), null, null, 0, true);
    }
}
