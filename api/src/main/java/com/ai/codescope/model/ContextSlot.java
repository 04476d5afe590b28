package com.ai.codescope.model;

/**
 * How one requested path is represented in an assembled context bundle.
 * {@link Full} carries the whole file, {@link Stub} a bounded structural summary,
 * {@link Missing} a path the snapshot does not contain.
 */
public sealed interface ContextSlot permits ContextSlot.Full, ContextSlot.Stub, ContextSlot.Missing {

    String path();

    /**
     * Size in the unit of the request that produced this slot.
     */
    long size();

    boolean truncated();

    record Full(String path, String content, long size) implements ContextSlot {
        @Override
        public boolean truncated() {
            return false;
        }
    }

    record Stub(String path, String stub, long size) implements ContextSlot {
        @Override
        public boolean truncated() {
            return true;
        }
    }

    record Missing(String path) implements ContextSlot {
        @Override
        public long size() {
            return 0;
        }

        @Override
        public boolean truncated() {
            return true;
        }
    }
}
