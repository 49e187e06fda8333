package io.contextrunr.core;

import java.util.List;

/**
 * The bounded, ordered context handed to the response generator.
 *
 * <p>Holds at most {@code maxRelevantMessages} conversation entries plus at most
 * {@link #MAX_INJECTED_ENTRIES} injected system entries: two chat header lines, one
 * cross-chat excerpt block, one private cross-context block, one image context and
 * one fact summary. No two entries share a message id.</p>
 *
 * @param entries       ordered entries
 * @param degradedSteps names of assembly steps whose collaborator failed and were skipped
 */
public record ContextWindow(List<ContextEntry> entries, List<String> degradedSteps) {

    public static final int MAX_INJECTED_ENTRIES = 6;

    public ContextWindow {
        entries = entries == null ? List.of() : List.copyOf(entries);
        degradedSteps = degradedSteps == null ? List.of() : List.copyOf(degradedSteps);
    }

    public static ContextWindow empty() {
        return new ContextWindow(List.of(), List.of());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Entries backed by a conversation message. */
    public List<ContextEntry> conversationEntries() {
        return entries.stream().filter(e -> !e.isInjected()).toList();
    }

    /** Injected system entries. */
    public List<ContextEntry> injectedEntries() {
        return entries.stream().filter(ContextEntry::isInjected).toList();
    }

    public List<ContextEntry> entriesFrom(String sourceLabel) {
        return entries.stream().filter(e -> e.sourceLabel().equals(sourceLabel)).toList();
    }

    public boolean isDegraded() {
        return !degradedSteps.isEmpty();
    }
}
