package com.herzen.audit.validation;

import com.herzen.audit.rule.RuleModels.Block;

import java.util.*;

/**
 * Immutable arena of linked blocks. References resolve to integer slots, so the catalog
 * can be shared across concurrent audit runs without ownership cycles.
 */
public final class LinkedCatalog {
    private static final LinkedCatalog EMPTY = new LinkedCatalog(List.of());

    private final List<Block> blocks;
    private final Map<String, Integer> slots;

    LinkedCatalog(List<Block> blocks) {
        this.blocks = List.copyOf(blocks);
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < this.blocks.size(); i++) {
            index.put(this.blocks.get(i).id(), i);
        }
        this.slots = Collections.unmodifiableMap(index);
    }

    public static LinkedCatalog empty() {
        return EMPTY;
    }

    public OptionalInt slotOf(String blockId) {
        Integer slot = slots.get(blockId);
        return slot == null ? OptionalInt.empty() : OptionalInt.of(slot);
    }

    public Block block(int slot) {
        return blocks.get(slot);
    }

    public Optional<Block> find(String blockId) {
        OptionalInt slot = slotOf(blockId);
        return slot.isPresent() ? Optional.of(blocks.get(slot.getAsInt())) : Optional.empty();
    }

    public List<Block> blocks() {
        return blocks;
    }

    public boolean contains(String blockId) {
        return slots.containsKey(blockId);
    }
}
