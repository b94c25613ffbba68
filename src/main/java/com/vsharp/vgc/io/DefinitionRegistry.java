package com.vsharp.vgc.io;

import com.vsharp.vgc.node.DefinitionNode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * Name-keyed store of definition nodes for one compilation session.
 *
 * Registering a name that is already present replaces the earlier definition;
 * there is no versioning. Iteration order is stable for the registry's
 * lifetime. Not thread-safe.
 */
@Log4j2
public final class DefinitionRegistry {
    private final Map<String, DefinitionNode> definitions = new LinkedHashMap<>();

    public void register(DefinitionNode def) {
        DefinitionNode previous = definitions.put(def.name(), def);
        if (previous != null && previous != def)
            log.warn("Definition '{}' replaced ({} -> {})", def.name(), previous.label(), def.label());
    }

    /**
     * Typed lookup.
     *
     * @return The definition, or empty if absent or of another kind.
     */
    public <T extends DefinitionNode> Optional<T> get(String name, Class<T> type) {
        DefinitionNode node = definitions.get(name);
        return type.isInstance(node) ? Optional.of(type.cast(node)) : Optional.empty();
    }

    public boolean contains(String name) {
        return definitions.containsKey(name);
    }

    public Collection<DefinitionNode> all() {
        return Collections.unmodifiableCollection(definitions.values());
    }

    public int size() {
        return definitions.size();
    }
}
