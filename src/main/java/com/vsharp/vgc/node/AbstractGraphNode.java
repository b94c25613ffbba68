package com.vsharp.vgc.node;

import com.vsharp.vgc.api.GraphNode;
import com.vsharp.vgc.api.SlotNotFoundException;
import com.vsharp.vgc.api.Slot;
import com.vsharp.vgc.api.SourceRef;
import com.vsharp.vgc.api.ValueType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Shared state of every node kind: id, ordered slots and input bindings.
 *
 * Subclasses declare their ports in the constructor through
 * {@link #addInput(Slot)} and {@link #addOutput(Slot)}.
 */
public abstract class AbstractGraphNode implements GraphNode {
    private final String id = UUID.randomUUID().toString();
    private final List<Slot> inputs = new ArrayList<>();
    private final List<Slot> outputs = new ArrayList<>();
    private final Map<String, SourceRef> connectedInputs = new LinkedHashMap<>();

    @Override
    public final String id() {
        return id;
    }

    @Override
    public List<Slot> inputs() {
        return Collections.unmodifiableList(inputs);
    }

    @Override
    public List<Slot> outputs() {
        return Collections.unmodifiableList(outputs);
    }

    @Override
    public Optional<Slot> input(String name) {
        return find(inputs, name);
    }

    @Override
    public Optional<Slot> output(String name) {
        return find(outputs, name);
    }

    @Override
    public Map<String, SourceRef> connectedInputs() {
        return Collections.unmodifiableMap(connectedInputs);
    }

    @Override
    public void bindInput(String inputName, SourceRef source) {
        if (input(inputName).isEmpty())
            throw new SlotNotFoundException(this, inputName, true);
        connectedInputs.put(inputName, source);
    }

    @Override
    public void resolveGenericGroup(String group, ValueType type) {
        replaceGroup(inputs, group, type);
        replaceGroup(outputs, group, type);
    }

    protected final void addInput(Slot slot) {
        if (input(slot.name()).isPresent())
            throw new IllegalArgumentException("Duplicate input slot '" + slot.name() + "' on " + label());
        inputs.add(slot);
    }

    protected final void addOutput(Slot slot) {
        if (output(slot.name()).isPresent())
            throw new IllegalArgumentException("Duplicate output slot '" + slot.name() + "' on " + label());
        outputs.add(slot);
    }

    /**
     * Returns the binding of a required input.
     *
     * @throws IllegalStateException if nothing is connected to it.
     */
    protected final SourceRef requireBinding(String inputName) {
        SourceRef ref = connectedInputs.get(inputName);
        if (ref == null)
            throw new IllegalStateException("Input '" + inputName + "' of " + label() + " is not connected");
        return ref;
    }

    private static Optional<Slot> find(List<Slot> slots, String name) {
        for (Slot s : slots) {
            if (s.name().equals(name))
                return Optional.of(s);
        }
        return Optional.empty();
    }

    private static void replaceGroup(List<Slot> slots, String group, ValueType type) {
        for (int i = 0; i < slots.size(); i++) {
            Slot s = slots.get(i);
            if (group.equals(s.genericGroup()))
                slots.set(i, s.withType(type));
        }
    }
}
