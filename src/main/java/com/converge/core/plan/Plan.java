package com.converge.core.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered instructions plus progress messages attached to some of them.
 * <p>
 * Messages are keyed by instruction identity, so two equal instructions at
 * different positions can carry different messages. Plans compare equal when
 * their instructions are equal and messages sit at the same positions.
 */
public final class Plan {

    private static final Plan EMPTY = new Plan(List.of(), new IdentityHashMap<>());

    private final List<Instruction> instructions;
    private final Map<Instruction, String> messages;

    private Plan(List<Instruction> instructions, Map<Instruction, String> messages) {
        this.instructions = List.copyOf(instructions);
        this.messages = messages;
    }

    public static Plan empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Instruction> instructions() {
        return instructions;
    }

    public Optional<String> messageFor(Instruction instruction) {
        return Optional.ofNullable(messages.get(instruction));
    }

    public int size() {
        return instructions.size();
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    /** A builder seeded with this plan's instructions and messages. */
    public Builder toBuilder() {
        Builder builder = new Builder();
        for (Instruction instruction : instructions) {
            builder.add(instruction, messages.get(instruction));
        }
        return builder;
    }

    /** Instructions of the given variant, in plan order. */
    public <T extends Instruction> List<T> instructionsOf(Class<T> type) {
        return instructions.stream().filter(type::isInstance).map(type::cast).toList();
    }

    private List<String> messagesByPosition() {
        List<String> positional = new ArrayList<>(instructions.size());
        for (Instruction instruction : instructions) {
            positional.add(messages.get(instruction));
        }
        return positional;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Plan other)) return false;
        return instructions.equals(other.instructions) && messagesByPosition().equals(other.messagesByPosition());
    }

    @Override
    public int hashCode() {
        return Objects.hash(instructions, messagesByPosition());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Plan[");
        for (Instruction instruction : instructions) {
            sb.append("\n  ").append(instruction);
            String message = messages.get(instruction);
            if (message != null) {
                sb.append("  # ").append(message);
            }
        }
        return sb.append(instructions.isEmpty() ? "]" : "\n]").toString();
    }

    public static final class Builder {

        private final List<Instruction> instructions = new ArrayList<>();
        private final Map<Instruction, String> messages = new IdentityHashMap<>();

        private Builder() {
        }

        public Builder add(Instruction instruction) {
            instructions.add(Objects.requireNonNull(instruction, "instruction"));
            return this;
        }

        /** Adds an instruction; a {@code null} message attaches nothing. */
        public Builder add(Instruction instruction, String message) {
            add(instruction);
            if (message != null) {
                messages.put(instruction, message);
            }
            return this;
        }

        public Builder addAll(List<? extends Instruction> toAdd) {
            toAdd.forEach(this::add);
            return this;
        }

        /** Appends another plan, keeping its messages. */
        public Builder addAll(Plan plan) {
            for (Instruction instruction : plan.instructions) {
                add(instruction, plan.messages.get(instruction));
            }
            return this;
        }

        public Plan build() {
            return new Plan(instructions, Collections.unmodifiableMap(new IdentityHashMap<>(messages)));
        }
    }
}
