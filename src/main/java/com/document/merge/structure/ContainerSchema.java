package com.document.merge.structure;

import com.document.merge.core.model.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Ordered sibling layout a parent must respect. Each slot names a container
 * tag and, when the container may be synthesized, a factory for it.
 *
 * <pre>
 * ContainerSchema channel = ContainerSchema.builder()
 *     .required("COMM-CONNECTORS")
 *     .synthesized("I-SIGNAL-TRIGGERINGS")
 *     .synthesized("PDU-TRIGGERINGS")
 *     .required("NETWORK-ENDPOINTS")
 *     .synthesized("SO-AD-CONFIG")
 *     .build();
 * </pre>
 */
public record ContainerSchema(List<Slot> slots) {

    public ContainerSchema {
        Objects.requireNonNull(slots, "slots are required");
        slots = List.copyOf(slots);
    }

    /**
     * @param factory creates an empty container, or {@code null} when the container is required
     */
    public record Slot(String tag, Supplier<Node> factory) {
        public Slot {
            Objects.requireNonNull(tag, "tag is required");
        }

        public boolean isSynthesizable() {
            return factory != null;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<Slot> slots = new ArrayList<>();

        /**
         * A container that must already exist.
         */
        public Builder required(String tag) {
            slots.add(new Slot(tag, null));
            return this;
        }

        /**
         * A container created empty when missing.
         */
        public Builder synthesized(String tag) {
            slots.add(new Slot(tag, () -> Node.of(tag)));
            return this;
        }

        public Builder synthesized(String tag, Supplier<Node> factory) {
            slots.add(new Slot(tag, Objects.requireNonNull(factory, "factory is required")));
            return this;
        }

        public ContainerSchema build() {
            return new ContainerSchema(slots);
        }
    }
}
