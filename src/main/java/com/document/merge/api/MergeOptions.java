package com.document.merge.api;

import com.document.merge.core.model.NodeTags;
import com.document.merge.merge.MergeMode;

/**
 * Options for a merge session.
 * Configures the default clash mode, the identity attribute and how
 * unmapped references are treated.
 */
public class MergeOptions {

    private final MergeMode defaultMode;
    private final String identityAttribute;
    private final boolean strictReferences;

    private MergeOptions(Builder builder) {
        this.defaultMode = builder.defaultMode;
        this.identityAttribute = builder.identityAttribute;
        this.strictReferences = builder.strictReferences;
    }

    public MergeMode getDefaultMode() {
        return defaultMode;
    }

    public String getIdentityAttribute() {
        return identityAttribute;
    }

    public boolean isStrictReferences() {
        return strictReferences;
    }

    /**
     * Strict clashes, {@code UUID} identities, lenient reference remapping.
     */
    public static MergeOptions defaults() {
        return builder().build();
    }

    /**
     * Options that tolerate clashes by skipping the clashing elements.
     */
    public static MergeOptions graceful() {
        return builder().defaultMode(MergeMode.GRACEFUL).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MergeMode defaultMode = MergeMode.STRICT;
        private String identityAttribute = NodeTags.IDENTITY_ATTRIBUTE;
        private boolean strictReferences = false;

        public Builder defaultMode(MergeMode defaultMode) {
            if (defaultMode == null) {
                throw new IllegalArgumentException("defaultMode must not be null");
            }
            this.defaultMode = defaultMode;
            return this;
        }

        public Builder identityAttribute(String identityAttribute) {
            if (identityAttribute == null || identityAttribute.isBlank()) {
                throw new IllegalArgumentException("identityAttribute must not be blank");
            }
            this.identityAttribute = identityAttribute;
            return this;
        }

        /**
         * When set, relocating a reference missing from the path map fails.
         */
        public Builder strictReferences(boolean strictReferences) {
            this.strictReferences = strictReferences;
            return this;
        }

        public MergeOptions build() {
            return new MergeOptions(this);
        }
    }
}
