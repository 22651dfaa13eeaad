package org.dxworks.vbframe.ir;

import java.util.List;
import java.util.Objects;

/**
 * Enrichment annotations of one node. All fields are optional; which ones are set depends on the node
 * kind. Values are immutable so that re-running enrichment can be compared with {@link #equals(Object)}.
 */
public final class SemanticInfo {

    private final TypeRef type;
    private final String parentControlId;
    private final List<String> childControlIds;
    private final BindingStatus bindingStatus;
    private final String bindingTargetId;
    private final String resourceRef;

    private SemanticInfo(Builder builder) {
        this.type = builder.type;
        this.parentControlId = builder.parentControlId;
        this.childControlIds = builder.childControlIds == null ? null : List.copyOf(builder.childControlIds);
        this.bindingStatus = builder.bindingStatus;
        this.bindingTargetId = builder.bindingTargetId;
        this.resourceRef = builder.resourceRef;
    }

    public static Builder builder() {
        return new Builder();
    }

    public TypeRef getType() {
        return type;
    }

    public String getParentControlId() {
        return parentControlId;
    }

    /**
     * Ids of directly nested controls, or null when the node is not a control.
     */
    public List<String> getChildControlIds() {
        return childControlIds;
    }

    public BindingStatus getBindingStatus() {
        return bindingStatus;
    }

    /**
     * Id of the control, variable or module an event binding resolved to.
     */
    public String getBindingTargetId() {
        return bindingTargetId;
    }

    public String getResourceRef() {
        return resourceRef;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SemanticInfo)) return false;
        SemanticInfo that = (SemanticInfo) o;
        return Objects.equals(type, that.type)
                && Objects.equals(parentControlId, that.parentControlId)
                && Objects.equals(childControlIds, that.childControlIds)
                && bindingStatus == that.bindingStatus
                && Objects.equals(bindingTargetId, that.bindingTargetId)
                && Objects.equals(resourceRef, that.resourceRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, parentControlId, childControlIds, bindingStatus, bindingTargetId, resourceRef);
    }

    public static final class Builder {
        private TypeRef type;
        private String parentControlId;
        private List<String> childControlIds;
        private BindingStatus bindingStatus;
        private String bindingTargetId;
        private String resourceRef;

        private Builder() {
        }

        public Builder type(TypeRef type) {
            this.type = type;
            return this;
        }

        public Builder parentControlId(String parentControlId) {
            this.parentControlId = parentControlId;
            return this;
        }

        public Builder childControlIds(List<String> childControlIds) {
            this.childControlIds = childControlIds;
            return this;
        }

        public Builder binding(BindingStatus status, String targetId) {
            this.bindingStatus = status;
            this.bindingTargetId = targetId;
            return this;
        }

        public Builder resourceRef(String resourceRef) {
            this.resourceRef = resourceRef;
            return this;
        }

        public SemanticInfo build() {
            return new SemanticInfo(this);
        }
    }
}
