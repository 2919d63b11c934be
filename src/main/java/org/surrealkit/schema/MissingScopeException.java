package org.surrealkit.schema;

public final class MissingScopeException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final EntityKey entity;

    public MissingScopeException(final EntityKey entity) {
        super("cannot render REMOVE for " + entity.kind() + " '" + entity.name() + "' without a scope");
        this.entity = entity;
    }

    public EntityKey entity() {
        return entity;
    }
}
