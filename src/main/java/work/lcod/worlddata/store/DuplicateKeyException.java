package work.lcod.worlddata.store;

import work.lcod.worlddata.load.DefinitionLoadException;

public final class DuplicateKeyException extends DefinitionLoadException {
    private final DefinitionKind kind;
    private final transient Object key;

    public DuplicateKeyException(DefinitionKind kind, Object key) {
        super("Duplicate " + kind.label() + " encountered: " + key);
        this.kind = kind;
        this.key = key;
    }

    public DefinitionKind kind() {
        return kind;
    }

    public Object key() {
        return key;
    }
}
