package com.mifinca.backend.modules.access.domain;

public record AnimalAccessFacts(boolean owner, boolean farmAccess) {

    public static final AnimalAccessFacts NONE = new AnimalAccessFacts(false, false);

    public boolean any() {
        return owner || farmAccess;
    }
}
