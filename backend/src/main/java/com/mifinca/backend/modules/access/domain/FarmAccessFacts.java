package com.mifinca.backend.modules.access.domain;

public record FarmAccessFacts(boolean owner, boolean sharedAccess) {

    public static final FarmAccessFacts NONE = new FarmAccessFacts(false, false);

    public boolean any() {
        return owner || sharedAccess;
    }
}
