package com.document.merge.identity;

import java.util.UUID;

/**
 * Random (version 4) UUIDs.
 */
public class UuidIdentityGenerator implements IdentityGenerator {

    @Override
    public String next() {
        return UUID.randomUUID().toString();
    }
}
