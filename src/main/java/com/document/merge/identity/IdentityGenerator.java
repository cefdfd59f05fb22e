package com.document.merge.identity;

/**
 * Source of fresh identity values.
 */
@FunctionalInterface
public interface IdentityGenerator {

    String next();
}
