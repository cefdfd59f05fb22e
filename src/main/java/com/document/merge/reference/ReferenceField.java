package com.document.merge.reference;

/**
 * A location holding an absolute path that points at another element:
 * the text of a {@code *-REF} leaf or the value of a path-valued attribute.
 */
public interface ReferenceField {

    String getPath();

    void setPath(String path);

    /**
     * Short description used in logs and failure reports.
     */
    String describe();
}
