package com.document.merge.packages;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Run-scoped list of root packages that a source document was expected to
 * contain but did not.
 */
public class MissingPackages {

    public record MissingPackage(String sourceDocument, String packageName) {
        public String describe() {
            return "Package " + packageName + " is missing in " + sourceDocument;
        }
    }

    private final List<MissingPackage> missing = new CopyOnWriteArrayList<>();

    public void recordMissing(String sourceDocument, String packageName) {
        missing.add(new MissingPackage(sourceDocument, packageName));
    }

    public boolean any() {
        return !missing.isEmpty();
    }

    public List<MissingPackage> list() {
        return Collections.unmodifiableList(new ArrayList<>(missing));
    }

    public int size() {
        return missing.size();
    }

    public void reset() {
        missing.clear();
    }
}
