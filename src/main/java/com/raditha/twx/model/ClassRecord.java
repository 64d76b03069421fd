package com.raditha.twx.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Aggregated occurrences of one class name across the run.
 * <p>
 * Mutated only by the registry that owns it.
 */
public class ClassRecord {

    private final String original;
    private String obfuscated;
    private int count;
    private final Set<String> files = new LinkedHashSet<>();
    private final List<String> locations = new ArrayList<>();

    public ClassRecord(String original) {
        this.original = original;
    }

    public void addOccurrence(ExtractedToken token) {
        count++;
        files.add(token.file());
        locations.add(token.location());
    }

    public String getOriginal() {
        return original;
    }

    public String getObfuscated() {
        return obfuscated;
    }

    public void setObfuscated(String obfuscated) {
        this.obfuscated = obfuscated;
    }

    public int getCount() {
        return count;
    }

    public Set<String> getFiles() {
        return Collections.unmodifiableSet(files);
    }

    public List<String> getLocations() {
        return Collections.unmodifiableList(locations);
    }

    @Override
    public String toString() {
        return original + " x" + count + " in " + files.size() + " file(s)";
    }
}
