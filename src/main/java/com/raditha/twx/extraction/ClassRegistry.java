package com.raditha.twx.extraction;

import com.raditha.twx.model.ClassRecord;
import com.raditha.twx.model.ExtractedToken;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deduplicated registry of every class seen, in first-seen order.
 * <p>
 * The same occurrence reported twice (same value, file, line and column) is
 * counted once. Not thread-safe: each worker fills its own registry and the
 * pipeline merges them under a lock.
 */
public class ClassRegistry {

    private final Map<String, ClassRecord> records = new LinkedHashMap<>();
    private final Set<ExtractedToken> seen = new HashSet<>();
    private final List<ExtractedToken> accepted = new ArrayList<>();
    private final Set<String> filesWithClasses = new LinkedHashSet<>();
    private int totalOccurrences;

    /**
     * @return true if the occurrence was new
     */
    public boolean add(ExtractedToken token) {
        totalOccurrences++;
        if (!seen.add(token)) {
            return false;
        }
        record(token);
        return true;
    }

    public void addAll(Collection<ExtractedToken> tokens) {
        for (ExtractedToken token : tokens) {
            add(token);
        }
    }

    /**
     * Fold another registry into this one. Counts add up, file lists keep
     * first-seen order and occurrences already known here are not counted
     * again.
     */
    public void merge(ClassRegistry other) {
        totalOccurrences += other.totalOccurrences;
        for (ExtractedToken token : other.accepted) {
            if (seen.add(token)) {
                record(token);
            }
        }
        for (ClassRecord incoming : other.records.values()) {
            ClassRecord existing = records.get(incoming.getOriginal());
            if (existing != null && existing.getObfuscated() == null) {
                existing.setObfuscated(incoming.getObfuscated());
            }
        }
    }

    private void record(ExtractedToken token) {
        accepted.add(token);
        records.computeIfAbsent(token.value(), ClassRecord::new).addOccurrence(token);
        filesWithClasses.add(token.file());
    }

    /**
     * Record the alias of every class present in {@code mapping}.
     */
    public void applyMapping(Map<String, String> mapping) {
        for (ClassRecord record : records.values()) {
            String alias = mapping.get(record.getOriginal());
            if (alias != null) {
                record.setObfuscated(alias);
            }
        }
    }

    public ClassRecord get(String className) {
        return records.get(className);
    }

    public boolean contains(String className) {
        return records.containsKey(className);
    }

    public Collection<ClassRecord> records() {
        return Collections.unmodifiableCollection(records.values());
    }

    public List<String> classNames() {
        return List.copyOf(records.keySet());
    }

    public int uniqueCount() {
        return records.size();
    }

    /**
     * Occurrences reported, duplicates included.
     */
    public int totalOccurrences() {
        return totalOccurrences;
    }

    public Set<String> filesWithClasses() {
        return Collections.unmodifiableSet(filesWithClasses);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
