package com.raditha.twx.classify;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-file record of variables known to hold class strings, plus the set of
 * helper functions whose arguments are class lists.
 * <p>
 * The table is flat: a name once marked stays marked for the rest of the file
 * regardless of scope.
 */
public class VariableAliasTable {

    public static final List<String> DEFAULT_HELPERS = List.of(
            "clsx", "classnames", "classNames", "cn", "cx", "twMerge", "twJoin", "tw", "cva");

    private final Set<String> helpers;
    private final Set<String> classBearing = new HashSet<>();

    public VariableAliasTable() {
        this(DEFAULT_HELPERS);
    }

    public VariableAliasTable(List<String> helpers) {
        this.helpers = new LinkedHashSet<>(helpers == null || helpers.isEmpty() ? DEFAULT_HELPERS : helpers);
    }

    public boolean isHelper(String name) {
        return name != null && helpers.contains(name);
    }

    public void mark(String name) {
        if (name != null) {
            classBearing.add(name);
        }
    }

    public boolean isClassBearing(String name) {
        return name != null && classBearing.contains(name);
    }

    /**
     * Names like {@code className}, {@code buttonClasses} or
     * {@code activeClass} are assumed to hold class strings.
     */
    public static boolean isClassishName(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        return name.equals("className") || name.equals("classes") || name.equals("class")
                || name.endsWith("ClassName") || name.endsWith("Classes") || name.endsWith("Class");
    }
}
