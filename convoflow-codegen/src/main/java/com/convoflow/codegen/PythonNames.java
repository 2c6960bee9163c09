package com.convoflow.codegen;

import com.convoflow.schema.util.Identifiers;

import java.util.HashSet;
import java.util.Set;

/** Hands out unique Python identifiers; a taken name gets {@code _2}, {@code _3}, ... appended. */
final class PythonNames {

    private final Set<String> taken = new HashSet<>();

    String allocate(String wanted) {
        String base = Identifiers.toIdentifier(wanted);
        String name = base;
        int n = 2;
        while (!taken.add(name)) {
            name = base + "_" + n++;
        }
        return name;
    }
}
