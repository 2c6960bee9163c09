package com.convoflow.graph.edit;

import java.util.Collection;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Labels for duplicated nodes: {@code "Greeting"} becomes {@code "Greeting copy"}, then
 * {@code "Greeting copy 2"}, {@code "Greeting copy 3"} as more copies exist.
 */
final class CopyLabels {

    private static final Pattern COPY_SUFFIX = Pattern.compile("^(.+?)(\\s+copy(?:\\s+\\d+)?)?$", Pattern.CASE_INSENSITIVE);

    private CopyLabels() {
    }

    static String next(String originalLabel, Collection<String> existingLabels) {
        String label = originalLabel == null || originalLabel.isBlank() ? "Node" : originalLabel.trim();
        Matcher m = COPY_SUFFIX.matcher(label);
        String baseName = m.matches() ? m.group(1).trim() : label;

        Pattern copyPattern = Pattern.compile("^" + Pattern.quote(baseName) + "\\s+copy(?:\\s+(\\d+))?$",
                Pattern.CASE_INSENSITIVE);
        int maxCopy = 0;
        for (String existing : existingLabels) {
            if (existing == null) continue;
            Matcher em = copyPattern.matcher(existing);
            if (em.matches()) {
                int n = em.group(1) != null ? Integer.parseInt(em.group(1)) : 1;
                maxCopy = Math.max(maxCopy, n);
            }
        }
        return maxCopy == 0 ? baseName + " copy" : baseName + " copy " + (maxCopy + 1);
    }
}
