package com.zzf.koda.core.change;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Unified diff of a change set for review before approval.
 */
public final class DiffRenderer {

    private static final int CONTEXT_LINES = 3;

    private DiffRenderer() {
    }

    public static String render(List<StagedChange> changeSet) {
        if (changeSet == null || changeSet.isEmpty()) {
            return "No staged changes.";
        }
        List<String> out = new ArrayList<>();
        for (StagedChange change : changeSet) {
            out.addAll(render(change));
        }
        return String.join("\n", out);
    }

    public static List<String> render(StagedChange change) {
        List<String> original = lines(change.getOriginalContent());
        List<String> revised = change.getChangeType() == ChangeType.DELETE
                ? Collections.emptyList()
                : lines(change.getNewContent());
        String from = change.getChangeType() == ChangeType.CREATE ? "/dev/null" : "a/" + change.getPath();
        String to = change.getChangeType() == ChangeType.DELETE ? "/dev/null" : "b/" + change.getPath();
        Patch<String> patch = DiffUtils.diff(original, revised);
        return UnifiedDiffUtils.generateUnifiedDiff(from, to, original, patch, CONTEXT_LINES);
    }

    private static List<String> lines(String content) {
        if (content == null || content.isEmpty()) {
            return Collections.emptyList();
        }
        return Arrays.asList(content.split("\\r?\\n", -1));
    }
}
