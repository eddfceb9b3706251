package dev.resumetailor.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of checking a bullet selection against the per-role counts and the page line budget.
 */
public record SelectionReport(
        Map<String, Integer> selectedCounts,
        List<String> issues,
        int totalLines,
        int lineBudget,
        LineBudgetStatus lineStatus) {

    public enum LineBudgetStatus {
        UNDER,
        EXACT,
        OVER
    }

    public SelectionReport {
        selectedCounts = Collections.unmodifiableMap(new LinkedHashMap<>(selectedCounts));
        issues = List.copyOf(issues);
    }

    public static LineBudgetStatus lineStatus(int totalLines, int lineBudget) {
        if (totalLines == lineBudget) {
            return LineBudgetStatus.EXACT;
        }
        return totalLines > lineBudget ? LineBudgetStatus.OVER : LineBudgetStatus.UNDER;
    }

    public boolean isValid() {
        return issues.isEmpty() && lineStatus == LineBudgetStatus.EXACT;
    }
}
