package com.configkit.ini.report;

import com.configkit.ini.diff.DocumentDiff;
import com.configkit.ini.diff.MergeOptions;
import com.configkit.ini.diff.MergeResult;
import com.configkit.ini.model.Document;
import com.configkit.ini.parser.IniParser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DiffReportRenderer.
 */
class DiffReportRendererTest {

    private final DiffReportRenderer renderer = new DiffReportRenderer();
    private final IniParser parser = new IniParser();

    @Test
    void testReportListsEveryChange() {
        Document left = parser.parse("""
                [shared]
                keep = 1
                change = old
                gone = x
                [removed]
                a = 1
                """);
        Document right = parser.parse("""
                [shared]
                keep = 1
                change = new
                fresh = y
                [added]
                b = 2
                c = 3
                """);

        String report = renderer.render("left.ini", "right.ini", left.compare(right));

        assertThat(report.lines()).containsExactly(
                "Comparing left.ini -> right.ini",
                "+ [added] (2 properties)",
                "- [removed] (1 properties)",
                "~ [shared]",
                "    + fresh = y",
                "    - gone = x",
                "    ~ change: old -> new",
                "Summary: 1 added, 1 removed, 1 modified sections");
    }

    @Test
    void testNoDifferences() {
        Document document = parser.parse("k = v\n");

        String report = renderer.render("a", "b", document.compare(document.copy()));

        assertThat(report.lines()).containsExactly("Comparing a -> b", "No differences.");
    }

    @Test
    void testMergeSummary() {
        Document left = parser.parse("k = 1\n");
        Document right = parser.parse("k = 2\n[new]\nx = 1\n");
        DocumentDiff diff = left.compare(right);
        MergeResult result = left.merge(diff, MergeOptions.all());

        String report = renderer.render("target", "source", diff, result);

        assertThat(report).contains("~ [$DEFAULT]");
        assertThat(report.lines()).last()
                .isEqualTo("Merge applied 2 changes (sections +1/-0, properties +0/-0/~1)");
    }
}
