package com.testinsight.analyzer;

import com.testinsight.model.KeywordCall;
import com.testinsight.model.TestResult;

import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Share of assertion-style keywords among a test's top-level steps.
 */
public class AssertionDensityAccumulator implements KpiAccumulator<AssertionDensityAccumulator.Result> {

    private static final int LISTED_TESTS = 30;

    public record TestAssertions(String name, String suite, int totalKeywords, int assertionCount, double density) {}

    public record Result(int totalTests, double avgDensity, int testsWithoutAssertions,
                         List<TestAssertions> noAssertionTests, List<TestAssertions> tests) {}

    private record Counts(int total, int assertions) {}

    private final KeywordLibraryResolver resolver;
    private final Pattern assertionPattern;
    private final int zeroAssertionLimit;
    private final LatestPerTest<Counts> counts = new LatestPerTest<>();

    public AssertionDensityAccumulator(KeywordLibraryResolver resolver, List<String> assertionPrefixes,
                                       int zeroAssertionLimit) {
        this.resolver = resolver;
        this.assertionPattern = compile(assertionPrefixes);
        this.zeroAssertionLimit = zeroAssertionLimit;
    }

    public boolean isAssertion(String keywordName) {
        return assertionPattern.matcher(resolver.canonicalName(keywordName)).find();
    }

    @Override
    public void fold(ReportData report) {
        Map<TestKey, List<KeywordCall>> byTest = report.keywordsByTest();
        for (TestResult test : report.tests()) {
            List<String> names = ReportData.topLevelNames(byTest.get(TestKey.of(test)));
            int assertions = (int) names.stream().filter(this::isAssertion).count();
            counts.offer(TestKey.of(test), report.run(), new Counts(names.size(), assertions));
        }
    }

    @Override
    public Result finish() {
        List<TestAssertions> all = counts.values().entrySet().stream()
                .map(e -> {
                    Counts c = e.getValue();
                    double density = c.total() == 0 ? 0.0 : Rounding.round(c.assertions() * 100.0 / c.total(), 1);
                    return new TestAssertions(e.getKey().testName(), e.getKey().suiteName(),
                            c.total(), c.assertions(), density);
                })
                .toList();

        double avg = all.stream().mapToDouble(TestAssertions::density).average().orElse(0.0);
        List<TestAssertions> withoutAssertions = all.stream()
                .filter(t -> t.assertionCount() == 0)
                .sorted(Comparator.comparingInt(TestAssertions::totalKeywords).reversed()
                        .thenComparing(TestAssertions::name)
                        .thenComparing(TestAssertions::suite))
                .toList();
        List<TestAssertions> lowestFirst = all.stream()
                .sorted(Comparator.comparingDouble(TestAssertions::density)
                        .thenComparing(TestAssertions::name)
                        .thenComparing(TestAssertions::suite))
                .limit(LISTED_TESTS)
                .toList();

        return new Result(all.size(), Rounding.round(avg, 1), withoutAssertions.size(),
                withoutAssertions.stream().limit(zeroAssertionLimit).toList(), lowestFirst);
    }

    private static Pattern compile(List<String> prefixes) {
        String alternatives = prefixes.stream()
                .filter(p -> p != null && !p.isBlank())
                .map(p -> Pattern.quote(p.trim()))
                .collect(Collectors.joining("|"));
        if (alternatives.isEmpty()) {
            // Matches nothing.
            return Pattern.compile("(?!)");
        }
        return Pattern.compile("^(" + alternatives + ")\\b", Pattern.CASE_INSENSITIVE);
    }
}
