package com.testinsight.analyzer;

/**
 * Deterministic choice between two library labels seen for the same keyword.
 */
final class LibraryLabels {

    private LibraryLabels() {
    }

    static String prefer(String current, String candidate) {
        boolean currentUnknown = KeywordLibraryResolver.UNKNOWN.equals(current);
        boolean candidateUnknown = KeywordLibraryResolver.UNKNOWN.equals(candidate);
        if (currentUnknown != candidateUnknown) {
            return currentUnknown ? candidate : current;
        }
        return current.compareTo(candidate) <= 0 ? current : candidate;
    }
}
