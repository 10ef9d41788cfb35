package com.phillippitts.recallahead.service.orchestration;

/**
 * Decides whether a freshly typed query differs enough from recent work to deserve a lookup.
 *
 * <p><b>Rules</b> (evaluated in order):
 * <ol>
 *   <li>A query equal to the last successfully searched query, or to the query currently in
 *       flight, is an {@link Verdict#EXACT_DUPLICATE}.</li>
 *   <li>A query whose length differs from the last searched query by at most
 *       {@code maxLengthDelta} characters, where the longer of the two starts with the shorter,
 *       is a {@link Verdict#NEAR_DUPLICATE} ("still typing the same thing").</li>
 * </ol>
 *
 * <p>The second rule is a tuned approximation, not an edit distance. Its only knob is
 * {@link OrchestratorOptions#nearDuplicateMaxDelta()}.
 *
 * @since 1.0
 */
public final class NearDuplicateFilter {

    /** Outcome of {@link #evaluate}. */
    public enum Verdict {
        PASS,
        EXACT_DUPLICATE,
        NEAR_DUPLICATE
    }

    private NearDuplicateFilter() {}

    /**
     * @param candidate      normalized query about to be scheduled
     * @param lastSearched   last successfully searched query, empty if none
     * @param inFlight       query currently in flight, or null
     * @param maxLengthDelta largest length difference still considered insignificant
     * @return verdict for the candidate
     */
    public static Verdict evaluate(String candidate, String lastSearched, String inFlight, int maxLengthDelta) {
        if (candidate.equals(lastSearched) || candidate.equals(inFlight)) {
            return Verdict.EXACT_DUPLICATE;
        }
        if (lastSearched == null || lastSearched.isEmpty() || candidate.isEmpty()) {
            return Verdict.PASS;
        }
        if (Math.abs(candidate.length() - lastSearched.length()) > maxLengthDelta) {
            return Verdict.PASS;
        }
        boolean candidateShorter = candidate.length() < lastSearched.length();
        String shorter = candidateShorter ? candidate : lastSearched;
        String longer = candidateShorter ? lastSearched : candidate;
        return longer.startsWith(shorter) ? Verdict.NEAR_DUPLICATE : Verdict.PASS;
    }
}
