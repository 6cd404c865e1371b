package com.vidnyan.helio.domain.verification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one decision-procedure call.
 *
 * @param status     what the solver decided
 * @param assignment term name to value, only when satisfiable
 * @param cores      minimal sets of blamed assumption term ids, {@code null} when no core could be computed
 * @param detail     solver message for timeouts and internal failures
 */
public record SolveResult(
    Status status,
    Map<String, Boolean> assignment,
    List<List<Integer>> cores,
    String detail
) {

    public enum Status {
        SATISFIABLE,
        UNSATISFIABLE,
        TIMEOUT
    }

    public static SolveResult satisfiable(Map<String, Boolean> assignment) {
        return new SolveResult(Status.SATISFIABLE,
                Collections.unmodifiableMap(new LinkedHashMap<>(assignment)), List.of(), null);
    }

    public static SolveResult unsatisfiable(List<List<Integer>> cores) {
        return new SolveResult(Status.UNSATISFIABLE, null, List.copyOf(cores), null);
    }

    public static SolveResult unsatisfiableWithoutCore(String detail) {
        return new SolveResult(Status.UNSATISFIABLE, null, null, detail);
    }

    public static SolveResult timeout(String detail) {
        return new SolveResult(Status.TIMEOUT, null, null, detail);
    }

    public boolean hasCores() {
        return cores != null;
    }
}
