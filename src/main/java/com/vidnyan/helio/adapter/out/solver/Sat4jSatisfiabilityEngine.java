package com.vidnyan.helio.adapter.out.solver;

import com.vidnyan.helio.application.port.out.SatisfiabilityEngine;
import com.vidnyan.helio.domain.verification.ConstraintModel;
import com.vidnyan.helio.domain.verification.SolveResult;
import com.vidnyan.helio.domain.verification.SymbolicTerm;
import com.vidnyan.helio.domain.verification.TrackedAssumption;
import lombok.extern.slf4j.Slf4j;
import org.sat4j.core.VecInt;
import org.sat4j.minisat.SolverFactory;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.ISolver;
import org.sat4j.specs.IVecInt;
import org.sat4j.specs.TimeoutException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.*;

/**
 * SAT4J implementation of the decision procedure.
 *
 * <p>Tracked assumptions are passed as solver assumptions. On UNSAT the engine shrinks the blamed
 * set to a minimal core by deletion: an assumption stays in the core only if dropping it makes the
 * rest satisfiable. With {@code allCores} the found core is retired and the search repeats, so every
 * independent violation is reported.</p>
 */
@Slf4j
@Component
public class Sat4jSatisfiabilityEngine implements SatisfiabilityEngine {

    @Override
    public SolveResult solve(ConstraintModel model, Duration deadline, boolean allCores) {
        long deadlineAt = System.nanoTime() + deadline.toNanos();
        ISolver solver = SolverFactory.newDefault();
        try {
            solver.newVar(model.termCount());
            for (int[] clause : model.clauses()) {
                solver.addClause(new VecInt(clause));
            }
        } catch (ContradictionException e) {
            log.warn("Constraint model is contradictory before any assumption: {}", e.getMessage());
            solver.reset();
            return SolveResult.unsatisfiableWithoutCore(e.getMessage());
        }

        List<Integer> active = new ArrayList<>();
        for (TrackedAssumption assumption : model.assumptions()) {
            active.add(assumption.term().id());
        }

        List<List<Integer>> cores = new ArrayList<>();
        try {
            while (true) {
                if (isSatisfiable(solver, active, deadlineAt)) {
                    return cores.isEmpty()
                            ? SolveResult.satisfiable(assignment(solver, model))
                            : SolveResult.unsatisfiable(cores);
                }
                List<Integer> core = minimalCore(solver, active, deadlineAt);
                if (core.isEmpty()) {
                    log.warn("Model is unsatisfiable without any tracked assumption");
                    return SolveResult.unsatisfiableWithoutCore("no assumption subset explains the conflict");
                }
                log.debug("Minimal core: {}", core);
                cores.add(core);
                if (!allCores) {
                    return SolveResult.unsatisfiable(cores);
                }
                active.removeAll(core);
            }
        } catch (TimeoutException e) {
            return SolveResult.timeout(e.getMessage());
        } finally {
            solver.reset();
        }
    }

    private List<Integer> minimalCore(ISolver solver, List<Integer> active, long deadlineAt) throws TimeoutException {
        List<Integer> core = new ArrayList<>(seed(solver, active, deadlineAt));

        int i = 0;
        while (i < core.size()) {
            List<Integer> candidate = new ArrayList<>(core);
            candidate.remove(i);
            if (isSatisfiable(solver, candidate, deadlineAt)) {
                i++;
            } else {
                core = candidate;
            }
        }
        return core;
    }

    /**
     * Starting set for minimization: the solver's own explanation when it is a usable subset,
     * otherwise every active assumption.
     */
    private List<Integer> seed(ISolver solver, List<Integer> active, long deadlineAt) throws TimeoutException {
        IVecInt explanation = solver.unsatExplanation();
        if (explanation == null || explanation.isEmpty()) {
            return active;
        }
        Set<Integer> activeSet = new HashSet<>(active);
        List<Integer> seed = new ArrayList<>();
        for (int k = 0; k < explanation.size(); k++) {
            int termId = Math.abs(explanation.get(k));
            if (activeSet.contains(termId) && !seed.contains(termId)) {
                seed.add(termId);
            }
        }
        if (seed.isEmpty() || isSatisfiable(solver, seed, deadlineAt)) {
            return active;
        }
        return seed;
    }

    private boolean isSatisfiable(ISolver solver, List<Integer> assumptions, long deadlineAt) throws TimeoutException {
        long remainingMs = Duration.ofNanos(deadlineAt - System.nanoTime()).toMillis();
        if (remainingMs <= 0) {
            throw new TimeoutException("deadline expired before the solver finished");
        }
        solver.setTimeoutMs(remainingMs);
        int[] literals = assumptions.stream().mapToInt(Integer::intValue).toArray();
        return solver.isSatisfiable(new VecInt(literals));
    }

    private Map<String, Boolean> assignment(ISolver solver, ConstraintModel model) {
        Set<Integer> trueTerms = new HashSet<>();
        for (int literal : solver.model()) {
            if (literal > 0) {
                trueTerms.add(literal);
            }
        }
        Map<String, Boolean> values = new LinkedHashMap<>();
        for (SymbolicTerm term : model.terms()) {
            if (model.assumptionFor(term.id()).isEmpty()) {
                values.put(term.name(), trueTerms.contains(term.id()));
            }
        }
        return values;
    }
}
