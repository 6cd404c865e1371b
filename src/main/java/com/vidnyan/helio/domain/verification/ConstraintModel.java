package com.vidnyan.helio.domain.verification;

import java.util.*;

/**
 * Propositional model of one verification run: terms, clauses over term ids (DIMACS-style signed
 * literals) and the tracked assumptions keyed by term id.
 * Built fresh per run and discarded afterwards.
 */
public final class ConstraintModel {

    private final List<SymbolicTerm> terms = new ArrayList<>();
    private final List<int[]> clauses = new ArrayList<>();
    private final Map<Integer, TrackedAssumption> assumptions = new LinkedHashMap<>();

    public SymbolicTerm newTerm(String name) {
        SymbolicTerm term = new SymbolicTerm(terms.size() + 1, name);
        terms.add(term);
        return term;
    }

    public void addClause(int... literals) {
        clauses.add(literals.clone());
    }

    /**
     * {@code antecedent → consequent}.
     */
    public void addImplication(SymbolicTerm antecedent, SymbolicTerm consequent) {
        addClause(-antecedent.id(), consequent.id());
    }

    /**
     * Register a tracked assumption whose term is constrained to false, so assuming it is
     * always unsatisfiable and it is blamed whenever the solver explains a conflict.
     */
    public TrackedAssumption track(TrackedAssumption.Kind kind, String subject, String service, String requirement) {
        SymbolicTerm term = newTerm("track_" + kind.name().toLowerCase(Locale.ROOT) + "_" + subject);
        addClause(-term.id());
        TrackedAssumption assumption = new TrackedAssumption(kind, subject, service, requirement, term);
        assumptions.put(term.id(), assumption);
        return assumption;
    }

    public List<SymbolicTerm> terms() {
        return Collections.unmodifiableList(terms);
    }

    public List<int[]> clauses() {
        return Collections.unmodifiableList(clauses);
    }

    public Collection<TrackedAssumption> assumptions() {
        return Collections.unmodifiableCollection(assumptions.values());
    }

    public Optional<TrackedAssumption> assumptionFor(int termId) {
        return Optional.ofNullable(assumptions.get(termId));
    }

    public int termCount() {
        return terms.size();
    }
}
