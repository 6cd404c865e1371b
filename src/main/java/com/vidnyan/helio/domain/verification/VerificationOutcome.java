package com.vidnyan.helio.domain.verification;

public enum VerificationOutcome {
    SATISFIABLE,
    UNSATISFIABLE,
    INCONCLUSIVE
}
