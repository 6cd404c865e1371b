package com.vidnyan.helio.adapter.out.analyzer;

import com.vidnyan.helio.domain.analysis.AnalysisInput;
import com.vidnyan.helio.domain.analysis.HeuristicAnalyzer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects long synchronous call chains and a missing timeout policy.
 * Chains are computed on the raw sync graph, so this also runs when the graph is cyclic.
 */
@Slf4j
@Component
@Order(20)
public class PerformanceAnalyzer implements HeuristicAnalyzer {

    static final int MAX_CHAIN_LENGTH = 3;

    @Override
    public Channel channel() {
        return Channel.WARNING;
    }

    @Override
    public List<String> analyze(AnalysisInput input) {
        List<String> warnings = new ArrayList<>();

        List<List<String>> chains = input.syncGraph().findCallChains();
        log.debug("Found {} synchronous call chains", chains.size());

        for (List<String> chain : chains) {
            if (chain.size() > MAX_CHAIN_LENGTH) {
                warnings.add("Performance Warning: Long synchronous call chain detected: "
                        + String.join(" -> ", chain));
            }
        }

        if (!input.specification().policies().hasTimeouts()) {
            warnings.add("Performance Warning: No global timeout policies defined, "
                    + "which could lead to hanging requests.");
        }
        return warnings;
    }
}
