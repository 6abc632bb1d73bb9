package org.corpusgate.gate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pass/fail verdict of a gate run with the checks that produced it.
 */
public final class GateDecision {
    private final List<GateCheck> checks;

    GateDecision(List<GateCheck> checks) {
        this.checks = List.copyOf(new ArrayList<>(Objects.requireNonNull(checks, "checks")));
    }

    public List<GateCheck> checks() {
        return checks;
    }

    public Optional<GateCheck> check(String gateId) {
        for (GateCheck check : checks) {
            if (check.gateId().equals(gateId)) {
                return Optional.of(check);
            }
        }
        return Optional.empty();
    }

    public List<GateCheck> failedChecks() {
        List<GateCheck> failed = new ArrayList<>();
        for (GateCheck check : checks) {
            if (!check.passed()) {
                failed.add(check);
            }
        }
        return List.copyOf(failed);
    }

    public boolean passed() {
        return failedChecks().isEmpty();
    }
}
