package com.vidnyan.statute.domain.verification;

import com.vidnyan.statute.domain.constraint.Model;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured diagnostic produced by the verifier. Findings are data, never errors.
 */
public sealed interface Finding {

    /**
     * Most severe first, then by code, statute ids and message.
     */
    Comparator<Finding> ORDER = Comparator
            .comparing(Finding::severity, Comparator.reverseOrder())
            .thenComparing(Finding::code)
            .thenComparing(f -> String.join(",", f.statuteIds()))
            .thenComparing(Finding::message);

    FindingCode code();

    /**
     * Statutes involved, in reporting order.
     */
    List<String> statuteIds();

    String message();

    default Severity severity() {
        return code().severity();
    }

    /**
     * Supersession/amendment cycle. Members start at the smallest id and follow the links.
     */
    record CircularReference(List<String> cycle) implements Finding {
        public CircularReference {
            cycle = List.copyOf(cycle);
            if (cycle.isEmpty()) {
                throw new IllegalArgumentException("cycle must not be empty");
            }
        }

        @Override
        public FindingCode code() {
            return FindingCode.CIRCULAR_REFERENCE;
        }

        @Override
        public List<String> statuteIds() {
            return cycle;
        }

        @Override
        public String message() {
            return "Circular reference: " + String.join(" → ", cycle) + " → " + cycle.get(0);
        }
    }

    /**
     * Preconditions, minus the exception, can never hold.
     */
    record DeadStatute(String statuteId) implements Finding {
        public DeadStatute {
            Objects.requireNonNull(statuteId, "statuteId");
        }

        @Override
        public FindingCode code() {
            return FindingCode.DEAD_STATUTE;
        }

        @Override
        public List<String> statuteIds() {
            return List.of(statuteId);
        }

        @Override
        public String message() {
            return "Statute " + statuteId + " can never apply: its preconditions are unsatisfiable";
        }
    }

    /**
     * Two statutes with conflicting effects can apply to the same entity.
     * {@code first} sorts before {@code second}.
     */
    record Contradiction(String first, String second, Optional<Model> witness) implements Finding {
        public Contradiction {
            Objects.requireNonNull(first, "first");
            Objects.requireNonNull(second, "second");
            Objects.requireNonNull(witness, "witness");
            if (first.compareTo(second) > 0) {
                String tmp = first;
                first = second;
                second = tmp;
            }
        }

        @Override
        public FindingCode code() {
            return FindingCode.CONTRADICTION;
        }

        @Override
        public List<String> statuteIds() {
            return List.of(first, second);
        }

        @Override
        public String message() {
            return "Statutes " + first + " and " + second + " have conflicting effects"
                    + witness.map(m -> " when " + m).orElse("");
        }
    }

    /**
     * The exception can never hold while the preconditions do.
     */
    record RedundantException(String statuteId) implements Finding {
        public RedundantException {
            Objects.requireNonNull(statuteId, "statuteId");
        }

        @Override
        public FindingCode code() {
            return FindingCode.REDUNDANT_EXCEPTION;
        }

        @Override
        public List<String> statuteIds() {
            return List.of(statuteId);
        }

        @Override
        public String message() {
            return "Exception of statute " + statuteId + " never applies when its preconditions hold";
        }
    }

    /**
     * An OR branch of the preconditions can never be the one that holds.
     */
    record UnreachableBranch(String statuteId, String branch) implements Finding {
        public UnreachableBranch {
            Objects.requireNonNull(statuteId, "statuteId");
            Objects.requireNonNull(branch, "branch");
        }

        @Override
        public FindingCode code() {
            return FindingCode.UNREACHABLE_BRANCH;
        }

        @Override
        public List<String> statuteIds() {
            return List.of(statuteId);
        }

        @Override
        public String message() {
            return "Branch '" + branch + "' of statute " + statuteId + " is unreachable";
        }
    }
}
