package com.e2eq.causal.check;

import com.e2eq.causal.core.ResultCode;
import com.e2eq.causal.core.SignedNode;

import java.util.*;

/**
 * Translates statements into the node vocabulary of a particular model formalism.
 *
 * @param <S> subject candidate type; a null candidate stands for "any source"
 */
public interface QueryAdapter<S> {

    /**
     * Resolves a query to subject candidates and signed target nodes, or to an error code
     * such as {@link ResultCode#STATEMENT_TYPE_NOT_HANDLED}.
     */
    StatementResolution<S> resolveStatement(CausalQuery query);

    /**
     * Resolves one subject candidate to the signed source nodes a path may start from.
     */
    SourceResolution resolveSubjectToSources(S subject);

    record StatementResolution<S>(List<S> subjects, List<SignedNode> targets, ResultCode error) {
        public StatementResolution {
            // subjects may hold a single null meaning "any source", so List.copyOf is not an option
            subjects = subjects == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(subjects));
            targets = targets == null ? List.of() : List.copyOf(targets);
        }

        public static <S> StatementResolution<S> of(List<S> subjects, List<SignedNode> targets) {
            return new StatementResolution<>(subjects, targets, null);
        }

        public static <S> StatementResolution<S> failed(ResultCode error) {
            return new StatementResolution<>(List.of(), List.of(), Objects.requireNonNull(error));
        }

        public boolean isError() {
            return error != null;
        }
    }

    record SourceResolution(Set<SignedNode> sources, ResultCode error) {
        public SourceResolution {
            sources = sources == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(sources));
        }

        public static SourceResolution anySource() {
            return new SourceResolution(null, null);
        }

        public static SourceResolution of(Set<SignedNode> sources) {
            return new SourceResolution(Objects.requireNonNull(sources), null);
        }

        public static SourceResolution failed(ResultCode error) {
            return new SourceResolution(null, Objects.requireNonNull(error));
        }

        public boolean isError() {
            return error != null;
        }

        /** No source restriction: any positive node may start a path. */
        public boolean isUnconstrained() {
            return error == null && sources == null;
        }
    }
}
