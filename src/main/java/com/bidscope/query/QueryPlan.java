package com.bidscope.query;

import java.util.Objects;

/**
 * Executable description of a filtered read: which relation to scan and which predicate to apply.
 *
 * <p>Plans are produced only by {@link QueryCompiler} and are immutable. The predicate is
 * {@code null} when nothing restricts the scan. The dimension is set for entity listings and
 * drill-downs.
 */
public class QueryPlan {
    private final QueryTarget target;
    private final PlanSource source;
    private final Expression predicate;
    private final Dimension dimension;

    QueryPlan(QueryTarget target, PlanSource source, Expression predicate, Dimension dimension) {
        this.target = Objects.requireNonNull(target, "target");
        this.source = Objects.requireNonNull(source, "source");
        this.predicate = predicate;
        this.dimension = dimension;
        if (source == PlanSource.ENTITY_SNAPSHOT && dimension == null) {
            throw new IllegalArgumentException("Snapshot plans need a dimension");
        }
    }

    public QueryTarget getTarget() {
        return target;
    }

    public PlanSource getSource() {
        return source;
    }

    public Expression getPredicate() {
        return predicate;
    }

    public boolean hasPredicate() {
        return predicate != null;
    }

    public Dimension getDimension() {
        return dimension;
    }

    public boolean isSnapshot() {
        return source == PlanSource.ENTITY_SNAPSHOT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryPlan)) return false;
        QueryPlan other = (QueryPlan) o;
        return target == other.target && source == other.source
            && Objects.equals(predicate, other.predicate) && dimension == other.dimension;
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, source, predicate, dimension);
    }

    @Override
    public String toString() {
        return "QueryPlan{" +
            "target=" + target +
            ", source=" + source +
            ", predicate=" + predicate +
            ", dimension=" + dimension +
            '}';
    }
}
