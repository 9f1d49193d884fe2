package com.bidscope.query;

import com.bidscope.error.ValidationException;
import com.bidscope.filter.FilterSpec;
import com.bidscope.filter.TimeRange;
import com.bidscope.filter.ValueRange;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Compiles a {@link FilterSpec} into a {@link QueryPlan}.
 *
 * <p>The predicate is an AND over one OR group per filter type:
 * <ul>
 *   <li>chip values become case-insensitive {@link ContainsExpression}s on their column,</li>
 *   <li>keyword tokens match the search text, with {@code &&} sub-tokens AND'd,</li>
 *   <li>time ranges become an OR of independent {@link BetweenExpression}s on award_date,</li>
 *   <li>a present value range becomes one inclusive {@link BetweenExpression} on contract_amount.</li>
 * </ul>
 *
 * Compilation is a pure function of its arguments. It never touches the backing store.
 */
@Component
public class QueryCompiler {

    /**
     * Compile a filter for the given operation.
     */
    public QueryPlan compile(FilterSpec spec, QueryTarget target) {
        if (target == QueryTarget.ENTITY_LISTING) {
            throw new IllegalArgumentException("Entity listings are compiled with compileEntityListing");
        }
        return new QueryPlan(target, contractSource(spec), buildPredicate(spec), null);
    }

    /**
     * Compile a per-entity listing of one dimension.
     *
     * <p>When the filter spans all time and carries no other restriction, the plan reads the
     * precomputed entity snapshot directly. Otherwise it targets contract records and the engine
     * groups them itself.
     *
     * @param searchQuery optional case-insensitive substring on the entity name
     */
    public QueryPlan compileEntityListing(Dimension dimension, FilterSpec spec, String searchQuery) {
        String search = searchQuery == null ? "" : searchQuery.trim();

        if (isSnapshotEligible(spec)) {
            Expression predicate = search.isEmpty() ? null : new ContainsExpression(Column.ENTITY, search);
            return new QueryPlan(QueryTarget.ENTITY_LISTING, PlanSource.ENTITY_SNAPSHOT, predicate, dimension);
        }

        List<Expression> conjuncts = new ArrayList<>();
        addIfPresent(conjuncts, buildPredicate(spec));
        if (!search.isEmpty()) {
            conjuncts.add(new ContainsExpression(dimension.getColumn(), search));
        }
        return new QueryPlan(QueryTarget.ENTITY_LISTING, contractSource(spec), and(conjuncts), dimension);
    }

    /**
     * Compile a drill-down: entities of {@code targetDimension} among the contracts whose
     * {@code sourceDimension} equals {@code sourceValue} exactly.
     */
    public QueryPlan compileRelated(Dimension sourceDimension, String sourceValue, Dimension targetDimension,
                                    List<TimeRange> timeRanges, boolean includeExtended) {
        if (sourceDimension == targetDimension) {
            throw new ValidationException("target_dimension", "Source and target dimensions must differ");
        }
        if (sourceValue == null || sourceValue.isBlank()) {
            throw new ValidationException("entity_value", "Source entity value is required");
        }

        List<Expression> conjuncts = new ArrayList<>();
        conjuncts.add(new EqualsExpression(sourceDimension.getColumn(), sourceValue.trim()));
        addIfPresent(conjuncts, timePredicate(timeRanges));

        PlanSource source = includeExtended ? PlanSource.PRIMARY_AND_EXTENDED : PlanSource.PRIMARY;
        return new QueryPlan(QueryTarget.ENTITY_LISTING, source, and(conjuncts), targetDimension);
    }

    /**
     * Whether an entity listing for this filter may use the all-time snapshot.
     */
    public boolean isSnapshotEligible(FilterSpec spec) {
        return spec.isAllTime() && !spec.hasRowFilters() && !spec.isIncludeExtended();
    }

    Expression buildPredicate(FilterSpec spec) {
        List<Expression> conjuncts = new ArrayList<>();
        addIfPresent(conjuncts, chipGroup(spec.getContractors(), Column.AWARDEE_NAME));
        addIfPresent(conjuncts, chipGroup(spec.getAreas(), Column.AREA_OF_DELIVERY));
        addIfPresent(conjuncts, chipGroup(spec.getOrganizations(), Column.ORGANIZATION_NAME));
        addIfPresent(conjuncts, chipGroup(spec.getBusinessCategories(), Column.BUSINESS_CATEGORY));
        addIfPresent(conjuncts, chipGroup(spec.getKeywords(), Column.SEARCH_TEXT));
        addIfPresent(conjuncts, timePredicate(spec.getTimeRanges()));
        spec.getValueRange().ifPresent(range -> conjuncts.add(valuePredicate(range)));
        return and(conjuncts);
    }

    private static PlanSource contractSource(FilterSpec spec) {
        return spec.isIncludeExtended() ? PlanSource.PRIMARY_AND_EXTENDED : PlanSource.PRIMARY;
    }

    private static Expression chipGroup(Collection<String> values, Column column) {
        List<Expression> alternatives = new ArrayList<>();
        for (String value : values) {
            List<Expression> parts = new ArrayList<>();
            for (String token : FilterSpec.subTokens(value)) {
                parts.add(new ContainsExpression(column, token));
            }
            addIfPresent(alternatives, and(parts));
        }
        return or(alternatives);
    }

    private static Expression timePredicate(List<TimeRange> ranges) {
        if (ranges == null) {
            return null;
        }
        List<Expression> alternatives = new ArrayList<>();
        for (TimeRange range : ranges) {
            alternatives.add(new BetweenExpression(Column.AWARD_DATE, range.getStartDate(), range.getEndDate()));
        }
        return or(alternatives);
    }

    private static Expression valuePredicate(ValueRange range) {
        return new BetweenExpression(Column.CONTRACT_AMOUNT, range.getMin(), range.getMax());
    }

    private static Expression and(List<Expression> operands) {
        if (operands.isEmpty()) {
            return null;
        }
        return operands.size() == 1 ? operands.get(0) : new AndExpression(operands);
    }

    private static Expression or(List<Expression> operands) {
        if (operands.isEmpty()) {
            return null;
        }
        return operands.size() == 1 ? operands.get(0) : new OrExpression(operands);
    }

    private static void addIfPresent(List<Expression> target, Expression expression) {
        if (expression != null) {
            target.add(expression);
        }
    }
}
