package com.bidscope.query;

import com.bidscope.storage.DatasetCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders compiled plans to DuckDB SQL.
 *
 * <p>This is the only place predicate trees become SQL. Every user-supplied value is bound as a
 * {@code ?} parameter; the SQL text contains only column names from {@link Column}, fixed
 * keywords and relation expressions from the {@link DatasetCatalog}.
 *
 * <p>Contract partitions are read through a fixed projection that normalizes types, so the
 * primary and extended partitions line up column for column in the UNION ALL.
 */
@Component
public class SqlRenderer {

    private static final Logger logger = LoggerFactory.getLogger(SqlRenderer.class);

    /** Decimal type used for stored amounts and sums. */
    public static final String AMOUNT_TYPE = "DECIMAL(18,2)";

    /**
     * Type value-range bounds are compared in. User bounds are unbounded in magnitude and scale, so
     * both sides are widened to DOUBLE rather than cast to the storage decimal.
     */
    static final String BOUND_TYPE = "DOUBLE";

    static final String CONTRACT_PROJECTION =
        "contract_number, award_title, notice_title, awardee_name, organization_name, " +
        "area_of_delivery, business_category, " +
        "TRY_CAST(contract_amount AS " + AMOUNT_TYPE + ") AS contract_amount, " +
        "TRY_CAST(award_date AS DATE) AS award_date, search_text";

    private final DatasetCatalog catalog;

    public SqlRenderer(DatasetCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Render the filtered row set of a plan as a standalone SELECT.
     */
    public SqlFragment renderFiltered(QueryPlan plan) {
        StringBuilder sql = new StringBuilder();
        List<Object> params = new ArrayList<>();

        sql.append("SELECT * FROM (").append(renderSource(plan)).append(") AS src");
        if (plan.hasPredicate()) {
            sql.append(" WHERE ");
            sql.append(renderExpression(plan.getPredicate(), params));
        }

        logger.debug("Rendered {} plan: {} {}", plan.getTarget(), sql, params);
        return new SqlFragment(sql.toString(), params);
    }

    /**
     * Render the relation a plan reads from, before any predicate.
     */
    public String renderSource(QueryPlan plan) {
        switch (plan.getSource()) {
            case PRIMARY:
                return "SELECT " + CONTRACT_PROJECTION + " FROM " + catalog.getPrimaryRelation();
            case PRIMARY_AND_EXTENDED:
                return "SELECT " + CONTRACT_PROJECTION + " FROM " + catalog.getPrimaryRelation()
                    + " UNION ALL SELECT " + CONTRACT_PROJECTION + " FROM " + catalog.getExtendedRelation();
            case ENTITY_SNAPSHOT:
                return "SELECT * FROM " + catalog.getSnapshotRelation(plan.getDimension());
            default:
                throw new IllegalArgumentException("Unsupported plan source: " + plan.getSource());
        }
    }

    /**
     * Render a predicate tree, appending its bind values to {@code params} in order.
     */
    public String renderExpression(Expression expression, List<Object> params) {
        if (expression instanceof AndExpression) {
            return joinOperands(((AndExpression) expression).getOperands(), " AND ", params);
        } else if (expression instanceof OrExpression) {
            return joinOperands(((OrExpression) expression).getOperands(), " OR ", params);
        } else if (expression instanceof ContainsExpression) {
            ContainsExpression contains = (ContainsExpression) expression;
            String column = contains.getColumn().getName();
            params.add(contains.getNeedle());
            return "(" + column + " IS NOT NULL AND contains(lower(" + column + "), ?))";
        } else if (expression instanceof EqualsExpression) {
            EqualsExpression equals = (EqualsExpression) expression;
            String column = equals.getColumn().getName();
            params.add(equals.getValue());
            return "(" + column + " IS NOT NULL AND " + column + " = ?)";
        } else if (expression instanceof BetweenExpression) {
            return renderBetween((BetweenExpression) expression, params);
        }
        throw new IllegalArgumentException("Unsupported expression: " + expression);
    }

    private String joinOperands(List<Expression> operands, String operator, List<Object> params) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < operands.size(); i++) {
            if (i > 0) sb.append(operator);
            sb.append(renderExpression(operands.get(i), params));
        }
        return sb.append(")").toString();
    }

    private String renderBetween(BetweenExpression between, List<Object> params) {
        boolean date = between.getColumn().getType() == Column.SqlType.DATE;
        String cast = date ? "DATE" : BOUND_TYPE;
        String column = date
            ? between.getColumn().getName()
            : "CAST(" + between.getColumn().getName() + " AS " + BOUND_TYPE + ")";
        String placeholder = "CAST(? AS " + cast + ")";

        if (between.getLower() != null && between.getUpper() != null) {
            params.add(bindValue(between.getLower()));
            params.add(bindValue(between.getUpper()));
            return "(" + column + " BETWEEN " + placeholder + " AND " + placeholder + ")";
        }
        if (between.getLower() != null) {
            params.add(bindValue(between.getLower()));
            return "(" + column + " >= " + placeholder + ")";
        }
        params.add(bindValue(between.getUpper()));
        return "(" + column + " <= " + placeholder + ")";
    }

    private static Object bindValue(Comparable<?> value) {
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof LocalDate) {
            return value.toString();
        }
        return value;
    }
}
