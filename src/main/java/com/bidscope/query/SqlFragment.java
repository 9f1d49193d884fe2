package com.bidscope.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parameterized SQL text with its positional bind values in order.
 */
public class SqlFragment {
    private final String sql;
    private final List<Object> params;

    public SqlFragment(String sql, List<Object> params) {
        this.sql = sql;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    public String getSql() {
        return sql;
    }

    public List<Object> getParams() {
        return params;
    }

    public Object[] paramArray() {
        return params.toArray();
    }

    /**
     * Wraps this fragment as the {@code filtered} CTE and appends the given outer query.
     */
    public SqlFragment wrap(String outerSql, Object... extraParams) {
        List<Object> all = new ArrayList<>(params);
        Collections.addAll(all, extraParams);
        return new SqlFragment("WITH filtered AS (" + sql + ") " + outerSql, all);
    }

    @Override
    public String toString() {
        return sql + " " + params;
    }
}
