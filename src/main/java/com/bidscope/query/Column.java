package com.bidscope.query;

/**
 * Columns the filter vocabulary can reference. The set is closed; nothing outside it is ever
 * rendered into SQL.
 */
public enum Column {
    CONTRACT_NUMBER("contract_number", SqlType.TEXT),
    AWARD_TITLE("award_title", SqlType.TEXT),
    NOTICE_TITLE("notice_title", SqlType.TEXT),
    AWARDEE_NAME("awardee_name", SqlType.TEXT),
    ORGANIZATION_NAME("organization_name", SqlType.TEXT),
    AREA_OF_DELIVERY("area_of_delivery", SqlType.TEXT),
    BUSINESS_CATEGORY("business_category", SqlType.TEXT),
    CONTRACT_AMOUNT("contract_amount", SqlType.DECIMAL),
    AWARD_DATE("award_date", SqlType.DATE),
    SEARCH_TEXT("search_text", SqlType.TEXT),
    /** Entity name column of the per-dimension aggregate snapshots. */
    ENTITY("entity", SqlType.TEXT);

    public enum SqlType {
        TEXT,
        DECIMAL,
        DATE
    }

    private final String name;
    private final SqlType type;

    Column(String name, SqlType type) {
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public SqlType getType() {
        return type;
    }
}
