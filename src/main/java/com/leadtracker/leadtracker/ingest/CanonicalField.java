package com.leadtracker.leadtracker.ingest;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Canonical property fields with the ordered header aliases used to locate them in an export.
 * Alias order is the preference order inside each match tier.
 */
public enum CanonicalField {

    ACCOUNT_NUMBER("accountNumber", List.of(
            "can", "account", "account number", "account_number", "acct", "acct no", "new-account number")),
    OWNER_NAME("ownerName", List.of(
            "owner name", "owner_name", "new-owner name", "owner", "name")),
    PROPERTY_ADDRESS("propertyAddress", List.of(
            "addrstring", "property address", "property_address", "new-property site address",
            "property site address", "situs address", "pstrname", "address", "property")),
    MAILING_ADDRESS("mailingAddress", List.of(
            "mailing address", "mailing_address", "mail address", "mailing")),
    STATUS("status", List.of("legalstatus"), true),
    TOTAL_DUE("totalDue", List.of(
            "tot_percan", "levy_balance", "total due", "total amount due", "new-total amount due",
            "new-total", "amount due", "amount_due", "balance", "total", "due")),
    PERCENTAGE_DUE("percentageDue", List.of(
            "percentage due", "percentage", "percent", "pct", "%", "tot_percan")),

    LEGAL_DESCRIPTION("legalDescription", List.of(
            "lglstring", "legal description", "new-legal description", "legal desc")),
    TAX_YEAR("taxYear", List.of("tax year", "year", "new-tax year"), true),
    MARKET_VALUE("marketValue", List.of("new-total market value", "total market value", "market value")),
    LAND_VALUE("landValue", List.of("new-land value", "land value")),
    IMPROVEMENT_VALUE("improvementValue", List.of("new-improvement value", "improvement value", "impr value")),
    CAPPED_VALUE("cappedValue", List.of("new-capped value", "capped value")),
    AGRICULTURAL_VALUE("agriculturalValue", List.of("new-agricultural value", "agricultural value")),
    EXEMPTIONS("exemptions", List.of("new-exemptions", "exemptions")),
    JURISDICTIONS("jurisdictions", List.of("new-jurisdictions", "jurisdictions")),
    LAST_PAYMENT_DATE("lastPaymentDate", List.of("new-last payment date", "last payment date")),
    LAST_PAYMENT_AMOUNT("lastPaymentAmount", List.of(
            "new-last payment amount received", "last payment amount received", "last payment amount")),
    LAST_PAYER("lastPayer", List.of("new-last payer", "last payer")),
    DELINQUENT_AFTER("delinquentAfter", List.of("new-delinquent after", "delinquent after")),
    HALF_PAYMENT_OPTION_AMOUNT("halfPaymentOptionAmount", List.of(
            "new-half payment option amount", "half payment option amount")),
    PRIOR_YEARS_AMOUNT_DUE("priorYearsAmountDue", List.of(
            "new-prior years amount due", "prior years amount due")),
    YEAR_AMOUNT_DUE("yearAmountDue", List.of("new-year amount due", "year amount due")),
    YEAR_TAX_LEVY("yearTaxLevy", List.of("new-year tax levy", "year tax levy")),
    LINK("link", List.of("new-link", "link")),
    OWNER_ADDRESS("ownerAddress", List.of("new-owner address", "owner address"));

    /**
     * Fields whose absence silently degrades diff quality and must be reported by callers.
     */
    public static final Set<CanonicalField> REQUIRED = EnumSet.of(ACCOUNT_NUMBER, PROPERTY_ADDRESS, STATUS);

    private final String key;
    private final List<String> aliases;
    private final boolean exactOnly;

    CanonicalField(String key, List<String> aliases) {
        this(key, aliases, false);
    }

    CanonicalField(String key, List<String> aliases, boolean exactOnly) {
        this.key = key;
        this.aliases = aliases;
        this.exactOnly = exactOnly;
    }

    public String key() {
        return key;
    }

    public List<String> aliases() {
        return aliases;
    }

    /**
     * Whether the field may only be matched by a case-insensitive literal header.
     */
    public boolean exactOnly() {
        return exactOnly;
    }
}
