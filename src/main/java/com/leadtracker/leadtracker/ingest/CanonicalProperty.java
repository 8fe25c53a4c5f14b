package com.leadtracker.leadtracker.ingest;

import java.time.LocalDate;
import java.util.List;

/**
 * Property record normalized to the canonical field set, independent of source column naming.
 * {@code accountNumber} is the identity key across snapshots.
 */
public record CanonicalProperty(
        String accountNumber,
        String ownerName,
        String propertyAddress,
        String mailingAddress,
        PropertyStatus status,
        double totalDue,
        double percentageDue,
        String legalDescription,
        Integer taxYear,
        Double marketValue,
        Double landValue,
        Double improvementValue,
        Double cappedValue,
        Double agriculturalValue,
        List<String> exemptions,
        List<String> jurisdictions,
        LocalDate lastPaymentDate,
        Double lastPaymentAmount,
        String lastPayer,
        LocalDate delinquentAfter,
        Double halfPaymentOptionAmount,
        Double priorYearsAmountDue,
        Double yearAmountDue,
        Double yearTaxLevy,
        String link,
        String ownerAddress,
        int sourceRowIndex
) {

    public CanonicalProperty {
        if (accountNumber == null || accountNumber.isBlank()) {
            throw new IllegalArgumentException("accountNumber is required");
        }
        accountNumber = accountNumber.trim();
        ownerName = ownerName == null || ownerName.isBlank() ? IngestConstants.UNKNOWN_VALUE : ownerName;
        propertyAddress = propertyAddress == null || propertyAddress.isBlank()
                ? IngestConstants.UNKNOWN_VALUE
                : propertyAddress;
        status = status == null ? PropertyStatus.UNKNOWN : status;
        exemptions = exemptions == null ? List.of() : List.copyOf(exemptions);
        jurisdictions = jurisdictions == null ? List.of() : List.copyOf(jurisdictions);
    }

    public static Builder builder(String accountNumber) {
        return new Builder(accountNumber);
    }

    /**
     * Step-free builder; unset fields take the record defaults.
     */
    public static final class Builder {

        private final String accountNumber;
        private String ownerName;
        private String propertyAddress;
        private String mailingAddress;
        private PropertyStatus status;
        private double totalDue;
        private double percentageDue;
        private String legalDescription;
        private Integer taxYear;
        private Double marketValue;
        private Double landValue;
        private Double improvementValue;
        private Double cappedValue;
        private Double agriculturalValue;
        private List<String> exemptions;
        private List<String> jurisdictions;
        private LocalDate lastPaymentDate;
        private Double lastPaymentAmount;
        private String lastPayer;
        private LocalDate delinquentAfter;
        private Double halfPaymentOptionAmount;
        private Double priorYearsAmountDue;
        private Double yearAmountDue;
        private Double yearTaxLevy;
        private String link;
        private String ownerAddress;
        private int sourceRowIndex;

        private Builder(String accountNumber) {
            this.accountNumber = accountNumber;
        }

        public Builder ownerName(String ownerName) {
            this.ownerName = ownerName;
            return this;
        }

        public Builder propertyAddress(String propertyAddress) {
            this.propertyAddress = propertyAddress;
            return this;
        }

        public Builder mailingAddress(String mailingAddress) {
            this.mailingAddress = mailingAddress;
            return this;
        }

        public Builder status(PropertyStatus status) {
            this.status = status;
            return this;
        }

        public Builder totalDue(double totalDue) {
            this.totalDue = totalDue;
            return this;
        }

        public Builder percentageDue(double percentageDue) {
            this.percentageDue = percentageDue;
            return this;
        }

        public Builder legalDescription(String legalDescription) {
            this.legalDescription = legalDescription;
            return this;
        }

        public Builder taxYear(Integer taxYear) {
            this.taxYear = taxYear;
            return this;
        }

        public Builder marketValue(Double marketValue) {
            this.marketValue = marketValue;
            return this;
        }

        public Builder landValue(Double landValue) {
            this.landValue = landValue;
            return this;
        }

        public Builder improvementValue(Double improvementValue) {
            this.improvementValue = improvementValue;
            return this;
        }

        public Builder cappedValue(Double cappedValue) {
            this.cappedValue = cappedValue;
            return this;
        }

        public Builder agriculturalValue(Double agriculturalValue) {
            this.agriculturalValue = agriculturalValue;
            return this;
        }

        public Builder exemptions(List<String> exemptions) {
            this.exemptions = exemptions;
            return this;
        }

        public Builder jurisdictions(List<String> jurisdictions) {
            this.jurisdictions = jurisdictions;
            return this;
        }

        public Builder lastPaymentDate(LocalDate lastPaymentDate) {
            this.lastPaymentDate = lastPaymentDate;
            return this;
        }

        public Builder lastPaymentAmount(Double lastPaymentAmount) {
            this.lastPaymentAmount = lastPaymentAmount;
            return this;
        }

        public Builder lastPayer(String lastPayer) {
            this.lastPayer = lastPayer;
            return this;
        }

        public Builder delinquentAfter(LocalDate delinquentAfter) {
            this.delinquentAfter = delinquentAfter;
            return this;
        }

        public Builder halfPaymentOptionAmount(Double halfPaymentOptionAmount) {
            this.halfPaymentOptionAmount = halfPaymentOptionAmount;
            return this;
        }

        public Builder priorYearsAmountDue(Double priorYearsAmountDue) {
            this.priorYearsAmountDue = priorYearsAmountDue;
            return this;
        }

        public Builder yearAmountDue(Double yearAmountDue) {
            this.yearAmountDue = yearAmountDue;
            return this;
        }

        public Builder yearTaxLevy(Double yearTaxLevy) {
            this.yearTaxLevy = yearTaxLevy;
            return this;
        }

        public Builder link(String link) {
            this.link = link;
            return this;
        }

        public Builder ownerAddress(String ownerAddress) {
            this.ownerAddress = ownerAddress;
            return this;
        }

        public Builder sourceRowIndex(int sourceRowIndex) {
            this.sourceRowIndex = sourceRowIndex;
            return this;
        }

        public CanonicalProperty build() {
            return new CanonicalProperty(
                    accountNumber,
                    ownerName,
                    propertyAddress,
                    mailingAddress,
                    status,
                    totalDue,
                    percentageDue,
                    legalDescription,
                    taxYear,
                    marketValue,
                    landValue,
                    improvementValue,
                    cappedValue,
                    agriculturalValue,
                    exemptions,
                    jurisdictions,
                    lastPaymentDate,
                    lastPaymentAmount,
                    lastPayer,
                    delinquentAfter,
                    halfPaymentOptionAmount,
                    priorYearsAmountDue,
                    yearAmountDue,
                    yearTaxLevy,
                    link,
                    ownerAddress,
                    sourceRowIndex
            );
        }
    }
}
