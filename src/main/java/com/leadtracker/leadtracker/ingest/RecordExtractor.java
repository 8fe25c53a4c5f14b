package com.leadtracker.leadtracker.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Predicate;

/**
 * Converts raw rows into canonical property records. Each row is handled independently; rows that
 * cannot yield an account number are dropped and counted, never thrown.
 */
@Component
public class RecordExtractor {

    private static final Logger log = LoggerFactory.getLogger(RecordExtractor.class);

    private final IngestProperties ingestProperties;
    private final Executor extractionExecutor;

    public RecordExtractor(IngestProperties ingestProperties,
                           @Qualifier("extractionExecutor") Executor extractionExecutor) {
        this.ingestProperties = ingestProperties;
        this.extractionExecutor = extractionExecutor;
    }

    /**
     * Extracts records chunk by chunk. Chunks run on the extraction pool and are concatenated in
     * chunk order; an interrupt between chunks abandons the run with {@link CancellationException}.
     */
    public ExtractionResult extract(List<RawRow> rows, ColumnMap columnMap) {
        RowPlan plan = RowPlan.of(columnMap);
        List<String> unresolved = columnMap.unresolvedRequired().stream().map(CanonicalField::key).toList();
        if (rows == null || rows.isEmpty()) {
            return new ExtractionResult(List.of(), ExtractionDiagnostics.empty(unresolved));
        }

        List<List<RawRow>> chunks = partition(rows, Math.max(1, ingestProperties.getExtractionChunkSize()));
        List<ExtractionResult> chunkResults = new ArrayList<>(chunks.size());
        if (chunks.size() == 1) {
            ensureNotCancelled(List.of());
            chunkResults.add(extractChunk(chunks.get(0), plan, unresolved));
        } else {
            List<CompletableFuture<ExtractionResult>> futures = new ArrayList<>(chunks.size());
            for (List<RawRow> chunk : chunks) {
                ensureNotCancelled(futures);
                futures.add(CompletableFuture.supplyAsync(() -> extractChunk(chunk, plan, unresolved), extractionExecutor));
            }
            for (CompletableFuture<ExtractionResult> future : futures) {
                ensureNotCancelled(futures);
                chunkResults.add(future.join());
            }
        }

        List<CanonicalProperty> properties = new ArrayList<>(rows.size());
        ExtractionDiagnostics diagnostics = ExtractionDiagnostics.empty(unresolved);
        for (ExtractionResult chunkResult : chunkResults) {
            properties.addAll(chunkResult.properties());
            diagnostics = diagnostics.plus(chunkResult.diagnostics());
        }

        if (diagnostics.rowsDroppedMissingAccount() > 0) {
            log.warn("Dropped {} of {} rows without a derivable account number",
                    diagnostics.rowsDroppedMissingAccount(), diagnostics.rowsRead());
        }
        log.info("Extracted {} records from {} rows in {} chunk(s)",
                properties.size(), rows.size(), chunks.size());
        return new ExtractionResult(properties, diagnostics);
    }

    private ExtractionResult extractChunk(List<RawRow> rows, RowPlan plan, List<String> unresolved) {
        List<CanonicalProperty> properties = new ArrayList<>(rows.size());
        int dropped = 0;
        int fromFallback = 0;
        int unknownStatus = 0;

        for (RawRow row : rows) {
            String accountNumber = row.value(plan.accountHeader());
            if (accountNumber.isEmpty()) {
                accountNumber = firstNonBlank(row, plan.accountFallback());
                if (!accountNumber.isEmpty()) {
                    fromFallback++;
                }
            }
            if (accountNumber.isEmpty()) {
                dropped++;
                continue;
            }

            CanonicalProperty property = toProperty(row, accountNumber, plan);
            if (property.status() == PropertyStatus.UNKNOWN) {
                unknownStatus++;
            }
            properties.add(property);
        }

        ExtractionDiagnostics diagnostics = new ExtractionDiagnostics(
                rows.size(), properties.size(), dropped, fromFallback, unknownStatus, unresolved);
        return new ExtractionResult(properties, diagnostics);
    }

    private CanonicalProperty toProperty(RawRow row, String accountNumber, RowPlan plan) {
        String propertyAddress = row.value(plan.addressHeader());
        if (propertyAddress.isEmpty()) {
            propertyAddress = firstNonBlank(row, plan.addressFallback());
        }
        String ownerAddress = text(row, plan, CanonicalField.OWNER_ADDRESS);
        String mailingAddress = text(row, plan, CanonicalField.MAILING_ADDRESS);

        return CanonicalProperty.builder(accountNumber)
                .ownerName(text(row, plan, CanonicalField.OWNER_NAME))
                .propertyAddress(propertyAddress)
                .mailingAddress(mailingAddress != null ? mailingAddress : ownerAddress)
                .status(PropertyStatus.fromLegalStatus(row.value(plan.statusHeader())))
                .totalDue(ValueCoercion.parseNumberOrZero(raw(row, plan, CanonicalField.TOTAL_DUE)))
                .percentageDue(ValueCoercion.parseNumberOrZero(raw(row, plan, CanonicalField.PERCENTAGE_DUE)))
                .legalDescription(text(row, plan, CanonicalField.LEGAL_DESCRIPTION))
                .taxYear(ValueCoercion.parseInteger(raw(row, plan, CanonicalField.TAX_YEAR)))
                .marketValue(number(row, plan, CanonicalField.MARKET_VALUE))
                .landValue(number(row, plan, CanonicalField.LAND_VALUE))
                .improvementValue(number(row, plan, CanonicalField.IMPROVEMENT_VALUE))
                .cappedValue(number(row, plan, CanonicalField.CAPPED_VALUE))
                .agriculturalValue(number(row, plan, CanonicalField.AGRICULTURAL_VALUE))
                .exemptions(ValueCoercion.splitList(raw(row, plan, CanonicalField.EXEMPTIONS)))
                .jurisdictions(ValueCoercion.splitList(raw(row, plan, CanonicalField.JURISDICTIONS)))
                .lastPaymentDate(ValueCoercion.parseDate(raw(row, plan, CanonicalField.LAST_PAYMENT_DATE)))
                .lastPaymentAmount(number(row, plan, CanonicalField.LAST_PAYMENT_AMOUNT))
                .lastPayer(text(row, plan, CanonicalField.LAST_PAYER))
                .delinquentAfter(ValueCoercion.parseDate(raw(row, plan, CanonicalField.DELINQUENT_AFTER)))
                .halfPaymentOptionAmount(number(row, plan, CanonicalField.HALF_PAYMENT_OPTION_AMOUNT))
                .priorYearsAmountDue(number(row, plan, CanonicalField.PRIOR_YEARS_AMOUNT_DUE))
                .yearAmountDue(number(row, plan, CanonicalField.YEAR_AMOUNT_DUE))
                .yearTaxLevy(number(row, plan, CanonicalField.YEAR_TAX_LEVY))
                .link(text(row, plan, CanonicalField.LINK))
                .ownerAddress(ownerAddress)
                .sourceRowIndex(row.rowIndex())
                .build();
    }

    private String raw(RawRow row, RowPlan plan, CanonicalField field) {
        List<String> headers = plan.fieldHeaders().getOrDefault(field, List.of());
        return firstNonBlank(row, headers);
    }

    private String text(RawRow row, RowPlan plan, CanonicalField field) {
        return ValueCoercion.emptyToNull(raw(row, plan, field));
    }

    private Double number(RawRow row, RowPlan plan, CanonicalField field) {
        return ValueCoercion.parseNumber(raw(row, plan, field));
    }

    private String firstNonBlank(RawRow row, List<String> headers) {
        for (String header : headers) {
            String value = row.value(header);
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    private void ensureNotCancelled(List<CompletableFuture<ExtractionResult>> pending) {
        if (Thread.currentThread().isInterrupted()) {
            pending.forEach(future -> future.cancel(true));
            throw new CancellationException("Extraction cancelled between chunks");
        }
    }

    private static List<List<RawRow>> partition(List<RawRow> rows, int size) {
        List<List<RawRow>> chunks = new ArrayList<>((rows.size() + size - 1) / size);
        for (int start = 0; start < rows.size(); start += size) {
            chunks.add(rows.subList(start, Math.min(rows.size(), start + size)));
        }
        return chunks;
    }

    /**
     * Per-file lookup plan: which headers feed each field, fallbacks included. Computed once from
     * the header row so every row is evaluated the same way.
     */
    record RowPlan(
            String accountHeader,
            List<String> accountFallback,
            String addressHeader,
            List<String> addressFallback,
            String statusHeader,
            Map<CanonicalField, List<String>> fieldHeaders
    ) {

        static RowPlan of(ColumnMap columnMap) {
            List<String> headers = columnMap.headers();
            String accountHeader = columnMap.header(CanonicalField.ACCOUNT_NUMBER);
            String addressHeader = columnMap.header(CanonicalField.PROPERTY_ADDRESS);

            // Headers claimed by another field (TOT_PERCAN, MAILING ADDRESS) are never fallback candidates.
            List<String> accountFallback = new ArrayList<>();
            Set<String> notAccount = claimedExcept(columnMap, CanonicalField.ACCOUNT_NUMBER);
            addMatching(accountFallback, headers, notAccount,
                    h -> h.equals(IngestConstants.ACCOUNT_FALLBACK_TOKEN));
            addMatching(accountFallback, headers, notAccount,
                    h -> h.contains(IngestConstants.ACCOUNT_FALLBACK_TOKEN));

            List<String> addressFallback = new ArrayList<>();
            Set<String> notAddress = claimedExcept(columnMap, CanonicalField.PROPERTY_ADDRESS);
            addMatching(addressFallback, headers, notAddress,
                    h -> h.contains(IngestConstants.ADDRESS_STRING_FALLBACK_TOKEN));
            addMatching(addressFallback, headers, notAddress,
                    h -> h.contains(IngestConstants.ADDRESS_FALLBACK_TOKEN));

            String statusHeader = null;
            for (String header : headers) {
                if (header != null && header.trim().toUpperCase(Locale.ROOT).equals(IngestConstants.LEGAL_STATUS_HEADER)) {
                    statusHeader = header;
                    break;
                }
            }

            Map<CanonicalField, List<String>> fieldHeaders = new EnumMap<>(CanonicalField.class);
            for (CanonicalField field : CanonicalField.values()) {
                String mapped = columnMap.header(field);
                if (mapped != null) {
                    fieldHeaders.put(field, List.of(mapped));
                } else {
                    fieldHeaders.put(field, genericFallback(columnMap, field));
                }
            }

            return new RowPlan(accountHeader, List.copyOf(accountFallback), addressHeader,
                    List.copyOf(addressFallback), statusHeader, fieldHeaders);
        }

        private static List<String> genericFallback(ColumnMap columnMap, CanonicalField field) {
            List<String> headers = columnMap.headers();
            String key = HeaderText.normalize(field.key());
            List<String> matches = new ArrayList<>();
            String upperKey = key.toUpperCase(Locale.ROOT);
            Set<String> claimed = claimedExcept(columnMap, field);
            addMatching(matches, headers, claimed, h -> h.equals(upperKey));
            addMatching(matches, headers, claimed, h -> h.contains(upperKey));
            return List.copyOf(matches);
        }

        private static Set<String> claimedExcept(ColumnMap columnMap, CanonicalField field) {
            Set<String> claimed = new HashSet<>();
            for (Map.Entry<CanonicalField, ColumnMatch> entry : columnMap.matches().entrySet()) {
                if (entry.getKey() != field) {
                    claimed.add(entry.getValue().header());
                }
            }
            return claimed;
        }

        private static void addMatching(List<String> target, List<String> headers, Set<String> exclude,
                                        Predicate<String> normalizedUpperTest) {
            for (String header : headers) {
                if (HeaderText.isPlaceholder(header) || exclude.contains(header) || target.contains(header)) {
                    continue;
                }
                String normalized = HeaderText.normalizeUpper(header);
                if (!normalized.isEmpty() && normalizedUpperTest.test(normalized)) {
                    target.add(header);
                }
            }
        }
    }
}
