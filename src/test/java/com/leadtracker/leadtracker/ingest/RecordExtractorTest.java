package com.leadtracker.leadtracker.ingest;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecordExtractorTest {

    private static final List<String> COUNTY_HEADERS = List.of("CAN", "OWNER NAME", "ADDRSTRING", "LEGALSTATUS", "TOT_PERCAN");

    private final SchemaResolver resolver = new SchemaResolver();
    private final ExecutorService pool = Executors.newFixedThreadPool(2);

    @AfterEach
    void shutdownPool() {
        pool.shutdownNow();
    }

    @Test
    void shouldExtractCountyExportRow() {
        List<RawRow> rows = List.of(row(3, COUNTY_HEADERS, "100500", "Jane Doe", "123 Oak St", "P", "12.5"));

        ExtractionResult result = extractor(5000).extract(rows, resolver.resolve(COUNTY_HEADERS));

        assertEquals(1, result.properties().size());
        CanonicalProperty property = result.properties().get(0);
        assertEquals("100500", property.accountNumber());
        assertEquals("Jane Doe", property.ownerName());
        assertEquals("123 Oak St", property.propertyAddress());
        assertEquals(PropertyStatus.PENDING, property.status());
        assertEquals(12.5, property.percentageDue());
        assertEquals(3, property.sourceRowIndex());
        assertEquals(0, result.diagnostics().rowsDroppedMissingAccount());
    }

    @Test
    void shouldKeepAccountIdentityWhenAccountHeaderIsNotExact() {
        List<String> headers = List.of("ACCOUNT ID", "OWNER NAME", "ADDRSTRING", "LEGALSTATUS", "TOT_PERCAN");
        List<RawRow> rows = List.of(row(1, headers, "100500", "Jane Doe", "123 Oak St", "P", "12.5"));

        CanonicalProperty property = extractor(5000).extract(rows, resolver.resolve(headers)).properties().get(0);

        assertEquals("100500", property.accountNumber());
        assertEquals(12.5, property.percentageDue());
    }

    @Test
    void shouldDropRowsWithoutAnyAccountNumber() {
        List<RawRow> rows = List.of(
                row(1, COUNTY_HEADERS, "", "Nobody", "1 Elm St", "A", "3"),
                row(2, COUNTY_HEADERS, "200", "Somebody", "2 Elm St", "A", "4")
        );

        ExtractionResult result = extractor(5000).extract(rows, resolver.resolve(COUNTY_HEADERS));

        assertEquals(1, result.properties().size());
        assertEquals("200", result.properties().get(0).accountNumber());
        assertEquals(2, result.diagnostics().rowsRead());
        assertEquals(1, result.diagnostics().rowsDroppedMissingAccount());
    }

    @Test
    void shouldUseCanFallbackWhenMappedAccountIsBlank() {
        List<String> headers = List.of("CAN", "ALT CAN", "OWNER NAME", "ADDRSTRING");
        ColumnMap map = resolver.resolve(headers);
        List<RawRow> rows = List.of(
                row(0, headers, "", "A-17", "Owner One", "17 Birch Ct"),
                row(1, headers, "B-2", "", "Owner Two", "2 Birch Ct")
        );

        ExtractionResult result = extractor(5000).extract(rows, map);

        assertEquals("A-17", result.properties().get(0).accountNumber());
        assertEquals("B-2", result.properties().get(1).accountNumber());
        assertEquals(1, result.diagnostics().accountNumbersFromFallback());
        assertEquals(List.of("status"), result.diagnostics().unresolvedRequiredFields());
        assertEquals(PropertyStatus.UNKNOWN, result.properties().get(0).status());
        assertEquals(2, result.diagnostics().unknownStatusRows());
    }

    @Test
    void shouldFallBackToAddressColumnsAndUnknownDefaults() {
        List<String> headers = List.of("CAN", "SITE ADDRESS TEXT");
        ColumnMap map = new ColumnMap(headers, Map.of(
                CanonicalField.ACCOUNT_NUMBER, new ColumnMatch("CAN", "can", MatchTier.EXACT)));

        ExtractionResult result = extractor(5000).extract(List.of(row(0, headers, "5", "5 Walnut Blvd")), map);

        CanonicalProperty property = result.properties().get(0);
        assertEquals("5 Walnut Blvd", property.propertyAddress());
        assertEquals(IngestConstants.UNKNOWN_VALUE, property.ownerName());
    }

    @Test
    void shouldNotTakeAccountFromHeaderClaimedByAnotherField() {
        List<RawRow> rows = List.of(row(0, COUNTY_HEADERS, "", "Jane Doe", "123 Oak St", "P", "12.5"));

        ExtractionResult result = extractor(5000).extract(rows, resolver.resolve(COUNTY_HEADERS));

        assertTrue(result.properties().isEmpty());
        assertEquals(1, result.diagnostics().rowsDroppedMissingAccount());
    }

    @Test
    void shouldMapStatusByFirstCharacterOnly() {
        List<RawRow> rows = new ArrayList<>();
        String[] raw = {"Pending", "a", " J ", "X", "", "F"};
        for (int i = 0; i < raw.length; i++) {
            rows.add(row(i, COUNTY_HEADERS, "acct-" + i, "o", "a", raw[i], "0"));
        }

        List<CanonicalProperty> properties = extractor(5000).extract(rows, resolver.resolve(COUNTY_HEADERS)).properties();

        assertEquals(PropertyStatus.PENDING, properties.get(0).status());
        assertEquals(PropertyStatus.ACTIVE, properties.get(1).status());
        assertEquals(PropertyStatus.JUDGMENT, properties.get(2).status());
        assertEquals(PropertyStatus.UNKNOWN, properties.get(3).status());
        assertEquals(PropertyStatus.UNKNOWN, properties.get(4).status());
        assertEquals(PropertyStatus.UNKNOWN, properties.get(5).status());
    }

    @Test
    void shouldCoerceExtendedFields() {
        List<String> headers = List.of("CAN", "LEGALSTATUS", "NEW-Total Market Value", "NEW-Exemptions",
                "NEW-Last Payment Date", "NEW-Total Amount Due", "Tax Year", "NEW-Owner Address");
        List<RawRow> rows = List.of(row(0, headers, "42", "J", "$1,250,000.50", "HS, OV65, ,DV",
                "3/15/2024", "not a number", "2023 (certified)", "PO Box 9"));

        CanonicalProperty property = extractor(5000).extract(rows, resolver.resolve(headers)).properties().get(0);

        assertEquals(1_250_000.50, property.marketValue());
        assertEquals(List.of("HS", "OV65", "DV"), property.exemptions());
        assertTrue(property.jurisdictions().isEmpty());
        assertEquals(LocalDate.of(2024, 3, 15), property.lastPaymentDate());
        assertEquals(0.0, property.totalDue());
        assertEquals(2023, property.taxYear());
        assertEquals("PO Box 9", property.ownerAddress());
        assertEquals("PO Box 9", property.mailingAddress());
        assertNull(property.landValue());
    }

    @Test
    void shouldBeIdempotentAndKeepRowOrderAcrossChunks() {
        List<RawRow> rows = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            rows.add(row(i, COUNTY_HEADERS, String.valueOf(1000 + i), "Owner " + i, i + " Main St", i % 2 == 0 ? "P" : "A", "1"));
        }
        ColumnMap map = resolver.resolve(COUNTY_HEADERS);
        RecordExtractor chunked = extractor(3);

        ExtractionResult first = chunked.extract(rows, map);
        ExtractionResult second = chunked.extract(rows, map);

        assertEquals(first, second);
        assertEquals(first.properties(), extractor(5000).extract(rows, map).properties());
        assertEquals("1000", first.properties().get(0).accountNumber());
        assertEquals("1010", first.properties().get(10).accountNumber());
        assertEquals(11, first.diagnostics().rowsRead());
    }

    @Test
    void shouldProduceSameRecordSetForShuffledRows() {
        List<RawRow> rows = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            rows.add(row(i, COUNTY_HEADERS, String.valueOf(i), "o", "a", "P", String.valueOf(i)));
        }
        List<RawRow> shuffled = new ArrayList<>(rows);
        Collections.reverse(shuffled);
        ColumnMap map = resolver.resolve(COUNTY_HEADERS);

        List<CanonicalProperty> forward = new ArrayList<>(extractor(3).extract(rows, map).properties());
        List<CanonicalProperty> backward = new ArrayList<>(extractor(3).extract(shuffled, map).properties());
        Collections.reverse(backward);

        assertEquals(forward, backward);
    }

    @Test
    void shouldAbandonExtractionWhenInterrupted() {
        List<RawRow> rows = List.of(row(0, COUNTY_HEADERS, "1", "o", "a", "P", "1"));
        Thread.currentThread().interrupt();
        try {
            assertThrows(CancellationException.class,
                    () -> extractor(5000).extract(rows, resolver.resolve(COUNTY_HEADERS)));
        } finally {
            Thread.interrupted();
        }
    }

    private RecordExtractor extractor(int chunkSize) {
        IngestProperties properties = new IngestProperties();
        properties.setExtractionChunkSize(chunkSize);
        return new RecordExtractor(properties, pool);
    }

    private static RawRow row(int index, List<String> headers, String... values) {
        Map<String, String> cells = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            cells.put(headers.get(i), i < values.length ? values[i] : "");
        }
        return new RawRow(index, cells);
    }
}
