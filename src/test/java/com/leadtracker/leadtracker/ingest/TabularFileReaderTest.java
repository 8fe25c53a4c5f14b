package com.leadtracker.leadtracker.ingest;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TabularFileReaderTest {

    private final TabularFileReader reader = new TabularFileReader(new IngestProperties());

    @Test
    void shouldFindHeaderBelowCountyTitleRows() {
        byte[] csv = csv(
                "Bexar County Delinquent Tax Roll,,,",
                "Run date 02/01/2025,,,",
                "CAN,OWNER NAME,ADDRSTRING,LEGALSTATUS",
                "100500,Jane Doe,123 Oak St,P",
                ",,,",
                "100501,John Roe,125 Oak St,A"
        );

        TabularData data = reader.read("roll.csv", csv);

        assertEquals(2, data.headerRowIndex());
        assertEquals(List.of("CAN", "OWNER NAME", "ADDRSTRING", "LEGALSTATUS"), data.headers());
        assertEquals(2, data.rows().size());
        assertEquals(3, data.rows().get(0).rowIndex());
        assertEquals(5, data.rows().get(1).rowIndex());
        assertEquals("John Roe", data.rows().get(1).value("OWNER NAME"));
    }

    @Test
    void shouldUseFirstRowWhenItIsTheHeader() {
        byte[] csv = csv(
                "CAN,OWNER NAME",
                "1,A",
                "2,B",
                "3,C"
        );

        TabularData data = reader.read("plain.csv", csv);

        assertEquals(0, data.headerRowIndex());
        assertEquals(3, data.rows().size());
        assertEquals("1", data.rows().get(0).value("CAN"));
    }

    @Test
    void shouldNameBlankAndDuplicateHeaders() {
        byte[] csv = csv(
                "CAN,,Amount,Amount",
                "7,x,1,2"
        );

        TabularData data = reader.read("dupes.csv", csv);

        assertEquals(List.of("CAN", "__EMPTY_1", "Amount", "Amount_2"), data.headers());
        assertEquals("2", data.rows().get(0).value("Amount_2"));
    }

    @Test
    void shouldReadFirstSheetOfWorkbook() throws IOException {
        byte[] xlsx;
        try (Workbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet("Roll");
            sheet.createRow(0).createCell(0).setCellValue("Delinquent Tax Roll");
            Row header = sheet.createRow(2);
            header.createCell(0).setCellValue("CAN");
            header.createCell(1).setCellValue("TOT_PERCAN");
            header.createCell(2).setCellValue("LEGALSTATUS");
            Row data = sheet.createRow(3);
            data.createCell(0).setCellValue("900");
            data.createCell(1).setCellValue(12.5);
            data.createCell(2).setCellValue("A");
            workbook.write(out);
            xlsx = out.toByteArray();
        }

        TabularData data = reader.read("roll.xlsx", xlsx);

        assertEquals(2, data.headerRowIndex());
        assertEquals(1, data.rows().size());
        assertEquals("900", data.rows().get(0).value("CAN"));
        assertEquals("12.5", data.rows().get(0).value("TOT_PERCAN"));
        assertEquals(3, data.rows().get(0).rowIndex());
    }

    @Test
    void shouldRejectUnsupportedOrEmptyInput() {
        assertThrows(IllegalArgumentException.class, () -> reader.read("roll.pdf", new byte[]{1}));
        assertThrows(IllegalArgumentException.class, () -> reader.read("roll.csv", new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> reader.read(" ", new byte[]{1}));
        assertThrows(IllegalStateException.class, () -> reader.read("blank.csv", csv(",,", ",,", ",,")));
    }

    private static byte[] csv(String... lines) {
        return String.join("\n", lines).getBytes(StandardCharsets.UTF_8);
    }
}
