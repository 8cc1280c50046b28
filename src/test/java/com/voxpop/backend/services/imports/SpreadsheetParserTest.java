package com.voxpop.backend.services.imports;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SpreadsheetParserTest {

    @TempDir
    Path tempDir;

    private final SpreadsheetParser parser = new SpreadsheetParser();

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void testParseCsv_CommaDelimited() throws IOException {
        // Given
        Path file = write("contatos.csv", "Nome,Telefone,Cidade\nMaria,11987654321,Campinas\nJoão,11912345678,\n");

        // When
        ParsedSheet sheet = parser.parse(file, "contatos.csv");

        // Then
        assertThat(sheet.headers()).containsExactly("Nome", "Telefone", "Cidade");
        assertEquals(2, sheet.size());
        assertThat(sheet.rows().get(0).values()).containsEntry("Nome", "Maria").containsEntry("Cidade", "Campinas");
        assertThat(sheet.rows().get(1).values()).containsEntry("Nome", "João").doesNotContainKey("Cidade");
    }

    @Test
    void testParseCsv_SemicolonDelimitedWithBom() throws IOException {
        Path file = write("export.csv", "\uFEFFNome;Telefone\n\"Silva, Ana\";(11) 98765-4321\n");

        ParsedSheet sheet = parser.parse(file, "export.csv");

        assertThat(sheet.headers()).containsExactly("Nome", "Telefone");
        assertThat(sheet.rows().get(0).values()).containsEntry("Nome", "Silva, Ana").containsEntry("Telefone", "(11) 98765-4321");
    }

    @Test
    void testParseCsv_BlankLinesSkippedButKeepLineNumbers() throws IOException {
        Path file = write("gaps.csv", "Nome,Telefone\nMaria,11987654321\n,\n\nAna,11912345678\n");

        ParsedSheet sheet = parser.parse(file, "gaps.csv");

        assertEquals(2, sheet.size());
        assertThat(sheet.rows()).extracting(ParsedSheet.SheetRow::number).containsExactly(2, 5);
    }

    @Test
    void testParseCsv_MultiLineCellNumberedByFirstLine() throws IOException {
        Path file = write("notes.csv", "Nome,Obs\nMaria,\"linha 1\nlinha 2\"\nAna,ok\n");

        ParsedSheet sheet = parser.parse(file, "notes.csv");

        assertThat(sheet.rows()).extracting(ParsedSheet.SheetRow::number).containsExactly(2, 4);
        assertEquals("linha 1\nlinha 2", sheet.rows().get(0).values().get("Obs"));
    }

    @Test
    void testParseCsv_Windows1252Export() throws IOException {
        // Given a Latin-1 style export, which is not valid UTF-8
        Path file = tempDir.resolve("excel.csv");
        Files.write(file, "Nome;Cidade\nJoão;São Paulo\n".getBytes(Charset.forName("windows-1252")));

        // When
        ParsedSheet sheet = parser.parse(file, "excel.csv");

        // Then
        assertThat(sheet.rows().get(0).values()).containsEntry("Nome", "João").containsEntry("Cidade", "São Paulo");
    }

    @Test
    void testParseCsv_Utf8AccentsReadAsUtf8() throws IOException {
        Path file = write("utf8.csv", "Nome;Cidade\nJoão;São Paulo\n");

        ParsedSheet sheet = parser.parse(file, "utf8.csv");

        assertThat(sheet.rows().get(0).values()).containsEntry("Nome", "João").containsEntry("Cidade", "São Paulo");
    }

    @Test
    void testParseCsv_EmptyFileFails() throws IOException {
        Path file = write("empty.csv", "");

        assertThrows(IOException.class, () -> parser.parse(file, "empty.csv"));
    }

    @Test
    void testParseWorkbook_NumericCellsKeepAllDigits() throws IOException {
        // Given
        Path file = tempDir.resolve("contatos.xlsx");
        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            Sheet sheet = workbook.createSheet("Contatos");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("Nome");
            header.createCell(1).setCellValue("Telefone");
            Row row = sheet.createRow(1);
            row.createCell(0).setCellValue("Maria");
            row.createCell(1).setCellValue(11987654321d);
            workbook.write(out);
        }

        // When
        ParsedSheet sheet = parser.parse(file, "contatos.xlsx");

        // Then
        assertThat(sheet.headers()).containsExactly("Nome", "Telefone");
        assertThat(sheet.rows().get(0).values()).containsEntry("Nome", "Maria").containsEntry("Telefone", "11987654321");
    }

    @Test
    void testParseWorkbook_RowNumbersSkipEmptyRows() throws IOException {
        // Given rows 2 and 4 filled, row 3 never created
        Path file = tempDir.resolve("gaps.xlsx");
        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            Sheet sheet = workbook.createSheet("Contatos");
            sheet.createRow(0).createCell(0).setCellValue("Nome");
            sheet.createRow(1).createCell(0).setCellValue("Maria");
            sheet.createRow(3).createCell(0).setCellValue("Ana");
            workbook.write(out);
        }

        // When
        ParsedSheet sheet = parser.parse(file, "gaps.xlsx");

        // Then
        assertThat(sheet.rows()).extracting(ParsedSheet.SheetRow::number).containsExactly(2, 4);
    }

    @Test
    void testParseWorkbook_CorruptFileFails() throws IOException {
        Path file = write("broken.xlsx", "not a workbook");

        assertThrows(IOException.class, () -> parser.parse(file, "broken.xlsx"));
    }

    @Test
    void testParse_UnsupportedExtension() throws IOException {
        Path file = write("notes.txt", "hello");

        assertThrows(IOException.class, () -> parser.parse(file, "notes.txt"));
    }

    @Test
    void testExtensionOf() {
        assertEquals("xlsx", SpreadsheetParser.extensionOf("Lista.Final.XLSX"));
        assertEquals("", SpreadsheetParser.extensionOf("README"));
        assertEquals("", SpreadsheetParser.extensionOf(null));
    }
}
