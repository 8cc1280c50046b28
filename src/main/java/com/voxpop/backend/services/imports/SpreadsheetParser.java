package com.voxpop.backend.services.imports;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads an uploaded spreadsheet into a {@link ParsedSheet}: CSV through opencsv (delimiter sniffed from
 * the first lines), .xlsx and .xls through Apache POI (first worksheet only).
 */
@Component
@Slf4j
public class SpreadsheetParser {

    private static final char[] CANDIDATE_DELIMITERS = {',', ';', '\t', '|'};
    private static final int SNIFF_LINES = 5;
    private static final Charset WINDOWS_1252 = Charset.forName("windows-1252");

    private final DataFormatter dataFormatter = new DataFormatter(Locale.ROOT);

    public ParsedSheet parse(Path file, String fileName) throws IOException {
        String extension = extensionOf(fileName);
        switch (extension) {
            case "csv":
                return parseCsv(file);
            case "xlsx":
            case "xls":
                return parseWorkbook(file);
            default:
                throw new IOException("Unsupported file type: " + fileName);
        }
    }

    public static String extensionOf(String fileName) {
        if (fileName == null || !fileName.contains(".")) {
            return "";
        }
        return fileName.substring(fileName.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
    }

    // ===== CSV =====

    ParsedSheet parseCsv(Path file) throws IOException {
        String text = readText(file);
        char delimiter = detectDelimiter(text);

        try (CSVReader csvReader = new CSVReaderBuilder(new StringReader(text))
                .withCSVParser(new CSVParserBuilder().withSeparator(delimiter).build())
                .build()) {

            String[] headerCells = csvReader.readNext();
            if (headerCells == null) {
                throw new IOException("CSV file is empty");
            }
            List<String> headers = new ArrayList<>();
            for (String header : headerCells) {
                headers.add(stripBom(header).trim());
            }

            List<ParsedSheet.SheetRow> rows = new ArrayList<>();
            while (true) {
                // a quoted cell may span lines; the record is numbered by the line it starts on
                int lineNumber = (int) csvReader.getLinesRead() + 1;
                String[] cells = csvReader.readNext();
                if (cells == null) {
                    break;
                }
                Map<String, String> row = toRow(headers, cells);
                if (!row.isEmpty()) {
                    rows.add(new ParsedSheet.SheetRow(lineNumber, row));
                }
            }

            log.debug("Parsed CSV {} with delimiter '{}': {} rows", file.getFileName(), delimiter, rows.size());
            return new ParsedSheet(headers, rows);
        } catch (CsvException e) {
            throw new IOException("Failed to parse CSV: " + e.getMessage(), e);
        }
    }

    /**
     * Decodes the file as UTF-8 and falls back to windows-1252, the default of spreadsheet exports on
     * Brazilian Windows installs, when the bytes are not valid UTF-8.
     */
    String readText(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            log.debug("{} is not valid UTF-8, reading it as windows-1252", file.getFileName());
            return new String(bytes, WINDOWS_1252);
        }
    }

    private char detectDelimiter(String text) {
        Map<Character, Integer> scores = new HashMap<>();

        text.lines().limit(SNIFF_LINES).forEach(line -> {
            for (char delimiter : CANDIDATE_DELIMITERS) {
                int count = line.length() - line.replace(String.valueOf(delimiter), "").length();
                scores.merge(delimiter, count, Integer::sum);
            }
        });

        return scores.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(',');
    }

    private static Map<String, String> toRow(List<String> headers, String[] cells) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int j = 0; j < Math.min(headers.size(), cells.length); j++) {
            String value = cells[j] != null ? cells[j].trim() : "";
            if (!value.isEmpty() && !headers.get(j).isEmpty()) {
                row.put(headers.get(j), value);
            }
        }
        return row;
    }

    private static String stripBom(String value) {
        if (value == null) {
            return "";
        }
        return value.startsWith("\uFEFF") ? value.substring(1) : value;
    }

    // ===== Excel =====

    ParsedSheet parseWorkbook(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file);
             Workbook workbook = WorkbookFactory.create(in)) {

            if (workbook.getNumberOfSheets() == 0) {
                throw new IOException("Workbook has no worksheets");
            }
            Sheet sheet = workbook.getSheetAt(0);
            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                throw new IOException("Workbook has no header row");
            }

            List<String> headers = new ArrayList<>();
            for (int j = 0; j < headerRow.getLastCellNum(); j++) {
                headers.add(cellText(headerRow.getCell(j)).trim());
            }

            List<ParsedSheet.SheetRow> rows = new ArrayList<>();
            for (int i = headerRow.getRowNum() + 1; i <= sheet.getLastRowNum(); i++) {
                Row sheetRow = sheet.getRow(i);
                if (sheetRow == null) {
                    continue;
                }
                String[] cells = new String[headers.size()];
                for (int j = 0; j < headers.size(); j++) {
                    cells[j] = cellText(sheetRow.getCell(j));
                }
                Map<String, String> row = toRow(headers, cells);
                if (!row.isEmpty()) {
                    rows.add(new ParsedSheet.SheetRow(i + 1, row));
                }
            }

            log.debug("Parsed workbook {}: {} rows", file.getFileName(), rows.size());
            return new ParsedSheet(headers, rows);
        } catch (EncryptedDocumentException e) {
            throw new IOException("Workbook is password protected", e);
        } catch (RuntimeException e) {
            // POI reports corrupt files with unchecked exceptions
            throw new IOException("Failed to read workbook: " + e.getMessage(), e);
        }
    }

    private String cellText(Cell cell) {
        if (cell == null) {
            return "";
        }
        if (cell.getCellType() == CellType.NUMERIC) {
            if (DateUtil.isCellDateFormatted(cell)) {
                return cell.getLocalDateTimeCellValue().toLocalDate().toString();
            }
            // Phone numbers and CPFs stored as numbers must not come back as 1.1999999999E10
            return new BigDecimal(String.valueOf(cell.getNumericCellValue())).stripTrailingZeros().toPlainString();
        }
        return dataFormatter.formatCellValue(cell);
    }
}
