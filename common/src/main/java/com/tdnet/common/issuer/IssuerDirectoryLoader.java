package com.tdnet.common.issuer;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the JPX listed-issues table (CSV export, UTF-8 with or without BOM).
 */
public class IssuerDirectoryLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(IssuerDirectoryLoader.class);

    static final String COLUMN_CODE = "コード";
    static final String COLUMN_NAME = "銘柄名";
    static final String COLUMN_MARKET = "市場・商品区分";
    static final String COLUMN_SECTOR = "33業種区分";
    static final String COLUMN_SIZE = "規模区分";

    private static final char BOM = '\uFEFF';

    public IssuerDirectory load(Path csvPath) {
        if (csvPath == null || !Files.isRegularFile(csvPath)) {
            LOGGER.warn("Issuer table not found at {}; market filter and issuer lookups are disabled", csvPath);
            return IssuerDirectory.empty();
        }

        Map<String, IssuerInfo> issuers = new LinkedHashMap<>();
        Map<String, String> markets = new HashMap<>();
        try (BufferedReader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8)) {
            reader.mark(1);
            if (reader.read() != BOM) {
                reader.reset();
            }
            try (CSVReader csv = new CSVReader(reader)) {
                String[] header = csv.readNext();
                if (header == null) {
                    return IssuerDirectory.empty();
                }
                Map<String, Integer> columns = indexColumns(header);
                if (!columns.containsKey(COLUMN_CODE)) {
                    throw new IllegalStateException("Issuer table " + csvPath + " has no '" + COLUMN_CODE + "' column");
                }

                String[] row;
                while ((row = csv.readNext()) != null) {
                    String code = IssuerCodes.normalize(cell(row, columns, COLUMN_CODE));
                    if (code.isEmpty()) {
                        continue;
                    }
                    issuers.put(code, new IssuerInfo(
                        code,
                        orUnknown(cell(row, columns, COLUMN_NAME)),
                        orUnknown(cell(row, columns, COLUMN_SECTOR)),
                        SizeClass.normalize(cell(row, columns, COLUMN_SIZE))
                    ));
                    String market = cell(row, columns, COLUMN_MARKET);
                    if (!market.isEmpty()) {
                        markets.put(code, market);
                    }
                }
            }
        } catch (IOException | CsvValidationException e) {
            throw new IllegalStateException("Failed to read issuer table " + csvPath, e);
        }

        LOGGER.info("Loaded {} issuers ({} with market segment) from {}", issuers.size(), markets.size(), csvPath);
        return new IssuerDirectory(issuers, markets);
    }

    private Map<String, Integer> indexColumns(String[] header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            columns.putIfAbsent(header[i].trim(), i);
        }
        return columns;
    }

    private String cell(String[] row, Map<String, Integer> columns, String column) {
        Integer index = columns.get(column);
        if (index == null || index >= row.length || row[index] == null) {
            return "";
        }
        return row[index].trim();
    }

    private String orUnknown(String value) {
        return value.isEmpty() ? IssuerInfo.UNKNOWN : value;
    }
}
