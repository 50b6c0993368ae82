package io.github.riemr.mobilepost.infrastructure.source;

import io.github.riemr.mobilepost.application.exception.BatchSourceException;
import io.github.riemr.mobilepost.application.importing.BatchSource;
import io.github.riemr.mobilepost.application.importing.ImportRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.file.transform.DelimitedLineTokenizer;
import org.springframework.batch.item.file.transform.FieldSet;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CSV upload with a header line naming the fields. Quoted values may contain commas.
 * Row index is the line number in the file (header is line 1).
 */
@Slf4j
public class CsvBatchSource implements BatchSource {
    private static final char BOM = '\uFEFF';

    private final String name;
    private final InputStream in;

    public CsvBatchSource(String name, InputStream in) {
        this.name = name;
        this.in = in;
    }

    @Override
    public String describe() {
        return name;
    }

    @Override
    public List<ImportRow> read() {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String header = br.readLine();
            if (header == null || header.isBlank()) {
                throw new BatchSourceException("CSV " + name + " has no header line");
            }
            if (header.charAt(0) == BOM) {
                header = header.substring(1);
            }
            String[] names = new DelimitedLineTokenizer().tokenize(header).getValues();

            DelimitedLineTokenizer tokenizer = new DelimitedLineTokenizer();
            tokenizer.setNames(names);
            tokenizer.setStrict(false);

            List<ImportRow> rows = new ArrayList<>();
            String line;
            int lineNo = 1;
            while ((line = br.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;
                FieldSet fs = tokenizer.tokenize(line);
                Map<String, Object> fields = new LinkedHashMap<>();
                for (String n : names) {
                    fields.put(n, fs.readRawString(n));
                }
                rows.add(new ImportRow(lineNo, fields));
            }
            log.info("Read {} rows from CSV {}", rows.size(), name);
            return rows;
        } catch (IOException e) {
            throw new BatchSourceException("CSV " + name + " could not be read", e);
        }
    }
}
