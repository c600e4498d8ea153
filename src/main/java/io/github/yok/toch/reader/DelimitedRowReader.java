package io.github.yok.toch.reader;

import io.github.yok.toch.exception.ConfigurationException;
import io.github.yok.toch.exception.SourceAccessException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Row reader for delimited text (tab-delimited and CSV), built on Apache Commons CSV.
 *
 * <p>
 * Input is decoded as UTF-8 and bytes that are not valid UTF-8 (for example text saved in a
 * Windows code page) fail the read with {@link SourceAccessException} instead of being replaced.
 * Carriage returns are removed before parsing, empty lines are ignored
 * and a single quote character suppresses separator and line-break interpretation inside quoted
 * spans (a doubled quote inside a quoted span is a literal quote).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DelimitedRowReader extends AbstractRowReader {

    private final CSVParser parser;
    private final Iterator<CSVRecord> records;
    private long rowNumber;

    /**
     * Creates a reader over the given stream. The stream is closed by {@link #close()}.
     *
     * @param description source description for messages
     * @param in byte stream of the source
     * @param separator field separator
     * @param quote quote character, or {@code null} for no quoting
     * @param skip leading records to discard
     * @throws IOException if the parser cannot be created
     * @throws ConfigurationException if the quote and separator characters conflict
     */
    public DelimitedRowReader(String description, InputStream in, char separator,
            Character quote, int skip) throws IOException {
        super(description, skip);
        CSVFormat format;
        try {
            format = CSVFormat.DEFAULT.builder().setDelimiter(separator).setQuote(quote)
                    .setIgnoreEmptyLines(true).get();
        } catch (IllegalArgumentException e) {
            in.close();
            throw new ConfigurationException("Invalid delimiter/quote combination: "
                    + e.getMessage(), e);
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        this.parser = format.parse(new CarriageReturnFilterReader(
                new BufferedReader(new InputStreamReader(in, decoder))));
        this.records = parser.iterator();
        log.debug("Opened delimited reader: {} (separator={}, quote={}, skip={})", description,
                separator == '\t' ? "TAB" : String.valueOf(separator), quote, skip);
    }

    @Override
    protected List<String> readRecord() throws IOException {
        try {
            if (!records.hasNext()) {
                return null;
            }
            CSVRecord record = records.next();
            rowNumber = record.getRecordNumber();
            return record.toList();
        } catch (UncheckedIOException e) {
            if (e.getCause() instanceof CharacterCodingException) {
                throw new SourceAccessException(getDescription()
                        + " is not valid UTF-8 text after record " + rowNumber, e.getCause());
            }
            throw e.getCause();
        }
    }

    @Override
    protected long currentRowNumber() {
        return rowNumber;
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }
}
