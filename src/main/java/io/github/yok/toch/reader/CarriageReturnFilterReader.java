package io.github.yok.toch.reader;

import java.io.FilterReader;
import java.io.IOException;
import java.io.Reader;

/**
 * Reader that drops every carriage-return character, including those inside quoted fields.
 *
 * @author Yasuharu.Okawauchi
 */
public class CarriageReturnFilterReader extends FilterReader {

    /**
     * Wraps the given reader.
     *
     * @param in underlying reader
     */
    public CarriageReturnFilterReader(Reader in) {
        super(in);
    }

    @Override
    public int read() throws IOException {
        int c;
        do {
            c = super.read();
        } while (c == '\r');
        return c;
    }

    @Override
    public int read(char[] cbuf, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }
        int n;
        do {
            n = super.read(cbuf, off, len);
            if (n < 0) {
                return n;
            }
            int w = off;
            for (int i = off; i < off + n; i++) {
                if (cbuf[i] != '\r') {
                    cbuf[w++] = cbuf[i];
                }
            }
            n = w - off;
            // a chunk made only of CRs yields nothing; read again
        } while (n == 0);
        return n;
    }
}
