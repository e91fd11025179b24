package io.kubetest.manifest;

import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;

/**
 * Search and replace a token in an InputStream.
 */
public class TokenReplacingStream extends InputStream {

    private final PushbackInputStream source;
    private final byte[] token;
    private final byte[] replacement;
    private byte[] pending = new byte[0];
    private int pendingIndex;

    public TokenReplacingStream(InputStream source, byte[] token, byte[] replacement) {
        if (token.length == 0) {
            throw new IllegalArgumentException("Nothing to replace");
        }
        this.source = new PushbackInputStream(source, token.length);
        this.token = token;
        this.replacement = replacement;
    }

    @Override
    public int read() throws IOException {
        while (true) {
            if (pendingIndex < pending.length) {
                return pending[pendingIndex++] & 0xff;
            }
            int b = source.read();
            if (b != (token[0] & 0xff)) {
                return b;
            }
            byte[] candidate = new byte[token.length];
            candidate[0] = token[0];
            int read = 1;
            boolean matched = true;
            while (read < token.length) {
                int c = source.read();
                if (c == -1) {
                    matched = false;
                    break;
                }
                candidate[read++] = (byte) c;
                if (c != (token[read - 1] & 0xff)) {
                    matched = false;
                    break;
                }
            }
            if (!matched) {
                // only the first byte is consumed, the rest may start a match
                source.unread(candidate, 1, read - 1);
                return b;
            }
            pending = replacement;
            pendingIndex = 0;
        }
    }

    @Override
    public void close() throws IOException {
        source.close();
    }
}
