package com.ai.codescope.service;

import com.ai.codescope.config.CodescopeProperties;
import com.ai.codescope.model.BudgetUnit;
import org.springframework.stereotype.Service;

/**
 * Measures text in a budget unit. The token figure is an estimate
 * ({@code ceil(utf8Bytes / bytesPerToken)}), not a tokenizer-exact count.
 */
@Service
public class TokenEstimator {

    private final int bytesPerToken;

    public TokenEstimator(CodescopeProperties properties) {
        this.bytesPerToken = Math.max(1, properties.getTokens().getBytesPerToken());
    }

    public long measure(String text, BudgetUnit unit) {
        long bytes = utf8Length(text);
        return unit == BudgetUnit.BYTES ? bytes : estimateTokens(bytes);
    }

    public long estimateTokens(long bytes) {
        return (bytes + bytesPerToken - 1) / bytesPerToken;
    }

    /**
     * UTF-8 encoded length without materialising the bytes.
     */
    public static long utf8Length(String text) {
        if (text == null) {
            return 0;
        }
        long bytes = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            bytes += utf8Width(cp);
            i += Character.charCount(cp);
        }
        return bytes;
    }

    /**
     * Longest prefix of {@code text} that fits in {@code maxBytes}, cut after the last complete
     * line when there is one.
     */
    public static String truncateToBytes(String text, long maxBytes) {
        if (utf8Length(text) <= maxBytes) {
            return text;
        }
        long bytes = 0;
        int end = 0;
        while (end < text.length()) {
            int cp = text.codePointAt(end);
            int width = utf8Width(cp);
            if (bytes + width > maxBytes) {
                break;
            }
            bytes += width;
            end += Character.charCount(cp);
        }
        int lastNewline = end > 0 ? text.lastIndexOf('\n', end - 1) : -1;
        return lastNewline >= 0 ? text.substring(0, lastNewline + 1) : text.substring(0, end);
    }

    private static int utf8Width(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }
}
