package br.edu.ifba.meetingrag.utils;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Utility class for token counting and token-bounded text slicing.
 * Uses jtokkit for GPT-compatible token counting.
 *
 * <p>This implementation uses the cl100k_base encoding which is the tokenizer of
 * the text-embedding-3 family, so chunk budgets line up with what the embedding
 * service actually receives.</p>
 */
public final class TokenUtil {

    private static final Logger logger = LoggerFactory.getLogger(TokenUtil.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Fallback approximation when jtokkit is unavailable.
     * Average of ~4 characters per token for English text.
     */
    private static final double AVG_CHARS_PER_TOKEN = 4.0;

    private static volatile Encoding encoding;
    private static volatile boolean initializationFailed = false;

    private TokenUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    @Nullable
    private static Encoding getEncoding() {
        if (encoding == null && !initializationFailed) {
            synchronized (TokenUtil.class) {
                if (encoding == null && !initializationFailed) {
                    try {
                        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
                        encoding = registry.getEncoding(EncodingType.CL100K_BASE);
                        logger.info("Initialized jtokkit with cl100k_base encoding for token counting");
                    } catch (Exception e) {
                        initializationFailed = true;
                        logger.warn("Failed to initialize jtokkit, falling back to approximation: {}", e.getMessage());
                    }
                }
            }
        }
        return encoding;
    }

    /**
     * Counts tokens for a given text using jtokkit.
     * Falls back to character-based approximation if jtokkit is unavailable.
     *
     * @param text the input text
     * @return token count (exact with jtokkit, approximate otherwise)
     */
    public static int estimateTokens(@NotNull String text) {
        if (text.isEmpty()) {
            return 0;
        }

        Encoding enc = getEncoding();
        if (enc != null) {
            try {
                return enc.countTokens(text);
            } catch (Exception e) {
                logger.debug("Token counting failed, using approximation: {}", e.getMessage());
            }
        }

        return estimateTokensApproximate(text);
    }

    /**
     * Estimates token count using character-based approximation.
     *
     * @param text the input text
     * @return approximate token count
     */
    public static int estimateTokensApproximate(@NotNull String text) {
        if (text.isEmpty()) {
            return 0;
        }
        return (int) Math.ceil(text.length() / AVG_CHARS_PER_TOKEN);
    }

    /**
     * Returns the longest prefix of {@code text} holding at most {@code maxTokens} tokens.
     * No ellipsis is appended.
     *
     * @param text the text to cut
     * @param maxTokens token budget
     * @return the prefix, or the text itself when it already fits
     */
    @NotNull
    public static String headTokens(@NotNull String text, int maxTokens) {
        if (maxTokens <= 0) {
            return "";
        }
        Encoding enc = getEncoding();
        if (enc != null) {
            try {
                IntArrayList tokens = enc.encode(text);
                if (tokens.size() <= maxTokens) {
                    return text;
                }
                IntArrayList head = new IntArrayList(maxTokens);
                for (int i = 0; i < maxTokens; i++) {
                    head.add(tokens.get(i));
                }
                return enc.decode(head);
            } catch (Exception e) {
                logger.debug("Exact truncation failed, using approximation: {}", e.getMessage());
            }
        }

        int targetChars = (int) (maxTokens * AVG_CHARS_PER_TOKEN);
        if (targetChars >= text.length()) {
            return text;
        }
        return text.substring(0, targetChars);
    }

    /**
     * Returns the longest suffix of {@code text} holding at most {@code maxTokens} tokens.
     *
     * @param text the text to cut
     * @param maxTokens token budget
     * @return the suffix, or the text itself when it already fits
     */
    @NotNull
    public static String tailTokens(@NotNull String text, int maxTokens) {
        if (maxTokens <= 0) {
            return "";
        }
        Encoding enc = getEncoding();
        if (enc != null) {
            try {
                IntArrayList tokens = enc.encode(text);
                if (tokens.size() <= maxTokens) {
                    return text;
                }
                IntArrayList tail = new IntArrayList(maxTokens);
                for (int i = tokens.size() - maxTokens; i < tokens.size(); i++) {
                    tail.add(tokens.get(i));
                }
                return enc.decode(tail);
            } catch (Exception e) {
                logger.debug("Exact truncation failed, using approximation: {}", e.getMessage());
            }
        }

        int targetChars = (int) (maxTokens * AVG_CHARS_PER_TOKEN);
        if (targetChars >= text.length()) {
            return text;
        }
        return text.substring(text.length() - targetChars);
    }

    /**
     * Counts words in text (simple whitespace-based).
     */
    public static int countWords(@NotNull String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        return WHITESPACE.split(trimmed).length;
    }
}
