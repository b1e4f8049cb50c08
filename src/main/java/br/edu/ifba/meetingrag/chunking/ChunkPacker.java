package br.edu.ifba.meetingrag.chunking;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Nullable;

import br.edu.ifba.meetingrag.utils.TokenUtil;

/**
 * Greedy token-budget packing of ordered text pieces into chunk drafts.
 *
 * <p>Rules, checked in order for every piece:</p>
 * <ol>
 *   <li>if appending the piece would exceed {@code maxTokens}, the current draft is closed;</li>
 *   <li>if the piece starts a boundary (new speaker, new heading) and the draft holds at
 *       least {@code minTokens}, the draft is closed;</li>
 *   <li>if the draft holds at least {@code minTokens} and appending would pass
 *       {@code targetTokens}, the draft is closed;</li>
 *   <li>otherwise the piece is appended.</li>
 * </ol>
 * <p>Pieces are pre-split to at most half the min/max spread, so a draft closed by
 * rule 1 always holds at least {@code minTokens}. Only the last draft may be smaller.</p>
 */
final class ChunkPacker {

    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final SegmentationConfig config;

    ChunkPacker(final SegmentationConfig config) {
        this.config = config;
    }

    List<Draft> pack(final List<Piece> input, final String separator, final boolean carryOverlap) {
        final List<Draft> drafts = new ArrayList<>();
        final List<Piece> pieces = splitOversize(input);

        String text = null;
        int tokens = 0;
        List<Piece> members = new ArrayList<>();

        for (final Piece piece : pieces) {
            if (text == null) {
                text = piece.text();
                tokens = TokenUtil.estimateTokens(text);
                members.add(piece);
                continue;
            }

            final String candidate = text + joiner(piece, separator) + piece.text();
            final int candidateTokens = TokenUtil.estimateTokens(candidate);

            final boolean forced = candidateTokens > config.maxTokens();
            final boolean atBoundary = piece.boundary() && tokens >= config.minTokens();
            final boolean atTarget = tokens >= config.minTokens() && candidateTokens > config.targetTokens();

            if (forced || atBoundary || atTarget) {
                drafts.add(new Draft(text, TokenUtil.estimateTokens(text), members));
                final String seed = carryOverlap && !atBoundary ? overlapSeed(text, piece) : "";
                text = seed.isEmpty() ? piece.text() : seed + joiner(piece, separator) + piece.text();
                tokens = TokenUtil.estimateTokens(text);
                if (tokens > config.maxTokens()) {
                    text = piece.text();
                    tokens = TokenUtil.estimateTokens(text);
                }
                members = new ArrayList<>();
                members.add(piece);
            } else {
                text = candidate;
                tokens = candidateTokens;
                members.add(piece);
            }
        }

        if (text != null) {
            drafts.add(new Draft(text, TokenUtil.estimateTokens(text), members));
        }
        return drafts;
    }

    private String overlapSeed(final String previous, final Piece next) {
        if (config.overlapTokens() <= 0) {
            return "";
        }
        final int budget = Math.min(config.overlapTokens(),
            config.maxTokens() - TokenUtil.estimateTokens(next.text()) - 4);
        if (budget <= 0) {
            return "";
        }
        String tail = TokenUtil.tailTokens(previous, budget);
        if (tail.length() < previous.length()) {
            // drop the partial leading word
            final int firstSpace = indexOfWhitespace(tail);
            tail = firstSpace < 0 ? "" : tail.substring(firstSpace);
        }
        return tail.trim();
    }

    List<Piece> splitOversize(final List<Piece> pieces) {
        final int limit = config.pieceLimit();
        final List<Piece> result = new ArrayList<>(pieces.size());
        for (final Piece piece : pieces) {
            if (TokenUtil.estimateTokens(piece.text()) <= limit) {
                result.add(piece);
                continue;
            }
            final List<String> fragments = splitText(piece.text(), limit);
            for (int i = 0; i < fragments.size(); i++) {
                final boolean first = i == 0;
                result.add(new Piece(fragments.get(i), piece.speaker(), piece.offsetSeconds(),
                    first && piece.boundary(), !first || piece.continuation()));
            }
        }
        return result;
    }

    private static List<String> splitText(final String text, final int limit) {
        final List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (final String sentence : SENTENCE_END.split(text.trim())) {
            if (TokenUtil.estimateTokens(sentence) > limit) {
                flush(current, out);
                current = new StringBuilder();
                out.addAll(splitWords(sentence, limit));
                continue;
            }
            final String candidate = current.length() == 0 ? sentence : current + " " + sentence;
            if (TokenUtil.estimateTokens(candidate) > limit) {
                flush(current, out);
                current = new StringBuilder(sentence);
            } else {
                current = new StringBuilder(candidate);
            }
        }
        flush(current, out);
        return out;
    }

    private static List<String> splitWords(final String sentence, final int limit) {
        final List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (final String word : WHITESPACE.split(sentence.trim())) {
            if (TokenUtil.estimateTokens(word) > limit) {
                flush(current, out);
                current = new StringBuilder();
                // each UTF-8 byte is at most one token
                final int step = Math.max(1, limit / 4);
                for (int start = 0; start < word.length(); start += step) {
                    out.add(word.substring(start, Math.min(word.length(), start + step)));
                }
                continue;
            }
            final String candidate = current.length() == 0 ? word : current + " " + word;
            if (TokenUtil.estimateTokens(candidate) > limit) {
                flush(current, out);
                current = new StringBuilder(word);
            } else {
                current = new StringBuilder(candidate);
            }
        }
        flush(current, out);
        return out;
    }

    private static void flush(final StringBuilder current, final List<String> out) {
        if (current.length() > 0) {
            out.add(current.toString());
        }
    }

    private static String joiner(final Piece piece, final String separator) {
        return piece.continuation() ? " " : separator;
    }

    private static int indexOfWhitespace(final String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Atomic unit of packing: a line, a paragraph or a fragment of an oversized one.
     *
     * @param boundary whether a new chunk should preferably start here
     * @param continuation whether this is a fragment continuing the previous piece
     */
    record Piece(String text, @Nullable String speaker, @Nullable Integer offsetSeconds,
            boolean boundary, boolean continuation) {
    }

    /**
     * A packed chunk before ids and entities are assigned.
     */
    record Draft(String content, int tokenCount, List<Piece> pieces) {

        Draft {
            pieces = List.copyOf(pieces);
        }

        /**
         * Speaker contributing the most text, first seen wins ties.
         */
        @Nullable
        String primarySpeaker() {
            final Map<String, Integer> weights = new LinkedHashMap<>();
            for (final Piece piece : pieces) {
                if (piece.speaker() != null) {
                    weights.merge(piece.speaker(), piece.text().length(), Integer::sum);
                }
            }
            String best = null;
            int bestWeight = -1;
            for (final Map.Entry<String, Integer> entry : weights.entrySet()) {
                if (entry.getValue() > bestWeight) {
                    best = entry.getKey();
                    bestWeight = entry.getValue();
                }
            }
            return best;
        }

        @Nullable
        Integer startSeconds() {
            for (final Piece piece : pieces) {
                if (piece.offsetSeconds() != null) {
                    return piece.offsetSeconds();
                }
            }
            return null;
        }

        @Nullable
        Integer endSeconds() {
            for (int i = pieces.size() - 1; i >= 0; i--) {
                if (pieces.get(i).offsetSeconds() != null) {
                    return pieces.get(i).offsetSeconds();
                }
            }
            return null;
        }
    }
}
