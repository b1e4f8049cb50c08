package br.edu.ifba.meetingrag.chunking;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jboss.logging.Logger;
import org.jetbrains.annotations.Nullable;

import br.edu.ifba.meetingrag.chunking.ChunkPacker.Draft;
import br.edu.ifba.meetingrag.chunking.ChunkPacker.Piece;
import br.edu.ifba.meetingrag.chunking.TranscriptParser.ParsedTranscript;
import br.edu.ifba.meetingrag.extraction.EntityExtractor;
import br.edu.ifba.meetingrag.extraction.ExtractedEntity;
import br.edu.ifba.meetingrag.extraction.ExtractionResult;
import br.edu.ifba.meetingrag.utils.TokenUtil;

/**
 * Splits a document into ordered chunks and links them into a relationship graph.
 *
 * <p>Every non-empty document yields a full-document chunk at position 0 followed by
 * the finer-grained chunks of the selected strategies, in this order: time windows,
 * speaker turns, topic segments. With {@link SegmentationStrategy#AUTO} the time
 * strategy runs when the text carries usable timestamps and the speaker strategy runs
 * when it carries speaker labels; the topic strategy is the fallback whenever nothing
 * else produced a chunk, including when markup detection or a strategy fails.</p>
 *
 * <p>Segmentation is single-threaded and deterministic: the same input and config always
 * produce the same positions, ids and relationships.</p>
 */
public class Segmenter {

    private static final Logger LOG = Logger.getLogger(Segmenter.class);

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t\\x0B\\f\\r]*\\n");
    private static final Pattern HEADER = Pattern.compile("^\\s{0,3}#{1,6}\\s+(.+?)\\s*#*\\s*$", Pattern.MULTILINE);

    private final EntityExtractor extractor;
    private final TranscriptParser parser = new TranscriptParser();

    public Segmenter(final EntityExtractor extractor) {
        this.extractor = extractor;
    }

    /**
     * Segments {@code content} of document {@code documentId}.
     *
     * @return chunks and relationships; empty for null or blank content
     */
    public SegmentationResult segment(final String documentId, final String content, final SegmentationConfig config) {
        if (content == null || content.isBlank()) {
            return SegmentationResult.empty();
        }

        final String normalized = content.replace("\r\n", "\n");
        final ParsedTranscript parsed = parseOrEmpty(documentId, normalized);

        final SegmentationConfig effective = config.forDuration(parsed.durationSeconds());
        final ChunkPacker packer = new ChunkPacker(effective);

        final List<Segment> segments = new ArrayList<>();
        final List<ChunkType> strategies = new ArrayList<>();
        final SegmentationStrategy strategy = effective.strategy();

        if ((strategy == SegmentationStrategy.AUTO || strategy == SegmentationStrategy.TIME_WINDOW)
                && parsed.hasTimeMarkup()) {
            addStrategy(documentId, ChunkType.TIME_WINDOW, () -> timeWindows(parsed, effective, packer),
                segments, strategies);
        }
        if ((strategy == SegmentationStrategy.AUTO || strategy == SegmentationStrategy.SPEAKER_TURN)
                && parsed.hasSpeakerMarkup()) {
            addStrategy(documentId, ChunkType.SPEAKER_TURN, () -> speakerTurns(parsed, packer),
                segments, strategies);
        }
        if (segments.isEmpty()) {
            if (strategy != SegmentationStrategy.AUTO && strategy != SegmentationStrategy.TOPIC) {
                LOG.debugf("No %s markup in document %s, using paragraph fallback", strategy, documentId);
            }
            segments.addAll(topicSegments(normalized, packer));
            strategies.add(ChunkType.TOPIC_SEGMENT);
        }

        final Segment full = new Segment(ChunkType.FULL_DOCUMENT, content, null,
            firstTimestamp(parsed), lastTimestamp(parsed), TokenUtil.estimateTokens(content), null);

        final List<Segment> ordered = new ArrayList<>(segments.size() + 1);
        ordered.add(full);
        ordered.addAll(segments);

        final SegmentationResult result = assemble(documentId, ordered, strategies, effective);
        LOG.debugf("Segmented document %s into %d chunks (%s) with %d relationships",
            documentId, Integer.valueOf(result.chunks().size()), strategies,
            Integer.valueOf(result.relationships().size()));
        return result;
    }

    private ParsedTranscript parseOrEmpty(final String documentId, final String content) {
        try {
            return parser.parse(content);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Markup detection failed for document %s, using paragraph fallback", documentId);
            return new ParsedTranscript(List.of());
        }
    }

    private void addStrategy(final String documentId, final ChunkType type, final StrategyRun run,
            final List<Segment> segments, final List<ChunkType> strategies) {
        try {
            final List<Segment> produced = run.segments();
            if (!produced.isEmpty()) {
                segments.addAll(produced);
                strategies.add(type);
            }
        } catch (RuntimeException e) {
            LOG.warnf(e, "%s segmentation failed for document %s, skipping strategy", type.label(), documentId);
        }
    }

    List<Segment> timeWindows(final ParsedTranscript parsed, final SegmentationConfig config,
            final ChunkPacker packer) {
        final List<TranscriptLine> lines = parsed.lines();
        final Integer first = firstTimestamp(parsed);
        if (first == null) {
            return List.of();
        }

        // untimed lines inherit the preceding timestamp, leading ones the first
        final int[] offsets = new int[lines.size()];
        int current = first;
        for (int i = 0; i < lines.size(); i++) {
            final TranscriptLine line = lines.get(i);
            if (line.hasTimestamp()) {
                current = line.offsetSeconds();
            }
            offsets[i] = current;
        }
        final int last = offsets[offsets.length - 1];

        final int window = config.timeWindowSeconds();
        final int step = window - config.timeOverlapSeconds();
        final List<Segment> segments = new ArrayList<>();
        String currentSpeaker = null;
        final String[] speakers = new String[lines.size()];
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).hasSpeaker()) {
                currentSpeaker = lines.get(i).speaker();
            }
            speakers[i] = currentSpeaker;
        }

        for (long windowStart = first; windowStart <= last; windowStart += step) {
            final long windowEnd = windowStart + window;
            final List<Piece> pieces = new ArrayList<>();
            for (int i = 0; i < lines.size(); i++) {
                if (offsets[i] >= windowStart && offsets[i] < windowEnd) {
                    pieces.add(new Piece(lines.get(i).text(), speakers[i], Integer.valueOf(offsets[i]), false, false));
                }
            }
            if (pieces.isEmpty()) {
                continue;
            }

            final String text = joinPieces(pieces, "\n");
            final int tokens = TokenUtil.estimateTokens(text);
            if (tokens <= config.maxTokens()) {
                final Draft draft = new Draft(text, tokens, pieces);
                segments.add(new Segment(ChunkType.TIME_WINDOW, text, draft.primarySpeaker(),
                    Integer.valueOf((int) windowStart), Integer.valueOf((int) windowEnd), tokens, null));
            } else {
                for (final Draft draft : packer.pack(pieces, "\n", false)) {
                    segments.add(new Segment(ChunkType.TIME_WINDOW, draft.content(), draft.primarySpeaker(),
                        draft.startSeconds(), draft.endSeconds(), draft.tokenCount(), null));
                }
            }
        }
        return segments;
    }

    List<Segment> speakerTurns(final ParsedTranscript parsed, final ChunkPacker packer) {
        final List<Piece> pieces = new ArrayList<>();
        String speaker = null;
        for (final TranscriptLine line : parsed.lines()) {
            final boolean changed = line.hasSpeaker() && speaker != null && !line.speaker().equals(speaker);
            if (line.hasSpeaker()) {
                speaker = line.speaker();
            }
            pieces.add(new Piece(line.text(), speaker, line.offsetSeconds(), changed, false));
        }

        final List<Segment> segments = new ArrayList<>();
        for (final Draft draft : packer.pack(pieces, "\n", true)) {
            segments.add(new Segment(ChunkType.SPEAKER_TURN, draft.content(), draft.primarySpeaker(),
                draft.startSeconds(), draft.endSeconds(), draft.tokenCount(), null));
        }
        return segments;
    }

    List<Segment> topicSegments(final String content, final ChunkPacker packer) {
        final List<Piece> pieces = new ArrayList<>();
        for (final String paragraph : PARAGRAPH_BREAK.split(content)) {
            final String trimmed = paragraph.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            final boolean header = HEADER.matcher(trimmed).lookingAt();
            pieces.add(new Piece(trimmed, null, null, header, false));
        }

        final List<Segment> segments = new ArrayList<>();
        for (final Draft draft : packer.pack(pieces, "\n\n", true)) {
            segments.add(new Segment(ChunkType.TOPIC_SEGMENT, draft.content(), null, null, null,
                draft.tokenCount(), heading(draft)));
        }
        return segments;
    }

    private SegmentationResult assemble(final String documentId, final List<Segment> segments,
            final List<ChunkType> strategies, final SegmentationConfig config) {
        final ImportanceScorer scorer = new ImportanceScorer(config.targetTokens());
        final String fullId = chunkId(documentId, 0);

        final List<Chunk> chunks = new ArrayList<>(segments.size());
        final List<ExtractedEntity> allEntities = new ArrayList<>();
        boolean truncated = false;

        for (int position = 0; position < segments.size(); position++) {
            final Segment segment = segments.get(position);
            final String id = chunkId(documentId, position);

            final ExtractionResult extraction = extractor.analyze(segment.content());
            truncated |= extraction.truncated();
            final List<ExtractedEntity> entities = new ArrayList<>(extraction.entities().size());
            for (final ExtractedEntity entity : extraction.entities()) {
                entities.add(entity.withSourceChunk(id));
            }
            allEntities.addAll(entities);

            final Set<String> topics = new LinkedHashSet<>();
            if (segment.heading() != null) {
                topics.add(segment.heading());
            }
            topics.addAll(extraction.topics());

            final double importance = scorer.score(segment.type(), segment.content(), segment.tokenCount(), entities);
            chunks.add(new Chunk(
                id,
                documentId,
                position,
                segment.type(),
                segment.content(),
                segment.speaker(),
                segment.startSeconds(),
                segment.endSeconds(),
                segment.tokenCount(),
                importance,
                List.copyOf(topics),
                entities,
                null,
                null,
                position == 0 ? null : chunkId(documentId, position - 1),
                position == segments.size() - 1 ? null : chunkId(documentId, position + 1),
                segment.type() == ChunkType.FULL_DOCUMENT ? null : fullId));
        }

        final RelationshipBuilder relationships = new RelationshipBuilder(config.topicSimilarityThreshold());
        return new SegmentationResult(chunks, relationships.build(chunks),
            EntityExtractor.deduplicate(allEntities), strategies, truncated);
    }

    static String chunkId(final String documentId, final int position) {
        return documentId + "_" + position;
    }

    private static String joinPieces(final List<Piece> pieces, final String separator) {
        final StringBuilder text = new StringBuilder();
        for (final Piece piece : pieces) {
            if (text.length() > 0) {
                text.append(separator);
            }
            text.append(piece.text());
        }
        return text.toString();
    }

    @Nullable
    private static String heading(final Draft draft) {
        for (final Piece piece : draft.pieces()) {
            final Matcher matcher = HEADER.matcher(piece.text());
            if (piece.boundary() && matcher.lookingAt()) {
                return matcher.group(1).trim();
            }
        }
        return null;
    }

    @Nullable
    private static Integer firstTimestamp(final ParsedTranscript parsed) {
        for (final TranscriptLine line : parsed.lines()) {
            if (line.hasTimestamp()) {
                return line.offsetSeconds();
            }
        }
        return null;
    }

    @Nullable
    private static Integer lastTimestamp(final ParsedTranscript parsed) {
        final List<TranscriptLine> lines = parsed.lines();
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (lines.get(i).hasTimestamp()) {
                return lines.get(i).offsetSeconds();
            }
        }
        return null;
    }

    @FunctionalInterface
    private interface StrategyRun {
        List<Segment> segments();
    }

    /**
     * Chunk content before positions, ids and entities are assigned.
     */
    record Segment(ChunkType type, String content, @Nullable String speaker, @Nullable Integer startSeconds,
            @Nullable Integer endSeconds, int tokenCount, @Nullable String heading) {
    }
}
