package br.edu.ifba.meetingrag.search;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.jetbrains.annotations.Nullable;

import br.edu.ifba.meetingrag.chunking.ChunkType;

/**
 * Metadata filters shared by semantic and text search. Null or empty means "any".
 *
 * @param from inclusive lower bound on the document date
 * @param to inclusive upper bound on the document date
 * @param tags matches documents carrying at least one of these tags
 * @param chunkTypes restricts results to these chunk types
 */
public record SearchFilters(
    @Nullable Instant from,
    @Nullable Instant to,
    @Nullable String category,
    @Nullable String project,
    @Nullable String department,
    @Nullable String speaker,
    List<String> tags,
    Set<ChunkType> chunkTypes,
    List<String> documentIds
) {

    private static final SearchFilters NONE = new SearchFilters(null, null, null, null, null, null,
        List.of(), Set.of(), List.of());

    public SearchFilters {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        tags = tags == null ? List.of() : List.copyOf(tags);
        chunkTypes = chunkTypes == null ? Set.of() : Set.copyOf(chunkTypes);
        documentIds = documentIds == null ? List.of() : List.copyOf(documentIds);
    }

    public static SearchFilters none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Instant from;
        private Instant to;
        private String category;
        private String project;
        private String department;
        private String speaker;
        private final List<String> tags = new ArrayList<>();
        private final Set<ChunkType> chunkTypes = EnumSet.noneOf(ChunkType.class);
        private final List<String> documentIds = new ArrayList<>();

        private Builder() {
        }

        public Builder from(final Instant value) {
            this.from = value;
            return this;
        }

        public Builder to(final Instant value) {
            this.to = value;
            return this;
        }

        public Builder category(final String value) {
            this.category = value;
            return this;
        }

        public Builder project(final String value) {
            this.project = value;
            return this;
        }

        public Builder department(final String value) {
            this.department = value;
            return this;
        }

        public Builder speaker(final String value) {
            this.speaker = value;
            return this;
        }

        public Builder tag(final String value) {
            this.tags.add(value);
            return this;
        }

        public Builder chunkType(final ChunkType value) {
            this.chunkTypes.add(value);
            return this;
        }

        public Builder documentId(final String value) {
            this.documentIds.add(value);
            return this;
        }

        public SearchFilters build() {
            return new SearchFilters(from, to, category, project, department, speaker, tags, chunkTypes, documentIds);
        }
    }
}
