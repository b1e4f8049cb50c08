package br.edu.ifba.meetingrag.embedding.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

@RegisterForReflection
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmbeddingResponse {

    private String model;
    private List<Embedding> data;

    // Default constructor for Jackson
    public EmbeddingResponse() {
    }

    public EmbeddingResponse(final String model, final List<Embedding> data) {
        this.model = model;
        this.data = data;
    }

    public String getModel() {
        return model;
    }

    public void setModel(final String model) {
        this.model = model;
    }

    public List<Embedding> getData() {
        return data;
    }

    public void setData(final List<Embedding> data) {
        this.data = data;
    }

    @RegisterForReflection
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Embedding {
        private List<Double> embedding;
        private Integer index;

        // Default constructor for Jackson
        public Embedding() {
        }

        public Embedding(final List<Double> embedding, final Integer index) {
            this.embedding = embedding;
            this.index = index;
        }

        public List<Double> getEmbedding() {
            return embedding;
        }

        public void setEmbedding(final List<Double> embedding) {
            this.embedding = embedding;
        }

        public Integer getIndex() {
            return index;
        }

        public void setIndex(final Integer index) {
            this.index = index;
        }
    }
}
