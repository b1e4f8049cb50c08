package br.edu.ifba.meetingrag.embedding.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

@RegisterForReflection
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EmbeddingRequest {

    private String model;
    private List<String> input;
    private Integer dimensions;

    // Default constructor for Jackson
    public EmbeddingRequest() {
    }

    public EmbeddingRequest(final String model, final List<String> input, final Integer dimensions) {
        this.model = model;
        this.input = input;
        this.dimensions = dimensions;
    }

    public String getModel() {
        return model;
    }

    public void setModel(final String model) {
        this.model = model;
    }

    public List<String> getInput() {
        return input;
    }

    public void setInput(final List<String> input) {
        this.input = input;
    }

    public Integer getDimensions() {
        return dimensions;
    }

    public void setDimensions(final Integer dimensions) {
        this.dimensions = dimensions;
    }
}
