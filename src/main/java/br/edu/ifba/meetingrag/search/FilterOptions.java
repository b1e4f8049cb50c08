package br.edu.ifba.meetingrag.search;

import java.util.List;

/**
 * Distinct filter values present in the store, for building search forms.
 */
public record FilterOptions(
    List<String> categories,
    List<String> projects,
    List<String> departments,
    List<String> speakers,
    List<String> tags
) {

    public FilterOptions {
        categories = List.copyOf(categories);
        projects = List.copyOf(projects);
        departments = List.copyOf(departments);
        speakers = List.copyOf(speakers);
        tags = List.copyOf(tags);
    }
}
