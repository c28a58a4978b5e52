package im.arun.docoutline.service;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.docoutline.model.CollectionJob;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a collection job description. Persona, task and documents may each be given as
 * plain strings or as objects ({@code {"role"}}, {@code {"task"}}, {@code {"filename"}}).
 */
public class CollectionJobParser {

    public CollectionJob parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Job description must be a JSON object");
        }
        String persona = textOf(root.get("persona"), "role");
        String job = textOf(root.get("job_to_be_done"), "task");
        if (persona == null || job == null) {
            throw new IllegalArgumentException("Job description needs both persona and job_to_be_done");
        }

        List<String> documents = new ArrayList<>();
        JsonNode docs = root.path("documents");
        if (docs.isArray()) {
            for (JsonNode doc : docs) {
                String name = textOf(doc, "filename");
                if (name != null && !name.isBlank()) {
                    documents.add(name);
                }
            }
        }
        return new CollectionJob(persona, job, documents);
    }

    private static String textOf(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
