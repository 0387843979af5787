package org.example.questionnaire.logic;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Names a decision point may compare against without a matching node in the
 * diagram: values computed outside the questionnaire ({@code numeric}) and
 * flags raised by other questionnaires ({@code flags}).
 *
 * <pre>{"numeric": ["age_in_months"], "flags": ["malnutrition"]}</pre>
 */
public record ExternalReferences(Set<String> numeric, Set<String> flags) {

    public ExternalReferences {
        numeric = Set.copyOf(numeric);
        flags = Set.copyOf(flags);
    }

    public static ExternalReferences empty() {
        return new ExternalReferences(Set.of(), Set.of());
    }

    public static ExternalReferences load(Path file) throws IOException {
        String text = Files.readString(file, StandardCharsets.UTF_8);
        try {
            return parse(new JSONObject(text));
        } catch (JSONException e) {
            throw new IOException("Invalid externals file '" + file + "': " + e.getMessage(), e);
        }
    }

    public static ExternalReferences parse(JSONObject json) {
        return new ExternalReferences(names(json.optJSONArray("numeric")), names(json.optJSONArray("flags")));
    }

    private static Set<String> names(JSONArray array) {
        Set<String> out = new LinkedHashSet<>();
        if (array == null) return out;
        for (int i = 0; i < array.length(); i++) {
            out.add(array.getString(i));
        }
        return out;
    }

    public boolean isNumeric(String name) {
        return numeric.contains(name);
    }

    public boolean isFlag(String name) {
        return flags.contains(name);
    }
}
