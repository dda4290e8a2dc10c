package DFAMin;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import DFAMin.Model.AutomatonModel;
import DFAMin.Model.InvalidAutomatonException;
import DFAMin.Serialization.AutomatonSerializer;

/**
 * Small automata bundled as resources under {@code examples/}.
 */
public final class ExampleAutomata {
    public static final List<String> NAMES = List.of("binary_even", "divisible_by_3", "contains_01");

    private static final String RESOURCE_DIR = "examples/";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ExampleAutomata() {}

    public static List<String> names() {
        return NAMES;
    }

    public static AutomatonModel load(String name) {
        try (InputStream is = open(name)) {
            return AutomatonSerializer.read(is);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (InvalidAutomatonException e) {
            throw new IllegalStateException("Bundled example '" + name + "' is invalid: " + e.getProblems(), e);
        }
    }

    /**
     * @return "title: description" of a bundled example
     */
    public static String describe(String name) {
        try (InputStream is = open(name)) {
            JsonNode root = MAPPER.readTree(is);
            return root.path("name").asText(name) + ": " + root.path("description").asText("");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static InputStream open(String name) {
        if (!NAMES.contains(name)) {
            throw new IllegalArgumentException("Unknown example '" + name + "', expected one of " + NAMES);
        }
        InputStream is = ExampleAutomata.class.getClassLoader().getResourceAsStream(RESOURCE_DIR + name + ".json");
        if (is == null) {
            throw new IllegalStateException("Missing resource for example '" + name + "'");
        }
        return is;
    }
}
