package ai.repocontext.analyzer.agent.tools;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import java.util.List;

/**
 * Tools the analyzer model may invoke. Defined once and shared by every analysis.
 */
public final class ToolCatalog {

    public static final String VIEW_FILE = "view_file";
    public static final String VIEW_FOLDER = "view_folder";
    public static final String GENERATE_SUMMARY = "generate_summary";

    public static final String PATH_ARGUMENT = "path";
    public static final String CONTENT_ARGUMENT = "content";

    private static final List<ToolSpecification> SPECIFICATIONS = List.of(
            tool(VIEW_FILE, "View the contents of a file in the repository",
                    PATH_ARGUMENT, "The path of the file to view"),
            tool(VIEW_FOLDER, "View the contents of a folder in the repository",
                    PATH_ARGUMENT, "The path of the folder to view"),
            tool(GENERATE_SUMMARY, "Generate a summary of the given content",
                    CONTENT_ARGUMENT, "The content to summarize"));

    private ToolCatalog() {
    }

    public static List<ToolSpecification> specifications() {
        return SPECIFICATIONS;
    }

    private static ToolSpecification tool(String name, String description, String argument, String argumentDescription) {
        return ToolSpecification.builder()
                .name(name)
                .description(description)
                .parameters(JsonObjectSchema.builder()
                        .addStringProperty(argument, argumentDescription)
                        .required(argument)
                        .build())
                .build();
    }
}
