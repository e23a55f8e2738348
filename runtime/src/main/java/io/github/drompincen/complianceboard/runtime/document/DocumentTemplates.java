package io.github.drompincen.complianceboard.runtime.document;

/**
 * Starter content for new documentation pages. The first page of an empty tree gets the rich
 * template; every other page gets the basic one.
 */
public final class DocumentTemplates {

    public static final String UNTITLED = "Untitled Page";

    private DocumentTemplates() {}

    public static String safeTitle(String title) {
        if (title == null || title.isBlank()) return UNTITLED;
        return title.trim();
    }

    public static String firstPage(String title) {
        return "# " + title + "\n\n"
                + "This is a template. Use placeholders like {field} that our AI agents will fill.\n\n"
                + "## Overview\n"
                + "{Brief overview of this section}\n\n"
                + "## Key Requirements\n"
                + "- {Requirement 1}\n- {Requirement 2}\n- {Requirement 3}\n\n"
                + "## Architecture Diagram\n"
                + "```mermaid\n"
                + "flowchart TD\n"
                + "  A[Start] --> B{Decision}\n"
                + "  B -->|yes| C[Proceed]\n"
                + "  B -->|no| D[Stop]\n"
                + "```\n\n"
                + "## Data Table\n"
                + "| Column | Description | Example |\n"
                + "|--------|-------------|---------|\n"
                + "| {Name} | {What is it} | {Example} |\n\n"
                + "## Steps\n"
                + "1. {Step 1}\n"
                + "2. {Step 2}\n";
    }

    public static String basicPage(String title) {
        return "# " + title + "\n\n"
                + "## Overview\n"
                + "{Brief overview of this section}\n";
    }
}
