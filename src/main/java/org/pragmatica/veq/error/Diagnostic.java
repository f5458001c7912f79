package org.pragmatica.veq.error;

import com.google.common.collect.ImmutableList;
import org.pragmatica.veq.tree.SourceSpan;

import java.util.List;

/**
 * Rich diagnostic message for Rust-style error reporting.
 *
 * <p>Example output:
 * <pre>
 * error[E0003]: Unknown identifier 'q' at position 4
 *   --> equation:1:5
 *   |
 * 1 | x + q
 *   |     ^ not a variable, constant or function
 *   |
 *   = help: variables are x and t, constants are pi, e and g
 * </pre>
 *
 * @param code    Error code (e.g., "E0001")
 * @param message Primary error message
 * @param span    Columns the error refers to
 * @param label   Text printed next to the underline, may be empty
 * @param notes   Additional notes or suggestions
 */
public record Diagnostic(
    String code,
    String message,
    SourceSpan span,
    String label,
    List<String> notes
) {
    public Diagnostic {
        notes = ImmutableList.copyOf(notes);
    }

    /**
     * Build the diagnostic describing a syntax error.
     */
    public static Diagnostic of(SyntaxError error) {
        if (error instanceof LexError lex) {
            return new Diagnostic("E0001", lex.message(), SourceSpan.of(lex.position(), lex.position() + 1),
                                  "not part of the equation syntax", List.of())
                .withHelp("operators are + - * / ^ %, numbers look like 12 or 3.5");
        }
        if (error instanceof ParseError.UnexpectedToken unexpected) {
            return new Diagnostic("E0002", unexpected.message(),
                                  SourceSpan.of(unexpected.position(), unexpected.position() + unexpected.found().length()),
                                  "expected " + unexpected.expected(), List.of());
        }
        if (error instanceof ParseError.UnexpectedEnd end) {
            return new Diagnostic("E0002", end.message(), SourceSpan.at(end.position()),
                                  "expected " + end.expected(), List.of());
        }
        if (error instanceof ParseError.UnknownIdentifier unknown) {
            return new Diagnostic("E0003", unknown.message(),
                                  SourceSpan.of(unknown.position(), unknown.position() + unknown.name().length()),
                                  "not a variable, constant or function", List.of())
                .withHelp("variables are x and t, constants are pi, e and g");
        }
        if (error instanceof ParseError.UnmatchedParenthesis unmatched) {
            return new Diagnostic("E0004", unmatched.message(), SourceSpan.of(unmatched.position(), unmatched.position() + 1),
                                  "no matching '('", List.of());
        }
        if (error instanceof ParseError.TooDeeplyNested nested) {
            return new Diagnostic("E0005", nested.message(), SourceSpan.of(nested.position(), nested.position() + 1),
                                  "nesting limit reached here", List.of());
        }
        var tooLong = (ParseError.InputTooLong) error;
        return new Diagnostic("E0006", tooLong.message(), SourceSpan.at(0), "", List.of());
    }

    /**
     * Add a note.
     */
    public Diagnostic withNote(String note) {
        var newNotes = ImmutableList.<String>builder()
                                    .addAll(notes)
                                    .add(note)
                                    .build();
        return new Diagnostic(code, message, span, label, newNotes);
    }

    /**
     * Add a help suggestion.
     */
    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic in Rust style.
     *
     * @param source   The equation text
     * @param filename Name shown in the location line, or null
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        // Header: error[E0001]: message
        sb.append("error[").append(code).append("]: ").append(message).append("\n");

        // Locate the line holding the span start
        int lineIndex = 0;
        int lineStart = 0;
        int offset = Math.min(span.start(), source.length());
        while (lineIndex < lines.length - 1 && lineStart + lines[lineIndex].length() < offset) {
            lineStart += lines[lineIndex].length() + 1;
            lineIndex++;
        }
        int lineNum = lineIndex + 1;
        int column = offset - lineStart;

        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(lineNum).append(":").append(column + 1).append("\n");

        int gutterWidth = String.valueOf(lineNum).length();
        var gutter = " ".repeat(gutterWidth);

        sb.append(gutter).append(" |\n");
        sb.append(lineNum).append(" | ").append(lines[lineIndex]).append("\n");

        // Underline, at least one caret even for zero-width spans
        int underlineLen = Math.max(1, span.length());
        sb.append(gutter).append(" | ")
          .append(" ".repeat(column))
          .append("^".repeat(underlineLen));
        if (!label.isEmpty()) {
            sb.append(" ").append(label);
        }
        sb.append("\n");

        sb.append(gutter).append(" |\n");

        for (var note : notes) {
            sb.append(gutter).append(" = ").append(note).append("\n");
        }

        return sb.toString();
    }
}
