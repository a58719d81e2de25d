package ca.uwaterloo.swag.flowlens.phases;

import ca.uwaterloo.swag.flowlens.util.CSyntax;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link SyntaxChecker} reports unbalanced delimiters and unterminated string literals. The diagnostics are
 * informational and do not feed into any other phase.
 *
 * @since 0.0.1
 */
public class SyntaxChecker {

    private final List<String> sourceLines;

    public SyntaxChecker(List<String> sourceLines) {
        this.sourceLines = sourceLines;
    }

    public List<String> check() {
        List<String> syntaxErrors = new ArrayList<>();
        int braceCount = 0;
        int parenCount = 0;
        int bracketCount = 0;

        for (int i = 0; i < sourceLines.size(); i++) {
            String line = sourceLines.get(i);
            if (CSyntax.isNonStatement(line)) {
                continue;
            }
            braceCount += CSyntax.count(line, '{') - CSyntax.count(line, '}');
            parenCount += CSyntax.count(line, '(') - CSyntax.count(line, ')');
            bracketCount += CSyntax.count(line, '[') - CSyntax.count(line, ']');

            if (CSyntax.count(line, '"') % 2 != 0) {
                syntaxErrors.add("Line " + (i + 1) + ": Unterminated string");
            }
        }

        if (braceCount != 0) {
            syntaxErrors.add("Unmatched braces: " + Math.abs(braceCount) + " extra");
        }
        if (parenCount != 0) {
            syntaxErrors.add("Unmatched parentheses: " + Math.abs(parenCount) + " extra");
        }
        if (bracketCount != 0) {
            syntaxErrors.add("Unmatched brackets: " + Math.abs(bracketCount) + " extra");
        }
        return syntaxErrors;
    }
}
