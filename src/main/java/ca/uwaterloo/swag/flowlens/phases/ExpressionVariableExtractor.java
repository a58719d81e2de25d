package ca.uwaterloo.swag.flowlens.phases;

import static ca.uwaterloo.swag.flowlens.util.CSyntax.IDENTIFIER;
import static ca.uwaterloo.swag.flowlens.util.CSyntax.IDENTIFIER_PATTERN;

import ca.uwaterloo.swag.flowlens.models.VariableRecord;
import ca.uwaterloo.swag.flowlens.util.CSyntax;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link ExpressionVariableExtractor} pulls the referenced identifiers out of a free-text C expression fragment.
 * Unbalanced or otherwise malformed fragments are tolerated; constructs that do not match are skipped.
 *
 * @since 0.0.1
 */
public class ExpressionVariableExtractor {

    private static final Pattern DEREFERENCE = Pattern.compile("\\*\\s*(" + IDENTIFIER + ")");
    private static final Pattern CALL = Pattern.compile("\\b" + IDENTIFIER + "\\s*\\(([^)]*)\\)");
    private static final Pattern ARRAY_ACCESS = Pattern.compile("(" + IDENTIFIER + ")\\s*\\[([^\\]]+)\\]");
    private static final Pattern MEMBER_ACCESS = Pattern.compile("\\b(" + IDENTIFIER + ")\\." + IDENTIFIER);
    private static final Pattern STRING_LITERAL = Pattern.compile("\"[^\"]*\"");
    private static final Pattern CHAR_LITERAL = Pattern.compile("'[^']*'");
    private static final Pattern INTEGER_LITERAL = Pattern.compile("\\b\\d+\\b");
    private static final Pattern CALL_SYNTAX = Pattern.compile("\\b" + IDENTIFIER + "\\s*\\([^)]*\\)");
    private static final Pattern ARRAY_SYNTAX = Pattern.compile(IDENTIFIER + "\\s*\\[[^\\]]+\\]");
    private static final List<String> ARGUMENT_STOP_WORDS = Arrays.asList("int", "char", "double", "float",
        "NULL", "sizeof");

    public Set<String> extract(String expression) {
        Set<String> variables = new LinkedHashSet<>();
        if (expression == null || expression.isEmpty()) {
            return variables;
        }
        String fragment = CSyntax.stripLineComment(expression);

        collectDereferences(fragment, variables);
        collectCallArguments(fragment, variables);
        collectArrayAccesses(fragment, variables);
        collectResidualIdentifiers(fragment, variables);

        variables.removeAll(CSyntax.C_KEYWORDS);
        return variables;
    }

    private void collectDereferences(String fragment, Set<String> variables) {
        Matcher matcher = DEREFERENCE.matcher(fragment);
        while (matcher.find()) {
            addDereference(matcher.group(1), variables);
        }
    }

    private void collectCallArguments(String fragment, Set<String> variables) {
        Matcher call = CALL.matcher(fragment);
        while (call.find()) {
            String args = call.group(1).strip();
            if (args.isEmpty()) {
                continue;
            }
            for (String arg : args.split(",")) {
                arg = arg.strip();
                if (arg.isEmpty() || CSyntax.isNumeric(arg)) {
                    continue;
                }
                if (arg.contains(VariableRecord.DEREFERENCE_PREFIX)) {
                    Matcher dereference = DEREFERENCE.matcher(arg);
                    if (dereference.find()) {
                        addDereference(dereference.group(1), variables);
                    }
                }
                // literals are not stripped here, so "%d" contributes d
                Matcher identifier = IDENTIFIER_PATTERN.matcher(arg);
                while (identifier.find()) {
                    String name = identifier.group(1);
                    if (!ARGUMENT_STOP_WORDS.contains(name)) {
                        variables.add(name);
                    }
                }
            }
        }
    }

    private void collectArrayAccesses(String fragment, Set<String> variables) {
        Matcher access = ARRAY_ACCESS.matcher(fragment);
        while (access.find()) {
            variables.add(access.group(1));
            Matcher index = IDENTIFIER_PATTERN.matcher(access.group(2));
            while (index.find()) {
                variables.add(index.group(1));
            }
        }
    }

    private void collectResidualIdentifiers(String fragment, Set<String> variables) {
        String cleaned = removeLiterals(fragment);
        cleaned = INTEGER_LITERAL.matcher(cleaned).replaceAll("");
        cleaned = CALL_SYNTAX.matcher(cleaned).replaceAll("");
        cleaned = DEREFERENCE.matcher(cleaned).replaceAll("");
        cleaned = ARRAY_SYNTAX.matcher(cleaned).replaceAll("");
        cleaned = MEMBER_ACCESS.matcher(cleaned).replaceAll("$1 ");

        Matcher identifier = IDENTIFIER_PATTERN.matcher(cleaned);
        while (identifier.find()) {
            variables.add(identifier.group(1));
        }
    }

    private static String removeLiterals(String text) {
        String cleaned = STRING_LITERAL.matcher(text).replaceAll("");
        return CHAR_LITERAL.matcher(cleaned).replaceAll("");
    }

    private static void addDereference(String pointerName, Set<String> variables) {
        if (CSyntax.C_KEYWORDS.contains(pointerName)) {
            // multiplication by sizeof(...) and the like
            return;
        }
        variables.add(pointerName);
        variables.add(VariableRecord.DEREFERENCE_PREFIX + pointerName);
    }
}
