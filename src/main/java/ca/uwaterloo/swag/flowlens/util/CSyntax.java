package ca.uwaterloo.swag.flowlens.util;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Lexical helpers shared by the phases. These are line-level regular expressions, not a C grammar.
 */
public final class CSyntax {

    public static final String IDENTIFIER = "[a-zA-Z_][a-zA-Z0-9_]*";
    public static final String PRIMITIVE_TYPE = "(int|char|double|float|long|short|void)";
    public static final String LINE_COMMENT = "//";
    public static final String DIRECTIVE = "#";

    public static final Pattern IDENTIFIER_PATTERN = Pattern.compile("\\b(" + IDENTIFIER + ")\\b");
    public static final Pattern FUNCTION_HEADER = Pattern.compile("\\b" + PRIMITIVE_TYPE + "\\s+" + IDENTIFIER +
        "\\s*\\(");
    public static final Pattern CONTROL_HEADER = Pattern.compile("\\b(if|while|for)\\s*\\(");
    public static final Pattern LOOP_HEADER = Pattern.compile("\\b(for|while)\\s*\\(");
    public static final Pattern IF_HEADER = Pattern.compile("\\bif\\s*\\(");
    public static final Pattern ELSE = Pattern.compile("\\belse\\b");
    public static final Pattern RETURN = Pattern.compile("\\breturn\\b");
    public static final Pattern CONTROL_KEYWORD = Pattern.compile("\\b(if|for|while|else|return)\\b");

    public static final Set<String> C_KEYWORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
        "int", "char", "double", "float", "long", "short", "void", "signed", "unsigned",
        "if", "else", "while", "for", "do", "switch", "case", "default", "break", "continue",
        "return", "sizeof", "typedef", "struct", "union", "enum", "static", "extern", "const",
        "volatile", "register", "auto", "inline", "restrict", "NULL")));

    private CSyntax() {
    }

    public static List<String> splitLines(String sourceText) {
        return sourceText.lines().collect(Collectors.toList());
    }

    /**
     * Blank lines, line comments and preprocessor directives carry no statement.
     */
    public static boolean isNonStatement(String line) {
        String stripped = line.strip();
        return stripped.isEmpty() || stripped.startsWith(LINE_COMMENT) || stripped.startsWith(DIRECTIVE);
    }

    public static boolean isMeaningful(String line) {
        String stripped = line.strip();
        return !stripped.isEmpty() && !stripped.startsWith(LINE_COMMENT);
    }

    public static String stripLineComment(String text) {
        int commentPos = text.indexOf(LINE_COMMENT);
        return commentPos == -1 ? text : text.substring(0, commentPos);
    }

    public static boolean isNumeric(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static int count(String text, char ch) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == ch) {
                count++;
            }
        }
        return count;
    }
}
