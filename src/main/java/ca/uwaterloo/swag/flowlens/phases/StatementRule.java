package ca.uwaterloo.swag.flowlens.phases;

import static ca.uwaterloo.swag.flowlens.util.CSyntax.IDENTIFIER;
import static ca.uwaterloo.swag.flowlens.util.CSyntax.PRIMITIVE_TYPE;

import ca.uwaterloo.swag.flowlens.models.VariableRecord;
import ca.uwaterloo.swag.flowlens.util.CSyntax;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line interpretations tried by the {@link StatementClassifier}, in declaration order; the first rule whose
 * {@link #matches(String)} accepts the line is the only one applied. Several patterns overlap, so reordering the
 * constants changes the analysis.
 *
 * <p>This is a pattern heuristic over single lines and makes no attempt to be a C front end.
 */
enum StatementRule {

    FUNCTION_DEFINITION {
        private final Pattern signature = Pattern.compile("\\b" + PRIMITIVE_TYPE + "\\s+" + IDENTIFIER +
            "\\s*\\([^)]*\\)\\s*\\{");

        @Override
        boolean matches(String line) {
            return signature.matcher(line).find();
        }

        @Override
        void apply(String line, LineContext context) {
            context.label("Function definition");
        }
    },

    POINTER_DEREFERENCE_ASSIGNMENT {
        private final Pattern target = Pattern.compile("\\*\\s*(" + IDENTIFIER + ")\\s*=");
        private final Pattern pointerType = Pattern.compile("\\b" + PRIMITIVE_TYPE + "\\s*\\*");

        @Override
        boolean matches(String line) {
            return target.matcher(line).find() && !line.contains("==") && !pointerType.matcher(line).find();
        }

        @Override
        void apply(String line, LineContext context) {
            Matcher matcher = target.matcher(line);
            if (!matcher.find()) {
                return;
            }
            String pointerName = matcher.group(1);
            String dereferenceName = VariableRecord.DEREFERENCE_PREFIX + pointerName;
            context.label("Pointer dereference assignment: " + dereferenceName + " = value");
            context.read(pointerName);
            context.define(dereferenceName, context.operation());
            context.readExpression(assignedExpression(line));
        }
    },

    DECLARATION_WITH_INITIALIZER {
        private final Pattern declaration = Pattern.compile("\\b" + PRIMITIVE_TYPE + "\\s*\\*?\\s*(" + IDENTIFIER +
            ")\\s*=");

        @Override
        boolean matches(String line) {
            return declaration.matcher(line).find();
        }

        @Override
        void apply(String line, LineContext context) {
            Matcher matcher = declaration.matcher(line);
            if (!matcher.find()) {
                return;
            }
            String varName = matcher.group(2);
            context.label("Declaration and assignment of " + varName);
            context.define(varName, context.operation());
            context.readExpression(assignedExpression(line));
        }
    },

    DECLARATION {
        private final Pattern declaration = Pattern.compile("\\b" + PRIMITIVE_TYPE + "\\b\\s*\\*?\\s*" + IDENTIFIER +
            "\\s*[,;]");
        private final Pattern typePrefix = Pattern.compile("\\b" + PRIMITIVE_TYPE + "\\s*(\\*?)");
        private final Pattern declarator = Pattern.compile("(" + IDENTIFIER + ")\\s*[,;]");

        @Override
        boolean matches(String line) {
            return declaration.matcher(line).find();
        }

        @Override
        void apply(String line, LineContext context) {
            Matcher type = typePrefix.matcher(line);
            if (!type.find()) {
                return;
            }
            String pointerSuffix = "*".equals(type.group(2)) ? " pointer" : "";
            Matcher names = declarator.matcher(line.substring(type.end()));
            while (names.find()) {
                String varName = names.group(1);
                String description = "Declaration of " + varName + pointerSuffix;
                if (context.define(varName, description)) {
                    context.label(description);
                }
            }
        }
    },

    ASSIGNMENT {
        private final Pattern target = Pattern.compile("\\b(" + IDENTIFIER + ")\\s*=");

        @Override
        boolean matches(String line) {
            return target.matcher(line).find() && !line.contains("==") && !line.contains("*");
        }

        @Override
        void apply(String line, LineContext context) {
            Matcher matcher = target.matcher(line);
            if (!matcher.find()) {
                return;
            }
            String varName = matcher.group(1);
            context.label("Assignment to " + varName);
            context.define(varName, context.operation());
            context.readExpression(assignedExpression(line));
        }
    },

    CONTROL_HEADER {
        @Override
        boolean matches(String line) {
            return CSyntax.CONTROL_HEADER.matcher(line).find();
        }

        @Override
        void apply(String line, LineContext context) {
            Matcher matcher = CSyntax.CONTROL_HEADER.matcher(line);
            if (!matcher.find()) {
                return;
            }
            context.label("Control flow: " + matcher.group(1) + " statement");
            context.readExpression(parenthesized(line, matcher.end() - 1));
        }
    },

    FUNCTION_CALL {
        private final Pattern call = Pattern.compile("(" + IDENTIFIER + ")\\s*\\(");
        private final Pattern assignmentTarget = Pattern.compile("(" + IDENTIFIER + ")\\s*=");

        @Override
        boolean matches(String line) {
            return call.matcher(line).find();
        }

        @Override
        void apply(String line, LineContext context) {
            Matcher matcher = call.matcher(line);
            if (!matcher.find()) {
                return;
            }
            String functionName = matcher.group(1);
            context.label("Function call: " + functionName + "()");

            int parenStart = line.indexOf('(');
            int parenEnd = line.lastIndexOf(')');
            if (parenStart != -1 && parenEnd > parenStart) {
                context.readExpression(line.substring(parenStart + 1, parenEnd));
            }

            if (context.isAllocationFunction(functionName) && line.contains("=")) {
                Matcher target = assignmentTarget.matcher(line.substring(0, parenStart));
                if (target.find()) {
                    String pointerName = target.group(1);
                    String description = "Memory allocation: " + pointerName + " = " + functionName + "(...)";
                    if (context.define(pointerName, description)) {
                        context.label(description);
                    }
                }
            }
        }
    },

    RETURN {
        @Override
        boolean matches(String line) {
            return CSyntax.RETURN.matcher(line).find();
        }

        @Override
        void apply(String line, LineContext context) {
            Matcher matcher = CSyntax.RETURN.matcher(line);
            if (!matcher.find()) {
                return;
            }
            context.label("Return statement");
            context.readExpression(line.substring(matcher.end()));
        }
    };

    abstract boolean matches(String line);

    abstract void apply(String line, LineContext context);

    private static String assignedExpression(String line) {
        int assignPos = line.indexOf('=');
        return assignPos == -1 ? "" : line.substring(assignPos + 1);
    }

    /**
     * Text inside the parenthesis opened at {@code openPos}, up to its matching close or the end of the line.
     */
    private static String parenthesized(String line, int openPos) {
        int depth = 0;
        for (int i = openPos; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
                if (depth == 0) {
                    return line.substring(openPos + 1, i);
                }
            }
        }
        return line.substring(openPos + 1);
    }
}
