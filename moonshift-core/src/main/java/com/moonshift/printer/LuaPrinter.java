package com.moonshift.printer;

import com.moonshift.ast.*;
import com.moonshift.value.LuaStrings;
import com.moonshift.value.LuaValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a tree back into source text.
 *
 * <p>{@link Layout#READABLE} writes one statement per line, indents nested blocks, keeps
 * comments and separates top-level function declarations with a blank line.
 * {@link Layout#COMPACT} drops comments and emits a space only where two tokens would
 * otherwise merge. In both layouts parentheses are emitted exactly where the tree needs
 * them, so parsing the output gives back the printed tree.</p>
 */
public class LuaPrinter {

    private static final int MAX_INLINE_TABLE = 80;

    // Priority of expressions that never need parentheses
    private static final int ATOM = 100;

    private final Layout layout;
    private final String indent;
    private int depth;

    public LuaPrinter(Layout layout) {
        this(layout, "    ");
    }

    public LuaPrinter(Layout layout, String indent) {
        this.layout = layout;
        this.indent = indent;
    }

    public static String print(Chunk chunk, Layout layout) {
        return new LuaPrinter(layout).print(chunk);
    }

    public String print(Chunk chunk) {
        depth = 0;
        if (layout == Layout.COMPACT) {
            return compactBlock(chunk.body());
        }
        StringBuilder out = new StringBuilder();
        readableBlock(chunk.body(), out, true);
        return out.toString();
    }

    public String printExpression(Expression expression) {
        depth = 0;
        return expression(expression);
    }

    private boolean readable() {
        return layout == Layout.READABLE;
    }

    private String makeIndent(int level) {
        return indent.repeat(level);
    }

    // ========================================================================
    // Blocks
    // ========================================================================

    private void readableBlock(Block block, StringBuilder out, boolean topLevel) {
        List<Statement> statements = block.statements();
        List<String> texts = new ArrayList<>(statements.size());
        for (Statement statement : statements) {
            texts.add(statement(statement));
        }
        Statement previousUnit = null;
        boolean unitStart = true;
        for (int i = 0; i < statements.size(); i++) {
            Statement statement = statements.get(i);
            if (topLevel && unitStart) {
                Statement unit = nextCode(statements, i);
                if (previousUnit != null && unit != null
                    && (previousUnit instanceof FunctionDeclaration || unit instanceof FunctionDeclaration)) {
                    out.append('\n');
                }
            }
            String text = texts.get(i);
            boolean code = !(statement instanceof CommentStatement);
            if (code && startsWithParen(statements, texts, i + 1)) {
                text += ";";
            }
            out.append(makeIndent(depth)).append(text).append('\n');
            if (code) {
                previousUnit = statement;
            }
            unitStart = code;
        }
    }

    private String compactBlock(Block block) {
        List<Statement> statements = block.codeStatements();
        List<String> texts = new ArrayList<>(statements.size());
        for (Statement statement : statements) {
            texts.add(statement(statement));
        }
        String result = "";
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            if (i + 1 < texts.size() && texts.get(i + 1).startsWith("(")) {
                text += ";";
            }
            result = join(result, text);
        }
        return result;
    }

    private static Statement nextCode(List<Statement> statements, int from) {
        for (int i = from; i < statements.size(); i++) {
            if (!(statements.get(i) instanceof CommentStatement)) {
                return statements.get(i);
            }
        }
        return null;
    }

    // A statement starting with '(' would otherwise continue the previous one as a call
    private static boolean startsWithParen(List<Statement> statements, List<String> texts, int from) {
        for (int i = from; i < statements.size(); i++) {
            if (!(statements.get(i) instanceof CommentStatement)) {
                return texts.get(i).startsWith("(");
            }
        }
        return false;
    }

    /**
     * Nested block, one level deeper. Readable bodies come back as complete lines.
     */
    private String body(Block block) {
        depth++;
        try {
            if (!readable()) {
                return compactBlock(block);
            }
            StringBuilder out = new StringBuilder();
            readableBlock(block, out, false);
            return out.toString();
        } finally {
            depth--;
        }
    }

    /**
     * {@code opener BODY closer}, e.g. {@code do ... end}.
     */
    private String wrap(String opener, Block block, String closer) {
        if (readable()) {
            return opener + "\n" + body(block) + makeIndent(depth) + closer;
        }
        return join(join(opener, body(block)), closer);
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private String statement(Statement statement) {
        if (statement instanceof CommentStatement comment) {
            return comment.text();
        }
        if (statement instanceof LocalDeclaration local) {
            String names = identifiers(local.names());
            if (local.values().isEmpty()) {
                return words("local", names);
            }
            return words("local", names, "=", list(local.values()));
        }
        if (statement instanceof Assignment assignment) {
            return words(list(assignment.targets()), "=", list(assignment.values()));
        }
        if (statement instanceof CompoundAssignment compound) {
            return words(expression(compound.target()), compound.operator().symbol() + "=", expression(compound.value()));
        }
        if (statement instanceof ExpressionStatement expressionStatement) {
            return expression(expressionStatement.expression());
        }
        if (statement instanceof FunctionDeclaration declaration) {
            StringBuilder name = new StringBuilder(declaration.name().name());
            for (String part : declaration.path()) {
                name.append('.').append(part);
            }
            if (declaration.method() != null) {
                name.append(':').append(declaration.method());
            }
            String header = declaration.local()
                ? words("local", "function", name.toString())
                : words("function", name.toString());
            return function(header, declaration.function());
        }
        if (statement instanceof IfStatement ifStatement) {
            return ifStatement(ifStatement);
        }
        if (statement instanceof WhileStatement whileStatement) {
            return wrap(words("while", expression(whileStatement.condition()), "do"), whileStatement.body(), "end");
        }
        if (statement instanceof RepeatStatement repeat) {
            return wrap("repeat", repeat.body(), words("until", expression(repeat.condition())));
        }
        if (statement instanceof NumericForStatement numericFor) {
            List<Expression> range = new ArrayList<>(3);
            range.add(numericFor.start());
            range.add(numericFor.limit());
            if (numericFor.step() != null) {
                range.add(numericFor.step());
            }
            String header = words("for", numericFor.variable().name(), "=", list(range), "do");
            return wrap(header, numericFor.body(), "end");
        }
        if (statement instanceof GenericForStatement genericFor) {
            String header = words("for", identifiers(genericFor.variables()), "in", list(genericFor.iterators()), "do");
            return wrap(header, genericFor.body(), "end");
        }
        if (statement instanceof DoStatement doStatement) {
            return wrap("do", doStatement.body(), "end");
        }
        if (statement instanceof ReturnStatement returnStatement) {
            return returnStatement.values().isEmpty() ? "return" : words("return", list(returnStatement.values()));
        }
        if (statement instanceof BreakStatement) {
            return "break";
        }
        if (statement instanceof ContinueStatement) {
            return "continue";
        }
        if (statement instanceof GotoStatement gotoStatement) {
            return words("goto", gotoStatement.label());
        }
        if (statement instanceof LabelStatement label) {
            return "::" + label.name() + "::";
        }
        throw new IllegalArgumentException("Unknown statement: " + statement.type());
    }

    private String ifStatement(IfStatement ifStatement) {
        StringBuilder out = new StringBuilder();
        String text = "";
        for (int i = 0; i < ifStatement.clauses().size(); i++) {
            IfClause clause = ifStatement.clauses().get(i);
            String opener = words(i == 0 ? "if" : "elseif", expression(clause.condition()), "then");
            if (readable()) {
                if (i > 0) {
                    out.append(makeIndent(depth));
                }
                out.append(opener).append('\n').append(body(clause.body()));
            } else {
                text = join(join(text, opener), body(clause.body()));
            }
        }
        if (ifStatement.elseBlock() != null) {
            if (readable()) {
                out.append(makeIndent(depth)).append("else\n").append(body(ifStatement.elseBlock()));
            } else {
                text = join(join(text, "else"), body(ifStatement.elseBlock()));
            }
        }
        if (readable()) {
            return out.append(makeIndent(depth)).append("end").toString();
        }
        return join(text, "end");
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private String expression(Expression expression) {
        if (expression instanceof Literal literal) {
            return literal(literal);
        }
        if (expression instanceof Identifier identifier) {
            return identifier.name();
        }
        if (expression instanceof VarargExpression) {
            return "...";
        }
        if (expression instanceof ParenExpression paren) {
            return "(" + expression(paren.expression()) + ")";
        }
        if (expression instanceof BinaryExpression binary) {
            return binary(binary);
        }
        if (expression instanceof UnaryExpression unary) {
            return unary(unary);
        }
        if (expression instanceof TableConstructor table) {
            return table(table);
        }
        if (expression instanceof FunctionExpression function) {
            return function("function", function);
        }
        if (expression instanceof IndexExpression index) {
            String object = prefix(index.object());
            if (index.dotted()) {
                return object + "." + index.fieldName();
            }
            return object + join("[", expression(index.key())) + "]";
        }
        if (expression instanceof CallExpression call) {
            return prefix(call.callee()) + "(" + list(call.arguments()) + ")";
        }
        if (expression instanceof MethodCallExpression methodCall) {
            return prefix(methodCall.object()) + ":" + methodCall.method() + "(" + list(methodCall.arguments()) + ")";
        }
        throw new IllegalArgumentException("Unknown expression: " + expression.type());
    }

    private String prefix(Expression expression) {
        String text = expression(expression);
        return expression.isPrefix() ? text : "(" + text + ")";
    }

    private String literal(Literal literal) {
        String raw = literal.raw();
        if (raw != null && !(layout == Layout.COMPACT && spansLines(raw))) {
            return raw;
        }
        LuaValue value = literal.value();
        if (value instanceof LuaValue.Nil) {
            return "nil";
        }
        if (value instanceof LuaValue.Bool b) {
            return b.value() ? "true" : "false";
        }
        if (value instanceof LuaValue.Num n) {
            return LuaStrings.formatNumber(n.value());
        }
        return LuaStrings.quote(((LuaValue.Str) value).bytes());
    }

    // Quoted spellings that skip or escape line breaks
    private static boolean spansLines(String raw) {
        if (raw.isEmpty() || (raw.charAt(0) != '"' && raw.charAt(0) != '\'')) {
            return false;
        }
        return raw.contains("\\z") || raw.contains("\\\n") || raw.contains("\\\r");
    }

    private String binary(BinaryExpression binary) {
        BinaryOperator operator = binary.operator();
        int priority = operator.leftPriority();

        String left = expression(binary.left());
        int leftPriority = priority(binary.left());
        if (leftPriority < priority || (leftPriority == priority && operator.isRightAssociative())) {
            left = "(" + left + ")";
        }

        String right = expression(binary.right());
        int rightPriority = priority(binary.right());
        // A unary operator binds its operand before the enclosing binary operator sees it
        boolean unaryRight = rightPriority == BinaryOperator.UNARY_PRIORITY;
        if (!unaryRight && (rightPriority < priority || (rightPriority == priority && !operator.isRightAssociative()))) {
            right = "(" + right + ")";
        }
        if (readable()) {
            return left + " " + operator.symbol() + " " + right;
        }
        return join(join(left, operator.symbol()), right);
    }

    private String unary(UnaryExpression unary) {
        String operand = expression(unary.operand());
        if (priority(unary.operand()) < BinaryOperator.UNARY_PRIORITY) {
            operand = "(" + operand + ")";
        }
        return switch (unary.operator()) {
            case NOT -> readable() ? "not " + operand : join("not", operand);
            case NEG -> join("-", operand);
            case LEN -> join("#", operand);
        };
    }

    private static int priority(Expression expression) {
        if (expression instanceof BinaryExpression binary) {
            return binary.operator().leftPriority();
        }
        if (expression instanceof UnaryExpression) {
            return BinaryOperator.UNARY_PRIORITY;
        }
        // A synthesized negative number prints with a leading '-'
        if (expression instanceof Literal literal && literal.raw() == null
            && literal.value() instanceof LuaValue.Num n && (n.value() < 0 || 1 / n.value() < 0)) {
            return BinaryOperator.UNARY_PRIORITY;
        }
        return ATOM;
    }

    private String table(TableConstructor table) {
        if (table.fields().isEmpty()) {
            return "{}";
        }
        List<String> fields = new ArrayList<>(table.fields().size());
        depth++;
        try {
            for (TableField field : table.fields()) {
                fields.add(field(field));
            }
        } finally {
            depth--;
        }
        if (!readable()) {
            return "{" + String.join(",", fields) + "}";
        }
        String inline = "{" + String.join(", ", fields) + "}";
        if (inline.indexOf('\n') < 0 && inline.length() <= MAX_INLINE_TABLE) {
            return inline;
        }
        StringBuilder out = new StringBuilder("{\n");
        for (String field : fields) {
            out.append(makeIndent(depth + 1)).append(field).append(",\n");
        }
        return out.append(makeIndent(depth)).append('}').toString();
    }

    private String field(TableField field) {
        String value = expression(field.value());
        return switch (field.kind()) {
            case POSITIONAL -> value;
            case NAMED -> words(((LuaValue.Str) ((Literal) field.key()).value()).bytes(), "=", value);
            case KEYED -> words(join("[", expression(field.key())) + "]", "=", value);
        };
    }

    private String function(String header, FunctionExpression function) {
        List<String> parameters = new ArrayList<>();
        for (Identifier parameter : function.parameters()) {
            parameters.add(parameter.name());
        }
        if (function.vararg()) {
            parameters.add("...");
        }
        String signature = header + "(" + String.join(readable() ? ", " : ",", parameters) + ")";
        if (function.body().statements().isEmpty()) {
            return readable() ? signature + " end" : join(signature, "end");
        }
        return wrap(signature, function.body(), "end");
    }

    // ========================================================================
    // Token joining
    // ========================================================================

    private String list(List<Expression> expressions) {
        List<String> parts = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            parts.add(expression(expression));
        }
        return String.join(readable() ? ", " : ",", parts);
    }

    private String identifiers(List<Identifier> identifiers) {
        List<String> names = new ArrayList<>(identifiers.size());
        for (Identifier identifier : identifiers) {
            names.add(identifier.name());
        }
        return String.join(readable() ? ", " : ",", names);
    }

    private String words(String... parts) {
        if (readable()) {
            return String.join(" ", parts);
        }
        String result = "";
        for (String part : parts) {
            result = join(result, part);
        }
        return result;
    }

    /**
     * Concatenates two pieces of code, adding a space only where their tokens would merge.
     */
    static String join(String left, String right) {
        if (left.isEmpty()) {
            return right;
        }
        if (right.isEmpty()) {
            return left;
        }
        return needsSpace(left, right.charAt(0)) ? left + " " + right : left + right;
    }

    private static boolean needsSpace(String left, char next) {
        char last = left.charAt(left.length() - 1);
        if (isWordChar(last) && isWordChar(next)) {
            return true;
        }
        if ((last == '-' && next == '-') || (last == '.' && next == '.')) {
            return true;
        }
        if (last == '[' && (next == '[' || next == '=')) {
            return true;
        }
        return next == '.' && isWordChar(last) && endsWithNumber(left);
    }

    private static boolean endsWithNumber(String text) {
        int i = text.length();
        while (i > 0 && (isWordChar(text.charAt(i - 1)) || text.charAt(i - 1) == '.')) {
            i--;
        }
        return i < text.length() && Character.isDigit(text.charAt(i));
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
