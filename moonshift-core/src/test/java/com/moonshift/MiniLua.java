package com.moonshift;

import com.moonshift.ast.*;
import com.moonshift.scope.Symbol;
import com.moonshift.value.LuaStrings;
import com.moonshift.value.LuaValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tree-walking interpreter for the Lua subset the test scripts use. It exists to check that a
 * transformation keeps what a script prints, so it only knows the library functions those
 * scripts call.
 */
public final class MiniLua {

    private final Map<String, Object> globals = new HashMap<>();
    private final StringBuilder output = new StringBuilder();

    private MiniLua() {
        installLibrary();
    }

    /**
     * Runs a script and returns everything it printed.
     */
    public static String run(String source) {
        MiniLua lua = new MiniLua();
        Chunk chunk = new Parser(source).parseChunk();
        lua.call(lua.load(chunk), List.of());
        return lua.output.toString();
    }

    public static final class LuaError extends RuntimeException {
        public LuaError(String message) {
            super(message);
        }
    }

    @FunctionalInterface
    interface Callable {
        List<Object> call(List<Object> args);
    }

    static final class LuaTable {
        final Map<Object, Object> entries = new LinkedHashMap<>();
        LuaTable metatable;

        Object get(Object key) {
            return entries.get(key);
        }

        void put(Object key, Object value) {
            if (key == null) {
                throw new LuaError("table index is nil");
            }
            if (value == null) {
                entries.remove(key);
            } else {
                entries.put(key, value);
            }
        }

        int length() {
            int n = 0;
            while (entries.containsKey((double) (n + 1))) {
                n++;
            }
            return n;
        }
    }

    private static final class Env {
        final Env parent;
        final Map<Symbol, Object[]> cells = new HashMap<>();
        List<Object> varargs;

        Env(Env parent) {
            this.parent = parent;
        }

        void declare(Symbol symbol, Object value) {
            cells.put(symbol, new Object[]{value});
        }

        Object[] cell(Symbol symbol) {
            for (Env env = this; env != null; env = env.parent) {
                Object[] cell = env.cells.get(symbol);
                if (cell != null) {
                    return cell;
                }
            }
            throw new LuaError("unbound local '" + symbol.name() + "'");
        }

        List<Object> varargs() {
            for (Env env = this; env != null; env = env.parent) {
                if (env.varargs != null) {
                    return env.varargs;
                }
            }
            return List.of();
        }
    }

    private static final class BreakSignal extends RuntimeException {
        BreakSignal() {
            super(null, null, false, false);
        }
    }

    private static final class ContinueSignal extends RuntimeException {
        ContinueSignal() {
            super(null, null, false, false);
        }
    }

    private static final class ReturnSignal extends RuntimeException {
        final List<Object> values;

        ReturnSignal(List<Object> values) {
            super(null, null, false, false);
            this.values = values;
        }
    }

    private final class Closure implements Callable {
        private final FunctionExpression function;
        private final Env env;
        private final Symbol self;

        Closure(FunctionExpression function, Env env, Symbol self) {
            this.function = function;
            this.env = env;
            this.self = self;
        }

        @Override
        public List<Object> call(List<Object> args) {
            Env frame = new Env(env);
            int next = 0;
            if (self != null) {
                frame.declare(self, arg(args, next++));
            }
            for (Identifier parameter : function.parameters()) {
                frame.declare(parameter.symbol(), arg(args, next++));
            }
            frame.varargs = function.vararg() && next < args.size()
                ? new ArrayList<>(args.subList(next, args.size()))
                : new ArrayList<>();
            try {
                for (Statement statement : function.body().statements()) {
                    execute(statement, frame);
                }
            } catch (ReturnSignal signal) {
                return signal.values;
            }
            return List.of();
        }
    }

    private Callable load(Chunk chunk) {
        return args -> {
            Env env = new Env(null);
            env.varargs = new ArrayList<>(args);
            try {
                for (Statement statement : chunk.body().statements()) {
                    execute(statement, env);
                }
            } catch (ReturnSignal signal) {
                return signal.values;
            }
            return List.of();
        };
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private void executeBlock(Block block, Env parent) {
        Env env = new Env(parent);
        for (Statement statement : block.statements()) {
            execute(statement, env);
        }
    }

    private void execute(Statement statement, Env env) {
        if (statement instanceof CommentStatement || statement instanceof LabelStatement) {
            return;
        }
        if (statement instanceof LocalDeclaration local) {
            List<Object> values = evaluateList(local.values(), env);
            for (int i = 0; i < local.names().size(); i++) {
                env.declare(local.names().get(i).symbol(), arg(values, i));
            }
        } else if (statement instanceof Assignment assignment) {
            assign(assignment, env);
        } else if (statement instanceof CompoundAssignment compound) {
            Object current = evaluate(compound.target(), env);
            Object value = arithmetic(compound.operator(), current, evaluate(compound.value(), env));
            store(compound.target(), value, env);
        } else if (statement instanceof ExpressionStatement expression) {
            evaluateMulti(expression.expression(), env);
        } else if (statement instanceof FunctionDeclaration declaration) {
            declareFunction(declaration, env);
        } else if (statement instanceof IfStatement ifStatement) {
            for (IfClause clause : ifStatement.clauses()) {
                if (truthy(evaluate(clause.condition(), env))) {
                    executeBlock(clause.body(), env);
                    return;
                }
            }
            if (ifStatement.elseBlock() != null) {
                executeBlock(ifStatement.elseBlock(), env);
            }
        } else if (statement instanceof WhileStatement whileStatement) {
            while (truthy(evaluate(whileStatement.condition(), env))) {
                if (!loopBody(whileStatement.body(), env)) {
                    return;
                }
            }
        } else if (statement instanceof RepeatStatement repeat) {
            repeat(repeat, env);
        } else if (statement instanceof NumericForStatement numericFor) {
            numericFor(numericFor, env);
        } else if (statement instanceof GenericForStatement genericFor) {
            genericFor(genericFor, env);
        } else if (statement instanceof DoStatement doStatement) {
            executeBlock(doStatement.body(), env);
        } else if (statement instanceof ReturnStatement returnStatement) {
            throw new ReturnSignal(evaluateList(returnStatement.values(), env));
        } else if (statement instanceof BreakStatement) {
            throw new BreakSignal();
        } else if (statement instanceof ContinueStatement) {
            throw new ContinueSignal();
        } else {
            throw new LuaError("unsupported statement " + statement.type());
        }
    }

    // Returns false when the body broke out of the loop
    private boolean loopBody(Block body, Env env) {
        try {
            executeBlock(body, env);
        } catch (BreakSignal signal) {
            return false;
        } catch (ContinueSignal signal) {
            return true;
        }
        return true;
    }

    private void repeat(RepeatStatement repeat, Env parent) {
        while (true) {
            Env env = new Env(parent);
            try {
                for (Statement statement : repeat.body().statements()) {
                    execute(statement, env);
                }
            } catch (BreakSignal signal) {
                return;
            } catch (ContinueSignal signal) {
                // falls through to the condition
            }
            if (truthy(evaluate(repeat.condition(), env))) {
                return;
            }
        }
    }

    private void numericFor(NumericForStatement loop, Env env) {
        double start = number(evaluate(loop.start(), env));
        double limit = number(evaluate(loop.limit(), env));
        double step = loop.step() == null ? 1 : number(evaluate(loop.step(), env));
        for (double v = start; step > 0 ? v <= limit : v >= limit; v += step) {
            Env iteration = new Env(env);
            iteration.declare(loop.variable().symbol(), v);
            if (!loopBody(loop.body(), iteration)) {
                return;
            }
        }
    }

    private void genericFor(GenericForStatement loop, Env env) {
        List<Object> init = evaluateList(loop.iterators(), env);
        Object function = arg(init, 0);
        Object state = arg(init, 1);
        Object control = arg(init, 2);
        while (true) {
            List<Object> results = call(function, Arrays.asList(state, control));
            if (arg(results, 0) == null) {
                return;
            }
            control = results.get(0);
            Env iteration = new Env(env);
            for (int i = 0; i < loop.variables().size(); i++) {
                iteration.declare(loop.variables().get(i).symbol(), arg(results, i));
            }
            if (!loopBody(loop.body(), iteration)) {
                return;
            }
        }
    }

    private void assign(Assignment assignment, Env env) {
        List<Object[]> places = new ArrayList<>();
        for (Expression target : assignment.targets()) {
            if (target instanceof IndexExpression index) {
                places.add(new Object[]{evaluate(index.object(), env), evaluate(index.key(), env)});
            } else {
                places.add(null);
            }
        }
        List<Object> values = evaluateList(assignment.values(), env);
        for (int i = 0; i < assignment.targets().size(); i++) {
            Object[] place = places.get(i);
            if (place == null) {
                store(assignment.targets().get(i), arg(values, i), env);
            } else {
                table(place[0]).put(place[1], arg(values, i));
            }
        }
    }

    private void store(Expression target, Object value, Env env) {
        if (target instanceof Identifier identifier) {
            if (identifier.symbol().isGlobal()) {
                if (value == null) {
                    globals.remove(identifier.name());
                } else {
                    globals.put(identifier.name(), value);
                }
            } else {
                env.cell(identifier.symbol())[0] = value;
            }
        } else if (target instanceof IndexExpression index) {
            table(evaluate(index.object(), env)).put(evaluate(index.key(), env), value);
        } else {
            throw new LuaError("cannot assign to " + target.type());
        }
    }

    private void declareFunction(FunctionDeclaration declaration, Env env) {
        Symbol self = null;
        if (declaration.method() != null) {
            for (Symbol symbol : declaration.function().body().scope().symbols()) {
                if (symbol.kind() == Symbol.Kind.SELF) {
                    self = symbol;
                }
            }
        }
        if (declaration.local()) {
            env.declare(declaration.name().symbol(), null);
        }
        Closure closure = new Closure(declaration.function(), env, self);
        if (declaration.assignsName()) {
            store(declaration.name(), closure, env);
            return;
        }
        Object holder = evaluate(declaration.name(), env);
        List<String> path = declaration.path();
        int walk = declaration.method() != null ? path.size() : path.size() - 1;
        for (int i = 0; i < walk; i++) {
            holder = index(holder, path.get(i));
        }
        String key = declaration.method() != null ? declaration.method() : path.get(path.size() - 1);
        table(holder).put(key, closure);
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private Object evaluate(Expression expression, Env env) {
        if (expression.isMultiValued()) {
            return arg(evaluateMulti(expression, env), 0);
        }
        if (expression instanceof Literal literal) {
            return fromValue(literal.value());
        }
        if (expression instanceof Identifier identifier) {
            if (identifier.symbol().isGlobal()) {
                return globals.get(identifier.name());
            }
            return env.cell(identifier.symbol())[0];
        }
        if (expression instanceof ParenExpression paren) {
            return evaluate(paren.expression(), env);
        }
        if (expression instanceof BinaryExpression binary) {
            return binary(binary, env);
        }
        if (expression instanceof UnaryExpression unary) {
            Object operand = evaluate(unary.operand(), env);
            return switch (unary.operator()) {
                case NOT -> !truthy(operand);
                case NEG -> -number(operand);
                case LEN -> operand instanceof String s ? (double) s.length() : (double) table(operand).length();
            };
        }
        if (expression instanceof TableConstructor constructor) {
            return construct(constructor, env);
        }
        if (expression instanceof FunctionExpression function) {
            return new Closure(function, env, null);
        }
        if (expression instanceof IndexExpression index) {
            return index(evaluate(index.object(), env), evaluate(index.key(), env));
        }
        throw new LuaError("unsupported expression " + expression.type());
    }

    private List<Object> evaluateMulti(Expression expression, Env env) {
        if (expression instanceof CallExpression call) {
            Object callee = evaluate(call.callee(), env);
            return call(callee, evaluateList(call.arguments(), env));
        }
        if (expression instanceof MethodCallExpression call) {
            Object object = evaluate(call.object(), env);
            List<Object> args = new ArrayList<>();
            args.add(object);
            args.addAll(evaluateList(call.arguments(), env));
            return call(index(object, call.method()), args);
        }
        if (expression instanceof VarargExpression) {
            return env.varargs();
        }
        return Collections.singletonList(evaluate(expression, env));
    }

    private List<Object> evaluateList(List<Expression> expressions, Env env) {
        List<Object> values = new ArrayList<>();
        for (int i = 0; i < expressions.size(); i++) {
            Expression expression = expressions.get(i);
            if (i == expressions.size() - 1) {
                values.addAll(evaluateMulti(expression, env));
            } else {
                values.add(evaluate(expression, env));
            }
        }
        return values;
    }

    private LuaTable construct(TableConstructor constructor, Env env) {
        LuaTable table = new LuaTable();
        double position = 1;
        List<TableField> fields = constructor.fields();
        for (int i = 0; i < fields.size(); i++) {
            TableField field = fields.get(i);
            switch (field.kind()) {
                case POSITIONAL -> {
                    if (i == fields.size() - 1) {
                        for (Object value : evaluateMulti(field.value(), env)) {
                            table.put(position++, value);
                        }
                    } else {
                        table.put(position++, evaluate(field.value(), env));
                    }
                }
                case NAMED, KEYED -> table.put(evaluate(field.key(), env), evaluate(field.value(), env));
            }
        }
        return table;
    }

    private Object binary(BinaryExpression binary, Env env) {
        BinaryOperator operator = binary.operator();
        Object left = evaluate(binary.left(), env);
        if (operator == BinaryOperator.AND) {
            return truthy(left) ? evaluate(binary.right(), env) : left;
        }
        if (operator == BinaryOperator.OR) {
            return truthy(left) ? left : evaluate(binary.right(), env);
        }
        Object right = evaluate(binary.right(), env);
        return switch (operator) {
            case EQ -> Objects.equals(left, right);
            case NE -> !Objects.equals(left, right);
            case LT -> compare(left, right) < 0;
            case LE -> compare(left, right) <= 0;
            case GT -> compare(left, right) > 0;
            case GE -> compare(left, right) >= 0;
            case CONCAT -> concatText(left) + concatText(right);
            default -> arithmetic(operator, left, right);
        };
    }

    private static Object arithmetic(BinaryOperator operator, Object left, Object right) {
        if (operator == BinaryOperator.CONCAT) {
            return concatText(left) + concatText(right);
        }
        double a = number(left);
        double b = number(right);
        return switch (operator) {
            case ADD -> a + b;
            case SUB -> a - b;
            case MUL -> a * b;
            case DIV -> a / b;
            case FLOOR_DIV -> Math.floor(a / b);
            case MOD -> a - Math.floor(a / b) * b;
            case POW -> Math.pow(a, b);
            default -> throw new LuaError("not arithmetic: " + operator);
        };
    }

    private static int compare(Object left, Object right) {
        if (left instanceof Double a && right instanceof Double b) {
            return Double.compare(a, b);
        }
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        throw new LuaError("attempt to compare " + typeName(left) + " with " + typeName(right));
    }

    private Object index(Object object, Object key) {
        if (object instanceof String) {
            return table(globals.get("string")).get(key);
        }
        LuaTable table = table(object);
        Object value = table.get(key);
        if (value == null && table.metatable != null) {
            Object handler = table.metatable.get("__index");
            if (handler instanceof LuaTable) {
                return index(handler, key);
            }
            if (handler != null) {
                return arg(call(handler, List.of(table, key)), 0);
            }
        }
        return value;
    }

    private List<Object> call(Object function, List<Object> args) {
        if (function instanceof Callable callable) {
            return callable.call(args);
        }
        throw new LuaError("attempt to call a " + typeName(function) + " value");
    }

    // ========================================================================
    // Values
    // ========================================================================

    private static Object fromValue(LuaValue value) {
        if (value instanceof LuaValue.Bool b) {
            return b.value();
        }
        if (value instanceof LuaValue.Num n) {
            return n.value();
        }
        if (value instanceof LuaValue.Str s) {
            return s.bytes();
        }
        return null;
    }

    private static boolean truthy(Object value) {
        return value != null && !Boolean.FALSE.equals(value);
    }

    private static Object arg(List<Object> values, int index) {
        return index < values.size() ? values.get(index) : null;
    }

    private static LuaTable table(Object value) {
        if (value instanceof LuaTable table) {
            return table;
        }
        throw new LuaError("attempt to index a " + typeName(value) + " value");
    }

    private static double number(Object value) {
        if (value instanceof Double d) {
            return d;
        }
        if (value instanceof String s) {
            Double parsed = parseNumber(s);
            if (parsed != null) {
                return parsed;
            }
        }
        throw new LuaError("attempt to perform arithmetic on a " + typeName(value) + " value");
    }

    private static Double parseNumber(String text) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String concatText(Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Double d) {
            return LuaStrings.formatNumber(d);
        }
        throw new LuaError("attempt to concatenate a " + typeName(value) + " value");
    }

    static String typeName(Object value) {
        if (value == null) {
            return "nil";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof Double) {
            return "number";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof LuaTable) {
            return "table";
        }
        return "function";
    }

    private static String toText(Object value) {
        if (value == null) {
            return "nil";
        }
        if (value instanceof Boolean || value instanceof String) {
            return value.toString();
        }
        if (value instanceof Double d) {
            return LuaStrings.formatNumber(d);
        }
        return typeName(value);
    }

    // ========================================================================
    // Library
    // ========================================================================

    private static List<Object> values(Object... values) {
        List<Object> list = new ArrayList<>(values.length);
        Collections.addAll(list, values);
        return list;
    }

    private void installLibrary() {
        globals.put("print", (Callable) args -> {
            List<String> parts = new ArrayList<>();
            for (Object arg : args) {
                parts.add(toText(arg));
            }
            output.append(String.join("\t", parts)).append('\n');
            return List.of();
        });
        globals.put("type", (Callable) args -> values(typeName(arg(args, 0))));
        globals.put("tostring", (Callable) args -> values(toText(arg(args, 0))));
        globals.put("tonumber", (Callable) args -> {
            Object value = arg(args, 0);
            return values(value instanceof String s ? parseNumber(s) : value instanceof Double ? value : null);
        });
        globals.put("setmetatable", (Callable) args -> {
            LuaTable table = table(arg(args, 0));
            table.metatable = (LuaTable) arg(args, 1);
            return values(table);
        });
        globals.put("select", (Callable) args -> {
            Object which = arg(args, 0);
            if ("#".equals(which)) {
                return values((double) (args.size() - 1));
            }
            int from = (int) number(which);
            return from < args.size() ? new ArrayList<>(args.subList(from, args.size())) : List.of();
        });
        globals.put("ipairs", (Callable) args -> {
            LuaTable table = table(arg(args, 0));
            int[] next = {0};
            Callable iterator = ignored -> {
                next[0]++;
                Object value = table.get((double) next[0]);
                return value == null ? values((Object) null) : values((double) next[0], value);
            };
            return values(iterator);
        });
        globals.put("pairs", (Callable) args -> {
            List<Map.Entry<Object, Object>> entries = new ArrayList<>(table(arg(args, 0)).entries.entrySet());
            int[] next = {0};
            Callable iterator = ignored -> {
                if (next[0] >= entries.size()) {
                    return values((Object) null);
                }
                Map.Entry<Object, Object> entry = entries.get(next[0]++);
                return values(entry.getKey(), entry.getValue());
            };
            return values(iterator);
        });
        Callable unpack = args -> {
            LuaTable table = table(arg(args, 0));
            int from = arg(args, 1) == null ? 1 : (int) number(arg(args, 1));
            int to = arg(args, 2) == null ? table.length() : (int) number(arg(args, 2));
            List<Object> result = new ArrayList<>();
            for (int i = from; i <= to; i++) {
                result.add(table.get((double) i));
            }
            return result;
        };
        globals.put("unpack", unpack);
        Callable loader = args -> {
            String code = LuaStrings.toText((String) arg(args, 0));
            try {
                return values(load(new Parser(code).parseChunk()));
            } catch (ParseException e) {
                return values(null, e.getMessage());
            }
        };
        globals.put("loadstring", loader);
        globals.put("load", loader);

        LuaTable string = new LuaTable();
        string.put("char", (Callable) args -> {
            StringBuilder sb = new StringBuilder();
            for (Object code : args) {
                sb.append((char) (int) number(code));
            }
            return values(sb.toString());
        });
        string.put("byte", (Callable) args -> {
            String s = (String) arg(args, 0);
            int from = arg(args, 1) == null ? 1 : (int) number(arg(args, 1));
            int to = arg(args, 2) == null ? from : (int) number(arg(args, 2));
            List<Object> codes = new ArrayList<>();
            for (int i = Math.max(from, 1); i <= Math.min(to, s.length()); i++) {
                codes.add((double) s.charAt(i - 1));
            }
            return codes;
        });
        string.put("rep", (Callable) args -> values(((String) arg(args, 0)).repeat((int) number(arg(args, 1)))));
        string.put("reverse", (Callable) args -> values(new StringBuilder((String) arg(args, 0)).reverse().toString()));
        string.put("upper", (Callable) args -> values(((String) arg(args, 0)).toUpperCase()));
        string.put("lower", (Callable) args -> values(((String) arg(args, 0)).toLowerCase()));
        string.put("len", (Callable) args -> values((double) ((String) arg(args, 0)).length()));
        string.put("sub", (Callable) args -> {
            String s = (String) arg(args, 0);
            int length = s.length();
            int from = (int) number(arg(args, 1));
            int to = arg(args, 2) == null ? -1 : (int) number(arg(args, 2));
            from = from < 0 ? Math.max(length + from + 1, 1) : Math.max(from, 1);
            to = to < 0 ? length + to + 1 : Math.min(to, length);
            return values(from > to ? "" : s.substring(from - 1, to));
        });
        globals.put("string", string);

        LuaTable tableLibrary = new LuaTable();
        tableLibrary.put("concat", (Callable) args -> {
            LuaTable table = table(arg(args, 0));
            String separator = arg(args, 1) == null ? "" : concatText(arg(args, 1));
            List<String> parts = new ArrayList<>();
            for (int i = 1; i <= table.length(); i++) {
                parts.add(concatText(table.get((double) i)));
            }
            return values(String.join(separator, parts));
        });
        tableLibrary.put("insert", (Callable) args -> {
            LuaTable table = table(arg(args, 0));
            table.put((double) (table.length() + 1), args.get(args.size() - 1));
            return List.of();
        });
        tableLibrary.put("unpack", unpack);
        globals.put("table", tableLibrary);

        LuaTable math = new LuaTable();
        math.put("floor", (Callable) args -> values(Math.floor(number(arg(args, 0)))));
        math.put("abs", (Callable) args -> values(Math.abs(number(arg(args, 0)))));
        math.put("max", (Callable) args -> values(Math.max(number(arg(args, 0)), number(arg(args, 1)))));
        math.put("min", (Callable) args -> values(Math.min(number(arg(args, 0)), number(arg(args, 1)))));
        globals.put("math", math);
    }
}
