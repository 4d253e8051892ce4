package com.moonshift;

import com.moonshift.ast.*;
import com.moonshift.pass.AstWalker;
import com.moonshift.pipeline.Warning;
import com.moonshift.scope.Scope;
import com.moonshift.scope.Symbol;
import com.moonshift.scope.SymbolTable;
import com.moonshift.value.LuaValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser that rebuilds the block structure of a Lua/Luau chunk and
 * resolves every name to a {@link Symbol} as it goes.
 *
 * <p>Two optional behaviours exist for damaged or obfuscated input:</p>
 * <ul>
 *   <li>repair mode closes blocks left open at end of input and wraps a {@code return}
 *       that is not last in its block into {@code do ... end}, recording each change;</li>
 *   <li>wrapper unwrapping flattens a chunk whose only statement is an immediately run
 *       function ({@code (function() ... end)()}, {@code task.spawn(function() ... end)}).</li>
 * </ul>
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private static final String SOURCE_NAME = "parser";

    // Combined statement/expression nesting limit
    private static final int MAX_DEPTH = 400;

    private static final Set<TokenType> BLOCK_END =
        EnumSet.of(TokenType.END, TokenType.ELSE, TokenType.ELSEIF, TokenType.UNTIL, TokenType.EOF);

    private final List<Token> tokens;
    // Comments preceding tokens.get(i); consumed entries are set to null
    private final List<List<Token>> leadingComments;
    private final boolean repairMode;
    private final boolean unwrapWrappers;
    private final SymbolTable symbols;
    private final List<Warning> warnings = new ArrayList<>();
    private int current = 0;
    private int depth = 0;

    private Scope scope;
    private boolean varargAllowed = true;
    private int loopDepth = 0;

    public Parser(String source) {
        this(source, false, false);
    }

    public Parser(String source, boolean repairMode, boolean unwrapWrappers) {
        this(source, repairMode, unwrapWrappers, new SymbolTable());
    }

    /**
     * @param symbols table to declare symbols in; pass an existing chunk's table when the
     *                parsed code will be spliced into that chunk
     */
    public Parser(String source, boolean repairMode, boolean unwrapWrappers, SymbolTable symbols) {
        this(Lexer.tokenize(source), repairMode, unwrapWrappers, symbols);
    }

    public Parser(List<Token> allTokens, boolean repairMode, boolean unwrapWrappers, SymbolTable symbols) {
        this.repairMode = repairMode;
        this.unwrapWrappers = unwrapWrappers;
        this.symbols = symbols;
        this.tokens = new ArrayList<>(allTokens.size());
        this.leadingComments = new ArrayList<>(allTokens.size());
        List<Token> pending = null;
        for (Token token : allTokens) {
            if (token.type() == TokenType.COMMENT) {
                if (pending == null) {
                    pending = new ArrayList<>();
                }
                pending.add(token);
                continue;
            }
            tokens.add(token);
            leadingComments.add(pending);
            pending = null;
        }
    }

    public static Chunk parse(String source) {
        return new Parser(source).parseChunk();
    }

    /**
     * Repairs and notes recorded while parsing.
     */
    public List<Warning> warnings() {
        return warnings;
    }

    public Chunk parseChunk() {
        Token first = peek();
        Scope root = new Scope(null, true);
        Block body = block(root);
        if (!isAtEnd()) {
            // A stray 'end', 'else', 'elseif' or 'until'
            throw new ExpectedTokenException("'<eof>' expected", peek());
        }
        Chunk chunk = new Chunk(span(first), body, symbols);
        if (unwrapWrappers) {
            chunk = unwrapImmediateWrapper(chunk);
        }
        return chunk;
    }

    // ========================================================================
    // Blocks
    // ========================================================================

    private Block block(Scope blockScope) {
        Scope saved = scope;
        scope = blockScope;
        int startIndex = current;
        List<Statement> statements = new ArrayList<>();
        while (true) {
            boolean afterReturn = !statements.isEmpty() && statements.get(statements.size() - 1) instanceof ReturnStatement;
            // Comments after a return would make it non-final; they are dropped
            takeComments(afterReturn ? null : statements);
            if (BLOCK_END.contains(peek().type())) {
                break;
            }
            if (afterReturn) {
                if (!repairMode) {
                    throw new ExpectedTokenException("'return' must be the last statement in its block", peek());
                }
                ReturnStatement ret = (ReturnStatement) statements.remove(statements.size() - 1);
                Block wrapped = new Block(ret.loc(), new ArrayList<>(List.of(ret)), new Scope(blockScope, false));
                statements.add(new DoStatement(ret.loc(), wrapped));
                repair("wrapped 'return' that was not the last statement in 'do ... end'", ret.loc());
                continue;
            }
            if (check(TokenType.RETURN)) {
                statements.add(returnStatement());
                continue;
            }
            Statement statement = statement();
            if (statement != null) {
                statements.add(statement);
            }
        }
        scope = saved;
        return new Block(spanFrom(startIndex), statements, blockScope);
    }

    private void takeComments(List<Statement> into) {
        List<Token> pending = leadingComments.get(current);
        if (pending == null) {
            return;
        }
        leadingComments.set(current, null);
        if (into == null) {
            return;
        }
        for (Token comment : pending) {
            String text = comment.lexeme().replace("\r\n", "\n").replace('\r', '\n');
            into.add(new CommentStatement(tokenLoc(comment), text));
        }
    }

    private void consumeEnd(Token opener) {
        if (match(TokenType.END)) {
            return;
        }
        if (repairMode && isAtEnd()) {
            repair("inserted missing 'end' for '" + opener.lexeme() + "' opened at line " + opener.line(), tokenLoc(peek()));
            return;
        }
        throw new ExpectedTokenException(expectedClosing("end", opener), peek());
    }

    private String expectedClosing(String what, Token opener) {
        if (peek().line() == opener.line()) {
            return "'" + what + "' expected";
        }
        return "'" + what + "' expected (to close '" + opener.lexeme() + "' at line " + opener.line() + ")";
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private Statement statement() {
        enterLevel();
        Token start = peek();
        Statement result = switch (start.type()) {
            case SEMICOLON -> {
                advance();
                yield null;
            }
            case IF -> ifStatement();
            case WHILE -> whileStatement();
            case DO -> doStatement();
            case FOR -> forStatement();
            case REPEAT -> repeatStatement();
            case FUNCTION -> functionStatement();
            case LOCAL -> localStatement();
            case DOUBLE_COLON -> labelStatement();
            case BREAK -> breakStatement();
            case IDENTIFIER -> {
                if (start.lexeme().equals("goto") && checkAhead(1, TokenType.IDENTIFIER)) {
                    yield gotoStatement();
                }
                if (start.lexeme().equals("continue") && loopDepth > 0 && !continuesAsExpression()) {
                    advance();
                    yield new ContinueStatement(tokenLoc(start));
                }
                yield expressionStatement();
            }
            default -> expressionStatement();
        };
        depth--;
        return result;
    }

    // "continue" is only a keyword when it cannot start an expression statement
    private boolean continuesAsExpression() {
        if (current + 1 >= tokens.size()) {
            return false;
        }
        TokenType next = tokens.get(current + 1).type();
        return switch (next) {
            case LPAREN, DOT, LBRACKET, COLON, ASSIGN, COMMA, LBRACE, STRING -> true;
            default -> next.isCompoundAssignment();
        };
    }

    private Statement ifStatement() {
        Token start = advance();
        List<IfClause> clauses = new ArrayList<>();
        clauses.add(ifClause(start));
        Block elseBlock = null;
        while (check(TokenType.ELSEIF)) {
            clauses.add(ifClause(advance()));
        }
        if (match(TokenType.ELSE)) {
            elseBlock = block(new Scope(scope, false));
        }
        consumeEnd(start);
        return new IfStatement(span(start), clauses, elseBlock);
    }

    private IfClause ifClause(Token keyword) {
        Expression condition = expression();
        consume(TokenType.THEN, "'then' expected");
        Block body = block(new Scope(scope, false));
        return new IfClause(span(keyword), condition, body);
    }

    private Statement whileStatement() {
        Token start = advance();
        Expression condition = expression();
        consume(TokenType.DO, "'do' expected");
        Block body = loopBody(new Scope(scope, false));
        consumeEnd(start);
        return new WhileStatement(span(start), condition, body);
    }

    private Block loopBody(Scope bodyScope) {
        loopDepth++;
        Block body = block(bodyScope);
        loopDepth--;
        return body;
    }

    private Statement doStatement() {
        Token start = advance();
        Block body = block(new Scope(scope, false));
        consumeEnd(start);
        return new DoStatement(span(start), body);
    }

    private Statement forStatement() {
        Token start = advance();
        Token first = consume(TokenType.IDENTIFIER, "<name> expected");
        if (match(TokenType.ASSIGN)) {
            Expression initial = expression();
            consume(TokenType.COMMA, "',' expected");
            Expression limit = expression();
            Expression step = match(TokenType.COMMA) ? expression() : null;
            consume(TokenType.DO, "'do' expected");
            Scope loopScope = new Scope(scope, false);
            Identifier variable = declare(first, Symbol.Kind.FOR_VARIABLE, loopScope);
            Block body = loopBody(loopScope);
            consumeEnd(start);
            return new NumericForStatement(span(start), variable, initial, limit, step, body);
        }
        if (!check(TokenType.COMMA) && !check(TokenType.IN)) {
            throw new ExpectedTokenException("'=' or 'in' expected", peek());
        }
        List<Token> names = new ArrayList<>();
        names.add(first);
        while (match(TokenType.COMMA)) {
            names.add(consume(TokenType.IDENTIFIER, "<name> expected"));
        }
        consume(TokenType.IN, "'in' expected");
        List<Expression> iterators = expressionList();
        consume(TokenType.DO, "'do' expected");
        Scope loopScope = new Scope(scope, false);
        List<Identifier> variables = new ArrayList<>();
        for (Token name : names) {
            variables.add(declare(name, Symbol.Kind.FOR_VARIABLE, loopScope));
        }
        Block body = loopBody(loopScope);
        consumeEnd(start);
        return new GenericForStatement(span(start), variables, iterators, body);
    }

    private Statement repeatStatement() {
        Token start = advance();
        Scope bodyScope = new Scope(scope, false);
        Block body = loopBody(bodyScope);
        Expression condition;
        if (match(TokenType.UNTIL)) {
            // The condition can see locals declared in the body
            Scope saved = scope;
            scope = bodyScope;
            condition = expression();
            scope = saved;
        } else if (repairMode && isAtEnd()) {
            repair("inserted missing 'until true' for 'repeat' opened at line " + start.line(), tokenLoc(peek()));
            condition = Literal.of(true);
        } else {
            throw new ExpectedTokenException(expectedClosing("until", start), peek());
        }
        return new RepeatStatement(span(start), body, condition);
    }

    private Statement functionStatement() {
        Token start = advance();
        Identifier name = reference(consume(TokenType.IDENTIFIER, "<name> expected"));
        List<String> path = new ArrayList<>();
        String method = null;
        while (match(TokenType.DOT)) {
            path.add(consume(TokenType.IDENTIFIER, "<name> expected").lexeme());
        }
        if (match(TokenType.COLON)) {
            method = consume(TokenType.IDENTIFIER, "<name> expected").lexeme();
        }
        FunctionExpression function = functionBody(start, method != null);
        return new FunctionDeclaration(span(start), false, name, path, method, function);
    }

    private Statement localStatement() {
        Token start = advance();
        if (match(TokenType.FUNCTION)) {
            // Declared before the body so the function can call itself
            Identifier name = declare(consume(TokenType.IDENTIFIER, "<name> expected"), Symbol.Kind.LOCAL, scope);
            FunctionExpression function = functionBody(start, false);
            return new FunctionDeclaration(span(start), true, name, List.of(), null, function);
        }
        List<Token> names = new ArrayList<>();
        do {
            names.add(consume(TokenType.IDENTIFIER, "<name> expected"));
        } while (match(TokenType.COMMA));
        List<Expression> values = match(TokenType.ASSIGN) ? expressionList() : new ArrayList<>();
        // Initializers are resolved before the new names come into scope
        List<Identifier> identifiers = new ArrayList<>();
        for (Token name : names) {
            identifiers.add(declare(name, Symbol.Kind.LOCAL, scope));
        }
        return new LocalDeclaration(span(start), identifiers, values);
    }

    private Statement labelStatement() {
        Token start = advance();
        String name = consume(TokenType.IDENTIFIER, "<name> expected").lexeme();
        consume(TokenType.DOUBLE_COLON, "'::' expected");
        return new LabelStatement(span(start), name);
    }

    private Statement gotoStatement() {
        Token start = advance();
        String label = consume(TokenType.IDENTIFIER, "<name> expected").lexeme();
        return new GotoStatement(span(start), label);
    }

    private Statement breakStatement() {
        Token start = advance();
        if (loopDepth == 0) {
            throw new ParseException("'break' outside a loop", start.line(), start.column(), start.position());
        }
        return new BreakStatement(tokenLoc(start));
    }

    private Statement returnStatement() {
        Token start = advance();
        List<Expression> values = BLOCK_END.contains(peek().type()) || check(TokenType.SEMICOLON)
            ? new ArrayList<>()
            : expressionList();
        match(TokenType.SEMICOLON);
        return new ReturnStatement(span(start), values);
    }

    private Statement expressionStatement() {
        Token start = peek();
        Expression first = suffixedExpression();
        if (check(TokenType.ASSIGN) || check(TokenType.COMMA)) {
            List<Expression> targets = new ArrayList<>();
            targets.add(checkTarget(first));
            while (match(TokenType.COMMA)) {
                targets.add(checkTarget(suffixedExpression()));
            }
            consume(TokenType.ASSIGN, "'=' expected");
            List<Expression> values = expressionList();
            return new Assignment(span(start), targets, values);
        }
        if (peek().type().isCompoundAssignment()) {
            checkTarget(first);
            BinaryOperator operator = BinaryOperator.fromCompoundAssignment(advance().type());
            Expression value = expression();
            return new CompoundAssignment(span(start), first, operator, value);
        }
        if (!(first instanceof CallExpression) && !(first instanceof MethodCallExpression)) {
            throw new ExpectedTokenException("syntax error", peek());
        }
        return new ExpressionStatement(span(start), first);
    }

    private Expression checkTarget(Expression target) {
        if (!(target instanceof Identifier) && !(target instanceof IndexExpression)) {
            throw new ExpectedTokenException("syntax error", peek());
        }
        return target;
    }

    // ========================================================================
    // Functions
    // ========================================================================

    private FunctionExpression functionBody(Token start, boolean method) {
        Scope functionScope = new Scope(scope, true);
        if (method) {
            symbols.declare("self", Symbol.Kind.SELF, functionScope);
        }
        consume(TokenType.LPAREN, "'(' expected");
        List<Identifier> parameters = new ArrayList<>();
        boolean vararg = false;
        if (!check(TokenType.RPAREN)) {
            do {
                if (match(TokenType.ELLIPSIS)) {
                    vararg = true;
                    break;
                }
                parameters.add(declare(consume(TokenType.IDENTIFIER, "<name> expected"), Symbol.Kind.PARAMETER, functionScope));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "')' expected");

        boolean savedVararg = varargAllowed;
        int savedLoopDepth = loopDepth;
        varargAllowed = vararg;
        loopDepth = 0;
        Block body = block(functionScope);
        varargAllowed = savedVararg;
        loopDepth = savedLoopDepth;

        consumeEnd(start);
        return new FunctionExpression(span(start), parameters, vararg, body);
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private Expression expression() {
        return subexpression(0);
    }

    private List<Expression> expressionList() {
        List<Expression> expressions = new ArrayList<>();
        expressions.add(expression());
        while (match(TokenType.COMMA)) {
            expressions.add(expression());
        }
        return expressions;
    }

    /**
     * Parses operators whose left priority exceeds {@code limit}.
     */
    private Expression subexpression(int limit) {
        enterLevel();
        Token start = peek();
        Expression left;
        UnaryOperator unary = UnaryOperator.fromToken(start.type());
        if (unary != null) {
            advance();
            Expression operand = subexpression(BinaryOperator.UNARY_PRIORITY);
            left = new UnaryExpression(span(start), unary, operand);
        } else {
            left = simpleExpression();
        }
        // Each operator in a left-associative chain nests the tree one level deeper
        int chained = 0;
        BinaryOperator operator = BinaryOperator.fromToken(peek().type());
        while (operator != null && operator.leftPriority() > limit) {
            advance();
            enterLevel();
            chained++;
            Expression right = subexpression(operator.rightPriority());
            left = new BinaryExpression(span(start), operator, left, right);
            operator = BinaryOperator.fromToken(peek().type());
        }
        depth -= chained + 1;
        return left;
    }

    private Expression simpleExpression() {
        Token token = peek();
        return switch (token.type()) {
            case NUMBER, STRING -> {
                advance();
                yield new Literal(tokenLoc(token), token.value(), token.lexeme());
            }
            case NIL -> {
                advance();
                yield new Literal(tokenLoc(token), LuaValue.NIL, null);
            }
            case TRUE, FALSE -> {
                advance();
                yield new Literal(tokenLoc(token), LuaValue.of(token.type() == TokenType.TRUE), null);
            }
            case ELLIPSIS -> {
                if (!varargAllowed) {
                    throw new ExpectedTokenException("cannot use '...' outside a vararg function", token);
                }
                advance();
                yield new VarargExpression(tokenLoc(token));
            }
            case LBRACE -> tableConstructor();
            case FUNCTION -> functionBody(advance(), false);
            default -> suffixedExpression();
        };
    }

    private Expression primaryExpression() {
        Token token = peek();
        if (token.type() == TokenType.IDENTIFIER) {
            advance();
            return reference(token);
        }
        if (token.type() == TokenType.LPAREN) {
            advance();
            Expression inner = expression();
            consume(TokenType.RPAREN, "')' expected");
            return new ParenExpression(span(token), inner);
        }
        throw new UnexpectedTokenException(token, "expression");
    }

    private Expression suffixedExpression() {
        Token start = peek();
        Expression expression = primaryExpression();
        int suffixes = 0;
        while (true) {
            TokenType next = peek().type();
            if (next == TokenType.DOT || next == TokenType.LBRACKET || next == TokenType.COLON
                || next == TokenType.LPAREN || next == TokenType.STRING || next == TokenType.LBRACE) {
                enterLevel();
                suffixes++;
            }
            switch (next) {
                case DOT -> {
                    advance();
                    Token name = consume(TokenType.IDENTIFIER, "<name> expected");
                    Literal key = new Literal(tokenLoc(name), LuaValue.ofBytes(name.lexeme()), null);
                    expression = new IndexExpression(span(start), expression, key, true);
                }
                case LBRACKET -> {
                    advance();
                    Expression key = expression();
                    consume(TokenType.RBRACKET, "']' expected");
                    expression = new IndexExpression(span(start), expression, key, false);
                }
                case COLON -> {
                    advance();
                    String method = consume(TokenType.IDENTIFIER, "<name> expected").lexeme();
                    List<Expression> arguments = callArguments();
                    expression = new MethodCallExpression(span(start), expression, method, arguments);
                }
                case LPAREN, STRING, LBRACE -> {
                    List<Expression> arguments = callArguments();
                    expression = new CallExpression(span(start), expression, arguments);
                }
                default -> {
                    depth -= suffixes;
                    return expression;
                }
            }
        }
    }

    private List<Expression> callArguments() {
        Token token = peek();
        List<Expression> arguments = new ArrayList<>();
        if (token.type() == TokenType.STRING) {
            advance();
            arguments.add(new Literal(tokenLoc(token), token.value(), token.lexeme()));
            return arguments;
        }
        if (token.type() == TokenType.LBRACE) {
            arguments.add(tableConstructor());
            return arguments;
        }
        consume(TokenType.LPAREN, "function arguments expected");
        if (!check(TokenType.RPAREN)) {
            arguments = expressionList();
        }
        consume(TokenType.RPAREN, "')' expected");
        return arguments;
    }

    private Expression tableConstructor() {
        Token start = consume(TokenType.LBRACE, "'{' expected");
        List<TableField> fields = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            Token fieldStart = peek();
            if (match(TokenType.LBRACKET)) {
                Expression key = expression();
                consume(TokenType.RBRACKET, "']' expected");
                consume(TokenType.ASSIGN, "'=' expected");
                Expression value = expression();
                fields.add(new TableField(span(fieldStart), TableField.Kind.KEYED, key, value));
            } else if (check(TokenType.IDENTIFIER) && checkAhead(1, TokenType.ASSIGN)) {
                Token name = advance();
                advance();
                Literal key = new Literal(tokenLoc(name), LuaValue.ofBytes(name.lexeme()), null);
                Expression value = expression();
                fields.add(new TableField(span(fieldStart), TableField.Kind.NAMED, key, value));
            } else {
                Expression value = expression();
                fields.add(new TableField(span(fieldStart), TableField.Kind.POSITIONAL, null, value));
            }
            if (!match(TokenType.COMMA) && !match(TokenType.SEMICOLON)) {
                break;
            }
        }
        consume(TokenType.RBRACE, "'}' expected");
        return new TableConstructor(span(start), fields);
    }

    // ========================================================================
    // Names
    // ========================================================================

    private Identifier declare(Token name, Symbol.Kind kind, Scope target) {
        Symbol symbol = symbols.declare(name.lexeme(), kind, target);
        return new Identifier(tokenLoc(name), name.lexeme(), symbol);
    }

    private Identifier reference(Token name) {
        return new Identifier(tokenLoc(name), name.lexeme(), symbols.resolve(name.lexeme(), scope));
    }

    // ========================================================================
    // Immediately-invoked wrappers
    // ========================================================================

    private Chunk unwrapImmediateWrapper(Chunk chunk) {
        Block body = chunk.body();
        List<Statement> code = body.codeStatements();
        if (code.size() != 1 || !(code.get(0) instanceof ExpressionStatement wrapper)) {
            return chunk;
        }
        FunctionExpression function = wrappedFunction(wrapper.expression());
        if (function == null || !function.parameters().isEmpty() || function.vararg() || returnsValues(function.body())) {
            return chunk;
        }
        List<Statement> statements = new ArrayList<>();
        for (Statement statement : body.statements()) {
            if (statement == wrapper) {
                statements.addAll(function.body().statements());
            } else {
                statements.add(statement);
            }
        }
        warnings.add(Warning.at(Warning.Category.NOTE, SOURCE_NAME,
            "flattened immediately invoked wrapper function", wrapper.loc()));
        LOG.debug("Flattened wrapper at line {}", wrapper.loc().line());
        return chunk.withBody(new Block(body.loc(), statements, function.body().scope()));
    }

    private static FunctionExpression wrappedFunction(Expression expression) {
        if (!(expression instanceof CallExpression call)) {
            return null;
        }
        Expression callee = call.callee();
        // (function() ... end)()
        if (call.arguments().isEmpty() && callee instanceof ParenExpression paren
            && paren.expression() instanceof FunctionExpression function) {
            return function;
        }
        // coroutine.wrap(function() ... end)()
        if (call.arguments().isEmpty() && callee instanceof CallExpression inner
            && isGlobalField(inner.callee(), "coroutine", "wrap")
            && inner.arguments().size() == 1 && inner.arguments().get(0) instanceof FunctionExpression function) {
            return function;
        }
        // task.spawn(function() ... end), task.defer(...), spawn(...)
        boolean scheduler = isGlobalField(callee, "task", "spawn") || isGlobalField(callee, "task", "defer")
            || (callee instanceof Identifier identifier && identifier.isGlobal("spawn"));
        if (scheduler && call.arguments().size() == 1 && call.arguments().get(0) instanceof FunctionExpression function) {
            return function;
        }
        return null;
    }

    private static boolean isGlobalField(Expression expression, String global, String field) {
        return expression instanceof IndexExpression index
            && index.object() instanceof Identifier identifier
            && identifier.isGlobal(global)
            && field.equals(index.fieldName());
    }

    // True if a return with values appears at this function's level
    private static boolean returnsValues(Block body) {
        boolean[] found = {false};
        new AstWalker() {
            @Override
            protected boolean enter(Node node) {
                if (node instanceof ReturnStatement ret && !ret.values().isEmpty()) {
                    found[0] = true;
                }
                return !found[0] && !(node instanceof FunctionExpression);
            }
        }.walk(body);
        return found[0];
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private void repair(String message, SourceLocation loc) {
        LOG.warn("Repaired source: {} (line {})", message, loc.line());
        warnings.add(Warning.at(Warning.Category.REPAIR, SOURCE_NAME, message, loc));
    }

    private void enterLevel() {
        if (++depth > MAX_DEPTH) {
            Token token = peek();
            throw new ParseException("chunk has too many syntax levels", token.line(), token.column(), token.position());
        }
    }

    private SourceLocation tokenLoc(Token token) {
        return SourceLocation.of(token.line(), token.column(), token.line(), token.column() + token.lexeme().length());
    }

    private SourceLocation span(Token start) {
        Token end = current > 0 ? previous() : start;
        return SourceLocation.of(start.line(), start.column(), end.line(), end.column() + end.lexeme().length());
    }

    private SourceLocation spanFrom(int startIndex) {
        if (current > startIndex) {
            return span(tokens.get(startIndex));
        }
        Token token = peek();
        return SourceLocation.of(token.line(), token.column(), token.line(), token.column());
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkAhead(int offset, TokenType type) {
        int pos = current + offset;
        if (pos >= tokens.size()) return false;
        return tokens.get(pos).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return current >= tokens.size() - 1;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw new ExpectedTokenException(message, peek());
    }
}
