package com.oxlang.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.oxlang.script.ParseError;
import com.oxlang.script.parser.Expr.ArrayLiteral;
import com.oxlang.script.parser.Expr.Binary;
import com.oxlang.script.parser.Expr.Call;
import com.oxlang.script.parser.Expr.GetExpr;
import com.oxlang.script.parser.Expr.IndexExpr;
import com.oxlang.script.parser.Expr.Literal;
import com.oxlang.script.parser.Expr.Logical;
import com.oxlang.script.parser.Expr.MethodCallExpr;
import com.oxlang.script.parser.Expr.Unary;
import com.oxlang.script.parser.Expr.Variable;
import com.oxlang.script.parser.Statement.AssignStmt;
import com.oxlang.script.parser.Statement.Block;
import com.oxlang.script.parser.Statement.ExprStmt;
import com.oxlang.script.parser.Statement.FunctionStmt;
import com.oxlang.script.parser.Statement.Stmt;

/**
 * Recursive-descent parser producing the statement list of one source unit.
 *
 * Statements need no terminator; ';' is accepted as a separator. The first
 * malformed construct throws {@link ParseError}; there is no recovery.
 */
public class Parser {
    private static final int MAX_PARAMS = 64;

    private final List<Token> tokens;
    private int current = 0;
    private int loopDepth = 0;
    private int functionDepth = 0;

    public Parser(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty() || tokens.get(tokens.size() - 1).type != TokenType.EOF) {
            throw new IllegalArgumentException("token list must end with EOF");
        }
        this.tokens = tokens;
    }

    public static List<Stmt> parse(String source) {
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!isAtEnd()) {
            if (match(TokenType.SEMICOLON)) continue;
            statements.add(declaration());
        }
        return statements;
    }

    private Stmt declaration() {
        if (match(TokenType.FUNC)) return functionDeclaration();
        if (match(TokenType.STRUCT)) return structDeclaration();
        if (match(TokenType.IMPORT)) return importDeclaration();
        return statement();
    }

    // func name(p) {}  |  func Struct.name(p) {}  |  func Struct:name(self, p) {}
    private Stmt functionDeclaration() {
        Token first = consume(TokenType.IDENTIFIER, "Expect function name.");
        Token owner = null;
        Token name = first;
        FunctionStmt.Kind kind = FunctionStmt.Kind.PLAIN;

        if (match(TokenType.DOT)) {
            owner = first;
            name = consume(TokenType.IDENTIFIER, "Expect static method name after '.'.");
            kind = FunctionStmt.Kind.STATIC;
        } else if (match(TokenType.COLON)) {
            owner = first;
            name = consume(TokenType.IDENTIFIER, "Expect instance method name after ':'.");
            kind = FunctionStmt.Kind.INSTANCE;
        }

        consume(TokenType.LEFT_PAREN, "Expect '(' after function name.");
        List<Token> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (params.size() >= MAX_PARAMS) {
                    throw error(peek(), "Too many parameters (max " + MAX_PARAMS + ").");
                }
                params.add(consume(TokenType.IDENTIFIER, "Expect parameter name."));
            } while (match(TokenType.COMMA));
        }
        Token close = consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");

        if (kind == FunctionStmt.Kind.INSTANCE && params.isEmpty()) {
            throw error(close, "Instance method " + owner.lexeme + ":" + name.lexeme
                    + " needs a receiver parameter.");
        }

        consume(TokenType.LEFT_BRACE, "Expect '{' before function body.");

        int enclosingLoops = loopDepth;
        loopDepth = 0;
        functionDepth++;
        try {
            List<Stmt> body = block();
            return new FunctionStmt(name, owner, kind, params, body);
        } finally {
            functionDepth--;
            loopDepth = enclosingLoops;
        }
    }

    // struct Name { a, b }  |  struct Name inherits Parent { a, b }
    private Stmt structDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect struct name.");
        Token parent = null;
        if (match(TokenType.INHERITS)) {
            parent = consume(TokenType.IDENTIFIER, "Expect parent struct name after 'inherits'.");
        }
        consume(TokenType.LEFT_BRACE, "Expect '{' after struct name.");

        List<Token> fields = new ArrayList<>();
        if (!check(TokenType.RIGHT_BRACE)) {
            do {
                Token field = consume(TokenType.IDENTIFIER, "Expect field name.");
                for (Token f : fields) {
                    if (f.lexeme.equals(field.lexeme)) {
                        throw error(field, "Duplicate field '" + field.lexeme + "' in struct " + name.lexeme + ".");
                    }
                }
                fields.add(field);
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after struct fields.");
        return new Statement.StructStmt(name, parent, fields);
    }

    // import name  |  import a.b.c
    private Stmt importDeclaration() {
        Token keyword = previous();
        StringBuilder module = new StringBuilder(consume(TokenType.IDENTIFIER, "Expect module name after 'import'.").lexeme);
        while (match(TokenType.DOT)) {
            module.append('.').append(consume(TokenType.IDENTIFIER, "Expect module name part after '.'.").lexeme);
        }
        return new Statement.ImportStmt(keyword, module.toString());
    }

    private Stmt statement() {
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.BREAK)) return breakStatement();
        if (match(TokenType.CONTINUE)) return continueStatement();
        if (match(TokenType.LEFT_BRACE)) return new Block(block());
        return simpleStatement();
    }

    private Stmt ifStatement() {
        Token keyword = previous();
        Expr.ExprInterface condition = expression();
        Block thenBranch = blockStatement("if condition");
        Stmt elseBranch = null;
        if (match(TokenType.ELSE)) {
            if (match(TokenType.IF)) {
                elseBranch = ifStatement();
            } else {
                elseBranch = blockStatement("'else'");
            }
        }
        return new Statement.If(keyword, condition, thenBranch, elseBranch);
    }

    private Stmt whileStatement() {
        Token keyword = previous();
        Expr.ExprInterface condition = expression();
        return new Statement.While(keyword, condition, loopBody("while condition"));
    }

    // for x in expr { }  |  for i = 0, i < n, i += 1 { }
    private Stmt forStatement() {
        Token keyword = previous();

        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.IN)) {
            Token variable = advance();
            advance(); // 'in'
            Expr.ExprInterface iterable = expression();
            return new Statement.ForIn(keyword, variable, iterable, loopBody("for-in expression"));
        }

        AssignStmt initializer = assignment("Expect loop variable assignment after 'for'.");
        consume(TokenType.COMMA, "Expect ',' after for initializer.");
        Expr.ExprInterface condition = expression();
        consume(TokenType.COMMA, "Expect ',' after for condition.");
        AssignStmt increment = assignment("Expect update assignment in for header.");
        return new Statement.For(keyword, initializer, condition, increment, loopBody("for header"));
    }

    private Block loopBody(String after) {
        loopDepth++;
        try {
            return blockStatement(after);
        } finally {
            loopDepth--;
        }
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        if (functionDepth <= 0) {
            throw error(keyword, "'return' used outside of a function.");
        }
        Expr.ExprInterface value = null;
        if (!check(TokenType.RIGHT_BRACE) && !check(TokenType.SEMICOLON) && !isAtEnd()) {
            value = expression();
        }
        return new Statement.ReturnStmt(keyword, value);
    }

    private Stmt breakStatement() {
        Token keyword = previous();
        if (loopDepth <= 0) {
            throw error(keyword, "'break' used outside of a loop.");
        }
        return new Statement.BreakStmt(keyword);
    }

    private Stmt continueStatement() {
        Token keyword = previous();
        if (loopDepth <= 0) {
            throw error(keyword, "'continue' used outside of a loop.");
        }
        return new Statement.ContinueStmt(keyword);
    }

    private Block blockStatement(String after) {
        consume(TokenType.LEFT_BRACE, "Expect '{' after " + after + ".");
        return new Block(block());
    }

    private List<Stmt> block() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            if (match(TokenType.SEMICOLON)) continue;
            statements.add(declaration());
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after block.");
        return statements;
    }

    /** Assignment when an assignment operator follows the expression, otherwise an expression statement. */
    private Stmt simpleStatement() {
        Expr.ExprInterface expr = expression();
        if (checkAssignOperator()) {
            return finishAssignment(expr);
        }
        return new ExprStmt(expr);
    }

    private AssignStmt assignment(String message) {
        Expr.ExprInterface target = expression();
        if (!checkAssignOperator()) throw error(peek(), message);
        return finishAssignment(target);
    }

    private AssignStmt finishAssignment(Expr.ExprInterface target) {
        Token operator = advance();
        if (!(target instanceof Variable) && !(target instanceof GetExpr) && !(target instanceof IndexExpr)) {
            throw error(operator, "Invalid assignment target.");
        }
        Expr.ExprInterface value = expression();
        return new AssignStmt(target, operator, value);
    }

    private boolean checkAssignOperator() {
        return check(TokenType.EQUAL) || check(TokenType.PLUS_EQUAL) || check(TokenType.MINUS_EQUAL)
                || check(TokenType.STAR_EQUAL) || check(TokenType.SLASH_EQUAL) || check(TokenType.CARET_EQUAL);
    }

    // -------------------------
    // Expressions, lowest precedence first
    // -------------------------

    private Expr.ExprInterface expression() { return or(); }

    private Expr.ExprInterface or() {
        Expr.ExprInterface expr = and();
        while (match(TokenType.OR_OR)) {
            Token op = previous();
            Expr.ExprInterface right = and();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface and() {
        Expr.ExprInterface expr = comparison();
        while (match(TokenType.AND_AND)) {
            Token op = previous();
            Expr.ExprInterface right = comparison();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = term();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL,
                TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = term();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = exponent();
        while (match(TokenType.STAR, TokenType.SLASH)) {
            Token op = previous();
            Expr.ExprInterface right = exponent();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    // right-associative: 2 ^ 3 ^ 2 == 2 ^ 9
    private Expr.ExprInterface exponent() {
        Expr.ExprInterface expr = unary();
        if (match(TokenType.CARET)) {
            Token op = previous();
            Expr.ExprInterface right = exponent();
            return new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.BANG, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            return new Unary(op, right);
        }
        return call();
    }

    private Expr.ExprInterface call() {
        Expr.ExprInterface expr = primary();

        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                expr = finishCall(expr);
            } else if (match(TokenType.LEFT_BRACKET)) {
                Token bracket = previous();
                Expr.ExprInterface index = expression();
                consume(TokenType.RIGHT_BRACKET, "Expect ']' after index.");
                expr = new IndexExpr(expr, index, bracket);
            } else if (match(TokenType.DOT)) {
                Token name = consume(TokenType.IDENTIFIER, "Expect field or method name after '.'.");
                expr = new GetExpr(expr, name);
            } else if (match(TokenType.COLON)) {
                Token method = consume(TokenType.IDENTIFIER, "Expect method name after ':'.");
                consume(TokenType.LEFT_PAREN, "Expect '(' after method name.");
                expr = new MethodCallExpr(expr, method, arguments());
            } else {
                break;
            }
        }

        return expr;
    }

    private Expr.ExprInterface finishCall(Expr.ExprInterface callee) {
        Token paren = previous();
        return new Call(callee, paren, arguments());
    }

    /** Argument list after '(' up to and including ')'. */
    private List<Expr.ExprInterface> arguments() {
        List<Expr.ExprInterface> args = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                args.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return args;
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Boolean.FALSE, previous());
        if (match(TokenType.TRUE)) return new Literal(Boolean.TRUE, previous());
        if (match(TokenType.NIL)) return new Literal(null, previous());
        if (match(TokenType.NUMBER, TokenType.STRING)) return new Literal(previous().literal, previous());
        if (match(TokenType.IDENTIFIER)) return new Variable(previous());

        if (match(TokenType.LEFT_PAREN)) {
            Expr.ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        if (match(TokenType.LEFT_BRACKET)) {
            Token bracket = previous();
            List<Expr.ExprInterface> items = new ArrayList<Expr.ExprInterface>();
            if (!check(TokenType.RIGHT_BRACKET)) {
                do {
                    items.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after array literal.");
            return new ArrayLiteral(bracket, items);
        }

        throw error(peek(), "Expect expression.");
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

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ParseError error(Token token, String message) {
        return new ParseError(token, message);
    }
}
